package technology.pagegrid.pdf;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import technology.pagegrid.ExtractionFailureException;
import technology.pagegrid.PageBlock;
import technology.pagegrid.PageSource;
import technology.pagegrid.Rectangle;
import technology.pagegrid.TableSettings;
import technology.pagegrid.TextElement;
import technology.pagegrid.detectors.TextBlockBuilder;

/**
 * 基于 PDFBox 的 {@link PageSource}。
 *
 * <p>
 * 字符由 {@link TextStripper} 提取，矢量路径与图像由 {@link ObjectExtractorStreamEngine} 收集，
 * 文本块由字符按行分段得到，图像作为 IMAGE 块加入。页码从 0 开始，坐标原点在页面左上角。
 * </p>
 *
 * PDDocument 不是线程安全的，所有读取方法都是同步的；最近一次读取的页面内容会被缓存。
 */
public class PdfPageSource implements PageSource, Closeable {

    private static final Logger logger = LoggerFactory.getLogger(PdfPageSource.class);

    private final PDDocument document;
    private final boolean ownsDocument;
    private final TextBlockBuilder blockBuilder;

    private int cachedIndex = -1;
    private PageContent cached;

    /**
     * 包装一个已打开的文档，{@link #close()} 不会关闭它。
     */
    public PdfPageSource(PDDocument document, TableSettings settings) {
        this(document, settings, false);
    }

    private PdfPageSource(PDDocument document, TableSettings settings, boolean ownsDocument) {
        this.document = document;
        this.ownsDocument = ownsDocument;
        this.blockBuilder = new TextBlockBuilder(settings.getTextXTolerance(), settings.getTextYTolerance());
    }

    /**
     * 打开 PDF 文件，{@link #close()} 时关闭文档。
     *
     * @throws IOException 文件无法读取或不是有效的 PDF
     */
    public static PdfPageSource open(File file, TableSettings settings) throws IOException {
        return new PdfPageSource(PDDocument.load(file), settings, true);
    }

    @Override
    public synchronized int getPageCount() {
        return document.getNumberOfPages();
    }

    @Override
    public synchronized float getPageWidth(int pageIndex) throws ExtractionFailureException {
        return pageSize(page(pageIndex))[0];
    }

    @Override
    public synchronized float getPageHeight(int pageIndex) throws ExtractionFailureException {
        return pageSize(page(pageIndex))[1];
    }

    @Override
    public synchronized List<TextElement> getCharacters(int pageIndex) throws ExtractionFailureException {
        return content(pageIndex).characters;
    }

    @Override
    public synchronized List<Rectangle> getVectorPaths(int pageIndex) throws ExtractionFailureException {
        return content(pageIndex).paths;
    }

    @Override
    public synchronized List<PageBlock> getTextBlocks(int pageIndex) throws ExtractionFailureException {
        PageContent content = content(pageIndex);
        List<PageBlock> blocks = new ArrayList<>(blockBuilder.build(content.characters));
        for (Rectangle image : content.images) {
            blocks.add(PageBlock.image(image));
        }
        return blocks;
    }

    @Override
    public void close() throws IOException {
        if (ownsDocument) {
            document.close();
        }
    }

    private PDPage page(int pageIndex) throws ExtractionFailureException {
        if (pageIndex < 0 || pageIndex >= document.getNumberOfPages()) {
            throw new ExtractionFailureException("Page index " + pageIndex + " out of range");
        }
        return document.getPage(pageIndex);
    }

    /**
     * 考虑旋转后的 [宽, 高]。
     */
    private static float[] pageSize(PDPage page) {
        PDRectangle cropBox = page.getCropBox();
        int rotation = Math.abs(page.getRotation());
        if (rotation == 90 || rotation == 270) {
            return new float[] { cropBox.getHeight(), cropBox.getWidth() };
        }
        return new float[] { cropBox.getWidth(), cropBox.getHeight() };
    }

    private PageContent content(int pageIndex) throws ExtractionFailureException {
        if (pageIndex == cachedIndex) {
            return cached;
        }
        PDPage page = page(pageIndex);
        float offset = 0;
        for (int i = 0; i < pageIndex; i++) {
            offset += pageSize(document.getPage(i))[1];
        }

        try {
            TextStripper stripper = new TextStripper(document, pageIndex, offset);
            stripper.process();

            ObjectExtractorStreamEngine engine = new ObjectExtractorStreamEngine(page);
            engine.processPage(page);

            cached = new PageContent(stripper.getTextElements(), engine.getPaths(), engine.getImages());
            cachedIndex = pageIndex;
            logger.debug("Page {}: {} characters, {} paths, {} images", pageIndex, cached.characters.size(),
                    cached.paths.size(), cached.images.size());
            return cached;
        } catch (IOException e) {
            throw new ExtractionFailureException("Unable to read page " + pageIndex, e);
        }
    }

    private static final class PageContent {
        final List<TextElement> characters;
        final List<Rectangle> paths;
        final List<Rectangle> images;

        PageContent(List<TextElement> characters, List<Rectangle> paths, List<Rectangle> images) {
            this.characters = Collections.unmodifiableList(characters);
            this.paths = Collections.unmodifiableList(paths);
            this.images = Collections.unmodifiableList(images);
        }
    }

}
