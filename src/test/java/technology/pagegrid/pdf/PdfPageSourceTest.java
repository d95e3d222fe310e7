package technology.pagegrid.pdf;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import technology.pagegrid.ExtractionFailureException;
import technology.pagegrid.PageBlock;
import technology.pagegrid.PageProcessor;
import technology.pagegrid.PageResult;
import technology.pagegrid.Rectangle;
import technology.pagegrid.TableSettings;
import technology.pagegrid.TextElement;

public class PdfPageSourceTest {

    private static final float PAGE_SIZE = 200;

    private PDDocument document;

    @BeforeEach
    public void setUp() throws IOException {
        document = PDDocument.load(samplePdf());
    }

    @AfterEach
    public void tearDown() throws IOException {
        document.close();
    }

    /**
     * 一页 200 × 200：左上角 (10, 10) 起的 3 × 3 带线表格（格子 40 × 20，内容 a 到 i），
     * 表格下方一行文字 "Hello" 和一张 20 × 20 的图片。
     */
    private static byte[] samplePdf() throws IOException {
        try (PDDocument doc = new PDDocument()) {
            PDPage page = new PDPage(new PDRectangle(PAGE_SIZE, PAGE_SIZE));
            doc.addPage(page);

            BufferedImage pixels = new BufferedImage(2, 2, BufferedImage.TYPE_INT_RGB);
            PDImageXObject image = LosslessFactory.createFromImage(doc, pixels);

            try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
                cs.setLineWidth(0.5f);
                for (int j = 0; j <= 3; j++) {
                    cs.moveTo(10 + j * 40, PAGE_SIZE - 10);
                    cs.lineTo(10 + j * 40, PAGE_SIZE - 70);
                    cs.stroke();
                }
                for (int i = 0; i <= 3; i++) {
                    cs.moveTo(10, PAGE_SIZE - 10 - i * 20);
                    cs.lineTo(130, PAGE_SIZE - 10 - i * 20);
                    cs.stroke();
                }

                for (int i = 0; i < 3; i++) {
                    for (int j = 0; j < 3; j++) {
                        cs.beginText();
                        cs.setFont(PDType1Font.HELVETICA, 10);
                        cs.newLineAtOffset(25 + j * 40, PAGE_SIZE - 24 - i * 20);
                        cs.showText(String.valueOf((char) ('a' + i * 3 + j)));
                        cs.endText();
                    }
                }

                cs.beginText();
                cs.setFont(PDType1Font.HELVETICA, 12);
                cs.newLineAtOffset(20, PAGE_SIZE - 120);
                cs.showText("Hello");
                cs.endText();

                cs.drawImage(image, 150, 20, 20, 20);
            }

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            doc.save(out);
            return out.toByteArray();
        }
    }

    @Test
    public void testPageGeometry() throws Exception {
        PdfPageSource source = new PdfPageSource(document, TableSettings.defaults());

        assertEquals(1, source.getPageCount());
        assertEquals(PAGE_SIZE, source.getPageWidth(0), 1e-3);
        assertEquals(PAGE_SIZE, source.getPageHeight(0), 1e-3);
    }

    @Test
    public void testCharacters() throws Exception {
        PdfPageSource source = new PdfPageSource(document, TableSettings.defaults());

        List<TextElement> chars = source.getCharacters(0);

        assertEquals(14, chars.size());
        TextElement h = null;
        for (TextElement te : chars) {
            if ("H".equals(te.getText())) {
                h = te;
            }
        }
        assertEquals(20f, h.getLeft(), 0.5);
        assertEquals(120f, h.getBottom(), 0.5);
        assertTrue(h.getHeight() > 0);
        assertTrue(h.getFontName().contains("Helvetica"));
        assertTrue(h.isUpright());
        assertEquals(0, h.getPageIndex());
    }

    @Test
    public void testVectorPaths() throws Exception {
        PdfPageSource source = new PdfPageSource(document, TableSettings.defaults());

        List<Rectangle> paths = source.getVectorPaths(0);

        assertEquals(8, paths.size());
        int vertical = 0;
        for (Rectangle r : paths) {
            if (r.getWidth() == 0) {
                vertical++;
                assertEquals(10f, r.getTop(), 1e-3);
                assertEquals(70f, r.getBottom(), 1e-3);
            } else {
                assertEquals(0f, (float) r.getHeight(), 1e-3);
                assertEquals(10f, r.getLeft(), 1e-3);
                assertEquals(130f, r.getRight(), 1e-3);
            }
        }
        assertEquals(4, vertical);
    }

    @Test
    public void testTextAndImageBlocks() throws Exception {
        PdfPageSource source = new PdfPageSource(document, TableSettings.defaults());

        List<PageBlock> blocks = source.getTextBlocks(0);

        PageBlock hello = null;
        PageBlock image = null;
        for (PageBlock b : blocks) {
            if ("Hello".equals(b.getText())) {
                hello = b;
            }
            if (b.getType() == PageBlock.BlockType.IMAGE) {
                image = b;
            }
        }
        assertEquals(5, hello.getCharCount());
        assertEquals(12f, hello.getFontSize(), 1e-3);
        assertEquals(150f, image.getLeft(), 1e-3);
        assertEquals(160f, image.getTop(), 1e-3);
        assertEquals(20f, (float) image.getWidth(), 1e-3);
        assertEquals(20f, (float) image.getHeight(), 1e-3);
    }

    @Test
    public void testPageIndexOutOfRange() {
        PdfPageSource source = new PdfPageSource(document, TableSettings.defaults());
        assertThrows(ExtractionFailureException.class, () -> source.getCharacters(1));
    }

    @Test
    public void testRuledTableFromPdf() throws Exception {
        try (PageProcessor processor = new PageProcessor(new PdfPageSource(document, TableSettings.defaults()),
                TableSettings.defaults())) {
            PageResult result = processor.process(0);

            assertFalse(result.isFailed());
            assertEquals(1, result.getTables().size());
            assertEquals("|a|b|c|\n|---|---|---|\n|d|e|f|\n|g|h|i|\n", result.getMarkdown().get(0));
        }
    }

    @Test
    public void testOpenAndCloseFile(@TempDir Path dir) throws Exception {
        File file = dir.resolve("sample.pdf").toFile();
        document.save(file);

        try (PdfPageSource source = PdfPageSource.open(file, TableSettings.defaults())) {
            assertEquals(1, source.getPageCount());
            assertEquals(8, source.getVectorPaths(0).size());
        }
    }

    @Test
    public void testOpenRejectsNonPdf(@TempDir Path dir) throws Exception {
        File file = dir.resolve("broken.pdf").toFile();
        Files.write(file.toPath(), "not a pdf".getBytes(StandardCharsets.UTF_8));

        assertThrows(IOException.class, () -> PdfPageSource.open(file, TableSettings.defaults()));
    }

}
