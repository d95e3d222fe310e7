package technology.pagegrid.extractors;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import technology.pagegrid.Cell;
import technology.pagegrid.CellTextSource;
import technology.pagegrid.Edge;
import technology.pagegrid.Intersection;
import technology.pagegrid.Page;
import technology.pagegrid.ResourceExhaustionException;
import technology.pagegrid.Table;
import technology.pagegrid.TableSettings;
import technology.pagegrid.TextChunk;

/**
 * 基于网格线推断表格的算法实现。
 *
 * 主要流程：
 * - 字符拼接为单词
 * - 按每个方向各自的策略生成候选表格线（lines：矢量路径；text：单词对齐）
 * - snap / join / filter 清理表格线
 * - 计算交点，由交点构造单元格
 * - 按共享角点把单元格组装成表格，填充单元格文本并识别表头
 *
 * 没有矢量路径的页面上 lines 策略回退到 text 策略。所有单元格文本都为空的表格被丢弃。
 */
public class TableFinder implements ExtractionAlgorithm {

    private static final Logger logger = LoggerFactory.getLogger(TableFinder.class);

    private final TableSettings settings;

    public TableFinder() {
        this(TableSettings.defaults());
    }

    public TableFinder(TableSettings settings) {
        this.settings = settings;
    }

    @Override
    public List<Table> extract(Page page) {
        return extract(page, page);
    }

    /**
     * @param textSource 单元格文本来源
     * @return 按 (top, left) 排序的表格
     * @throws ResourceExhaustionException 表格线或交点数量超过上限，或者当前线程被中断（页面处理超时）
     */
    public List<Table> extract(Page page, CellTextSource textSource) {
        List<TextChunk> words = getWords(page);
        checkInterrupted();

        List<Edge> edges = getEdges(page, words);
        logger.debug("Page {}: {} words, {} edges", page.getPageNumber(), words.size(), edges.size());
        checkInterrupted();

        List<Intersection> intersections = IntersectionFinder.findIntersections(edges,
                settings.getIntersectionXTolerance(), settings.getIntersectionYTolerance(),
                settings.getMaxIntersections());
        checkInterrupted();

        List<Cell> cells = CellBuilder.findCells(intersections);
        logger.debug("Page {}: {} intersections, {} cells", page.getPageNumber(), intersections.size(),
                cells.size());
        checkInterrupted();

        List<Table> tables = new ArrayList<>();
        for (Table table : TableAssembler.assemble(cells, toString())) {
            boolean hasText = false;
            for (Cell c : table.getCells()) {
                c.setText(textSource.getTextUnderRect(c));
                hasText |= !c.getText().trim().isEmpty();
            }
            if (!hasText) {
                continue;
            }
            table.setPageNumber(page.getPageNumber());
            table.setHeader(HeaderDetector.detect(table, page, words, settings.getTextYTolerance()));
            tables.add(table);
        }
        logger.debug("Page {}: {} tables", page.getPageNumber(), tables.size());
        return tables;
    }

    public List<TextChunk> getWords(Page page) {
        WordAssembler assembler = new WordAssembler(settings.getTextXTolerance(), settings.getTextYTolerance(),
                settings.isExpandLigatures());
        return assembler.assemble(page.getText());
    }

    /**
     * 候选表格线经 snap / join / filter 之后的结果。
     *
     * @throws ResourceExhaustionException 清理前的表格线数量超过 {@code max_edges}
     */
    public List<Edge> getEdges(Page page, List<TextChunk> words) {
        List<Edge> raw = new ArrayList<>();
        raw.addAll(candidateEdges(page, words, Edge.Orientation.VERTICAL, settings.getVerticalStrategy()));
        raw.addAll(candidateEdges(page, words, Edge.Orientation.HORIZONTAL, settings.getHorizontalStrategy()));
        if (raw.size() > settings.getMaxEdges()) {
            throw new ResourceExhaustionException(
                    "Edge count " + raw.size() + " exceeds limit of " + settings.getMaxEdges());
        }
        return EdgeProcessor.merge(raw, settings.getSnapXTolerance(), settings.getSnapYTolerance(),
                settings.getJoinXTolerance(), settings.getJoinYTolerance(), settings.getEdgeMinLength());
    }

    private List<Edge> candidateEdges(Page page, List<TextChunk> words, Edge.Orientation orientation,
            TableSettings.Strategy strategy) {
        if (strategy == TableSettings.Strategy.LINES && !page.getVectorPaths().isEmpty()) {
            return EdgeSynthesizer.pathsToEdges(page.getVectorPaths(), orientation);
        }
        if (orientation == Edge.Orientation.VERTICAL) {
            return EdgeSynthesizer.wordsToEdgesV(words, settings.getMinWordsVertical());
        }
        return EdgeSynthesizer.wordsToEdgesH(words, settings.getMinWordsHorizontal());
    }

    private static void checkInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new ResourceExhaustionException("Page processing interrupted");
        }
    }

    @Override
    public String toString() {
        return settings.getVerticalStrategy() + "/" + settings.getHorizontalStrategy();
    }

}
