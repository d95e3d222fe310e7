package technology.pagegrid.extractors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import technology.pagegrid.Cell;
import technology.pagegrid.Page;
import technology.pagegrid.Rectangle;
import technology.pagegrid.Row;
import technology.pagegrid.Table;
import technology.pagegrid.TableHeader;
import technology.pagegrid.TextChunk;
import technology.pagegrid.TextElement;
import technology.pagegrid.Utils;

/**
 * 表头识别。
 *
 * <p>
 * 默认以第一行为表头。第一行是粗体而第二行不是时，直接采用第一行。否则在表格上方寻找紧邻的文本行：
 * 这些文本不跨越任何内部列边界时，它们构成外部表头（external），
 * 前提是第一行不是粗体，或者上方文本本身也是粗体。
 * </p>
 *
 * 列名取表头单元格文本去掉首尾空白，空列名替换为 {@code Col<N>}（N 从 1 开始）。
 */
public final class HeaderDetector {

    /**
     * 相邻表头行之间允许的最大行距（相对行高）。
     */
    static final float LINE_SPACING_FACTOR = 1.5f;

    private HeaderDetector() {
    }

    public static TableHeader firstRowHeader(Table table) {
        List<Row> rows = table.getRows();
        if (rows.isEmpty()) {
            return new TableHeader(new Rectangle(), Collections.<Cell>emptyList(),
                    Collections.<String>emptyList(), false);
        }
        Row first = rows.get(0);
        return new TableHeader(first, first.getCells(), namesOf(first.getCells()), false);
    }

    /**
     * @param words      页面上的单词
     * @param yTolerance 上方文本行按 top 聚类的容差
     */
    public static TableHeader detect(Table table, Page page, List<TextChunk> words, float yTolerance) {
        List<Row> rows = table.getRows();
        if (rows.isEmpty()) {
            return firstRowHeader(table);
        }
        boolean firstRowBold = isBold(rows.get(0), page);
        if (firstRowBold && (rows.size() < 2 || !isBold(rows.get(1), page))) {
            return firstRowHeader(table);
        }

        List<TextChunk> headerWords = wordsAbove(table, words, yTolerance);
        if (headerWords.isEmpty() || crossesColumnBoundary(headerWords, rows.get(0))) {
            return firstRowHeader(table);
        }
        if (firstRowBold && !containsBold(headerWords)) {
            return firstRowHeader(table);
        }

        float top = Rectangle.boundingBoxOf(headerWords).getTop();
        float height = table.getTop() - top;
        List<Cell> cells = new ArrayList<>();
        for (Cell c : rows.get(0).getCells()) {
            Cell hc = new Cell(top, c.getLeft(), (float) c.getWidth(), height);
            hc.setText(page.getTextUnderRect(hc));
            cells.add(hc);
        }
        Rectangle bbox = new Rectangle(top, table.getLeft(), (float) table.getWidth(), height);
        return new TableHeader(bbox, cells, namesOf(cells), true);
    }

    static List<String> namesOf(List<Cell> cells) {
        List<String> names = new ArrayList<>(cells.size());
        for (int i = 0; i < cells.size(); i++) {
            String name = cells.get(i).getText().trim();
            names.add(name.isEmpty() ? "Col" + (i + 1) : name);
        }
        return names;
    }

    /**
     * 紧邻表格上方的文本行中的单词：从最近的一行开始向上，行距超过行高的 1.5 倍时停止。
     */
    static List<TextChunk> wordsAbove(Table table, List<TextChunk> words, float yTolerance) {
        List<TextChunk> above = new ArrayList<>();
        for (TextChunk w : words) {
            if (w.getBottom() <= table.getTop() && w.horizontallyOverlaps(table)) {
                above.add(w);
            }
        }
        if (above.isEmpty()) {
            return above;
        }

        List<List<TextChunk>> lines = Utils.clusterObjects(above, new Utils.KeyFunction<TextChunk>() {
            @Override
            public float apply(TextChunk t) {
                return t.getTop();
            }
        }, yTolerance);

        List<TextChunk> rv = new ArrayList<>();
        float lastY = table.getTop();
        for (int i = lines.size() - 1; i >= 0; i--) {
            Rectangle line = Rectangle.boundingBoxOf(lines.get(i));
            float lineHeight = (float) line.getHeight();
            if (lastY - line.getTop() > LINE_SPACING_FACTOR * lineHeight) {
                break;
            }
            rv.addAll(lines.get(i));
            lastY = line.getTop();
        }
        return rv;
    }

    private static boolean crossesColumnBoundary(List<TextChunk> words, Row firstRow) {
        List<Cell> cells = firstRow.getCells();
        for (int i = 0; i < cells.size() - 1; i++) {
            float boundary = cells.get(i).getRight();
            for (TextChunk w : words) {
                if (w.getLeft() < boundary && w.getRight() > boundary) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean isBold(Row row, Page page) {
        for (Cell c : row.getCells()) {
            for (TextElement te : page.getTextElementsUnder(c)) {
                if (isBold(te)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean containsBold(List<TextChunk> words) {
        for (TextChunk w : words) {
            for (TextElement te : w.getTextElements()) {
                if (isBold(te)) {
                    return true;
                }
            }
        }
        return false;
    }

    static boolean isBold(TextElement te) {
        return te.getFontName() != null && te.getFontName().toLowerCase(Locale.ROOT).contains("bold");
    }

}
