package technology.pagegrid.extractors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import technology.pagegrid.Cell;
import technology.pagegrid.Edge;
import technology.pagegrid.Fixtures;
import technology.pagegrid.Page;
import technology.pagegrid.Rectangle;
import technology.pagegrid.ResourceExhaustionException;
import technology.pagegrid.Table;
import technology.pagegrid.TableSettings;
import technology.pagegrid.TextElement;
import technology.pagegrid.writers.MarkdownWriter;

public class TableFinderTest {

    private static TableSettings settings(String vertical, String horizontal) {
        Map<String, Object> values = new HashMap<>();
        values.put("vertical_strategy", vertical);
        values.put("horizontal_strategy", horizontal);
        return TableSettings.fromMap(values);
    }

    private static List<Rectangle> gridRules(int rows, int cols, float size) {
        List<Rectangle> rules = new ArrayList<>(Fixtures.verticalRules(rows, cols, size));
        rules.addAll(Fixtures.horizontalRules(rows, cols, size));
        return rules;
    }

    @Test
    public void testRuledVerticalsWithTextRows() {
        TableFinder finder = new TableFinder(settings("lines", "text"));
        Page page = Fixtures.page(100, 100, Fixtures.gridText(3, 3, 10), Fixtures.verticalRules(3, 3, 10));

        List<Table> tables = finder.extract(page);

        assertEquals(1, tables.size());
        Table table = tables.get(0);
        assertEquals(3, table.getRowCount());
        assertEquals(3, table.getColCount());
        assertEquals(9, table.getCells().size());
        for (Cell c : table.getCells()) {
            assertEquals(10f, (float) c.getWidth(), 1e-4);
            assertEquals(10f, (float) c.getHeight(), 1e-4);
        }
        assertEquals("e", table.getCell(1, 1).getText());
        assertEquals(1, table.getPageNumber());
        assertEquals("lines/text", table.getExtractionMethod());
        assertEquals("|a|b|c|\n|---|---|---|\n|d|e|f|\n|g|h|i|\n", new MarkdownWriter().toMarkdown(table));
    }

    @Test
    public void testUnruledWordGridWithTextStrategies() {
        // 3 x 3 two-letter words, 40 apart horizontally and 20 apart vertically
        List<TextElement> texts = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                String letter = String.valueOf((char) ('a' + i * 3 + j));
                texts.add(Fixtures.chr(i * 20, j * 40, 5, 10, letter));
                texts.add(Fixtures.chr(i * 20, j * 40 + 5, 5, 10, letter.toUpperCase()));
            }
        }
        TableFinder finder = new TableFinder(settings("text", "text"));
        Page page = Fixtures.page(200, 200, texts, Collections.<Rectangle>emptyList());

        // left, center and right of every word column; top and bottom of every row
        List<Edge> edges = finder.getEdges(page, finder.getWords(page));
        int verticals = 0;
        for (Edge e : edges) {
            if (e.isVertical()) {
                verticals++;
                assertEquals(0f, e.getStart(), 1e-6);
                assertEquals(50f, e.getEnd(), 1e-6);
            }
        }
        assertEquals(9, verticals);
        assertEquals(6, edges.size() - verticals);

        List<Table> tables = finder.extract(page);

        assertEquals(1, tables.size());
        Table table = tables.get(0);
        assertEquals("text/text", table.getExtractionMethod());
        assertEquals(5, table.getRowCount());
        assertEquals(8, table.getColCount());
        assertEquals(40, table.getCells().size());
        assertEquals(90f, table.getRight(), 1e-4);
        assertEquals(50f, table.getBottom(), 1e-4);
        assertEquals("a", table.getCell(0, 0).getText());
        assertEquals("A", table.getCell(0, 1).getText());
        assertEquals("", table.getCell(0, 2).getText());
        assertEquals("", table.getCell(1, 0).getText());
        assertEquals("e", table.getCell(2, 3).getText());
        assertEquals("I", table.getCell(4, 7).getText());
        assertEquals(Arrays.asList("a", "A", "Col3", "b", "B", "Col6", "c", "C"),
                table.getHeader().getNames());
    }

    @Test
    public void testRuledGrid() {
        Page page = Fixtures.page(100, 100, Fixtures.gridText(2, 4, 20), gridRules(2, 4, 20));

        List<Table> tables = new TableFinder().extract(page);

        assertEquals(1, tables.size());
        assertEquals(2, tables.get(0).getRowCount());
        assertEquals(4, tables.get(0).getColCount());
        assertEquals("h", tables.get(0).getCell(1, 3).getText());
        assertEquals(80f, tables.get(0).getRight(), 1e-4);
    }

    @Test
    public void testTablesWithoutTextAreDropped() {
        Page page = Fixtures.page(100, 100, Collections.<TextElement>emptyList(), gridRules(3, 3, 10));
        assertTrue(new TableFinder().extract(page).isEmpty());
    }

    @Test
    public void testSingleColumnGridIsNotATable() {
        Page page = Fixtures.page(100, 100, Fixtures.gridText(3, 1, 10), gridRules(3, 1, 10));
        assertTrue(new TableFinder().extract(page).isEmpty());
    }

    @Test
    public void testLinesStrategyFallsBackToTextWithoutPaths() {
        List<TextElement> texts = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                texts.add(Fixtures.chr(i * 20, j * 40, 10, 10, "w"));
            }
        }
        TableFinder finder = new TableFinder();
        Page page = Fixtures.page(200, 200, texts, Collections.<Rectangle>emptyList());

        List<Edge> edges = finder.getEdges(page, finder.getWords(page));

        int verticals = 0;
        for (Edge e : edges) {
            assertEquals(Edge.Source.TEXT, e.getSource());
            if (e.isVertical()) {
                verticals++;
            }
        }
        assertEquals(9, verticals);
        assertEquals(6, edges.size() - verticals);
    }

    @Test
    public void testEdgeLimit() {
        Map<String, Object> values = new HashMap<>();
        values.put("max_edges", 5);
        TableFinder finder = new TableFinder(TableSettings.fromMap(values));
        Page page = Fixtures.page(100, 100, Fixtures.gridText(3, 3, 10), gridRules(3, 3, 10));

        assertThrows(ResourceExhaustionException.class, () -> finder.extract(page));
    }

    @Test
    public void testIntersectionLimit() {
        Map<String, Object> values = new HashMap<>();
        values.put("max_intersections", 10);
        TableFinder finder = new TableFinder(TableSettings.fromMap(values));
        Page page = Fixtures.page(100, 100, Fixtures.gridText(3, 3, 10), gridRules(3, 3, 10));

        assertThrows(ResourceExhaustionException.class, () -> finder.extract(page));
    }

    @Test
    public void testInterruptedThreadAbortsExtraction() {
        Page page = Fixtures.page(100, 100, Fixtures.gridText(3, 3, 10), gridRules(3, 3, 10));
        Thread.currentThread().interrupt();
        try {
            assertThrows(ResourceExhaustionException.class, () -> new TableFinder().extract(page));
        } finally {
            Thread.interrupted();
        }
        assertFalse(Thread.currentThread().isInterrupted());
    }

    @Test
    public void testCellTextComesFromGivenSource() {
        Page page = Fixtures.page(100, 100, Fixtures.gridText(2, 2, 10), gridRules(2, 2, 10));

        List<Table> tables = new TableFinder().extract(page, area -> "x" + (int) area.getLeft());

        assertEquals("x10", tables.get(0).getCell(1, 1).getText());
    }

}
