package technology.pagegrid;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.util.List;

import org.junit.jupiter.api.Test;

public class TableTest {

    @Test
    public void testEmpty() {
        Table table = Table.empty();
        assertEquals(0, table.getRowCount());
        assertEquals(0, table.getColCount());
        assertEquals(0, table.getRows().size());
        assertEquals("", table.getExtractionMethod());
    }

    @Test
    public void testAddGrowsDimensionsAndBounds() {
        Table table = new Table("lines/lines");
        table.add(new Cell(10, 10, 20, 10), 0, 0);
        table.add(new Cell(10, 30, 20, 10), 0, 1);
        table.add(new Cell(20, 10, 20, 10), 1, 0);

        assertEquals(2, table.getRowCount());
        assertEquals(2, table.getColCount());
        assertEquals(10f, table.getTop(), 1e-6);
        assertEquals(10f, table.getLeft(), 1e-6);
        assertEquals(50f, table.getRight(), 1e-6);
        assertEquals(30f, table.getBottom(), 1e-6);
    }

    @Test
    public void testRaggedRows() {
        Table table = new Table("lines/lines");
        Cell a = new Cell(0, 0, 10, 10);
        Cell b = new Cell(0, 10, 10, 10);
        Cell c = new Cell(10, 0, 20, 10);
        table.add(a, 0, 0);
        table.add(b, 0, 1);
        table.add(c, 1, 0);

        List<Row> rows = table.getRows();
        assertEquals(2, rows.size());
        assertEquals(2, rows.get(0).size());
        assertEquals(1, rows.get(1).size());
        assertSame(c, table.getCell(1, 0));
        assertNull(table.getCell(1, 1));
    }

    @Test
    public void testCellsInRowMajorOrder() {
        Table table = new Table("text/text");
        Cell second = new Cell(10, 0, 10, 10);
        Cell first = new Cell(0, 0, 10, 10);
        table.add(second, 1, 0);
        table.add(first, 0, 0);

        List<Cell> cells = table.getCells();
        assertSame(first, cells.get(0));
        assertSame(second, cells.get(1));
    }

}
