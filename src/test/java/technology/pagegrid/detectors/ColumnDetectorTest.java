package technology.pagegrid.detectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import technology.pagegrid.Column;
import technology.pagegrid.Fixtures;
import technology.pagegrid.PageBlock;

public class ColumnDetectorTest {

    @Test
    public void testNoBlocksNoColumns() {
        assertTrue(ColumnDetector.detectColumns(Collections.<PageBlock>emptyList(), 200).isEmpty());
    }

    @Test
    public void testFullWidthBlockGivesSingleColumn() {
        PageBlock block = Fixtures.block(0, 0, 200, 10, "full");

        List<Column> columns = ColumnDetector.detectColumns(Collections.singletonList(block), 200);

        assertEquals(1, columns.size());
        assertEquals(0f, columns.get(0).getX0(), 1e-6);
        assertEquals(200f, columns.get(0).getX1(), 1e-6);
        assertSame(block, columns.get(0).getBlocks().get(0));
    }

    @Test
    public void testTwoColumnsMeetInTheGutter() {
        PageBlock left = Fixtures.block(0, 10, 80, 10, "left");
        PageBlock right = Fixtures.block(0, 110, 80, 10, "right");
        PageBlock leftBelow = Fixtures.block(20, 10, 60, 10, "left below");

        List<Column> columns = ColumnDetector.detectColumns(Arrays.asList(left, right, leftBelow), 200);

        assertEquals(2, columns.size());
        assertEquals(0f, columns.get(0).getX0(), 1e-6);
        assertEquals(100f, columns.get(0).getX1(), 1e-6);
        assertEquals(100f, columns.get(1).getX0(), 1e-6);
        assertEquals(200f, columns.get(1).getX1(), 1e-6);
        assertEquals(2, columns.get(0).getBlocks().size());
        assertEquals(1, columns.get(1).getBlocks().size());
        assertEquals(1, right.getColumnId());
        assertEquals(80f, columns.get(0).getMedianWidth(), 1e-6);
    }

    @Test
    public void testNarrowGapDoesNotSplitColumns() {
        List<PageBlock> blocks = Arrays.asList(Fixtures.block(0, 10, 80, 10, "a"), Fixtures.block(0, 96, 94, 10, "b"));

        List<Column> columns = ColumnDetector.detectColumns(blocks, 200);

        assertEquals(1, columns.size());
        assertEquals(200f, columns.get(0).getWidth(), 1e-6);
    }

    @Test
    public void testEqualOverlapGoesToLowestColumn() {
        List<Column> columns = Arrays.asList(new Column(0, 0, 100), new Column(1, 100, 200));
        assertEquals(0, ColumnDetector.assign(Fixtures.block(0, 90, 20, 10, "x"), columns));
        assertEquals(1, ColumnDetector.assign(Fixtures.block(0, 95, 20, 10, "x"), columns));
    }

    @Test
    public void testBlockOutsideAllColumnsGoesToNearest() {
        List<Column> columns = Arrays.asList(new Column(0, 0, 100), new Column(1, 150, 200));
        assertEquals(1, ColumnDetector.assign(Fixtures.block(0, 130, 10, 10, "x"), columns));
    }

    @Test
    public void testBinCount() {
        assertEquals(1000, ColumnDetector.binCount(5000));
        assertEquals(306, ColumnDetector.binCount(612));
        assertEquals(1, ColumnDetector.binCount(1));
    }

}
