package technology.pagegrid;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

public class ColumnTest {

    @Test
    public void testReadingOrderGroupsBlocksIntoLines() {
        PageBlock right = Fixtures.block(1, 50, 10, 10, "right");
        PageBlock left = Fixtures.block(0, 0, 10, 10, "left");
        PageBlock below = Fixtures.block(20, 0, 10, 10, "below");
        List<PageBlock> blocks = new ArrayList<>(Arrays.asList(below, right, left));

        Column.sortReadingOrder(blocks);

        assertEquals("left", blocks.get(0).getText());
        assertEquals("right", blocks.get(1).getText());
        assertEquals("below", blocks.get(2).getText());
    }

    @Test
    public void testStatisticsUseDefaultGapWithFewerThanTwoGaps() {
        Column column = new Column(0, 0, 100);
        column.addBlock(Fixtures.block(0, 0, 80, 10, "one"));
        column.addBlock(Fixtures.block(14, 0, 60, 10, "two"));
        column.recomputeStatistics();

        assertEquals(Column.DEFAULT_GAP, column.getMedianGap(), 1e-6);
        assertEquals(80f, column.getMedianWidth(), 1e-6);
        assertEquals(10f, column.getMedianHeight(), 1e-6);
    }

    @Test
    public void testMedianGapOfStackedTextBlocks() {
        Column column = new Column(0, 0, 100);
        column.addBlock(Fixtures.block(0, 0, 80, 10, "one"));
        column.addBlock(Fixtures.block(14, 0, 80, 10, "two"));
        column.addBlock(Fixtures.block(30, 0, 80, 10, "three"));
        column.addBlock(Fixtures.block(43, 0, 80, 10, "four"));
        column.recomputeStatistics();

        // gaps 4, 6, 3 -> sorted 3, 4, 6
        assertEquals(4f, column.getMedianGap(), 1e-6);
    }

    @Test
    public void testRemoveBlockByIdentity() {
        Column column = new Column(3, 0, 100);
        PageBlock a = Fixtures.block(0, 0, 10, 10, "same");
        PageBlock b = Fixtures.block(0, 0, 10, 10, "same");
        column.addBlock(a);
        column.addBlock(b);

        assertEquals(3, a.getColumnId());
        assertTrue(column.removeBlock(b));
        assertEquals(1, column.getBlocks().size());
        assertTrue(column.getBlocks().get(0) == a);
        assertFalse(column.removeBlock(b));
    }

    @Test
    public void testDistanceTo() {
        Column column = new Column(0, 10, 20);
        assertEquals(5f, column.distanceTo(5), 1e-6);
        assertEquals(0f, column.distanceTo(15), 1e-6);
        assertEquals(3f, column.distanceTo(23), 1e-6);
    }

}
