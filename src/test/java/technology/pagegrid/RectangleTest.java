package technology.pagegrid;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

public class RectangleTest {

    @Test
    public void testAccessors() {
        Rectangle r = new Rectangle(10, 20, 30, 40);
        assertEquals(10f, r.getTop(), 1e-6);
        assertEquals(20f, r.getLeft(), 1e-6);
        assertEquals(50f, r.getRight(), 1e-6);
        assertEquals(50f, r.getBottom(), 1e-6);
        assertEquals(1200f, r.getArea(), 1e-6);
        assertEquals(35f, r.getCenterXf(), 1e-6);
    }

    @Test
    public void testOverlapsAndGaps() {
        Rectangle a = new Rectangle(0, 0, 10, 10);
        Rectangle b = new Rectangle(5, 15, 10, 10);

        assertEquals(5f, a.verticalOverlap(b), 1e-6);
        assertTrue(a.verticallyOverlaps(b));
        assertFalse(a.horizontallyOverlaps(b));
        assertEquals(5f, a.horizontalGap(b), 1e-6);
        assertEquals(0f, a.verticalGap(b), 1e-6);
        assertEquals(0.5f, a.verticalOverlapRatio(b), 1e-6);
        assertEquals(0f, a.intersectionArea(b), 1e-6);
    }

    @Test
    public void testMergeIncludesDegenerateRectangles() {
        Rectangle r = new Rectangle(10, 10, 10, 10);
        r.merge(new Rectangle(0, 50, 0, 0));
        assertEquals(0f, r.getTop(), 1e-6);
        assertEquals(10f, r.getLeft(), 1e-6);
        assertEquals(50f, r.getRight(), 1e-6);
        assertEquals(20f, r.getBottom(), 1e-6);
    }

    @Test
    public void testBoundingBoxOf() {
        Rectangle bbox = Rectangle.boundingBoxOf(Arrays.asList(new Rectangle(5, 5, 5, 5), new Rectangle(0, 20, 1, 1)));
        assertEquals(0f, bbox.getTop(), 1e-6);
        assertEquals(5f, bbox.getLeft(), 1e-6);
        assertEquals(21f, bbox.getRight(), 1e-6);
        assertEquals(10f, bbox.getBottom(), 1e-6);

        Rectangle empty = Rectangle.boundingBoxOf(Collections.<Rectangle>emptyList());
        assertTrue(empty.isDegenerate());
    }

    @Test
    public void testTopLeftOrder() {
        List<Rectangle> rects = new ArrayList<>(Arrays.asList(new Rectangle(10, 0, 1, 1), new Rectangle(0, 5, 1, 1),
                new Rectangle(0, 1, 1, 1)));
        rects.sort(Rectangle.TOP_LEFT_ORDER);
        assertEquals(1f, rects.get(0).getLeft(), 1e-6);
        assertEquals(5f, rects.get(1).getLeft(), 1e-6);
        assertEquals(10f, rects.get(2).getTop(), 1e-6);
    }

}
