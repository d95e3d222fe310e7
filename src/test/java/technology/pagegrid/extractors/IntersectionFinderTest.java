package technology.pagegrid.extractors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import technology.pagegrid.Edge;
import technology.pagegrid.Intersection;
import technology.pagegrid.ResourceExhaustionException;

public class IntersectionFinderTest {

    @Test
    public void testCrossingEdges() {
        List<Edge> edges = Arrays.asList(Edge.vertical(10, 0, 20, Edge.Source.PATH),
                Edge.horizontal(5, 0, 30, Edge.Source.PATH));

        List<Intersection> points = IntersectionFinder.findIntersections(edges, 3, 3);

        assertEquals(1, points.size());
        assertEquals(10f, points.get(0).x, 1e-6);
        assertEquals(5f, points.get(0).y, 1e-6);
        assertEquals(1, points.get(0).getVerticals().size());
        assertEquals(1, points.get(0).getHorizontals().size());
    }

    @Test
    public void testToleranceExtendsEdges() {
        List<Edge> edges = Arrays.asList(Edge.vertical(10, 0, 20, Edge.Source.PATH),
                Edge.horizontal(22, 0, 30, Edge.Source.PATH));

        assertEquals(1, IntersectionFinder.findIntersections(edges, 3, 3).size());
        assertTrue(IntersectionFinder.findIntersections(edges, 3, 1).isEmpty());
    }

    @Test
    public void testCoincidentPointsAreMerged() {
        List<Edge> edges = Arrays.asList(Edge.vertical(10, 0, 20, Edge.Source.PATH),
                Edge.vertical(10.05f, 0, 20, Edge.Source.TEXT), Edge.horizontal(5, 0, 30, Edge.Source.PATH));

        List<Intersection> points = IntersectionFinder.findIntersections(edges, 3, 3);

        assertEquals(1, points.size());
        assertEquals(2, points.get(0).getVerticals().size());
    }

    @Test
    public void testIntersectionLimit() {
        List<Edge> edges = Arrays.asList(Edge.vertical(0, 0, 20, Edge.Source.PATH),
                Edge.vertical(10, 0, 20, Edge.Source.PATH), Edge.horizontal(0, 0, 10, Edge.Source.PATH),
                Edge.horizontal(20, 0, 10, Edge.Source.PATH));

        assertEquals(4, IntersectionFinder.findIntersections(edges, 3, 3, 4).size());
        assertThrows(ResourceExhaustionException.class,
                () -> IntersectionFinder.findIntersections(edges, 3, 3, 3));
    }

}
