package technology.pagegrid.extractors;

import java.util.ArrayList;
import java.util.List;

import technology.pagegrid.Edge;
import technology.pagegrid.Intersection;
import technology.pagegrid.ResourceExhaustionException;

/**
 * 计算垂直线与水平线的交点。
 *
 * 对每一对 (v, h)：v 的垂直范围在 yTolerance 内覆盖 h 的 y，且 h 的水平范围在 xTolerance 内覆盖 v 的 x 时，
 * 交点为 (v.x, h.y)。与已有交点在两轴上都相差不超过 {@link Intersection#EPSILON} 时并入已有交点。
 */
public final class IntersectionFinder {

    private IntersectionFinder() {
    }

    public static List<Intersection> findIntersections(List<Edge> edges, float xTolerance, float yTolerance) {
        return findIntersections(edges, xTolerance, yTolerance, Integer.MAX_VALUE);
    }

    /**
     * @param maxIntersections 交点数量上限，超过时抛出 {@link ResourceExhaustionException}
     */
    public static List<Intersection> findIntersections(List<Edge> edges, float xTolerance, float yTolerance,
            int maxIntersections) {
        List<Edge> verticals = new ArrayList<>();
        List<Edge> horizontals = new ArrayList<>();
        for (Edge e : edges) {
            if (e.isVertical()) {
                verticals.add(e);
            } else {
                horizontals.add(e);
            }
        }

        List<Intersection> rv = new ArrayList<>();
        for (Edge v : verticals) {
            for (Edge h : horizontals) {
                float x = v.getPosition();
                float y = h.getPosition();
                if (y >= v.getStart() - yTolerance && y <= v.getEnd() + yTolerance
                        && x >= h.getStart() - xTolerance && x <= h.getEnd() + xTolerance) {
                    Intersection existing = find(rv, x, y);
                    if (existing != null) {
                        existing.attach(v, h);
                    } else {
                        if (rv.size() >= maxIntersections) {
                            throw new ResourceExhaustionException(
                                    "Intersection count exceeds limit of " + maxIntersections);
                        }
                        rv.add(new Intersection(x, y, v, h));
                    }
                }
            }
        }
        return rv;
    }

    private static Intersection find(List<Intersection> intersections, float x, float y) {
        for (Intersection i : intersections) {
            if (i.coincides(x, y)) {
                return i;
            }
        }
        return null;
    }

}
