package technology.pagegrid;

import java.awt.geom.Point2D;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.Set;

@SuppressWarnings("serial")
/**
 * 一条垂直线与一条水平线的交点，以及所有经过该点的垂直线/水平线集合。
 *
 * 交点的身份由容差决定：两点在 x 和 y 上都相差不超过 {@link #EPSILON} 时视为同一交点，
 * 合并时取并集。
 */
public class Intersection extends Point2D.Float {

    public static final float EPSILON = 0.1f;

    /**
     * 先按 y、再按 x 排序。
     */
    public static final Comparator<Point2D> YX_ORDER = new Comparator<Point2D>() {
        @Override
        public int compare(Point2D o1, Point2D o2) {
            int rv = java.lang.Double.compare(o1.getY(), o2.getY());
            return rv != 0 ? rv : java.lang.Double.compare(o1.getX(), o2.getX());
        }
    };

    private final Set<Edge> verticals = new LinkedHashSet<>();
    private final Set<Edge> horizontals = new LinkedHashSet<>();

    public Intersection(float x, float y) {
        super(x, y);
    }

    public Intersection(float x, float y, Edge vertical, Edge horizontal) {
        this(x, y);
        this.attach(vertical, horizontal);
    }

    public void attach(Edge vertical, Edge horizontal) {
        this.verticals.add(vertical);
        this.horizontals.add(horizontal);
    }

    public Set<Edge> getVerticals() {
        return verticals;
    }

    public Set<Edge> getHorizontals() {
        return horizontals;
    }

    /**
     * 判断给定坐标是否与本交点重合（两轴都在 EPSILON 以内）。
     */
    public boolean coincides(double px, double py) {
        return Math.abs(this.x - px) <= EPSILON && Math.abs(this.y - py) <= EPSILON;
    }

}
