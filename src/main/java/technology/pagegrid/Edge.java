package technology.pagegrid;

import java.awt.geom.Line2D;
import java.util.ArrayList;
import java.util.Formatter;
import java.util.List;
import java.util.Locale;

@SuppressWarnings("serial")
/**
 * 表示候选表格线（edge）：一条严格水平或严格垂直的线段。
 *
 * 与依靠角度推断方向的线段不同，Edge 显式记录方向，因此零长度或被 snap 移动后的线段
 * 方向也不会改变。面向方向的访问器：
 * - position：水平线为 y，垂直线为 x
 * - start/end：水平线为 left/right，垂直线为 top/bottom（start <= end）
 *
 * source 记录该线来自文本对齐推断（TEXT）还是矢量路径（PATH）。
 */
public class Edge extends Line2D.Float {

    public enum Orientation {
        HORIZONTAL, VERTICAL
    }

    public enum Source {
        TEXT, PATH
    }

    private final Orientation orientation;
    private final Source source;

    /**
     * @param orientation 方向
     * @param position    水平线的 y 或垂直线的 x
     * @param start       沿线方向的起点
     * @param end         沿线方向的终点（与 start 顺序无关，内部会规范化）
     * @param source      来源标记
     */
    public Edge(Orientation orientation, float position, float start, float end, Source source) {
        super();
        this.orientation = orientation;
        this.source = source;
        this.setGeometry(position, Math.min(start, end), Math.max(start, end));
    }

    public static Edge horizontal(float y, float x0, float x1, Source source) {
        return new Edge(Orientation.HORIZONTAL, y, x0, x1, source);
    }

    public static Edge vertical(float x, float y0, float y1, Source source) {
        return new Edge(Orientation.VERTICAL, x, y0, y1, source);
    }

    private void setGeometry(float position, float start, float end) {
        if (orientation == Orientation.HORIZONTAL) {
            this.setLine(start, position, end, position);
        } else {
            this.setLine(position, start, position, end);
        }
    }

    public Orientation getOrientation() {
        return orientation;
    }

    public Source getSource() {
        return source;
    }

    public boolean isVertical() {
        return orientation == Orientation.VERTICAL;
    }

    public boolean isHorizontal() {
        return orientation == Orientation.HORIZONTAL;
    }

    public float getPosition() {
        return isVertical() ? this.x1 : this.y1;
    }

    public void setPosition(float v) {
        this.setGeometry(v, getStart(), getEnd());
    }

    public float getStart() {
        return isVertical() ? this.y1 : this.x1;
    }

    public float getEnd() {
        return isVertical() ? this.y2 : this.x2;
    }

    /**
     * 沿线方向的长度。
     */
    public float length() {
        return getEnd() - getStart();
    }

    public float getTop() {
        return this.y1;
    }

    public float getLeft() {
        return this.x1;
    }

    public float getBottom() {
        return this.y2;
    }

    public float getRight() {
        return this.x2;
    }

    /**
     * 判断另一条线是否与本线同向且共线（position 相差不超过 tolerance）。
     */
    public boolean collinearWith(Edge other, float tolerance) {
        return this.orientation == other.orientation
                && Math.abs(this.getPosition() - other.getPosition()) <= tolerance;
    }

    /**
     * 两条同向线段沿线方向的间隙，重叠时为负数。
     */
    public float gapTo(Edge other) {
        return Math.max(this.getStart(), other.getStart()) - Math.min(this.getEnd(), other.getEnd());
    }

    /**
     * 把另一条线段的范围并入本线段（只扩展 start/end，position 不变）。
     */
    public void absorb(Edge other) {
        this.setGeometry(getPosition(), Math.min(getStart(), other.getStart()), Math.max(getEnd(), other.getEnd()));
    }

    public Edge copy() {
        return new Edge(orientation, getPosition(), getStart(), getEnd(), source);
    }

    /**
     * 深拷贝一组线段，供原地修改的算法使用。
     */
    public static List<Edge> copyOf(List<Edge> edges) {
        List<Edge> rv = new ArrayList<>(edges.size());
        for (Edge e : edges) {
            rv.add(e.copy());
        }
        return rv;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other)
            return true;

        if (!(other instanceof Edge))
            return false;

        Edge o = (Edge) other;
        return this.orientation == o.orientation && this.getPosition() == o.getPosition()
                && this.getStart() == o.getStart() && this.getEnd() == o.getEnd();
    }

    @Override
    public int hashCode() {
        int result = orientation.hashCode();
        result = 31 * result + java.lang.Float.floatToIntBits(getPosition());
        result = 31 * result + java.lang.Float.floatToIntBits(getStart());
        result = 31 * result + java.lang.Float.floatToIntBits(getEnd());
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        Formatter formatter = new Formatter(sb);
        String rv = formatter.format(Locale.US, "%s[%s %s position=%f start=%f end=%f]",
                this.getClass().getSimpleName(), orientation, source, getPosition(), getStart(), getEnd()).toString();
        formatter.close();
        return rv;
    }

}
