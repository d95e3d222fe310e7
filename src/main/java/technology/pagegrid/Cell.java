package technology.pagegrid;

import java.awt.geom.Point2D;

@SuppressWarnings("serial")
/**
 * 表格单元格：四个角都是网格交点的矩形。
 *
 * 单元格文本在表格组装之后由 {@link CellTextSource} 填充；未填充时为空串。
 */
public class Cell extends Rectangle implements HasText {

    private String text = "";

    public Cell(float top, float left, float width, float height) {
        super(top, left, width, height);
    }

    public Cell(Point2D topLeft, Point2D bottomRight) {
        super((float) topLeft.getY(), (float) topLeft.getX(), (float) (bottomRight.getX() - topLeft.getX()),
                (float) (bottomRight.getY() - topLeft.getY()));
    }

    @Override
    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text == null ? "" : text;
    }

    /**
     * 判断两个单元格是否至少共享一个角（两轴都在 Intersection.EPSILON 以内）。
     */
    public boolean sharesCornerWith(Cell other) {
        for (Point2D p : this.getPoints()) {
            for (Point2D q : other.getPoints()) {
                if (Math.abs(p.getX() - q.getX()) <= Intersection.EPSILON
                        && Math.abs(p.getY() - q.getY()) <= Intersection.EPSILON) {
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        String s = super.toString();
        sb.append(s.substring(0, s.length() - 1));
        sb.append(String.format(",text=\"%s\"]", this.text));
        return sb.toString();
    }

}
