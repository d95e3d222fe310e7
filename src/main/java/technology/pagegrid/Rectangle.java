package technology.pagegrid;

import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * 页面坐标系中的轴对齐矩形（bbox）。
 *
 * 坐标原点在页面左上角，y 轴向下。所有几何原语（字符、单词、单元格、表格、版面块）
 * 都继承自该类，以便共享重叠/合并等运算。
 */
@SuppressWarnings("serial")
public class Rectangle extends Rectangle2D.Float {

	/**
	 * 先按 top、再按 left 排序（页面阅读顺序：自上而下、自左而右）。
	 */
	public static final Comparator<Rectangle> TOP_LEFT_ORDER = new Comparator<Rectangle>() {
		@Override
		public int compare(Rectangle o1, Rectangle o2) {
			int rv = java.lang.Float.compare(o1.getTop(), o2.getTop());
			return rv != 0 ? rv : java.lang.Float.compare(o1.getLeft(), o2.getLeft());
		}
	};

	public Rectangle() {
		super();
	}

	/**
	 * 使用顶部、左侧、宽度和高度构造 Rectangle。
	 *
	 * @param top    矩形顶部 Y 坐标
	 * @param left   矩形左侧 X 坐标
	 * @param width  矩形宽度
	 * @param height 矩形高度
	 */
	public Rectangle(float top, float left, float width, float height) {
		super();
		this.setRect(left, top, width, height);
	}

	/**
	 * 由左上角与右下角两点构造。
	 */
	public static Rectangle fromCorners(double x0, double y0, double x1, double y1) {
		return new Rectangle((float) Math.min(y0, y1), (float) Math.min(x0, x1), (float) Math.abs(x1 - x0),
				(float) Math.abs(y1 - y0));
	}

	public float getArea() {
		return this.width * this.height;
	}

	/**
	 * 宽或高为 0（或负）的矩形视为退化矩形。
	 */
	public boolean isDegenerate() {
		return this.width <= 0 || this.height <= 0;
	}

	/**
	 * 计算当前矩形与另一个矩形在垂直方向上的重叠长度，没有重叠返回 0。
	 */
	public float verticalOverlap(Rectangle other) {
		return Math.max(0, Math.min(this.getBottom(), other.getBottom()) - Math.max(this.getTop(), other.getTop()));
	}

	public boolean verticallyOverlaps(Rectangle other) {
		return verticalOverlap(other) > 0;
	}

	/**
	 * 计算当前矩形与另一个矩形在水平方向上的重叠长度，没有重叠返回 0。
	 */
	public float horizontalOverlap(Rectangle other) {
		return Math.max(0, Math.min(this.getRight(), other.getRight()) - Math.max(this.getLeft(), other.getLeft()));
	}

	public boolean horizontallyOverlaps(Rectangle other) {
		return horizontalOverlap(other) > 0;
	}

	/**
	 * 水平重叠比例：重叠长度 / 两者中较小的宽度。
	 *
	 * @return 0-1 之间的比例；任一宽度为 0 时返回 0
	 */
	public float horizontalOverlapRatio(Rectangle other) {
		return Utils.overlapRatio(this.getLeft(), this.getRight(), other.getLeft(), other.getRight());
	}

	/**
	 * 垂直重叠比例：重叠长度 / 两者中较小的高度。
	 */
	public float verticalOverlapRatio(Rectangle other) {
		return Utils.overlapRatio(this.getTop(), this.getBottom(), other.getTop(), other.getBottom());
	}

	/**
	 * 两矩形在水平方向的间距，重叠时为 0。
	 */
	public float horizontalGap(Rectangle other) {
		return Math.max(0, Math.max(this.getLeft(), other.getLeft()) - Math.min(this.getRight(), other.getRight()));
	}

	/**
	 * 两矩形在垂直方向的间距，重叠时为 0。
	 */
	public float verticalGap(Rectangle other) {
		return Math.max(0, Math.max(this.getTop(), other.getTop()) - Math.min(this.getBottom(), other.getBottom()));
	}

	/**
	 * 交集面积（没有交集返回 0）。
	 */
	public float intersectionArea(Rectangle other) {
		return this.horizontalOverlap(other) * this.verticalOverlap(other);
	}

	/**
	 * 将当前矩形扩展为包含另一个矩形的并集（修改当前对象并返回自身）。
	 *
	 * 与 {@link Rectangle2D#createUnion} 不同，退化（零宽或零高）的矩形同样参与合并。
	 */
	public Rectangle merge(Rectangle other) {
		float left = Math.min(this.getLeft(), other.getLeft());
		float top = Math.min(this.getTop(), other.getTop());
		float right = Math.max(this.getRight(), other.getRight());
		float bottom = Math.max(this.getBottom(), other.getBottom());
		this.setRect(left, top, right - left, bottom - top);
		return this;
	}

	public float getTop() {
		return (float) this.getMinY();
	}

	public float getRight() {
		return (float) this.getMaxX();
	}

	public float getLeft() {
		return (float) this.getMinX();
	}

	public float getBottom() {
		return (float) this.getMaxY();
	}

	public float getCenterXf() {
		return (this.getLeft() + this.getRight()) / 2f;
	}

	/**
	 * 返回矩形的四个角点，按顺时针顺序：左上、右上、右下、左下。
	 */
	public Point2D[] getPoints() {
		return new Point2D[] { new Point2D.Float(this.getLeft(), this.getTop()),
				new Point2D.Float(this.getRight(), this.getTop()), new Point2D.Float(this.getRight(), this.getBottom()),
				new Point2D.Float(this.getLeft(), this.getBottom()) };
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		String s = super.toString();
		sb.append(s.substring(0, s.length() - 1));
		sb.append(String.format(Locale.US, ",bottom=%f,right=%f]", this.getBottom(), this.getRight()));
		return sb.toString();
	}

	/**
	 * 计算并返回一组矩形的最小外接矩形。
	 *
	 * @param rectangles 要包围的矩形列表
	 * @return 最小外接矩形；列表为空时返回位于原点的空矩形
	 */
	public static Rectangle boundingBoxOf(List<? extends Rectangle> rectangles) {
		if (rectangles.isEmpty()) {
			return new Rectangle();
		}
		float minx = java.lang.Float.MAX_VALUE;
		float miny = java.lang.Float.MAX_VALUE;
		float maxx = -java.lang.Float.MAX_VALUE;
		float maxy = -java.lang.Float.MAX_VALUE;

		for (Rectangle r : rectangles) {
			minx = Math.min(r.getLeft(), minx);
			miny = Math.min(r.getTop(), miny);
			maxx = Math.max(r.getRight(), maxx);
			maxy = Math.max(r.getBottom(), maxy);
		}
		return new Rectangle(miny, minx, maxx - minx, maxy - miny);
	}

}
