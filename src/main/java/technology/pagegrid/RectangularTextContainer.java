package technology.pagegrid;

import java.util.ArrayList;
import java.util.List;

@SuppressWarnings("serial")
/**
 * 矩形文本容器。
 *
 * <p>
 * 泛型 T 必须同时是 Rectangle 与 HasText 的实现（例如 TextElement）。
 * 本类表示页面上某个矩形区域内按顺序保存的文本元素集合，几何边界始终是这些元素的并集。
 * </p>
 *
 * @param <T> 存放的文本元素类型，必须继承 Rectangle 并实现 HasText
 */
public abstract class RectangularTextContainer<T extends Rectangle & HasText> extends Rectangle implements HasText {

	protected List<T> textElements = new ArrayList<>();

	protected RectangularTextContainer(float top, float left, float width, float height) {
		super(top, left, width, height);
	}

	/**
	 * 以单个元素初始化容器，边界与该元素相同。
	 */
	protected RectangularTextContainer(T first) {
		super(first.getTop(), first.getLeft(), (float) first.getWidth(), (float) first.getHeight());
		this.textElements.add(first);
	}

	/**
	 * 追加一个元素并扩展边界。
	 */
	public void addElement(T element) {
		this.textElements.add(element);
		super.merge(element);
	}

	public List<T> getTextElements() {
		return textElements;
	}

	public boolean isEmpty() {
		return textElements.isEmpty();
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		String s = super.toString();
		sb.append(s.substring(0, s.length() - 1));
		sb.append(String.format(",text=%s]", this.getText() == null ? "null" : "\"" + this.getText() + "\""));
		return sb.toString();
	}

}
