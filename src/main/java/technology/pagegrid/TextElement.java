package technology.pagegrid;

import java.util.Objects;

@SuppressWarnings("serial")
/**
 * 表示页面上的一个字符（一个字素）。
 *
 * TextElement 继承自 Rectangle，包含文本内容、字体名、字号、基线位置、doctop（跨页累计的顶部位置）
 * 以及书写方向（upright）。由提取器每页生成一次，之后只读。
 */
public class TextElement extends Rectangle implements HasText {

    private final String text;
    private final String fontName;
    private final float fontSize;
    private final float baseline;
    private final float doctop;
    private final boolean upright;
    private final int pageIndex;

    /**
     * 构造一个横排字符，基线取框底部，doctop 等于 top，页码为 0。
     *
     * @param y        字符顶部 Y 坐标
     * @param x        字符左侧 X 坐标
     * @param width    字符框宽度
     * @param height   字符框高度
     * @param text     字符内容
     * @param fontName 字体名
     * @param fontSize 字号
     */
    public TextElement(float y, float x, float width, float height, String text, String fontName, float fontSize) {
        this(y, x, width, height, text, fontName, fontSize, y + height, y, true, 0);
    }

    /**
     * 完整构造。
     *
     * @param y         字符顶部 Y 坐标
     * @param x         字符左侧 X 坐标
     * @param width     字符框宽度
     * @param height    字符框高度
     * @param text      字符内容
     * @param fontName  字体名
     * @param fontSize  字号
     * @param baseline  基线 Y 坐标
     * @param doctop    文档累计顶部位置
     * @param upright   是否为横排（false 表示竖排）
     * @param pageIndex 页码（0 起）
     */
    public TextElement(float y, float x, float width, float height, String text, String fontName, float fontSize,
            float baseline, float doctop, boolean upright, int pageIndex) {
        super(y, x, width, height);
        this.text = text;
        this.fontName = fontName;
        this.fontSize = fontSize;
        this.baseline = baseline;
        this.doctop = doctop;
        this.upright = upright;
        this.pageIndex = pageIndex;
    }

    @Override
    public String getText() {
        return text;
    }

    public String getFontName() {
        return fontName;
    }

    public float getFontSize() {
        return fontSize;
    }

    public float getBaseline() {
        return baseline;
    }

    public float getDoctop() {
        return doctop;
    }

    public boolean isUpright() {
        return upright;
    }

    public int getPageIndex() {
        return pageIndex;
    }

    /**
     * 是否只由空白字符组成（空串也算空白）。
     */
    public boolean isWhitespace() {
        return text == null || text.trim().isEmpty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        String s = super.toString();
        sb.append(s.substring(0, s.length() - 1));
        sb.append(String.format(",text=\"%s\"]", this.getText()));
        return sb.toString();
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = super.hashCode();
        result = prime * result + java.lang.Float.floatToIntBits(baseline);
        result = prime * result + java.lang.Float.floatToIntBits(doctop);
        result = prime * result + ((fontName == null) ? 0 : fontName.hashCode());
        result = prime * result + java.lang.Float.floatToIntBits(fontSize);
        result = prime * result + pageIndex;
        result = prime * result + ((text == null) ? 0 : text.hashCode());
        result = prime * result + (upright ? 1231 : 1237);
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!super.equals(obj))
            return false;
        if (getClass() != obj.getClass())
            return false;
        TextElement other = (TextElement) obj;
        return java.lang.Float.floatToIntBits(baseline) == java.lang.Float.floatToIntBits(other.baseline)
                && java.lang.Float.floatToIntBits(doctop) == java.lang.Float.floatToIntBits(other.doctop)
                && java.lang.Float.floatToIntBits(fontSize) == java.lang.Float.floatToIntBits(other.fontSize)
                && pageIndex == other.pageIndex
                && upright == other.upright
                && Objects.equals(fontName, other.fontName)
                && Objects.equals(text, other.text);
    }

}
