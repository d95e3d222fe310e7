package technology.pagegrid;

@SuppressWarnings("serial")
/**
 * 单词：由相邻字符拼接而成的文本片段，边界为各字符的并集。
 *
 * 只在构造表格线的阶段使用，之后即被丢弃。direction 为 1 表示从左到右（或从上到下），
 * -1 表示字符流反向排列。
 */
public class TextChunk extends RectangularTextContainer<TextElement> {

    private final StringBuilder text = new StringBuilder();
    private final float doctop;
    private final boolean upright;
    private int direction = 1;

    public TextChunk(TextElement first, String firstText) {
        super(first);
        this.text.append(firstText);
        this.doctop = first.getDoctop();
        this.upright = first.isUpright();
    }

    public TextChunk(TextElement first) {
        this(first, first.getText());
    }

    /**
     * 追加一个字符。appendedText 可与字符原文不同（例如展开后的连字）。
     */
    public void add(TextElement element, String appendedText) {
        this.addElement(element);
        this.text.append(appendedText);
    }

    public void add(TextElement element) {
        this.add(element, element.getText());
    }

    @Override
    public String getText() {
        return text.toString();
    }

    public float getDoctop() {
        return doctop;
    }

    public boolean isUpright() {
        return upright;
    }

    public int getDirection() {
        return direction;
    }

    public void setDirection(int direction) {
        this.direction = direction;
    }

}
