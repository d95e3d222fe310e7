package technology.pagegrid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 测试用的页面与几何对象构造方法。
 */
public final class Fixtures {

    public static final String FONT = "Helvetica";

    public static final String BOLD_FONT = "Helvetica-Bold";

    private Fixtures() {
    }

    public static TextElement chr(float top, float left, float width, float height, String text) {
        return new TextElement(top, left, width, height, text, FONT, height);
    }

    public static TextElement bold(float top, float left, float width, float height, String text) {
        return new TextElement(top, left, width, height, text, BOLD_FONT, height);
    }

    /**
     * 把字符串按固定字宽排成一行字符，空格也作为字符输出。
     */
    public static List<TextElement> line(float top, float left, float charWidth, float height, String text) {
        List<TextElement> rv = new ArrayList<>();
        for (int i = 0; i < text.length(); i++) {
            rv.add(chr(top, left + i * charWidth, charWidth, height, String.valueOf(text.charAt(i))));
        }
        return rv;
    }

    /**
     * rows × cols 的网格，每个格子大小为 size，格子里放一个占满格子的字符，文本为 a、b、c ...
     */
    public static List<TextElement> gridText(int rows, int cols, float size) {
        List<TextElement> rv = new ArrayList<>();
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                rv.add(chr(i * size, j * size, size, size, String.valueOf((char) ('a' + i * cols + j))));
            }
        }
        return rv;
    }

    /**
     * 垂直网格线（零宽矩形），x = 0, size, ..., cols * size，高度覆盖 rows 行。
     */
    public static List<Rectangle> verticalRules(int rows, int cols, float size) {
        List<Rectangle> rv = new ArrayList<>();
        for (int j = 0; j <= cols; j++) {
            rv.add(new Rectangle(0, j * size, 0, rows * size));
        }
        return rv;
    }

    /**
     * 水平网格线（零高矩形）。
     */
    public static List<Rectangle> horizontalRules(int rows, int cols, float size) {
        List<Rectangle> rv = new ArrayList<>();
        for (int i = 0; i <= rows; i++) {
            rv.add(new Rectangle(i * size, 0, cols * size, 0));
        }
        return rv;
    }

    public static Page page(float width, float height, List<TextElement> texts, List<Rectangle> paths) {
        return new Page(1, width, height, texts, paths, Collections.<PageBlock>emptyList(), 3f);
    }

    public static Page layoutPage(float width, float height, List<PageBlock> blocks) {
        return new Page(1, width, height, Collections.<TextElement>emptyList(), Collections.<Rectangle>emptyList(),
                blocks, 3f);
    }

    public static PageBlock block(float top, float left, float width, float height, String text) {
        return PageBlock.text(new Rectangle(top, left, width, height), text, 10f);
    }

    public static PageBlock block(float top, float left, float width, float height, String text, float fontSize) {
        return PageBlock.text(new Rectangle(top, left, width, height), text, fontSize);
    }

}
