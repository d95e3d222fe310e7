package technology.pagegrid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

@SuppressWarnings("serial")
/**
 * 单页处理的上下文：页面尺寸、字符、矢量路径矩形与版面块。
 *
 * <p>
 * 每次页面处理调用各自创建一个 Page，所有中间结果都只属于这一次调用，因此不同页面可以并行处理。
 * Page 同时实现 {@link CellTextSource}：字符框与单元格的交集面积超过字符自身面积的一半时，
 * 该字符属于该单元格。
 * </p>
 */
public class Page extends Rectangle implements CellTextSource {

    /**
     * 同一行内字符 top 的最大差值。
     */
    static final float LINE_TOLERANCE = 2.0f;

    private static final float GLYPH_OVERLAP_RATIO = 0.5f;

    private final int pageNumber;
    private final List<TextElement> texts;
    private final List<Rectangle> paths;
    private final List<PageBlock> blocks;
    private final float wordGap;
    private RectangleSpatialIndex<TextElement> spatialIndex;

    /**
     * @param pageNumber 页码（从 1 开始）
     * @param width      页面宽度
     * @param height     页面高度
     * @param texts      按阅读顺序的字符
     * @param paths      矢量路径矩形
     * @param blocks     版面块
     * @param wordGap    取单元格文本时，同一行相邻字符间距超过该值则插入空格
     */
    public Page(int pageNumber, float width, float height, List<TextElement> texts, List<Rectangle> paths,
            List<PageBlock> blocks, float wordGap) {
        super(0, 0, width, height);
        this.pageNumber = pageNumber;
        this.texts = Collections.unmodifiableList(new ArrayList<>(texts));
        this.paths = Collections.unmodifiableList(new ArrayList<>(paths));
        this.blocks = Collections.unmodifiableList(new ArrayList<>(blocks));
        this.wordGap = wordGap;
    }

    public Page(int pageNumber, float width, float height, List<TextElement> texts) {
        this(pageNumber, width, height, texts, Collections.<Rectangle>emptyList(),
                Collections.<PageBlock>emptyList(), TableSettings.defaults().getTextXTolerance());
    }

    public int getPageNumber() {
        return pageNumber;
    }

    public List<TextElement> getText() {
        return texts;
    }

    public List<Rectangle> getVectorPaths() {
        return paths;
    }

    public List<PageBlock> getBlocks() {
        return blocks;
    }

    public boolean hasText() {
        return !texts.isEmpty();
    }

    private RectangleSpatialIndex<TextElement> getSpatialIndex() {
        if (spatialIndex == null) {
            spatialIndex = new RectangleSpatialIndex<>();
            for (TextElement te : texts) {
                spatialIndex.add(te);
            }
        }
        return spatialIndex;
    }

    /**
     * 返回属于 area 的字符（交集面积超过字符自身面积的一半），按阅读顺序。
     */
    public List<TextElement> getTextElementsUnder(Rectangle area) {
        return getSpatialIndex().overlapping(area, GLYPH_OVERLAP_RATIO);
    }

    /**
     * 单元格文本：字符按 top 分行（与行首 top 相差不超过 2.0），行内从左到右，行之间以换行连接。
     */
    @Override
    public String getTextUnderRect(Rectangle area) {
        List<TextElement> glyphs = new ArrayList<>(getTextElementsUnder(area));
        if (glyphs.isEmpty()) {
            return "";
        }
        Collections.sort(glyphs, new Comparator<TextElement>() {
            @Override
            public int compare(TextElement a, TextElement b) {
                return java.lang.Float.compare(a.getTop(), b.getTop());
            }
        });

        List<String> lines = new ArrayList<>();
        int lineStart = 0;
        for (int i = 1; i <= glyphs.size(); i++) {
            if (i == glyphs.size() || glyphs.get(i).getTop() - glyphs.get(lineStart).getTop() > LINE_TOLERANCE) {
                String line = lineText(glyphs.subList(lineStart, i));
                if (!line.isEmpty()) {
                    lines.add(line);
                }
                lineStart = i;
            }
        }
        return String.join("\n", lines);
    }

    private String lineText(List<TextElement> line) {
        List<TextElement> sorted = new ArrayList<>(line);
        Collections.sort(sorted, new Comparator<TextElement>() {
            @Override
            public int compare(TextElement a, TextElement b) {
                return java.lang.Float.compare(a.getLeft(), b.getLeft());
            }
        });
        StringBuilder sb = new StringBuilder();
        TextElement prev = null;
        for (TextElement te : sorted) {
            if (prev != null && te.getLeft() - prev.getRight() > wordGap && !te.isWhitespace()
                    && !prev.isWhitespace()) {
                sb.append(' ');
            }
            sb.append(te.getText());
            prev = te;
        }
        return sb.toString().trim();
    }

}
