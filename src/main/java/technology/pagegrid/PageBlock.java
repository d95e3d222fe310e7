package technology.pagegrid;

@SuppressWarnings("serial")
/**
 * 版面块：版面分析（分栏/表格区域检测）使用的页面矩形块。
 *
 * 类型在分类阶段可能由 TEXT 变为 TABLE_CELL；合并阶段会修改边界、文本与字号。
 */
public class PageBlock extends Rectangle implements HasText {

    public enum BlockType {
        TEXT, IMAGE, TABLE_CELL
    }

    /**
     * 没有字符统计时使用的字号。
     */
    public static final float DEFAULT_FONT_SIZE = 12f;

    private BlockType type;
    private String text;
    private float fontSize;
    private int charCount;
    private int columnId = -1;

    public PageBlock(float top, float left, float width, float height, BlockType type, String text,
            float fontSize, int charCount) {
        super(top, left, width, height);
        this.type = type;
        this.text = text == null ? "" : text;
        this.fontSize = fontSize;
        this.charCount = charCount;
    }

    /**
     * 文本块，字符数取文本长度。
     */
    public static PageBlock text(Rectangle bbox, String text, float fontSize) {
        return new PageBlock(bbox.getTop(), bbox.getLeft(), (float) bbox.getWidth(), (float) bbox.getHeight(),
                BlockType.TEXT, text, fontSize, text == null ? 0 : text.length());
    }

    public static PageBlock image(Rectangle bbox) {
        return new PageBlock(bbox.getTop(), bbox.getLeft(), (float) bbox.getWidth(), (float) bbox.getHeight(),
                BlockType.IMAGE, "", DEFAULT_FONT_SIZE, 0);
    }

    public BlockType getType() {
        return type;
    }

    public void setType(BlockType type) {
        this.type = type;
    }

    public boolean isText() {
        return type == BlockType.TEXT;
    }

    @Override
    public String getText() {
        return text;
    }

    public float getFontSize() {
        return fontSize;
    }

    public int getCharCount() {
        return charCount;
    }

    public int getColumnId() {
        return columnId;
    }

    public void setColumnId(int columnId) {
        this.columnId = columnId;
    }

    /**
     * 把 other 合并进本块：边界取并集，文本以一个空格连接，字号取按字符数加权的平均值。
     * 两块都没有字符时字号保持不变。
     */
    public void absorb(PageBlock other) {
        this.merge(other);
        int total = this.charCount + other.charCount;
        if (total > 0) {
            this.fontSize = (this.fontSize * this.charCount + other.fontSize * other.charCount) / total;
        }
        this.charCount = total;
        this.text = this.text + " " + other.text;
    }

    /**
     * 返回裁剪到 area 内的副本；没有交集时返回 null。
     */
    public PageBlock clipTo(Rectangle area) {
        float left = Math.max(getLeft(), area.getLeft());
        float top = Math.max(getTop(), area.getTop());
        float right = Math.min(getRight(), area.getRight());
        float bottom = Math.min(getBottom(), area.getBottom());
        if (right < left || bottom < top) {
            return null;
        }
        return new PageBlock(top, left, right - left, bottom - top, type, text, fontSize, charCount);
    }

}
