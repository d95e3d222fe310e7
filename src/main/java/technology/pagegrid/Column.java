package technology.pagegrid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * 分栏：页面上一段连续的 x 区间，以及分配到该区间的版面块。
 *
 * <p>
 * 统计量（块宽/块高中位数、相邻文本块的垂直间距中位数）在成员变化后必须调用
 * {@link #recomputeStatistics()} 重新计算。
 * </p>
 */
public class Column {

    public static final float DEFAULT_GAP = 10.0f;

    /**
     * 同一视觉行内 top 的最大差值。
     */
    public static final float LINE_TOLERANCE = 2.0f;

    private static final Comparator<PageBlock> BY_TOP = new Comparator<PageBlock>() {
        @Override
        public int compare(PageBlock a, PageBlock b) {
            return java.lang.Float.compare(a.getTop(), b.getTop());
        }
    };

    private static final Comparator<PageBlock> BY_LEFT = new Comparator<PageBlock>() {
        @Override
        public int compare(PageBlock a, PageBlock b) {
            return java.lang.Float.compare(a.getLeft(), b.getLeft());
        }
    };

    private final int id;
    private float x0;
    private float x1;
    private final List<PageBlock> blocks = new ArrayList<>();

    private float medianGap = DEFAULT_GAP;
    private float medianWidth;
    private float medianHeight;

    public Column(int id, float x0, float x1) {
        this.id = id;
        this.x0 = x0;
        this.x1 = x1;
    }

    public int getId() {
        return id;
    }

    public float getX0() {
        return x0;
    }

    public float getX1() {
        return x1;
    }

    public float getWidth() {
        return x1 - x0;
    }

    public float distanceTo(float x) {
        return x < x0 ? x0 - x : (x > x1 ? x - x1 : 0);
    }

    public void addBlock(PageBlock block) {
        block.setColumnId(id);
        blocks.add(block);
    }

    /**
     * 按引用移除成员块（不同块的边界可能相同）。
     */
    public boolean removeBlock(PageBlock block) {
        for (int i = 0; i < blocks.size(); i++) {
            if (blocks.get(i) == block) {
                blocks.remove(i);
                return true;
            }
        }
        return false;
    }

    /**
     * 成员块（可修改），顺序即加入顺序。
     */
    public List<PageBlock> getBlocks() {
        return blocks;
    }

    /**
     * 指定类型的成员块，按阅读顺序排序。
     */
    public List<PageBlock> getBlocks(PageBlock.BlockType type) {
        List<PageBlock> rv = new ArrayList<>();
        for (PageBlock b : blocks) {
            if (b.getType() == type) {
                rv.add(b);
            }
        }
        return sortReadingOrder(rv);
    }

    /**
     * 按阅读顺序原地排序并返回：先按 top 排序，top 与行首相差不超过
     * {@link #LINE_TOLERANCE} 的块视为同一行，行内按 left 排序。
     */
    public static List<PageBlock> sortReadingOrder(List<PageBlock> blocks) {
        Collections.sort(blocks, BY_TOP);
        int lineStart = 0;
        for (int i = 1; i <= blocks.size(); i++) {
            if (i == blocks.size()
                    || blocks.get(i).getTop() - blocks.get(lineStart).getTop() > LINE_TOLERANCE) {
                Collections.sort(blocks.subList(lineStart, i), BY_LEFT);
                lineStart = i;
            }
        }
        return blocks;
    }

    public float getMedianGap() {
        return medianGap;
    }

    public float getMedianWidth() {
        return medianWidth;
    }

    public float getMedianHeight() {
        return medianHeight;
    }

    /**
     * 重新计算统计量：
     * - 块宽/块高中位数取全部成员块
     * - 间距中位数取按阅读顺序相邻、水平重叠比例大于 0.4 且间距为正的文本块对；
     *   这样的间距不足两个时为 {@link #DEFAULT_GAP}
     */
    public void recomputeStatistics() {
        List<java.lang.Float> widths = new ArrayList<>();
        List<java.lang.Float> heights = new ArrayList<>();
        for (PageBlock b : blocks) {
            widths.add((float) b.getWidth());
            heights.add((float) b.getHeight());
        }
        medianWidth = widths.isEmpty() ? 0 : Utils.median(widths);
        medianHeight = heights.isEmpty() ? 0 : Utils.median(heights);

        List<PageBlock> text = getBlocks(PageBlock.BlockType.TEXT);
        List<java.lang.Float> gaps = new ArrayList<>();
        for (int i = 0; i + 1 < text.size(); i++) {
            PageBlock upper = text.get(i);
            PageBlock lower = text.get(i + 1);
            if (lower.getTop() > upper.getBottom() && upper.horizontalOverlapRatio(lower) > 0.4f) {
                gaps.add(lower.getTop() - upper.getBottom());
            }
        }
        medianGap = gaps.size() < 2 ? DEFAULT_GAP : Utils.median(gaps);
    }

    @Override
    public String toString() {
        return String.format("Column[id=%d,x0=%f,x1=%f,blocks=%d]", id, x0, x1, blocks.size());
    }

}
