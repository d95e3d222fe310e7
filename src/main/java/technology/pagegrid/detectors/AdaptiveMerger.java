package technology.pagegrid.detectors;

import java.util.List;

import technology.pagegrid.Column;
import technology.pagegrid.PageBlock;

/**
 * 按栏内典型行距合并相邻的文本块（多行段落）。
 *
 * 每轮扫描前按当前的文本块重新计算分栏统计量（表格候选块不参与行距统计），
 * 再按阅读顺序扫描相邻的文本块对，合并第一对满足条件的块后从头扫描，
 * 直到一次完整扫描没有合并为止。每次合并块数减一，所以一定会结束。
 */
public final class AdaptiveMerger {

    static final float GAP_FACTOR = 1.8f;

    static final float MIN_OVERLAP = 0.45f;

    static final float FONT_SIZE_TOLERANCE = 0.3f;

    private AdaptiveMerger() {
    }

    /**
     * @return 合并次数
     */
    public static int merge(Column column) {
        int merges = 0;
        boolean merged = true;
        while (merged) {
            merged = false;
            column.recomputeStatistics();
            List<PageBlock> text = column.getBlocks(PageBlock.BlockType.TEXT);
            float maxGap = GAP_FACTOR * column.getMedianGap();
            for (int i = 0; i + 1 < text.size(); i++) {
                PageBlock upper = text.get(i);
                PageBlock lower = text.get(i + 1);
                if (canMerge(upper, lower, maxGap)) {
                    upper.absorb(lower);
                    column.removeBlock(lower);
                    merges++;
                    merged = true;
                    break;
                }
            }
        }
        return merges;
    }

    static boolean canMerge(PageBlock upper, PageBlock lower, float maxGap) {
        float gap = lower.getTop() - upper.getBottom();
        if (gap < 0 || gap > maxGap) {
            return false;
        }
        if (upper.horizontalOverlapRatio(lower) < MIN_OVERLAP) {
            return false;
        }
        return Math.abs(upper.getFontSize() - lower.getFontSize()) <= FONT_SIZE_TOLERANCE * upper.getFontSize();
    }

}
