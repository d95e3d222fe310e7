package technology.pagegrid.detectors;

import java.util.ArrayList;
import java.util.List;

import technology.pagegrid.Column;
import technology.pagegrid.PageBlock;

/**
 * 把分栏中的文本块标记为表格候选（{@link PageBlock.BlockType#TABLE_CELL}）。
 *
 * 满足任一条件即为候选：
 * <ul>
 * <li>宽度小于栏内块宽中位数的 0.7 倍，且对齐度大于 0.3</li>
 * <li>宽度小于栏宽的 0.6 倍，且对齐度大于 0.2</li>
 * <li>栏内至少有 2 个其他块的宽度与它相差不超过 20%</li>
 * </ul>
 * 对齐度是栏内其他块中 left 或 right 与它相差在 5 以内的比例。
 *
 * 所有判断都基于分类前的快照，标记只增不减。非 TEXT 块不参与分类。
 */
public final class BlockClassifier {

    static final float ALIGNMENT_TOLERANCE = 5.0f;

    static final float NARROW_FACTOR = 0.7f;
    static final float NARROW_ALIGNMENT = 0.3f;

    static final float COLUMN_FRACTION = 0.6f;
    static final float COLUMN_ALIGNMENT = 0.2f;

    static final float SIMILAR_WIDTH = 0.2f;
    static final int MIN_SIMILAR_BLOCKS = 2;

    private BlockClassifier() {
    }

    /**
     * @return 本次新标记的表格候选块数量
     */
    public static int classify(Column column) {
        List<PageBlock> blocks = column.getBlocks();
        float medianWidth = column.getMedianWidth();

        List<PageBlock> candidates = new ArrayList<>();
        for (PageBlock b : blocks) {
            if (b.isText() && isTableCandidate(b, blocks, medianWidth, column.getWidth())) {
                candidates.add(b);
            }
        }
        for (PageBlock b : candidates) {
            b.setType(PageBlock.BlockType.TABLE_CELL);
        }
        return candidates.size();
    }

    static boolean isTableCandidate(PageBlock block, List<PageBlock> blocks, float medianWidth, float columnWidth) {
        float width = (float) block.getWidth();
        float alignment = alignmentScore(block, blocks);
        if (width < NARROW_FACTOR * medianWidth && alignment > NARROW_ALIGNMENT) {
            return true;
        }
        if (width < COLUMN_FRACTION * columnWidth && alignment > COLUMN_ALIGNMENT) {
            return true;
        }
        return similarWidthCount(block, blocks) >= MIN_SIMILAR_BLOCKS;
    }

    /**
     * 其他块中 left 或 right 与 block 相差在 {@value #ALIGNMENT_TOLERANCE} 以内的比例。
     */
    static float alignmentScore(PageBlock block, List<PageBlock> blocks) {
        int others = 0;
        int aligned = 0;
        for (PageBlock other : blocks) {
            if (other == block) {
                continue;
            }
            others++;
            if (Math.abs(other.getLeft() - block.getLeft()) <= ALIGNMENT_TOLERANCE
                    || Math.abs(other.getRight() - block.getRight()) <= ALIGNMENT_TOLERANCE) {
                aligned++;
            }
        }
        return others == 0 ? 0 : (float) aligned / others;
    }

    private static int similarWidthCount(PageBlock block, List<PageBlock> blocks) {
        float width = (float) block.getWidth();
        if (width <= 0) {
            return 0;
        }
        int count = 0;
        for (PageBlock other : blocks) {
            if (other != block && Math.abs(width - (float) other.getWidth()) / width < SIMILAR_WIDTH) {
                count++;
            }
        }
        return count;
    }

}
