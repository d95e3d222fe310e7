package technology.pagegrid.detectors;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import technology.pagegrid.Column;
import technology.pagegrid.PageBlock;
import technology.pagegrid.TableRegion;

/**
 * 把分栏中的表格候选块聚成表格区域。
 *
 * <p>
 * 两个候选块相互对齐且尺寸相容时相连：
 * 同一行（垂直重叠比例不小于 0.7 且水平间距小于栏内块宽中位数）或同一列（水平重叠比例不小于 0.7
 * 且垂直间距小于栏内块高中位数），并且两者宽度之比不超过 2.5。
 * 候选块少于 4 个时不做聚类。只有一个块的簇以及未参与聚类的候选块恢复为 TEXT。
 * </p>
 */
public final class TableRegionClusterer {

    static final int MIN_CANDIDATES = 4;

    static final float MIN_ALIGNMENT_OVERLAP = 0.7f;

    static final float MAX_SIZE_RATIO = 2.5f;

    private TableRegionClusterer() {
    }

    public static List<TableRegion> cluster(Column column) {
        List<TableRegion> regions = new ArrayList<>();
        List<PageBlock> candidates = column.getBlocks(PageBlock.BlockType.TABLE_CELL);
        if (candidates.size() < MIN_CANDIDATES) {
            revert(candidates);
            return regions;
        }

        float maxHorizontalGap = column.getMedianWidth();
        float maxVerticalGap = column.getMedianHeight();
        boolean[] used = new boolean[candidates.size()];
        for (int seed = 0; seed < candidates.size(); seed++) {
            if (used[seed]) {
                continue;
            }
            used[seed] = true;
            List<PageBlock> members = new ArrayList<>();
            Deque<Integer> worklist = new ArrayDeque<>();
            worklist.add(seed);
            while (!worklist.isEmpty()) {
                PageBlock current = candidates.get(worklist.poll());
                members.add(current);
                for (int k = 0; k < candidates.size(); k++) {
                    if (!used[k] && connected(current, candidates.get(k), maxHorizontalGap, maxVerticalGap)) {
                        used[k] = true;
                        worklist.add(k);
                    }
                }
            }

            if (members.size() < 2) {
                revert(members);
            } else {
                regions.add(new TableRegion(column.getId(), Column.sortReadingOrder(members)));
            }
        }
        return regions;
    }

    static boolean connected(PageBlock a, PageBlock b, float maxHorizontalGap, float maxVerticalGap) {
        boolean sameRow = a.verticalOverlapRatio(b) >= MIN_ALIGNMENT_OVERLAP
                && a.horizontalGap(b) < maxHorizontalGap;
        boolean sameColumn = a.horizontalOverlapRatio(b) >= MIN_ALIGNMENT_OVERLAP
                && a.verticalGap(b) < maxVerticalGap;
        return (sameRow || sameColumn) && compatibleSize(a, b);
    }

    private static boolean compatibleSize(PageBlock a, PageBlock b) {
        float wa = (float) a.getWidth();
        float wb = (float) b.getWidth();
        float min = Math.min(wa, wb);
        return min > 0 && Math.max(wa, wb) / min <= MAX_SIZE_RATIO;
    }

    private static void revert(List<PageBlock> blocks) {
        for (PageBlock b : blocks) {
            b.setType(PageBlock.BlockType.TEXT);
        }
    }

}
