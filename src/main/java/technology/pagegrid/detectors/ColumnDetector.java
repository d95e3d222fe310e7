package technology.pagegrid.detectors;

import java.util.ArrayList;
import java.util.List;

import technology.pagegrid.Column;
import technology.pagegrid.PageBlock;

/**
 * 基于 x 方向占用直方图的分栏检测。
 *
 * <p>
 * 页面宽度划分为 min(1000, max(1, ⌊宽度/2⌋)) 个等宽的箱，每个块使其覆盖的所有箱计数加一。
 * 宽度超过 {@value #MIN_RUN_BINS} 个箱的零占用区间，以及接触页面左右边缘的零占用区间（页边距）是分隔区；
 * 分隔区之间宽度超过 {@value #MIN_RUN_BINS} 个箱的内容区间成为分栏。
 * </p>
 *
 * <p>
 * 检测到的分栏被扩展为对 [0, 页面宽度] 的划分：第一栏从 0 开始，最后一栏到页面宽度结束，
 * 相邻两栏在分隔区中点相接。没有检测到分栏（但有块）时返回一个覆盖整个页面宽度的分栏。
 * </p>
 */
public final class ColumnDetector {

    static final int MAX_BINS = 1000;

    static final int MIN_RUN_BINS = 5;

    private ColumnDetector() {
    }

    /**
     * 检测分栏并把每个块分配到一个分栏，分配后各分栏的统计量已重新计算。
     *
     * @return 从左到右的分栏，编号从 0 开始；没有块时为空列表
     */
    public static List<Column> detectColumns(List<PageBlock> blocks, float pageWidth) {
        List<Column> columns = new ArrayList<>();
        if (blocks.isEmpty() || pageWidth <= 0) {
            return columns;
        }

        int binCount = binCount(pageWidth);
        float binWidth = pageWidth / binCount;
        int[] occupancy = occupancy(blocks, binCount, binWidth);

        List<int[]> spans = contentSpans(occupancy);
        if (spans.isEmpty()) {
            columns.add(new Column(0, 0, pageWidth));
        } else {
            for (int i = 0; i < spans.size(); i++) {
                float x0 = i == 0 ? 0 : midpoint(spans.get(i - 1)[1], spans.get(i)[0], binWidth);
                float x1 = i == spans.size() - 1 ? pageWidth : midpoint(spans.get(i)[1], spans.get(i + 1)[0], binWidth);
                columns.add(new Column(i, x0, x1));
            }
        }

        for (PageBlock b : blocks) {
            columns.get(assign(b, columns)).addBlock(b);
        }
        for (Column c : columns) {
            c.recomputeStatistics();
        }
        return columns;
    }

    static int binCount(float pageWidth) {
        return Math.min(MAX_BINS, Math.max(1, (int) Math.floor(pageWidth / 2)));
    }

    static int[] occupancy(List<PageBlock> blocks, int binCount, float binWidth) {
        int[] occupancy = new int[binCount];
        for (PageBlock b : blocks) {
            int first = clamp((int) Math.floor(b.getLeft() / binWidth), binCount);
            int last = clamp((int) Math.ceil(b.getRight() / binWidth) - 1, binCount);
            for (int i = first; i <= Math.max(first, last); i++) {
                occupancy[i]++;
            }
        }
        return occupancy;
    }

    /**
     * 分隔区之间宽度超过阈值的内容区间，每项为 [起始箱, 结束箱)。
     */
    static List<int[]> contentSpans(int[] occupancy) {
        int n = occupancy.length;
        List<int[]> separators = new ArrayList<>();
        int i = 0;
        while (i < n) {
            if (occupancy[i] != 0) {
                i++;
                continue;
            }
            int start = i;
            while (i < n && occupancy[i] == 0) {
                i++;
            }
            if (i - start > MIN_RUN_BINS || start == 0 || i == n) {
                separators.add(new int[] { start, i });
            }
        }

        List<int[]> spans = new ArrayList<>();
        int cursor = 0;
        for (int[] sep : separators) {
            addSpan(spans, cursor, sep[0]);
            cursor = sep[1];
        }
        addSpan(spans, cursor, n);
        return spans;
    }

    private static void addSpan(List<int[]> spans, int start, int end) {
        if (end - start > MIN_RUN_BINS) {
            spans.add(new int[] { start, end });
        }
    }

    private static float midpoint(int leftEnd, int rightStart, float binWidth) {
        return (leftEnd + rightStart) / 2f * binWidth;
    }

    private static int clamp(int bin, int binCount) {
        return Math.max(0, Math.min(binCount - 1, bin));
    }

    /**
     * 重叠比例（重叠长度 / min(块宽, 栏宽)）最大的分栏，相同时取编号最小者；
     * 与所有分栏都不重叠时取包含（或最接近）块中心 x 的分栏。
     */
    static int assign(PageBlock block, List<Column> columns) {
        int best = -1;
        float bestRatio = 0;
        for (int i = 0; i < columns.size(); i++) {
            Column c = columns.get(i);
            float overlap = Math.min(block.getRight(), c.getX1()) - Math.max(block.getLeft(), c.getX0());
            float minWidth = Math.min((float) block.getWidth(), c.getWidth());
            float ratio = overlap > 0 && minWidth > 0 ? overlap / minWidth : 0;
            if (ratio > bestRatio) {
                bestRatio = ratio;
                best = i;
            }
        }
        if (best >= 0) {
            return best;
        }

        float center = block.getCenterXf();
        float bestDistance = Float.MAX_VALUE;
        best = 0;
        for (int i = 0; i < columns.size(); i++) {
            float d = columns.get(i).distanceTo(center);
            if (d < bestDistance) {
                bestDistance = d;
                best = i;
            }
        }
        return best;
    }

}
