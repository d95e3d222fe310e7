package technology.pagegrid.extractors;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import technology.pagegrid.Cell;
import technology.pagegrid.Rectangle;
import technology.pagegrid.Table;
import technology.pagegrid.Utils;

/**
 * 把单元格按连通关系组装成表格。
 *
 * 两个单元格至少有一个角点重合（容差 {@link technology.pagegrid.Intersection#EPSILON}）即属于同一张表。
 * 少于 2 个单元格的连通分量，以及只有一列的连通分量（不同的 left 或 right 少于 2 个）被丢弃。
 */
public final class TableAssembler {

    static final float ROW_TOLERANCE = 1.0f;

    static final float COLUMN_EDGE_TOLERANCE = 0.1f;

    private TableAssembler() {
    }

    /**
     * @return 按 (top, left) 排序的表格，行列已填充，页码为 0
     */
    public static List<Table> assemble(List<Cell> cells, String extractionMethod) {
        List<Table> tables = new ArrayList<>();
        for (List<Cell> group : groupCells(cells)) {
            if (group.size() < 2 || isSingleColumn(group)) {
                continue;
            }
            tables.add(toTable(group, extractionMethod));
        }
        Utils.sort(tables, Rectangle.TOP_LEFT_ORDER);
        return tables;
    }

    /**
     * 连通分量，每个分量内的单元格保持 (top, left) 顺序。
     */
    public static List<List<Cell>> groupCells(List<Cell> cells) {
        List<Cell> sorted = new ArrayList<>(cells);
        Utils.sort(sorted, Rectangle.TOP_LEFT_ORDER);
        boolean[] used = new boolean[sorted.size()];

        List<List<Cell>> groups = new ArrayList<>();
        for (int seed = 0; seed < sorted.size(); seed++) {
            if (used[seed]) {
                continue;
            }
            used[seed] = true;
            List<Integer> members = new ArrayList<>();
            Deque<Integer> worklist = new ArrayDeque<>();
            worklist.add(seed);
            while (!worklist.isEmpty()) {
                int current = worklist.poll();
                members.add(current);
                for (int k = 0; k < sorted.size(); k++) {
                    if (!used[k] && sorted.get(current).sharesCornerWith(sorted.get(k))) {
                        used[k] = true;
                        worklist.add(k);
                    }
                }
            }
            members.sort(null);
            List<Cell> group = new ArrayList<>(members.size());
            for (int idx : members) {
                group.add(sorted.get(idx));
            }
            groups.add(group);
        }
        return groups;
    }

    private static boolean isSingleColumn(List<Cell> group) {
        float[] lefts = new float[group.size()];
        float[] rights = new float[group.size()];
        for (int i = 0; i < group.size(); i++) {
            lefts[i] = group.get(i).getLeft();
            rights[i] = group.get(i).getRight();
        }
        return distinct(lefts) < 2 || distinct(rights) < 2;
    }

    private static int distinct(float[] values) {
        int count = 0;
        for (int id : Utils.cluster(values, COLUMN_EDGE_TOLERANCE)) {
            count = Math.max(count, id + 1);
        }
        return count;
    }

    private static Table toTable(List<Cell> group, String extractionMethod) {
        Table table = new Table(extractionMethod);
        List<List<Cell>> rows = Utils.clusterObjects(group, new Utils.KeyFunction<Cell>() {
            @Override
            public float apply(Cell c) {
                return c.getTop();
            }
        }, ROW_TOLERANCE);

        for (int i = 0; i < rows.size(); i++) {
            List<Cell> row = rows.get(i);
            row.sort((a, b) -> Float.compare(a.getLeft(), b.getLeft()));
            for (int j = 0; j < row.size(); j++) {
                table.add(row.get(j), i, j);
            }
        }
        return table;
    }

}
