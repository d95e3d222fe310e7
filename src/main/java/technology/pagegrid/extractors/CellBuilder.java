package technology.pagegrid.extractors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import technology.pagegrid.Cell;
import technology.pagegrid.Intersection;

/**
 * 由交点网格构造单元格。
 *
 * 交点按 (y, x) 排序后依次作为左上角候选 P：按距离由近到远枚举 P 正下方的交点 B 与正右方的交点 R，
 * 第一个右下角 (R.x, B.y) 也是交点的组合产生单元格 [P, 右下角]。每个 P 至多产生一个单元格。
 *
 * 最坏情况 O(n^3)（n 为交点数）。
 */
public final class CellBuilder {

    private static final Comparator<Intersection> BY_X = new Comparator<Intersection>() {
        @Override
        public int compare(Intersection a, Intersection b) {
            return Float.compare(a.x, b.x);
        }
    };

    private static final Comparator<Intersection> BY_Y = new Comparator<Intersection>() {
        @Override
        public int compare(Intersection a, Intersection b) {
            return Float.compare(a.y, b.y);
        }
    };

    private CellBuilder() {
    }

    public static List<Cell> findCells(List<Intersection> intersections) {
        List<Intersection> points = new ArrayList<>(intersections);
        Collections.sort(points, Intersection.YX_ORDER);

        List<Cell> cells = new ArrayList<>();
        for (int i = 0; i < points.size(); i++) {
            Intersection topLeft = points.get(i);

            List<Intersection> below = new ArrayList<>();
            List<Intersection> right = new ArrayList<>();
            for (int j = 0; j < points.size(); j++) {
                Intersection p = points.get(j);
                if (j == i) {
                    continue;
                }
                if (Math.abs(p.x - topLeft.x) <= Intersection.EPSILON && p.y > topLeft.y + Intersection.EPSILON) {
                    below.add(p);
                }
                if (Math.abs(p.y - topLeft.y) <= Intersection.EPSILON && p.x > topLeft.x + Intersection.EPSILON) {
                    right.add(p);
                }
            }
            Collections.sort(below, BY_Y);
            Collections.sort(right, BY_X);

            Cell cell = findCell(points, topLeft, below, right);
            if (cell != null) {
                cells.add(cell);
            }
        }
        return cells;
    }

    private static Cell findCell(List<Intersection> points, Intersection topLeft, List<Intersection> below,
            List<Intersection> right) {
        for (Intersection b : below) {
            for (Intersection r : right) {
                for (Intersection candidate : points) {
                    if (candidate.coincides(r.x, b.y)) {
                        return new Cell(topLeft, candidate);
                    }
                }
            }
        }
        return null;
    }

}
