package technology.pagegrid.extractors;

import java.util.ArrayList;
import java.util.List;

import technology.pagegrid.Edge;

/**
 * 表格线清理：snap（对齐）、join（连接）、filter（过滤过短线段）。
 *
 * snap 与 join 原地修改传入的列表及其中的线段。
 */
public final class EdgeProcessor {

    private EdgeProcessor() {
    }

    /**
     * 按下标顺序单遍扫描所有同向线段对，位置相差不超过容差的一对线段都移到两者的平均位置。
     *
     * <p>
     * 不做传递闭包：A 与 B、B 与 C 分别接近而 A 与 C 不接近时，三者不一定对齐到同一位置。
     * </p>
     */
    public static void snap(List<Edge> edges, float xTolerance, float yTolerance) {
        for (int i = 0; i < edges.size(); i++) {
            for (int j = i + 1; j < edges.size(); j++) {
                Edge e1 = edges.get(i);
                Edge e2 = edges.get(j);
                if (e1.getOrientation() != e2.getOrientation()) {
                    continue;
                }
                float tolerance = e1.isVertical() ? xTolerance : yTolerance;
                if (Math.abs(e1.getPosition() - e2.getPosition()) <= tolerance) {
                    float avg = (e1.getPosition() + e2.getPosition()) / 2f;
                    e1.setPosition(avg);
                    e2.setPosition(avg);
                }
            }
        }
    }

    /**
     * 连接同向、共线且沿线方向间隙不超过容差的线段：后面的线段并入前面的线段（保留前者的位置）并被移除。
     * 水平线的位置差用 yTolerance、间隙用 xTolerance 判断，垂直线相反。
     * 重复扫描直到没有可连接的线段对，因此结果上再次调用不会有变化。
     */
    public static void join(List<Edge> edges, float xTolerance, float yTolerance) {
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int i = 0; i < edges.size(); i++) {
                for (int j = i + 1; j < edges.size(); j++) {
                    Edge e1 = edges.get(i);
                    Edge e2 = edges.get(j);
                    if (!e1.collinearWith(e2, e1.isHorizontal() ? yTolerance : xTolerance)) {
                        continue;
                    }
                    if (e1.gapTo(e2) <= (e1.isHorizontal() ? xTolerance : yTolerance)) {
                        e1.absorb(e2);
                        edges.remove(j);
                        j--;
                        changed = true;
                    }
                }
            }
        }
    }

    /**
     * 返回长度不小于 minLength 的线段。
     */
    public static List<Edge> filter(List<Edge> edges, float minLength) {
        List<Edge> rv = new ArrayList<>();
        for (Edge e : edges) {
            if (e.length() >= minLength) {
                rv.add(e);
            }
        }
        return rv;
    }

    /**
     * snap（任一 snap 容差大于 0 时）、join、filter 依次执行，返回新列表，不修改传入的线段。
     */
    public static List<Edge> merge(List<Edge> edges, float snapX, float snapY, float joinX, float joinY,
            float minLength) {
        List<Edge> working = Edge.copyOf(edges);
        if (snapX > 0 || snapY > 0) {
            snap(working, snapX, snapY);
        }
        join(working, joinX, joinY);
        return filter(working, minLength);
    }

}
