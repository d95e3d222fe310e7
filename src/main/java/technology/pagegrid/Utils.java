package technology.pagegrid;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * 几何计算与一维聚类的静态工具方法。
 */
public class Utils {

    /**
     * 一维聚类中视为“同一个值”的距离，保证聚类结果与输入顺序无关。
     */
    public static final float CLUSTER_EPSILON = 1e-3f;

    private Utils() {
    }

    public static float round(double d, int decimalPlace) {
        BigDecimal bd = new BigDecimal(Double.toString(d));
        bd = bd.setScale(decimalPlace, RoundingMode.HALF_UP);
        return bd.floatValue();
    }

    /**
     * 区间重叠比例：重叠长度 / 较短区间的长度。较短区间长度为 0 时返回 0。
     */
    public static float overlapRatio(float a0, float a1, float b0, float b1) {
        float overlap = Math.max(0, Math.min(a1, b1) - Math.max(a0, b0));
        float minSpan = Math.min(a1 - a0, b1 - b0);
        return minSpan > 0 ? overlap / minSpan : 0;
    }

    /**
     * 稳定排序（List.sort 使用归并排序，相等元素保持原有顺序）。
     */
    public static <T> void sort(List<T> list, Comparator<? super T> comparator) {
        list.sort(comparator);
    }

    /**
     * 中位数：升序排列后下标为 n/2 的元素（偶数个元素时取靠上的一个）。空集合返回 NaN。
     */
    public static float median(Collection<java.lang.Float> values) {
        if (values.isEmpty()) {
            return java.lang.Float.NaN;
        }
        float[] sorted = new float[values.size()];
        int i = 0;
        for (java.lang.Float v : values) {
            sorted[i++] = v;
        }
        Arrays.sort(sorted);
        return sorted[sorted.length / 2];
    }

    /**
     * 一维聚类：把数值升序排列，相邻两值之差超过 tolerance 时开启新簇。
     *
     * <p>
     * 返回与输入一一对应的簇编号，编号按簇中数值从小到大分配（0 起）。相差不超过
     * {@link #CLUSTER_EPSILON} 的值总在同一簇中，与输入顺序无关。
     * </p>
     *
     * @param values    待聚类的数值
     * @param tolerance 簇内相邻值的最大间距
     * @return 每个输入值的簇编号
     */
    public static int[] cluster(float[] values, float tolerance) {
        int n = values.length;
        int[] ids = new int[n];
        if (n == 0) {
            return ids;
        }
        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        Arrays.sort(order, (a, b) -> java.lang.Float.compare(values[a], values[b]));

        float threshold = Math.max(tolerance, CLUSTER_EPSILON);
        int current = 0;
        ids[order[0]] = 0;
        for (int k = 1; k < n; k++) {
            if (values[order[k]] - values[order[k - 1]] > threshold) {
                current++;
            }
            ids[order[k]] = current;
        }
        return ids;
    }

    /**
     * 按键值对对象做一维聚类，返回按簇编号排序的分组（组内保持原有顺序）。
     */
    public static <T> List<List<T>> clusterObjects(List<T> objects, KeyFunction<? super T> key, float tolerance) {
        float[] values = new float[objects.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = key.apply(objects.get(i));
        }
        int[] ids = cluster(values, tolerance);
        int clusterCount = 0;
        for (int id : ids) {
            clusterCount = Math.max(clusterCount, id + 1);
        }
        List<List<T>> rv = new ArrayList<>(clusterCount);
        for (int i = 0; i < clusterCount; i++) {
            rv.add(new ArrayList<T>());
        }
        for (int i = 0; i < ids.length; i++) {
            rv.get(ids[i]).add(objects.get(i));
        }
        return rv;
    }

    /**
     * 聚类使用的数值键。
     */
    public interface KeyFunction<T> {
        float apply(T t);
    }

}
