package technology.pagegrid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.strtree.STRtree;

/**
 * 基于 STRtree 的矩形空间索引。
 *
 * <p>
 * 使用 JTS 的 STRtree 提供相交查询。树中存放的是对象的插入序号，查询结果据此按插入顺序返回。
 * STRtree 在第一次查询时构建，之后不能再添加对象。
 * </p>
 *
 * @param <T> 存储的矩形类型，必须继承自 Rectangle
 */
public class RectangleSpatialIndex<T extends Rectangle> {

    private final STRtree si = new STRtree();

    private final List<T> items = new ArrayList<>();

    public void add(T te) {
        si.insert(envelopeOf(te), items.size());
        items.add(te);
    }

    /**
     * 返回包络与 r 相交的对象（未经精确检查），按插入顺序。
     */
    public List<T> intersects(Rectangle r) {
        List<Integer> indexes = new ArrayList<>();
        for (Object o : si.query(envelopeOf(r))) {
            indexes.add((Integer) o);
        }
        Collections.sort(indexes);
        List<T> rv = new ArrayList<>(indexes.size());
        for (int i : indexes) {
            rv.add(items.get(i));
        }
        return rv;
    }

    /**
     * 返回与 r 的交集面积超过自身面积 ratio 倍的对象，按插入顺序。
     *
     * 面积为 0 的对象（例如空格的零宽框）不会被返回。
     */
    public List<T> overlapping(Rectangle r, float ratio) {
        List<T> rv = new ArrayList<T>();
        for (T item : intersects(r)) {
            float area = item.getArea();
            if (area > 0 && item.intersectionArea(r) > ratio * area) {
                rv.add(item);
            }
        }
        return rv;
    }

    private static Envelope envelopeOf(Rectangle r) {
        return new Envelope(r.getLeft(), r.getRight(), r.getTop(), r.getBottom());
    }

}
