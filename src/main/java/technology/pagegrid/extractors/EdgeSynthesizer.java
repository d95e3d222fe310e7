package technology.pagegrid.extractors;

import java.util.ArrayList;
import java.util.List;

import technology.pagegrid.Edge;
import technology.pagegrid.Rectangle;
import technology.pagegrid.TextChunk;
import technology.pagegrid.Utils;

/**
 * 生成候选表格线。
 *
 * <p>
 * 文本策略根据单词的对齐关系推断表格线：
 * </p>
 * <ul>
 * <li>水平线：按单词 top 聚类（容差 1.0），成员数不少于阈值的簇在其外接框的顶边和底边各产生一条水平线</li>
 * <li>垂直线：每个单词贡献 left/right/center 三个坐标一起聚类（容差 1.0），成员数不少于阈值的簇取均值 x，
 * 收集 left/right/center 任一落在均值 2.0 以内的单词，按这些单词的垂直范围产生一条垂直线</li>
 * </ul>
 *
 * <p>
 * 线条策略把矢量路径矩形转换为表格线：较窄一边小于 {@value #THIN_PATH} 的矩形视为一条线，
 * 否则四条边各产生一条线。
 * </p>
 */
public final class EdgeSynthesizer {

    static final float CLUSTER_TOLERANCE = 1.0f;

    static final float WORD_ALIGNMENT_TOLERANCE = 2.0f;

    static final float THIN_PATH = 2.0f;

    private EdgeSynthesizer() {
    }

    public static List<Edge> wordsToEdgesH(List<TextChunk> words, int minWords) {
        List<Edge> edges = new ArrayList<>();
        if (words.isEmpty() || words.size() < minWords) {
            return edges;
        }
        List<List<TextChunk>> clusters = Utils.clusterObjects(words, new Utils.KeyFunction<TextChunk>() {
            @Override
            public float apply(TextChunk t) {
                return t.getTop();
            }
        }, CLUSTER_TOLERANCE);

        for (List<TextChunk> cluster : clusters) {
            if (cluster.size() < minWords) {
                continue;
            }
            Rectangle bbox = Rectangle.boundingBoxOf(cluster);
            edges.add(Edge.horizontal(bbox.getTop(), bbox.getLeft(), bbox.getRight(), Edge.Source.TEXT));
            edges.add(Edge.horizontal(bbox.getBottom(), bbox.getLeft(), bbox.getRight(), Edge.Source.TEXT));
        }
        return edges;
    }

    public static List<Edge> wordsToEdgesV(List<TextChunk> words, int minWords) {
        List<Edge> edges = new ArrayList<>();
        if (words.isEmpty() || words.size() < minWords) {
            return edges;
        }
        int n = words.size();
        float[] coords = new float[n * 3];
        for (int i = 0; i < n; i++) {
            TextChunk w = words.get(i);
            coords[i * 3] = w.getLeft();
            coords[i * 3 + 1] = w.getRight();
            coords[i * 3 + 2] = w.getCenterXf();
        }
        int[] ids = Utils.cluster(coords, CLUSTER_TOLERANCE);
        int clusterCount = 0;
        for (int id : ids) {
            clusterCount = Math.max(clusterCount, id + 1);
        }
        float[] sums = new float[clusterCount];
        int[] counts = new int[clusterCount];
        for (int i = 0; i < coords.length; i++) {
            sums[ids[i]] += coords[i];
            counts[ids[i]]++;
        }

        for (int cid = 0; cid < clusterCount; cid++) {
            if (counts[cid] < minWords) {
                continue;
            }
            float mean = sums[cid] / counts[cid];
            List<TextChunk> aligned = new ArrayList<>();
            for (TextChunk w : words) {
                if (Math.abs(w.getLeft() - mean) <= WORD_ALIGNMENT_TOLERANCE
                        || Math.abs(w.getRight() - mean) <= WORD_ALIGNMENT_TOLERANCE
                        || Math.abs(w.getCenterXf() - mean) <= WORD_ALIGNMENT_TOLERANCE) {
                    aligned.add(w);
                }
            }
            if (aligned.isEmpty()) {
                continue;
            }
            Rectangle bbox = Rectangle.boundingBoxOf(aligned);
            edges.add(Edge.vertical(mean, bbox.getTop(), bbox.getBottom(), Edge.Source.TEXT));
        }
        return edges;
    }

    /**
     * 矢量路径矩形转换为表格线，结果只包含指定方向的线。
     */
    public static List<Edge> pathsToEdges(List<Rectangle> paths, Edge.Orientation orientation) {
        List<Edge> edges = new ArrayList<>();
        for (Rectangle r : paths) {
            float w = (float) r.getWidth();
            float h = (float) r.getHeight();
            if (w <= 0 && h <= 0) {
                continue;
            }
            boolean thinVertical = w < THIN_PATH && h >= w;
            boolean thinHorizontal = h < THIN_PATH && w > h;
            if (orientation == Edge.Orientation.HORIZONTAL) {
                if (thinHorizontal) {
                    float y = (r.getTop() + r.getBottom()) / 2f;
                    edges.add(Edge.horizontal(y, r.getLeft(), r.getRight(), Edge.Source.PATH));
                } else if (!thinVertical) {
                    edges.add(Edge.horizontal(r.getTop(), r.getLeft(), r.getRight(), Edge.Source.PATH));
                    edges.add(Edge.horizontal(r.getBottom(), r.getLeft(), r.getRight(), Edge.Source.PATH));
                }
            } else {
                if (thinVertical) {
                    float x = (r.getLeft() + r.getRight()) / 2f;
                    edges.add(Edge.vertical(x, r.getTop(), r.getBottom(), Edge.Source.PATH));
                } else if (!thinHorizontal) {
                    edges.add(Edge.vertical(r.getLeft(), r.getTop(), r.getBottom(), Edge.Source.PATH));
                    edges.add(Edge.vertical(r.getRight(), r.getTop(), r.getBottom(), Edge.Source.PATH));
                }
            }
        }
        return edges;
    }

}
