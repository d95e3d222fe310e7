package technology.pagegrid;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 表格与版面推断的全部可调参数。
 *
 * <p>
 * 参数可以来自 {@code Map}、{@link Properties} 或 classpath 上的 {@value #DEFAULT_RESOURCE}。
 * 未设置的 x/y 分量回退到对应的通用值（例如 {@code snap_x_tolerance} 回退到
 * {@code snap_tolerance}）。未知参数名、无法解析的值以及非负参数的负值都会抛出
 * {@link IllegalArgumentException}。
 * </p>
 *
 * 实例不可变，可在多个线程间共享。
 */
public final class TableSettings {

    private static final Logger logger = LoggerFactory.getLogger(TableSettings.class);

    public static final String DEFAULT_RESOURCE = "pagegrid.properties";

    /**
     * 表格线来源策略。
     */
    public enum Strategy {
        LINES, TEXT;

        public static Strategy fromString(String value) {
            String v = value.trim().toLowerCase(Locale.ROOT);
            if ("lines".equals(v)) {
                return LINES;
            }
            if ("text".equals(v)) {
                return TEXT;
            }
            throw new IllegalArgumentException("Unknown strategy: " + value);
        }

        @Override
        public String toString() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private static final Set<String> KEYS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "vertical_strategy", "horizontal_strategy",
            "snap_tolerance", "snap_x_tolerance", "snap_y_tolerance",
            "join_tolerance", "join_x_tolerance", "join_y_tolerance",
            "edge_min_length", "min_words_vertical", "min_words_horizontal",
            "intersection_tolerance", "intersection_x_tolerance", "intersection_y_tolerance",
            "text_tolerance", "text_x_tolerance", "text_y_tolerance",
            "expand_ligatures", "max_edges", "max_intersections", "page_timeout_ms", "threads",
            "header_margin", "footer_margin")));

    private final Strategy verticalStrategy;
    private final Strategy horizontalStrategy;
    private final float snapXTolerance;
    private final float snapYTolerance;
    private final float joinXTolerance;
    private final float joinYTolerance;
    private final float edgeMinLength;
    private final int minWordsVertical;
    private final int minWordsHorizontal;
    private final float intersectionXTolerance;
    private final float intersectionYTolerance;
    private final float textXTolerance;
    private final float textYTolerance;
    private final boolean expandLigatures;
    private final int maxEdges;
    private final int maxIntersections;
    private final long pageTimeoutMillis;
    private final int threads;
    private final float headerMargin;
    private final float footerMargin;

    private TableSettings(Map<String, ?> values) {
        for (String key : values.keySet()) {
            if (!KEYS.contains(key)) {
                throw new IllegalArgumentException("Unknown setting: " + key);
            }
        }
        this.verticalStrategy = Strategy.fromString(string(values, "vertical_strategy", "lines"));
        this.horizontalStrategy = Strategy.fromString(string(values, "horizontal_strategy", "lines"));

        float snap = nonNegative(values, "snap_tolerance", 3f);
        this.snapXTolerance = nonNegative(values, "snap_x_tolerance", snap);
        this.snapYTolerance = nonNegative(values, "snap_y_tolerance", snap);

        float join = nonNegative(values, "join_tolerance", 3f);
        this.joinXTolerance = nonNegative(values, "join_x_tolerance", join);
        this.joinYTolerance = nonNegative(values, "join_y_tolerance", join);

        this.edgeMinLength = nonNegative(values, "edge_min_length", 3f);
        this.minWordsVertical = (int) nonNegative(values, "min_words_vertical", 3f);
        this.minWordsHorizontal = (int) nonNegative(values, "min_words_horizontal", 1f);

        float intersection = nonNegative(values, "intersection_tolerance", 3f);
        this.intersectionXTolerance = nonNegative(values, "intersection_x_tolerance", intersection);
        this.intersectionYTolerance = nonNegative(values, "intersection_y_tolerance", intersection);

        float text = nonNegative(values, "text_tolerance", 3f);
        this.textXTolerance = nonNegative(values, "text_x_tolerance", text);
        this.textYTolerance = nonNegative(values, "text_y_tolerance", text);

        this.expandLigatures = Boolean.parseBoolean(string(values, "expand_ligatures", "true"));
        this.maxEdges = (int) nonNegative(values, "max_edges", 10000f);
        this.maxIntersections = (int) nonNegative(values, "max_intersections", 50000f);
        this.pageTimeoutMillis = (long) nonNegative(values, "page_timeout_ms", 0f);
        int availableProcessors = Runtime.getRuntime().availableProcessors();
        this.threads = Math.max(1, (int) nonNegative(values, "threads", availableProcessors));
        this.headerMargin = nonNegative(values, "header_margin", 0f);
        this.footerMargin = nonNegative(values, "footer_margin", 0f);
    }

    public static TableSettings defaults() {
        return new TableSettings(Collections.<String, Object>emptyMap());
    }

    public static TableSettings fromMap(Map<String, ?> values) {
        return new TableSettings(values);
    }

    public static TableSettings fromProperties(Properties properties) {
        Map<String, Object> values = new HashMap<>();
        for (String name : properties.stringPropertyNames()) {
            values.put(name, properties.getProperty(name));
        }
        return new TableSettings(values);
    }

    /**
     * 从 classpath 上的 {@value #DEFAULT_RESOURCE} 读取；找不到该资源时使用默认值。
     */
    public static TableSettings load() throws IOException {
        return load(DEFAULT_RESOURCE);
    }

    public static TableSettings load(String resource) throws IOException {
        Properties properties = new Properties();
        try (InputStream input = TableSettings.class.getClassLoader().getResourceAsStream(resource)) {
            if (input == null) {
                logger.debug("{} not found on classpath, using defaults", resource);
                return defaults();
            }
            properties.load(input);
        }
        return fromProperties(properties);
    }

    /**
     * 返回在当前设置上覆盖了 overrides 的新实例。x/y 分量按覆盖后的通用值重新回退。
     */
    public TableSettings with(Map<String, ?> overrides) {
        Map<String, Object> values = new HashMap<>(toMap());
        for (Map.Entry<String, ?> e : overrides.entrySet()) {
            String key = e.getKey();
            if (key.endsWith("_tolerance") && !key.contains("_x_") && !key.contains("_y_")) {
                String prefix = key.substring(0, key.length() - "tolerance".length());
                values.remove(prefix + "x_tolerance");
                values.remove(prefix + "y_tolerance");
            }
            values.put(key, e.getValue());
        }
        return new TableSettings(values);
    }

    /**
     * 全部参数（x/y 分量均已展开）。
     */
    public Map<String, Object> toMap() {
        Map<String, Object> m = new HashMap<>();
        m.put("vertical_strategy", verticalStrategy.toString());
        m.put("horizontal_strategy", horizontalStrategy.toString());
        m.put("snap_x_tolerance", snapXTolerance);
        m.put("snap_y_tolerance", snapYTolerance);
        m.put("join_x_tolerance", joinXTolerance);
        m.put("join_y_tolerance", joinYTolerance);
        m.put("edge_min_length", edgeMinLength);
        m.put("min_words_vertical", minWordsVertical);
        m.put("min_words_horizontal", minWordsHorizontal);
        m.put("intersection_x_tolerance", intersectionXTolerance);
        m.put("intersection_y_tolerance", intersectionYTolerance);
        m.put("text_x_tolerance", textXTolerance);
        m.put("text_y_tolerance", textYTolerance);
        m.put("expand_ligatures", expandLigatures);
        m.put("max_edges", maxEdges);
        m.put("max_intersections", maxIntersections);
        m.put("page_timeout_ms", pageTimeoutMillis);
        m.put("threads", threads);
        m.put("header_margin", headerMargin);
        m.put("footer_margin", footerMargin);
        return m;
    }

    private static String string(Map<String, ?> values, String key, String defaultValue) {
        Object v = values.get(key);
        return v == null ? defaultValue : v.toString();
    }

    private static float nonNegative(Map<String, ?> values, String key, float defaultValue) {
        Object v = values.get(key);
        if (v == null) {
            return defaultValue;
        }
        float f;
        if (v instanceof Number) {
            f = ((Number) v).floatValue();
        } else {
            try {
                f = Float.parseFloat(v.toString().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Setting " + key + " is not a number: " + v, e);
            }
        }
        if (f < 0 || Float.isNaN(f)) {
            throw new IllegalArgumentException("Setting " + key + " must be non-negative: " + v);
        }
        return f;
    }

    public Strategy getVerticalStrategy() {
        return verticalStrategy;
    }

    public Strategy getHorizontalStrategy() {
        return horizontalStrategy;
    }

    public float getSnapXTolerance() {
        return snapXTolerance;
    }

    public float getSnapYTolerance() {
        return snapYTolerance;
    }

    public float getJoinXTolerance() {
        return joinXTolerance;
    }

    public float getJoinYTolerance() {
        return joinYTolerance;
    }

    public float getEdgeMinLength() {
        return edgeMinLength;
    }

    public int getMinWordsVertical() {
        return minWordsVertical;
    }

    public int getMinWordsHorizontal() {
        return minWordsHorizontal;
    }

    public float getIntersectionXTolerance() {
        return intersectionXTolerance;
    }

    public float getIntersectionYTolerance() {
        return intersectionYTolerance;
    }

    public float getTextXTolerance() {
        return textXTolerance;
    }

    public float getTextYTolerance() {
        return textYTolerance;
    }

    public boolean isExpandLigatures() {
        return expandLigatures;
    }

    public int getMaxEdges() {
        return maxEdges;
    }

    public int getMaxIntersections() {
        return maxIntersections;
    }

    public long getPageTimeoutMillis() {
        return pageTimeoutMillis;
    }

    public int getThreads() {
        return threads;
    }

    public float getHeaderMargin() {
        return headerMargin;
    }

    public float getFooterMargin() {
        return footerMargin;
    }

    @Override
    public String toString() {
        return "TableSettings" + toMap();
    }

}
