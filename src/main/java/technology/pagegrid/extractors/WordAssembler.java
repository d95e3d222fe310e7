package technology.pagegrid.extractors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import technology.pagegrid.TextChunk;
import technology.pagegrid.TextElement;

/**
 * 把按阅读顺序排列的字符拼接成单词（TextChunk）。
 *
 * 满足以下任一条件时结束当前单词：
 * - 当前字符为空白（空白字符本身被丢弃）
 * - 当前字符与上一字符的书写方向（upright）不同
 * - 横排：两字符框的水平间距超过 xTolerance，或基线相差超过 yTolerance
 * - 竖排：两字符框的垂直间距超过 yTolerance，或 left 相差超过 xTolerance
 *
 * 输入结束时未结束的单词同样输出。
 */
public class WordAssembler {

    private static final Map<String, String> LIGATURES;

    static {
        Map<String, String> m = new HashMap<>();
        m.put("ﬀ", "ff");
        m.put("ﬃ", "ffi");
        m.put("ﬄ", "ffl");
        m.put("ﬁ", "fi");
        m.put("ﬂ", "fl");
        m.put("ﬆ", "st");
        m.put("ﬅ", "st");
        LIGATURES = Collections.unmodifiableMap(m);
    }

    private final float xTolerance;
    private final float yTolerance;
    private final boolean expandLigatures;

    public WordAssembler(float xTolerance, float yTolerance, boolean expandLigatures) {
        this.xTolerance = xTolerance;
        this.yTolerance = yTolerance;
        this.expandLigatures = expandLigatures;
    }

    public WordAssembler(float xTolerance, float yTolerance) {
        this(xTolerance, yTolerance, true);
    }

    /**
     * 连字字形展开为对应的字母序列，其他文本原样返回。
     */
    public static String expandLigature(String text) {
        String expanded = LIGATURES.get(text);
        return expanded != null ? expanded : text;
    }

    public List<TextChunk> assemble(List<TextElement> characters) {
        List<TextChunk> words = new ArrayList<>();
        TextChunk current = null;
        TextElement prev = null;

        for (TextElement chr : characters) {
            if (chr.isWhitespace()) {
                close(current, words);
                current = null;
                prev = null;
                continue;
            }

            if (current != null && startsNewWord(prev, chr)) {
                close(current, words);
                current = null;
            }

            String text = expandLigatures ? expandLigature(chr.getText()) : chr.getText();
            if (current == null) {
                current = new TextChunk(chr, text);
            } else {
                current.add(chr, text);
            }
            prev = chr;
        }
        close(current, words);
        return words;
    }

    private boolean startsNewWord(TextElement prev, TextElement chr) {
        if (prev.isUpright() != chr.isUpright()) {
            return true;
        }
        if (chr.isUpright()) {
            float gap = Math.max(chr.getLeft() - prev.getRight(), prev.getLeft() - chr.getRight());
            return gap > xTolerance || Math.abs(chr.getBaseline() - prev.getBaseline()) > yTolerance;
        }
        float gap = Math.max(chr.getTop() - prev.getBottom(), prev.getTop() - chr.getBottom());
        return gap > yTolerance || Math.abs(chr.getLeft() - prev.getLeft()) > xTolerance;
    }

    private static void close(TextChunk word, List<TextChunk> words) {
        if (word == null) {
            return;
        }
        List<TextElement> chars = word.getTextElements();
        TextElement first = chars.get(0);
        TextElement last = chars.get(chars.size() - 1);
        if (word.isUpright()) {
            word.setDirection(last.getLeft() < first.getLeft() ? -1 : 1);
        } else {
            word.setDirection(last.getTop() < first.getTop() ? -1 : 1);
        }
        words.add(word);
    }

}
