package technology.pagegrid.detectors;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import technology.pagegrid.Column;
import technology.pagegrid.PageBlock;
import technology.pagegrid.Rectangle;
import technology.pagegrid.TextChunk;
import technology.pagegrid.TextElement;
import technology.pagegrid.Utils;
import technology.pagegrid.extractors.WordAssembler;

/**
 * 由字符构造版面分析使用的文本块。
 *
 * 单词按 top 聚成行（容差 {@link Column#LINE_TOLERANCE}），行内从左到右；
 * 相邻单词的间距超过前一个单词高度的 {@value #SEGMENT_GAP_FACTOR} 倍时断开。
 * 每一段成为一个文本块，字号为字符字号的平均值。多行段落由 {@link AdaptiveMerger} 在之后合并。
 */
public final class TextBlockBuilder {

    static final float SEGMENT_GAP_FACTOR = 2.0f;

    private static final Comparator<TextChunk> BY_LEFT = new Comparator<TextChunk>() {
        @Override
        public int compare(TextChunk a, TextChunk b) {
            return Float.compare(a.getLeft(), b.getLeft());
        }
    };

    private final WordAssembler wordAssembler;

    public TextBlockBuilder(float xTolerance, float yTolerance) {
        this.wordAssembler = new WordAssembler(xTolerance, yTolerance);
    }

    public List<PageBlock> build(List<TextElement> characters) {
        List<TextChunk> words = wordAssembler.assemble(characters);
        List<List<TextChunk>> lines = Utils.clusterObjects(words, new Utils.KeyFunction<TextChunk>() {
            @Override
            public float apply(TextChunk t) {
                return t.getTop();
            }
        }, Column.LINE_TOLERANCE);

        List<PageBlock> blocks = new ArrayList<>();
        for (List<TextChunk> line : lines) {
            line.sort(BY_LEFT);
            List<TextChunk> segment = new ArrayList<>();
            for (TextChunk w : line) {
                if (!segment.isEmpty()) {
                    TextChunk prev = segment.get(segment.size() - 1);
                    if (w.getLeft() - prev.getRight() > SEGMENT_GAP_FACTOR * prev.getHeight()) {
                        blocks.add(toBlock(segment));
                        segment = new ArrayList<>();
                    }
                }
                segment.add(w);
            }
            if (!segment.isEmpty()) {
                blocks.add(toBlock(segment));
            }
        }
        return Column.sortReadingOrder(blocks);
    }

    private static PageBlock toBlock(List<TextChunk> segment) {
        Rectangle bbox = Rectangle.boundingBoxOf(segment);
        StringBuilder text = new StringBuilder();
        float fontSizeSum = 0;
        int chars = 0;
        for (TextChunk w : segment) {
            if (text.length() > 0) {
                text.append(' ');
            }
            text.append(w.getText());
            for (TextElement te : w.getTextElements()) {
                fontSizeSum += te.getFontSize();
                chars++;
            }
        }
        float fontSize = chars > 0 ? fontSizeSum / chars : PageBlock.DEFAULT_FONT_SIZE;
        return new PageBlock(bbox.getTop(), bbox.getLeft(), (float) bbox.getWidth(), (float) bbox.getHeight(),
                PageBlock.BlockType.TEXT, text.toString(), fontSize, chars);
    }

}
