package technology.pagegrid.pdf;

import org.apache.fontbox.util.BoundingBox;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDFontDescriptor;
import org.apache.pdfbox.pdmodel.font.PDType3Font;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import technology.pagegrid.TextElement;
import technology.pagegrid.Utils;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 基于 PDFBox 的 PDFTextStripper 从单个 PDF 页面中提取字符（TextElement）。
 *
 * <p>
 * 字符按位置排序后依次输出（阅读顺序）。坐标系原点在页面左上角。
 * 不可打印字符被丢弃，非断行空格替换为普通空格，异常高或字号异常的空白字符被丢弃。
 * </p>
 */
public class TextStripper extends PDFTextStripper {
  // 非断行空格字符，用于替换为普通空格
  private static final String NBSP = "\u00A0";
  // 用于丢弃过高空白字符的高度阈值倍数 (avgHeight * AVG_HEIGHT_MULT_THRESHOLD)
  private static final float AVG_HEIGHT_MULT_THRESHOLD = 6.0f;
  // 允许的最大空白字符字号（超过则丢弃）
  private static final float MAX_BLANK_FONT_SIZE = 40.0f;
  // 允许的最小空白字符字号（小于则丢弃）
  private static final float MIN_BLANK_FONT_SIZE = 2.0f;

  private final PDDocument document;
  private final int pageIndex;
  // 之前各页高度之和，用于计算 doctop
  private final float pageOffset;
  private final List<TextElement> textElements;

  private float totalHeight = 0.0f;
  private int countHeight = 0;

  /**
   * @param document   要处理的 PDF 文档
   * @param pageIndex  页码（0 起）
   * @param pageOffset 之前各页的高度之和
   * @throws IOException 由 PDFTextStripper 抛出
   */
  public TextStripper(PDDocument document, int pageIndex, float pageOffset) throws IOException {
    super();
    this.document = document;
    this.pageIndex = pageIndex;
    this.pageOffset = pageOffset;
    this.setStartPage(pageIndex + 1);
    this.setEndPage(pageIndex + 1);
    this.setSortByPosition(true);
    this.textElements = new ArrayList<>();
  }

  /**
   * 解析页面并填充字符列表。
   *
   * @throws IOException 若读取 PDF 失败
   */
  public void process() throws IOException {
    this.getText(this.document);
  }

  @Override
  protected void writeString(String string, List<TextPosition> textPositions) throws IOException {
    for (TextPosition textPosition : textPositions) {
      if (textPosition == null) {
        continue;
      }

      String c = textPosition.getUnicode();
      if (c == null || !isPrintable(c)) {
        continue;
      }
      if (c.equals(NBSP)) {
        c = " ";
      }

      float h = textPosition.getHeightDir();
      float top = Utils.round(textPosition.getYDirAdj() - h, 2);
      float height = Utils.round(h, 2);
      float dir = textPosition.getDir();
      boolean upright = dir == 0 || dir == 180;
      PDFont font = textPosition.getFont();
      String fontName = font != null ? font.getName() : null;

      TextElement te = new TextElement(top, Utils.round(textPosition.getXDirAdj(), 2),
          Utils.round(textPosition.getWidthDirAdj(), 2), height, c, fontName, textPosition.getFontSizeInPt(),
          top + height, pageOffset + top, upright, pageIndex);

      countHeight++;
      totalHeight += te.getHeight();
      float avgHeight = totalHeight / countHeight;

      if (te.isWhitespace()) {
        if (avgHeight > 0 && te.getHeight() >= (avgHeight * AVG_HEIGHT_MULT_THRESHOLD)) {
          continue;
        }
        if (textPosition.getFontSizeInPt() > MAX_BLANK_FONT_SIZE
            || textPosition.getFontSizeInPt() < MIN_BLANK_FONT_SIZE) {
          continue;
        }
      }
      this.textElements.add(te);
    }
  }

  /**
   * 字体高度：取字形边界框高度的一半，字体描述符给出更小的 capHeight 或 (ascent - descent) / 2 时取后者。
   */
  @Override
  protected float computeFontHeight(PDFont font) throws IOException {
    BoundingBox bbox = font.getBoundingBox();
    if (bbox.getLowerLeftY() < Short.MIN_VALUE) {
      // PDFBOX-2158 / PDFBOX-3130
      bbox.setLowerLeftY(-(bbox.getLowerLeftY() + 65536));
    }
    float glyphHeight = bbox.getHeight() / 2;

    PDFontDescriptor fontDescriptor = font.getFontDescriptor();
    if (fontDescriptor != null) {
      float capHeight = fontDescriptor.getCapHeight();
      if (Float.compare(capHeight, 0) != 0 &&
          (capHeight < glyphHeight || Float.compare(glyphHeight, 0) == 0)) {
        glyphHeight = capHeight;
      }
      float ascent = fontDescriptor.getAscent();
      float descent = fontDescriptor.getDescent();
      if (ascent > 0 && descent < 0 &&
          ((ascent - descent) / 2 < glyphHeight || Float.compare(glyphHeight, 0) == 0)) {
        glyphHeight = (ascent - descent) / 2;
      }
    }

    if (font instanceof PDType3Font) {
      return font.getFontMatrix().transformPoint(0, glyphHeight).y;
    }
    return glyphHeight / 1000;
  }

  private boolean isPrintable(String s) {
    boolean printable = false;
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      Character.UnicodeBlock block = Character.UnicodeBlock.of(c);
      printable |= !Character.isISOControl(c) && block != null && block != Character.UnicodeBlock.SPECIALS;
    }
    return printable;
  }

  public List<TextElement> getTextElements() {
    return this.textElements;
  }

}
