package technology.pagegrid;

/**
 * 取得某个矩形区域内文本的回调，用于填充单元格内容。
 */
public interface CellTextSource {

    String getTextUnderRect(Rectangle area);

}
