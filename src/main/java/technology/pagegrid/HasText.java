package technology.pagegrid;

/**
 * 携带文本内容的页面对象。
 */
public interface HasText {

    String getText();

}
