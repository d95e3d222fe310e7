package technology.pagegrid;

import java.util.List;

/**
 * 页面内容的提供方：按页给出字符、矢量路径矩形与版面块。
 *
 * <p>
 * 页码从 0 开始。字符按阅读顺序返回；没有矢量路径或版面块的页面返回空列表。
 * 实现方在无法读取页面内容时抛出 {@link ExtractionFailureException}。
 * </p>
 */
public interface PageSource {

    int getPageCount();

    float getPageWidth(int pageIndex) throws ExtractionFailureException;

    float getPageHeight(int pageIndex) throws ExtractionFailureException;

    List<TextElement> getCharacters(int pageIndex) throws ExtractionFailureException;

    List<Rectangle> getVectorPaths(int pageIndex) throws ExtractionFailureException;

    List<PageBlock> getTextBlocks(int pageIndex) throws ExtractionFailureException;

}
