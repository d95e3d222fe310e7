package technology.pagegrid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单页处理结果：表格、每张表格的 Markdown 以及版面分析结果。
 *
 * 页面处理失败（内容无法读取、资源超限或超时）时结果为空，并带有失败原因。
 */
public class PageResult {

    private final int pageIndex;
    private final List<Table> tables;
    private final List<String> markdown;
    private final PageLayout layout;
    private final String failureReason;

    public PageResult(int pageIndex, List<Table> tables, List<String> markdown, PageLayout layout) {
        this(pageIndex, tables, markdown, layout, null);
    }

    private PageResult(int pageIndex, List<Table> tables, List<String> markdown, PageLayout layout,
            String failureReason) {
        this.pageIndex = pageIndex;
        this.tables = Collections.unmodifiableList(new ArrayList<>(tables));
        this.markdown = Collections.unmodifiableList(new ArrayList<>(markdown));
        this.layout = layout;
        this.failureReason = failureReason;
    }

    public static PageResult failed(int pageIndex, String reason) {
        return new PageResult(pageIndex, Collections.<Table>emptyList(), Collections.<String>emptyList(),
                PageLayout.empty(0, 0), reason);
    }

    public int getPageIndex() {
        return pageIndex;
    }

    public List<Table> getTables() {
        return tables;
    }

    public List<String> getMarkdown() {
        return markdown;
    }

    public PageLayout getLayout() {
        return layout;
    }

    public boolean isFailed() {
        return failureReason != null;
    }

    public String getFailureReason() {
        return failureReason;
    }

    @Override
    public String toString() {
        if (isFailed()) {
            return String.format("PageResult[page=%d,failed=%s]", pageIndex, failureReason);
        }
        return String.format("PageResult[page=%d,tables=%d,columns=%d,regions=%d]", pageIndex, tables.size(),
                layout.getColumns().size(), layout.getRegions().size());
    }

}
