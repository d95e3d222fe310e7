package technology.pagegrid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 版面分析结果：分栏、合并后的文本块与表格区域。
 */
public class PageLayout {

    public static PageLayout empty(float pageWidth, float pageHeight) {
        return new PageLayout(pageWidth, pageHeight, new ArrayList<Column>(), new ArrayList<TableRegion>());
    }

    private final float pageWidth;
    private final float pageHeight;
    private final List<Column> columns;
    private final List<TableRegion> regions;

    public PageLayout(float pageWidth, float pageHeight, List<Column> columns, List<TableRegion> regions) {
        this.pageWidth = pageWidth;
        this.pageHeight = pageHeight;
        this.columns = Collections.unmodifiableList(columns);
        this.regions = Collections.unmodifiableList(regions);
    }

    public float getPageWidth() {
        return pageWidth;
    }

    public float getPageHeight() {
        return pageHeight;
    }

    public List<Column> getColumns() {
        return columns;
    }

    public List<TableRegion> getRegions() {
        return regions;
    }

    /**
     * 所有分栏中仍为 TEXT 的块，逐栏按阅读顺序。
     */
    public List<PageBlock> getTextBlocks() {
        List<PageBlock> rv = new ArrayList<>();
        for (Column c : columns) {
            rv.addAll(c.getBlocks(PageBlock.BlockType.TEXT));
        }
        return rv;
    }

    /**
     * 最终的分栏/区域矩形：逐栏先输出文本块，再输出该栏的表格区域。
     */
    public List<Rectangle> getBoxes() {
        List<Rectangle> rv = new ArrayList<>();
        for (Column c : columns) {
            for (PageBlock b : c.getBlocks(PageBlock.BlockType.TEXT)) {
                rv.add(new Rectangle(b.getTop(), b.getLeft(), (float) b.getWidth(), (float) b.getHeight()));
            }
            for (TableRegion r : regions) {
                if (r.getColumnId() == c.getId()) {
                    rv.add(new Rectangle(r.getTop(), r.getLeft(), (float) r.getWidth(), (float) r.getHeight()));
                }
            }
        }
        return rv;
    }

}
