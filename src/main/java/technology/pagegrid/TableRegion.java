package technology.pagegrid;

import java.util.Collections;
import java.util.List;

@SuppressWarnings("serial")
/**
 * 表格区域：同一分栏中相互对齐的表格候选块组成的簇，边界为成员块的并集。
 */
public class TableRegion extends Rectangle {

    private final int columnId;
    private final List<PageBlock> blocks;

    public TableRegion(int columnId, List<PageBlock> blocks) {
        super();
        this.columnId = columnId;
        this.blocks = Collections.unmodifiableList(blocks);
        this.setRect(Rectangle.boundingBoxOf(blocks));
    }

    public int getColumnId() {
        return columnId;
    }

    public List<PageBlock> getBlocks() {
        return blocks;
    }

}
