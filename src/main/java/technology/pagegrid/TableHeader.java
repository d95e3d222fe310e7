package technology.pagegrid;

import java.util.Collections;
import java.util.List;

@SuppressWarnings("serial")
/**
 * 表头：表头单元格、列名，以及表头是否来自表格外部（external）。
 *
 * 表头取自表格首行时 external 为 false，导出 markdown 时首行不再作为数据行输出。
 */
public class TableHeader extends Rectangle {

    private final List<Cell> cells;
    private final List<String> names;
    private final boolean external;

    public TableHeader(Rectangle bbox, List<Cell> cells, List<String> names, boolean external) {
        super(bbox.getTop(), bbox.getLeft(), (float) bbox.getWidth(), (float) bbox.getHeight());
        this.cells = Collections.unmodifiableList(cells);
        this.names = Collections.unmodifiableList(names);
        this.external = external;
    }

    public List<Cell> getCells() {
        return cells;
    }

    public List<String> getNames() {
        return names;
    }

    public boolean isExternal() {
        return external;
    }

}
