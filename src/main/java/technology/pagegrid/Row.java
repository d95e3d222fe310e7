package technology.pagegrid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

@SuppressWarnings("serial")
/**
 * 表格的一行：top 聚在同一簇中的单元格，按 left 从左到右排列。
 */
public class Row extends Rectangle {

    private final List<Cell> cells;

    public Row(List<Cell> cells) {
        super();
        List<Cell> sorted = new ArrayList<>(cells);
        Collections.sort(sorted, new Comparator<Cell>() {
            @Override
            public int compare(Cell a, Cell b) {
                return java.lang.Float.compare(a.getLeft(), b.getLeft());
            }
        });
        this.cells = Collections.unmodifiableList(sorted);
        Rectangle bounds = Rectangle.boundingBoxOf(sorted);
        this.setRect(bounds);
    }

    public List<Cell> getCells() {
        return cells;
    }

    public int size() {
        return cells.size();
    }

    public Cell get(int index) {
        return cells.get(index);
    }

}
