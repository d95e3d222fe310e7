package technology.pagegrid.writers;

import java.util.ArrayList;
import java.util.List;

import technology.pagegrid.Cell;
import technology.pagegrid.Table;

/**
 * 表格的行 × 列文本网格。单元格文本在表格组装后已经填充；
 * 较短的行（或缺失的单元格）用空串补齐到列数。
 */
public final class TextGrid {

    private TextGrid() {
    }

    public static List<List<String>> of(Table table) {
        List<List<String>> grid = new ArrayList<>(table.getRowCount());
        for (int i = 0; i < table.getRowCount(); i++) {
            List<String> row = new ArrayList<>(table.getColCount());
            for (int j = 0; j < table.getColCount(); j++) {
                Cell c = table.getCell(i, j);
                row.add(c == null ? "" : c.getText());
            }
            grid.add(row);
        }
        return grid;
    }

    /**
     * 空单元格先取左侧相邻单元格的文本，再取上方相邻单元格的文本。原网格不变。
     */
    public static List<List<String>> fillEmpty(List<List<String>> grid) {
        List<List<String>> filled = new ArrayList<>(grid.size());
        for (List<String> row : grid) {
            filled.add(new ArrayList<>(row));
        }

        for (List<String> row : filled) {
            for (int j = 0; j + 1 < row.size(); j++) {
                if (isBlank(row.get(j + 1)) && !isBlank(row.get(j))) {
                    row.set(j + 1, row.get(j));
                }
            }
        }
        for (int i = 0; i + 1 < filled.size(); i++) {
            List<String> upper = filled.get(i);
            List<String> lower = filled.get(i + 1);
            for (int j = 0; j < Math.min(upper.size(), lower.size()); j++) {
                if (isBlank(lower.get(j)) && !isBlank(upper.get(j))) {
                    lower.set(j, upper.get(j));
                }
            }
        }
        return filled;
    }

    static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }

}
