package technology.pagegrid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeMap;

@SuppressWarnings("serial")
/**
 * 表示从页面中推断出来的表格（单元格的连通分量）。
 *
 * Table 继承自 Rectangle，边界为所有成员单元格的并集。该类负责：
 * - 记录行数、列数（列数由最长行推导，不能单独设置）以及所属页码
 * - 用 CellPosition 索引保存单元格
 * - 按行返回单元格（允许参差不齐的行）以及表头
 *
 * extractionMethod 记录产生该表格的提取方法（例如线段策略组合），便于调试/输出。
 */
public class Table extends Rectangle {

	public static final Table empty() {
		return new Table("");
	}

	public Table(String extractionMethod) {
		this.extractionMethod = extractionMethod;
	}

	private final String extractionMethod;

	private int rowCount = 0;
	private int colCount = 0;
	private int pageNumber = 0;
	private TableHeader header;

	/*
	 * 单元格按 (row, col) 有序保存，遍历顺序可预测。对测试可见。
	 */
	final TreeMap<CellPosition, Cell> cells = new TreeMap<>();

	public int getRowCount() {
		return rowCount;
	}

	public int getColCount() {
		return colCount;
	}

	public int getPageNumber() {
		return pageNumber;
	}

	public void setPageNumber(int pageNumber) {
		this.pageNumber = pageNumber;
	}

	public String getExtractionMethod() {
		return extractionMethod;
	}

	public TableHeader getHeader() {
		return header;
	}

	public void setHeader(TableHeader header) {
		this.header = header;
	}

	/**
	 * 将单元格放到表格的 (row, col) 位置。
	 *
	 * 行列计数会按需扩展，表格边界并入该单元格；同一位置已有单元格时被替换。
	 *
	 * @param cell 单元格
	 * @param row  行索引（从 0 开始）
	 * @param col  列索引（从 0 开始）
	 */
	public void add(Cell cell, int row, int col) {
		if (cells.isEmpty()) {
			this.setRect(cell);
		} else {
			this.merge(cell);
		}

		rowCount = Math.max(rowCount, row + 1);
		colCount = Math.max(colCount, col + 1);

		cells.put(new CellPosition(row, col), cell);

		this.memoizedRows = null;
	}

	private List<Row> memoizedRows = null;

	/**
	 * 返回表格的行（行内单元格从左到右）。行可以比列数短。
	 */
	public List<Row> getRows() {
		if (this.memoizedRows == null)
			this.memoizedRows = computeRows();
		return this.memoizedRows;
	}

	private List<Row> computeRows() {
		List<Row> rows = new ArrayList<>();
		for (int i = 0; i < rowCount; i++) {
			List<Cell> rowCells = new ArrayList<>();
			for (int j = 0; j < colCount; j++) {
				Cell cell = cells.get(new CellPosition(i, j));
				if (cell != null) {
					rowCells.add(cell);
				}
			}
			rows.add(new Row(rowCells));
		}
		return Collections.unmodifiableList(rows);
	}

	/**
	 * 返回所有单元格，按行优先顺序。
	 */
	public List<Cell> getCells() {
		return new ArrayList<>(cells.values());
	}

	/**
	 * 返回指定位置的单元格；该位置没有单元格（参差行的尾部）时返回 null。
	 *
	 * @param i 行索引（从 0 开始）
	 * @param j 列索引（从 0 开始）
	 */
	public Cell getCell(int i, int j) {
		return cells.get(new CellPosition(i, j));
	}

}

/**
 * 表示单元格的位置（行, 列），并实现 Comparable 以便在 TreeMap 中排序。
 */
class CellPosition implements Comparable<CellPosition> {

	CellPosition(int row, int col) {
		this.row = row;
		this.col = col;
	}

	final int row, col;

	@Override
	public int hashCode() {
		return row + 101 * col;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		CellPosition other = (CellPosition) obj;
		return row == other.row && col == other.col;
	}

	/**
	 * 先按行再按列比较。
	 */
	@Override
	public int compareTo(CellPosition other) {
		int rowdiff = row - other.row;
		return rowdiff != 0 ? rowdiff : col - other.col;
	}

}
