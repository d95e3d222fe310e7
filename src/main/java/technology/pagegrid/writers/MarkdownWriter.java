package technology.pagegrid.writers;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import technology.pagegrid.Table;
import technology.pagegrid.TableHeader;

/**
 * 以 Markdown 表格格式输出。
 *
 * <p>
 * 第一行是列名（来自表头，缺失时为 {@code Col<N>}），第二行是 {@code |---|...|} 分隔行，
 * 之后是数据行。表头属于表格第一行时数据从第二行开始；外部表头时从第一行开始。
 * 单元格内的换行输出为 {@code <br>}。
 * </p>
 *
 * <ul>
 * <li>clean：单元格文本做 HTML 转义，并把 {@code -} 写成 {@code &#45;}</li>
 * <li>fillEmpty：空单元格依次用左侧、上方相邻单元格的文本填充</li>
 * </ul>
 */
public class MarkdownWriter implements Writer {

    private final boolean clean;
    private final boolean fillEmpty;

    public MarkdownWriter() {
        this(false, false);
    }

    public MarkdownWriter(boolean clean, boolean fillEmpty) {
        this.clean = clean;
        this.fillEmpty = fillEmpty;
    }

    @Override
    public void write(Appendable out, Table table) throws IOException {
        int cols = table.getColCount();
        if (cols == 0) {
            return;
        }

        List<String> names = columnNames(table);
        out.append('|');
        for (String name : names) {
            out.append(format(name)).append('|');
        }
        out.append('\n');

        out.append('|');
        for (int j = 0; j < cols; j++) {
            out.append("---|");
        }
        out.append('\n');

        List<List<String>> grid = TextGrid.of(table);
        if (fillEmpty) {
            grid = TextGrid.fillEmpty(grid);
        }
        TableHeader header = table.getHeader();
        int first = header != null && header.isExternal() ? 0 : 1;
        for (int i = first; i < grid.size(); i++) {
            out.append('|');
            for (String cell : grid.get(i)) {
                out.append(format(cell)).append('|');
            }
            out.append('\n');
        }
    }

    @Override
    public void write(Appendable out, List<Table> tables) throws IOException {
        for (int i = 0; i < tables.size(); i++) {
            if (i > 0) {
                out.append('\n');
            }
            write(out, tables.get(i));
        }
    }

    public String toMarkdown(Table table) {
        StringBuilder sb = new StringBuilder();
        try {
            write(sb, table);
        } catch (IOException e) {
            // StringBuilder 不会抛出 IOException
            throw new IllegalStateException(e);
        }
        return sb.toString();
    }

    /**
     * 列名，数量与列数一致：表头缺失的列用 {@code Col<N>} 补齐。
     */
    static List<String> columnNames(Table table) {
        List<String> names = new ArrayList<>();
        TableHeader header = table.getHeader();
        if (header != null) {
            names.addAll(header.getNames());
        }
        while (names.size() > table.getColCount()) {
            names.remove(names.size() - 1);
        }
        while (names.size() < table.getColCount()) {
            names.add("Col" + (names.size() + 1));
        }
        return names;
    }

    private String format(String text) {
        String s = text == null ? "" : text;
        if (clean) {
            s = escapeHtml(s).replace("-", "&#45;");
        }
        return s.replace("\n", "<br>");
    }

    static String escapeHtml(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
            case '&':
                sb.append("&amp;");
                break;
            case '<':
                sb.append("&lt;");
                break;
            case '>':
                sb.append("&gt;");
                break;
            case '"':
                sb.append("&quot;");
                break;
            case '\'':
                sb.append("&#x27;");
                break;
            default:
                sb.append(c);
            }
        }
        return sb.toString();
    }

}
