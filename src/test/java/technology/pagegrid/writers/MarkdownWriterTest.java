package technology.pagegrid.writers;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import technology.pagegrid.Cell;
import technology.pagegrid.Rectangle;
import technology.pagegrid.Table;
import technology.pagegrid.TableHeader;

public class MarkdownWriterTest {

    private static Table table(String[][] texts) {
        Table table = new Table("lines/lines");
        for (int i = 0; i < texts.length; i++) {
            for (int j = 0; j < texts[i].length; j++) {
                Cell c = new Cell(i * 10, j * 10, 10, 10);
                c.setText(texts[i][j]);
                table.add(c, i, j);
            }
        }
        return table;
    }

    private static void firstRowHeader(Table table, String... names) {
        table.setHeader(new TableHeader(table.getRows().get(0), table.getRows().get(0).getCells(),
                Arrays.asList(names), false));
    }

    @Test
    public void testFirstRowHeader() {
        Table table = table(new String[][] { { "Name", "Qty" }, { "apple", "3" }, { "pear", "5" } });
        firstRowHeader(table, "Name", "Qty");

        assertEquals("|Name|Qty|\n|---|---|\n|apple|3|\n|pear|5|\n", new MarkdownWriter().toMarkdown(table));
    }

    @Test
    public void testExternalHeaderKeepsFirstRow() {
        Table table = table(new String[][] { { "apple", "3" }, { "pear", "5" } });
        table.setHeader(new TableHeader(new Rectangle(-10, 0, 20, 10), Collections.<Cell>emptyList(),
                Arrays.asList("Fruit", "Count"), true));

        assertEquals("|Fruit|Count|\n|---|---|\n|apple|3|\n|pear|5|\n", new MarkdownWriter().toMarkdown(table));
    }

    @Test
    public void testMissingHeaderNamesArePlaceholders() {
        Table table = table(new String[][] { { "a", "b", "c" }, { "d", "e", "f" } });
        firstRowHeader(table, "A");

        assertEquals("|A|Col2|Col3|\n|---|---|---|\n|d|e|f|\n", new MarkdownWriter().toMarkdown(table));

        table.setHeader(null);
        assertEquals("|Col1|Col2|Col3|\n|---|---|---|\n|d|e|f|\n", new MarkdownWriter().toMarkdown(table));
    }

    @Test
    public void testLineBreaksInCells() {
        Table table = table(new String[][] { { "h1", "h2" }, { "two\nlines", "x" } });
        firstRowHeader(table, "h1", "h2");

        assertEquals("|h1|h2|\n|---|---|\n|two<br>lines|x|\n", new MarkdownWriter().toMarkdown(table));
    }

    @Test
    public void testCleanEscapesMarkup() {
        Table table = table(new String[][] { { "h1", "h2" }, { "<b>&</b>", "1-2\n3" } });
        firstRowHeader(table, "h1", "h2");

        assertEquals("|h1|h2|\n|---|---|\n|&lt;b&gt;&amp;&lt;/b&gt;|1&#45;2<br>3|\n",
                new MarkdownWriter(true, false).toMarkdown(table));
    }

    @Test
    public void testFillEmpty() {
        Table table = table(new String[][] { { "h1", "h2" }, { "a", "" }, { "", "" } });
        firstRowHeader(table, "h1", "h2");

        assertEquals("|h1|h2|\n|---|---|\n|a|a|\n|a|a|\n", new MarkdownWriter(false, true).toMarkdown(table));
    }

    @Test
    public void testWriteSeveralTables() throws IOException {
        Table first = table(new String[][] { { "a", "b" }, { "1", "2" } });
        firstRowHeader(first, "a", "b");
        Table second = table(new String[][] { { "c", "d" }, { "3", "4" } });
        firstRowHeader(second, "c", "d");

        StringBuilder sb = new StringBuilder();
        new MarkdownWriter().write(sb, Arrays.asList(first, second));

        assertEquals("|a|b|\n|---|---|\n|1|2|\n\n|c|d|\n|---|---|\n|3|4|\n", sb.toString());
    }

    @Test
    public void testEmptyTableWritesNothing() {
        assertEquals("", new MarkdownWriter().toMarkdown(Table.empty()));
    }

}
