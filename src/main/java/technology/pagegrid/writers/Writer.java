package technology.pagegrid.writers;

import java.io.IOException;
import java.util.List;

import technology.pagegrid.Table;

public interface Writer {

    void write(Appendable out, Table table) throws IOException;

    void write(Appendable out, List<Table> tables) throws IOException;

}
