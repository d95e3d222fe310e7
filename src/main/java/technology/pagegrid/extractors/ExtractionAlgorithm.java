package technology.pagegrid.extractors;

import java.util.List;

import technology.pagegrid.Page;
import technology.pagegrid.Table;

public interface ExtractionAlgorithm {

    List<Table> extract(Page page);

    String toString();

}
