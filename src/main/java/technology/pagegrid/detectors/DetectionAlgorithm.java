package technology.pagegrid.detectors;

import java.util.List;

import technology.pagegrid.Page;
import technology.pagegrid.Rectangle;

/**
 * 页面版面检测算法，返回检测到的矩形区域。
 */
public interface DetectionAlgorithm {

    List<Rectangle> detect(Page page);

}
