package technology.pagegrid.detectors;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import technology.pagegrid.Column;
import technology.pagegrid.Page;
import technology.pagegrid.PageBlock;
import technology.pagegrid.PageLayout;
import technology.pagegrid.Rectangle;
import technology.pagegrid.TableRegion;
import technology.pagegrid.TableSettings;

/**
 * 分栏与表格区域检测。
 *
 * 页面的版面块先裁剪到去掉页眉/页脚边距后的内容区域，然后依次进行分栏检测、表格候选分类、
 * 多行合并与表格区域聚类。页面上的原始块不会被修改。
 */
public class LayoutDetectionAlgorithm implements DetectionAlgorithm {

    private static final Logger logger = LoggerFactory.getLogger(LayoutDetectionAlgorithm.class);

    private final TableSettings settings;

    public LayoutDetectionAlgorithm() {
        this(TableSettings.defaults());
    }

    public LayoutDetectionAlgorithm(TableSettings settings) {
        this.settings = settings;
    }

    /**
     * @return 最终的分栏/区域矩形，逐栏先文本块后表格区域
     */
    @Override
    public List<Rectangle> detect(Page page) {
        return detectLayout(page).getBoxes();
    }

    public PageLayout detectLayout(Page page) {
        float width = (float) page.getWidth();
        float height = (float) page.getHeight();
        Rectangle content = new Rectangle(settings.getHeaderMargin(), 0, width,
                height - settings.getHeaderMargin() - settings.getFooterMargin());
        if (content.isDegenerate()) {
            return PageLayout.empty(width, height);
        }

        List<PageBlock> blocks = new ArrayList<>();
        for (PageBlock b : page.getBlocks()) {
            PageBlock clipped = b.clipTo(content);
            if (clipped != null) {
                blocks.add(clipped);
            }
        }

        List<Column> columns = ColumnDetector.detectColumns(blocks, width);
        List<TableRegion> regions = new ArrayList<>();
        for (Column column : columns) {
            int candidates = BlockClassifier.classify(column);
            int merges = AdaptiveMerger.merge(column);
            List<TableRegion> found = TableRegionClusterer.cluster(column);
            logger.debug("Page {}, column {}: {} table candidates, {} merges, {} regions", page.getPageNumber(),
                    column.getId(), candidates, merges, found.size());
            regions.addAll(found);
        }
        logger.debug("Page {}: {} blocks, {} columns, {} regions", page.getPageNumber(), blocks.size(),
                columns.size(), regions.size());
        return new PageLayout(width, height, columns, regions);
    }

    @Override
    public String toString() {
        return "layout";
    }

}
