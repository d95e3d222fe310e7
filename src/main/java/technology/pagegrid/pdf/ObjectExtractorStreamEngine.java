package technology.pagegrid.pdf;

import java.awt.Shape;
import java.awt.geom.AffineTransform;
import java.awt.geom.GeneralPath;
import java.awt.geom.Line2D;
import java.awt.geom.PathIterator;
import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;
import java.util.ArrayList;
import java.util.List;

import org.apache.pdfbox.contentstream.PDFGraphicsStreamEngine;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.PDImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import technology.pagegrid.Rectangle;
import technology.pagegrid.Utils;

import static java.awt.geom.PathIterator.*;

/**
 * 从 PDF 页面的内容流中收集矢量路径与图像。
 *
 * <p>
 * 只由直线段组成的路径被拆成线段，每条水平或垂直线段（裁剪到当前裁剪区域后）记录为一个零厚度的矩形；
 * 斜线与曲线被忽略。每次绘制图像记录图像在页面上的外接矩形。坐标系原点在页面左上角。
 * </p>
 */
class ObjectExtractorStreamEngine extends PDFGraphicsStreamEngine {

    private static final Logger logger = LoggerFactory.getLogger(ObjectExtractorStreamEngine.class);

    /**
     * 短于该长度的线段被忽略。
     */
    private static final float MINIMUM_LENGTH = 0.01f;

    /**
     * 两端点坐标相差不超过该值时视为水平（或垂直）线段。
     */
    private static final float AXIS_TOLERANCE = 0.5f;

    private final List<Rectangle> paths = new ArrayList<>();

    private final List<Rectangle> images = new ArrayList<>();

    private AffineTransform pageTransform;

    private int clipWindingRule = -1;

    private GeneralPath currentPath = new GeneralPath();

    protected ObjectExtractorStreamEngine(PDPage page) {
        super(page);

        pageTransform = new AffineTransform();
        PDRectangle pageCropBox = getPage().getCropBox();
        int rotationAngleInDegrees = getPage().getRotation();

        if (Math.abs(rotationAngleInDegrees) == 90 || Math.abs(rotationAngleInDegrees) == 270) {
            double rotationAngleInRadians = rotationAngleInDegrees * (Math.PI / 180.0);
            pageTransform = AffineTransform.getRotateInstance(rotationAngleInRadians, 0, 0);
        } else {
            pageTransform.concatenate(AffineTransform.getTranslateInstance(0, pageCropBox.getHeight()));
        }

        // 翻转 y 轴，使原点位于左上角
        pageTransform.concatenate(AffineTransform.getScaleInstance(1, -1));
        pageTransform.translate(-pageCropBox.getLowerLeftX(), -pageCropBox.getLowerLeftY());
    }

    public List<Rectangle> getPaths() {
        return paths;
    }

    public List<Rectangle> getImages() {
        return images;
    }

    @Override
    public void appendRectangle(Point2D p0, Point2D p1, Point2D p2, Point2D p3) {
        currentPath.moveTo((float) p0.getX(), (float) p0.getY());
        currentPath.lineTo((float) p1.getX(), (float) p1.getY());
        currentPath.lineTo((float) p2.getX(), (float) p2.getY());
        currentPath.lineTo((float) p3.getX(), (float) p3.getY());
        currentPath.closePath();
    }

    @Override
    public void clip(int windingRule) {
        clipWindingRule = windingRule;
    }

    @Override
    public void closePath() {
        currentPath.closePath();
    }

    @Override
    public void curveTo(float x1, float y1, float x2, float y2, float x3, float y3) {
        currentPath.curveTo(x1, y1, x2, y2, x3, y3);
    }

    @Override
    public void drawImage(PDImage image) {
        // 图像占据用户空间中的单位正方形
        AffineTransform ctm = getGraphicsState().getCurrentTransformationMatrix().createAffineTransform();
        Shape unitSquare = new Rectangle2D.Float(0, 0, 1, 1);
        Rectangle2D bounds = pageTransform.createTransformedShape(ctm.createTransformedShape(unitSquare))
                .getBounds2D();
        images.add(Rectangle.fromCorners(bounds.getMinX(), bounds.getMinY(), bounds.getMaxX(), bounds.getMaxY()));
    }

    @Override
    public void endPath() {
        if (clipWindingRule != -1) {
            currentPath.setWindingRule(clipWindingRule);
            getGraphicsState().intersectClippingPath(currentPath);
            clipWindingRule = -1;
        }
        currentPath.reset();
    }

    @Override
    public void fillAndStrokePath(int windingRule) {
        strokeOrFillPath();
    }

    @Override
    public void fillPath(int windingRule) {
        strokeOrFillPath();
    }

    @Override
    public Point2D getCurrentPoint() {
        return currentPath.getCurrentPoint();
    }

    @Override
    public void lineTo(float x, float y) {
        currentPath.lineTo(x, y);
    }

    @Override
    public void moveTo(float x, float y) {
        currentPath.moveTo(x, y);
    }

    @Override
    public void shadingFill(COSName shadingName) {
    }

    @Override
    public void strokePath() {
        strokeOrFillPath();
    }

    private void strokeOrFillPath() {
        if (!onlyStraightSegments()) {
            currentPath.reset();
            return;
        }

        PathIterator pathIterator = currentPath.getPathIterator(pageTransform);
        float[] coordinates = new float[6];
        Point2D.Float startPoint = getStartPoint(pathIterator);
        Point2D.Float lastMove = startPoint;
        Point2D.Float endPoint = null;

        while (!pathIterator.isDone()) {
            pathIterator.next();
            int currentSegment;
            try {
                currentSegment = pathIterator.currentSegment(coordinates);
            } catch (IndexOutOfBoundsException ex) {
                // 迭代器已耗尽
                continue;
            }
            switch (currentSegment) {
            case SEG_LINETO:
                endPoint = new Point2D.Float(coordinates[0], coordinates[1]);
                if (startPoint != null) {
                    addSegment(new Line2D.Float(startPoint, endPoint));
                }
                break;
            case SEG_MOVETO:
                lastMove = new Point2D.Float(coordinates[0], coordinates[1]);
                endPoint = lastMove;
                break;
            case SEG_CLOSE:
                if (endPoint != null && lastMove != null) {
                    addSegment(new Line2D.Float(endPoint, lastMove));
                }
                break;
            default:
                break;
            }
            startPoint = endPoint;
        }
        currentPath.reset();
    }

    /**
     * 路径只由 moveTo / lineTo / close 组成时返回 true。
     */
    private boolean onlyStraightSegments() {
        PathIterator pathIterator = currentPath.getPathIterator(pageTransform);
        if (pathIterator.isDone()) {
            return false;
        }
        float[] coordinates = new float[6];
        if (pathIterator.currentSegment(coordinates) != SEG_MOVETO) {
            return false;
        }
        pathIterator.next();
        while (!pathIterator.isDone()) {
            int type = pathIterator.currentSegment(coordinates);
            if (type != SEG_LINETO && type != SEG_CLOSE && type != SEG_MOVETO) {
                return false;
            }
            pathIterator.next();
        }
        return true;
    }

    private Point2D.Float getStartPoint(PathIterator pathIterator) {
        float[] startPointCoordinates = new float[6];
        pathIterator.currentSegment(startPointCoordinates);
        return new Point2D.Float(Utils.round(startPointCoordinates[0], 2), Utils.round(startPointCoordinates[1], 2));
    }

    /**
     * 水平或垂直线段裁剪到当前裁剪区域后记录为零厚度矩形。
     */
    private void addSegment(Line2D.Float line) {
        boolean horizontal = Math.abs(line.y1 - line.y2) <= AXIS_TOLERANCE;
        boolean vertical = Math.abs(line.x1 - line.x2) <= AXIS_TOLERANCE;
        if (!horizontal && !vertical) {
            logger.trace("Skipping oblique segment {},{} - {},{}", line.x1, line.y1, line.x2, line.y2);
            return;
        }

        Rectangle2D clip = currentClippingPath();
        double x0 = Math.max(Math.min(line.x1, line.x2), clip.getMinX());
        double x1 = Math.min(Math.max(line.x1, line.x2), clip.getMaxX());
        double y0 = Math.max(Math.min(line.y1, line.y2), clip.getMinY());
        double y1 = Math.min(Math.max(line.y1, line.y2), clip.getMaxY());
        if (x1 < x0 || y1 < y0) {
            return;
        }
        if (horizontal) {
            double y = (line.y1 + line.y2) / 2.0;
            if (x1 - x0 > MINIMUM_LENGTH && y >= clip.getMinY() && y <= clip.getMaxY()) {
                paths.add(Rectangle.fromCorners(x0, y, x1, y));
            }
        } else {
            double x = (line.x1 + line.x2) / 2.0;
            if (y1 - y0 > MINIMUM_LENGTH && x >= clip.getMinX() && x <= clip.getMaxX()) {
                paths.add(Rectangle.fromCorners(x, y0, x, y1));
            }
        }
    }

    private Rectangle2D currentClippingPath() {
        Shape currentClippingPath = getGraphicsState().getCurrentClippingPath();
        Shape transformedClippingPath = pageTransform.createTransformedShape(currentClippingPath);
        return transformedClippingPath.getBounds2D();
    }

}
