package technology.pagegrid;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import technology.pagegrid.detectors.LayoutDetectionAlgorithm;
import technology.pagegrid.extractors.TableFinder;
import technology.pagegrid.writers.MarkdownWriter;

/**
 * 按页运行表格识别与版面分析。
 *
 * <p>
 * 每一页各自创建 {@link Page} 上下文，页面之间不共享可变状态，因此多页由线程池并行处理
 * （线程数取 {@code threads} 设置），结果按页码顺序返回。
 * </p>
 *
 * <p>
 * 错误处理：页码越界或页面尺寸为空时抛出 {@link InvalidPageException}；
 * 页面内容无法读取（{@link ExtractionFailureException}）、资源超限（{@link ResourceExhaustionException}）
 * 或超过 {@code page_timeout_ms} 时记录 WARN 日志，该页返回失败的空结果，其他页面继续处理。
 * 超时从该页开始执行时计起，在线程池队列中等待的时间不计入。
 * </p>
 */
public class PageProcessor implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(PageProcessor.class);

    private final PageSource source;
    private final TableSettings settings;
    private final TableFinder tableFinder;
    private final LayoutDetectionAlgorithm layoutDetector;
    private final MarkdownWriter markdownWriter;
    private ExecutorService executor;

    public PageProcessor(PageSource source, TableSettings settings) {
        this(source, settings, new MarkdownWriter());
    }

    public PageProcessor(PageSource source, TableSettings settings, MarkdownWriter markdownWriter) {
        this.source = source;
        this.settings = settings;
        this.tableFinder = new TableFinder(settings);
        this.layoutDetector = new LayoutDetectionAlgorithm(settings);
        this.markdownWriter = markdownWriter;
    }

    /**
     * 处理单页。
     *
     * @param pageIndex 页码（0 起）
     * @throws InvalidPageException 页码越界或页面为空
     */
    public PageResult process(int pageIndex) throws InvalidPageException {
        List<Integer> pages = new ArrayList<>();
        pages.add(pageIndex);
        return processAll(pages).get(0);
    }

    /**
     * 处理文档的全部页面。
     */
    public List<PageResult> processAll() throws InvalidPageException {
        List<Integer> pages = new ArrayList<>();
        for (int i = 0; i < source.getPageCount(); i++) {
            pages.add(i);
        }
        return processAll(pages);
    }

    /**
     * 并行处理给定页面，结果顺序与 pageIndexes 一致。
     *
     * @throws InvalidPageException 任一页码越界或页面为空
     */
    public List<PageResult> processAll(List<Integer> pageIndexes) throws InvalidPageException {
        for (int pageIndex : pageIndexes) {
            checkIndex(pageIndex);
        }

        List<PageTask> tasks = new ArrayList<>(pageIndexes.size());
        List<Future<PageResult>> futures = new ArrayList<>(pageIndexes.size());
        for (int pageIndex : pageIndexes) {
            PageTask task = new PageTask(pageIndex);
            tasks.add(task);
            futures.add(executor().submit(task));
        }

        List<PageResult> results = new ArrayList<>(pageIndexes.size());
        try {
            for (int i = 0; i < futures.size(); i++) {
                results.add(await(tasks.get(i), futures.get(i)));
            }
        } finally {
            if (results.size() < futures.size()) {
                for (Future<PageResult> f : futures) {
                    f.cancel(true);
                }
            }
        }
        return results;
    }

    /**
     * 从 {@link PageSource} 读取一页并创建处理上下文。
     *
     * @throws InvalidPageException       页码越界或页面尺寸为空
     * @throws ExtractionFailureException 页面内容无法读取
     */
    public Page loadPage(int pageIndex) throws InvalidPageException, ExtractionFailureException {
        checkIndex(pageIndex);
        float width = source.getPageWidth(pageIndex);
        float height = source.getPageHeight(pageIndex);
        if (width <= 0 || height <= 0) {
            throw new InvalidPageException("Page " + pageIndex + " is empty");
        }
        return new Page(pageIndex + 1, width, height, source.getCharacters(pageIndex),
                source.getVectorPaths(pageIndex), source.getTextBlocks(pageIndex), settings.getTextXTolerance());
    }

    PageResult processPage(int pageIndex) throws InvalidPageException {
        Page page;
        try {
            page = loadPage(pageIndex);
        } catch (ExtractionFailureException e) {
            logger.warn("Skipping page {}: {}", pageIndex, e.getMessage(), e);
            return PageResult.failed(pageIndex, e.getMessage());
        }

        try {
            List<Table> tables = tableFinder.extract(page);
            List<String> markdown = new ArrayList<>(tables.size());
            for (Table t : tables) {
                markdown.add(markdownWriter.toMarkdown(t));
            }
            PageLayout layout = layoutDetector.detectLayout(page);
            return new PageResult(pageIndex, tables, markdown, layout);
        } catch (ResourceExhaustionException e) {
            logger.warn("Aborting page {}: {}", pageIndex, e.getMessage());
            return PageResult.failed(pageIndex, e.getMessage());
        }
    }

    private PageResult await(PageTask task, Future<PageResult> future) throws InvalidPageException {
        int pageIndex = task.pageIndex;
        long timeout = settings.getPageTimeoutMillis();
        try {
            if (timeout <= 0) {
                return future.get();
            }
            while (!task.started.await(timeout, TimeUnit.MILLISECONDS)) {
                if (future.isDone()) {
                    return future.get();
                }
            }
            long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - task.startNanos);
            return future.get(Math.max(0, timeout - elapsed), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn("Aborting page {}: exceeded {} ms", pageIndex, timeout);
            return PageResult.failed(pageIndex, "Timed out after " + timeout + " ms");
        } catch (CancellationException e) {
            return PageResult.failed(pageIndex, "Cancelled");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return PageResult.failed(pageIndex, "Interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof InvalidPageException) {
                throw (InvalidPageException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException(cause);
        }
    }

    private void checkIndex(int pageIndex) throws InvalidPageException {
        int count = source.getPageCount();
        if (pageIndex < 0 || pageIndex >= count) {
            throw new InvalidPageException("Page index " + pageIndex + " out of range [0, " + count + ")");
        }
    }

    private synchronized ExecutorService executor() {
        if (executor == null) {
            executor = Executors.newFixedThreadPool(Math.max(1, settings.getThreads()), new ThreadFactory() {
                private int count = 0;

                @Override
                public Thread newThread(Runnable r) {
                    Thread t = new Thread(r, "pagegrid-page-" + (count++));
                    t.setDaemon(true);
                    return t;
                }
            });
        }
        return executor;
    }

    /**
     * 记录开始执行的时刻，超时据此计算。
     */
    private final class PageTask implements Callable<PageResult> {

        private final int pageIndex;
        private final CountDownLatch started = new CountDownLatch(1);
        private volatile long startNanos;

        PageTask(int pageIndex) {
            this.pageIndex = pageIndex;
        }

        @Override
        public PageResult call() throws InvalidPageException {
            startNanos = System.nanoTime();
            started.countDown();
            return processPage(pageIndex);
        }
    }

    @Override
    public synchronized void close() {
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }

}
