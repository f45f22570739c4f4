package github.sarthakdev143.pixel_factory.processing;

import github.sarthakdev143.pixel_factory.model.PixelImage;
import github.sarthakdev143.pixel_factory.model.Rgba;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs per-pixel functions over an image in parallel.
 * <p>
 * The row range is split into at most {@code workers} contiguous bands of
 * {@code ceil(height / workers)} rows. Each band is processed by one task that writes
 * only its own rows, so no locking is needed. All tasks are joined before a call
 * returns, and the result does not depend on the worker count.
 */
public class PixelProcessor implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PixelProcessor.class);

    private final int workers;
    private final ExecutorService executor;

    public PixelProcessor(int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("Pixel processor needs at least one worker but got " + workers);
        }
        this.workers = workers;
        this.executor = Executors.newFixedThreadPool(workers, new WorkerThreadFactory());
        logger.info("Pixel processor started with {} workers", workers);
    }

    public static int defaultWorkerCount() {
        return Runtime.getRuntime().availableProcessors() * 2;
    }

    public int workers() {
        return workers;
    }

    public PixelImage process(PixelImage image, PixelTransform transform) {
        PixelImage result = new PixelImage(image.width(), image.height());
        forEachBand(image.height(), image.width(), band -> {
            for (int y = band.startY(); y < band.endY(); y++) {
                for (int x = 0; x < image.width(); x++) {
                    result.set(x, y, transform.apply(image.get(x, y)));
                }
            }
        });
        return result;
    }

    public PixelImage combine(PixelImage bottom, PixelImage top, PixelBlendFunction blend) {
        PixelImage result = new PixelImage(bottom.width(), bottom.height());
        forEachBand(bottom.height(), bottom.width(), band -> {
            for (int y = band.startY(); y < band.endY(); y++) {
                for (int x = 0; x < bottom.width(); x++) {
                    result.set(x, y, blend.blend(bottom.get(x, y), topPixel(top, x, y)));
                }
            }
        });
        return result;
    }

    // Writes into destination; copy it first if the original is still needed.
    public PixelImage applyInto(PixelImage destination, PixelImage source, PixelBlendFunction blend) {
        forEachBand(destination.height(), destination.width(), band -> {
            for (int y = band.startY(); y < band.endY(); y++) {
                for (int x = 0; x < destination.width(); x++) {
                    destination.set(x, y, blend.blend(destination.get(x, y), topPixel(source, x, y)));
                }
            }
        });
        return destination;
    }

    public double[] buffer(PixelImage image, PixelBufferFunction function) {
        double[] buffer = new double[image.width() * image.height()];
        forEachBand(image.height(), image.width(), band -> {
            for (int y = band.startY(); y < band.endY(); y++) {
                for (int x = 0; x < image.width(); x++) {
                    buffer[y * image.width() + x] = function.apply(image.get(x, y));
                }
            }
        });
        return buffer;
    }

    public List<RowBand> partition(int height) {
        List<RowBand> bands = new ArrayList<>();
        if (height <= 0) {
            return bands;
        }

        int rowsPerWorker = (height + workers - 1) / workers;
        for (int index = 0; index < workers; index++) {
            int startY = index * rowsPerWorker;
            int endY = Math.min(startY + rowsPerWorker, height);
            if (startY >= endY) {
                break;
            }
            bands.add(new RowBand(startY, endY));
        }
        return bands;
    }

    @Override
    public void close() {
        executor.shutdown();
    }

    private void forEachBand(int height, int width, BandTask task) {
        if (height == 0 || width == 0) {
            return;
        }

        List<RowBand> bands = partition(height);
        if (bands.size() == 1) {
            task.run(bands.get(0));
            return;
        }

        List<Future<?>> futures = new ArrayList<>(bands.size());
        for (RowBand band : bands) {
            futures.add(executor.submit(() -> task.run(band)));
        }
        awaitAll(futures);
    }

    private void awaitAll(List<Future<?>> futures) {
        RuntimeException failure = null;
        boolean interrupted = false;

        for (Future<?> future : futures) {
            while (true) {
                try {
                    future.get();
                    break;
                } catch (InterruptedException e) {
                    // Bands still write into the result, so keep waiting and re-flag afterwards.
                    interrupted = true;
                } catch (ExecutionException e) {
                    if (failure == null) {
                        failure = asRuntimeException(e.getCause());
                    }
                    break;
                }
            }
        }

        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        if (failure != null) {
            throw failure;
        }
    }

    private static RuntimeException asRuntimeException(Throwable cause) {
        if (cause instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IllegalStateException("Pixel worker failed", cause);
    }

    private static Rgba topPixel(PixelImage top, int x, int y) {
        return top.contains(x, y) ? top.get(x, y) : Rgba.TRANSPARENT;
    }

    @FunctionalInterface
    private interface BandTask {
        void run(RowBand band);
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "pixel-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
