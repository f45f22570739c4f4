package github.sarthakdev143.pixel_factory.admission;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-wide bound on concurrently running script executions. Acquisition waits, it never fails.
 */
public class RenderAdmissionController {

    private static final Logger logger = LoggerFactory.getLogger(RenderAdmissionController.class);

    private final int maxConcurrent;
    private final Semaphore slots;
    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger peak = new AtomicInteger();

    public RenderAdmissionController(int maxConcurrent) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("Max concurrent renders must be at least 1 but was " + maxConcurrent);
        }
        this.maxConcurrent = maxConcurrent;
        this.slots = new Semaphore(maxConcurrent, true);
    }

    public static int defaultMaxConcurrent() {
        return Runtime.getRuntime().availableProcessors();
    }

    public AdmissionPermit acquire() throws InterruptedException {
        if (!slots.tryAcquire()) {
            logger.debug("All {} render slots busy, waiting", maxConcurrent);
            slots.acquire();
        }
        int now = running.incrementAndGet();
        peak.accumulateAndGet(now, Math::max);
        return new SlotPermit();
    }

    public int maxConcurrent() {
        return maxConcurrent;
    }

    public int running() {
        return running.get();
    }

    public int peak() {
        return peak.get();
    }

    private final class SlotPermit implements AdmissionPermit {

        private final AtomicBoolean released = new AtomicBoolean();

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                running.decrementAndGet();
                slots.release();
            }
        }
    }
}
