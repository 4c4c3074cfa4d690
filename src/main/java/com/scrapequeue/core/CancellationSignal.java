package com.scrapequeue.core;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Cooperative cancellation flag shared by every task of one job.
 *
 * <p>All scheduler suspension points (slot waits, rate waits, retry backoff,
 * inter-chunk delays) sleep through {@link #sleep(long)} or register a
 * listener, so that cancelling a job wakes them immediately instead of letting
 * them finish their full sleep.</p>
 *
 * <p><b>Thread Safety:</b> the latch gives a happens-before edge between
 * {@link #cancel()} and every observer; listeners run on the cancelling thread.</p>
 */
public class CancellationSignal {
    private static final Logger logger = Logger.getLogger(CancellationSignal.class.getName());

    /**
     * Signal for work that does not belong to a job (single-task scrapes).
     * It can never be cancelled.
     */
    public static final CancellationSignal NONE = new CancellationSignal("none") {
        @Override
        public boolean cancel() {
            return false;
        }
    };

    private final String owner;
    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public CancellationSignal(String owner) {
        this.owner = owner;
    }

    /**
     * Cancel the owner. Only the first call has an effect.
     *
     * @return true if this call performed the cancellation
     */
    public boolean cancel() {
        synchronized (latch) {
            if (latch.getCount() == 0) {
                return false;
            }
            latch.countDown();
        }
        for (Runnable listener : listeners) {
            // remove first: onCancel() may race us for the same listener
            if (!listeners.remove(listener)) {
                continue;
            }
            try {
                listener.run();
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Cancellation listener failed for " + owner, e);
            }
        }
        return true;
    }

    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    /**
     * Throw if cancelled. Meant for checkpoints between suspension points.
     *
     * @throws TaskCancelledException if the owner has been cancelled
     */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new TaskCancelledException(owner + " was cancelled");
        }
    }

    /**
     * Sleep for the given duration, waking early on cancellation.
     *
     * @param millis how long to sleep; non-positive values return at once
     * @throws TaskCancelledException if cancelled before or during the sleep
     * @throws InterruptedException if the sleeping thread is interrupted
     */
    public void sleep(long millis) throws InterruptedException {
        throwIfCancelled();
        if (millis <= 0) {
            return;
        }
        if (latch.await(millis, TimeUnit.MILLISECONDS)) {
            throw new TaskCancelledException(owner + " was cancelled");
        }
    }

    /**
     * Register a callback run once on cancellation. If already cancelled the
     * callback runs immediately on the calling thread.
     *
     * @param listener the callback
     * @return a handle that unregisters the callback
     */
    public Runnable onCancel(Runnable listener) {
        listeners.add(listener);
        if (isCancelled() && listeners.remove(listener)) {
            listener.run();
        }
        return () -> listeners.remove(listener);
    }

    public String getOwner() {
        return owner;
    }

    @Override
    public String toString() {
        return "CancellationSignal{owner='" + owner + "', cancelled=" + isCancelled() + "}";
    }
}
