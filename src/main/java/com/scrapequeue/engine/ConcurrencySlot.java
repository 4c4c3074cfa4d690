package com.scrapequeue.engine;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * One permit taken from a {@link ConcurrencyGate}.
 *
 * <p>Releasing is idempotent: the first {@link #release()} hands the permit back,
 * any later call is logged and ignored, so an error path that releases twice
 * can never free a permit it does not own.</p>
 */
public final class ConcurrencySlot implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(ConcurrencySlot.class.getName());

    private final ConcurrencyGate gate;
    private final long id;
    private final AtomicBoolean released = new AtomicBoolean(false);

    ConcurrencySlot(ConcurrencyGate gate, long id) {
        this.gate = gate;
        this.id = id;
    }

    public long getId() {
        return id;
    }

    public boolean isReleased() {
        return released.get();
    }

    /**
     * Give the permit back to the gate.
     *
     * @return true if this call released the permit, false if it was already released
     */
    public boolean release() {
        if (!released.compareAndSet(false, true)) {
            logger.warning("Slot " + id + " already released; ignoring second release");
            return false;
        }
        gate.release(this);
        return true;
    }

    @Override
    public void close() {
        if (!released.get()) {
            release();
        }
    }

    @Override
    public String toString() {
        return "ConcurrencySlot{id=" + id + ", released=" + released.get() + "}";
    }
}
