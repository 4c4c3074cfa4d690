package com.scrapequeue.engine;

/**
 * Answer of {@link WindowedRateCounter#tryAdmit()}: either admitted, or
 * rejected until a given instant.
 */
public final class RateDecision {
    private static final RateDecision ADMITTED = new RateDecision(true, 0L);

    private final boolean admitted;
    private final long retryAtMillis;

    private RateDecision(boolean admitted, long retryAtMillis) {
        this.admitted = admitted;
        this.retryAtMillis = retryAtMillis;
    }

    public static RateDecision admitted() {
        return ADMITTED;
    }

    public static RateDecision rejectedUntil(long retryAtMillis) {
        return new RateDecision(false, retryAtMillis);
    }

    public boolean isAdmitted() {
        return admitted;
    }

    /**
     * @return epoch millis before which another attempt will be rejected; 0 when admitted
     */
    public long getRetryAtMillis() {
        return retryAtMillis;
    }

    @Override
    public String toString() {
        return admitted ? "RateDecision{admitted}" : "RateDecision{rejectedUntil=" + retryAtMillis + "}";
    }
}
