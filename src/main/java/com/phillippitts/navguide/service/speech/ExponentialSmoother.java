package com.phillippitts.navguide.service.speech;

/**
 * Exponential moving average: {@code smoothed = alpha * value + (1 - alpha) * previous}.
 *
 * <p>Not thread-safe; owned by a component that guards it with its own lock.
 */
public final class ExponentialSmoother {

    private final double alpha;
    private Double current;

    /**
     * @param alpha weight of the newest sample, in (0, 1]; higher reacts faster
     */
    public ExponentialSmoother(double alpha) {
        if (!(alpha > 0.0 && alpha <= 1.0)) {
            throw new IllegalArgumentException("alpha must be in (0, 1], got: " + alpha);
        }
        this.alpha = alpha;
    }

    /**
     * Folds a new sample into the average. The first sample is returned unchanged.
     */
    public double smooth(double value) {
        double next = current == null ? value : alpha * value + (1.0 - alpha) * current;
        current = next;
        return next;
    }

    /** Current average, or {@code null} before the first sample. */
    public Double current() {
        return current;
    }

    public void reset() {
        current = null;
    }
}
