package com.phillippitts.navguide.domain;

/**
 * Coarse distance bucket, declared in increasing order of danger.
 *
 * <p>The declaration order is the total order FAR &lt; MEDIUM &lt; CLOSE &lt; VERY_CLOSE
 * used by the rate limiter's movement-sensitivity rule.
 */
public enum DistanceCategory {
    FAR,
    MEDIUM,
    CLOSE,
    VERY_CLOSE;

    /**
     * Returns {@code true} if this category is strictly more dangerous than {@code other}.
     *
     * @param other category to compare against (must not be null)
     */
    public boolean isMoreDangerousThan(DistanceCategory other) {
        return compareTo(other) > 0;
    }
}
