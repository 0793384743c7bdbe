package com.phillippitts.navguide.service.gate;

import java.util.Objects;

/**
 * Outcome of one gate evaluation.
 *
 * <p>Separates "legitimately suppressed by rule X" from "spoken", so tests and logs never
 * have to infer one from silence.
 *
 * @param allowed      whether the announcement was (or may be) spoken
 * @param reason       suppressing rule; {@code null} when allowed
 * @param announcement spoken text when allowed and known, otherwise {@code null}
 */
public record GateVerdict(boolean allowed, SuppressionReason reason, String announcement) {

    private static final GateVerdict ALLOW = new GateVerdict(true, null, null);

    public GateVerdict {
        if (allowed && reason != null) {
            throw new IllegalArgumentException("An allowed verdict carries no suppression reason");
        }
        if (!allowed) {
            Objects.requireNonNull(reason, "A suppressed verdict needs a reason");
        }
    }

    public static GateVerdict allow() {
        return ALLOW;
    }

    public static GateVerdict spoken(String announcement) {
        return new GateVerdict(true, null, announcement);
    }

    public static GateVerdict suppress(SuppressionReason reason) {
        return new GateVerdict(false, reason, null);
    }

    public boolean suppressed() {
        return !allowed;
    }
}
