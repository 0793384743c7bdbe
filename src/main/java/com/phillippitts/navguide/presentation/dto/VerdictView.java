package com.phillippitts.navguide.presentation.dto;

import com.phillippitts.navguide.service.gate.GateVerdict;

/**
 * Client view of a gate verdict.
 *
 * @param spoken       whether an announcement went out
 * @param reason       suppression reason name, {@code null} when spoken
 * @param announcement spoken text, {@code null} when suppressed
 */
public record VerdictView(boolean spoken, String reason, String announcement) {

    public static VerdictView of(GateVerdict verdict) {
        if (verdict == null) {
            return null;
        }
        return new VerdictView(verdict.allowed(),
                verdict.reason() == null ? null : verdict.reason().name(),
                verdict.announcement());
    }
}
