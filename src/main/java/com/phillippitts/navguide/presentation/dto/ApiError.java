package com.phillippitts.navguide.presentation.dto;

import java.time.Instant;

/**
 * Standardized error response for API clients.
 */
public record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
) {}
