/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.navguide.exception.NavGuideException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.navguide.exception.InvalidFrameException} - Thrown when
 *       a detector frame cannot be normalized (bad image size, missing detection list)</li>
 *   <li>{@link com.phillippitts.navguide.exception.SpeechOutputException} - Thrown when
 *       the speech sink rejects or fails an utterance</li>
 * </ul>
 *
 * <p>Suppressed announcements are not errors and never raise an exception.
 *
 * @see com.phillippitts.navguide.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.navguide.exception;
