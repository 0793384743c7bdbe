/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@code POST /api/navigation/frames} - one detector frame, returns the verdicts</li>
 *   <li>{@code GET /api/navigation/session} - session id, strategy and pause state</li>
 *   <li>{@code POST /api/navigation/session/reset|pause|resume} - session control</li>
 *   <li>{@code POST /api/navigation/scene} - read out a scene description</li>
 * </ul>
 *
 * <p>Controllers are thin adapters; exceptions are left to {@code GlobalExceptionHandler}.
 *
 * @since 1.0
 */
package com.phillippitts.navguide.presentation.controller;
