/**
 * Immutable domain model for the navigation pipeline.
 *
 * <p>Records in this package carry per-frame data between pipeline stages:
 * <ul>
 *   <li>{@link com.phillippitts.navguide.domain.RawDetection} and
 *       {@link com.phillippitts.navguide.domain.Frame} - detector input in pixels</li>
 *   <li>{@link com.phillippitts.navguide.domain.Detection} - normalized canonical detection</li>
 *   <li>{@link com.phillippitts.navguide.domain.PartitionAnalysis} - zone breakdown</li>
 *   <li>{@link com.phillippitts.navguide.domain.DecisionResult} and
 *       {@link com.phillippitts.navguide.domain.Guidance} - outputs of the two decision paths</li>
 * </ul>
 *
 * <p>Nothing here holds mutable state; all of it is discarded after the frame is processed.
 *
 * @since 1.0
 */
package com.phillippitts.navguide.domain;
