/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.navguide.config.NavigationConfig} - frame pipeline, strategy
 *       selection, speech arbiter and session</li>
 *   <li>{@link com.phillippitts.navguide.config.ThreadPoolConfig} - frame and speech executors</li>
 *   <li>{@link com.phillippitts.navguide.config.ThreadPoolMetricsConfig} - pool gauges</li>
 *   <li>{@link com.phillippitts.navguide.config.ClockConfig} - time source</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - typed {@code nav.*} and {@code threadpool.*} properties</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filters)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.navguide.config;
