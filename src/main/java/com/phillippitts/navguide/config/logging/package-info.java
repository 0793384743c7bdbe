/**
 * Logging infrastructure: request correlation through Log4j2's ThreadContext.
 *
 * @since 1.0
 */
package com.phillippitts.navguide.config.logging;
