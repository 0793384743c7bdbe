/**
 * REST boundary: frame ingestion, session control and scene descriptions.
 *
 * @since 1.0
 */
package com.phillippitts.navguide.presentation;
