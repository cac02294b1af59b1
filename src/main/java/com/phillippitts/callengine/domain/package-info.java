/**
 * Immutable value types shared across the engine: the inbound {@link
 * com.phillippitts.callengine.domain.EventEnvelope}, participant identities and processing
 * summaries.
 *
 * @since 1.0
 */
package com.phillippitts.callengine.domain;
