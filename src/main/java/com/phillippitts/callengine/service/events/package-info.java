/**
 * Event ingestion: catalog, payload decoding, handler registry and the processor.
 *
 * <p>{@link com.phillippitts.callengine.service.events.CallEventProcessor} is the single entry
 * point. It correlates each {@link com.phillippitts.callengine.domain.EventEnvelope} with its call,
 * builds a {@link com.phillippitts.callengine.service.events.CallEventContext} and runs the
 * handlers registered for the envelope type, in order, isolating their failures.
 */
package com.phillippitts.callengine.service.events;
