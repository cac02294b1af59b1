/**
 * Best-effort status notifications towards the presentation layer.
 *
 * <p>{@link com.phillippitts.callengine.service.observer.CallStatusBroadcaster} runs deliveries on
 * a bounded executor; {@link com.phillippitts.callengine.service.observer.CallObserver} is the
 * delivery seam, backed by the Spring event bus by default.
 */
package com.phillippitts.callengine.service.observer;
