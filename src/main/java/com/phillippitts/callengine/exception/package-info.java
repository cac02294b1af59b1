/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.callengine.exception.CallEngineException} - Base exception
 *       for all engine errors</li>
 *   <li>{@link com.phillippitts.callengine.exception.SessionStoreException} - Session store
 *       unavailable or persistence failed</li>
 *   <li>{@link com.phillippitts.callengine.exception.TelephonyProviderException} - Provider
 *       query, hang-up or recognition call failed</li>
 * </ul>
 *
 * <p>None of these are fatal to the host. Handlers catch them at their own boundary and the
 * processor isolates anything that still escapes.
 *
 * @since 1.0
 */
package com.phillippitts.callengine.exception;
