/**
 * Spring wiring for the call event engine.
 *
 * <p>{@link com.phillippitts.callengine.config.CallEventConfig} builds the processor and its
 * collaborators; hosts override the telephony provider, session store, terminator and observer
 * by declaring their own beans of those types.
 */
package com.phillippitts.callengine.config;
