/**
 * Micrometer meters for the event engine.
 */
package com.phillippitts.callengine.service.metrics;
