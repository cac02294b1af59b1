/**
 * Per-call session state and the notification stream used for DTMF validation rendezvous.
 */
package com.phillippitts.callengine.service.session;
