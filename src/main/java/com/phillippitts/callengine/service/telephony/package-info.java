/**
 * Ports onto the telephony provider and the graceful session terminator.
 */
package com.phillippitts.callengine.service.telephony;
