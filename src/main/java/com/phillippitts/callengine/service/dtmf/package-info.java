/**
 * DTMF caller validation: tone normalization, the challenge and fixed-PIN strategies, the
 * completion rendezvous and the cancellation procedure.
 */
package com.phillippitts.callengine.service.dtmf;
