package com.phillippitts.callengine.service.telephony;

/**
 * Graceful call termination: tears down the provider call together with any media or AI
 * sessions attached to it.
 *
 * <p>Optional collaborator. When absent, or when it reports failure, the engine falls back to a
 * plain provider hang-up.
 */
@FunctionalInterface
public interface SessionTerminator {

    /**
     * @return true if the call was terminated
     * @throws Exception on any termination error; the caller falls back to a direct hang-up
     */
    boolean terminate(String callConnectionId, TerminationReason reason) throws Exception;
}
