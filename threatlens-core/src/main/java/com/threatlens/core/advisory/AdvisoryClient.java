package com.threatlens.core.advisory;

/**
 * External scoring collaborator that proposes advisory findings for a diff.
 *
 * <p><b>Contract:</b>
 * <ul>
 *   <li>At most one upstream attempt per call; no retries</li>
 *   <li>Must honor {@link AdvisoryRequest#timeoutMs()} and cancel the pending call on expiry</li>
 *   <li>Must never throw: every failure is returned as an {@link AdvisoryResult} with a reason</li>
 *   <li>Returned findings have source {@code advisory} and an {@code advisory-} rule id</li>
 * </ul>
 */
public interface AdvisoryClient {

    /**
     * Asks the collaborator for advisory findings.
     *
     * @param request diff, context and limits
     * @return outcome; never null
     */
    AdvisoryResult review(AdvisoryRequest request);
}
