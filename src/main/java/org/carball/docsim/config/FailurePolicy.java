package org.carball.docsim.config;

/**
 * What a batch run does when one (design, query) evaluation fails.
 */
public enum FailurePolicy {
    /** Abort the whole run on the first failure. */
    FAIL_FAST,
    /** Record the failure and carry on with the remaining pairs. */
    CONTINUE
}
