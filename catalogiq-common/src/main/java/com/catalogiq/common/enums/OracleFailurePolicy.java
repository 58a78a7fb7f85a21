package com.catalogiq.common.enums;

/**
 * What to do with a candidate when the validation oracle times out or errors.
 */
public enum OracleFailurePolicy {
    /** Keep the candidate on the strength of its similarity scores alone. */
    DEGRADE,
    /** Drop the candidate and log the failure. */
    STRICT
}
