package com.catalogiq.engine.spi;

/**
 * Generative model used for soft validation and scoring. Treated as fallible and
 * non-authoritative: every call may throw {@link OracleException}.
 */
public interface Oracle {

    boolean validateBool(String prompt);

    double scoreScalar(String prompt);

    String explain(String prompt);

    /**
     * Whether the oracle is configured. The engine skips oracle steps entirely when false.
     */
    default boolean isAvailable() {
        return true;
    }
}
