package com.catalogiq.engine.spi;

/**
 * Failure of an oracle call: timeout, transport error or unparseable answer.
 */
public class OracleException extends RuntimeException {

    public OracleException(String message) {
        super(message);
    }

    public OracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
