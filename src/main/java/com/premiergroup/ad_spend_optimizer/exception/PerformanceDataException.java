package com.premiergroup.ad_spend_optimizer.exception;

/**
 * Wraps storage collaborator failures. Thrown inside a transaction so the run writes nothing.
 */
public class PerformanceDataException extends OptimizerException {

    public PerformanceDataException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return "ERR-STORE-001";
    }
}
