package com.premiergroup.ad_spend_optimizer.exception;

import lombok.Getter;

/**
 * Base exception for faults that abort an optimizer run or an impact computation.
 * Recoverable conditions (insufficient data, zero denominators, duplicate decisions)
 * are represented in the output instead and never use this hierarchy.
 */
@Getter
public abstract class OptimizerException extends RuntimeException {

    private final String errorCode;

    protected OptimizerException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    protected OptimizerException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    protected OptimizerException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    /**
     * Each subclass must provide a default error code.
     */
    protected abstract String getDefaultErrorCode();
}
