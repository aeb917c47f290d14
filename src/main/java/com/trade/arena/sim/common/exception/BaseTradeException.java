package com.trade.arena.sim.common.exception;

import lombok.Getter;

/**
 * Base exception class for all simulator exceptions.
 * Provides a standard way to include error codes with exceptions.
 */
@Getter
public abstract class BaseTradeException extends RuntimeException {

    private final String errorCode;

    protected BaseTradeException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    protected BaseTradeException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    protected BaseTradeException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Each subclass must provide a default error code.
     */
    protected abstract String getDefaultErrorCode();
}
