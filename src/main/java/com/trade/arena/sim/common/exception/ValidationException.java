package com.trade.arena.sim.common.exception;

/**
 * Exception for request validation errors raised above the ledger (controllers, manual triggers).
 */
public class ValidationException extends BaseTradeException {
    private static final String DEFAULT_ERROR_CODE = "ERR-VAL-001";

    public ValidationException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
