package com.trade.arena.sim.common.constants;

/**
 * Error codes carried by failed {@link com.trade.arena.sim.common.Result}s.
 */
public final class ErrorCodes {

    private ErrorCodes() {
    }

    // ledger rejections
    public static final String INVALID_INPUT = "INVALID_INPUT";
    public static final String INSUFFICIENT_FUNDS = "INSUFFICIENT_FUNDS";
    public static final String INSUFFICIENT_QUANTITY = "INSUFFICIENT_QUANTITY";
    public static final String STOCK_NOT_OWNED = "STOCK_NOT_OWNED";
    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String CONCURRENT_MODIFICATION = "CONCURRENT_MODIFICATION";

    // batch / infrastructure
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";
    public static final String EXTERNAL_PROVIDER_ERROR = "ERR-EXT-001";
    public static final String CONFIGURATION_ERROR = "ERR-CFG-001";
    public static final String UNAUTHORIZED = "ERR-AUTH-001";
    public static final String DUPLICATE = "DUPLICATE";
}
