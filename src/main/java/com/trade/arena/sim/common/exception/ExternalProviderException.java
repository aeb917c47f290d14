package com.trade.arena.sim.common.exception;

import com.trade.arena.sim.common.constants.ErrorCodes;
import lombok.Getter;

/**
 * One call to the market-data provider failed. Transient: callers count it and move on.
 */
@Getter
public class ExternalProviderException extends BaseTradeException {

    /**
     * HTTP status of the response, or 0 when no response was received.
     */
    private final int status;

    /**
     * Provider message code (e.g. KIS {@code msg_cd}); null for transport-level failures.
     */
    private final String providerCode;

    public ExternalProviderException(int status, String providerCode, String message) {
        super(message);
        this.status = status;
        this.providerCode = providerCode;
    }

    public ExternalProviderException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
        this.providerCode = null;
    }

    @Override
    protected String getDefaultErrorCode() {
        return ErrorCodes.EXTERNAL_PROVIDER_ERROR;
    }
}
