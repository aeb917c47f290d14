package com.trade.arena.sim.common.exception;

import com.trade.arena.sim.common.constants.ErrorCodes;

/**
 * Required settings are missing. Raised while a component is being constructed, so the
 * application context refuses to start rather than failing per call.
 */
public class ConfigurationException extends BaseTradeException {

    public ConfigurationException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return ErrorCodes.CONFIGURATION_ERROR;
    }
}
