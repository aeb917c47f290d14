package com.trade.arena.sim.common.exception;

import com.trade.arena.sim.common.Result;
import com.trade.arena.sim.common.constants.ErrorCodes;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Converts a {@link Result} into the {@code {success, data|error}} envelope with a matching status.
 */
public final class Http {
    private Http() {
    }

    public static <T> ResponseEntity<Result<T>> from(Result<T> r) {
        if (r == null) {
            return ResponseEntity.internalServerError().body(Result.fail(ErrorCodes.INTERNAL_ERROR, "Result is null"));
        }
        if (r.isSuccess()) {
            return ResponseEntity.ok(r);
        }
        return ResponseEntity.status(statusOf(r.getErrorCode())).body(r);
    }

    static HttpStatus statusOf(String errorCode) {
        if (errorCode == null) return HttpStatus.BAD_REQUEST;

        return switch (errorCode) {
            case ErrorCodes.UNAUTHORIZED -> HttpStatus.UNAUTHORIZED;
            case ErrorCodes.NOT_FOUND, ErrorCodes.STOCK_NOT_OWNED, "ERR-DB-001" -> HttpStatus.NOT_FOUND;
            case ErrorCodes.INSUFFICIENT_FUNDS, ErrorCodes.INSUFFICIENT_QUANTITY -> HttpStatus.UNPROCESSABLE_ENTITY;
            case ErrorCodes.CONCURRENT_MODIFICATION, ErrorCodes.DUPLICATE -> HttpStatus.CONFLICT;
            case ErrorCodes.EXTERNAL_PROVIDER_ERROR -> HttpStatus.BAD_GATEWAY;
            case ErrorCodes.INTERNAL_ERROR, ErrorCodes.CONFIGURATION_ERROR,
                 "ERR-DB-002", "ERR-SYS-001" -> HttpStatus.INTERNAL_SERVER_ERROR;
            case "ERR-REQ-002" -> HttpStatus.METHOD_NOT_ALLOWED;
            default -> HttpStatus.BAD_REQUEST;
        };
    }
}
