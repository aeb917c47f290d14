package com.trade.arena.sim.web;

import com.trade.arena.sim.common.exception.Http;
import com.trade.arena.sim.service.trade.TradingLedger;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/trading")
@RequiredArgsConstructor
public class TradingController {

    static final String USER_HEADER = "X-User-Id";

    private final TradingLedger ledger;

    public record OrderRequest(@NotBlank String stockCode, @Positive long quantity, String note) {
    }

    @PostMapping("/buy")
    public ResponseEntity<?> buy(@RequestHeader(USER_HEADER) String userId, @Valid @RequestBody OrderRequest req) {
        return Http.from(ledger.executeBuy(userId, req.stockCode(), req.quantity(), req.note()));
    }

    @PostMapping("/sell")
    public ResponseEntity<?> sell(@RequestHeader(USER_HEADER) String userId, @Valid @RequestBody OrderRequest req) {
        return Http.from(ledger.executeSell(userId, req.stockCode(), req.quantity(), req.note()));
    }
}
