package com.trade.arena.sim.web;

import com.trade.arena.sim.common.Result;
import com.trade.arena.sim.common.exception.Http;
import com.trade.arena.sim.common.time.TradingCalendar;
import com.trade.arena.sim.service.portfolio.PortfolioService;
import com.trade.arena.sim.service.ranking.PortfolioSnapshotService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.time.LocalDate;

@RestController
@RequestMapping("/api/portfolio")
@RequiredArgsConstructor
public class PortfolioController {

    private final PortfolioService portfolio;
    private final PortfolioSnapshotService snapshots;
    private final TradingCalendar calendar;

    public record OpenRequest(String username, BigDecimal initialCapital) {
    }

    @GetMapping
    public ResponseEntity<?> get(@RequestHeader(TradingController.USER_HEADER) String userId) {
        return Http.from(portfolio.getPortfolio(userId));
    }

    @PostMapping
    public ResponseEntity<?> open(@RequestHeader(TradingController.USER_HEADER) String userId,
                                  @RequestBody(required = false) OpenRequest req) {
        String username = req == null ? null : req.username();
        BigDecimal capital = req == null ? null : req.initialCapital();
        return Http.from(portfolio.openPortfolio(userId, username, capital));
    }

    @GetMapping("/transactions")
    public ResponseEntity<?> transactions(@RequestHeader(TradingController.USER_HEADER) String userId) {
        return Http.from(Result.ok(portfolio.getTransactions(userId)));
    }

    @GetMapping("/capital-history")
    public ResponseEntity<?> capitalHistory(@RequestHeader(TradingController.USER_HEADER) String userId) {
        return Http.from(Result.ok(portfolio.getCapitalHistory(userId)));
    }

    /**
     * Daily snapshots; defaults to the last 30 days.
     */
    @GetMapping("/history")
    public ResponseEntity<?> history(@RequestHeader(TradingController.USER_HEADER) String userId,
                                     @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                                     @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        LocalDate end = to != null ? to : calendar.today();
        LocalDate start = from != null ? from : end.minusDays(30);
        return Http.from(Result.ok(snapshots.history(userId, start, end)));
    }
}
