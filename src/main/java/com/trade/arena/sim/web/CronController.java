package com.trade.arena.sim.web;

import com.trade.arena.sim.common.exception.Http;
import com.trade.arena.sim.jobs.ScheduleOrchestrator;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

/**
 * Trigger endpoints for the external scheduler. Guarded by the cron bearer secret.
 */
@RestController
@RequestMapping("/api/cron")
@RequiredArgsConstructor
public class CronController {

    private final ScheduleOrchestrator orchestrator;

    @PostMapping("/intraday-update")
    public ResponseEntity<?> intradayUpdate() {
        return Http.from(orchestrator.intradayTick());
    }

    @PostMapping("/daily-candle")
    public ResponseEntity<?> dailyCandle() {
        return Http.from(orchestrator.finalizeDailyCandles());
    }

    @PostMapping("/portfolio-snapshot")
    public ResponseEntity<?> portfolioSnapshot() {
        return Http.from(orchestrator.snapshotPortfolios());
    }

    @PostMapping("/ranking-update")
    public ResponseEntity<?> rankingUpdate() {
        return Http.from(orchestrator.updateRankings());
    }

    @PostMapping("/midnight")
    public ResponseEntity<?> midnight() {
        return Http.from(orchestrator.midnightTasks());
    }

    /**
     * Manual gap repair for one past trading day.
     */
    @PostMapping("/backfill")
    public ResponseEntity<?> backfill(@RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return Http.from(orchestrator.backfill(date));
    }

    /**
     * Fills the missing days of one security's recent history.
     */
    @PostMapping("/backfill-range")
    public ResponseEntity<?> backfillRange(@RequestParam("code") String code,
                                           @RequestParam(name = "days", defaultValue = "30") int days) {
        return Http.from(orchestrator.backfillRange(code, days));
    }
}
