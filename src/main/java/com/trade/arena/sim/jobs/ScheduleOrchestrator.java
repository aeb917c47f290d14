package com.trade.arena.sim.jobs;

import com.trade.arena.sim.common.Result;
import com.trade.arena.sim.common.constants.ErrorCodes;
import com.trade.arena.sim.common.time.TradingCalendar;
import com.trade.arena.sim.enums.RankingPeriod;
import com.trade.arena.sim.service.market.CollectionReport;
import com.trade.arena.sim.service.market.PriceCollector;
import com.trade.arena.sim.service.portfolio.CapitalService;
import com.trade.arena.sim.service.portfolio.MonthlyRewardReport;
import com.trade.arena.sim.service.portfolio.PortfolioService;
import com.trade.arena.sim.service.ranking.LeagueReport;
import com.trade.arena.sim.service.ranking.LeagueService;
import com.trade.arena.sim.service.ranking.PeriodResetService;
import com.trade.arena.sim.service.ranking.PortfolioSnapshotService;
import com.trade.arena.sim.service.ranking.RankingEngine;
import com.trade.arena.sim.service.ranking.RankingRun;
import com.trade.arena.sim.service.ranking.ResetOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * One-shot trigger operations for an external clock. None of them keeps state between calls;
 * each reports counts and leaves per-item effects of a partial failure in place.
 * <p>
 * Expected windows (exchange time): intraday every 5 minutes 09:00-15:30 Mon-Fri, candle
 * finalize 15:35, snapshot 15:40, rankings 16:10, midnight tasks 00:00.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleOrchestrator {

    static final String MARKET_CLOSED = "Market is closed";

    private final TradingCalendar calendar;
    private final PriceCollector priceCollector;
    private final PortfolioService portfolioService;
    private final PortfolioSnapshotService snapshotService;
    private final RankingEngine rankingEngine;
    private final PeriodResetService periodResetService;
    private final LeagueService leagueService;
    private final CapitalService capitalService;

    public Result<TaskOutcome<CollectionReport>> intradayTick() {
        if (!calendar.isMarketOpen()) {
            log.info("Intraday tick at {}: market closed, nothing to do", calendar.now());
            return Result.ok(TaskOutcome.skipped("intraday-update", MARKET_CLOSED));
        }
        return guarded("intraday-update", () -> Result.ok(TaskOutcome.ran("intraday-update", priceCollector.runIntradayUpdate())));
    }

    public Result<TaskOutcome<Integer>> finalizeDailyCandles() {
        return guarded("daily-candle", () -> Result.ok(TaskOutcome.ran("daily-candle", priceCollector.runDailyCandleCreation())));
    }

    /**
     * Revalues every portfolio at closing prices, then stores today's snapshot.
     */
    public Result<TaskOutcome<Integer>> snapshotPortfolios() {
        return guarded("portfolio-snapshot", () -> {
            Result<Integer> revalued = portfolioService.revalueAll();
            if (revalued.isFailure()) return revalued.<TaskOutcome<Integer>>asFailure();
            return snapshotService.snapshotAll(calendar.today()).map(n -> TaskOutcome.ran("portfolio-snapshot", n));
        });
    }

    public Result<TaskOutcome<Map<RankingPeriod, Integer>>> updateRankings() {
        return guarded("ranking-update", () -> rankingEngine.computeAll().map(m -> TaskOutcome.ran("ranking-update", m)));
    }

    public Result<TaskOutcome<CollectionReport>> backfill(LocalDate date) {
        if (date == null || !date.isBefore(calendar.today())) {
            return Result.fail(ErrorCodes.INVALID_INPUT, "Backfill date must be a past day");
        }
        return guarded("backfill", () -> Result.ok(TaskOutcome.ran("backfill", priceCollector.backfillDate(date))));
    }

    public Result<TaskOutcome<Integer>> backfillRange(String code, int days) {
        if (code == null || code.isBlank() || days <= 0) {
            return Result.fail(ErrorCodes.INVALID_INPUT, "code and a positive day count are required");
        }
        return guarded("backfill-range", () -> Result.ok(TaskOutcome.ran("backfill-range", priceCollector.backfillRange(code, days))));
    }

    /**
     * League classification, then on the 1st the monthly ranking refresh and rewards, then
     * baseline snapshots, then the weekly (Monday) and monthly (1st) resets. A failing subtask
     * is recorded and the rest still run.
     */
    public Result<MidnightReport> midnightTasks() {
        LocalDate today = calendar.today();
        List<String> errors = new ArrayList<>();
        log.info("Midnight tasks started for {}", today);

        LeagueReport leagues = step("league classification", errors, leagueService::classifyAll);

        MonthlyRewardReport rewards = null;
        if (calendar.isFirstOfMonth(today)) {
            YearMonth previous = YearMonth.from(today).minusMonths(1);
            RankingRun monthly = step("monthly ranking refresh", errors,
                    () -> rankingEngine.computeRanking(RankingPeriod.MONTHLY));
            if (monthly != null) {
                rewards = step("monthly rewards", errors, () -> capitalService.distributeMonthlyRewards(previous));
            }
        }

        Integer snapshots = step("portfolio snapshots", errors, () -> snapshotService.snapshotAll(today));
        ResetOutcome weekly = step("weekly reset", errors, () -> periodResetService.resetWeeklyIfDue(today));
        ResetOutcome monthlyReset = step("monthly reset", errors, () -> periodResetService.resetMonthlyIfDue(today));

        MidnightReport report = new MidnightReport(today, leagues, rewards, snapshots, weekly, monthlyReset, List.copyOf(errors));
        if (report.isClean()) {
            log.info("Midnight tasks for {} finished", today);
        } else {
            log.warn("Midnight tasks for {} finished with {} error(s): {}", today, errors.size(), errors);
        }
        return Result.ok(report);
    }

    // -------------------- Helpers --------------------

    private <T> T step(String name, List<String> errors, Supplier<Result<T>> task) {
        try {
            Result<T> r = task.get();
            if (r.isSuccess()) return r.get();
            errors.add(name + " failed: " + r.getError());
        } catch (RuntimeException e) {
            log.error("Midnight subtask '{}' failed", name, e);
            errors.add(name + " failed: " + e.getMessage());
        }
        return null;
    }

    private <T> Result<T> guarded(String task, Supplier<Result<T>> body) {
        long t0 = System.currentTimeMillis();
        try {
            Result<T> r = body.get();
            log.info("Trigger {} done in {} ms (success={})", task, System.currentTimeMillis() - t0, r.isSuccess());
            return r;
        } catch (RuntimeException e) {
            log.error("Trigger {} failed", task, e);
            return Result.fail(ErrorCodes.INTERNAL_ERROR, task + " failed");
        }
    }
}
