package com.trade.arena.sim.service.ranking;

import com.trade.arena.sim.common.Result;
import com.trade.arena.sim.common.constants.ErrorCodes;
import com.trade.arena.sim.common.time.TradingCalendar;
import com.trade.arena.sim.core.FastStateStore;
import com.trade.arena.sim.enums.RankingPeriod;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDate;
import java.util.function.Predicate;

/**
 * Rebases weekly (Mondays) and monthly (1st) baselines.
 * <p>
 * The {@code *IfDue} variants evaluate the boundary on the exchange calendar day and claim a
 * run-once marker {@code reset:<period>:<day>} first; a failed reset releases the marker so the
 * trigger can be repeated.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PeriodResetService {

    static final Duration MARKER_TTL = Duration.ofDays(3);

    private final PeriodBaselineWriter baselineWriter;
    private final FastStateStore stateStore;
    private final TradingCalendar calendar;

    public Result<ResetOutcome> resetWeeklyPeriod() {
        return reset(RankingPeriod.WEEKLY);
    }

    public Result<ResetOutcome> resetMonthlyPeriod() {
        return reset(RankingPeriod.MONTHLY);
    }

    public Result<ResetOutcome> resetWeeklyIfDue(LocalDate day) {
        return resetIfDue(RankingPeriod.WEEKLY, day, calendar::isMonday);
    }

    public Result<ResetOutcome> resetMonthlyIfDue(LocalDate day) {
        return resetIfDue(RankingPeriod.MONTHLY, day, calendar::isFirstOfMonth);
    }

    static String markerKey(RankingPeriod period, LocalDate day) {
        return "reset:" + period.name().toLowerCase() + ":" + day;
    }

    private Result<ResetOutcome> resetIfDue(RankingPeriod period, LocalDate day, Predicate<LocalDate> due) {
        if (!due.test(day)) {
            return Result.ok(ResetOutcome.notRun(period, "Not a " + period.name().toLowerCase() + " boundary"));
        }
        String key = markerKey(period, day);
        if (!stateStore.setIfAbsent(key, "running", MARKER_TTL)) {
            log.info("{} reset for {} already ran, skipping", period, day);
            return Result.ok(ResetOutcome.notRun(period, "Already reset for " + day));
        }
        Result<ResetOutcome> r = reset(period);
        if (r.isSuccess()) {
            stateStore.put(key, "done", MARKER_TTL);
        } else {
            stateStore.delete(key);
        }
        return r;
    }

    private Result<ResetOutcome> reset(RankingPeriod period) {
        try {
            ResetOutcome outcome = baselineWriter.rebase(period);
            log.info("{} baseline reset: {} portfolios updated, {} skipped", period, outcome.updated(), outcome.skipped());
            return Result.ok(outcome);
        } catch (RuntimeException e) {
            log.error("{} baseline reset failed, nothing was applied", period, e);
            return Result.fail(ErrorCodes.INTERNAL_ERROR, period + " reset failed: " + e.getMessage());
        }
    }
}
