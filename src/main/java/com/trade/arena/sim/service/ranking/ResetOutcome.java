package com.trade.arena.sim.service.ranking;

import com.trade.arena.sim.enums.RankingPeriod;

/**
 * Result of a baseline reset. {@code executed=false} means the run was not due or already done
 * for the day; {@code message} says which.
 */
public record ResetOutcome(RankingPeriod period, boolean executed, int updated, int skipped, String message) {

    static ResetOutcome ran(RankingPeriod period, int updated, int skipped) {
        return new ResetOutcome(period, true, updated, skipped, "Baseline reset");
    }

    static ResetOutcome notRun(RankingPeriod period, String why) {
        return new ResetOutcome(period, false, 0, 0, why);
    }
}
