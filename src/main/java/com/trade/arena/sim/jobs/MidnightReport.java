package com.trade.arena.sim.jobs;

import com.trade.arena.sim.service.portfolio.MonthlyRewardReport;
import com.trade.arena.sim.service.ranking.LeagueReport;
import com.trade.arena.sim.service.ranking.ResetOutcome;

import java.time.LocalDate;
import java.util.List;

/**
 * What the midnight run did per subtask; a null field means the subtask did not run or failed,
 * in which case {@code errors} says why.
 */
public record MidnightReport(LocalDate day,
                             LeagueReport leagues,
                             MonthlyRewardReport rewards,
                             Integer snapshots,
                             ResetOutcome weeklyReset,
                             ResetOutcome monthlyReset,
                             List<String> errors) {

    public boolean isClean() {
        return errors.isEmpty();
    }
}
