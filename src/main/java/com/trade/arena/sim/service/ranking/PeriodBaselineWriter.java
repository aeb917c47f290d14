package com.trade.arena.sim.service.ranking;

import com.trade.arena.sim.enums.RankingPeriod;
import com.trade.arena.sim.model.documents.Portfolio;
import com.trade.arena.sim.repo.documents.PortfolioRepo;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Moves every portfolio's weekly or monthly baseline to its current total assets in a single
 * transaction.
 */
@Component
@RequiredArgsConstructor
public class PeriodBaselineWriter {

    private final PortfolioRepo portfolioRepo;

    @Transactional
    public ResetOutcome rebase(RankingPeriod period) {
        if (period == RankingPeriod.ALL_TIME) {
            throw new IllegalArgumentException("ALL_TIME has no baseline");
        }
        List<Portfolio> changed = new ArrayList<>();
        int skipped = 0;
        for (Portfolio p : portfolioRepo.findAll()) {
            if (p.getTotalAssets() == null) {
                skipped++;
                continue;
            }
            if (period == RankingPeriod.WEEKLY) {
                p.setWeeklyStartAssets(p.getTotalAssets());
            } else {
                p.setMonthlyStartAssets(p.getTotalAssets());
            }
            changed.add(p);
        }
        portfolioRepo.saveAll(changed);
        return ResetOutcome.ran(period, changed.size(), skipped);
    }
}
