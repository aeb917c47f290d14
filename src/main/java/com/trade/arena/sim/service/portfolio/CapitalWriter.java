package com.trade.arena.sim.service.portfolio;

import com.trade.arena.sim.model.documents.CapitalHistory;
import com.trade.arena.sim.model.documents.Portfolio;
import com.trade.arena.sim.repo.documents.CapitalHistoryRepo;
import com.trade.arena.sim.repo.documents.PortfolioRepo;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes a capital change: the portfolio and its capital-history row commit together.
 */
@Component
@RequiredArgsConstructor
public class CapitalWriter {

    private final PortfolioRepo portfolioRepo;
    private final CapitalHistoryRepo capitalHistoryRepo;

    @Transactional
    public Portfolio commit(Portfolio portfolio, CapitalHistory entry) {
        Portfolio saved = portfolioRepo.save(portfolio);
        capitalHistoryRepo.insert(entry);
        return saved;
    }
}
