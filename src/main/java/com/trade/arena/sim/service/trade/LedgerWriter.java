package com.trade.arena.sim.service.trade;

import com.trade.arena.sim.model.documents.Portfolio;
import com.trade.arena.sim.model.documents.Transaction;
import com.trade.arena.sim.repo.documents.PortfolioRepo;
import com.trade.arena.sim.repo.documents.TransactionRepo;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persists one applied order: the versioned portfolio save and the transaction insert commit
 * together or not at all.
 */
@Component
@RequiredArgsConstructor
public class LedgerWriter {

    private final PortfolioRepo portfolioRepo;
    private final TransactionRepo transactionRepo;

    @Transactional
    public Transaction commit(Portfolio portfolio, Transaction txn) {
        portfolioRepo.save(portfolio);
        return transactionRepo.insert(txn);
    }
}
