package com.trade.arena.sim.service.portfolio;

import com.trade.arena.sim.common.Result;
import com.trade.arena.sim.common.constants.ErrorCodes;
import com.trade.arena.sim.enums.CapitalChangeReason;
import com.trade.arena.sim.enums.League;
import com.trade.arena.sim.model.documents.CapitalHistory;
import com.trade.arena.sim.model.documents.Portfolio;
import com.trade.arena.sim.model.documents.Transaction;
import com.trade.arena.sim.repo.documents.CapitalHistoryRepo;
import com.trade.arena.sim.repo.documents.PortfolioRepo;
import com.trade.arena.sim.repo.documents.TransactionRepo;
import com.trade.arena.sim.service.market.PriceResolver;
import com.trade.arena.sim.service.trade.PortfolioLocks;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
public class PortfolioService {

    @Autowired
    private PortfolioRepo portfolioRepo;
    @Autowired
    private TransactionRepo transactionRepo;
    @Autowired
    private CapitalHistoryRepo capitalHistoryRepo;
    @Autowired
    private CapitalWriter capitalWriter;
    @Autowired
    private PriceResolver priceResolver;
    @Autowired
    private PortfolioLocks locks;
    @Autowired
    private Clock clock;

    @Value("${arena.portfolio.initial-capital:10000000}")
    private BigDecimal defaultInitialCapital = BigDecimal.valueOf(10_000_000L);

    /**
     * Onboards a user. Calling it again for the same user returns the existing portfolio.
     */
    public Result<Portfolio> openPortfolio(String userId, String username, BigDecimal initialCapital) {
        if (userId == null || userId.isBlank()) return Result.fail(ErrorCodes.INVALID_INPUT, "userId is required");
        BigDecimal capital = initialCapital == null ? defaultInitialCapital : initialCapital;
        if (capital.signum() <= 0) return Result.fail(ErrorCodes.INVALID_INPUT, "Initial capital must be positive");

        PortfolioLocks.Lease lease = locks.acquire(userId);
        try {
            Optional<Portfolio> existing = portfolioRepo.findByUserId(userId);
            if (existing.isPresent()) return Result.ok(existing.get());

            Portfolio p = Portfolio.builder()
                    .userId(userId)
                    .username(username == null || username.isBlank() ? userId : username)
                    .initialCapital(capital)
                    .cash(capital)
                    .holdings(new ArrayList<>())
                    .totalAssets(capital)
                    .totalReturn(PortfolioValuation.totalReturn(capital, capital))
                    .realizedPnl(BigDecimal.ZERO)
                    .weeklyStartAssets(capital)
                    .monthlyStartAssets(capital)
                    .league(League.ROOKIE)
                    .build();
            CapitalHistory initial = CapitalHistory.builder()
                    .userId(userId)
                    .amount(capital)
                    .newTotal(capital)
                    .reason(CapitalChangeReason.INITIAL)
                    .description(CapitalChangeReason.INITIAL.getDescription())
                    .timestamp(clock.instant())
                    .build();
            Portfolio saved = capitalWriter.commit(p, initial);
            log.info("Opened portfolio for {} with {}", userId, capital);
            return Result.ok(saved);
        } catch (DuplicateKeyException e) {
            // opened concurrently by another instance
            return portfolioRepo.findByUserId(userId)
                    .map(Result::ok)
                    .orElseGet(() -> Result.fail(ErrorCodes.INTERNAL_ERROR, "Portfolio could not be opened"));
        } finally {
            lease.release();
        }
    }

    public Result<Portfolio> getPortfolio(String userId) {
        return portfolioRepo.findByUserId(userId)
                .map(Result::ok)
                .orElseGet(() -> Result.fail(ErrorCodes.NOT_FOUND, "Portfolio not found for user " + userId));
    }

    public List<Transaction> getTransactions(String userId) {
        return transactionRepo.findByUserIdOrderByTimestampDesc(userId);
    }

    public List<CapitalHistory> getCapitalHistory(String userId) {
        return capitalHistoryRepo.findByUserIdOrderByTimestampDesc(userId);
    }

    /**
     * Re-prices every holding at the current resolved price and recomputes assets and return.
     * Holdings without a resolvable price keep their last known price.
     */
    public Result<Portfolio> recalculateMetrics(String userId) {
        PortfolioLocks.Lease lease = locks.acquire(userId);
        try {
            Optional<Portfolio> found = portfolioRepo.findByUserId(userId);
            if (found.isEmpty()) return Result.fail(ErrorCodes.NOT_FOUND, "Portfolio not found for user " + userId);

            Portfolio p = found.get();
            if (p.getHoldings() != null) {
                for (Portfolio.Holding h : p.getHoldings()) {
                    priceResolver.currentPrice(h.getStockCode()).ifPresent(h::setCurrentPrice);
                }
            }
            PortfolioValuation.revalue(p);
            return Result.ok(portfolioRepo.save(p));
        } catch (OptimisticLockingFailureException e) {
            log.warn("Portfolio of {} changed during revaluation", userId);
            return Result.fail(ErrorCodes.CONCURRENT_MODIFICATION, "Portfolio was modified concurrently");
        } finally {
            lease.release();
        }
    }

    /**
     * @return number of portfolios revalued; failures are logged and skipped
     */
    public Result<Integer> revalueAll() {
        int ok = 0;
        int failed = 0;
        for (Portfolio p : portfolioRepo.findAll()) {
            try {
                Result<Portfolio> r = recalculateMetrics(p.getUserId());
                if (r.isSuccess()) {
                    ok++;
                } else {
                    failed++;
                    log.warn("Revaluation of {} failed: {}", p.getUserId(), r.getError());
                }
            } catch (RuntimeException e) {
                failed++;
                log.error("Revaluation of {} failed", p.getUserId(), e);
            }
        }
        log.info("Revalued {} portfolios ({} failed)", ok, failed);
        return Result.ok(ok);
    }
}
