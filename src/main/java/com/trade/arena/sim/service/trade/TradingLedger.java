package com.trade.arena.sim.service.trade;

import com.trade.arena.sim.common.Result;
import com.trade.arena.sim.common.constants.ErrorCodes;
import com.trade.arena.sim.enums.TransactionType;
import com.trade.arena.sim.model.documents.Portfolio;
import com.trade.arena.sim.model.documents.Security;
import com.trade.arena.sim.model.documents.Transaction;
import com.trade.arena.sim.repo.documents.PortfolioRepo;
import com.trade.arena.sim.repo.documents.SecurityRepo;
import com.trade.arena.sim.service.market.PriceResolver;
import com.trade.arena.sim.service.portfolio.PortfolioValuation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Optional;

/**
 * Buy and sell orders against a user's simulated portfolio.
 * <p>
 * An order is validated and applied inside the user's lock; the resulting portfolio and its
 * transaction record are written by {@link LedgerWriter} in one transaction. Rejections are
 * returned as failed {@link Result}s and leave the stored state untouched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradingLedger {

    private final PortfolioRepo portfolioRepo;
    private final SecurityRepo securityRepo;
    private final PriceResolver priceResolver;
    private final PortfolioLocks locks;
    private final LedgerWriter writer;
    private final Clock clock;

    public Result<TradeReceipt> executeBuy(String userId, String code, long quantity, String note) {
        Result<TradeReceipt> invalid = validateInput(userId, code, quantity);
        if (invalid != null) return invalid;
        return underLock(userId, code, () -> applyBuy(userId, code, quantity, note));
    }

    public Result<TradeReceipt> executeSell(String userId, String code, long quantity, String note) {
        Result<TradeReceipt> invalid = validateInput(userId, code, quantity);
        if (invalid != null) return invalid;
        return underLock(userId, code, () -> applySell(userId, code, quantity, note));
    }

    // -------------------- Buy --------------------

    private Result<TradeReceipt> applyBuy(String userId, String code, long quantity, String note) {
        Optional<Portfolio> found = portfolioRepo.findByUserId(userId);
        if (found.isEmpty()) return reject(ErrorCodes.NOT_FOUND, "Portfolio not found for user " + userId);
        Optional<BigDecimal> resolved = priceResolver.currentPrice(code);
        if (resolved.isEmpty()) return reject(ErrorCodes.NOT_FOUND, "No price available for " + code);

        Portfolio p = found.get();
        BigDecimal price = resolved.get();
        BigDecimal cost = price.multiply(BigDecimal.valueOf(quantity));
        if (p.getCash().compareTo(cost) < 0) {
            return reject(ErrorCodes.INSUFFICIENT_FUNDS,
                    "Insufficient cash: need " + cost.toPlainString() + ", have " + p.getCash().toPlainString());
        }

        if (p.getHoldings() == null) p.setHoldings(new ArrayList<>());
        Portfolio.Holding holding = p.holding(code).orElse(null);
        String stockName;
        if (holding == null) {
            stockName = securityRepo.findById(code).map(Security::getName).orElse(code);
            holding = Portfolio.Holding.builder()
                    .stockCode(code)
                    .stockName(stockName)
                    .quantity(quantity)
                    .avgCost(PortfolioValuation.averageCost(0, BigDecimal.ZERO, quantity, price))
                    .currentPrice(price)
                    .build();
            p.getHoldings().add(holding);
        } else {
            stockName = holding.getStockName();
            holding.setAvgCost(PortfolioValuation.averageCost(holding.getQuantity(), holding.getAvgCost(), quantity, price));
            holding.setQuantity(holding.getQuantity() + quantity);
            holding.setCurrentPrice(price);
        }
        p.setCash(p.getCash().subtract(cost));
        PortfolioValuation.revalue(p);

        Transaction txn = Transaction.builder()
                .userId(userId)
                .type(TransactionType.BUY)
                .stockCode(code)
                .stockName(stockName)
                .quantity(quantity)
                .price(price)
                .totalAmount(cost)
                .note(note)
                .timestamp(clock.instant())
                .build();
        Transaction saved = writer.commit(p, txn);

        log.info("BUY {} x{} @ {} for {} (cash now {})", code, quantity, price, userId, p.getCash());
        return Result.ok(new TradeReceipt(saved.getId(), TransactionType.BUY, code, stockName, quantity, price,
                cost, null, p.getCash(), holding.getQuantity()));
    }

    // -------------------- Sell --------------------

    private Result<TradeReceipt> applySell(String userId, String code, long quantity, String note) {
        Optional<Portfolio> found = portfolioRepo.findByUserId(userId);
        if (found.isEmpty()) return reject(ErrorCodes.NOT_FOUND, "Portfolio not found for user " + userId);

        Portfolio p = found.get();
        Optional<Portfolio.Holding> held = p.holding(code);
        if (held.isEmpty()) return reject(ErrorCodes.STOCK_NOT_OWNED, "No holding of " + code);
        Portfolio.Holding holding = held.get();
        if (quantity > holding.getQuantity()) {
            return reject(ErrorCodes.INSUFFICIENT_QUANTITY,
                    "Cannot sell " + quantity + " of " + code + ", holding " + holding.getQuantity());
        }

        Optional<BigDecimal> resolved = priceResolver.currentPrice(code);
        if (resolved.isEmpty()) return reject(ErrorCodes.NOT_FOUND, "No price available for " + code);
        BigDecimal price = resolved.get();

        BigDecimal proceeds = price.multiply(BigDecimal.valueOf(quantity));
        BigDecimal pnl = PortfolioValuation.realizedPnl(holding.getAvgCost(), price, quantity);
        long remaining = holding.getQuantity() - quantity;
        if (remaining == 0) {
            p.getHoldings().remove(holding);
        } else {
            holding.setQuantity(remaining);
            holding.setCurrentPrice(price);
        }
        p.setCash(p.getCash().add(proceeds));
        p.setRealizedPnl((p.getRealizedPnl() == null ? BigDecimal.ZERO : p.getRealizedPnl()).add(pnl));
        PortfolioValuation.revalue(p);

        Transaction txn = Transaction.builder()
                .userId(userId)
                .type(TransactionType.SELL)
                .stockCode(code)
                .stockName(holding.getStockName())
                .quantity(quantity)
                .price(price)
                .totalAmount(proceeds)
                .realizedPnl(pnl)
                .note(note)
                .timestamp(clock.instant())
                .build();
        Transaction saved = writer.commit(p, txn);

        log.info("SELL {} x{} @ {} for {} (pnl {}, cash now {})", code, quantity, price, userId, pnl, p.getCash());
        return Result.ok(new TradeReceipt(saved.getId(), TransactionType.SELL, code, holding.getStockName(), quantity,
                price, proceeds, pnl, p.getCash(), remaining));
    }

    // -------------------- Helpers --------------------

    private interface OrderStep {
        Result<TradeReceipt> run();
    }

    private Result<TradeReceipt> underLock(String userId, String code, OrderStep step) {
        PortfolioLocks.Lease lease = locks.acquire(userId);
        try {
            return step.run();
        } catch (OptimisticLockingFailureException e) {
            log.warn("Portfolio of {} changed concurrently while trading {}", userId, code);
            return Result.fail(ErrorCodes.CONCURRENT_MODIFICATION, "Portfolio was modified concurrently, retry the order");
        } catch (RuntimeException e) {
            log.error("Order for {} on {} failed unexpectedly", userId, code, e);
            return Result.fail(ErrorCodes.INTERNAL_ERROR, "Order could not be processed");
        } finally {
            lease.release();
        }
    }

    private static Result<TradeReceipt> validateInput(String userId, String code, long quantity) {
        if (userId == null || userId.isBlank()) return reject(ErrorCodes.INVALID_INPUT, "userId is required");
        if (code == null || code.isBlank()) return reject(ErrorCodes.INVALID_INPUT, "stockCode is required");
        if (quantity <= 0) return reject(ErrorCodes.INVALID_INPUT, "Quantity must be a positive integer");
        return null;
    }

    private static Result<TradeReceipt> reject(String code, String message) {
        log.warn("Order rejected [{}]: {}", code, message);
        return Result.fail(code, message);
    }
}
