package com.trade.arena.sim.service.portfolio;

import com.trade.arena.sim.model.documents.Portfolio;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Money arithmetic shared by the ledger and the batch jobs.
 */
public final class PortfolioValuation {

    public static final int MONEY_SCALE = 2;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private PortfolioValuation() {
    }

    /**
     * cash + sum(quantity x currentPrice); a holding never priced falls back to its average cost.
     */
    public static BigDecimal totalAssets(BigDecimal cash, List<Portfolio.Holding> holdings) {
        BigDecimal total = cash;
        if (holdings == null) return total;
        for (Portfolio.Holding h : holdings) {
            BigDecimal px = h.getCurrentPrice() != null ? h.getCurrentPrice() : h.getAvgCost();
            total = total.add(px.multiply(BigDecimal.valueOf(h.getQuantity())));
        }
        return total;
    }

    /**
     * Percent return over {@code base}, rounded to 2 decimals; 0 when the base is 0.
     */
    public static BigDecimal totalReturn(BigDecimal totalAssets, BigDecimal base) {
        if (base == null || base.signum() == 0) return BigDecimal.ZERO.setScale(MONEY_SCALE);
        return totalAssets.subtract(base)
                .multiply(HUNDRED)
                .divide(base, MONEY_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Weighted average cost after adding {@code addQty} shares at {@code price}.
     */
    public static BigDecimal averageCost(long heldQty, BigDecimal heldAvg, long addQty, BigDecimal price) {
        if (heldQty == 0) return price.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
        BigDecimal cost = heldAvg.multiply(BigDecimal.valueOf(heldQty))
                .add(price.multiply(BigDecimal.valueOf(addQty)));
        return cost.divide(BigDecimal.valueOf(heldQty + addQty), MONEY_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal realizedPnl(BigDecimal avgCost, BigDecimal price, long quantity) {
        return price.subtract(avgCost)
                .multiply(BigDecimal.valueOf(quantity))
                .setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Recomputes {@code totalAssets} and {@code totalReturn} from cash and holdings in place.
     */
    public static void revalue(Portfolio p) {
        BigDecimal assets = totalAssets(p.getCash(), p.getHoldings());
        p.setTotalAssets(assets);
        p.setTotalReturn(totalReturn(assets, p.getInitialCapital()));
    }
}
