package com.trade.arena.sim.service.trade;

import com.trade.arena.sim.enums.TransactionType;

import java.math.BigDecimal;

/**
 * What an applied order did. {@code realizedPnl} is null for buys.
 */
public record TradeReceipt(String transactionId,
                           TransactionType type,
                           String stockCode,
                           String stockName,
                           long quantity,
                           BigDecimal price,
                           BigDecimal amount,
                           BigDecimal realizedPnl,
                           BigDecimal cashAfter,
                           long holdingQuantityAfter) {
}
