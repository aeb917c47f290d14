package com.trade.arena.sim.service.quote;

import java.math.BigDecimal;

/**
 * One polled quote: last price, the day's range so far and cumulative daily volume.
 */
public record QuoteSnapshot(String code,
                            BigDecimal price,
                            BigDecimal open,
                            BigDecimal high,
                            BigDecimal low,
                            long cumulativeVolume) {
}
