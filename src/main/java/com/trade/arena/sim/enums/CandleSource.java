package com.trade.arena.sim.enums;

/**
 * Where the last write to a daily candle came from.
 */
public enum CandleSource {
    TICK,
    LIVE,
    BACKFILL
}
