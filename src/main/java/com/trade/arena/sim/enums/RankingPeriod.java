package com.trade.arena.sim.enums;

/**
 * Ranking windows. WEEKLY and MONTHLY are measured against a baseline captured at the start of
 * the period; ALL_TIME against the portfolio's initial capital.
 */
public enum RankingPeriod {
    WEEKLY,
    MONTHLY,
    ALL_TIME
}
