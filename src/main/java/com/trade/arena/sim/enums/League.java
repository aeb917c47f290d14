package com.trade.arena.sim.enums;

/**
 * Portfolios are split by total assets; only ROOKIE portfolios earn monthly rewards.
 */
public enum League {
    ROOKIE,
    HALL_OF_FAME
}
