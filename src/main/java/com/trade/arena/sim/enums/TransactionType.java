package com.trade.arena.sim.enums;

public enum TransactionType {
    BUY,
    SELL
}
