package com.trade.arena.sim.enums;

public enum CapitalChangeReason {
    INITIAL("Initial funding"),
    REWARD("Ranking reward"),
    ADJUSTMENT("Manual adjustment");

    private final String description;

    CapitalChangeReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
