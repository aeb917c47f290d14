package com.trade.arena.sim.service.ranking;

public record LeagueReport(int classified, int promoted, int demoted, int unchanged) {
}
