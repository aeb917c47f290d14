package com.trade.arena.sim.service.ranking;

import com.trade.arena.sim.enums.RankingPeriod;

public record RankingRun(RankingPeriod period, int ranked) {
}
