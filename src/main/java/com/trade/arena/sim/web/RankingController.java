package com.trade.arena.sim.web;

import com.trade.arena.sim.common.Result;
import com.trade.arena.sim.common.constants.ErrorCodes;
import com.trade.arena.sim.common.exception.Http;
import com.trade.arena.sim.enums.RankingPeriod;
import com.trade.arena.sim.service.ranking.RankingEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/rankings")
@RequiredArgsConstructor
public class RankingController {

    private final RankingEngine rankings;

    @GetMapping
    public ResponseEntity<?> list(@RequestParam(name = "period", defaultValue = "WEEKLY") RankingPeriod period,
                                  @RequestParam(name = "limit", required = false) Integer limit) {
        return Http.from(Result.ok(rankings.getRankings(period, limit)));
    }

    @GetMapping("/me")
    public ResponseEntity<?> mine(@RequestHeader(TradingController.USER_HEADER) String userId,
                                  @RequestParam(name = "period", defaultValue = "WEEKLY") RankingPeriod period) {
        return Http.from(rankings.getUserRank(userId, period)
                .map(Result::ok)
                .orElseGet(() -> Result.fail(ErrorCodes.NOT_FOUND, "No " + period + " rank for " + userId)));
    }
}
