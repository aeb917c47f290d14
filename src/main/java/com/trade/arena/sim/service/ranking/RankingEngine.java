package com.trade.arena.sim.service.ranking;

import com.trade.arena.sim.common.Result;
import com.trade.arena.sim.common.constants.ErrorCodes;
import com.trade.arena.sim.enums.RankingPeriod;
import com.trade.arena.sim.model.documents.Portfolio;
import com.trade.arena.sim.model.documents.RankingEntry;
import com.trade.arena.sim.repo.documents.PortfolioRepo;
import com.trade.arena.sim.repo.documents.RankingEntryRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Period returns and rankings over all portfolios.
 * <p>
 * Order: period return descending, then username ascending, then user id ascending. Ranks are
 * positions starting at 1, so equal returns still get distinct ranks.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RankingEngine {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int RETURN_SCALE = 4;

    static final Comparator<Scored> RANK_ORDER = Comparator
            .comparing(Scored::periodReturn, Comparator.reverseOrder())
            .thenComparing(Scored::username, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Scored::userId);

    private final PortfolioRepo portfolioRepo;
    private final RankingEntryRepo rankingEntryRepo;
    private final RankingWriter rankingWriter;
    private final Clock clock;

    @Value("${arena.ranking.limit:100}")
    private int defaultLimit = 100;

    record Scored(String userId, String username, BigDecimal periodReturn) {
    }

    public Result<RankingRun> computeRanking(RankingPeriod period) {
        try {
            List<Portfolio> portfolios = portfolioRepo.findAll();
            List<Scored> scored = new ArrayList<>(portfolios.size());
            for (Portfolio p : portfolios) {
                scored.add(new Scored(p.getUserId(), p.getUsername(), periodReturn(p, period)));
            }
            scored.sort(RANK_ORDER);

            Instant now = clock.instant();
            List<RankingEntry> entries = new ArrayList<>(scored.size());
            int rank = 1;
            for (Scored s : scored) {
                entries.add(RankingEntry.builder()
                        .period(period)
                        .userId(s.userId())
                        .username(s.username())
                        .rank(rank++)
                        .periodReturn(s.periodReturn())
                        .updatedAt(now)
                        .build());
            }
            int written = rankingWriter.replace(period, entries);
            log.info("{} ranking replaced: {} entries", period, written);
            return Result.ok(new RankingRun(period, written));
        } catch (RuntimeException e) {
            log.error("{} ranking computation failed", period, e);
            return Result.fail(ErrorCodes.INTERNAL_ERROR, period + " ranking failed: " + e.getMessage());
        }
    }

    /**
     * WEEKLY, MONTHLY and ALL_TIME in turn; one failing period does not stop the others.
     */
    public Result<Map<RankingPeriod, Integer>> computeAll() {
        Map<RankingPeriod, Integer> counts = new EnumMap<>(RankingPeriod.class);
        List<String> errors = new ArrayList<>();
        for (RankingPeriod period : RankingPeriod.values()) {
            Result<RankingRun> r = computeRanking(period);
            if (r.isSuccess()) {
                counts.put(period, r.get().ranked());
            } else {
                errors.add(r.getError());
            }
        }
        if (!errors.isEmpty()) return Result.fail(ErrorCodes.INTERNAL_ERROR, String.join("; ", errors));
        return Result.ok(counts);
    }

    /**
     * ALL_TIME uses the stored total return; WEEKLY and MONTHLY measure against their baseline
     * and yield 0 when the baseline is missing or zero.
     */
    public static BigDecimal periodReturn(Portfolio p, RankingPeriod period) {
        if (period == RankingPeriod.ALL_TIME) {
            return p.getTotalReturn() == null ? BigDecimal.ZERO : p.getTotalReturn();
        }
        BigDecimal baseline = period == RankingPeriod.WEEKLY ? p.getWeeklyStartAssets() : p.getMonthlyStartAssets();
        if (baseline == null || baseline.signum() == 0 || p.getTotalAssets() == null) {
            return BigDecimal.ZERO;
        }
        return p.getTotalAssets().subtract(baseline)
                .multiply(HUNDRED)
                .divide(baseline, RETURN_SCALE, RoundingMode.HALF_UP);
    }

    // -------------------- Reads --------------------

    public List<RankingEntry> getRankings(RankingPeriod period, Integer limit) {
        int size = (limit == null || limit <= 0) ? defaultLimit : limit;
        return rankingEntryRepo.findByPeriodOrderByRankAsc(period, PageRequest.of(0, size));
    }

    public Optional<RankingEntry> getUserRank(String userId, RankingPeriod period) {
        return rankingEntryRepo.findByPeriodAndUserId(period, userId);
    }
}
