package com.trade.arena.sim.service.portfolio;

import com.trade.arena.sim.common.Result;
import com.trade.arena.sim.common.constants.ErrorCodes;
import com.trade.arena.sim.core.FastStateStore;
import com.trade.arena.sim.enums.CapitalChangeReason;
import com.trade.arena.sim.enums.League;
import com.trade.arena.sim.enums.RankingPeriod;
import com.trade.arena.sim.model.documents.CapitalHistory;
import com.trade.arena.sim.model.documents.Portfolio;
import com.trade.arena.sim.model.documents.RankingEntry;
import com.trade.arena.sim.repo.documents.PortfolioRepo;
import com.trade.arena.sim.repo.documents.RankingEntryRepo;
import com.trade.arena.sim.service.trade.PortfolioLocks;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Capital injections: manual bonuses and the monthly league rewards.
 * <p>
 * Rewards use the MONTHLY ranking restricted to each league: ROOKIE places 1-10 get
 * 10,000,000 and places 11-100 get 5,000,000; HALL_OF_FAME earns nothing yet. A per-user marker
 * makes a re-run after a partial failure pay only the users that were missed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CapitalService {

    static final BigDecimal ROOKIE_TOP10_REWARD = BigDecimal.valueOf(10_000_000L);
    static final BigDecimal ROOKIE_TOP100_REWARD = BigDecimal.valueOf(5_000_000L);
    private static final Duration MARKER_TTL = Duration.ofDays(40);

    private final PortfolioRepo portfolioRepo;
    private final RankingEntryRepo rankingEntryRepo;
    private final CapitalWriter capitalWriter;
    private final PortfolioLocks locks;
    private final FastStateStore stateStore;
    private final Clock clock;

    /**
     * Raises initial capital and cash by {@code amount} and records the change.
     */
    public Result<Portfolio> addCapitalBonus(String userId, BigDecimal amount, CapitalChangeReason reason, String description) {
        if (amount == null || amount.signum() <= 0) return Result.fail(ErrorCodes.INVALID_INPUT, "Bonus amount must be positive");

        PortfolioLocks.Lease lease = locks.acquire(userId);
        try {
            Optional<Portfolio> found = portfolioRepo.findByUserId(userId);
            if (found.isEmpty()) return Result.fail(ErrorCodes.NOT_FOUND, "Portfolio not found for user " + userId);

            Portfolio p = found.get();
            BigDecimal newTotal = p.getInitialCapital().add(amount);
            p.setInitialCapital(newTotal);
            p.setCash(p.getCash().add(amount));
            PortfolioValuation.revalue(p);

            CapitalHistory entry = CapitalHistory.builder()
                    .userId(userId)
                    .amount(amount)
                    .newTotal(newTotal)
                    .reason(reason)
                    .description(description)
                    .timestamp(clock.instant())
                    .build();
            Portfolio saved = capitalWriter.commit(p, entry);
            log.info("Capital +{} for {} ({}), initial capital now {}", amount, userId, reason, newTotal);
            return Result.ok(saved);
        } catch (OptimisticLockingFailureException e) {
            log.warn("Portfolio of {} changed while adding capital", userId);
            return Result.fail(ErrorCodes.CONCURRENT_MODIFICATION, "Portfolio was modified concurrently");
        } catch (RuntimeException e) {
            log.error("Capital change for {} failed", userId, e);
            return Result.fail(ErrorCodes.INTERNAL_ERROR, "Capital change failed: " + e.getMessage());
        } finally {
            lease.release();
        }
    }

    /**
     * Pays the rewards for {@code month} from the current MONTHLY ranking. The caller must run
     * this before the monthly baseline reset.
     */
    public Result<MonthlyRewardReport> distributeMonthlyRewards(YearMonth month) {
        String monthKey = "reward:" + month;
        if (stateStore.get(monthKey).filter("done"::equals).isPresent()) {
            log.info("Monthly rewards for {} already distributed", month);
            return Result.ok(new MonthlyRewardReport(month, false, 0, 0, BigDecimal.ZERO, List.of()));
        }

        List<RankingEntry> ranking = rankingEntryRepo.findByPeriodOrderByRankAsc(RankingPeriod.MONTHLY);
        Map<String, Portfolio> byUser = portfolioRepo.findAll().stream()
                .collect(Collectors.toMap(Portfolio::getUserId, Function.identity(), (a, b) -> a));

        int rookieRank = 0;
        int rewarded = 0;
        int skipped = 0;
        BigDecimal paid = BigDecimal.ZERO;
        List<String> failures = new ArrayList<>();
        for (RankingEntry e : ranking) {
            Portfolio p = byUser.get(e.getUserId());
            if (p == null) continue;
            if (p.getLeague() != League.ROOKIE) {
                skipped++;
                continue;
            }
            rookieRank++;
            BigDecimal amount = rewardFor(rookieRank);
            if (amount == null) break;

            String userKey = monthKey + ":" + e.getUserId();
            if (!stateStore.setIfAbsent(userKey, "paid", MARKER_TTL)) {
                skipped++;
                continue;
            }
            Result<Portfolio> r = addCapitalBonus(e.getUserId(), amount, CapitalChangeReason.REWARD,
                    "ROOKIE league monthly reward - Rank #" + rookieRank + " (" + month + ")");
            if (r.isSuccess()) {
                rewarded++;
                paid = paid.add(amount);
            } else {
                stateStore.delete(userKey);
                failures.add(e.getUserId() + ": " + r.getError());
            }
        }

        if (failures.isEmpty()) {
            stateStore.put(monthKey, "done", MARKER_TTL);
        }
        log.info("Monthly rewards {}: {} rewarded, {} skipped, {} paid, {} failed", month, rewarded, skipped, paid, failures.size());
        return Result.ok(new MonthlyRewardReport(month, true, rewarded, skipped, paid, failures));
    }

    static BigDecimal rewardFor(int leagueRank) {
        if (leagueRank >= 1 && leagueRank <= 10) return ROOKIE_TOP10_REWARD;
        if (leagueRank >= 11 && leagueRank <= 100) return ROOKIE_TOP100_REWARD;
        return null;
    }
}
