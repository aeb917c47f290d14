package com.trade.arena.sim.service.ranking;

import com.trade.arena.sim.common.Result;
import com.trade.arena.sim.enums.League;
import com.trade.arena.sim.model.documents.Portfolio;
import com.trade.arena.sim.repo.documents.PortfolioRepo;
import com.trade.arena.sim.service.trade.PortfolioLocks;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Places each portfolio in a league by total assets.
 */
@Slf4j
@Service
public class LeagueService {

    @Autowired
    private PortfolioRepo portfolioRepo;
    @Autowired
    private PortfolioLocks locks;

    @Value("${arena.league.hall-of-fame-threshold:100000000}")
    private BigDecimal hallOfFameThreshold = BigDecimal.valueOf(100_000_000L);

    public League leagueFor(BigDecimal totalAssets) {
        if (totalAssets != null && totalAssets.compareTo(hallOfFameThreshold) >= 0) return League.HALL_OF_FAME;
        return League.ROOKIE;
    }

    public Result<LeagueReport> classifyAll() {
        int classified = 0;
        int promoted = 0;
        int demoted = 0;
        int unchanged = 0;
        for (Portfolio snapshot : portfolioRepo.findAll()) {
            PortfolioLocks.Lease lease = locks.acquire(snapshot.getUserId());
            try {
                Portfolio p = portfolioRepo.findByUserId(snapshot.getUserId()).orElse(null);
                if (p == null) continue;
                classified++;
                League current = p.getLeague() == null ? League.ROOKIE : p.getLeague();
                League target = leagueFor(p.getTotalAssets());
                if (target == current && p.getLeague() != null) {
                    unchanged++;
                    continue;
                }
                p.setLeague(target);
                portfolioRepo.save(p);
                if (target.ordinal() > current.ordinal()) {
                    promoted++;
                    log.info("{} promoted to {}", p.getUserId(), target);
                } else if (target.ordinal() < current.ordinal()) {
                    demoted++;
                    log.info("{} demoted to {}", p.getUserId(), target);
                } else {
                    unchanged++;
                }
            } catch (OptimisticLockingFailureException e) {
                log.warn("League update for {} lost a concurrent write, left for the next run", snapshot.getUserId());
            } finally {
                lease.release();
            }
        }
        log.info("League classification: {} classified, {} promoted, {} demoted", classified, promoted, demoted);
        return Result.ok(new LeagueReport(classified, promoted, demoted, unchanged));
    }
}
