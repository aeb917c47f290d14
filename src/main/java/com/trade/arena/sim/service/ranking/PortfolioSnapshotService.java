package com.trade.arena.sim.service.ranking;

import com.trade.arena.sim.common.Result;
import com.trade.arena.sim.model.documents.Portfolio;
import com.trade.arena.sim.model.documents.PortfolioSnapshot;
import com.trade.arena.sim.repo.documents.PortfolioRepo;
import com.trade.arena.sim.repo.documents.PortfolioSnapshotRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;

/**
 * End-of-day asset snapshots, one per portfolio and calendar day.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PortfolioSnapshotService {

    private final PortfolioRepo portfolioRepo;
    private final PortfolioSnapshotRepo snapshotRepo;

    /**
     * Upserts today's snapshot for every portfolio; re-running on the same day overwrites.
     *
     * @return number of snapshots written
     */
    public Result<Integer> snapshotAll(LocalDate day) {
        int written = 0;
        for (Portfolio p : portfolioRepo.findAll()) {
            try {
                PortfolioSnapshot snap = snapshotRepo.findByUserIdAndSnapshotDate(p.getUserId(), day)
                        .orElseGet(() -> PortfolioSnapshot.builder().userId(p.getUserId()).snapshotDate(day).build());
                snap.setTotalAssets(p.getTotalAssets());
                snap.setTotalReturn(p.getTotalReturn());
                snap.setCash(p.getCash());
                snapshotRepo.save(snap);
                written++;
            } catch (RuntimeException e) {
                log.error("Snapshot for {} on {} failed", p.getUserId(), day, e);
            }
        }
        log.info("Portfolio snapshots for {}: {} written", day, written);
        return Result.ok(written);
    }

    public List<PortfolioSnapshot> history(String userId, LocalDate from, LocalDate to) {
        return snapshotRepo.findWindow(userId, from, to);
    }
}
