package com.trade.arena.sim.service.ranking;

import com.trade.arena.sim.enums.RankingPeriod;
import com.trade.arena.sim.model.documents.RankingEntry;
import com.trade.arena.sim.repo.documents.RankingEntryRepo;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Replaces a period's ranking set wholesale.
 */
@Component
@RequiredArgsConstructor
public class RankingWriter {

    private final RankingEntryRepo rankingEntryRepo;

    @Transactional
    public int replace(RankingPeriod period, List<RankingEntry> entries) {
        rankingEntryRepo.deleteByPeriod(period);
        if (entries.isEmpty()) return 0;
        return rankingEntryRepo.insert(entries).size();
    }
}
