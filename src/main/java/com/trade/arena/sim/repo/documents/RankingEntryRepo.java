package com.trade.arena.sim.repo.documents;

import com.trade.arena.sim.enums.RankingPeriod;
import com.trade.arena.sim.model.documents.RankingEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RankingEntryRepo extends MongoRepository<RankingEntry, String> {

    List<RankingEntry> findByPeriodOrderByRankAsc(RankingPeriod period, Pageable page);

    List<RankingEntry> findByPeriodOrderByRankAsc(RankingPeriod period);

    Optional<RankingEntry> findByPeriodAndUserId(RankingPeriod period, String userId);

    long deleteByPeriod(RankingPeriod period);
}
