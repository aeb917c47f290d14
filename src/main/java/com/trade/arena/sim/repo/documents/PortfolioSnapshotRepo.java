package com.trade.arena.sim.repo.documents;

import com.trade.arena.sim.model.documents.PortfolioSnapshot;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface PortfolioSnapshotRepo extends MongoRepository<PortfolioSnapshot, String> {

    Optional<PortfolioSnapshot> findByUserIdAndSnapshotDate(String userId, LocalDate snapshotDate);

    @Query(value = "{ 'userId': ?0, 'snapshotDate': { $gte: ?1, $lte: ?2 } }", sort = "{ 'snapshotDate': 1 }")
    List<PortfolioSnapshot> findWindow(String userId, LocalDate from, LocalDate to);
}
