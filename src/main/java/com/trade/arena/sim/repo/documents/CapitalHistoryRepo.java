package com.trade.arena.sim.repo.documents;

import com.trade.arena.sim.model.documents.CapitalHistory;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CapitalHistoryRepo extends MongoRepository<CapitalHistory, String> {

    List<CapitalHistory> findByUserIdOrderByTimestampDesc(String userId);
}
