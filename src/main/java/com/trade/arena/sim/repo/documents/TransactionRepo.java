package com.trade.arena.sim.repo.documents;

import com.trade.arena.sim.model.documents.Transaction;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TransactionRepo extends MongoRepository<Transaction, String> {

    List<Transaction> findByUserIdOrderByTimestampDesc(String userId);
}
