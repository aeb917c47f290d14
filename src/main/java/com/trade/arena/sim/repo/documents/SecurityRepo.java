package com.trade.arena.sim.repo.documents;

import com.trade.arena.sim.model.documents.Security;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SecurityRepo extends MongoRepository<Security, String> {
}
