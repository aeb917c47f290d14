package com.trade.arena.sim.repo.documents;

import com.trade.arena.sim.model.documents.Portfolio;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PortfolioRepo extends MongoRepository<Portfolio, String> {

    Optional<Portfolio> findByUserId(String userId);

    boolean existsByUserId(String userId);
}
