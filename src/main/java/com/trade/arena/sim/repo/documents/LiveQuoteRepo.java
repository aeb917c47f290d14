package com.trade.arena.sim.repo.documents;

import com.trade.arena.sim.model.documents.LiveQuote;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface LiveQuoteRepo extends MongoRepository<LiveQuote, String> {

    /**
     * Quote for a security only if it was polled on the given exchange day.
     */
    Optional<LiveQuote> findByCodeAndTradingDate(String code, LocalDate tradingDate);

    List<LiveQuote> findByTradingDate(LocalDate tradingDate);
}
