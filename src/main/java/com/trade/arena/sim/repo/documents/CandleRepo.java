package com.trade.arena.sim.repo.documents;

import com.trade.arena.sim.model.documents.Candle;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface CandleRepo extends MongoRepository<Candle, String> {

    Optional<Candle> findByStockCodeAndTradingDate(String stockCode, LocalDate tradingDate);

    boolean existsByStockCodeAndTradingDate(String stockCode, LocalDate tradingDate);

    /**
     * Most recent daily bar for a security.
     */
    Optional<Candle> findTopByStockCodeOrderByTradingDateDesc(String stockCode);

    /**
     * Chart window (inclusive), oldest first. Derived "Between" queries are exclusive in Mongo.
     */
    @Query(value = "{ 'stockCode': ?0, 'tradingDate': { $gte: ?1, $lte: ?2 } }", sort = "{ 'tradingDate': 1 }")
    List<Candle> findWindow(String stockCode, LocalDate from, LocalDate to);
}
