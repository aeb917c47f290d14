package com.trade.arena.sim.model.documents;

import com.trade.arena.sim.enums.League;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One simulated account per user. Invariants: cash never negative, no zero-quantity holdings.
 */
@Document("portfolios")
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Portfolio {

    @Id
    private String id;

    @Indexed(unique = true)
    private String userId;

    private String username;

    private BigDecimal initialCapital;
    private BigDecimal cash;

    @Builder.Default
    private List<Holding> holdings = new ArrayList<>();

    private BigDecimal totalAssets;
    private BigDecimal totalReturn;      // percent, 2 dp
    private BigDecimal realizedPnl;

    private BigDecimal weeklyStartAssets;
    private BigDecimal monthlyStartAssets;

    private League league;

    @Version
    private Long version;

    @CreatedDate
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;

    public Optional<Holding> holding(String stockCode) {
        if (holdings == null) return Optional.empty();
        return holdings.stream().filter(h -> h.getStockCode().equals(stockCode)).findFirst();
    }

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Holding {
        private String stockCode;
        private String stockName;
        private long quantity;
        private BigDecimal avgCost;
        private BigDecimal currentPrice;
    }
}
