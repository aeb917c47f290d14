package com.trade.arena.sim.model.documents;

import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Document("portfolio_snapshots")
@CompoundIndex(name = "user_day_uq", def = "{'userId': 1, 'snapshotDate': 1}", unique = true)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PortfolioSnapshot {

    @Id
    private String id;

    private String userId;

    private LocalDate snapshotDate;

    private BigDecimal totalAssets;
    private BigDecimal totalReturn;
    private BigDecimal cash;

    @CreatedDate
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;
}
