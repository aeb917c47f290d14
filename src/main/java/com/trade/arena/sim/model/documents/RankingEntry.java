package com.trade.arena.sim.model.documents;

import com.trade.arena.sim.enums.RankingPeriod;
import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

@Document("rankings")
@CompoundIndex(name = "period_rank", def = "{'period': 1, 'rank': 1}")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RankingEntry {

    @Id
    private String id;

    private RankingPeriod period;

    private String userId;
    private String username;

    private int rank;
    private BigDecimal periodReturn;   // percent

    private Instant updatedAt;
}
