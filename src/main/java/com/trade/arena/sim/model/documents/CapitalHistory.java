package com.trade.arena.sim.model.documents;

import com.trade.arena.sim.enums.CapitalChangeReason;
import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

@Document("capital_history")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CapitalHistory {

    @Id
    private String id;

    @Indexed
    private String userId;

    private BigDecimal amount;
    private BigDecimal newTotal;       // initial capital after the change

    private CapitalChangeReason reason;
    private String description;

    private Instant timestamp;
}
