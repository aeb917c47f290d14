package com.trade.arena.sim.model.documents;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Latest polled quote per security, overwritten on every tick.
 */
@Document("live_quotes")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LiveQuote {

    @Id
    private String code;

    private LocalDate tradingDate;

    private BigDecimal price;
    private BigDecimal open;
    private BigDecimal high;
    private BigDecimal low;

    private long volume;

    private Instant updatedAt;
}
