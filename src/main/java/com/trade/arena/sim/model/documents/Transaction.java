package com.trade.arena.sim.model.documents;

import com.trade.arena.sim.enums.TransactionType;
import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Append-only order record; never updated or deleted.
 */
@Document("transactions")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Transaction {

    @Id
    private String id;

    @Indexed
    private String userId;

    private TransactionType type;
    private String stockCode;
    private String stockName;
    private long quantity;
    private BigDecimal price;
    private BigDecimal totalAmount;

    private BigDecimal realizedPnl;   // SELL only

    private String note;

    private Instant timestamp;
}
