package com.trade.arena.sim.model.documents;

import com.trade.arena.sim.enums.CandleSource;
import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Document("candles_1d")
@CompoundIndex(name = "code_day_uq", def = "{'stockCode': 1, 'tradingDate': 1}", unique = true)
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = {"stockCode", "tradingDate"})
public class Candle {

    @Id
    private String id;

    @NonNull
    private String stockCode;

    @NonNull
    private LocalDate tradingDate;   // exchange calendar day

    private BigDecimal open;
    private BigDecimal high;
    private BigDecimal low;
    private BigDecimal close;

    private long volume;             // provider's cumulative daily volume

    private boolean closed;
    private Instant finalizedAt;

    private CandleSource source;

    // bumped on every write; ticks and the close-of-day pass race on the same document
    @Version
    private Long version;

    @LastModifiedDate
    private Instant updatedAt;
}
