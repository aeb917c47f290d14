package com.trade.arena.sim.test.repo;

import com.trade.arena.sim.enums.CandleSource;
import com.trade.arena.sim.model.documents.Candle;
import com.trade.arena.sim.repo.documents.CandleRepo;
import com.trade.arena.sim.test.BaseContainers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class CandleRepoIT extends BaseContainers {

    @Autowired
    CandleRepo candleRepo;

    @BeforeEach
    void clean() {
        candleRepo.deleteAll();
    }

    private static Candle candle(String code, LocalDate day, long close) {
        BigDecimal px = BigDecimal.valueOf(close);
        return Candle.builder()
                .stockCode(code).tradingDate(day)
                .open(px).high(px).low(px).close(px)
                .volume(1).source(CandleSource.TICK)
                .build();
    }

    @Test
    void windowIsInclusiveAndAscending() {
        LocalDate d = LocalDate.of(2024, 3, 4);
        candleRepo.save(candle("005930", d.plusDays(2), 3));
        candleRepo.save(candle("005930", d, 1));
        candleRepo.save(candle("005930", d.plusDays(1), 2));
        candleRepo.save(candle("005930", d.plusDays(3), 4));
        candleRepo.save(candle("000660", d.plusDays(1), 9));

        List<Candle> out = candleRepo.findWindow("005930", d, d.plusDays(2));

        assertThat(out).extracting(Candle::getTradingDate).containsExactly(d, d.plusDays(1), d.plusDays(2));
        assertThat(candleRepo.findTopByStockCodeOrderByTradingDateDesc("005930").orElseThrow().getClose())
                .isEqualByComparingTo("4");
    }

    @Test
    void oneCandlePerSecurityAndDay() {
        LocalDate d = LocalDate.of(2024, 3, 4);
        candleRepo.insert(candle("005930", d, 1));

        assertThatThrownBy(() -> candleRepo.insert(candle("005930", d, 2)))
                .isInstanceOf(DuplicateKeyException.class);
    }
}
