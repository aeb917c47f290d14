package com.trade.arena.sim.test.service;

import com.trade.arena.sim.enums.CandleSource;
import com.trade.arena.sim.model.documents.Candle;
import com.trade.arena.sim.model.documents.LiveQuote;
import com.trade.arena.sim.repo.documents.CandleRepo;
import com.trade.arena.sim.service.market.CandleStore;
import com.trade.arena.sim.service.quote.DailyBar;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CandleStoreTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 4);
    private static final String CODE = "005930";

    private final Map<String, Candle> rows = new HashMap<>();
    // runs once, right after the next read has taken its copy
    private Runnable afterNextRead;
    private CandleRepo repo;
    private CandleStore store;

    @BeforeEach
    void setUp() {
        repo = mock(CandleRepo.class);
        when(repo.findByStockCodeAndTradingDate(anyString(), any(LocalDate.class))).thenAnswer(inv -> {
            Optional<Candle> read = Optional.ofNullable(rows.get(key(inv.getArgument(0), inv.getArgument(1))))
                    .map(c -> c.toBuilder().build());
            Runnable hook = afterNextRead;
            afterNextRead = null;
            if (hook != null) hook.run();
            return read;
        });
        when(repo.insert(any(Candle.class))).thenAnswer(inv -> {
            Candle c = inv.getArgument(0);
            if (rows.containsKey(key(c.getStockCode(), c.getTradingDate()))) throw new DuplicateKeyException("code_day_uq");
            return keep(c);
        });
        when(repo.save(any(Candle.class))).thenAnswer(inv -> {
            Candle c = inv.getArgument(0);
            Candle stored = rows.get(key(c.getStockCode(), c.getTradingDate()));
            if (c.getVersion() == null) {
                if (stored != null) throw new DuplicateKeyException("code_day_uq");
            } else if (stored == null || !c.getVersion().equals(stored.getVersion())) {
                throw new OptimisticLockingFailureException("stale candle version " + c.getVersion());
            }
            return keep(c);
        });
        store = new CandleStore(repo, Clock.fixed(Instant.parse("2024-03-04T06:35:00Z"), ZoneOffset.UTC));
    }

    // same contract as @Version: every write bumps the version
    private Candle keep(Candle c) {
        c.setVersion(c.getVersion() == null ? 0L : c.getVersion() + 1);
        rows.put(key(c.getStockCode(), c.getTradingDate()), c.toBuilder().build());
        return c;
    }

    private static String key(String code, LocalDate day) {
        return code + "|" + day;
    }

    private static BigDecimal px(long v) {
        return BigDecimal.valueOf(v);
    }

    @Test
    void ticksBuildTheDayRange() {
        store.upsertTick(CODE, DAY, px(70000), 100);
        Candle c = store.upsertTick(CODE, DAY, px(71500), 150);

        assertThat(c.getOpen()).isEqualByComparingTo("70000");
        assertThat(c.getHigh()).isEqualByComparingTo("71500");
        assertThat(c.getLow()).isEqualByComparingTo("70000");
        assertThat(c.getClose()).isEqualByComparingTo("71500");
        assertThat(c.getVolume()).isEqualTo(150);
        assertThat(c.getSource()).isEqualTo(CandleSource.TICK);
    }

    @Test
    void staleTickWidensRangeButKeepsClose() {
        store.upsertTick(CODE, DAY, px(70000), 200);
        Candle c = store.upsertTick(CODE, DAY, px(69000), 150);

        assertThat(c.getLow()).isEqualByComparingTo("69000");
        assertThat(c.getClose()).isEqualByComparingTo("70000");
        assertThat(c.getVolume()).isEqualTo(200);
    }

    @Test
    void closedCandleIgnoresTicks() {
        store.upsertTick(CODE, DAY, px(70000), 100);
        assertThat(store.finalizeCandle(CODE, DAY)).isTrue();

        Candle c = store.upsertTick(CODE, DAY, px(90000), 500);

        assertThat(c.getHigh()).isEqualByComparingTo("70000");
        assertThat(c.isClosed()).isTrue();
        assertThat(store.finalizeCandle(CODE, DAY)).isFalse();
    }

    @Test
    void tickRacingTheCloseNeverReopensTheCandle() {
        store.upsertTick(CODE, DAY, px(70000), 100);
        afterNextRead = () -> assertThat(store.finalizeCandle(CODE, DAY)).isTrue();

        Candle c = store.upsertTick(CODE, DAY, px(72000), 150);

        Candle kept = store.findCandle(CODE, DAY).orElseThrow();
        assertThat(kept.isClosed()).isTrue();
        assertThat(kept.getFinalizedAt()).isNotNull();
        assertThat(kept.getHigh()).isEqualByComparingTo("70000");
        assertThat(kept.getVolume()).isEqualTo(100);
        assertThat(c.isClosed()).isTrue();
    }

    @Test
    void concurrentTicksKeepEachOthersRange() {
        store.upsertTick(CODE, DAY, px(70000), 100);
        afterNextRead = () -> store.upsertTick(CODE, DAY, px(69000), 120);

        store.upsertTick(CODE, DAY, px(72000), 150);

        Candle c = store.findCandle(CODE, DAY).orElseThrow();
        assertThat(c.getLow()).isEqualByComparingTo("69000");
        assertThat(c.getHigh()).isEqualByComparingTo("72000");
        assertThat(c.getClose()).isEqualByComparingTo("72000");
        assertThat(c.getVolume()).isEqualTo(150);
    }

    @Test
    void replayedTickLeavesCandleUnchanged() {
        store.upsertTick(CODE, DAY, px(70000), 100);
        Candle first = store.upsertTick(CODE, DAY, px(71500), 150);
        clearInvocations(repo);

        Candle replayed = store.upsertTick(CODE, DAY, px(71500), 150);

        assertThat(replayed.getOpen()).isEqualByComparingTo(first.getOpen());
        assertThat(replayed.getHigh()).isEqualByComparingTo(first.getHigh());
        assertThat(replayed.getLow()).isEqualByComparingTo(first.getLow());
        assertThat(replayed.getClose()).isEqualByComparingTo(first.getClose());
        assertThat(replayed.getVolume()).isEqualTo(first.getVolume());
        verify(repo, never()).save(any(Candle.class));
    }

    @Test
    void nonPositiveTickRejected() {
        assertThatThrownBy(() -> store.upsertTick(CODE, DAY, BigDecimal.ZERO, 1))
                .isInstanceOf(IllegalArgumentException.class);
        verify(repo, never()).insert(any(Candle.class));
    }

    @Test
    void dayRangeOverwritesOpenAndKeepsInvariant() {
        store.upsertTick(CODE, DAY, px(70500), 100);
        LiveQuote q = LiveQuote.builder().code(CODE).tradingDate(DAY)
                .price(px(71000)).open(px(70000)).high(px(71200)).low(px(69800)).volume(90).build();

        Candle c = store.applyDayRange(CODE, DAY, q).orElseThrow();

        assertThat(c.getOpen()).isEqualByComparingTo("70000");
        assertThat(c.getClose()).isEqualByComparingTo("71000");
        assertThat(c.getHigh()).isEqualByComparingTo("71200");
        assertThat(c.getLow()).isEqualByComparingTo("69800");
        assertThat(c.getVolume()).isEqualTo(100);
        assertThat(c.getSource()).isEqualTo(CandleSource.LIVE);
    }

    @Test
    void dayRangeWithMissingFieldsIsSkipped() {
        LiveQuote q = LiveQuote.builder().code(CODE).tradingDate(DAY).price(px(71000)).open(BigDecimal.ZERO).build();

        assertThat(store.applyDayRange(CODE, DAY, q)).isEmpty();
    }

    @Test
    void backfillNeverOverwritesWithoutForce() {
        store.upsertTick(CODE, DAY, px(70000), 100);
        DailyBar bar = new DailyBar(DAY, px(1), px(2), px(1), px(2), 5);

        assertThat(store.backfill(CODE, DAY, bar, false)).isFalse();
        assertThat(store.findCandle(CODE, DAY).orElseThrow().getClose()).isEqualByComparingTo("70000");

        assertThat(store.backfill(CODE, DAY, bar, true)).isTrue();
        Candle c = store.findCandle(CODE, DAY).orElseThrow();
        assertThat(c.getClose()).isEqualByComparingTo("2");
        assertThat(c.isClosed()).isTrue();
        assertThat(c.getSource()).isEqualTo(CandleSource.BACKFILL);
    }

    @Test
    void backfillNormalisesInconsistentBar() {
        LocalDate past = DAY.minusDays(3);
        DailyBar bar = new DailyBar(past, BigDecimal.ZERO, px(100), px(120), px(110), 10);

        assertThat(store.backfill(CODE, past, bar, false)).isTrue();

        Candle c = store.findCandle(CODE, past).orElseThrow();
        assertThat(c.getOpen()).isEqualByComparingTo("110");
        assertThat(c.getHigh()).isEqualByComparingTo("110");
        assertThat(c.getLow()).isEqualByComparingTo("110");
    }

    @Test
    void backfillWithoutPositiveCloseRejected() {
        DailyBar bar = new DailyBar(DAY, px(1), px(2), px(1), BigDecimal.ZERO, 5);

        assertThat(store.backfill(CODE, DAY, bar, false)).isFalse();
        verify(repo, never()).save(any(Candle.class));
    }
}
