package com.trade.arena.sim.service.market;

import com.trade.arena.sim.enums.CandleSource;
import com.trade.arena.sim.model.documents.Candle;
import com.trade.arena.sim.model.documents.LiveQuote;
import com.trade.arena.sim.repo.documents.CandleRepo;
import com.trade.arena.sim.service.quote.DailyBar;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Day-bucketed OHLC candles keyed by {@code (stockCode, tradingDate)}.
 * <p>
 * Every write keeps {@code low <= open, close <= high}. Once a candle is closed, ticks and live
 * day ranges no longer touch it; only a forced backfill can rewrite it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CandleStore {

    static final int MAX_WRITE_ATTEMPTS = 5;

    private final CandleRepo candleRepo;
    private final Clock clock;

    // -------------------- Ticks --------------------

    /**
     * Folds one polled tick into the day's candle. {@code cumulativeVolume} is the provider's
     * running daily total: a tick carrying a smaller total than the candle already has is stale
     * and may only widen the range.
     */
    public Candle upsertTick(String code, LocalDate tradingDate, BigDecimal price, long cumulativeVolume) {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(tradingDate, "tradingDate");
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("tick price must be positive for " + code);
        }
        return withRetry("tick", code, tradingDate, () -> applyTick(code, tradingDate, price, cumulativeVolume));
    }

    private Candle applyTick(String code, LocalDate tradingDate, BigDecimal price, long cumulativeVolume) {
        Optional<Candle> existing = candleRepo.findByStockCodeAndTradingDate(code, tradingDate);
        if (existing.isEmpty()) {
            Candle created = Candle.builder()
                    .stockCode(code)
                    .tradingDate(tradingDate)
                    .open(price).high(price).low(price).close(price)
                    .volume(cumulativeVolume)
                    .source(CandleSource.TICK)
                    .build();
            try {
                return candleRepo.insert(created);
            } catch (DuplicateKeyException race) {
                // another writer created the day's candle first; fold into theirs
                log.debug("Candle {} {} created concurrently, folding tick", code, tradingDate);
                existing = candleRepo.findByStockCodeAndTradingDate(code, tradingDate);
                if (existing.isEmpty()) throw race;
            }
        }

        Candle current = existing.get();
        if (current.isClosed()) {
            log.debug("Ignoring tick for closed candle {} {}", code, tradingDate);
            return current;
        }
        Candle folded = fold(current, price, cumulativeVolume);
        if (sameValues(current, folded)) return current;
        return candleRepo.save(folded);
    }

    static Candle fold(Candle c, BigDecimal price, long cumulativeVolume) {
        Candle next = c.toBuilder()
                .high(c.getHigh().max(price))
                .low(c.getLow().min(price))
                .build();
        // equal totals: the most recent tick wins
        if (cumulativeVolume >= c.getVolume()) {
            next.setClose(price);
            next.setVolume(cumulativeVolume);
            next.setSource(CandleSource.TICK);
        }
        return next;
    }

    // -------------------- Close of day --------------------

    /**
     * Writes the provider's day range for {@code tradingDate} from the live quote.
     *
     * @return the written candle, or empty when the day is already closed or the quote is unusable
     */
    public Optional<Candle> applyDayRange(String code, LocalDate tradingDate, LiveQuote quote) {
        if (!hasFullRange(quote)) {
            log.warn("Live quote for {} has no usable day range, skipping", code);
            return Optional.empty();
        }
        return withRetry("day range", code, tradingDate, () -> writeDayRange(code, tradingDate, quote));
    }

    private Optional<Candle> writeDayRange(String code, LocalDate tradingDate, LiveQuote quote) {
        Candle candle = candleRepo.findByStockCodeAndTradingDate(code, tradingDate)
                .orElseGet(() -> Candle.builder().stockCode(code).tradingDate(tradingDate).build());
        if (candle.isClosed()) return Optional.empty();

        BigDecimal open = quote.getOpen();
        BigDecimal close = quote.getPrice();
        candle.setOpen(open);
        candle.setClose(close);
        candle.setHigh(quote.getHigh().max(open).max(close));
        candle.setLow(quote.getLow().min(open).min(close));
        candle.setVolume(Math.max(candle.getVolume(), quote.getVolume()));
        candle.setSource(CandleSource.LIVE);
        return Optional.of(candleRepo.save(candle));
    }

    /**
     * Marks the day's candle as closed history. Prices are left as they are.
     *
     * @return true when this call closed the candle
     */
    public boolean finalizeCandle(String code, LocalDate tradingDate) {
        return withRetry("finalize", code, tradingDate, () -> close(code, tradingDate));
    }

    private boolean close(String code, LocalDate tradingDate) {
        Optional<Candle> existing = candleRepo.findByStockCodeAndTradingDate(code, tradingDate);
        if (existing.isEmpty() || existing.get().isClosed()) return false;

        Candle candle = existing.get();
        candle.setClosed(true);
        candle.setFinalizedAt(clock.instant());
        candleRepo.save(candle);
        return true;
    }

    // -------------------- Backfill --------------------

    /**
     * Inserts a historical bar when the day has no candle. With {@code force} an existing candle
     * is overwritten.
     *
     * @return true when something was written
     */
    public boolean backfill(String code, LocalDate tradingDate, DailyBar bar, boolean force) {
        if (bar == null || bar.close() == null || bar.close().signum() <= 0) {
            log.warn("Rejecting backfill bar for {} {} without a positive close", code, tradingDate);
            return false;
        }
        return withRetry("backfill", code, tradingDate, () -> writeBar(code, tradingDate, bar, force));
    }

    private boolean writeBar(String code, LocalDate tradingDate, DailyBar bar, boolean force) {
        Optional<Candle> existing = candleRepo.findByStockCodeAndTradingDate(code, tradingDate);
        if (existing.isPresent() && !force) return false;

        Candle candle = existing.orElseGet(() -> Candle.builder().stockCode(code).tradingDate(tradingDate).build());
        BigDecimal close = bar.close();
        BigDecimal open = positiveOr(bar.open(), close);
        BigDecimal high = positiveOr(bar.high(), close).max(open).max(close);
        BigDecimal low = positiveOr(bar.low(), close).min(open).min(close);

        candle.setOpen(open);
        candle.setHigh(high);
        candle.setLow(low);
        candle.setClose(close);
        candle.setVolume(bar.volume());
        candle.setClosed(true);
        candle.setFinalizedAt(clock.instant());
        candle.setSource(CandleSource.BACKFILL);
        candleRepo.save(candle);
        if (existing.isPresent()) {
            log.info("Overwrote candle {} {} from backfill", code, tradingDate);
        }
        return true;
    }

    // -------------------- Reads --------------------

    public Optional<Candle> findCandle(String code, LocalDate tradingDate) {
        return candleRepo.findByStockCodeAndTradingDate(code, tradingDate);
    }

    public boolean hasCandle(String code, LocalDate tradingDate) {
        return candleRepo.existsByStockCodeAndTradingDate(code, tradingDate);
    }

    /**
     * Chart read: candles in {@code [from, to]}, oldest first.
     */
    public List<Candle> history(String code, LocalDate from, LocalDate to) {
        return candleRepo.findWindow(code, from, to);
    }

    public Optional<BigDecimal> latestClose(String code) {
        return candleRepo.findTopByStockCodeOrderByTradingDateDesc(code)
                .map(Candle::getClose)
                .filter(c -> c.signum() > 0);
    }

    // -------------------- Helpers --------------------

    /**
     * Re-reads and re-applies a write that lost a version or insert race, so a concurrent close
     * is seen before anything is written over it.
     */
    private <T> T withRetry(String op, String code, LocalDate tradingDate, Supplier<T> write) {
        for (int attempt = 1; ; attempt++) {
            try {
                return write.get();
            } catch (OptimisticLockingFailureException | DuplicateKeyException e) {
                if (attempt >= MAX_WRITE_ATTEMPTS) throw e;
                log.debug("Candle {} {} changed during {}, retrying ({}/{})", code, tradingDate, op, attempt, MAX_WRITE_ATTEMPTS);
            }
        }
    }

    static boolean hasFullRange(LiveQuote q) {
        return q != null
                && isPositive(q.getPrice())
                && isPositive(q.getOpen())
                && isPositive(q.getHigh())
                && isPositive(q.getLow());
    }

    private static boolean isPositive(BigDecimal v) {
        return v != null && v.signum() > 0;
    }

    private static BigDecimal positiveOr(BigDecimal v, BigDecimal fallback) {
        return isPositive(v) ? v : fallback;
    }

    private static boolean sameValues(Candle a, Candle b) {
        return a.getVolume() == b.getVolume()
                && a.getOpen().compareTo(b.getOpen()) == 0
                && a.getHigh().compareTo(b.getHigh()) == 0
                && a.getLow().compareTo(b.getLow()) == 0
                && a.getClose().compareTo(b.getClose()) == 0;
    }
}
