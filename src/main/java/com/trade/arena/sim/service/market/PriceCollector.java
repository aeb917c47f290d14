package com.trade.arena.sim.service.market;

import com.trade.arena.sim.common.exception.ExternalProviderException;
import com.trade.arena.sim.common.time.TradingCalendar;
import com.trade.arena.sim.model.documents.LiveQuote;
import com.trade.arena.sim.model.documents.Security;
import com.trade.arena.sim.repo.documents.LiveQuoteRepo;
import com.trade.arena.sim.repo.documents.SecurityRepo;
import com.trade.arena.sim.service.quote.DailyBar;
import com.trade.arena.sim.service.quote.QuoteClient;
import com.trade.arena.sim.service.quote.QuoteSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Polls the quote provider for every tracked security and folds the results into live quotes
 * and daily candles. Securities are fetched sequentially; the client's throttle spaces them.
 * One security failing never stops the batch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PriceCollector {

    private final QuoteClient quoteClient;
    private final CandleStore candleStore;
    private final SecurityRepo securityRepo;
    private final LiveQuoteRepo liveQuoteRepo;
    private final TradingCalendar calendar;
    private final Clock clock;

    /**
     * One polling pass: overwrite each live quote and fold the tick into today's candle.
     */
    public CollectionReport runIntradayUpdate() {
        LocalDate today = calendar.today();
        List<Security> securities = securityRepo.findAll();
        log.info("Intraday update started for {} securities ({})", securities.size(), today);

        CollectionReport.Tally tally = CollectionReport.tally();
        for (Security s : securities) {
            String code = s.getCode();
            try {
                QuoteSnapshot q = quoteClient.getQuote(code);
                if (q.price() == null || q.price().signum() <= 0) {
                    log.warn("Quote for {} has no positive price, skipped", code);
                    tally.failure(code, "non-positive price");
                    continue;
                }
                liveQuoteRepo.save(LiveQuote.builder()
                        .code(code)
                        .tradingDate(today)
                        .price(q.price())
                        .open(q.open())
                        .high(q.high())
                        .low(q.low())
                        .volume(q.cumulativeVolume())
                        .updatedAt(clock.instant())
                        .build());
                candleStore.upsertTick(code, today, q.price(), q.cumulativeVolume());
                tally.success();
            } catch (ExternalProviderException e) {
                log.warn("Quote fetch failed for {} (status={}): {}", code, e.getStatus(), e.getMessage());
                tally.failure(code, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Unexpected failure updating {}", code, e);
                tally.failure(code, e.getMessage() == null ? e.toString() : e.getMessage());
            }
        }

        CollectionReport report = tally.report();
        log.info("Intraday update finished: {} updated, {} failed", report.updated(), report.failed());
        return report;
    }

    /**
     * Writes today's live day ranges into candles and closes them. Quotes whose candle is
     * already closed are skipped, so a second run writes nothing.
     *
     * @return number of candles closed by this run
     */
    public int runDailyCandleCreation() {
        LocalDate today = calendar.today();
        List<LiveQuote> quotes = liveQuoteRepo.findByTradingDate(today);
        log.info("Daily candle creation started: {} live quotes for {}", quotes.size(), today);

        int created = 0;
        for (LiveQuote q : quotes) {
            String code = q.getCode();
            if (!CandleStore.hasFullRange(q)) {
                log.warn("Skipping {}: incomplete OHLC in live quote", code);
                continue;
            }
            try {
                if (candleStore.applyDayRange(code, today, q).isPresent() && candleStore.finalizeCandle(code, today)) {
                    created++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to close candle for {}", code, e);
            }
        }

        log.info("Daily candle creation finished: {} candles closed", created);
        return created;
    }

    /**
     * Repairs a missed day: every security without a candle on {@code date} gets the provider's
     * bar for that day. Existing candles are never touched.
     */
    public CollectionReport backfillDate(LocalDate date) {
        List<Security> securities = securityRepo.findAll();
        log.info("Backfill for {} started over {} securities", date, securities.size());

        CollectionReport.Tally tally = CollectionReport.tally();
        for (Security s : securities) {
            String code = s.getCode();
            if (candleStore.hasCandle(code, date)) continue;
            try {
                Optional<DailyBar> bar = quoteClient.getHistoricalSeries(code, date, date).stream()
                        .filter(b -> b.date().equals(date))
                        .findFirst();
                if (bar.isEmpty()) {
                    log.debug("No provider bar for {} on {}", code, date);
                    continue;
                }
                if (candleStore.backfill(code, date, bar.get(), false)) {
                    tally.success();
                }
            } catch (ExternalProviderException e) {
                log.warn("Backfill fetch failed for {} on {}: {}", code, date, e.getMessage());
                tally.failure(code, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Unexpected failure backfilling {} on {}", code, date, e);
                tally.failure(code, e.getMessage() == null ? e.toString() : e.getMessage());
            }
        }

        CollectionReport report = tally.report();
        log.info("Backfill for {} finished: {} written, {} failed", date, report.updated(), report.failed());
        return report;
    }

    /**
     * Fills every missing day of the last {@code days} calendar days (excluding today) for one
     * security from a single historical request.
     *
     * @return number of candles written
     */
    public int backfillRange(String code, int days) {
        if (days <= 0) throw new IllegalArgumentException("days must be positive");
        LocalDate to = calendar.today().minusDays(1);
        LocalDate from = to.minusDays(days - 1L);

        List<DailyBar> bars = quoteClient.getHistoricalSeries(code, from, to);
        int written = 0;
        for (DailyBar bar : bars) {
            if (bar.date().isBefore(from) || bar.date().isAfter(to)) continue;
            if (candleStore.backfill(code, bar.date(), bar, false)) written++;
        }
        log.info("Backfilled {} of {} provider bars for {} ({}..{})", written, bars.size(), code, from, to);
        return written;
    }
}
