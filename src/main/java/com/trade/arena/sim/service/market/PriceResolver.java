package com.trade.arena.sim.service.market;

import com.trade.arena.sim.common.time.TradingCalendar;
import com.trade.arena.sim.model.documents.LiveQuote;
import com.trade.arena.sim.repo.documents.LiveQuoteRepo;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Current trade price: today's live quote when it carries a positive price, otherwise the most
 * recent candle close.
 */
@Component
@RequiredArgsConstructor
public class PriceResolver {

    private final LiveQuoteRepo liveQuoteRepo;
    private final CandleStore candleStore;
    private final TradingCalendar calendar;

    public Optional<BigDecimal> currentPrice(String code) {
        Optional<BigDecimal> live = liveQuoteRepo.findByCodeAndTradingDate(code, calendar.today())
                .map(LiveQuote::getPrice)
                .filter(p -> p.signum() > 0);
        if (live.isPresent()) return live;
        return candleStore.latestClose(code);
    }
}
