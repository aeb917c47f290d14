package com.trade.arena.sim.web;

import com.trade.arena.sim.common.Result;
import com.trade.arena.sim.common.exception.Http;
import com.trade.arena.sim.common.exception.ValidationException;
import com.trade.arena.sim.common.time.TradingCalendar;
import com.trade.arena.sim.service.market.CandleStore;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/stocks")
@RequiredArgsConstructor
public class MarketDataController {

    private final CandleStore candles;
    private final TradingCalendar calendar;

    /**
     * Daily candles for charting, oldest first. Defaults to the last 90 days.
     */
    @GetMapping("/{code}/candles")
    public ResponseEntity<?> candles(@PathVariable("code") String code,
                                     @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                                     @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        LocalDate end = to != null ? to : calendar.today();
        LocalDate start = from != null ? from : end.minusDays(90);
        if (start.isAfter(end)) throw new ValidationException("from must not be after to");
        return Http.from(Result.ok(candles.history(code, start, end)));
    }
}
