package com.trade.arena.sim.common.time;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Exchange calendar. Every "which day is it" question in the simulator is answered here, in the
 * exchange zone, so candle bucketing and period boundaries never depend on the JVM default zone.
 */
@Component
public class TradingCalendar {

    private final Clock clock;
    private final ZoneId zone;
    private final LocalTime marketOpen;
    private final LocalTime marketClose;

    public TradingCalendar(Clock clock,
                           @Value("${arena.timezone:Asia/Seoul}") String zone,
                           @Value("${arena.market.open:09:00}") String marketOpen,
                           @Value("${arena.market.close:15:30}") String marketClose) {
        this.clock = clock;
        this.zone = ZoneId.of(zone);
        this.marketOpen = LocalTime.parse(marketOpen);
        this.marketClose = LocalTime.parse(marketClose);
    }

    public ZoneId zone() {
        return zone;
    }

    public ZonedDateTime now() {
        return ZonedDateTime.now(clock).withZoneSameInstant(zone);
    }

    /**
     * Current calendar day on the exchange.
     */
    public LocalDate today() {
        return now().toLocalDate();
    }

    public YearMonth currentMonth() {
        return YearMonth.from(today());
    }

    public boolean isWeekday(LocalDate day) {
        DayOfWeek dow = day.getDayOfWeek();
        return dow != DayOfWeek.SATURDAY && dow != DayOfWeek.SUNDAY;
    }

    /**
     * True on weekdays between the opening and closing time, both inclusive.
     */
    public boolean isMarketOpen() {
        ZonedDateTime now = now();
        if (!isWeekday(now.toLocalDate())) return false;
        LocalTime t = now.toLocalTime();
        return !t.isBefore(marketOpen) && !t.isAfter(marketClose);
    }

    public boolean isMonday(LocalDate day) {
        return day.getDayOfWeek() == DayOfWeek.MONDAY;
    }

    public boolean isFirstOfMonth(LocalDate day) {
        return day.getDayOfMonth() == 1;
    }
}
