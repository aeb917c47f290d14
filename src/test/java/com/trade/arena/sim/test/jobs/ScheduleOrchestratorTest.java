package com.trade.arena.sim.test.jobs;

import com.trade.arena.sim.common.Result;
import com.trade.arena.sim.common.constants.ErrorCodes;
import com.trade.arena.sim.common.time.TradingCalendar;
import com.trade.arena.sim.enums.RankingPeriod;
import com.trade.arena.sim.jobs.MidnightReport;
import com.trade.arena.sim.jobs.ScheduleOrchestrator;
import com.trade.arena.sim.jobs.TaskOutcome;
import com.trade.arena.sim.service.market.CollectionReport;
import com.trade.arena.sim.service.market.PriceCollector;
import com.trade.arena.sim.service.portfolio.CapitalService;
import com.trade.arena.sim.service.portfolio.MonthlyRewardReport;
import com.trade.arena.sim.service.portfolio.PortfolioService;
import com.trade.arena.sim.service.ranking.LeagueReport;
import com.trade.arena.sim.service.ranking.LeagueService;
import com.trade.arena.sim.service.ranking.PeriodResetService;
import com.trade.arena.sim.service.ranking.PortfolioSnapshotService;
import com.trade.arena.sim.service.ranking.RankingEngine;
import com.trade.arena.sim.service.ranking.RankingRun;
import com.trade.arena.sim.service.ranking.ResetOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ScheduleOrchestratorTest {

    private PriceCollector priceCollector;
    private PortfolioService portfolioService;
    private PortfolioSnapshotService snapshotService;
    private RankingEngine rankingEngine;
    private PeriodResetService resetService;
    private LeagueService leagueService;
    private CapitalService capitalService;

    @BeforeEach
    void setUp() {
        priceCollector = mock(PriceCollector.class);
        portfolioService = mock(PortfolioService.class);
        snapshotService = mock(PortfolioSnapshotService.class);
        rankingEngine = mock(RankingEngine.class);
        resetService = mock(PeriodResetService.class);
        leagueService = mock(LeagueService.class);
        capitalService = mock(CapitalService.class);
    }

    private ScheduleOrchestrator at(String instant) {
        Clock clock = Clock.fixed(Instant.parse(instant), ZoneOffset.UTC);
        TradingCalendar calendar = new TradingCalendar(clock, "Asia/Seoul", "09:00", "15:30");
        return new ScheduleOrchestrator(calendar, priceCollector, portfolioService, snapshotService, rankingEngine,
                resetService, leagueService, capitalService);
    }

    @Test
    void intradayOutsideMarketHoursIsANoOp() {
        // Sunday noon KST
        Result<TaskOutcome<CollectionReport>> r = at("2024-03-03T03:00:00Z").intradayTick();

        assertThat(r.isOk()).isTrue();
        assertThat(r.get().executed()).isFalse();
        assertThat(r.get().message()).isEqualTo("Market is closed");
        verifyNoInteractions(priceCollector);
    }

    @Test
    void intradayDuringMarketHoursRuns() {
        when(priceCollector.runIntradayUpdate()).thenReturn(new CollectionReport(2, 0, Map.of()));

        Result<TaskOutcome<CollectionReport>> r = at("2024-03-04T01:00:00Z").intradayTick();

        assertThat(r.get().executed()).isTrue();
        assertThat(r.get().data().updated()).isEqualTo(2);
    }

    @Test
    void snapshotStopsWhenRevaluationFails() {
        when(portfolioService.revalueAll()).thenReturn(Result.fail(ErrorCodes.INTERNAL_ERROR, "boom"));

        Result<TaskOutcome<Integer>> r = at("2024-03-04T06:40:00Z").snapshotPortfolios();

        assertThat(r.isOk()).isFalse();
        verifyNoInteractions(snapshotService);
    }

    @Test
    void backfillRejectsTodayAndFuture() {
        ScheduleOrchestrator o = at("2024-03-04T01:00:00Z");

        assertThat(o.backfill(LocalDate.of(2024, 3, 4)).getErrorCode()).isEqualTo(ErrorCodes.INVALID_INPUT);
        assertThat(o.backfillRange("005930", 0).getErrorCode()).isEqualTo(ErrorCodes.INVALID_INPUT);
        verifyNoInteractions(priceCollector);
    }

    @Test
    void midnightOnFirstOfMonthRewardsBeforeReset() {
        // 2024-04-01 00:00 KST, a Monday
        LocalDate day = LocalDate.of(2024, 4, 1);
        when(leagueService.classifyAll()).thenReturn(Result.ok(new LeagueReport(3, 0, 0, 3)));
        when(rankingEngine.computeRanking(RankingPeriod.MONTHLY)).thenReturn(Result.ok(new RankingRun(RankingPeriod.MONTHLY, 3)));
        when(capitalService.distributeMonthlyRewards(YearMonth.of(2024, 3)))
                .thenReturn(Result.ok(new MonthlyRewardReport(YearMonth.of(2024, 3), true, 3, 0, BigDecimal.TEN, List.of())));
        when(snapshotService.snapshotAll(day)).thenReturn(Result.ok(3));
        when(resetService.resetWeeklyIfDue(day)).thenReturn(Result.ok(new ResetOutcome(RankingPeriod.WEEKLY, true, 3, 0, "Baseline reset")));
        when(resetService.resetMonthlyIfDue(day)).thenReturn(Result.ok(new ResetOutcome(RankingPeriod.MONTHLY, true, 3, 0, "Baseline reset")));

        Result<MidnightReport> r = at("2024-03-31T15:00:00Z").midnightTasks();

        assertThat(r.isOk()).isTrue();
        assertThat(r.get().isClean()).isTrue();
        assertThat(r.get().rewards().rewarded()).isEqualTo(3);
        InOrder order = inOrder(leagueService, rankingEngine, capitalService, snapshotService, resetService);
        order.verify(leagueService).classifyAll();
        order.verify(rankingEngine).computeRanking(RankingPeriod.MONTHLY);
        order.verify(capitalService).distributeMonthlyRewards(YearMonth.of(2024, 3));
        order.verify(snapshotService).snapshotAll(day);
        order.verify(resetService).resetWeeklyIfDue(day);
        order.verify(resetService).resetMonthlyIfDue(day);
    }

    @Test
    void midnightCollectsErrorsAndKeepsGoing() {
        LocalDate day = LocalDate.of(2024, 3, 5);
        when(leagueService.classifyAll()).thenThrow(new IllegalStateException("mongo down"));
        when(snapshotService.snapshotAll(day)).thenReturn(Result.fail(ErrorCodes.INTERNAL_ERROR, "snapshot failed"));
        when(resetService.resetWeeklyIfDue(day)).thenReturn(Result.ok(new ResetOutcome(RankingPeriod.WEEKLY, false, 0, 0, "n/a")));
        when(resetService.resetMonthlyIfDue(day)).thenReturn(Result.ok(new ResetOutcome(RankingPeriod.MONTHLY, false, 0, 0, "n/a")));

        Result<MidnightReport> r = at("2024-03-04T15:00:00Z").midnightTasks();

        assertThat(r.isOk()).isTrue();
        assertThat(r.get().errors()).hasSize(2);
        assertThat(r.get().leagues()).isNull();
        assertThat(r.get().weeklyReset()).isNotNull();
        verify(capitalService, never()).distributeMonthlyRewards(any());
    }
}
