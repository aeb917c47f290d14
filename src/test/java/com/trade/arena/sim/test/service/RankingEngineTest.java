package com.trade.arena.sim.test.service;

import com.trade.arena.sim.common.Result;
import com.trade.arena.sim.enums.RankingPeriod;
import com.trade.arena.sim.model.documents.Portfolio;
import com.trade.arena.sim.model.documents.RankingEntry;
import com.trade.arena.sim.repo.documents.PortfolioRepo;
import com.trade.arena.sim.repo.documents.RankingEntryRepo;
import com.trade.arena.sim.service.ranking.PeriodBaselineWriter;
import com.trade.arena.sim.service.ranking.RankingEngine;
import com.trade.arena.sim.service.ranking.RankingRun;
import com.trade.arena.sim.service.ranking.RankingWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RankingEngineTest {

    private PortfolioRepo portfolioRepo;
    private RankingWriter writer;
    private RankingEngine engine;

    @BeforeEach
    void setUp() {
        portfolioRepo = mock(PortfolioRepo.class);
        writer = mock(RankingWriter.class);
        when(writer.replace(any(), anyList())).thenAnswer(inv -> ((List<?>) inv.getArgument(1)).size());
        engine = new RankingEngine(portfolioRepo, mock(RankingEntryRepo.class), writer, Clock.systemUTC());
    }

    private static Portfolio portfolio(String userId, String username, String assets, String weeklyBase) {
        return Portfolio.builder()
                .userId(userId).username(username)
                .initialCapital(new BigDecimal("10000000"))
                .totalAssets(new BigDecimal(assets))
                .totalReturn(BigDecimal.ZERO)
                .weeklyStartAssets(weeklyBase == null ? null : new BigDecimal(weeklyBase))
                .build();
    }

    @Test
    void periodReturnAgainstBaseline() {
        Portfolio p = portfolio("u1", "a", "11000000", "10000000");

        assertThat(RankingEngine.periodReturn(p, RankingPeriod.WEEKLY)).isEqualByComparingTo("10.0000");
        // no monthly baseline yet
        assertThat(RankingEngine.periodReturn(p, RankingPeriod.MONTHLY)).isEqualByComparingTo("0");
    }

    @Test
    void periodReturnIsZeroRightAfterReset() {
        Portfolio p = portfolio("u1", "a", "12345678", "10000000");
        when(portfolioRepo.findAll()).thenReturn(List.of(p));

        new PeriodBaselineWriter(portfolioRepo).rebase(RankingPeriod.WEEKLY);

        assertThat(p.getWeeklyStartAssets()).isEqualByComparingTo("12345678");
        assertThat(RankingEngine.periodReturn(p, RankingPeriod.WEEKLY)).isEqualByComparingTo("0");
    }

    @Test
    @SuppressWarnings("unchecked")
    void ranksByReturnThenUsernameWithDistinctPositions() {
        when(portfolioRepo.findAll()).thenReturn(List.of(
                portfolio("u3", "carol", "10500000", "10000000"),
                portfolio("u2", "bob", "11000000", "10000000"),
                portfolio("u1", "alice", "10500000", "10000000"),
                portfolio("u4", null, "10500000", "10000000")));

        Result<RankingRun> r = engine.computeRanking(RankingPeriod.WEEKLY);

        assertThat(r.isOk()).isTrue();
        assertThat(r.get().ranked()).isEqualTo(4);
        ArgumentCaptor<List<RankingEntry>> captor = ArgumentCaptor.forClass(List.class);
        verify(writer).replace(eq(RankingPeriod.WEEKLY), captor.capture());
        List<RankingEntry> entries = captor.getValue();
        assertThat(entries).extracting(RankingEntry::getUserId).containsExactly("u2", "u1", "u3", "u4");
        assertThat(entries).extracting(RankingEntry::getRank).containsExactly(1, 2, 3, 4);
    }

    @Test
    void computeAllCoversEveryPeriod() {
        when(portfolioRepo.findAll()).thenReturn(List.of(portfolio("u1", "a", "10000000", null)));

        Result<Map<RankingPeriod, Integer>> r = engine.computeAll();

        assertThat(r.isOk()).isTrue();
        assertThat(r.get()).containsOnlyKeys(RankingPeriod.values());
    }

    @Test
    void failureIsReportedNotThrown() {
        when(portfolioRepo.findAll()).thenThrow(new IllegalStateException("mongo down"));

        Result<RankingRun> r = engine.computeRanking(RankingPeriod.ALL_TIME);

        assertThat(r.isOk()).isFalse();
        assertThat(r.getError()).contains("mongo down");
    }
}
