package com.trade.arena.sim.jobs;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drives the trigger operations from inside the process, for deployments without an external
 * scheduler. Off by default.
 * <p>
 * Configure (optional):
 * arena.scheduler.in-process.enabled=true
 * arena.timezone=Asia/Seoul
 * arena.scheduler.intraday-cron=0 0/5 9-15 * * MON-FRI
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "arena.scheduler.in-process.enabled", havingValue = "true")
public class InProcessScheduleJob {

    @Autowired
    private ScheduleOrchestrator orchestrator;

    /**
     * Every 5 minutes in market hours; ticks after 15:30 fall outside the window and no-op.
     */
    @Scheduled(cron = "${arena.scheduler.intraday-cron:0 0/5 9-15 * * MON-FRI}", zone = "${arena.timezone:Asia/Seoul}")
    public void intraday() {
        report("intraday-update", orchestrator.intradayTick().isSuccess());
    }

    @Scheduled(cron = "${arena.scheduler.daily-candle-cron:0 35 15 * * MON-FRI}", zone = "${arena.timezone:Asia/Seoul}")
    public void dailyCandle() {
        report("daily-candle", orchestrator.finalizeDailyCandles().isSuccess());
    }

    @Scheduled(cron = "${arena.scheduler.snapshot-cron:0 40 15 * * MON-FRI}", zone = "${arena.timezone:Asia/Seoul}")
    public void snapshot() {
        report("portfolio-snapshot", orchestrator.snapshotPortfolios().isSuccess());
    }

    @Scheduled(cron = "${arena.scheduler.ranking-cron:0 10 16 * * MON-FRI}", zone = "${arena.timezone:Asia/Seoul}")
    public void rankings() {
        report("ranking-update", orchestrator.updateRankings().isSuccess());
    }

    @Scheduled(cron = "${arena.scheduler.midnight-cron:0 0 0 * * *}", zone = "${arena.timezone:Asia/Seoul}")
    public void midnight() {
        report("midnight", orchestrator.midnightTasks().isSuccess());
    }

    private static void report(String task, boolean ok) {
        if (!ok) log.warn("Scheduled {} reported failure", task);
    }
}
