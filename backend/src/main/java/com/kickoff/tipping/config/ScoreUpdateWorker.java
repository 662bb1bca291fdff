package com.kickoff.tipping.config;

import com.kickoff.tipping.service.ScoreUpdateService;
import com.kickoff.tipping.service.ScoreUpdateService.ScoreUpdateSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * Runs the results catch-up pass with a fixed delay between passes. The first pass runs
 * immediately on start; a failed pass is logged and retried on the next tick. Stopping lets an
 * in-flight pass finish.
 */
@Component
public class ScoreUpdateWorker implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(ScoreUpdateWorker.class);

    static final long MIN_INTERVAL_SECONDS = 60;

    private final ScoreUpdateService scoreUpdateService;
    private final boolean enabled;
    private final long intervalSeconds;
    private final double minAgeHours;

    private ThreadPoolTaskScheduler scheduler;
    private ScheduledFuture<?> task;

    public ScoreUpdateWorker(ScoreUpdateService scoreUpdateService,
                             @Value("${tipping.scores.auto-update.enabled:true}") boolean enabled,
                             @Value("${tipping.scores.auto-update.interval-seconds:900}") long intervalSeconds,
                             @Value("${tipping.scores.auto-update.min-age-hours:2.0}") double minAgeHours) {
        this.scoreUpdateService = scoreUpdateService;
        this.enabled = enabled;
        this.intervalSeconds = Math.max(MIN_INTERVAL_SECONDS, intervalSeconds);
        this.minAgeHours = Math.max(0.0, minAgeHours);
    }

    public long getIntervalSeconds() { return intervalSeconds; }

    @Override
    public synchronized void start() {
        if (!enabled) {
            log.info("[SCORES] background catch-up disabled");
            return;
        }
        if (isRunning()) return;
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(1);
        s.setThreadNamePrefix("score-catch-up-");
        s.setDaemon(true);
        s.setWaitForTasksToCompleteOnShutdown(true);
        s.setAwaitTerminationSeconds(5);
        s.initialize();
        scheduler = s;
        task = s.scheduleWithFixedDelay(this::runOnce, Duration.ofSeconds(intervalSeconds));
        log.info("[SCORES] background catch-up started, every {}s", intervalSeconds);
    }

    @Override
    public synchronized void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
        }
        if (scheduler != null) {
            scheduler.shutdown();
            scheduler = null;
        }
    }

    @Override
    public synchronized boolean isRunning() {
        return task != null && !task.isCancelled();
    }

    /** One catch-up pass; never throws. */
    public void runOnce() {
        try {
            ScoreUpdateSummary summary = scoreUpdateService.runCatchUp(null, minAgeHours, null);
            if (summary.fixturesUpdated() > 0 || summary.autoUnderdogTipsAdded() > 0) {
                log.info("[SCORES] season={} updated={} autoTips={} rescored={}", summary.seasonYear(),
                        summary.fixturesUpdated(), summary.autoUnderdogTipsAdded(), summary.tipsRescored());
            } else {
                log.debug("[SCORES] catch-up pass found nothing to update");
            }
        } catch (Exception e) {
            log.warn("[SCORES] background catch-up failed: {}", e.getMessage());
        }
    }
}
