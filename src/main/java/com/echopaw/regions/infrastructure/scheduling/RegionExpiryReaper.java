package com.echopaw.regions.infrastructure.scheduling;

import com.echopaw.regions.application.port.out.RegionStore;
import com.echopaw.regions.domain.model.CachedRegion;
import com.echopaw.regions.infrastructure.config.RegionCacheProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Background sweep that evicts expired regions even when no queries arrive.
 *
 * Runs on its own single-thread scheduler every quarter of the expiry time.
 * Once stopped, the reaper cannot be started again.
 */
@Component
public class RegionExpiryReaper {

    private static final Logger logger = LoggerFactory.getLogger(RegionExpiryReaper.class);

    private final RegionStore regionStore;
    private final Clock clock;
    private final long expireTimeMillis;
    private final Duration interval;

    private ThreadPoolTaskScheduler scheduler;
    private ScheduledFuture<?> sweepTask;
    private boolean stopped;

    public RegionExpiryReaper(RegionStore regionStore, Clock clock, RegionCacheProperties properties) {
        this.regionStore = regionStore;
        this.clock = clock;
        this.expireTimeMillis = properties.getCacheExpireTimeMillis();
        this.interval = properties.getReaperInterval();
    }

    /**
     * Schedule the periodic sweep. The first sweep runs one interval from now.
     * Calling start on a running or stopped reaper has no effect.
     */
    public synchronized void start() {
        if (stopped || sweepTask != null) {
            logger.debug("Expiry reaper already started or stopped, ignoring start");
            return;
        }
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("region-reaper-");
        scheduler.setDaemon(true);
        scheduler.initialize();

        sweepTask = scheduler.scheduleWithFixedDelay(
                this::sweep, scheduler.getClock().instant().plus(interval), interval);
        logger.info("Started region expiry reaper: interval={}ms, expireTime={}ms",
                interval.toMillis(), expireTimeMillis);
    }

    /**
     * Cancel the sweep and release the scheduler thread. Idempotent.
     */
    public synchronized void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        if (sweepTask != null) {
            sweepTask.cancel(false);
            sweepTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdown();
            scheduler = null;
        }
        logger.info("Stopped region expiry reaper");
    }

    public synchronized boolean isRunning() {
        return sweepTask != null && !stopped;
    }

    /**
     * Remove every region older than the expiry time.
     *
     * @return Number of regions removed
     */
    public int sweep() {
        try {
            long now = clock.millis();
            List<CachedRegion> expired = regionStore.removeIf(region -> region.isExpired(now, expireTimeMillis));
            if (!expired.isEmpty()) {
                logger.debug("Expiry reaper removed {} regions, {} remaining", expired.size(), regionStore.size());
            }
            return expired.size();
        } catch (RuntimeException e) {
            // An exception escaping a fixed-delay task would cancel every later run
            logger.error("Region expiry sweep failed", e);
            return 0;
        }
    }
}
