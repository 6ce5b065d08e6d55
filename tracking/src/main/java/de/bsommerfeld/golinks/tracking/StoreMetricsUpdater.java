package de.bsommerfeld.golinks.tracking;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.golinks.core.config.MetricsConfig;
import de.bsommerfeld.golinks.db.LinkStore;
import de.bsommerfeld.golinks.db.UserStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically copies link and user totals into the {@link ClickMetrics}
 * gauges. A failed refresh keeps the previous values.
 */
@Singleton
public class StoreMetricsUpdater {

    private static final Logger LOG = LoggerFactory.getLogger(StoreMetricsUpdater.class);

    private final LinkStore linkStore;
    private final UserStore userStore;
    private final ClickMetrics metrics;
    private final long intervalSeconds;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setNameFormat("metrics-refresh-%d").setDaemon(true).build());

    @Inject
    public StoreMetricsUpdater(LinkStore linkStore, UserStore userStore, ClickMetrics metrics,
            MetricsConfig config) {
        this.linkStore = linkStore;
        this.userStore = userStore;
        this.metrics = metrics;
        this.intervalSeconds = config.getRefreshIntervalSeconds();
    }

    public void start() {
        LOG.info("Refreshing store gauges every {} s.", intervalSeconds);
        scheduler.scheduleAtFixedRate(this::refresh, 0, intervalSeconds, TimeUnit.SECONDS);
    }

    void refresh() {
        try {
            metrics.setLinksTotal(linkStore.countAll());
            metrics.setUsersTotal(userStore.countAll());
        } catch (RuntimeException e) {
            LOG.warn("Failed to refresh store gauges: {}", e.getMessage());
        }
    }

    /**
     * Stops refreshing immediately; an in-flight refresh is interrupted.
     */
    public void stop() {
        scheduler.shutdownNow();
        LOG.info("Store gauge refresh stopped.");
    }

    public boolean isStopped() {
        return scheduler.isShutdown();
    }
}
