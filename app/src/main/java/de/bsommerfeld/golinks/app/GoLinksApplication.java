package de.bsommerfeld.golinks.app;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.golinks.db.Database;
import de.bsommerfeld.golinks.db.Migrator;
import de.bsommerfeld.golinks.tracking.ClickPipeline;
import de.bsommerfeld.golinks.tracking.StoreMetricsUpdater;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the startup and shutdown order of the long-lived services.
 *
 * <p>
 * Startup opens the database, applies pending migrations, then starts the
 * click writer and the gauge refresher. Shutdown reverses the last two steps
 * and drains the click queue within the configured timeout.
 */
@Singleton
public class GoLinksApplication {

    private static final Logger LOG = LoggerFactory.getLogger(GoLinksApplication.class);

    private final Database database;
    private final Migrator migrator;
    private final ClickPipeline clickPipeline;
    private final StoreMetricsUpdater metricsUpdater;

    private volatile boolean started;
    private volatile boolean stopped;

    @Inject
    public GoLinksApplication(Database database, Migrator migrator, ClickPipeline clickPipeline,
            StoreMetricsUpdater metricsUpdater) {
        this.database = database;
        this.migrator = migrator;
        this.clickPipeline = clickPipeline;
        this.metricsUpdater = metricsUpdater;
    }

    public synchronized void start() {
        if (started) {
            return;
        }
        LOG.info("Starting ({})...", database.dialect());
        database.initialize();
        int applied = migrator.migrate();
        LOG.info("Schema at version {} ({} migration(s) applied).", migrator.currentVersion(), applied);
        clickPipeline.start();
        metricsUpdater.start();
        started = true;
        LOG.info("Started.");
    }

    /**
     * Stops the gauge refresher and drains the click pipeline. Safe to call
     * more than once.
     */
    public synchronized void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        LOG.info("Stopping...");
        metricsUpdater.stop();
        clickPipeline.shutdown();
        LOG.info("Stopped. Clicks recorded: {}, failed: {}, dropped: {}, abandoned: {}",
                clickPipeline.getRecordedCount(), clickPipeline.getFailedCount(),
                clickPipeline.getDroppedCount(), clickPipeline.getAbandonedCount());
    }

    public boolean isStarted() {
        return started;
    }

    public boolean isStopped() {
        return stopped;
    }
}
