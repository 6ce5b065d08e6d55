package de.bsommerfeld.golinks.tracking;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Click and inventory meters.
 *
 * <ul>
 * <li>{@code golinks.clicks.recorded}: clicks persisted</li>
 * <li>{@code golinks.clicks.record.errors}: clicks the store rejected</li>
 * <li>{@code golinks.clicks.dropped{reason}}: clicks never handed to the store</li>
 * <li>{@code golinks.clicks.queue.depth}: clicks waiting for the writer</li>
 * <li>{@code golinks.links.total}, {@code golinks.users.total}: refreshed
 * periodically by {@link StoreMetricsUpdater}</li>
 * </ul>
 */
@Singleton
public class ClickMetrics {

    private final MeterRegistry registry;

    private final AtomicLong linksTotal = new AtomicLong(0);
    private final AtomicLong usersTotal = new AtomicLong(0);

    private final Counter recorded;
    private final Counter recordErrors;
    private final Map<DropReason, Counter> dropped = new EnumMap<>(DropReason.class);

    @Inject
    public ClickMetrics(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder("golinks.links.total", linksTotal, AtomicLong::get)
                .description("Number of short links")
                .register(registry);
        Gauge.builder("golinks.users.total", usersTotal, AtomicLong::get)
                .description("Number of users")
                .register(registry);

        recorded = Counter.builder("golinks.clicks.recorded")
                .description("Click events persisted")
                .register(registry);
        recordErrors = Counter.builder("golinks.clicks.record.errors")
                .description("Click events the store failed to persist")
                .register(registry);
        for (DropReason reason : DropReason.values()) {
            dropped.put(reason, Counter.builder("golinks.clicks.dropped")
                    .description("Click events discarded before reaching the store")
                    .tag("reason", reason.tag())
                    .register(registry));
        }
    }

    /**
     * Exposes the size of the writer's queue as {@code golinks.clicks.queue.depth}.
     */
    void bindQueue(Collection<?> queue) {
        Gauge.builder("golinks.clicks.queue.depth", queue, Collection::size)
                .description("Click events waiting to be persisted")
                .register(registry);
    }

    void recordSuccess() {
        recorded.increment();
    }

    void recordError() {
        recordErrors.increment();
    }

    void recordDrop(DropReason reason) {
        dropped.get(reason).increment();
    }

    void setLinksTotal(long value) {
        linksTotal.set(value);
    }

    void setUsersTotal(long value) {
        usersTotal.set(value);
    }
}
