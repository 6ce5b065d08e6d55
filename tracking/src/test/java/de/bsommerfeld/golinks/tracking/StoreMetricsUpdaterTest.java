package de.bsommerfeld.golinks.tracking;

import de.bsommerfeld.golinks.core.config.MetricsConfig;
import de.bsommerfeld.golinks.db.LinkStore;
import de.bsommerfeld.golinks.db.StoreException;
import de.bsommerfeld.golinks.db.UserStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StoreMetricsUpdaterTest {

    @Mock
    private LinkStore linkStore;

    @Mock
    private UserStore userStore;

    private SimpleMeterRegistry registry;
    private StoreMetricsUpdater updater;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        updater = new StoreMetricsUpdater(linkStore, userStore, new ClickMetrics(registry), new MetricsConfig());
    }

    @Test
    void refresh_shouldCopyTotalsIntoGauges() {
        when(linkStore.countAll()).thenReturn(42L);
        when(userStore.countAll()).thenReturn(7L);

        updater.refresh();

        assertEquals(42.0, registry.get("golinks.links.total").gauge().value());
        assertEquals(7.0, registry.get("golinks.users.total").gauge().value());
    }

    @Test
    void refresh_failureShouldKeepPreviousValuesAndNotThrow() {
        when(linkStore.countAll()).thenReturn(5L).thenThrow(
                new StoreException(StoreException.Kind.TRANSIENT, "database is locked"));
        when(userStore.countAll()).thenReturn(3L);

        updater.refresh();
        assertDoesNotThrow(() -> updater.refresh());

        assertEquals(5.0, registry.get("golinks.links.total").gauge().value());
        assertEquals(3.0, registry.get("golinks.users.total").gauge().value());
    }

    @Test
    void start_shouldRefreshImmediatelyAndStopOnRequest() {
        when(linkStore.countAll()).thenReturn(1L);
        when(userStore.countAll()).thenReturn(1L);

        updater.start();
        verify(userStore, timeout(5000).atLeastOnce()).countAll();
        updater.stop();

        assertTrue(updater.isStopped());
    }
}
