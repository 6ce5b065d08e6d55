package de.bsommerfeld.golinks.app;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.golinks.core.config.ClickConfig;
import de.bsommerfeld.golinks.core.config.DatabaseConfig;
import de.bsommerfeld.golinks.core.config.GlobalConfig;
import de.bsommerfeld.golinks.core.config.MetricsConfig;
import de.bsommerfeld.golinks.db.ClickStore;
import de.bsommerfeld.golinks.db.Database;
import de.bsommerfeld.golinks.db.SqlClickStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guice module for the store, pipeline and metrics wiring.
 *
 * <p>
 * Configuration is loaded before the injector exists and handed in, so the
 * same module serves the launcher and the tests.
 */
public class AppModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(AppModule.class);

    private final GlobalConfig config;

    public AppModule(GlobalConfig config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        LOG.info("Database dialect: {}", config.dialect());

        bind(GlobalConfig.class).toInstance(config);

        // Sub-configs for convenience
        bind(DatabaseConfig.class).toInstance(config.getDatabase());
        bind(ClickConfig.class).toInstance(config.getClicks());
        bind(MetricsConfig.class).toInstance(config.getMetrics());

        bind(ClickStore.class).to(SqlClickStore.class);
    }

    @Provides
    @Singleton
    Database provideDatabase(DatabaseConfig databaseConfig) {
        return Database.fromConfig(databaseConfig);
    }

    @Provides
    @Singleton
    MeterRegistry provideMeterRegistry() {
        return new SimpleMeterRegistry();
    }
}
