package de.bsommerfeld.golinks.app;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.golinks.core.config.ConfigLoader;
import de.bsommerfeld.golinks.core.config.GlobalConfig;
import de.bsommerfeld.golinks.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Entry point. Loads {@code golinks.toml} from the working directory (or the
 * path given as the first argument), wires the services and keeps them running
 * until the JVM is asked to exit.
 */
public final class AppMain {

    static {
        // Must run before the first logger is created; logback.xml reads LOG_DIR.
        Path logDir = StorageUtils.getLogsDir(ConfigLoader.APP_NAME);
        try {
            Files.createDirectories(logDir);
            System.setProperty("LOG_DIR", logDir.toAbsolutePath().toString());
        } catch (IOException e) {
            System.err.println("Failed to create log directory: " + logDir + " (" + e.getMessage() + ")");
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(AppMain.class);

    private AppMain() {
    }

    public static void main(String[] args) throws InterruptedException {
        Path configPath = Path.of(args.length > 0 ? args[0] : ConfigLoader.DEFAULT_FILE_NAME);
        GlobalConfig config = ConfigLoader.load(configPath);

        Injector injector = Guice.createInjector(new AppModule(config));
        GoLinksApplication application = injector.getInstance(GoLinksApplication.class);

        Runtime.getRuntime().addShutdownHook(new Thread(application::stop, "golinks-shutdown"));
        application.start();

        Thread.currentThread().join();
    }
}
