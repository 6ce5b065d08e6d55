package de.bsommerfeld.golinks.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves where golinks keeps local state (the embedded SQLite database and
 * log files) when no explicit location is configured. Paths follow each
 * platform's conventions and are <strong>not</strong> created here.
 *
 * <ul>
 * <li><strong>macOS</strong>: {@code ~/Library/Application Support/{appName}}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\{appName}}, falling back to
 * {@code ~/AppData/Roaming}</li>
 * <li><strong>Linux</strong>: {@code $XDG_DATA_HOME/{appName}}, falling back
 * to {@code ~/.local/share}</li>
 * </ul>
 */
public final class StorageUtils {

    private StorageUtils() {
    }

    public static Path getAppDataDir(String appName) {
        return getAppDataDir(appName, System.getProperty("os.name", "generic"),
                System.getProperty("user.home"), System.getenv());
    }

    /**
     * Resolution with explicit inputs, so every platform branch can be
     * exercised on any host.
     */
    static Path getAppDataDir(String appName, String osName, String userHome, Map<String, String> env) {
        String os = osName.toLowerCase(Locale.ENGLISH);
        if (os.contains("mac") || os.contains("darwin")) {
            return Paths.get(userHome, "Library", "Application Support", appName).toAbsolutePath();
        }
        if (os.contains("win")) {
            String appData = env.get("APPDATA");
            return (appData != null && !appData.isEmpty()
                    ? Paths.get(appData, appName)
                    : Paths.get(userHome, "AppData", "Roaming", appName)).toAbsolutePath();
        }
        String xdgData = env.get("XDG_DATA_HOME");
        return (xdgData != null && !xdgData.isEmpty()
                ? Paths.get(xdgData, appName)
                : Paths.get(userHome, ".local", "share", appName)).toAbsolutePath();
    }

    /** {@code {appDataDir}/logs}. */
    public static Path getLogsDir(String appName) {
        return getAppDataDir(appName).resolve("logs");
    }
}
