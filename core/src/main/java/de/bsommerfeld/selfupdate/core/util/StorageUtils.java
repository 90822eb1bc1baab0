package de.bsommerfeld.selfupdate.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Resolves OS-specific application directories following each platform's
 * native conventions. All paths are returned as absolute {@link Path} instances
 * but are <strong>not</strong> created; the caller is responsible for ensuring
 * the directory exists.
 *
 * <p>
 * Two tiers are distinguished. The data tier holds configuration and must
 * survive; the cache tier holds downloads that the OS or the user may wipe at
 * any time.
 *
 * <table>
 * <caption>Resolution per platform</caption>
 * <tr><th></th><th>data</th><th>cache</th></tr>
 * <tr><td>macOS</td><td>{@code ~/Library/Application Support/{app}}</td>
 * <td>{@code ~/Library/Caches/{app}}</td></tr>
 * <tr><td>Windows</td><td>{@code %APPDATA%\{app}}</td>
 * <td>{@code %LOCALAPPDATA%\{app}\Cache}</td></tr>
 * <tr><td>Linux</td><td>{@code $XDG_DATA_HOME/{app}} or {@code ~/.local/share/{app}}</td>
 * <td>{@code $XDG_CACHE_HOME/{app}} or {@code ~/.cache/{app}}</td></tr>
 * </table>
 */
public final class StorageUtils {

    private StorageUtils() {
    }

    /**
     * Returns the platform-specific application data directory for the given app
     * name. The directory is not guaranteed to exist.
     *
     * @param appName application identifier used as the directory name
     * @return absolute path to the application's data directory
     */
    public static Path getAppDataDir(String appName) {
        String os = osName();
        String home = System.getProperty("user.home");

        if (isMac(os)) {
            return Paths.get(home, "Library", "Application Support", appName);
        }
        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData != null) {
                return Paths.get(appData, appName);
            }
            return Paths.get(home, "AppData", "Roaming", appName);
        }
        String xdgData = System.getenv("XDG_DATA_HOME");
        if (xdgData != null && !xdgData.isEmpty()) {
            return Paths.get(xdgData, appName);
        }
        return Paths.get(home, ".local", "share", appName);
    }

    /**
     * Returns the evictable cache directory for the given app name. Used as
     * scratch space for downloads.
     *
     * @param appName application identifier used as the directory name
     * @return absolute path to the application's cache directory
     */
    public static Path getCacheDir(String appName) {
        String os = osName();
        String home = System.getProperty("user.home");

        if (isMac(os)) {
            return Paths.get(home, "Library", "Caches", appName);
        }
        if (os.contains("win")) {
            String localAppData = System.getenv("LOCALAPPDATA");
            if (localAppData != null) {
                return Paths.get(localAppData, appName, "Cache");
            }
            return Paths.get(home, "AppData", "Local", appName, "Cache");
        }
        String xdgCache = System.getenv("XDG_CACHE_HOME");
        if (xdgCache != null && !xdgCache.isEmpty()) {
            return Paths.get(xdgCache, appName);
        }
        return Paths.get(home, ".cache", appName);
    }

    private static String osName() {
        return System.getProperty("os.name", "generic").toLowerCase(Locale.ENGLISH);
    }

    private static boolean isMac(String os) {
        return os.contains("mac") || os.contains("darwin");
    }
}
