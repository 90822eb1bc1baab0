package de.bsommerfeld.selfupdate.platform;

import java.util.Locale;

/**
 * Operating system families with a known installer hand-off.
 */
public enum OperatingSystem {
    WINDOWS,
    MACOS,
    LINUX,
    OTHER;

    public static OperatingSystem current() {
        return fromName(System.getProperty("os.name", ""));
    }

    static OperatingSystem fromName(String osName) {
        String os = osName.toLowerCase(Locale.ENGLISH);
        if (os.contains("win")) {
            return WINDOWS;
        }
        if (os.contains("mac") || os.contains("darwin")) {
            return MACOS;
        }
        if (os.contains("linux")) {
            return LINUX;
        }
        return OTHER;
    }
}
