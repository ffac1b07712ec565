package dev.nuclr.pdf.cache;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Locale;
import java.util.Properties;

/**
 * Reads and writes {@link RenderCacheSettings} as a .properties file.
 * Missing or malformed values fall back to the defaults with a warning.
 */
@Slf4j
public final class RenderCacheProperties {

    public static final String KEY_BUDGET_BYTES     = "pdf.renderCache.budgetBytes";
    public static final String KEY_LOW_WATER        = "pdf.renderCache.lowWaterFraction";
    public static final String KEY_RENDER_TIMEOUT   = "pdf.renderCache.renderTimeoutMs";
    public static final String KEY_DEFAULT_QUALITY  = "pdf.renderCache.defaultQuality";
    public static final String KEY_ENTRY_TTL        = "pdf.renderCache.entryTtlHours";
    public static final String KEY_RENDER_THREADS   = "pdf.renderCache.renderThreads";
    public static final String KEY_PRELOAD_THREADS  = "pdf.renderCache.preloadThreads";
    public static final String KEY_MAX_PRELOAD      = "pdf.renderCache.maxPreloadPages";
    public static final String KEY_MAINTENANCE      = "pdf.renderCache.maintenanceIntervalMinutes";

    /** A century; larger values overflow {@link Duration}. */
    static final long MAX_TTL_HOURS           = 876_600;
    /** A year. */
    static final long MAX_MAINTENANCE_MINUTES = 525_600;

    private RenderCacheProperties() {
    }

    // --- Load ---

    /**
     * Load settings from {@code file}. A missing or unreadable file yields the defaults.
     */
    public static RenderCacheSettings load(Path file, Path cacheDirectory) {
        Properties props = new Properties();
        if (Files.exists(file)) {
            try (InputStream in = Files.newInputStream(file)) {
                props.load(in);
            } catch (IOException e) {
                log.warn("Could not load render cache settings, using defaults: {}", e.getMessage());
            }
        }
        return fromProperties(props, cacheDirectory);
    }

    public static RenderCacheSettings fromProperties(Properties props, Path cacheDirectory) {
        RenderCacheSettings d = RenderCacheSettings.defaults(cacheDirectory);
        return new RenderCacheSettings(
                getLong(props, KEY_BUDGET_BYTES, d.budgetBytes(), 1, Long.MAX_VALUE),
                getDouble(props, KEY_LOW_WATER, d.lowWaterFraction()),
                Duration.ofMillis(getLong(props, KEY_RENDER_TIMEOUT, d.renderTimeout().toMillis(), 1, Long.MAX_VALUE)),
                getQuality(props, d.defaultQuality()),
                cacheDirectory,
                Duration.ofHours(getLong(props, KEY_ENTRY_TTL, d.entryTtl().toHours(), 1, MAX_TTL_HOURS)),
                getInt(props, KEY_RENDER_THREADS, d.renderThreads(), RenderCacheSettings.MAX_THREADS),
                getInt(props, KEY_PRELOAD_THREADS, d.preloadThreads(), RenderCacheSettings.MAX_THREADS),
                getInt(props, KEY_MAX_PRELOAD, d.maxPreloadPages(), Integer.MAX_VALUE),
                Duration.ofMinutes(getLong(props, KEY_MAINTENANCE, d.maintenanceInterval().toMinutes(),
                        0, MAX_MAINTENANCE_MINUTES)));
    }

    // --- Save ---

    public static void save(RenderCacheSettings settings, Path file) throws IOException {
        Properties props = new Properties();
        props.setProperty(KEY_BUDGET_BYTES, String.valueOf(settings.budgetBytes()));
        props.setProperty(KEY_LOW_WATER, String.valueOf(settings.lowWaterFraction()));
        props.setProperty(KEY_RENDER_TIMEOUT, String.valueOf(settings.renderTimeout().toMillis()));
        props.setProperty(KEY_DEFAULT_QUALITY, settings.defaultQuality().name());
        props.setProperty(KEY_ENTRY_TTL, String.valueOf(settings.entryTtl().toHours()));
        props.setProperty(KEY_RENDER_THREADS, String.valueOf(settings.renderThreads()));
        props.setProperty(KEY_PRELOAD_THREADS, String.valueOf(settings.preloadThreads()));
        props.setProperty(KEY_MAX_PRELOAD, String.valueOf(settings.maxPreloadPages()));
        props.setProperty(KEY_MAINTENANCE, String.valueOf(settings.maintenanceInterval().toMinutes()));

        Files.createDirectories(file.toAbsolutePath().getParent());
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            try (OutputStream out = Files.newOutputStream(tmp)) {
                props.store(out, "PDF render cache settings");
            }
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    // --- Parsing ---

    private static long getLong(Properties props, String key, long fallback, long min, long max) {
        String raw = props.getProperty(key);
        if (raw == null) {
            return fallback;
        }
        try {
            long value = Long.parseLong(raw.trim());
            if (value < min) {
                log.warn("{}={} is below {}, using {}", key, raw, min, fallback);
                return fallback;
            }
            if (value > max) {
                log.warn("{}={} is above {}, using {}", key, raw, max, fallback);
                return fallback;
            }
            return value;
        } catch (NumberFormatException e) {
            log.warn("Malformed {}={}, using {}", key, raw, fallback);
            return fallback;
        }
    }

    private static int getInt(Properties props, String key, int fallback, int max) {
        return (int) getLong(props, key, fallback, 1, max);
    }

    private static double getDouble(Properties props, String key, double fallback) {
        String raw = props.getProperty(key);
        if (raw == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Malformed {}={}, using {}", key, raw, fallback);
            return fallback;
        }
    }

    private static RenderQuality getQuality(Properties props, RenderQuality fallback) {
        String raw = props.getProperty(KEY_DEFAULT_QUALITY);
        if (raw == null) {
            return fallback;
        }
        String value = raw.trim();
        try {
            return RenderQuality.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException notAName) {
            try {
                return RenderQuality.fromLevel(Integer.parseInt(value));
            } catch (IllegalArgumentException e) {
                log.warn("Malformed {}={}, using {}", KEY_DEFAULT_QUALITY, raw, fallback);
                return fallback;
            }
        }
    }
}
