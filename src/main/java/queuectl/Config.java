package queuectl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Key/value settings kept in a properties file next to the database.
 *
 * <p>Values are re-read from disk on every {@link #reload()}, so a running worker picks up
 * {@code config set} changes made by another process.
 */
public class Config {

    private static final Logger log = LoggerFactory.getLogger(Config.class);

    public static final String MAX_RETRIES = "max_retries";
    public static final String BACKOFF_BASE_SECONDS = "backoff_base_seconds";
    public static final String JOB_TIMEOUT_SECONDS = "job_timeout_seconds";
    public static final String POLL_INTERVAL_MILLIS = "poll_interval_millis";
    public static final String BUSY_TIMEOUT_MILLIS = "busy_timeout_millis";

    private static final Map<String, String> DEFAULTS = defaults();

    private final Path file;
    private final Properties props = new Properties();

    public Config(Path file) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        reload();
    }

    private static Map<String, String> defaults() {
        Map<String, String> d = new LinkedHashMap<>();
        d.put(MAX_RETRIES, "3");
        d.put(BACKOFF_BASE_SECONDS, "2");
        d.put(JOB_TIMEOUT_SECONDS, "300");
        d.put(POLL_INTERVAL_MILLIS, "1000");
        d.put(BUSY_TIMEOUT_MILLIS, "10000");
        return Collections.unmodifiableMap(d);
    }

    public static Set<String> knownKeys() {
        return DEFAULTS.keySet();
    }

    public static boolean isKnownKey(String key) {
        return DEFAULTS.containsKey(key);
    }

    public final synchronized void reload() {
        Properties loaded = new Properties();
        try (InputStream input = Files.newInputStream(file)) {
            loaded.load(input);
        } catch (NoSuchFileException e) {
            DEFAULTS.forEach(loaded::setProperty);
            props.clear();
            props.putAll(loaded);
            save();
            return;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read config file " + file, e);
        }
        props.clear();
        props.putAll(loaded);
    }

    // Readers in other processes only ever see the old file or the new one, never a partial write.
    private void save() {
        Path tmp = null;
        try {
            Path dir = file.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            try (OutputStream output = Files.newOutputStream(tmp)) {
                props.store(output, "queuectl configuration");
            }
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException suppressed) {
                    e.addSuppressed(suppressed);
                }
            }
            throw new UncheckedIOException("Cannot write config file " + file, e);
        }
    }

    /**
     * Returns the stored value, falling back to the built-in default; null when neither exists.
     */
    public synchronized String get(String key) {
        String v = props.getProperty(key);
        return v != null ? v : DEFAULTS.get(key);
    }

    public int getInt(String key, int defaultValue) {
        String v = get(key);
        if (v == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            log.warn("Config value {}={} is not an integer, using {}", key, v, defaultValue);
            return defaultValue;
        }
    }

    public synchronized void set(String key, String value) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        props.setProperty(key, value);
        save();
    }

    public int maxRetries() {
        return positiveOr(MAX_RETRIES, 3);
    }

    public int backoffBaseSeconds() {
        return positiveOr(BACKOFF_BASE_SECONDS, 2);
    }

    public Duration jobTimeout() {
        return Duration.ofSeconds(positiveOr(JOB_TIMEOUT_SECONDS, 300));
    }

    public Duration pollInterval() {
        return Duration.ofMillis(positiveOr(POLL_INTERVAL_MILLIS, 1000));
    }

    public int busyTimeoutMillis() {
        return positiveOr(BUSY_TIMEOUT_MILLIS, 10000);
    }

    private int positiveOr(String key, int defaultValue) {
        int v = getInt(key, defaultValue);
        if (v < 1) {
            log.warn("Config value {}={} must be positive, using {}", key, v, defaultValue);
            return defaultValue;
        }
        return v;
    }
}
