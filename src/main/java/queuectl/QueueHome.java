package queuectl;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

public final class QueueHome {

    public static final String HOME_PROPERTY = "queuectl.home";
    public static final String HOME_ENV = "QUEUECTL_HOME";

    private final Path root;

    public QueueHome(Path root) {
        this.root = Objects.requireNonNull(root, "root must not be null").toAbsolutePath();
    }

    public static QueueHome resolve() {
        String fromProperty = System.getProperty(HOME_PROPERTY);
        if (fromProperty != null && !fromProperty.isBlank()) {
            return new QueueHome(Paths.get(fromProperty));
        }
        String fromEnv = System.getenv(HOME_ENV);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return new QueueHome(Paths.get(fromEnv));
        }
        return new QueueHome(Paths.get(System.getProperty("user.home"), ".queuectl"));
    }

    public Path root() {
        return root;
    }

    public Path databaseFile() {
        return root.resolve("queue.db");
    }

    public Path configFile() {
        return root.resolve("config.properties");
    }

    public Path workersDir() {
        return root.resolve("workers");
    }

    public Path logsDir() {
        return root.resolve("logs");
    }

    public QueueHome ensureExists() {
        try {
            Files.createDirectories(root);
            Files.createDirectories(workersDir());
            Files.createDirectories(logsDir());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create queuectl home at " + root, e);
        }
        return this;
    }
}
