package queuectl;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashSet;
import java.util.Set;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileIsCreatedWithDefaults() {
        Path file = tempDir.resolve("config.properties");

        Config config = new Config(file);

        assertThat(file).exists();
        assertThat(config.maxRetries()).isEqualTo(3);
        assertThat(config.backoffBaseSeconds()).isEqualTo(2);
        assertThat(config.jobTimeout()).isEqualTo(Duration.ofSeconds(300));
        assertThat(config.pollInterval()).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void valuesSetByOneInstanceAreSeenByAnotherAfterReload() {
        Path file = tempDir.resolve("config.properties");
        Config writer = new Config(file);
        Config reader = new Config(file);

        writer.set(Config.BACKOFF_BASE_SECONDS, "5");
        assertThat(reader.backoffBaseSeconds()).isEqualTo(2);

        reader.reload();
        assertThat(reader.backoffBaseSeconds()).isEqualTo(5);
    }

    @Test
    void concurrentReaderNeverSeesAHalfWrittenFile() throws Exception {
        Path file = tempDir.resolve("config.properties");
        Config writer = new Config(file);
        Config reader = new Config(file);
        writer.set(Config.BACKOFF_BASE_SECONDS, "3");

        Thread writes = new Thread(() -> {
            for (int i = 0; i < 300; i++) {
                writer.set(Config.BACKOFF_BASE_SECONDS, i % 2 == 0 ? "5" : "3");
            }
        });
        writes.start();
        Set<Integer> seen = new HashSet<>();
        while (writes.isAlive()) {
            reader.reload();
            seen.add(reader.backoffBaseSeconds());
        }
        writes.join();

        assertThat(seen).isSubsetOf(3, 5);
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files).containsExactly(file);
        }
    }

    @Test
    void unparseableOrNonPositiveValuesFallBackToDefaults() throws Exception {
        Path file = tempDir.resolve("config.properties");
        Files.writeString(file, "max_retries=lots\nbackoff_base_seconds=0\n");

        Config config = new Config(file);

        assertThat(config.maxRetries()).isEqualTo(3);
        assertThat(config.backoffBaseSeconds()).isEqualTo(2);
    }

    @Test
    void unknownKeysAreStoredButNotKnown() {
        Config config = new Config(tempDir.resolve("config.properties"));

        config.set("color", "blue");

        assertThat(config.get("color")).isEqualTo("blue");
        assertThat(Config.isKnownKey("color")).isFalse();
        assertThat(config.get("missing")).isNull();
    }
}
