package queuectl.worker;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class FileLivenessRegistryTest {

    private static final Instant BOOT = Instant.parse("2024-05-01T08:00:00.120Z");

    @TempDir
    Path tempDir;

    private final Map<Long, Instant> running = new HashMap<>();
    private FileLivenessRegistry registry;
    private Path workersDir;

    @BeforeEach
    void setUp() {
        workersDir = tempDir.resolve("workers");
        ProcessControl control = new ProcessControl() {
            @Override
            public boolean isAlive(long pid) {
                return running.containsKey(pid);
            }

            @Override
            public Optional<Instant> startInstant(long pid) {
                return Optional.ofNullable(running.get(pid));
            }

            @Override
            public boolean requestTermination(long pid) {
                return running.remove(pid) != null;
            }
        };
        registry = new FileLivenessRegistry(workersDir, control);
    }

    @Test
    void registeredLiveWorkersAreListed() throws Exception {
        running.put(101L, BOOT);
        running.put(102L, BOOT.plusSeconds(1));
        registry.register(101L, 1);
        registry.register(102L, 2);

        assertThat(registry.listAlive()).containsExactly(101L, 102L);
        assertThat(Files.readAllLines(workersDir.resolve("worker.102.pid")))
            .containsExactly("2", "2024-05-01T08:00:01.120Z");
        try (Stream<Path> files = Files.list(workersDir)) {
            assertThat(files).hasSize(2);
        }
    }

    @Test
    void deregisterRemovesMarker() {
        running.put(7L, BOOT);
        registry.register(7L, 1);

        registry.deregister(7L);
        registry.deregister(7L);

        assertThat(registry.listAlive()).isEmpty();
        assertThat(workersDir.resolve("worker.7.pid")).doesNotExist();
    }

    @Test
    void listingPrunesMarkersOfDeadProcesses() {
        running.put(1L, BOOT);
        registry.register(1L, 1);
        registry.register(2L, 2);

        assertThat(registry.listAlive()).containsExactly(1L);
        assertThat(workersDir.resolve("worker.2.pid")).doesNotExist();
        assertThat(workersDir.resolve("worker.1.pid")).exists();
    }

    @Test
    void markerOfCrashedWorkerIsStaleOnceItsPidIsReused() {
        running.put(300L, BOOT);
        registry.register(300L, 1);

        running.put(300L, BOOT.plusSeconds(3600));

        assertThat(registry.listAlive()).isEmpty();
        assertThat(workersDir.resolve("worker.300.pid")).doesNotExist();
    }

    @Test
    void markerWithoutStartInstantOnlyCountsWhereNoneIsReported() throws Exception {
        Files.createDirectories(workersDir);
        Files.writeString(workersDir.resolve("worker.400.pid"), "1");
        running.put(400L, BOOT);

        assertThat(registry.listAlive()).isEmpty();
        assertThat(workersDir.resolve("worker.400.pid")).doesNotExist();

        Files.writeString(workersDir.resolve("worker.401.pid"), "1");
        running.put(401L, null);

        assertThat(registry.listAlive()).containsExactly(401L);
    }

    @Test
    void pruneStaleReportsWhatWasRemoved() throws Exception {
        registry.register(5L, 1);
        running.put(6L, BOOT);
        registry.register(6L, 2);
        Files.writeString(workersDir.resolve("worker.garbage.pid"), "?");
        Files.writeString(workersDir.resolve("worker.8.pid"), "3\nyesterday");
        running.put(8L, BOOT);

        assertThat(registry.pruneStale()).containsExactly(5L, 8L);
        assertThat(workersDir.resolve("worker.garbage.pid")).doesNotExist();
        assertThat(registry.listAlive()).containsExactly(6L);
    }

    @Test
    void missingDirectoryMeansNoWorkers() {
        assertThat(registry.listAlive()).isEmpty();
    }
}
