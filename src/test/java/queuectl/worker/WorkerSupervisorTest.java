package queuectl.worker;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import queuectl.JobState;
import queuectl.JobStore;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkerSupervisorTest {

    @TempDir
    Path tempDir;

    @Mock
    WorkerLauncher launcher;

    @Mock
    LivenessRegistry registry;

    @Mock
    ProcessControl processControl;

    @Test
    void startLaunchesDistinctOrdinals() throws Exception {
        when(launcher.launch(1)).thenReturn(11L);
        when(launcher.launch(2)).thenReturn(12L);
        when(launcher.launch(3)).thenReturn(13L);
        when(registry.listAlive()).thenReturn(Set.of(11L, 12L, 13L));

        List<Long> pids = supervisor().start(3);

        assertThat(pids).containsExactly(11L, 12L, 13L);
    }

    @Test
    void startStopsAtFirstLaunchFailure() throws Exception {
        when(launcher.launch(1)).thenReturn(11L);
        when(launcher.launch(2)).thenThrow(new IOException("fork failed"));
        when(registry.listAlive()).thenReturn(Set.of(11L));

        List<Long> pids = supervisor().start(3);

        assertThat(pids).containsExactly(11L);
        verify(launcher, never()).launch(3);
    }

    @Test
    void startWaitsForRegistrationAndDropsWorkersThatExit() throws Exception {
        when(launcher.launch(1)).thenReturn(11L);
        when(launcher.launch(2)).thenReturn(12L);
        when(registry.listAlive()).thenReturn(Set.of(), Set.of(11L));
        when(processControl.isAlive(11L)).thenReturn(true);
        when(processControl.isAlive(12L)).thenReturn(false);

        List<Long> pids = supervisor().start(2);

        assertThat(pids).containsExactly(11L);
        verify(processControl, never()).requestTermination(anyLong());
    }

    @Test
    void startTerminatesWorkersThatNeverRegister() throws Exception {
        when(launcher.launch(1)).thenReturn(11L);
        when(registry.listAlive()).thenReturn(Set.of());
        when(processControl.isAlive(11L)).thenReturn(true);

        List<Long> pids = supervisor().start(1);

        assertThat(pids).isEmpty();
        verify(processControl).requestTermination(11L);
    }

    @Test
    void startRejectsNonPositiveCount() {
        assertThatThrownBy(() -> supervisor().start(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void stopWithNoWorkersHasNothingToDo() {
        when(registry.listAlive()).thenReturn(Set.of());

        StopResult result = supervisor().stop();

        assertThat(result.outcome()).isEqualTo(StopResult.Outcome.NOTHING_TO_STOP);
        verify(processControl, never()).requestTermination(anyLong());
    }

    @Test
    void stopReportsWorkersThatOutliveTheWaitWindow() {
        when(registry.listAlive()).thenReturn(Set.of(42L, 43L));
        when(processControl.requestTermination(anyLong())).thenReturn(true);

        StopResult result = supervisor().stop();

        assertThat(result.outcome()).isEqualTo(StopResult.Outcome.TIMED_OUT);
        assertThat(result.remaining()).containsExactlyInAnyOrder(42L, 43L);
        verify(processControl).requestTermination(42L);
        verify(processControl).requestTermination(43L);
    }

    @Test
    void stopSucceedsOnceRegistryDrains() {
        when(registry.listAlive()).thenReturn(Set.of(42L), Set.of(42L), Set.of());
        when(processControl.requestTermination(42L)).thenReturn(true);

        StopResult result = supervisor().stop();

        assertThat(result.outcome()).isEqualTo(StopResult.Outcome.ALL_STOPPED);
        assertThat(result.signalled()).containsExactly(42L);
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void threeWorkersStartAndStopCleanly() throws Exception {
        JobStore store = new JobStore(tempDir.resolve("queue.db"), 5000);
        store.init();
        store.insert("warmup", "true", 3);

        InProcessWorkers workers = new InProcessWorkers(store);
        FileLivenessRegistry fileRegistry = new FileLivenessRegistry(tempDir.resolve("workers"), workers);
        workers.registry = fileRegistry;
        WorkerSupervisor supervisor = new WorkerSupervisor(workers, fileRegistry, workers);

        assertThat(supervisor.start(3)).hasSize(3);
        assertThat(waitUntil(5, TimeUnit.SECONDS, () -> supervisor.activeWorkers().size() == 3)).isTrue();
        assertThat(waitUntil(5, TimeUnit.SECONDS,
            () -> store.findById("warmup").state() == JobState.COMPLETED)).isTrue();

        StopResult result = supervisor.stop();

        assertThat(result.outcome()).isEqualTo(StopResult.Outcome.ALL_STOPPED);
        assertThat(result.signalled()).hasSize(3);
        assertThat(supervisor.activeWorkers()).isEmpty();
    }

    private WorkerSupervisor supervisor() {
        return new WorkerSupervisor(launcher, registry, processControl, Duration.ofMillis(10), 3, 3);
    }

    private static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(50);
        }
        return false;
    }

    /**
     * Runs each "process" as a thread with a synthetic pid.
     */
    private static final class InProcessWorkers implements WorkerLauncher, ProcessControl {

        private final JobStore store;
        private final AtomicLong nextPid = new AtomicLong(90_000);
        private final Map<Long, Thread> threads = new ConcurrentHashMap<>();
        private final Map<Long, ShutdownSignal> signals = new ConcurrentHashMap<>();
        private final Map<Long, Instant> starts = new ConcurrentHashMap<>();
        LivenessRegistry registry;

        InProcessWorkers(JobStore store) {
            this.store = store;
        }

        @Override
        public long launch(int ordinal) {
            long pid = nextPid.incrementAndGet();
            ShutdownSignal shutdown = new ShutdownSignal();
            JobWorker worker = new JobWorker(ordinal, store, new ShellCommandExecutor(), RetryPolicy.withBase(2),
                shutdown, Duration.ofSeconds(10), Duration.ofMillis(100), Clock.systemUTC());
            Thread thread = new Thread(new WorkerRuntime(pid, ordinal, registry, worker)::run, "worker-" + ordinal);
            signals.put(pid, shutdown);
            starts.put(pid, Instant.now());
            threads.put(pid, thread);
            thread.start();
            return pid;
        }

        @Override
        public boolean isAlive(long pid) {
            Thread thread = threads.get(pid);
            return thread != null && thread.isAlive();
        }

        @Override
        public Optional<Instant> startInstant(long pid) {
            return Optional.ofNullable(starts.get(pid));
        }

        @Override
        public boolean requestTermination(long pid) {
            ShutdownSignal signal = signals.get(pid);
            return signal != null && signal.request();
        }
    }
}
