package queuectl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import queuectl.worker.FileLivenessRegistry;
import queuectl.worker.JobWorker;
import queuectl.worker.LivenessRegistry;
import queuectl.worker.OsProcessControl;
import queuectl.worker.ProcessControl;
import queuectl.worker.ProcessWorkerLauncher;
import queuectl.worker.RetryPolicy;
import queuectl.worker.ShellCommandExecutor;
import queuectl.worker.ShutdownSignal;
import queuectl.worker.WorkerLauncher;
import queuectl.worker.WorkerSupervisor;

import java.time.Clock;
import java.util.Objects;

/**
 * Wires the queue components for one queue home.
 */
public class QueueContext {

    private final QueueHome home;
    private final Config config;
    private final JobStore store;
    private final LivenessRegistry livenessRegistry;
    private final WorkerSupervisor supervisor;
    private final QueueService queueService;
    private final ObjectMapper objectMapper;

    public QueueContext(QueueHome home, WorkerLauncher launcher, ProcessControl processControl) {
        this.home = Objects.requireNonNull(home, "home must not be null").ensureExists();
        this.config = new Config(home.configFile());
        this.store = new JobStore(home.databaseFile(), config.busyTimeoutMillis());
        this.store.init();
        this.livenessRegistry = new FileLivenessRegistry(home.workersDir(), processControl);
        this.supervisor = new WorkerSupervisor(launcher, livenessRegistry, processControl);
        this.objectMapper = newObjectMapper();
        this.queueService = new QueueService(store, config, livenessRegistry, objectMapper);
    }

    public static QueueContext open(QueueHome home) {
        return new QueueContext(home, new ProcessWorkerLauncher(home, QueueCtl.class.getName()), new OsProcessControl());
    }

    public static ObjectMapper newObjectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Builds the loop for one worker. The backoff base is re-read on every failure.
     */
    public JobWorker newWorker(int ordinal, ShutdownSignal shutdown) {
        RetryPolicy retryPolicy = new RetryPolicy(() -> {
            config.reload();
            return config.backoffBaseSeconds();
        });
        return new JobWorker(ordinal, store, new ShellCommandExecutor(), retryPolicy, shutdown,
            config.jobTimeout(), config.pollInterval(), Clock.systemUTC());
    }

    public QueueHome home() {
        return home;
    }

    public Config config() {
        return config;
    }

    public JobStore store() {
        return store;
    }

    public LivenessRegistry livenessRegistry() {
        return livenessRegistry;
    }

    public WorkerSupervisor supervisor() {
        return supervisor;
    }

    public QueueService queueService() {
        return queueService;
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }
}
