package queuectl;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import queuectl.worker.JobWorker;
import queuectl.worker.ShutdownSignal;
import queuectl.worker.StopResult;
import queuectl.worker.WorkerRuntime;

import java.io.PrintWriter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

@Command(name = "queuectl",
    mixinStandardHelpOptions = true,
    version = "queuectl 1.0",
    description = "A CLI-based background job queue system.",
    subcommands = {
        QueueCtl.InitDbCommand.class,
        QueueCtl.EnqueueCommand.class,
        QueueCtl.ListCommand.class,
        QueueCtl.StatusCommand.class,
        QueueCtl.WorkerCommand.class,
        QueueCtl.DLQCommand.class,
        QueueCtl.ConfigCommand.class
    })
public class QueueCtl implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(QueueCtl.class);

    private final Supplier<QueueContext> contextFactory;
    private QueueContext context;

    @Spec
    CommandSpec spec;

    public QueueCtl(Supplier<QueueContext> contextFactory) {
        this.contextFactory = contextFactory;
    }

    public QueueCtl() {
        this(() -> QueueContext.open(QueueHome.resolve()));
    }

    /**
     * Opened on first use so that {@code --help} never touches the queue home.
     */
    QueueContext context() {
        if (context == null) {
            context = contextFactory.get();
        }
        return context;
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    @Command(name = "init-db",
        description = "Initialize the job queue database.")
    static class InitDbCommand implements Callable<Integer> {

        @ParentCommand
        QueueCtl parent;

        @Spec
        CommandSpec spec;

        @Override
        public Integer call() {
            QueueContext ctx = parent.context();
            spec.commandLine().getOut().println("Database initialized at: " + ctx.home().databaseFile());
            return 0;
        }
    }

    @Command(name = "enqueue",
        description = {
            "Add a new job to the queue.",
            "Example: queuectl enqueue '{\"id\":\"job1\",\"command\":\"echo hello\"}'"
        })
    static class EnqueueCommand implements Callable<Integer> {

        @ParentCommand
        QueueCtl parent;

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "JSON job spec, or the command for the job to execute.")
        private String jobSpec;

        @Option(names = "--id", description = "Job id (defaults to a random UUID).")
        private String id;

        @Option(names = "--max-retries", description = "Attempts before the job moves to the DLQ.")
        private Integer maxRetries;

        @Override
        public Integer call() {
            QueueService service = parent.context().queueService();
            JobRequest request;
            if (jobSpec.trim().startsWith("{")) {
                JobRequest parsed = service.parseRequest(jobSpec);
                request = new JobRequest(
                    id != null ? id : parsed.id(),
                    parsed.command(),
                    maxRetries != null ? maxRetries : parsed.maxRetries());
            } else {
                request = new JobRequest(id, jobSpec, maxRetries);
            }
            Job job = service.enqueue(request);
            spec.commandLine().getOut().println("Job enqueued with ID: " + job.id());
            return 0;
        }
    }

    @Command(name = "list",
        description = "List jobs, optionally filtering by state.")
    static class ListCommand implements Callable<Integer> {

        @ParentCommand
        QueueCtl parent;

        @Spec
        CommandSpec spec;

        @Option(names = "--state", description = "Filter by state: ${COMPLETION-CANDIDATES}")
        private JobState state;

        @Override
        public Integer call() throws JsonProcessingException {
            QueueContext ctx = parent.context();
            PrintWriter out = spec.commandLine().getOut();
            if (state == null) {
                out.println("Listing all jobs (use --state to filter):");
                for (Map.Entry<JobState, List<Job>> entry : ctx.queueService().listAll().entrySet()) {
                    printJobs(out, ctx, entry.getKey(), entry.getValue());
                }
            } else {
                List<Job> jobs = ctx.queueService().findJobsByState(state);
                if (jobs.isEmpty()) {
                    out.println("No jobs found with state: " + state.dbValue());
                }
                printJobs(out, ctx, state, jobs);
            }
            return 0;
        }

        private static void printJobs(PrintWriter out, QueueContext ctx, JobState state, List<Job> jobs)
                throws JsonProcessingException {
            if (jobs.isEmpty()) {
                return;
            }
            out.println();
            out.println("--- State: " + state.name() + " (" + jobs.size() + ") ---");
            for (Job job : jobs) {
                out.println(ctx.objectMapper().writeValueAsString(job));
            }
        }
    }

    @Command(name = "status",
        description = "Show a summary of all job states and active workers.")
    static class StatusCommand implements Callable<Integer> {

        @ParentCommand
        QueueCtl parent;

        @Spec
        CommandSpec spec;

        @Override
        public Integer call() {
            QueueSummary summary = parent.context().queueService().summary();
            PrintWriter out = spec.commandLine().getOut();
            out.println("--- Queue Status ---");
            out.println("Active Workers: " + summary.activeWorkers());
            out.println("Pending:        " + summary.count(JobState.PENDING));
            out.println("Processing:     " + summary.count(JobState.PROCESSING));
            out.println("Completed:      " + summary.count(JobState.COMPLETED));
            out.println("Dead (DLQ):     " + summary.count(JobState.DEAD));
            return 0;
        }
    }

    @Command(name = "worker",
        description = "Manage worker processes.",
        subcommands = {
            WorkerCommand.StartCommand.class,
            WorkerCommand.StopCommand.class,
            WorkerCommand.RunCommand.class
        })
    static class WorkerCommand implements Callable<Integer> {

        @ParentCommand
        QueueCtl parent;

        @Spec
        CommandSpec spec;

        @Override
        public Integer call() {
            spec.commandLine().getOut().println("Use 'worker start --count N' or 'worker stop'.");
            return 0;
        }

        @Command(name = "start", description = "Start one or more background worker processes.")
        static class StartCommand implements Callable<Integer> {

            @ParentCommand
            WorkerCommand parent;

            @Spec
            CommandSpec spec;

            @Option(names = "--count", defaultValue = "1", description = "Number of workers to start.")
            private int count;

            @Override
            public Integer call() {
                if (count < 1) {
                    throw new CommandLine.ParameterException(spec.commandLine(), "--count must be at least 1");
                }
                QueueContext ctx = parent.parent.context();
                List<Long> pids = ctx.supervisor().start(count);
                PrintWriter out = spec.commandLine().getOut();
                PrintWriter err = spec.commandLine().getErr();
                if (pids.isEmpty()) {
                    err.println("Error: no workers could be started. See the worker logs in " + ctx.home().logsDir());
                    return 1;
                }
                out.println("Successfully started " + pids.size() + " worker(s): " + pids);
                out.println("They will run in the background. Use 'queuectl worker stop' to stop them.");
                if (pids.size() < count) {
                    err.println("Warning: only " + pids.size() + " of " + count + " workers started. See the worker logs in "
                        + ctx.home().logsDir());
                    return 1;
                }
                return 0;
            }
        }

        @Command(name = "stop", description = "Stop all running workers gracefully.")
        static class StopCommand implements Callable<Integer> {

            @ParentCommand
            WorkerCommand parent;

            @Spec
            CommandSpec spec;

            @Override
            public Integer call() {
                PrintWriter out = spec.commandLine().getOut();
                StopResult result = parent.parent.context().supervisor().stop();
                switch (result.outcome()) {
                    case NOTHING_TO_STOP:
                        out.println("No active workers found.");
                        return 0;
                    case ALL_STOPPED:
                        out.println("Stopped " + result.signalled().size() + " worker(s) gracefully.");
                        return 0;
                    default:
                        spec.commandLine().getErr().println("Some workers did not stop in time: " + result.remaining()
                            + ". They may still be finishing a job.");
                        return 1;
                }
            }
        }

        /**
         * Entry point of a spawned worker process. Not meant to be typed by hand.
         */
        @Command(name = "run", hidden = true, description = "Run a worker loop in this process.")
        static class RunCommand implements Callable<Integer> {

            @ParentCommand
            WorkerCommand parent;

            @Option(names = "--ordinal", required = true, description = "Worker number.")
            private int ordinal;

            @Override
            public Integer call() {
                QueueContext ctx = parent.parent.context();
                long pid = ProcessHandle.current().pid();
                ShutdownSignal shutdown = new ShutdownSignal();
                JobWorker worker = ctx.newWorker(ordinal, shutdown);
                WorkerRuntime runtime = new WorkerRuntime(pid, ordinal, ctx.livenessRegistry(), worker);

                // SIGTERM/SIGINT run this hook; the JVM stays up until the current job is done.
                Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                    if (shutdown.request()) {
                        log.info("Worker {} (PID: {}) received termination signal. Shutting down gracefully...", ordinal, pid);
                    }
                    try {
                        runtime.awaitFinished();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }, "queuectl-worker-" + ordinal + "-shutdown"));

                runtime.run();
                return 0;
            }
        }
    }

    @Command(name = "dlq",
        description = "Manage the Dead Letter Queue (permanently failed jobs).",
        subcommands = {
            DLQCommand.ListDLQCommand.class,
            DLQCommand.RetryDLQCommand.class
        })
    static class DLQCommand implements Callable<Integer> {

        @ParentCommand
        QueueCtl parent;

        @Spec
        CommandSpec spec;

        @Override
        public Integer call() {
            spec.commandLine().getOut().println("Use 'dlq list' or 'dlq retry <job-id>'.");
            return 0;
        }

        @Command(name = "list", description = "View all jobs in the DLQ.")
        static class ListDLQCommand implements Callable<Integer> {

            @ParentCommand
            DLQCommand parent;

            @Spec
            CommandSpec spec;

            @Override
            public Integer call() {
                List<Job> jobs = parent.parent.context().queueService().dlqJobs();
                PrintWriter out = spec.commandLine().getOut();
                if (jobs.isEmpty()) {
                    out.println("Dead Letter Queue is empty.");
                    return 0;
                }
                out.println("--- DLQ Jobs (" + jobs.size() + ") ---");
                for (Job job : jobs) {
                    out.println("- " + job);
                    if (job.lastError() != null) {
                        out.println("    Error: " + job.lastError().replace("\n", "\n    "));
                    }
                }
                return 0;
            }
        }

        @Command(name = "retry", description = "Move a specific job from the DLQ back to the pending queue.")
        static class RetryDLQCommand implements Callable<Integer> {

            @ParentCommand
            DLQCommand parent;

            @Spec
            CommandSpec spec;

            @Parameters(index = "0", description = "The ID of the job to retry.")
            private String jobId;

            @Override
            public Integer call() {
                parent.parent.context().queueService().retryDeadJob(jobId);
                spec.commandLine().getOut().println("Job '" + jobId + "' moved from DLQ to 'pending' queue.");
                return 0;
            }
        }
    }

    @Command(name = "config",
        description = "Manage system configuration.",
        subcommands = {
            ConfigCommand.SetCommand.class,
            ConfigCommand.GetCommand.class
        })
    static class ConfigCommand implements Callable<Integer> {

        @ParentCommand
        QueueCtl parent;

        @Spec
        CommandSpec spec;

        @Override
        public Integer call() {
            spec.commandLine().getOut().println("Use 'config set <key> <value>' or 'config get <key>'. Known keys: "
                + Config.knownKeys());
            return 0;
        }

        @Command(name = "set", description = "Set a configuration value.")
        static class SetCommand implements Callable<Integer> {

            @ParentCommand
            ConfigCommand parent;

            @Spec
            CommandSpec spec;

            @Parameters(index = "0", description = "The config key.")
            private String key;

            @Parameters(index = "1", description = "The config value.")
            private String value;

            @Override
            public Integer call() {
                if (!Config.isKnownKey(key)) {
                    spec.commandLine().getErr().println("Warning: '" + key + "' is not a recognized setting.");
                }
                parent.parent.context().config().set(key, value);
                spec.commandLine().getOut().println("Config updated: " + key + " = " + value);
                return 0;
            }
        }

        @Command(name = "get", description = "Get a configuration value.")
        static class GetCommand implements Callable<Integer> {

            @ParentCommand
            ConfigCommand parent;

            @Spec
            CommandSpec spec;

            @Parameters(index = "0", description = "The config key.")
            private String key;

            @Override
            public Integer call() {
                String value = parent.parent.context().config().get(key);
                if (value == null) {
                    spec.commandLine().getErr().println("Error: Config key '" + key + "' not found.");
                    return 1;
                }
                spec.commandLine().getOut().println(key + " = " + value);
                return 0;
            }
        }
    }

    /**
     * Command line with queue errors reported as plain messages rather than stack traces.
     */
    public static CommandLine commandLine(QueueCtl queueCtl) {
        CommandLine cmd = new CommandLine(queueCtl);
        cmd.setCaseInsensitiveEnumValuesAllowed(true);
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof QueueException) {
                commandLine.getErr().println("Error: " + ex.getMessage());
                log.debug("Command failed", ex);
                return 1;
            }
            throw ex;
        });
        return cmd;
    }

    public static void main(String[] args) {
        int exitCode = commandLine(new QueueCtl()).execute(args);
        System.exit(exitCode);
    }
}
