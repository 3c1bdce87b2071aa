package queuectl.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import queuectl.QueueHome;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Spawns each worker as a detached JVM running {@code <mainClass> worker run --ordinal N}
 * with this JVM's class path. Output goes to {@code logs/worker-N.log} under the queue home.
 */
public class ProcessWorkerLauncher implements WorkerLauncher {

    private static final Logger log = LoggerFactory.getLogger(ProcessWorkerLauncher.class);

    static final String LOG_LEVEL_PROPERTY = "queuectl.log.level";

    private final QueueHome home;
    private final String mainClass;

    public ProcessWorkerLauncher(QueueHome home, String mainClass) {
        this.home = Objects.requireNonNull(home, "home must not be null");
        this.mainClass = Objects.requireNonNull(mainClass, "mainClass must not be null");
    }

    @Override
    public long launch(int ordinal) throws IOException {
        Files.createDirectories(home.logsDir());
        Path logFile = home.logsDir().resolve("worker-" + ordinal + ".log");

        ProcessBuilder pb = new ProcessBuilder(command(ordinal));
        pb.redirectErrorStream(true);
        pb.redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()));
        Process process = pb.start();
        process.getOutputStream().close();

        log.debug("Launched worker {} as process {} (log: {})", ordinal, process.pid(), logFile);
        return process.pid();
    }

    List<String> command(int ordinal) {
        List<String> cmd = new ArrayList<>();
        cmd.add(javaExecutable());
        cmd.add("-cp");
        cmd.add(System.getProperty("java.class.path"));
        cmd.add("-D" + QueueHome.HOME_PROPERTY + "=" + home.root());
        cmd.add("-D" + LOG_LEVEL_PROPERTY + "=INFO");
        cmd.add(mainClass);
        cmd.add("worker");
        cmd.add("run");
        cmd.add("--ordinal");
        cmd.add(Integer.toString(ordinal));
        return cmd;
    }

    private static String javaExecutable() {
        return ProcessHandle.current().info().command()
            .orElseGet(() -> Paths.get(System.getProperty("java.home"), "bin", "java").toString());
    }
}
