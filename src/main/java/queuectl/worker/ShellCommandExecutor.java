package queuectl.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public class ShellCommandExecutor implements CommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(ShellCommandExecutor.class);

    private static final long STREAM_DRAIN_MILLIS = 2000;

    @Override
    public CommandResult execute(String command, Duration timeout) throws CommandExecutionException {
        long startNanos = System.nanoTime();
        Process process;
        try {
            process = new ProcessBuilder(shellCommand(command)).start();
        } catch (IOException e) {
            throw new CommandExecutionException("Cannot start command: " + e.getMessage(), e);
        }
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            process.destroyForcibly();
            throw new CommandExecutionException("Cannot close command input: " + e.getMessage(), e);
        }
        CompletableFuture<String> stdout = drain(process.getInputStream());
        CompletableFuture<String> stderr = drain(process.getErrorStream());

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                log.warn("Command exceeded {}s, killing it: {}", timeout.toSeconds(), command);
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
                process.waitFor(STREAM_DRAIN_MILLIS, TimeUnit.MILLISECONDS);
                return CommandResult.timedOut(collect(stdout), collect(stderr), elapsedSince(startNanos));
            }
            return CommandResult.exited(process.exitValue(), collect(stdout), collect(stderr), elapsedSince(startNanos));
        } catch (InterruptedException e) {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new CommandExecutionException("Interrupted while waiting for command", e);
        }
    }

    static String[] shellCommand(String command) {
        String os = System.getProperty("os.name").toLowerCase(Locale.ROOT);
        if (os.contains("win")) {
            return new String[]{"cmd", "/c", command};
        }
        return new String[]{"sh", "-c", command};
    }

    private static CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    // A grandchild that inherited the pipe can keep it open after we stop waiting; give up on its output then.
    private static String collect(CompletableFuture<String> output) {
        try {
            return output.get(STREAM_DRAIN_MILLIS, TimeUnit.MILLISECONDS).trim();
        } catch (TimeoutException e) {
            output.cancel(true);
            return "";
        } catch (ExecutionException e) {
            log.debug("Could not read command output", e.getCause());
            return "";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "";
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
