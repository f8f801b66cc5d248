package com.matey.anomaly.supervisor.process;

import com.matey.anomaly.supervisor.anomaly.DetectorOutputHandler;
import com.matey.anomaly.supervisor.anomaly.NotificationWorker;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Owns the bridge and detector child processes and the pipe between them.
 *
 * State machine: NEW -> RUNNING -> SHUTTING_DOWN -> STOPPED. Every line the detector
 * writes goes to the {@link DetectorOutputHandler} until its stdout reaches end of
 * stream, including lines written while shutting down. Either child exiting, end of
 * detector output or a read failure triggers a coordinated shutdown and then the
 * failure listener; children are never respawned.
 *
 * Shutdown order: stop the bridge, which closes the detector's input; give the detector
 * the grace period to flush its last batch and close its output; terminate it if it has
 * not (SIGTERM, then SIGKILL); wait for the reader to finish; flush the residual
 * notification batch; close the stream log.
 */
@Slf4j
public class ProcessSupervisor {

    private final ChildProcessLauncher launcher;
    private final SupervisorSettings settings;
    private final DetectorOutputHandler outputHandler;
    private final NotificationWorker notificationWorker;

    private final AtomicReference<SupervisorState> state = new AtomicReference<>(SupervisorState.NEW);
    private final CountDownLatch stopped = new CountDownLatch(1);
    private volatile Consumer<String> failureListener = reason -> { };

    private Process bridge;
    private Process detector;
    private Thread reader;

    public ProcessSupervisor(ChildProcessLauncher launcher,
                             SupervisorSettings settings,
                             DetectorOutputHandler outputHandler,
                             NotificationWorker notificationWorker) {
        this.launcher = launcher;
        this.settings = settings;
        this.outputHandler = outputHandler;
        this.notificationWorker = notificationWorker;
    }

    /**
     * Called once, after the children are gone, when the pipeline stopped on its own.
     */
    public void setFailureListener(Consumer<String> failureListener) {
        this.failureListener = failureListener;
    }

    public synchronized void start() {
        if (state.get() != SupervisorState.NEW) {
            throw new IllegalStateException("Supervisor already started; state=" + state.get());
        }

        List<Process> processes;
        try {
            processes = launcher.launch(settings.getBridgeCommand(), settings.getDetectorCommand(),
                    settings.getWorkingDirectory());
        } catch (ProcessSupervisionException e) {
            state.set(SupervisorState.STOPPED);
            stopped.countDown();
            outputHandler.close();
            throw e;
        }
        bridge = processes.get(0);
        detector = processes.get(1);
        log.info("Pipeline started. bridgePid={} detectorPid={}", bridge.pid(), detector.pid());

        notificationWorker.start();
        state.set(SupervisorState.RUNNING);

        reader = new Thread(() -> readDetectorOutput(detector.getInputStream()), "detector-reader");
        reader.start();

        bridge.onExit().thenAccept(p -> onChildExit("bridge", p));
        detector.onExit().thenAccept(p -> onChildExit("detector", p));
    }

    /**
     * Orderly stop requested from outside (application shutdown). Does not notify the
     * failure listener.
     */
    public void requestStop(String reason) {
        shutdown(reason, false);
    }

    public SupervisorState getState() {
        return state.get();
    }

    public boolean awaitStopped(Duration timeout) throws InterruptedException {
        return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void readDetectorOutput(InputStream output) {
        try (BufferedReader lines = new BufferedReader(new InputStreamReader(output, StandardCharsets.UTF_8))) {
            String line;
            while ((line = lines.readLine()) != null) {
                outputHandler.onLine(line);
            }
            shutdown("detector output closed", true);
        } catch (IOException e) {
            shutdown("detector output read failed: " + e.getMessage(), true);
        }
    }

    private void onChildExit(String name, Process process) {
        shutdown(name + " exited with code " + process.exitValue(), true);
    }

    private void shutdown(String reason, boolean failure) {
        if (!state.compareAndSet(SupervisorState.RUNNING, SupervisorState.SHUTTING_DOWN)) {
            return;
        }
        if (failure) {
            log.error("Pipeline failure: {}; shutting down", reason);
        } else {
            log.info("Stopping pipeline: {}", reason);
        }

        Duration grace = settings.getTerminationGrace();
        terminate("bridge", bridge);
        if (!awaitReader(grace)) {
            log.warn("Detector did not close its output within {}s of losing its input", grace.toSeconds());
            terminate("detector", detector);
            if (!awaitReader(grace)) {
                log.warn("Detector output reader still running; anomalies it queues from now on are not flushed");
            }
        }
        terminate("detector", detector);

        notificationWorker.stop();
        outputHandler.close();

        state.set(SupervisorState.STOPPED);
        log.info("Supervisor stopped");

        try {
            if (failure) {
                failureListener.accept(reason);
            }
        } finally {
            stopped.countDown();
        }
    }

    private void terminate(String name, Process process) {
        if (process == null || !process.isAlive()) {
            return;
        }
        Duration grace = settings.getTerminationGrace();
        process.destroy();
        try {
            if (!process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("{} did not exit within {}s; killing it. pid={}", name, grace.toSeconds(), process.pid());
                process.destroyForcibly();
                process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
        log.info("{} terminated. pid={}", name, process.pid());
    }

    /**
     * @return true once the reader has seen the end of the detector's output
     */
    private boolean awaitReader(Duration timeout) {
        if (reader == null || reader == Thread.currentThread()) {
            return true;
        }
        try {
            reader.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return !reader.isAlive();
    }
}
