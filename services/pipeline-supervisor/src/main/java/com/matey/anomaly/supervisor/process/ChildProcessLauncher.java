package com.matey.anomaly.supervisor.process;

import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * Starts the bridge and the detector as one OS-level pipeline: the bridge's stdout is
 * the detector's stdin, the detector's stdout is left for the supervisor to read, and
 * both stderr streams go to the supervisor's own stderr.
 */
@Slf4j
public class ChildProcessLauncher {

    /**
     * @return the bridge process followed by the detector process
     */
    public List<Process> launch(List<String> bridgeCommand, List<String> detectorCommand, File workingDirectory) {
        ProcessBuilder bridge = new ProcessBuilder(bridgeCommand)
                .redirectError(ProcessBuilder.Redirect.INHERIT);
        ProcessBuilder detector = new ProcessBuilder(detectorCommand)
                .redirectError(ProcessBuilder.Redirect.INHERIT);
        if (workingDirectory != null) {
            bridge.directory(workingDirectory);
            detector.directory(workingDirectory);
        }

        log.info("Launching bridge: {}", String.join(" ", bridgeCommand));
        log.info("Launching detector: {}", String.join(" ", detectorCommand));
        try {
            return ProcessBuilder.startPipeline(List.of(bridge, detector));
        } catch (IOException e) {
            throw new ProcessSupervisionException("Failed to launch pipeline: " + e.getMessage(), e);
        }
    }
}
