package com.matey.anomaly.supervisor.process;

import lombok.Value;

import java.io.File;
import java.time.Duration;
import java.util.List;

@Value
public class SupervisorSettings {

    List<String> bridgeCommand;
    List<String> detectorCommand;
    /** Working directory of both children; null inherits the supervisor's. */
    File workingDirectory;
    /**
     * Time the detector gets to drain after its input closes, and time a child gets to
     * exit after SIGTERM before it is killed.
     */
    Duration terminationGrace;
}
