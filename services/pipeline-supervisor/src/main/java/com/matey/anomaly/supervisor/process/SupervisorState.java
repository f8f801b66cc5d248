package com.matey.anomaly.supervisor.process;

public enum SupervisorState {
    NEW,
    RUNNING,
    SHUTTING_DOWN,
    STOPPED
}
