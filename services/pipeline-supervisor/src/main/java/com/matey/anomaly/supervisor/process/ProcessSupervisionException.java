package com.matey.anomaly.supervisor.process;

public class ProcessSupervisionException extends RuntimeException {

    public ProcessSupervisionException(String message, Throwable cause) {
        super(message, cause);
    }
}
