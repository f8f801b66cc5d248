package com.matey.anomaly.supervisor.process;

import com.matey.anomaly.core.lifecycle.ApplicationTerminator;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Ties the supervised pipeline to the application lifecycle: started with the context,
 * stopped with it, and a pipeline that dies on its own takes the application down with
 * a non-zero exit code.
 */
@Component
@RequiredArgsConstructor
public class SupervisorRunner {

    public static final int EXIT_PIPELINE_FAILED = 1;

    private final ProcessSupervisor supervisor;
    private final ApplicationTerminator terminator;

    @PostConstruct
    public void start() {
        supervisor.setFailureListener(reason -> terminator.terminate(EXIT_PIPELINE_FAILED, reason));
        supervisor.start();
    }

    @PreDestroy
    public void stop() {
        supervisor.requestStop("application shutdown");
    }
}
