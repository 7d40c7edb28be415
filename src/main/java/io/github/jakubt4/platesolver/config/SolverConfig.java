package io.github.jakubt4.platesolver.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Threads that drain solver output while the process runs.
 *
 * <p>One reader per running process; the pool grows with concurrent solves and
 * has no upper bound, matching the absence of admission control in front of it.
 */
@Slf4j
@Configuration
public class SolverConfig {

    @Bean(name = "solverOutputExecutor", destroyMethod = "shutdownNow")
    ExecutorService solverOutputExecutor() {
        final var counter = new AtomicInteger();
        log.info("Solver output executor initialized");
        return Executors.newCachedThreadPool(runnable -> {
            final var thread = new Thread(runnable, "solver-output-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
