package com.ddosshield.core.error;

import java.util.List;

/**
 * Raised when a flow event lacks a usable source identity or timestamp, or
 * carries impossible counters. The event is dropped and counted; the
 * pipeline keeps running.
 *
 * @since 1.0.0
 */
public class MalformedEventException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final List<String> problems;

    public MalformedEventException(List<String> problems) {
        super("Malformed flow event: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public MalformedEventException(String problem, Throwable cause) {
        super("Malformed flow event: " + problem, cause);
        this.problems = List.of(problem);
    }

    /**
     * @return every validation problem found, in detection order
     */
    public List<String> getProblems() {
        return problems;
    }
}
