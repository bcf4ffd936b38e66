package com.libragraph.workqueue.core.worker;

public sealed interface WorkOutcome {

    /** @param result serialized to JSON and stored in {@code result}; may be null */
    record Completed(Object result) implements WorkOutcome {}

    record Failed(ExecutionError error) implements WorkOutcome {
        public Failed {
            if (error == null) {
                error = ExecutionError.of(null);
            }
        }
    }

    static WorkOutcome completed(Object result) {
        return new Completed(result);
    }

    static WorkOutcome failed(ExecutionError error) {
        return new Failed(error);
    }

    static WorkOutcome failed(String message) {
        return new Failed(ExecutionError.of(message));
    }

    static WorkOutcome failed(Throwable t) {
        return new Failed(ExecutionError.from(t));
    }
}
