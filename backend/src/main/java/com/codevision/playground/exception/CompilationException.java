package com.codevision.playground.exception;

public class CompilationException extends Exception {

    private final String stage;

    public CompilationException(String stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    /** Name of the pipeline stage that failed. */
    public String getStage() {
        return stage;
    }
}
