package com.phillippitts.syd.exception;

/**
 * Thrown when processing of a single star fails (fitting stage error, unwritable output).
 * Local to that star: the pipeline records it and continues with the remaining stars.
 */
public class ProcessingException extends SydException {

    private final String star;

    public ProcessingException(String message, String star) {
        super(message + " (star: " + star + ")");
        this.star = star;
    }

    public ProcessingException(String message, String star, Throwable cause) {
        super(message + " (star: " + star + ")", cause);
        this.star = star;
    }

    public String getStar() {
        return star;
    }
}
