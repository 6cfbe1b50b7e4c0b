package com.tlsearch.build;

/**
 * A build that did not produce a complete collection. {@code completed} counts the items embedded
 * before the failure, including any resumed prefix.
 */
public class BuildException extends Exception {
    private final int completed;
    private final int total;

    public BuildException(String message, int completed, int total, Throwable cause) {
        super(message, cause);
        this.completed = completed;
        this.total = total;
    }

    public static BuildException afterItems(int completed, int total, Throwable cause) {
        return new BuildException("Failed after processing %d/%d items: %s".formatted(completed, total, cause.getMessage()),
                completed, total, cause);
    }

    public static BuildException beforeItems(String message, Throwable cause) {
        return new BuildException(message + ": " + cause.getMessage(), 0, 0, cause);
    }

    public int completed() {
        return completed;
    }

    public int total() {
        return total;
    }
}
