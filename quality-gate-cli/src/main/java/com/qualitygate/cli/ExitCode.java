package com.qualitygate.cli;

/**
 * Process exit codes of the {@code check} command.
 */
public final class ExitCode {

    /** Overall score reached the passing score */
    public static final int PASS = 0;

    /** Overall score is below the passing score */
    public static final int QUALITY_FAILURE = 1;

    /** Configuration missing invariants or file set could not be loaded */
    public static final int CONFIGURATION_ERROR = 2;

    /** Unexpected failure while running the pipeline */
    public static final int EXECUTION_ERROR = 3;

    private ExitCode() {
        // Utility class
    }
}
