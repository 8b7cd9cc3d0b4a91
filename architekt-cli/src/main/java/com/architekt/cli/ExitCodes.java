package com.architekt.cli;

/**
 * Process exit codes returned by every command.
 */
public final class ExitCodes {

    public static final int OK = 0;
    public static final int FAILURE = 1;
    public static final int VALIDATION = 2;
    public static final int NOT_FOUND = 3;

    private ExitCodes() {
        // Constants class
    }
}
