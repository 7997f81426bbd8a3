package com.syntaxlens.cli;

/**
 * Process exit codes shared by the commands.
 */
public final class ExitCodes {

    /** Command succeeded; for {@code validate}, the source is valid. */
    public static final int OK = 0;

    /** The source is invalid or could not be analyzed. */
    public static final int INVALID = 1;

    /** The file is unreadable or its language is not supported by the command. */
    public static final int UNSUPPORTED = 2;

    private ExitCodes() {
    }
}
