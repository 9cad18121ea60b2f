package org.trypticon.fstkit.cli;

/**
 * Constants shared by the commands.
 */
class Constants {
    static final String APP_NAME = "fstkit";

    static final String STDIN = "standard input";
    static final String STDOUT = "standard output";
}
