package com.busylight.config;

public enum ProbeType {
    /**
     * Runs a command and matches the tail of its output against regular expressions.
     */
    COMMAND_PATTERN,
    /**
     * Runs a command and compares a number in its output with low/high thresholds.
     */
    COMMAND_THRESHOLD,
    /**
     * Looks for a keyword in the titles of visible windows.
     */
    WINDOW_TITLE;

    public boolean runsCommand() {
        return this != WINDOW_TITLE;
    }
}
