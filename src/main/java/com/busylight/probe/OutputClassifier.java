package com.busylight.probe;

/**
 * Decides what a command's output says about the source.
 */
@FunctionalInterface
public interface OutputClassifier {

    Reading classify(CommandOutput output);
}
