package com.busylight.lifecycle;

public interface BusyLightApplication extends AutoCloseable {

    void start() throws Exception;

    /**
     * Stops sampling and clears every source, so nothing is reported busy while paused.
     */
    void pause();

    void resume();

    void stop() throws Exception;
}
