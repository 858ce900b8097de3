package com.busylight.config;

@FunctionalInterface
public interface ConfigListener {

    void onConfigReload(AppConfig config);
}
