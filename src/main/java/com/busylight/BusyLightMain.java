package com.busylight;

import com.busylight.config.FileConfigManager;
import com.busylight.lifecycle.BusyLightApplication;
import com.busylight.lifecycle.BusyLightService;
import com.busylight.util.PathUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

public final class BusyLightMain {

    private static final Logger log = LoggerFactory.getLogger(BusyLightMain.class);

    private BusyLightMain() {
    }

    public static void main(String[] args) {
        Path configPath = resolveConfigPath(args);
        log.info("{}", banner(version(), configPath));
        if (!Files.exists(configPath)) {
            log.info("No configuration at {}; writing defaults with no sources", configPath);
        }
        try (FileConfigManager configManager = new FileConfigManager()) {
            BusyLightApplication application = new BusyLightService(configPath, configManager);
            CountDownLatch latch = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                try {
                    application.stop();
                } catch (Exception ex) {
                    log.error("Error during shutdown", ex);
                } finally {
                    latch.countDown();
                }
            }, "busylight-shutdown"));

            application.start();
            latch.await();
        } catch (Exception ex) {
            log.error("BusyLight could not start monitoring; check {}", configPath, ex);
            System.exit(1);
        }
    }

    static Path resolveConfigPath(String[] args) {
        String candidate = args != null && args.length > 0 ? args[0] : null;
        return PathUtils.resolveOrDefault(candidate, Path.of("config", "config.json"));
    }

    static String version() {
        return StringUtils.defaultIfBlank(BusyLightMain.class.getPackage().getImplementationVersion(), "dev");
    }

    static String banner(String version, Path configPath) {
        return "BusyLight " + version + " watching sources from " + configPath;
    }
}
