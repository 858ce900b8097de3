package com.busylight.lifecycle;

import com.busylight.aggregate.ActivityAggregator;
import com.busylight.aggregate.ActivityListener;
import com.busylight.config.AppConfig;
import com.busylight.config.ConfigManager;
import com.busylight.config.SourceConfig;
import com.busylight.logging.LoggingConfigurator;
import com.busylight.probe.Probe;
import com.busylight.probe.Reading;
import com.busylight.schedule.PollScheduler;
import com.busylight.source.SourceId;
import com.busylight.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wires configuration, scheduler and aggregator together and keeps them in sync with the
 * configuration file.
 */
public class BusyLightService implements BusyLightApplication {

    private static final Logger log = LoggerFactory.getLogger(BusyLightService.class);

    private final Path configPath;
    private final ConfigManager configManager;
    private final SourceFactory sourceFactory;
    private final ActivityAggregator aggregator = new ActivityAggregator();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean paused = new AtomicBoolean(false);

    private AppConfig config;
    private ExecutorService publisher;
    private PollScheduler scheduler;

    public BusyLightService(Path configPath, ConfigManager configManager) {
        this(configPath, configManager, new SourceFactory());
    }

    public BusyLightService(Path configPath, ConfigManager configManager, SourceFactory sourceFactory) {
        this.configPath = configPath.toAbsolutePath().normalize();
        this.configManager = Objects.requireNonNull(configManager, "configManager");
        this.sourceFactory = Objects.requireNonNull(sourceFactory, "sourceFactory");
    }

    @Override
    public synchronized void start() throws Exception {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        this.config = configManager.load(configPath);
        LoggingConfigurator.apply(config.logging());
        log.info("Starting BusyLight with configuration {}", configPath);

        this.publisher = Executors.newSingleThreadExecutor(new NamedThreadFactory("publisher"));
        this.scheduler = new PollScheduler(config.tickInterval(), publisher, aggregator);
        aggregator.addListener(active -> log.info("Busy sources: {}", active.isEmpty() ? "none" : active));
        config.enabledSources().forEach(this::register);
        scheduler.start();

        configManager.registerListener(this::applyConfigReload);
        try {
            configManager.startWatching(configPath);
        } catch (Exception ex) {
            log.warn("Failed to start configuration watcher", ex);
        }
    }

    synchronized void applyConfigReload(AppConfig newConfig) {
        if (scheduler == null) {
            return;
        }
        AppConfig previous = this.config;
        this.config = newConfig;
        if (previous.equals(newConfig)) {
            log.debug("Configuration reload detected but nothing changed");
            return;
        }
        log.info("Configuration reloaded from {}", configPath);

        if (!previous.logging().equals(newConfig.logging())) {
            try {
                LoggingConfigurator.apply(newConfig.logging());
            } catch (Exception ex) {
                log.warn("Failed to apply logging configuration after reload", ex);
            }
        }

        Map<String, SourceConfig> before = byId(previous);
        Map<String, SourceConfig> after = byId(newConfig);
        before.forEach((id, source) -> {
            if (!source.equals(after.get(id))) {
                unregister(source.sourceId());
            }
        });
        after.forEach((id, source) -> {
            if (!source.equals(before.get(id))) {
                register(source);
            }
        });

        if (!previous.tickInterval().equals(newConfig.tickInterval())) {
            scheduler.reschedule(newConfig.tickInterval());
            log.info("Tick interval updated to {} ms", newConfig.tickInterval().toMillis());
        }
    }

    private void register(SourceConfig source) {
        Probe probe;
        try {
            probe = sourceFactory.createProbe(source);
        } catch (RuntimeException ex) {
            log.error("Source {} could not be created and stays disabled", source.id(), ex);
            return;
        }
        scheduler.addSource(source.sourceId(), source.debounce(), probe, sourceFactory.createOptions(source));
    }

    private void unregister(SourceId id) {
        if (scheduler.contains(id)) {
            scheduler.removeSource(id);
        }
    }

    private static Map<String, SourceConfig> byId(AppConfig configuration) {
        Map<String, SourceConfig> map = new LinkedHashMap<>();
        configuration.enabledSources().forEach(source -> map.put(source.id(), source));
        return map;
    }

    public void addActivityListener(ActivityListener listener) {
        aggregator.addListener(listener);
    }

    public Set<SourceId> activeSources() {
        return aggregator.activeSet();
    }

    public Optional<Reading> lastReading(SourceId id) {
        return aggregator.lastReading(id);
    }

    public synchronized Set<SourceId> registeredSources() {
        return scheduler == null ? Set.of() : scheduler.sources();
    }

    public synchronized AppConfig config() {
        return config;
    }

    public boolean isPaused() {
        return paused.get();
    }

    @Override
    public synchronized void pause() {
        if (scheduler == null || !paused.compareAndSet(false, true)) {
            return;
        }
        scheduler.stop();
        scheduler.resetAll();
        log.info("Monitoring paused");
    }

    @Override
    public synchronized void resume() {
        if (scheduler == null || !paused.compareAndSet(true, false)) {
            return;
        }
        scheduler.start();
        log.info("Monitoring resumed");
    }

    @Override
    public synchronized void stop() throws Exception {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("Stopping BusyLight");
        configManager.close();
        if (scheduler != null) {
            scheduler.close();
            scheduler = null;
        }
        if (publisher != null) {
            publisher.shutdown();
            if (!publisher.awaitTermination(5, TimeUnit.SECONDS)) {
                publisher.shutdownNow();
            }
        }
    }

    @Override
    public void close() throws Exception {
        stop();
    }
}
