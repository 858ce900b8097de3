package com.busylight.config;

import com.busylight.util.NamedThreadFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;

/**
 * JSON configuration on disk, with optional live reload.
 *
 * <p>A reload that fails to parse or validate is logged and skipped; listeners keep the last
 * good configuration.
 */
public class FileConfigManager implements ConfigManager {

    private static final Logger log = LoggerFactory.getLogger(FileConfigManager.class);

    private final ObjectMapper mapper;
    private final List<ConfigListener> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService watcherExecutor;
    private WatchService watchService;
    private volatile boolean watching;

    public FileConfigManager() {
        this.mapper = new ObjectMapper()
                .registerModule(new ParameterNamesModule())
                .registerModule(new Jdk8Module())
                .registerModule(new JavaTimeModule());
        this.mapper.configure(SerializationFeature.INDENT_OUTPUT, true);
        this.mapper.configure(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS, false);
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.mapper.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
        this.watcherExecutor = Executors.newSingleThreadExecutor(new NamedThreadFactory("config-watcher"));
    }

    @Override
    public AppConfig load(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        ensureParentDirectory(path);
        if (!Files.exists(path)) {
            AppConfig defaults = AppConfig.defaults();
            save(path, defaults);
            return defaults;
        }
        AppConfig config;
        try (var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            config = mapper.readValue(reader, AppConfig.class);
        }
        if (config == null) {
            throw new IOException("Configuration file " + path + " is empty");
        }
        log.debug("Loaded configuration from {} ({} source(s))", path, config.sources().size());
        return config;
    }

    @Override
    public void save(Path path, AppConfig config) throws IOException {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(config, "config");
        ensureParentDirectory(path);
        try (var writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE)) {
            mapper.writeValue(writer, config);
        }
        log.info("Configuration saved to {}", path);
    }

    @Override
    public void registerListener(ConfigListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public synchronized void startWatching(Path configFile) throws IOException {
        Objects.requireNonNull(configFile, "configFile");
        if (watching) {
            return;
        }
        Path absolute = configFile.toAbsolutePath().normalize();
        ensureParentDirectory(absolute);
        Path dir = absolute.getParent();
        watchService = dir.getFileSystem().newWatchService();
        dir.register(watchService, ENTRY_CREATE, ENTRY_MODIFY);
        watching = true;
        watcherExecutor.submit(() -> runWatcherLoop(absolute));
        log.info("Watching {} for configuration changes", absolute);
    }

    private void runWatcherLoop(Path configFile) {
        while (watching) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ClosedWatchServiceException ex) {
                break;
            }
            boolean changed = false;
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.context() instanceof Path eventPath
                        && configFile.getParent().resolve(eventPath).equals(configFile)) {
                    changed = true;
                }
            }
            if (changed) {
                reload(configFile);
            }
            if (!key.reset()) {
                log.warn("Configuration directory {} is no longer watchable", configFile.getParent());
                break;
            }
        }
    }

    private void reload(Path configFile) {
        AppConfig reloaded;
        try {
            reloaded = load(configFile);
        } catch (IOException ex) {
            log.warn("Ignoring invalid configuration change in {}: {}", configFile, ex.getMessage());
            return;
        }
        for (ConfigListener listener : listeners) {
            try {
                listener.onConfigReload(reloaded);
            } catch (RuntimeException ex) {
                log.error("Configuration listener failed", ex);
            }
        }
    }

    @Override
    public void close() {
        watching = false;
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException ex) {
                log.debug("Error closing config watch service", ex);
            }
        }
        watcherExecutor.shutdownNow();
    }

    private void ensureParentDirectory(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }
    }
}
