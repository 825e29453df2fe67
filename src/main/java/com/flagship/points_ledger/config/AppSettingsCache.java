package com.flagship.points_ledger.config;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Process-wide cache of the {@code app_settings} table.
 *
 * Holds an immutable {@link Snapshot} of all settings together with the
 * instant it was loaded. Reads are served from the snapshot until it is older
 * than the refresh window, then the table is reloaded on the calling thread.
 * {@link #forceRefresh()} bypasses the window.
 *
 * If a reload fails, the last good snapshot keeps being served (or an empty
 * one when nothing was ever loaded) and the next read retries. Callers always
 * supply a default for every key.
 *
 * The cache is a Spring singleton injected through constructors; nothing
 * reaches it through static state.
 */
@Component
@Slf4j
public class AppSettingsCache {

    private final AppSettingRepository repository;
    private final Duration refreshWindow;
    private final Clock clock;

    private volatile Snapshot snapshot;

    @Autowired
    public AppSettingsCache(AppSettingRepository repository,
                            @org.springframework.beans.factory.annotation.Value("${app-settings.cache-window-ms:30000}")
                            long cacheWindowMs) {
        this(repository, Duration.ofMillis(cacheWindowMs), Clock.systemUTC());
    }

    AppSettingsCache(AppSettingRepository repository, Duration refreshWindow, Clock clock) {
        this.repository = repository;
        this.refreshWindow = refreshWindow;
        this.clock = clock;
    }

    /**
     * Returns the current snapshot, reloading it first if it is stale.
     */
    public Snapshot current() {
        Snapshot current = snapshot;
        if (current != null && !isStale(current)) {
            return current;
        }
        return reload(false);
    }

    /**
     * Reloads the settings regardless of the refresh window.
     */
    public Snapshot forceRefresh() {
        return reload(true);
    }

    public String get(String key, String defaultValue) {
        String value = current().getValues().get(key);
        return value != null ? value : defaultValue;
    }

    public long getLong(String key, long defaultValue) {
        String value = current().getValues().get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            log.warn("App setting is not a number, using default: key={}, value={}, default={}",
                    key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = current().getValues().get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    private boolean isStale(Snapshot current) {
        return Duration.between(current.getLoadedAt(), clock.instant()).compareTo(refreshWindow) >= 0;
    }

    private synchronized Snapshot reload(boolean force) {
        // Another thread may have refreshed while this one waited for the monitor.
        Snapshot current = snapshot;
        if (!force && current != null && !isStale(current)) {
            return current;
        }

        try {
            Map<String, String> values = new HashMap<>();
            for (AppSettingEntity setting : repository.findAll()) {
                if (setting.getValue() != null) {
                    values.put(setting.getKey(), setting.getValue());
                }
            }
            Snapshot loaded = new Snapshot(Map.copyOf(values), clock.instant());
            snapshot = loaded;
            log.debug("Loaded {} app settings", values.size());
            return loaded;
        } catch (RuntimeException e) {
            log.error("Failed to load app settings, serving last known values: {}", e.getMessage());
            return current != null ? current : new Snapshot(Map.of(), Instant.EPOCH);
        }
    }

    /**
     * Settings as loaded at {@code loadedAt}.
     */
    @Value
    public static class Snapshot {
        Map<String, String> values;
        Instant loadedAt;
    }
}
