package com.flagship.points_ledger.jobs;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Process-wide map from job type to handler.
 * Built once from the handler beans and never changed afterwards.
 */
@Component
@Slf4j
public class JobHandlerRegistry {

    private final Map<String, JobHandler> handlers;

    public JobHandlerRegistry(List<JobHandler> handlerBeans) {
        Map<String, JobHandler> byType = new HashMap<>();
        for (JobHandler handler : handlerBeans) {
            JobHandler previous = byType.putIfAbsent(handler.type(), handler);
            if (previous != null) {
                throw new IllegalStateException(String.format(
                        "Duplicate job handler for type %s: %s and %s",
                        handler.type(), previous.getClass().getName(), handler.getClass().getName()));
            }
        }
        this.handlers = Map.copyOf(byType);
        log.info("Registered job handlers: {}", this.handlers.keySet());
    }

    public Optional<JobHandler> find(String type) {
        return Optional.ofNullable(handlers.get(type));
    }

    public Set<String> registeredTypes() {
        return handlers.keySet();
    }
}
