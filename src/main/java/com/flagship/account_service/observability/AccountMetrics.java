package com.flagship.account_service.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for account operations.
 *
 * Metrics exposed:
 * - account.created: Counter of created accounts
 * - account.updated: Counter of updated accounts
 * - account.deleted: Counter of deleted accounts (idempotent deletes of absent ids are not counted)
 * - account.not_found: Counter of lookups that found no account, tagged by operation
 * - account.api.duration: Timer for account operations, tagged by operation and outcome
 */
@Component
public class AccountMetrics {

    private final MeterRegistry registry;

    private final Counter accountsCreated;
    private final Counter accountsUpdated;
    private final Counter accountsDeleted;

    public AccountMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.accountsCreated = Counter.builder("account.created")
                .description("Number of accounts created")
                .register(registry);

        this.accountsUpdated = Counter.builder("account.updated")
                .description("Number of accounts updated")
                .register(registry);

        this.accountsDeleted = Counter.builder("account.deleted")
                .description("Number of accounts deleted")
                .register(registry);
    }

    public void incrementAccountsCreated() {
        accountsCreated.increment();
    }

    public void incrementAccountsUpdated() {
        accountsUpdated.increment();
    }

    public void incrementAccountsDeleted() {
        accountsDeleted.increment();
    }

    public void recordNotFound(String operation) {
        registry.counter("account.not_found",
                "operation", sanitizeTag(operation)
        ).increment();
    }

    /**
     * Records account operation latency.
     * Uses registry.timer() for efficient meter lookup/creation.
     */
    public void recordLatency(String operation, String outcome, long durationMs) {
        registry.timer("account.api.duration",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).record(Duration.ofMillis(durationMs));
    }

    private String sanitizeTag(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        return value.toLowerCase().replaceAll("[^a-z0-9_]", "_");
    }
}
