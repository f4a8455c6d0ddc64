package com.flagship.account_service.account;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.account_service.account.dto.AccountRequest;
import com.flagship.account_service.account.exception.AccountNotFoundException;
import com.flagship.account_service.observability.AccountMetrics;
import com.flagship.account_service.observability.LogContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.function.Supplier;

/**
 * Account operations behind the REST API.
 *
 * Each operation reads and validates the payload first, then talks to the
 * {@link AccountGateway}. Validation failures never reach storage.
 * Every operation is timed under account.api.duration, and operations on a
 * single account carry its id in the MDC while they run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private final AccountGateway accountGateway;
    private final AccountPayloadReader payloadReader;
    private final AccountMetrics accountMetrics;

    public Account create(JsonNode payload) {
        return timed("create", null, () -> {
            AccountRequest request = payloadReader.read(payload);
            Account created = accountGateway.create(Account.create(request));

            LogContext.putAccountId(created.getId());
            accountMetrics.incrementAccountsCreated();
            log.info("Account created: id={}", created.getId());
            return created;
        });
    }

    public Account read(long id) {
        return timed("read", id, () -> {
            log.debug("Reading account {}", id);
            return accountGateway.find(id)
                .orElseThrow(() -> notFound("read", id));
        });
    }

    /**
     * Updates an existing account. The id is looked up before the payload is
     * validated, so an unknown id is reported as not found whatever the body.
     * Lookup and write share one transaction.
     */
    @Transactional
    public Account update(long id, JsonNode payload) {
        return timed("update", id, () -> {
            Account existing = accountGateway.find(id)
                .orElseThrow(() -> notFound("update", id));

            AccountRequest request = payloadReader.read(payload);
            Account updated = accountGateway.update(existing.applyUpdate(request));

            accountMetrics.incrementAccountsUpdated();
            log.info("Account updated: id={}", id);
            return updated;
        });
    }

    /**
     * Deletes an account. Deleting an id that does not exist succeeds without effect.
     */
    public void delete(long id) {
        timed("delete", id, () -> {
            boolean deleted = accountGateway.delete(id);
            if (deleted) {
                accountMetrics.incrementAccountsDeleted();
                log.info("Account deleted: id={}", id);
            } else {
                log.info("Account {} already absent, nothing to delete", id);
            }
            return deleted;
        });
    }

    public List<Account> list(String name) {
        return timed("list", null, () -> {
            List<Account> accounts = name == null
                ? accountGateway.all()
                : accountGateway.findByName(name);
            log.debug("Listing {} accounts (name filter: {})", accounts.size(), name);
            return accounts;
        });
    }

    private <T> T timed(String operation, Long accountId, Supplier<T> action) {
        long startTime = System.currentTimeMillis();
        if (accountId != null) {
            LogContext.putAccountId(accountId);
        }
        try {
            T result = action.get();
            accountMetrics.recordLatency(operation, "success", System.currentTimeMillis() - startTime);
            return result;
        } catch (RuntimeException e) {
            accountMetrics.recordLatency(operation, "error", System.currentTimeMillis() - startTime);
            throw e;
        } finally {
            LogContext.clearAccountId();
        }
    }

    private AccountNotFoundException notFound(String operation, long id) {
        accountMetrics.recordNotFound(operation);
        return new AccountNotFoundException(id);
    }
}
