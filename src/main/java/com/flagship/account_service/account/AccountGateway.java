package com.flagship.account_service.account;

import java.util.List;
import java.util.Optional;

/**
 * Storage port for accounts. Owns the authoritative collection; callers only
 * ever hold request-scoped copies.
 *
 * Failures of the underlying store are not retried and propagate to the caller.
 */
public interface AccountGateway {

    /**
     * Persists a new account.
     *
     * @param account Account to store; any id it carries is ignored
     * @return The stored account with its freshly assigned id
     */
    Account create(Account account);

    /**
     * Replaces the stored record that has the same id.
     *
     * @throws com.flagship.account_service.account.exception.DataValidationException if the account has no id
     * @throws com.flagship.account_service.account.exception.AccountNotFoundException if no record has that id
     */
    Account update(Account account);

    /**
     * Removes the record with the given id. Absent ids are a no-op.
     *
     * @return true if a record was removed
     */
    boolean delete(long id);

    /**
     * All accounts in storage (insertion) order.
     */
    List<Account> all();

    Optional<Account> find(long id);

    List<Account> findByName(String name);
}
