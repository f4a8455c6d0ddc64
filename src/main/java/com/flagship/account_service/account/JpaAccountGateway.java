package com.flagship.account_service.account;

import com.flagship.account_service.account.exception.AccountNotFoundException;
import com.flagship.account_service.account.exception.DataValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Gateway backed by the accounts table.
 *
 * Bridges the domain layer (Account) and persistence layer (AccountEntity).
 * Each call runs in its own transaction: commit on success, rollback on exception.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaAccountGateway implements AccountGateway {

    private final AccountRepository accountRepository;

    @Override
    @Transactional
    public Account create(Account account) {
        AccountEntity saved = accountRepository.save(AccountEntity.fromDomain(account));
        log.debug("Created account {}", saved.getId());
        return saved.toDomain();
    }

    @Override
    @Transactional
    public Account update(Account account) {
        if (!account.isPersisted()) {
            throw new DataValidationException("Update called with empty ID field");
        }

        AccountEntity existing = accountRepository.findById(account.getId())
            .orElseThrow(() -> new AccountNotFoundException(account.getId()));

        existing.updateFromDomain(account);

        AccountEntity updated = accountRepository.save(existing);
        log.debug("Updated account {}", updated.getId());
        return updated.toDomain();
    }

    @Override
    @Transactional
    public boolean delete(long id) {
        if (!accountRepository.existsById(id)) {
            log.debug("Delete of absent account {} ignored", id);
            return false;
        }
        accountRepository.deleteById(id);
        log.debug("Deleted account {}", id);
        return true;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Account> all() {
        return accountRepository.findAllByOrderByIdAsc().stream()
            .map(AccountEntity::toDomain)
            .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Account> find(long id) {
        return accountRepository.findById(id)
            .map(AccountEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Account> findByName(String name) {
        return accountRepository.findByNameOrderByIdAsc(name).stream()
            .map(AccountEntity::toDomain)
            .toList();
    }
}
