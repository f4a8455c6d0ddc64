package com.flagship.account_service.account;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.account_service.account.dto.AccountResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.net.URI;
import java.util.List;

/**
 * REST Controller for account operations.
 *
 * Create and update only accept application/json bodies (415 otherwise).
 * Bodies are taken as raw JSON so that a body which is not an object is
 * reported as a validation failure rather than a parse failure.
 */
@RestController
@RequestMapping(AccountController.BASE_PATH)
@RequiredArgsConstructor
@Slf4j
public class AccountController {

    public static final String BASE_PATH = "/accounts";

    private final AccountService accountService;

    /**
     * Creates a new account.
     *
     * @param payload Account fields; any id is ignored
     * @return 201 with the stored account and a Location header pointing at it
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<AccountResponse> createAccount(@RequestBody JsonNode payload) {
        log.info("Request to create an account");
        Account created = accountService.create(payload);

        URI location = ServletUriComponentsBuilder.fromCurrentRequestUri()
            .path("/{id}")
            .buildAndExpand(created.getId())
            .toUri();

        return ResponseEntity.created(location).body(AccountResponse.from(created));
    }

    /**
     * Lists accounts, optionally only those with the given name.
     * An empty collection is a 200 with an empty array.
     */
    @GetMapping
    public ResponseEntity<List<AccountResponse>> listAccounts(
            @RequestParam(value = "name", required = false) String name) {
        log.info("Request to list accounts");
        List<AccountResponse> accounts = accountService.list(name).stream()
            .map(AccountResponse::from)
            .toList();
        return ResponseEntity.ok(accounts);
    }

    @GetMapping("/{id}")
    public ResponseEntity<AccountResponse> getAccount(@PathVariable("id") long id) {
        log.info("Request to read account {}", id);
        return ResponseEntity.ok(AccountResponse.from(accountService.read(id)));
    }

    @PutMapping(value = "/{id}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<AccountResponse> updateAccount(@PathVariable("id") long id,
                                                         @RequestBody JsonNode payload) {
        log.info("Request to update account {}", id);
        return ResponseEntity.ok(AccountResponse.from(accountService.update(id, payload)));
    }

    /**
     * Deletes an account. Idempotent: an unknown id also answers 204.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteAccount(@PathVariable("id") long id) {
        log.info("Request to delete account {}", id);
        accountService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
