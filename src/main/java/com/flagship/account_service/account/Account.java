package com.flagship.account_service.account;

import com.flagship.account_service.account.dto.AccountRequest;
import lombok.Value;

import java.time.LocalDate;

/**
 * Account domain object.
 *
 * Immutable: an update produces a new Account that replaces the stored record.
 * The id is assigned by the gateway on creation and never taken from a request payload.
 */
@Value
public class Account {
    Long id;
    String name;
    String email;
    String address;
    String phoneNumber;
    LocalDate dateJoined;

    /**
     * Creates a not-yet-persisted Account from a validated request.
     * date_joined defaults to today when absent.
     */
    public static Account create(AccountRequest request) {
        LocalDate dateJoined = request.getDateJoined() != null
            ? request.getDateJoined()
            : LocalDate.now();
        return new Account(
            null,
            request.getName(),
            request.getEmail(),
            request.getAddress(),
            request.getPhoneNumber(),
            dateJoined
        );
    }

    /**
     * Applies an update request on top of this account.
     *
     * name and email are always replaced; optional fields absent from the request keep their current value.
     *
     * @return New Account instance carrying the same id
     */
    public Account applyUpdate(AccountRequest request) {
        return new Account(
            this.id,
            request.getName(),
            request.getEmail(),
            request.getAddress() != null ? request.getAddress() : this.address,
            request.getPhoneNumber() != null ? request.getPhoneNumber() : this.phoneNumber,
            request.getDateJoined() != null ? request.getDateJoined() : this.dateJoined
        );
    }

    public Account withId(Long newId) {
        return new Account(newId, name, email, address, phoneNumber, dateJoined);
    }

    public boolean isPersisted() {
        return id != null;
    }
}
