package com.flagship.account_service.account;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * JPA Entity for Account persistence.
 *
 * - No @Setter: rows change only through updateFromDomain()
 * - The id is generated by the database and is not updatable
 * - fromDomain() is the only way to create entities
 */
@Entity
@Table(
    name = "accounts",
    indexes = {
        @Index(name = "idx_accounts_name", columnList = "name")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AccountEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(nullable = false, updatable = false)
    private Long id;

    @Column(nullable = false, length = 64)
    private String name;

    @Column(nullable = false, length = 64)
    private String email;

    @Column(length = 256)
    private String address;

    @Column(name = "phone_number", length = 32)
    private String phoneNumber;

    @Column(name = "date_joined", nullable = false)
    private LocalDate dateJoined;

    /**
     * Creates a new, not yet persisted entity. Any id on the domain object is ignored.
     */
    static AccountEntity fromDomain(Account account) {
        return new AccountEntity(
            null, // id - assigned by the database on insert
            account.getName(),
            account.getEmail(),
            account.getAddress(),
            account.getPhoneNumber(),
            account.getDateJoined()
        );
    }

    public Account toDomain() {
        return new Account(id, name, email, address, phoneNumber, dateJoined);
    }

    /**
     * Copies every mutable field from the domain object. The id is never changed.
     */
    void updateFromDomain(Account account) {
        this.name = account.getName();
        this.email = account.getEmail();
        this.address = account.getAddress();
        this.phoneNumber = account.getPhoneNumber();
        this.dateJoined = account.getDateJoined();
    }
}
