package com.flagship.account_service.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.account_service.account.Account;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Response DTO: the serialized form of an account.
 */
@Value
@Builder
public class AccountResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("name")
    String name;

    @JsonProperty("email")
    String email;

    @JsonProperty("address")
    String address;

    @JsonProperty("phone_number")
    String phoneNumber;

    @JsonProperty("date_joined")
    LocalDate dateJoined;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
            .id(account.getId())
            .name(account.getName())
            .email(account.getEmail())
            .address(account.getAddress())
            .phoneNumber(account.getPhoneNumber())
            .dateJoined(account.getDateJoined())
            .build();
    }
}
