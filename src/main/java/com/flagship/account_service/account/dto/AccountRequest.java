package com.flagship.account_service.account.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/**
 * Request DTO for creating or updating an account.
 *
 * The id is deliberately absent: a client-supplied id is ignored.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class AccountRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 64, message = "Name must be at most 64 characters")
    @JsonProperty("name")
    String name;

    @NotBlank(message = "Email is required")
    @Size(max = 64, message = "Email must be at most 64 characters")
    @JsonProperty("email")
    String email;

    @Size(max = 256, message = "Address must be at most 256 characters")
    @JsonProperty("address")
    String address;

    @Size(max = 32, message = "Phone number must be at most 32 characters")
    @JsonProperty("phone_number")
    String phoneNumber;

    @JsonProperty("date_joined")
    LocalDate dateJoined;
}
