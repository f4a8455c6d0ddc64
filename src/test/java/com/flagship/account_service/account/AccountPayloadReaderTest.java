package com.flagship.account_service.account;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.account_service.account.dto.AccountRequest;
import com.flagship.account_service.account.dto.AccountResponse;
import com.flagship.account_service.account.exception.DataValidationException;
import com.flagship.account_service.config.JacksonConfig;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class AccountPayloadReaderTest {

    private static ValidatorFactory validatorFactory;
    private static ObjectMapper objectMapper;
    private static AccountPayloadReader reader;

    @BeforeAll
    static void setUp() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        objectMapper = new JacksonConfig().objectMapper();
        reader = new AccountPayloadReader(objectMapper, validatorFactory.getValidator());
    }

    @AfterAll
    static void tearDown() {
        validatorFactory.close();
    }

    private JsonNode json(String content) throws Exception {
        return objectMapper.readTree(content);
    }

    @Test
    @DisplayName("A complete payload is read field by field")
    void testReadCompletePayload() throws Exception {
        AccountRequest request = reader.read(json(
            "{\"name\":\"A\",\"email\":\"a@x.com\",\"address\":\"addr\",\"phone_number\":\"1\",\"date_joined\":\"2024-01-01\"}"));

        assertEquals("A", request.getName());
        assertEquals("a@x.com", request.getEmail());
        assertEquals("addr", request.getAddress());
        assertEquals("1", request.getPhoneNumber());
        assertEquals(LocalDate.of(2024, 1, 1), request.getDateJoined());
    }

    @Test
    @DisplayName("Only name and email are required")
    void testReadMinimalPayload() throws Exception {
        AccountRequest request = reader.read(json("{\"name\":\"A\",\"email\":\"a@x.com\"}"));

        assertNull(request.getAddress());
        assertNull(request.getPhoneNumber());
        assertNull(request.getDateJoined());
    }

    @Test
    @DisplayName("Unknown keys, including id, are ignored")
    void testReadIgnoresUnknownKeys() throws Exception {
        AccountRequest request = reader.read(json("{\"id\":9,\"name\":\"A\",\"email\":\"a@x.com\",\"nickname\":\"x\"}"));

        assertEquals("A", request.getName());
    }

    @Test
    @DisplayName("Missing required fields are all reported by wire name")
    void testReadMissingFields() throws Exception {
        DataValidationException e = assertThrows(DataValidationException.class,
            () -> reader.read(json("{\"address\":\"addr\"}")));

        assertEquals("Name is required", e.getDetails().get("name"));
        assertEquals("Email is required", e.getDetails().get("email"));
        assertEquals(2, e.getDetails().size());
    }

    @Test
    @DisplayName("Blank name is rejected")
    void testReadBlankName() throws Exception {
        DataValidationException e = assertThrows(DataValidationException.class,
            () -> reader.read(json("{\"name\":\"  \",\"email\":\"a@x.com\"}")));

        assertTrue(e.getDetails().containsKey("name"));
    }

    @Test
    @DisplayName("Oversized phone number is reported as phone_number")
    void testReadOversizedPhoneNumber() throws Exception {
        String phone = "1".repeat(40);

        DataValidationException e = assertThrows(DataValidationException.class,
            () -> reader.read(json("{\"name\":\"A\",\"email\":\"a@x.com\",\"phone_number\":\"" + phone + "\"}")));

        assertTrue(e.getDetails().containsKey("phone_number"));
    }

    @Test
    @DisplayName("A payload that is not an object is rejected")
    void testReadNonObject() throws Exception {
        assertThrows(DataValidationException.class, () -> reader.read(json("[1, 2]")));
        assertThrows(DataValidationException.class, () -> reader.read(json("\"text\"")));
        assertThrows(DataValidationException.class, () -> reader.read(null));
    }

    @Test
    @DisplayName("A malformed date is reported against date_joined")
    void testReadMalformedDate() throws Exception {
        DataValidationException e = assertThrows(DataValidationException.class,
            () -> reader.read(json("{\"name\":\"A\",\"email\":\"a@x.com\",\"date_joined\":\"yesterday\"}")));

        assertTrue(e.getDetails().containsKey("date_joined"));
    }

    @Test
    @DisplayName("A serialized account reads back to the same fields")
    void testSerializedAccountReadsBack() throws Exception {
        Account account = new Account(5L, "A", "a@x.com", "addr", "1", LocalDate.of(2024, 1, 1));
        JsonNode serialized = objectMapper.valueToTree(AccountResponse.from(account));

        Account readBack = Account.create(reader.read(serialized)).withId(account.getId());

        assertEquals(account, readBack);
    }

    @Test
    @DisplayName("Property names are converted to wire names")
    void testToWireName() {
        assertEquals("phone_number", AccountPayloadReader.toWireName("phoneNumber"));
        assertEquals("date_joined", AccountPayloadReader.toWireName("dateJoined"));
        assertEquals("name", AccountPayloadReader.toWireName("name"));
    }
}
