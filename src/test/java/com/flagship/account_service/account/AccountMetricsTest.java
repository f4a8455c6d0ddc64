package com.flagship.account_service.account;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Metrics recorded by account operations.
 *
 * The registry outlives a single test (cached context), so every assertion
 * compares against the value read before the operation.
 */
@WebMvcTest(controllers = AccountController.class)
@Import(AccountWebTestConfig.class)
class AccountMetricsTest {

    private static final String VALID_ACCOUNT =
        "{\"name\":\"A\",\"email\":\"a@x.com\",\"address\":\"addr\",\"phone_number\":\"1\",\"date_joined\":\"2024-01-01\"}";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private MeterRegistry meterRegistry;

    @Autowired
    private InMemoryAccountGateway accountGateway;

    @BeforeEach
    void setUp() {
        accountGateway.clear();
    }

    private double counter(String name) {
        Counter counter = meterRegistry.find(name).counter();
        return counter == null ? 0 : counter.count();
    }

    private double notFound(String operation) {
        Counter counter = meterRegistry.find("account.not_found").tag("operation", operation).counter();
        return counter == null ? 0 : counter.count();
    }

    private long timerCount(String operation, String outcome) {
        Timer timer = meterRegistry.find("account.api.duration")
            .tag("operation", operation)
            .tag("outcome", outcome)
            .timer();
        return timer == null ? 0 : timer.count();
    }

    private long createAccount() throws Exception {
        String json = mockMvc.perform(post("/accounts")
                .contentType(MediaType.APPLICATION_JSON)
                .content(VALID_ACCOUNT))
            .andExpect(status().isCreated())
            .andReturn()
            .getResponse()
            .getContentAsString();
        return objectMapper.readTree(json).get("id").asLong();
    }

    @Test
    @DisplayName("Create counts the account and times the operation")
    void testCreateMetrics() throws Exception {
        double created = counter("account.created");
        long timed = timerCount("create", "success");

        createAccount();

        assertEquals(created + 1, counter("account.created"));
        assertEquals(timed + 1, timerCount("create", "success"));
    }

    @Test
    @DisplayName("A rejected create is timed as an error and not counted")
    void testRejectedCreateMetrics() throws Exception {
        double created = counter("account.created");
        long failed = timerCount("create", "error");

        mockMvc.perform(post("/accounts")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"only\"}"))
            .andExpect(status().isBadRequest());

        assertEquals(created, counter("account.created"));
        assertEquals(failed + 1, timerCount("create", "error"));
    }

    @Test
    @DisplayName("Read is timed; an unknown id is counted as not found")
    void testReadMetrics() throws Exception {
        long id = createAccount();
        long succeeded = timerCount("read", "success");
        long failed = timerCount("read", "error");
        double missing = notFound("read");

        mockMvc.perform(get("/accounts/{id}", id)).andExpect(status().isOk());
        mockMvc.perform(get("/accounts/{id}", 0)).andExpect(status().isNotFound());

        assertEquals(succeeded + 1, timerCount("read", "success"));
        assertEquals(failed + 1, timerCount("read", "error"));
        assertEquals(missing + 1, notFound("read"));
    }

    @Test
    @DisplayName("Update counts the account; an unknown id is counted as not found")
    void testUpdateMetrics() throws Exception {
        long id = createAccount();
        double updated = counter("account.updated");
        long timed = timerCount("update", "success");
        double missing = notFound("update");

        mockMvc.perform(put("/accounts/{id}", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"B\",\"email\":\"b@x.com\"}"))
            .andExpect(status().isOk());
        mockMvc.perform(put("/accounts/{id}", 0)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isNotFound());

        assertEquals(updated + 1, counter("account.updated"));
        assertEquals(timed + 1, timerCount("update", "success"));
        assertEquals(missing + 1, notFound("update"));
    }

    @Test
    @DisplayName("Delete counts removed accounts only; deleting an absent id is timed but not counted")
    void testDeleteMetrics() throws Exception {
        long id = createAccount();
        double deleted = counter("account.deleted");
        long timed = timerCount("delete", "success");

        mockMvc.perform(delete("/accounts/{id}", id)).andExpect(status().isNoContent());
        mockMvc.perform(delete("/accounts/{id}", 0)).andExpect(status().isNoContent());

        assertEquals(deleted + 1, counter("account.deleted"));
        assertEquals(timed + 2, timerCount("delete", "success"));
    }

    @Test
    @DisplayName("List is timed")
    void testListMetrics() throws Exception {
        long timed = timerCount("list", "success");

        mockMvc.perform(get("/accounts")).andExpect(status().isOk());
        mockMvc.perform(get("/accounts").param("name", "A")).andExpect(status().isOk());

        assertEquals(timed + 2, timerCount("list", "success"));
    }
}
