package com.flagship.missed_call.admin;

import com.flagship.missed_call.BaseIntegrationTest;
import com.flagship.missed_call.customer.Customer;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class AdminActionControllerTest extends BaseIntegrationTest {

    private static MockHttpServletRequestBuilder action(String body) {
        return post("/api/admin/users")
                .cookie(new Cookie("admin_auth", ADMIN_PASSWORD_HASH))
                .contentType(MediaType.APPLICATION_JSON)
                .content(body);
    }

    private static String walletBody(UUID customerId, String action, String amount, String referenceId) {
        return """
                {"customer_id":"%s","action":"%s","data":{"amount":"%s","reference_id":"%s","description":"Support adjustment"}}
                """.formatted(customerId, action, amount, referenceId);
    }

    private static String statusBody(UUID customerId, String action) {
        return "{\"customer_id\":\"" + customerId + "\",\"action\":\"" + action + "\"}";
    }

    @Test
    @DisplayName("No admin cookie is 401")
    void testUnauthenticated() throws Exception {
        Customer customer = createCustomer("5.00");

        mockMvc.perform(post("/api/admin/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(walletBody(customer.getId(), "add-wallet-funds", "10.00", "manual-1")))
                .andExpect(status().isUnauthorized());

        assertEquals(new BigDecimal("5.00"), ledgerService.getBalance(customer.getId()));
    }

    @Test
    @DisplayName("Wrong cookie value is 401")
    void testWrongCookie() throws Exception {
        Customer customer = createCustomer("5.00");

        mockMvc.perform(post("/api/admin/users")
                        .cookie(new Cookie("admin_auth", "deadbeef"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(statusBody(customer.getId(), "pause")))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("add-wallet-funds credits once per reference id")
    void testAddFunds() throws Exception {
        printTestHeader("Admin credit");

        // Given
        Customer customer = createCustomer("5.00");
        String body = walletBody(customer.getId(), "add-wallet-funds", "20.00", "stripe-evt-1");
        printInput("Body", body);

        // When / Then
        mockMvc.perform(action(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.customer_id").value(customer.getId().toString()))
                .andExpect(jsonPath("$.action").value("add-wallet-funds"))
                .andExpect(jsonPath("$.balance").value(25.00))
                .andExpect(jsonPath("$.replayed").value(false))
                .andExpect(jsonPath("$.transaction_id").exists())
                .andExpect(jsonPath("$.active").doesNotExist());

        mockMvc.perform(action(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balance").value(25.00))
                .andExpect(jsonPath("$.replayed").value(true));

        assertEquals(new BigDecimal("25.00"), ledgerService.getBalance(customer.getId()));
        printSuccess("Credited once");
    }

    @Test
    @DisplayName("deduct-wallet-funds debits the wallet")
    void testDeductFunds() throws Exception {
        Customer customer = createCustomer("5.00");

        mockMvc.perform(action(walletBody(customer.getId(), "deduct-wallet-funds", "1.25", "chargeback-1")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balance").value(3.75));

        assertEquals(new BigDecimal("3.75"), ledgerService.getBalance(customer.getId()));
    }

    @Test
    @DisplayName("Deducting more than the balance is 409")
    void testDeductInsufficientFunds() throws Exception {
        Customer customer = createCustomer("1.00");

        mockMvc.perform(action(walletBody(customer.getId(), "deduct-wallet-funds", "2.00", "too-much")))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("INSUFFICIENT_FUNDS"));

        assertEquals(new BigDecimal("1.00"), ledgerService.getBalance(customer.getId()));
    }

    @Test
    @DisplayName("Invalid amount is 400")
    void testInvalidAmount() throws Exception {
        Customer customer = createCustomer("1.00");

        mockMvc.perform(action(walletBody(customer.getId(), "add-wallet-funds", "-5", "neg")))
                .andExpect(status().isBadRequest());
        mockMvc.perform(action(walletBody(customer.getId(), "add-wallet-funds", "lots", "nan")))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("pause and resume toggle the account")
    void testPauseResume() throws Exception {
        Customer customer = createCustomer("1.00");

        mockMvc.perform(action(statusBody(customer.getId(), "pause")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(false))
                .andExpect(jsonPath("$.balance").doesNotExist());
        assertTrue(customerService.findServiceableByPhoneNumber(customer.getPhoneNumber()).isEmpty());

        mockMvc.perform(action(statusBody(customer.getId(), "resume")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(true));
        assertTrue(customerService.findServiceableByPhoneNumber(customer.getPhoneNumber()).isPresent());
    }

    @Test
    @DisplayName("Unknown action is 400")
    void testUnknownAction() throws Exception {
        Customer customer = createCustomer("1.00");

        mockMvc.perform(action(statusBody(customer.getId(), "delete-everything")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unknown action: delete-everything"));
    }

    @Test
    @DisplayName("Unknown customer is 404")
    void testUnknownCustomer() throws Exception {
        mockMvc.perform(action(statusBody(UUID.randomUUID(), "pause")))
                .andExpect(status().isNotFound());
    }
}
