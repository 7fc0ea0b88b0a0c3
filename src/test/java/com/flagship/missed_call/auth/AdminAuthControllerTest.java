package com.flagship.missed_call.auth;

import com.flagship.missed_call.BaseIntegrationTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import java.util.UUID;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class AdminAuthControllerTest extends BaseIntegrationTest {

    private static MockHttpServletRequestBuilder login(String body, String ip) {
        return post("/api/admin/auth")
                .header("X-Forwarded-For", ip)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body);
    }

    private static String password(String value) {
        return "{\"password\":\"" + value + "\"}";
    }

    private static String uniqueIp() {
        return "admin-" + UUID.randomUUID();
    }

    @Test
    @DisplayName("Correct password sets the admin cookie")
    void testLoginSuccess() throws Exception {
        printTestHeader("Admin login");

        mockMvc.perform(login(password(ADMIN_PASSWORD), uniqueIp()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(header().string("Set-Cookie", containsString("admin_auth=" + ADMIN_PASSWORD_HASH)))
                .andExpect(header().string("Set-Cookie", containsString("HttpOnly")))
                .andExpect(header().string("Set-Cookie", containsString("SameSite=Strict")));
        printSuccess("Cookie issued");
    }

    @Test
    @DisplayName("Wrong password is 401 without a cookie")
    void testWrongPassword() throws Exception {
        mockMvc.perform(login(password("wrong horse"), uniqueIp()))
                .andExpect(status().isUnauthorized())
                .andExpect(header().doesNotExist("Set-Cookie"));
    }

    @Test
    @DisplayName("Missing password is 400")
    void testMissingPassword() throws Exception {
        mockMvc.perform(login("{}", uniqueIp()))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Sixth attempt from one IP is 429 with Retry-After, even with the right password")
    void testLoginThrottled() throws Exception {
        printTestHeader("Admin login throttle");

        // Given
        String ip = uniqueIp();
        for (int i = 0; i < 5; i++) {
            mockMvc.perform(login(password("guess-" + i), ip))
                    .andExpect(status().isUnauthorized());
        }

        // When / Then
        mockMvc.perform(login(password(ADMIN_PASSWORD), ip))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "900"))
                .andExpect(jsonPath("$.error").value("Too many attempts. Try again later."));

        // Another IP is unaffected
        mockMvc.perform(login(password(ADMIN_PASSWORD), uniqueIp()))
                .andExpect(status().isOk());
        printSuccess("Throttled per IP");
    }

    @Test
    @DisplayName("Logout expires the cookie")
    void testLogout() throws Exception {
        mockMvc.perform(delete("/api/admin/auth"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(header().string("Set-Cookie", containsString("admin_auth=")))
                .andExpect(header().string("Set-Cookie", containsString("Max-Age=0")));
    }
}
