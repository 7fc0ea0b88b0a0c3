package com.flagship.missed_call;

import com.flagship.missed_call.callrecord.CallRecordService;
import com.flagship.missed_call.channel.MessageSender;
import com.flagship.missed_call.customer.BusinessHours;
import com.flagship.missed_call.customer.Customer;
import com.flagship.missed_call.customer.CustomerService;
import com.flagship.missed_call.wallet.WalletLedgerService;
import com.flagship.missed_call.webhook.TwilioSignatureValidator;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.util.AopTestUtils;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.fail;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;

/**
 * Shared setup for tests that need the full application on H2.
 *
 * All subclasses declare the same mock and spy beans so they share one
 * cached Spring context. The outbound SMS sender is always mocked; nothing
 * leaves the JVM.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
public abstract class BaseIntegrationTest {

    protected static final String AUTH_TOKEN = "test-auth-token";
    protected static final String PUBLIC_BASE_URL = "https://hooks.example.test";
    protected static final String ADMIN_PASSWORD = "correct horse";
    protected static final String ADMIN_PASSWORD_HASH =
            "4104d36f8da2c254349f85836793ebe029e0c957063a34c91c2e9203187b5631";

    @Autowired
    protected MockMvc mockMvc;

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @Autowired
    protected CustomerService customerService;

    @MockBean
    protected MessageSender messageSender;

    @SpyBean
    protected WalletLedgerService ledgerService;

    @SpyBean
    protected CallRecordService callRecordService;

    @BeforeEach
    void cleanDatabase() {
        jdbcTemplate.update("DELETE FROM low_balance_alerts");
        jdbcTemplate.update("DELETE FROM call_records");
        jdbcTemplate.update("DELETE FROM wallet_transactions");
        jdbcTemplate.update("DELETE FROM wallets");
        jdbcTemplate.update("DELETE FROM outbox_events");
        jdbcTemplate.update("DELETE FROM vip_contacts");
        jdbcTemplate.update("DELETE FROM customers");
    }

    // ==================== Fixtures ====================

    /**
     * Verified, active customer open around the clock with the given opening balance.
     */
    protected Customer createCustomer(String openingBalance) {
        return createCustomer(openingBalance, Customer.builder());
    }

    /**
     * Same as {@link #createCustomer(String)} with extra settings applied on top.
     */
    protected Customer createCustomer(String openingBalance, Customer.CustomerBuilder overrides) {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        Customer template = overrides.build();
        Customer customer = customerService.register(Customer.builder()
                .email(template.getEmail() != null ? template.getEmail() : "owner-" + suffix + "@example.com")
                .businessName(template.getBusinessName() != null ? template.getBusinessName() : "Acme Plumbing")
                .phoneNumber(template.getPhoneNumber() != null ? template.getPhoneNumber() : randomPhoneNumber())
                .verified(true)
                .active(true)
                .businessHours(template.getBusinessHours() != null
                        ? template.getBusinessHours()
                        : BusinessHours.parse("UTC", "00:00", "00:00", "1,2,3,4,5,6,7"))
                .greetingUrl(template.getGreetingUrl())
                .customMessage(template.getCustomMessage())
                .twoWayEnabled(template.isTwoWayEnabled())
                .transcriptionEnabled(template.isTranscriptionEnabled())
                .sequencesEnabled(template.isSequencesEnabled())
                .recognitionEnabled(template.isRecognitionEnabled())
                .vipPriorityEnabled(template.isVipPriorityEnabled())
                .build());

        BigDecimal amount = new BigDecimal(openingBalance);
        if (amount.signum() > 0) {
            ledgerService.credit(customer.getId(), amount, "Opening balance", "topup-" + customer.getId());
        }
        return customer;
    }

    protected static String randomPhoneNumber() {
        return "+1555" + ThreadLocalRandom.current().nextInt(1_000_000, 9_999_999);
    }

    /**
     * Unspied service, for stubbing with doThrow/doReturn through the transactional proxy.
     */
    protected CallRecordService callRecordServiceSpy() {
        return AopTestUtils.getUltimateTargetObject(callRecordService);
    }

    protected WalletLedgerService ledgerServiceSpy() {
        return AopTestUtils.getUltimateTargetObject(ledgerService);
    }

    // ==================== Webhooks ====================

    /**
     * Form POST signed the way the provider signs it.
     */
    protected MockHttpServletRequestBuilder signedPost(String path, Map<String, String> params) {
        String signature = TwilioSignatureValidator.computeSignature(AUTH_TOKEN, PUBLIC_BASE_URL + path, params);
        MockHttpServletRequestBuilder request = post(path)
                .header(TwilioSignatureValidator.SIGNATURE_HEADER, signature)
                .contentType("application/x-www-form-urlencoded");
        params.forEach(request::param);
        return request;
    }

    protected void await(String description, Duration timeout, BooleanSupplier condition) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return;
            }
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrupted while waiting for: " + description);
            }
        }
        fail("Timed out after " + timeout + " waiting for: " + description);
    }

    protected int countRows(String table, String where, Object... args) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM " + table + " WHERE " + where, Integer.class, args);
        return count != null ? count : 0;
    }

    // ==================== Test output ====================

    protected void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    protected void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    protected void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    protected void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }
}
