package com.flagship.missed_call.wallet;

import com.flagship.missed_call.BaseIntegrationTest;
import com.flagship.missed_call.customer.Customer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Wallet ledger guarantees:
 * - balance never negative
 * - one transaction row per balance change, sum of rows equals balance
 * - reference ids make postings idempotent per kind
 * - concurrent debits never oversell
 */
class WalletLedgerServiceTest extends BaseIntegrationTest {

    @Test
    @DisplayName("Debit reduces balance and writes one signed transaction")
    void testDebit() {
        printTestHeader("Debit reduces balance and writes one signed transaction");

        // Given
        Customer customer = createCustomer("10.00");
        printInput("Opening balance", "10.00");

        // When
        LedgerPosting posting = ledgerService.debit(customer.getId(), new BigDecimal("0.99"), "Missed call", "CA-debit-1");
        printOutput("Posting", posting);

        // Then
        assertFalse(posting.isReplayed());
        assertEquals(new BigDecimal("9.01"), posting.getBalanceAfter());
        assertEquals(new BigDecimal("0.99"), posting.getAmount());
        assertEquals(new BigDecimal("9.01"), ledgerService.getBalance(customer.getId()));

        WalletTransaction row = ledgerService.findPosting("CA-debit-1", TransactionKind.DEBIT).orElseThrow();
        assertEquals(new BigDecimal("-0.99"), row.getAmount());
        assertEquals(new BigDecimal("9.01"), row.getBalanceAfter());
        assertEquals(ledgerService.getBalance(customer.getId()), ledgerService.sumOfDeltas(customer.getId()));
        printSuccess("Balance and log agree");
    }

    @Test
    @DisplayName("Same reference debited twice charges once and returns the original posting")
    void testIdempotentDebit() {
        printTestHeader("Idempotent debit");

        // Given
        Customer customer = createCustomer("10.00");

        // When
        LedgerPosting first = ledgerService.debit(customer.getId(), new BigDecimal("1.00"), "first", "abc");
        LedgerPosting second = ledgerService.debit(customer.getId(), new BigDecimal("1.00"), "second", "abc");
        printOutput("First", first);
        printOutput("Second", second);

        // Then
        assertFalse(first.isReplayed());
        assertTrue(second.isReplayed());
        assertEquals(first.getTransactionId(), second.getTransactionId());
        assertEquals(new BigDecimal("9.00"), second.getBalanceAfter());
        assertEquals(new BigDecimal("9.00"), ledgerService.getBalance(customer.getId()));
        assertEquals(1, countRows("wallet_transactions", "reference_id = ? AND kind = 'DEBIT'", "abc"));
        printSuccess("Charged once");
    }

    @Test
    @DisplayName("A debit and a credit may share a reference id")
    void testReferenceScopedByKind() {
        Customer customer = createCustomer("5.00");

        ledgerService.debit(customer.getId(), new BigDecimal("2.00"), "charge", "evt-1");
        LedgerPosting credit = ledgerService.credit(customer.getId(), new BigDecimal("2.00"), "reversal", "evt-1");

        assertFalse(credit.isReplayed());
        assertEquals(new BigDecimal("5.00"), ledgerService.getBalance(customer.getId()));
    }

    @Test
    @DisplayName("Insufficient funds leaves balance and log untouched")
    void testInsufficientFunds() {
        printTestHeader("Insufficient funds");

        // Given
        Customer customer = createCustomer("0.50");
        int rowsBefore = countRows("wallet_transactions", "customer_id = ?", customer.getId());

        // When
        InsufficientFundsException e = assertThrows(InsufficientFundsException.class,
                () -> ledgerService.debit(customer.getId(), new BigDecimal("0.99"), "too much", "CA-poor"));
        printOutput("Exception", e.getMessage());

        // Then
        assertEquals(new BigDecimal("0.50"), e.getBalance());
        assertEquals(new BigDecimal("0.99"), e.getRequested());
        assertEquals(new BigDecimal("0.50"), ledgerService.getBalance(customer.getId()));
        assertEquals(rowsBefore, countRows("wallet_transactions", "customer_id = ?", customer.getId()));
        assertTrue(ledgerService.findPosting("CA-poor", TransactionKind.DEBIT).isEmpty());
        printSuccess("Nothing written");
    }

    @Test
    @DisplayName("Debiting the exact balance leaves zero")
    void testDebitToZero() {
        Customer customer = createCustomer("0.99");

        LedgerPosting posting = ledgerService.debit(customer.getId(), new BigDecimal("0.99"), "last one", null);

        assertEquals(new BigDecimal("0.00"), posting.getBalanceAfter());
    }

    @Test
    @DisplayName("Zero, negative and sub-cent amounts are rejected")
    void testInvalidAmounts() {
        Customer customer = createCustomer("10.00");
        UUID id = customer.getId();

        assertThrows(IllegalArgumentException.class, () -> ledgerService.debit(id, BigDecimal.ZERO, "zero", null));
        assertThrows(IllegalArgumentException.class, () -> ledgerService.debit(id, new BigDecimal("-1.00"), "neg", null));
        assertThrows(IllegalArgumentException.class, () -> ledgerService.credit(id, new BigDecimal("0.001"), "dust", null));
        assertThrows(IllegalArgumentException.class, () -> ledgerService.credit(id, null, "null", null));
        assertEquals(new BigDecimal("10.00"), ledgerService.getBalance(id));
    }

    @Test
    @DisplayName("Unknown customer has no wallet")
    void testWalletNotFound() {
        UUID unknown = UUID.randomUUID();

        assertThrows(WalletNotFoundException.class, () -> ledgerService.getBalance(unknown));
        assertThrows(WalletNotFoundException.class,
                () -> ledgerService.credit(unknown, new BigDecimal("1.00"), "nobody", null));
    }

    @Test
    @DisplayName("Transactions come back newest first and the limit is honored")
    void testTransactionOrdering() {
        Customer customer = createCustomer("10.00");
        ledgerService.debit(customer.getId(), new BigDecimal("1.00"), "first", "t-1");
        ledgerService.debit(customer.getId(), new BigDecimal("2.00"), "second", "t-2");
        ledgerService.credit(customer.getId(), new BigDecimal("0.50"), "third", "t-3");

        List<WalletTransaction> all = ledgerService.getTransactions(customer.getId(), 50);
        List<WalletTransaction> two = ledgerService.getTransactions(customer.getId(), 2);

        assertEquals(4, all.size());
        assertEquals("t-3", all.get(0).getReferenceId());
        assertEquals("t-2", all.get(1).getReferenceId());
        assertEquals("t-1", all.get(2).getReferenceId());
        assertEquals(2, two.size());
        assertEquals(new BigDecimal("7.50"), all.get(0).getBalanceAfter());
    }

    @Test
    @DisplayName("10 concurrent 1.00 debits on 5.00: exactly 5 succeed, balance ends at zero")
    void testConcurrentDebitsNeverOversell() throws InterruptedException {
        printTestHeader("Concurrent debits never oversell");

        // Given
        Customer customer = createCustomer("5.00");
        int threads = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        AtomicInteger other = new AtomicInteger();
        printInput("Opening balance", "5.00");
        printInput("Concurrent debits", threads + " x 1.00");

        // When
        for (int i = 0; i < threads; i++) {
            String reference = "concurrent-" + i;
            executor.submit(() -> {
                try {
                    start.await();
                    ledgerService.debit(customer.getId(), new BigDecimal("1.00"), "race", reference);
                    succeeded.incrementAndGet();
                } catch (InsufficientFundsException e) {
                    rejected.incrementAndGet();
                } catch (Exception e) {
                    other.incrementAndGet();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(60, TimeUnit.SECONDS));
        executor.shutdown();

        // Then
        printOutput("Succeeded", succeeded.get());
        printOutput("Rejected", rejected.get());
        assertEquals(0, other.get());
        assertEquals(5, succeeded.get());
        assertEquals(5, rejected.get());
        assertEquals(new BigDecimal("0.00"), ledgerService.getBalance(customer.getId()));
        assertEquals(new BigDecimal("0.00"), ledgerService.sumOfDeltas(customer.getId()));
        printSuccess("No oversell, log matches balance");
    }

    @Test
    @DisplayName("Concurrent debits with the same reference charge once")
    void testConcurrentSameReference() throws InterruptedException {
        Customer customer = createCustomer("10.00");
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger applied = new AtomicInteger();
        AtomicInteger replayed = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    LedgerPosting posting = ledgerService.debit(
                            customer.getId(), new BigDecimal("0.99"), "dup", "CA-same");
                    (posting.isReplayed() ? replayed : applied).incrementAndGet();
                } catch (Exception e) {
                    failed.incrementAndGet();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(60, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(0, failed.get());
        assertEquals(1, applied.get());
        assertEquals(threads - 1, replayed.get());
        assertEquals(new BigDecimal("9.01"), ledgerService.getBalance(customer.getId()));
    }
}
