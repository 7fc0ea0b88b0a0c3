package com.flagship.missed_call.wallet;

import com.flagship.missed_call.observability.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * The single authority over customer wallet balances.
 *
 * Invariants enforced here:
 * 1. A balance never goes negative (also backed by a CHECK constraint)
 * 2. Every balance change writes exactly one immutable wallet_transactions row
 *    in the same database transaction
 * 3. For a non-null reference id, at most one posting of each kind exists;
 *    re-submission returns the original posting (unique index backstop)
 * 4. Concurrent postings on one wallet are serialized by an optimistic
 *    version check; the loser re-reads and retries
 *
 * JDBC is used directly so the read / conditional write / log insert
 * sequence is explicit. Callers must not wrap these methods in their own
 * transaction: each attempt commits on its own.
 */
@Service
@Slf4j
public class WalletLedgerService {

    public static final String DEFAULT_CURRENCY = "USD";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final PipelineMetrics metrics;
    private final int maxAttempts;

    public WalletLedgerService(JdbcTemplate jdbcTemplate,
                               PlatformTransactionManager transactionManager,
                               PipelineMetrics metrics,
                               @Value("${wallet.ledger.max-attempts:25}") int maxAttempts) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.metrics = metrics;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Creates an empty USD wallet for the customer. Safe to call twice.
     */
    public Wallet createWallet(UUID customerId) {
        Optional<Wallet> existing = findWallet(customerId);
        if (existing.isPresent()) {
            return existing.get();
        }
        OffsetDateTime now = now();
        try {
            jdbcTemplate.update(
                "INSERT INTO wallets (customer_id, balance, currency, version, created_at, updated_at) " +
                "VALUES (?, ?, ?, 0, ?, ?)",
                customerId, Money.ZERO, DEFAULT_CURRENCY, now, now
            );
            log.info("Created wallet for customer {}", customerId);
        } catch (DuplicateKeyException e) {
            log.debug("Wallet for customer {} created concurrently", customerId);
        }
        return findWallet(customerId).orElseThrow(() -> new WalletNotFoundException(customerId));
    }

    /**
     * Debits the wallet.
     *
     * @param referenceId external id making the debit idempotent; may be null
     * @return the posting, flagged replayed if referenceId had already been debited
     * @throws InsufficientFundsException if the balance would go negative
     * @throws WalletNotFoundException if the customer has no wallet
     */
    public LedgerPosting debit(UUID customerId, BigDecimal amount, String description, String referenceId) {
        return post(customerId, TransactionKind.DEBIT, amount, description, referenceId);
    }

    /**
     * Credits the wallet. Same idempotency contract as {@link #debit}, keyed on kind CREDIT.
     */
    public LedgerPosting credit(UUID customerId, BigDecimal amount, String description, String referenceId) {
        return post(customerId, TransactionKind.CREDIT, amount, description, referenceId);
    }

    private LedgerPosting post(UUID customerId, TransactionKind kind, BigDecimal amount,
                               String description, String referenceId) {
        if (customerId == null) {
            throw new IllegalArgumentException("Customer id is required");
        }
        BigDecimal value = Money.requirePositive(amount);
        String reference = referenceId == null || referenceId.isBlank() ? null : referenceId;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                Optional<LedgerPosting> posting = transactionTemplate.execute(status ->
                        tryPost(customerId, kind, value, description, reference));
                if (posting != null && posting.isPresent()) {
                    LedgerPosting result = posting.get();
                    metrics.recordLedgerPosting(kind.name(), result.isReplayed() ? "replayed" : "applied");
                    return result;
                }
                log.debug("Version conflict on wallet {} (attempt {}/{})", customerId, attempt, maxAttempts);
            } catch (DuplicateKeyException e) {
                // A concurrent posting with the same reference committed first
                log.info("Reference {} ({}) posted concurrently, returning existing posting", reference, kind);
                metrics.recordLedgerPosting(kind.name(), "replayed");
                return findPosting(reference, kind)
                        .map(existing -> LedgerPosting.from(existing, true))
                        .orElseThrow(() -> e);
            } catch (InsufficientFundsException e) {
                metrics.recordLedgerPosting(kind.name(), "insufficient_funds");
                throw e;
            } catch (TransientDataAccessException e) {
                log.debug("Transient failure on wallet {} (attempt {}/{}): {}",
                        customerId, attempt, maxAttempts, e.getMessage());
            }
            metrics.recordLedgerRetry();
            backoff(attempt);
        }

        log.error("Giving up on {} of {} for customer {} after {} attempts",
                kind, value, customerId, maxAttempts);
        throw new ConcurrentWalletUpdateException(customerId, maxAttempts);
    }

    /**
     * One attempt inside one transaction. Empty result means the version
     * check lost a race and the caller should retry.
     */
    private Optional<LedgerPosting> tryPost(UUID customerId, TransactionKind kind, BigDecimal amount,
                                            String description, String referenceId) {
        if (referenceId != null) {
            Optional<WalletTransaction> existing = findPosting(referenceId, kind);
            if (existing.isPresent()) {
                return Optional.of(replay(existing.get(), customerId, amount));
            }
        }

        Wallet wallet = findWallet(customerId).orElseThrow(() -> new WalletNotFoundException(customerId));
        BigDecimal delta = kind == TransactionKind.DEBIT ? amount.negate() : amount;
        BigDecimal newBalance = wallet.getBalance().add(delta);

        if (newBalance.signum() < 0) {
            throw new InsufficientFundsException(customerId, wallet.getBalance(), amount);
        }

        OffsetDateTime now = now();
        int updated = jdbcTemplate.update(
            "UPDATE wallets SET balance = ?, version = version + 1, updated_at = ? " +
            "WHERE customer_id = ? AND version = ?",
            newBalance, now, customerId, wallet.getVersion()
        );
        if (updated == 0) {
            return Optional.empty();
        }

        UUID transactionId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO wallet_transactions " +
            "(id, customer_id, amount, kind, description, reference_id, balance_after, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
            transactionId, customerId, delta, kind.name(), description, referenceId, newBalance, now
        );

        log.info("Wallet {}: {} {} -> balance {} (ref={})", customerId, kind, amount, newBalance, referenceId);
        return Optional.of(new LedgerPosting(transactionId, customerId, kind, amount, newBalance, referenceId, false));
    }

    private LedgerPosting replay(WalletTransaction existing, UUID customerId, BigDecimal amount) {
        if (!existing.getCustomerId().equals(customerId)) {
            throw new IllegalStateException(String.format(
                "Reference %s already posted against another wallet", existing.getReferenceId()));
        }
        if (existing.getAmount().abs().compareTo(amount) != 0) {
            log.warn("Replay of reference {} with different amount: original={}, requested={}",
                    existing.getReferenceId(), existing.getAmount().abs(), amount);
        }
        log.info("Reference {} ({}) already posted, returning original balanceAfter={}",
                existing.getReferenceId(), existing.getKind(), existing.getBalanceAfter());
        return LedgerPosting.from(existing, true);
    }

    public Optional<Wallet> findWallet(UUID customerId) {
        List<Wallet> wallets = jdbcTemplate.query(
            "SELECT customer_id, balance, currency, version, updated_at FROM wallets WHERE customer_id = ?",
            walletRowMapper(),
            customerId
        );
        return wallets.stream().findFirst();
    }

    public Wallet getWallet(UUID customerId) {
        return findWallet(customerId).orElseThrow(() -> new WalletNotFoundException(customerId));
    }

    public BigDecimal getBalance(UUID customerId) {
        return getWallet(customerId).getBalance();
    }

    /**
     * Finds the posting recorded for a reference id and kind, if any.
     */
    public Optional<WalletTransaction> findPosting(String referenceId, TransactionKind kind) {
        if (referenceId == null) {
            return Optional.empty();
        }
        List<WalletTransaction> rows = jdbcTemplate.query(
            "SELECT id, customer_id, amount, kind, description, reference_id, balance_after, created_at, sequence_number " +
            "FROM wallet_transactions WHERE reference_id = ? AND kind = ?",
            transactionRowMapper(),
            referenceId,
            kind.name()
        );
        return rows.stream().findFirst();
    }

    /**
     * Most recent transactions first. The limit is clamped to 1..100.
     */
    public List<WalletTransaction> getTransactions(UUID customerId, int limit) {
        int bounded = Math.max(1, Math.min(limit, 100));
        return jdbcTemplate.query(
            "SELECT id, customer_id, amount, kind, description, reference_id, balance_after, created_at, sequence_number " +
            "FROM wallet_transactions WHERE customer_id = ? " +
            "ORDER BY created_at DESC, sequence_number DESC LIMIT ?",
            transactionRowMapper(),
            customerId,
            bounded
        );
    }

    /**
     * Sum of all signed transaction amounts. Always equal to the stored balance.
     */
    public BigDecimal sumOfDeltas(UUID customerId) {
        BigDecimal sum = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount), 0) FROM wallet_transactions WHERE customer_id = ?",
            BigDecimal.class,
            customerId
        );
        return sum != null ? Money.normalize(sum) : Money.ZERO;
    }

    private void backoff(int attempt) {
        long ceiling = Math.min(50L, 2L * attempt);
        try {
            Thread.sleep(ThreadLocalRandom.current().nextLong(1, ceiling + 1));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConcurrentWalletUpdateException(null, attempt);
        }
    }

    private static OffsetDateTime now() {
        return OffsetDateTime.now(ZoneOffset.UTC);
    }

    private static Instant toInstant(OffsetDateTime value) {
        return value != null ? value.toInstant() : null;
    }

    private RowMapper<Wallet> walletRowMapper() {
        return (rs, rowNum) -> new Wallet(
            UUID.fromString(rs.getString("customer_id")),
            Money.normalize(rs.getBigDecimal("balance")),
            rs.getString("currency"),
            rs.getLong("version"),
            toInstant(rs.getObject("updated_at", OffsetDateTime.class))
        );
    }

    private RowMapper<WalletTransaction> transactionRowMapper() {
        return (rs, rowNum) -> new WalletTransaction(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("customer_id")),
            Money.normalize(rs.getBigDecimal("amount")),
            TransactionKind.valueOf(rs.getString("kind")),
            rs.getString("description"),
            rs.getString("reference_id"),
            Money.normalize(rs.getBigDecimal("balance_after")),
            toInstant(rs.getObject("created_at", OffsetDateTime.class)),
            rs.getLong("sequence_number")
        );
    }
}
