package com.flagship.missed_call.pipeline;

import com.flagship.missed_call.config.MissedCallProperties;
import com.flagship.missed_call.customer.Customer;
import com.flagship.missed_call.observability.PipelineMetrics;
import com.flagship.missed_call.wallet.Money;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Low-balance alerting with a per-threshold cooldown.
 *
 * The "should we alert?" check and the "we alerted" record are one atomic
 * statement: a conditional UPDATE on the existing row, or an INSERT of the
 * first one. Two concurrent calls crossing the same threshold produce one
 * alert; the loser sees zero updated rows or a duplicate key.
 */
@Service
@Slf4j
public class LowBalanceAlertService {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final LowBalanceNotifier notifier;
    private final MissedCallProperties properties;
    private final PipelineMetrics metrics;

    public LowBalanceAlertService(JdbcTemplate jdbcTemplate,
                                  PlatformTransactionManager transactionManager,
                                  LowBalanceNotifier notifier,
                                  MissedCallProperties properties,
                                  PipelineMetrics metrics) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.notifier = notifier;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Checks every configured threshold against the balance, highest first,
     * and notifies for each one that fires.
     *
     * @return thresholds that produced an alert
     */
    public List<BigDecimal> checkThresholds(Customer customer, BigDecimal balance) {
        List<BigDecimal> raised = new ArrayList<>();
        List<BigDecimal> thresholds = properties.getAlerts().getThresholds().stream()
                .map(Money::normalize)
                .sorted(Comparator.reverseOrder())
                .toList();
        for (BigDecimal threshold : thresholds) {
            if (raiseIfDue(customer, balance, threshold)) {
                raised.add(threshold);
            }
        }
        return raised;
    }

    /**
     * Alerts for a single threshold if the balance is at or below it and no
     * alert for that threshold went out within the cooldown.
     *
     * @return true if the notifier was called
     */
    public boolean raiseIfDue(Customer customer, BigDecimal balance, BigDecimal threshold) {
        if (balance.compareTo(threshold) > 0) {
            return false;
        }
        if (!checkAndRecord(customer.getId(), threshold, Instant.now())) {
            log.debug("Low balance alert for customer {} at {} still in cooldown", customer.getId(), threshold);
            return false;
        }
        notifier.notifyLowBalance(customer, balance, threshold);
        metrics.recordLowBalanceAlert(threshold.toPlainString());
        return true;
    }

    /**
     * Records an alert at the threshold unless one was recorded within the
     * cooldown. Commits on its own.
     *
     * @return true if this call claimed the alert
     */
    public boolean checkAndRecord(UUID customerId, BigDecimal threshold, Instant now) {
        OffsetDateTime sentAt = OffsetDateTime.ofInstant(now, ZoneOffset.UTC);
        OffsetDateTime cutoff = sentAt.minus(properties.getAlerts().getCooldown());
        BigDecimal level = Money.normalize(threshold);
        try {
            Boolean claimed = transactionTemplate.execute(status -> {
                int updated = jdbcTemplate.update(
                    "UPDATE low_balance_alerts SET last_sent_at = ? " +
                    "WHERE customer_id = ? AND threshold = ? AND last_sent_at < ?",
                    sentAt, customerId, level, cutoff
                );
                if (updated > 0) {
                    return true;
                }
                Integer existing = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM low_balance_alerts WHERE customer_id = ? AND threshold = ?",
                    Integer.class, customerId, level
                );
                if (existing != null && existing > 0) {
                    return false;
                }
                jdbcTemplate.update(
                    "INSERT INTO low_balance_alerts (customer_id, threshold, last_sent_at) VALUES (?, ?, ?)",
                    customerId, level, sentAt
                );
                return true;
            });
            return Boolean.TRUE.equals(claimed);
        } catch (DuplicateKeyException e) {
            log.debug("Concurrent low balance alert for customer {} at {}", customerId, level);
            return false;
        }
    }
}
