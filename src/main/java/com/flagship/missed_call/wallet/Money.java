package com.flagship.missed_call.wallet;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point money helpers. All balances are held in cents precision.
 */
public final class Money {

    public static final int SCALE = 2;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private Money() {
        // Utility class
    }

    public static BigDecimal of(String amount) {
        return normalize(new BigDecimal(amount));
    }

    public static BigDecimal normalize(BigDecimal amount) {
        return amount.setScale(SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Validates a posting amount: positive and representable in cents.
     *
     * @throws IllegalArgumentException if null, not positive, or finer than a cent
     */
    public static BigDecimal requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive: " + amount);
        }
        if (amount.stripTrailingZeros().scale() > SCALE) {
            throw new IllegalArgumentException("Amount has more than " + SCALE + " decimal places: " + amount);
        }
        return amount.setScale(SCALE, RoundingMode.UNNECESSARY);
    }
}
