package com.flagship.broker_ledger.money;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Rounding policies for the two money domains of the ledger.
 *
 * Share-space values (what a client pays or is paid: pending, my share,
 * counterparty share) ALWAYS round down, so a client is never asked for
 * more than the exact share.
 *
 * Capital-space values (capital, loss, capital closed) round half-up to
 * two places, standard accounting.
 *
 * Rounding is only ever applied once, after exact computation.
 */
public final class MoneyRounding {

    public static final int SHARE_SCALE = 1;
    public static final int CAPITAL_SCALE = 2;

    /**
     * Anything strictly below one cent is closed to exactly zero, and only
     * through an explicit ledger entry.
     */
    public static final BigDecimal AUTO_CLOSE_THRESHOLD = new BigDecimal("0.01");

    /**
     * Precision for intermediate divisions (payment x 100 / pct can be non-terminating).
     */
    public static final MathContext EXACT = MathContext.DECIMAL128;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private MoneyRounding() {
        // Utility class
    }

    /**
     * Share-space rounding: always down.
     * 8.55 -> 8.5, 8.59 -> 8.5, 9.00 -> 9.0
     */
    public static BigDecimal roundShare(BigDecimal amount) {
        if (amount == null) {
            return BigDecimal.ZERO.setScale(SHARE_SCALE);
        }
        return amount.setScale(SHARE_SCALE, RoundingMode.DOWN);
    }

    /**
     * Capital-space rounding: half-up to two places.
     * 8.555 -> 8.56, 8.554 -> 8.55
     */
    public static BigDecimal roundCapital(BigDecimal amount) {
        if (amount == null) {
            return BigDecimal.ZERO.setScale(CAPITAL_SCALE);
        }
        return amount.setScale(CAPITAL_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Capital-space truncation, used when one side of an allocation must
     * not round up.
     */
    public static BigDecimal truncateCapital(BigDecimal amount) {
        return amount.setScale(CAPITAL_SCALE, RoundingMode.DOWN);
    }

    public static boolean isBelowThreshold(BigDecimal amount) {
        return amount.abs().compareTo(AUTO_CLOSE_THRESHOLD) < 0;
    }

    /**
     * amount x pct / 100, unrounded.
     */
    public static BigDecimal percentOf(BigDecimal amount, BigDecimal pct) {
        return amount.multiply(pct).divide(HUNDRED, EXACT);
    }

    /**
     * amount x 100 / pct, unrounded. Converts a share-space amount back to
     * the capital it represents.
     */
    public static BigDecimal capitalFor(BigDecimal shareAmount, BigDecimal pct) {
        if (pct.signum() <= 0) {
            throw new IllegalArgumentException("Share percentage must be positive: " + pct);
        }
        return shareAmount.multiply(HUNDRED).divide(pct, EXACT);
    }

    /**
     * |a - b| <= 0.01
     */
    public static boolean withinTolerance(BigDecimal a, BigDecimal b) {
        return a.subtract(b).abs().compareTo(AUTO_CLOSE_THRESHOLD) <= 0;
    }
}
