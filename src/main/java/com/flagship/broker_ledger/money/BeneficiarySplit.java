package com.flagship.broker_ledger.money;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Who shares in a loss (or a profit) and by how much.
 *
 * Resolved once, when a snapshot is frozen, from the account's client type:
 * a personal client has a single beneficiary (me), a company client has two
 * (me and the company). Settlement never re-interprets the client type.
 */
public interface BeneficiarySplit {

    BigDecimal getMySharePct();

    BigDecimal getCounterpartySharePct();

    SplitType getType();

    default BigDecimal totalPct() {
        return getMySharePct().add(getCounterpartySharePct());
    }

    enum SplitType {
        SINGLE,
        DUAL
    }

    static BeneficiarySplit single(BigDecimal mySharePct) {
        return new Single(mySharePct);
    }

    static BeneficiarySplit dual(BigDecimal mySharePct, BigDecimal counterpartySharePct) {
        return new Dual(mySharePct, counterpartySharePct);
    }

    /**
     * Rebuilds a split from its stored columns.
     */
    static BeneficiarySplit of(SplitType type, BigDecimal mySharePct, BigDecimal counterpartySharePct) {
        return switch (type) {
            case SINGLE -> single(mySharePct);
            case DUAL -> dual(mySharePct, counterpartySharePct);
        };
    }

    /**
     * Personal client: the whole share is mine.
     */
    @Value
    class Single implements BeneficiarySplit {
        BigDecimal mySharePct;

        public Single(BigDecimal mySharePct) {
            requireValidPct(mySharePct, "my share");
            if (mySharePct.signum() == 0) {
                throw new IllegalArgumentException("Single beneficiary share must be positive");
            }
            this.mySharePct = mySharePct;
        }

        @Override
        public BigDecimal getCounterpartySharePct() {
            return BigDecimal.ZERO;
        }

        @Override
        public SplitType getType() {
            return SplitType.SINGLE;
        }
    }

    /**
     * Company client: my share and the company's share, frozen together.
     */
    @Value
    class Dual implements BeneficiarySplit {
        BigDecimal mySharePct;
        BigDecimal counterpartySharePct;

        public Dual(BigDecimal mySharePct, BigDecimal counterpartySharePct) {
            requireValidPct(mySharePct, "my share");
            requireValidPct(counterpartySharePct, "counterparty share");
            BigDecimal total = mySharePct.add(counterpartySharePct);
            if (total.signum() == 0 || total.compareTo(BigDecimal.valueOf(100)) > 0) {
                throw new IllegalArgumentException("Total share must be in (0, 100]: " + total);
            }
            this.mySharePct = mySharePct;
            this.counterpartySharePct = counterpartySharePct;
        }

        @Override
        public SplitType getType() {
            return SplitType.DUAL;
        }
    }

    private static void requireValidPct(BigDecimal pct, String label) {
        if (pct == null) {
            throw new IllegalArgumentException(label + " percentage is required");
        }
        if (pct.signum() < 0 || pct.compareTo(BigDecimal.valueOf(100)) > 0) {
            throw new IllegalArgumentException(label + " percentage must be between 0 and 100: " + pct);
        }
    }
}
