package com.linkedfate.evaluator;

import com.linkedfate.domain.enums.AlertLevel;
import java.util.List;
import java.util.Optional;

/**
 * Ordered list of threshold tiers, most severe first. {@link #match} returns the first tier
 * the value crosses.
 *
 * <p>Tiers are mutually exclusive by construction: levels must strictly decrease and cutoffs
 * must move strictly away from the danger side (for the BELOW directions each later cutoff is
 * higher, for the ABOVE directions lower). Any other ordering is rejected with
 * {@link IllegalStateException} so a misconfiguration fails at startup.
 */
public final class ThresholdCascade {

    public enum Direction {
        /** Tier matches when {@code value < cutoff}. */
        BELOW,
        /** Tier matches when {@code value <= cutoff}. */
        AT_OR_BELOW,
        /** Tier matches when {@code value > cutoff}. */
        ABOVE,
        /** Tier matches when {@code value >= cutoff}. */
        AT_OR_ABOVE;

        boolean crossed(double value, double cutoff) {
            return switch (this) {
                case BELOW -> value < cutoff;
                case AT_OR_BELOW -> value <= cutoff;
                case ABOVE -> value > cutoff;
                case AT_OR_ABOVE -> value >= cutoff;
            };
        }

        boolean downward() {
            return this == BELOW || this == AT_OR_BELOW;
        }
    }

    private final Direction direction;
    private final List<ThresholdTier> tiers;

    private ThresholdCascade(Direction direction, List<ThresholdTier> tiers) {
        this.direction = direction;
        this.tiers = List.copyOf(tiers);
        validate();
    }

    public static ThresholdCascade below(ThresholdTier... tiers) {
        return new ThresholdCascade(Direction.BELOW, List.of(tiers));
    }

    public static ThresholdCascade above(ThresholdTier... tiers) {
        return new ThresholdCascade(Direction.ABOVE, List.of(tiers));
    }

    public static ThresholdCascade of(Direction direction, ThresholdTier... tiers) {
        return new ThresholdCascade(direction, List.of(tiers));
    }

    public Optional<ThresholdTier> match(double value) {
        if (Double.isNaN(value)) {
            return Optional.empty();
        }
        for (ThresholdTier tier : tiers) {
            if (direction.crossed(value, tier.getCutoff())) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }

    /** Level of the matching tier, NORMAL when none matches. */
    public AlertLevel levelOf(double value) {
        return match(value).map(ThresholdTier::getLevel).orElse(AlertLevel.NORMAL);
    }

    public Direction getDirection() {
        return direction;
    }

    public List<ThresholdTier> getTiers() {
        return tiers;
    }

    private void validate() {
        if (tiers.isEmpty()) {
            throw new IllegalStateException("Threshold cascade needs at least one tier");
        }
        for (int i = 0; i < tiers.size(); i++) {
            ThresholdTier tier = tiers.get(i);
            if (tier.getLevel() == AlertLevel.NORMAL) {
                throw new IllegalStateException("NORMAL is the fall-through level, not a tier: " + tier);
            }
            if (Double.isNaN(tier.getCutoff())) {
                throw new IllegalStateException("Tier cutoff must be a number: " + tier);
            }
            if (i == 0) {
                continue;
            }
            ThresholdTier previous = tiers.get(i - 1);
            if (tier.getLevel().compareTo(previous.getLevel()) >= 0) {
                throw new IllegalStateException(
                        "Tier levels must strictly decrease: " + previous + " then " + tier);
            }
            boolean ordered = direction.downward()
                    ? tier.getCutoff() > previous.getCutoff()
                    : tier.getCutoff() < previous.getCutoff();
            if (!ordered) {
                throw new IllegalStateException(String.format(
                        "Cutoffs of a %s cascade must be strictly ordered: %s then %s", direction, previous, tier));
            }
        }
    }
}
