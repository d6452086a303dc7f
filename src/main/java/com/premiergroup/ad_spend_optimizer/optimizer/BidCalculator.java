package com.premiergroup.ad_spend_optimizer.optimizer;

import com.premiergroup.ad_spend_optimizer.enums.BidBasis;

import java.util.Locale;

/**
 * Continuous bid formula with a per-run change cap and absolute bid limits.
 */
public final class BidCalculator {

    private BidCalculator() {
    }

    /**
     * @param throttleScale 1.0 for target-level evidence, 0.5 when classifying from ad-group totals
     */
    public static BidOutcome formulaBid(double baseBid, double roas, OptimizerConfig config, double throttleScale) {
        double gap = roas / config.getTargetRoas() - 1.0;
        double adjustment;
        BidBasis basis;
        if (gap > 0) {
            adjustment = gap * config.getUpThrottle() * throttleScale;
            basis = BidBasis.PROMOTE;
        } else if (gap < 0) {
            adjustment = gap * config.getDownThrottle() * throttleScale;
            basis = BidBasis.BID_DOWN;
        } else {
            adjustment = 0.0;
            basis = BidBasis.STABLE;
        }
        return clamp(baseBid, baseBid * (1.0 + adjustment), basis, gap, adjustment, config);
    }

    public static BidOutcome visibilityBoost(double baseBid, OptimizerConfig config) {
        double adjustment = config.getVisibilityBoostPct();
        return clamp(baseBid, baseBid * (1.0 + adjustment), BidBasis.VISIBILITY_BOOST, 0.0, adjustment, config);
    }

    /**
     * Applies the per-run change cap, then the absolute limits. The absolute bid floor wins over the cap:
     * a base bid below {@code bidFloor / (1 + maxBidChangePct)} is raised to the floor even though that
     * moves it further than the cap allows.
     */
    static BidOutcome clamp(double baseBid, double rawBid, BidBasis basis, double gap, double adjustment,
                            OptimizerConfig config) {
        double maxChange = config.getMaxBidChangePct();
        double bid = rawBid;
        String note = "";
        if (bid > baseBid * (1.0 + maxChange)) {
            bid = baseBid * (1.0 + maxChange);
            note = String.format(Locale.ROOT, "[Capped +%d%%]", Math.round(maxChange * 100));
        } else if (bid < baseBid * (1.0 - maxChange)) {
            bid = baseBid * (1.0 - maxChange);
            note = String.format(Locale.ROOT, "[Floored -%d%%]", Math.round(maxChange * 100));
        }

        double lower = Math.max(config.getBidFloor(), baseBid * config.getMinBidMultiplier());
        double upper = baseBid * config.getMaxBidMultiplier();
        bid = Math.max(lower, Math.min(upper, bid));
        if (lower > baseBid * (1.0 + maxChange)) {
            note = String.format(Locale.ROOT, "[Raised to bid floor %.2f]", lower);
        }
        return new BidOutcome(bid, basis, gap, adjustment, note);
    }
}
