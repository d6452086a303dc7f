package com.premiergroup.ad_spend_optimizer.optimizer;

import com.premiergroup.ad_spend_optimizer.dto.BidReference;

import java.util.*;

/**
 * Lookup of explicit and ad-group default bids supplied with a run.
 */
public class BidBook {

    private final Map<String, Double> explicitBids = new HashMap<>();
    private final Map<String, Double> adGroupDefaults = new HashMap<>();

    public BidBook(Collection<BidReference> references) {
        if (references == null) {
            return;
        }
        for (BidReference ref : references) {
            if (ref.bid() != null && ref.targetText() != null) {
                explicitBids.put(targetKey(ref.campaignName(), ref.adGroupName(), ref.targetText()), ref.bid().doubleValue());
            }
            if (ref.adGroupDefaultBid() != null) {
                adGroupDefaults.putIfAbsent(adGroupKey(ref.campaignName(), ref.adGroupName()),
                        ref.adGroupDefaultBid().doubleValue());
            }
        }
    }

    public static BidBook empty() {
        return new BidBook(List.of());
    }

    /**
     * Base-bid candidates in priority order: explicit bid, ad-group default, observed CPC.
     */
    public List<Double> candidates(String campaign, String adGroup, String target, double observedCpc) {
        List<Double> candidates = new ArrayList<>(3);
        candidates.add(explicitBids.get(targetKey(campaign, adGroup, target)));
        candidates.add(adGroupDefaults.get(adGroupKey(campaign, adGroup)));
        candidates.add(observedCpc);
        return candidates;
    }

    /**
     * First candidate that is present and positive.
     */
    public static OptionalDouble resolveBaseBid(List<? extends Number> candidates) {
        for (Number candidate : candidates) {
            if (candidate == null) {
                continue;
            }
            double value = candidate.doubleValue();
            if (value > 0 && !Double.isNaN(value)) {
                return OptionalDouble.of(value);
            }
        }
        return OptionalDouble.empty();
    }

    private static String targetKey(String campaign, String adGroup, String target) {
        return adGroupKey(campaign, adGroup) + "|" + TargetingText.normalize(target);
    }

    private static String adGroupKey(String campaign, String adGroup) {
        return TargetingText.normalize(campaign) + "|" + TargetingText.normalize(adGroup);
    }
}
