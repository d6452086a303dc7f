package com.premiergroup.ad_spend_optimizer.service;

import com.premiergroup.ad_spend_optimizer.entity.Decision;
import com.premiergroup.ad_spend_optimizer.enums.DecisionType;
import com.premiergroup.ad_spend_optimizer.optimizer.BidRecommendation;
import com.premiergroup.ad_spend_optimizer.optimizer.HarvestCandidate;
import com.premiergroup.ad_spend_optimizer.optimizer.NegativeCandidate;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns run outputs into decision log rows.
 */
public final class DecisionFactory {

    static final String NEGATIVE_OLD_VALUE = "ENABLED";
    static final String NEGATIVE_NEW_VALUE = "PAUSED";

    private DecisionFactory() {
    }

    public static List<Decision> fromRun(LocalDate decisionDate, List<BidRecommendation> bids,
                                         List<NegativeCandidate> negatives, List<HarvestCandidate> harvests) {
        List<Decision> decisions = new ArrayList<>();
        for (HarvestCandidate harvest : harvests) {
            decisions.add(harvest(decisionDate, harvest));
        }
        for (NegativeCandidate negative : negatives) {
            decisions.add(negative(decisionDate, negative));
        }
        for (BidRecommendation bid : bids) {
            if (bid.isActionable()) {
                decisions.add(bidChange(decisionDate, bid));
            }
        }
        return decisions;
    }

    static Decision bidChange(LocalDate decisionDate, BidRecommendation bid) {
        return Decision.builder()
                .decisionDate(decisionDate)
                .decisionType(DecisionType.BID_CHANGE)
                .targetText(bid.targetText())
                .campaignName(bid.campaignName())
                .adGroupName(bid.adGroupName())
                .matchType(bid.matchType())
                .oldValue(money(bid.baseBid()))
                .newValue(money(bid.newBid()))
                .reason(bid.reason())
                .build();
    }

    static Decision negative(LocalDate decisionDate, NegativeCandidate negative) {
        return Decision.builder()
                .decisionDate(decisionDate)
                .decisionType(DecisionType.NEGATIVE)
                .targetText(negative.term())
                .campaignName(negative.campaignName())
                .adGroupName(negative.adGroupName())
                .matchType(negative.negativeMatchType())
                .oldValue(NEGATIVE_OLD_VALUE)
                .newValue(NEGATIVE_NEW_VALUE)
                .reason(negative.reason())
                .build();
    }

    static Decision harvest(LocalDate decisionDate, HarvestCandidate harvest) {
        return Decision.builder()
                .decisionDate(decisionDate)
                .decisionType(DecisionType.HARVEST)
                .targetText(harvest.term())
                .campaignName(harvest.winnerCampaign())
                .adGroupName(harvest.winnerAdGroup())
                .matchType(HarvestCandidate.AFTER_MATCH_TYPE)
                .oldValue(money(harvest.baseBid()))
                .newValue(money(harvest.launchBid()))
                .reason(String.format(Locale.ROOT, "Harvest: %d orders, ROAS %.2f (required %.2f)",
                        harvest.orders(), harvest.roas(), harvest.requiredRoas()))
                .winnerSourceCampaign(harvest.winnerCampaign())
                .newCampaignName(harvest.newCampaignName())
                .beforeMatchType(harvest.winnerMatchType())
                .afterMatchType(HarvestCandidate.AFTER_MATCH_TYPE)
                .build();
    }

    private static String money(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
