package com.premiergroup.ad_spend_optimizer.impact;

import com.premiergroup.ad_spend_optimizer.enums.MarketTag;

public final class MarketTagClassifier {

    private MarketTagClassifier() {
    }

    public static MarketTag classify(double expectedTrendPct, double decisionValuePct) {
        boolean marketUp = expectedTrendPct >= 0;
        boolean decisionHelped = decisionValuePct >= 0;
        if (marketUp) {
            return decisionHelped ? MarketTag.OFFENSIVE_WIN : MarketTag.GAP;
        }
        return decisionHelped ? MarketTag.DEFENSIVE_WIN : MarketTag.MARKET_DRAG;
    }
}
