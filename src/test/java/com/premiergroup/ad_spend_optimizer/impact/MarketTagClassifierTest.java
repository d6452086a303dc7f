package com.premiergroup.ad_spend_optimizer.impact;

import com.premiergroup.ad_spend_optimizer.enums.MarketTag;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class MarketTagClassifierTest {

    @ParameterizedTest(name = "trend {0}, value {1} -> {2}")
    @CsvSource({
            "10, 5, OFFENSIVE_WIN",
            "0, 0, OFFENSIVE_WIN",
            "10, -5, GAP",
            "-10, 5, DEFENSIVE_WIN",
            "-10, 0, DEFENSIVE_WIN",
            "-10, -5, MARKET_DRAG"
    })
    void quadrants(double trend, double value, MarketTag expected) {
        assertThat(MarketTagClassifier.classify(trend, value)).isEqualTo(expected);
    }
}
