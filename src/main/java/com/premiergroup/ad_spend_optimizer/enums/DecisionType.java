package com.premiergroup.ad_spend_optimizer.enums;

public enum DecisionType {

    BID_CHANGE,
    NEGATIVE,
    HARVEST
}
