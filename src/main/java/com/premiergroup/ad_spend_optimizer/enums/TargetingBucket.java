package com.premiergroup.ad_spend_optimizer.enums;

public enum TargetingBucket {

    EXACT,
    PRODUCT_TARGETING,
    BROAD_PHRASE,
    AUTO,
    CATEGORY
}
