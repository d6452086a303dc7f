package com.premiergroup.ad_spend_optimizer.enums;

public enum BidBasis {

    PROMOTE,
    BID_DOWN,
    STABLE,
    VISIBILITY_BOOST,
    HOLD_INSUFFICIENT_DATA,
    HOLD_NO_BID_DATA;

    public boolean isHold() {
        return switch (this) {
            case HOLD_INSUFFICIENT_DATA, HOLD_NO_BID_DATA -> true;
            default -> false;
        };
    }
}
