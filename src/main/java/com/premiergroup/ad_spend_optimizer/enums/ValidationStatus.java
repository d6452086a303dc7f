package com.premiergroup.ad_spend_optimizer.enums;

/**
 * Evidence found in the after window that a decision was actually applied on the platform.
 */
public enum ValidationStatus {

    CPC_MATCH(true),
    CPC_DIRECTIONAL(true),
    VOLUME_MATCH(true),
    DIRECTION_MISMATCH(false),
    CONFIRMED_BLOCKED(true),
    NORMALIZED_BLOCK(true),
    PREVENTATIVE(true),
    NOT_IMPLEMENTED(false),
    HARVEST_COMPLETE(true),
    HARVEST_NEAR_COMPLETE(true),
    HARVEST_MIGRATED(true),
    HARVEST_PARTIAL(true),
    HARVEST_INCOMPLETE(false),
    UNVERIFIED(false);

    private final boolean validated;

    ValidationStatus(boolean validated) {
        this.validated = validated;
    }

    public boolean isValidated() {
        return validated;
    }
}
