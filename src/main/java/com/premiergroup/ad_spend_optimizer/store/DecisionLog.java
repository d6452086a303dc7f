package com.premiergroup.ad_spend_optimizer.store;

import com.premiergroup.ad_spend_optimizer.dto.DateRange;
import com.premiergroup.ad_spend_optimizer.entity.Decision;
import com.premiergroup.ad_spend_optimizer.enums.DecisionType;

import java.util.List;
import java.util.Set;

/**
 * Append-only log of emitted decisions.
 */
public interface DecisionLog {

    /**
     * Appends the batch, skipping any decision whose key already exists.
     *
     * @return number of decisions actually written
     */
    int appendDecisions(String accountId, String batchId, List<Decision> decisions);

    /**
     * @param range null for the full history
     * @param types empty or null for every type
     */
    List<Decision> queryDecisions(String accountId, DateRange range, Set<DecisionType> types);
}
