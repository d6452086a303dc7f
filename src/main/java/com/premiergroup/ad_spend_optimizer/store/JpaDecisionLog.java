package com.premiergroup.ad_spend_optimizer.store;

import com.premiergroup.ad_spend_optimizer.dto.DateRange;
import com.premiergroup.ad_spend_optimizer.entity.Decision;
import com.premiergroup.ad_spend_optimizer.enums.DecisionType;
import com.premiergroup.ad_spend_optimizer.exception.PerformanceDataException;
import com.premiergroup.ad_spend_optimizer.repository.DecisionRepository;
import lombok.AllArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Repository
@Log4j2
@AllArgsConstructor
public class JpaDecisionLog implements DecisionLog {

    private DecisionRepository decisionRepository;

    @Override
    @Transactional
    public int appendDecisions(String accountId, String batchId, List<Decision> decisions) {
        if (decisions == null || decisions.isEmpty()) {
            return 0;
        }
        Instant now = Instant.now();
        Set<String> seen = new HashSet<>();
        int appended = 0;
        try {
            for (Decision decision : decisions) {
                if (decision.getDecisionDate() == null) {
                    decision.setDecisionDate(LocalDate.ofInstant(now, ZoneOffset.UTC));
                }
                decision.assignKeys();
                String dedupKey = decision.getDecisionDate() + "|" + decision.getTargetKey() + "|"
                        + decision.getDecisionType() + "|" + decision.getCampaignKey();
                if (!seen.add(dedupKey)) {
                    continue;
                }

                decision.setDecisionId(decision.getDecisionId() != null ? decision.getDecisionId() : UUID.randomUUID());
                decision.setAccountId(accountId);
                decision.setBatchId(batchId);
                decision.setEmittedAt(decision.getEmittedAt() != null ? decision.getEmittedAt() : now);
                appended += decisionRepository.insertIfAbsent(decision);
            }
        } catch (DataAccessException e) {
            throw new PerformanceDataException("Failed to append decisions for account " + accountId, e);
        }

        int dropped = decisions.size() - appended;
        if (dropped > 0) {
            log.info("Batch {} for account {}: {} appended, {} duplicates skipped",
                    batchId, accountId, appended, dropped);
        } else {
            log.info("Batch {} for account {}: {} appended", batchId, accountId, appended);
        }
        return appended;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Decision> queryDecisions(String accountId, DateRange range, Set<DecisionType> types) {
        try {
            if (range == null) {
                List<Decision> all = decisionRepository.findByAccountIdOrderByEmittedAtAsc(accountId);
                return types == null || types.isEmpty()
                        ? all
                        : all.stream().filter(d -> types.contains(d.getDecisionType())).toList();
            }
            if (types == null || types.isEmpty()) {
                return decisionRepository.findByAccountIdAndDecisionDateBetweenOrderByEmittedAtAsc(
                        accountId, range.start(), range.end());
            }
            return decisionRepository.findByAccountIdAndDecisionDateBetweenAndDecisionTypeInOrderByEmittedAtAsc(
                    accountId, range.start(), range.end(), types);
        } catch (DataAccessException e) {
            throw new PerformanceDataException("Failed to query decisions for account " + accountId, e);
        }
    }
}
