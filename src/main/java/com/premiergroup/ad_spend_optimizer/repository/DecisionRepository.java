package com.premiergroup.ad_spend_optimizer.repository;

import com.premiergroup.ad_spend_optimizer.entity.Decision;
import com.premiergroup.ad_spend_optimizer.enums.DecisionType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface DecisionRepository extends JpaRepository<Decision, UUID> {

    /**
     * Inserts the decision unless its key is already taken, including by a concurrent run.
     *
     * @return 1 if the row was written, 0 if it conflicted
     */
    @Modifying
    @Query(value = """
        INSERT INTO decisions (decision_id, account_id, batch_id, emitted_at, decision_date, decision_type,
                               target_text, campaign_name, ad_group_name, match_type, old_value, new_value,
                               reason, winner_source_campaign, new_campaign_name, before_match_type,
                               after_match_type, target_key, campaign_key)
        VALUES (:#{#d.decisionId}, :#{#d.accountId}, :#{#d.batchId}, :#{#d.emittedAt}, :#{#d.decisionDate},
                :#{#d.decisionType.name()}, :#{#d.targetText}, :#{#d.campaignName},
                CAST(:#{#d.adGroupName} AS VARCHAR), CAST(:#{#d.matchType} AS VARCHAR),
                CAST(:#{#d.oldValue} AS VARCHAR), CAST(:#{#d.newValue} AS VARCHAR),
                CAST(:#{#d.reason} AS VARCHAR), CAST(:#{#d.winnerSourceCampaign} AS VARCHAR),
                CAST(:#{#d.newCampaignName} AS VARCHAR), CAST(:#{#d.beforeMatchType} AS VARCHAR),
                CAST(:#{#d.afterMatchType} AS VARCHAR), :#{#d.targetKey}, :#{#d.campaignKey})
        ON CONFLICT DO NOTHING
    """, nativeQuery = true)
    int insertIfAbsent(@Param("d") Decision decision);

    List<Decision> findByAccountIdAndDecisionDateBetweenOrderByEmittedAtAsc(
            String accountId,
            LocalDate start,
            LocalDate end
    );

    List<Decision> findByAccountIdAndDecisionDateBetweenAndDecisionTypeInOrderByEmittedAtAsc(
            String accountId,
            LocalDate start,
            LocalDate end,
            Collection<DecisionType> types
    );

    List<Decision> findByAccountIdOrderByEmittedAtAsc(String accountId);

    long countByAccountId(String accountId);
}
