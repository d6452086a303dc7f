package com.premiergroup.ad_spend_optimizer.entity;

import com.premiergroup.ad_spend_optimizer.enums.DecisionType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Locale;
import java.util.UUID;

/**
 * An emitted optimizer action. Rows are appended once and never updated.
 */
@Entity
@Table(name = "decisions",
        uniqueConstraints = @UniqueConstraint(name = "uk_decision_key", columnNames = {
                "account_id", "decision_date", "target_key", "decision_type", "campaign_key"}),
        indexes = @Index(name = "idx_decision_account_date", columnList = "account_id, decision_date"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties({"hibernateLazyInitializer", "handler"})
public class Decision {

    @Id
    @Column(name = "decision_id", nullable = false, updatable = false)
    private UUID decisionId;

    @Column(name = "account_id", nullable = false, updatable = false)
    private String accountId;

    @Column(name = "batch_id", nullable = false, updatable = false)
    private String batchId;

    @Column(name = "emitted_at", nullable = false, updatable = false)
    private Instant emittedAt;

    @Column(name = "decision_date", nullable = false, updatable = false)
    private LocalDate decisionDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "decision_type", nullable = false, updatable = false, length = 20)
    private DecisionType decisionType;

    @Column(name = "target_text", nullable = false, updatable = false)
    private String targetText;

    @Column(name = "campaign_name", nullable = false, updatable = false)
    private String campaignName;

    @Column(name = "ad_group_name", updatable = false)
    private String adGroupName;

    @Column(name = "match_type", updatable = false)
    private String matchType;

    @Column(name = "old_value", updatable = false)
    private String oldValue;

    @Column(name = "new_value", updatable = false)
    private String newValue;

    @Column(name = "reason", length = 512, updatable = false)
    private String reason;

    @Column(name = "winner_source_campaign", updatable = false)
    private String winnerSourceCampaign;

    @Column(name = "new_campaign_name", updatable = false)
    private String newCampaignName;

    @Column(name = "before_match_type", updatable = false)
    private String beforeMatchType;

    @Column(name = "after_match_type", updatable = false)
    private String afterMatchType;

    // normalized copies backing the unique key
    @Column(name = "target_key", nullable = false, updatable = false)
    private String targetKey;

    @Column(name = "campaign_key", nullable = false, updatable = false)
    private String campaignKey;

    public void assignKeys() {
        targetKey = keyOf(targetText);
        campaignKey = keyOf(campaignName);
    }

    private static String keyOf(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
