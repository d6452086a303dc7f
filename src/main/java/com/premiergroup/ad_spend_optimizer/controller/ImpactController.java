package com.premiergroup.ad_spend_optimizer.controller;

import com.premiergroup.ad_spend_optimizer.enums.ImpactHorizon;
import com.premiergroup.ad_spend_optimizer.impact.ImpactFilter;
import com.premiergroup.ad_spend_optimizer.impact.ImpactRecord;
import com.premiergroup.ad_spend_optimizer.impact.ImpactSummary;
import com.premiergroup.ad_spend_optimizer.service.ImpactService;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/impact")
@RequiredArgsConstructor
@Validated
public class ImpactController {

    private final ImpactService impactService;

    @GetMapping("/{accountId}/actions")
    public ResponseEntity<List<ImpactRecord>> getActionImpact(
            @PathVariable String accountId,
            @RequestParam(required = false) @Positive Integer beforeDays,
            @RequestParam(required = false) @Positive Integer afterDays
    ) {
        List<ImpactRecord> records = impactService.getActionImpact(accountId, beforeDays, afterDays);
        if (records.isEmpty()) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(records);
    }

    @GetMapping("/{accountId}/summary")
    public ResponseEntity<ImpactSummary> getImpactSummary(
            @PathVariable String accountId,
            @RequestParam(defaultValue = "true") boolean matureOnly,
            @RequestParam(defaultValue = "true") boolean validatedOnly,
            @RequestParam(required = false) ImpactHorizon horizon
    ) {
        return ResponseEntity.ok(impactService.getImpactSummary(accountId,
                new ImpactFilter(matureOnly, validatedOnly), horizon));
    }
}
