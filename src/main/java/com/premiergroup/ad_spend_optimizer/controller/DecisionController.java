package com.premiergroup.ad_spend_optimizer.controller;

import com.premiergroup.ad_spend_optimizer.dto.DateRange;
import com.premiergroup.ad_spend_optimizer.entity.Decision;
import com.premiergroup.ad_spend_optimizer.enums.DecisionType;
import com.premiergroup.ad_spend_optimizer.store.DecisionLog;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

@RestController
@RequestMapping("/api/decisions")
@RequiredArgsConstructor
public class DecisionController {

    private final DecisionLog decisionLog;

    @GetMapping("/{accountId}")
    public ResponseEntity<List<Decision>> getDecisions(
            @PathVariable String accountId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) Set<DecisionType> types
    ) {
        DateRange range = startDate != null && endDate != null ? new DateRange(startDate, endDate) : null;
        List<Decision> decisions = decisionLog.queryDecisions(accountId, range, types);
        if (decisions.isEmpty()) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(decisions);
    }
}
