package com.premiergroup.ad_spend_optimizer.controller;

import com.premiergroup.ad_spend_optimizer.dto.PerformanceUpsert;
import com.premiergroup.ad_spend_optimizer.store.PerformanceStore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/performance")
@RequiredArgsConstructor
@Validated
@Log4j2
public class PerformanceController {

    private final PerformanceStore performanceStore;

    /**
     * Adds a batch of weekly rows. Example: POST api/performance/acme-us
     */
    @PostMapping("/{accountId}")
    @Transactional
    public ResponseEntity<Integer> upsertPerformance(
            @PathVariable String accountId,
            @RequestBody @NotEmpty List<@Valid PerformanceUpsert> rows
    ) {
        rows.forEach(row -> performanceStore.upsertPerformance(accountId, row));
        log.info("Upserted {} performance rows for account {}", rows.size(), accountId);
        return ResponseEntity.ok(rows.size());
    }

    @GetMapping("/{accountId}/latest-raw-date")
    public ResponseEntity<LocalDate> getLatestRawDate(@PathVariable String accountId) {
        return performanceStore.latestRawDate(accountId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
