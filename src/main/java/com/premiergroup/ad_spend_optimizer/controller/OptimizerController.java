package com.premiergroup.ad_spend_optimizer.controller;

import com.premiergroup.ad_spend_optimizer.dto.OptimizationRequest;
import com.premiergroup.ad_spend_optimizer.dto.OptimizationResult;
import com.premiergroup.ad_spend_optimizer.service.OptimizerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/optimizer")
@RequiredArgsConstructor
public class OptimizerController {

    private final OptimizerService optimizerService;

    /**
     * Runs the optimizer for an account and logs the resulting decisions.
     * <p>
     * Example: POST api/optimizer/acme-us/run with {"profile": "CONSERVATIVE", "dryRun": true}
     */
    @PostMapping("/{accountId}/run")
    public ResponseEntity<OptimizationResult> run(
            @PathVariable String accountId,
            @RequestBody(required = false) @Valid OptimizationRequest request
    ) {
        OptimizationResult result = optimizerService.run(accountId, request);
        if (result.analysisWindow() == null) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(result);
    }
}
