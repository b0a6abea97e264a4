package com.example.scrubservice.controller;

import com.example.scrubservice.ruleset.BuildDiagnostic;
import com.example.scrubservice.ruleset.MalformedRulesDocumentException;
import com.example.scrubservice.ruleset.RuleSet;
import com.example.scrubservice.service.RuleSetRefreshService;
import com.example.scrubservice.service.RuleSetRegistry;
import com.example.scrubservice.service.RulesTransportException;
import com.example.scrubservice.service.ScrubService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for inspecting and refreshing the URL cleaning ruleset
 */
@RestController
@RequestMapping("/api/rules")
@RequiredArgsConstructor
@Slf4j
public class RuleSetController {

    private final RuleSetRegistry registry;
    private final RuleSetRefreshService refreshService;
    private final ScrubService scrubService;

    /**
     * Names of the published providers, in evaluation order
     */
    @GetMapping("/providers")
    public ResponseEntity<List<String>> getProviders() {
        return ResponseEntity.ok(registry.current().map(RuleSet::getProviderNames).orElse(List.of()));
    }

    /**
     * Providers excluded from the published ruleset and why
     */
    @GetMapping("/diagnostics")
    public ResponseEntity<List<BuildDiagnostic>> getDiagnostics() {
        return ResponseEntity.ok(registry.current().map(RuleSet::getDiagnostics).orElse(List.of()));
    }

    /**
     * Ruleset and evaluation statistics
     */
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStatistics() {
        return ResponseEntity.ok(scrubService.getStatistics());
    }

    /**
     * Download the rules again, optionally from a different location
     */
    @PostMapping("/refresh")
    public ResponseEntity<String> refresh(@RequestParam(name = "url", required = false) String url) {
        try {
            RuleSet ruleSet = refreshService.refresh(url);
            log.info("Rules updated from {}: {} providers", ruleSet.getSource(), ruleSet.size());
            return ResponseEntity.ok("Rules updated");
        } catch (RulesTransportException e) {
            log.error("Rules update failed", e);
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body("Rules update failed (see log for details)");
        } catch (MalformedRulesDocumentException e) {
            log.error("Rules update failed", e);
            return ResponseEntity.unprocessableEntity().body("Rules document is malformed (see log for details)");
        }
    }
}
