package com.example.scrubservice.controller;

import com.example.scrubservice.model.ScrubReport;
import com.example.scrubservice.model.ScrubTextRequest;
import com.example.scrubservice.model.ScrubUrlRequest;
import com.example.scrubservice.model.ScrubUrlResponse;
import com.example.scrubservice.model.Verdict;
import com.example.scrubservice.service.RuleSetUnavailableException;
import com.example.scrubservice.service.ScrubService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;

/**
 * REST API for scrubbing URLs
 */
@RestController
@RequestMapping("/api/scrub")
@RequiredArgsConstructor
@Slf4j
public class ScrubController {

    private final ScrubService scrubService;

    /**
     * Evaluate a single URL
     */
    @PostMapping("/url")
    public ResponseEntity<ScrubUrlResponse> scrubUrl(@Valid @RequestBody ScrubUrlRequest request) {
        try {
            Verdict verdict = scrubService.scrubUrl(request.getUrl());
            return ResponseEntity.ok(ScrubUrlResponse.from(request.getUrl(), verdict));
        } catch (RuleSetUnavailableException e) {
            log.error("Cannot scrub URL, no ruleset available", e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
    }

    /**
     * Scrub every link found in a block of text
     */
    @PostMapping("/text")
    public ResponseEntity<ScrubReport> scrubText(@Valid @RequestBody ScrubTextRequest request) {
        try {
            return ResponseEntity.ok(scrubService.scrubText(request.getContent()));
        } catch (RuleSetUnavailableException e) {
            log.error("Cannot scrub text, no ruleset available", e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Service is running");
    }
}
