package org.handhistory.controller;

import lombok.RequiredArgsConstructor;
import org.handhistory.dto.HandSummaryDTO;
import org.handhistory.service.HandHistoryService;
import org.handhistory.service.HandSummaries;
import org.handhistory.service.parsing.HandParseException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/hands")
@RequiredArgsConstructor
public class HandHistoryController {

    private final HandHistoryService handHistoryService;

    // POST /api/hands/{room} : full parse of a raw hand history (text/plain)
    @PostMapping(value = "/{room}", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<?> parse(@PathVariable String room, @RequestBody String text) {
        try {
            return ResponseEntity.ok(HandSummaries.from(handHistoryService.parse(room, text)));
        } catch (HandParseException e) {
            return unprocessable(e);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    // POST /api/hands/{room}/header : header fields only
    @PostMapping(value = "/{room}/header", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<?> header(@PathVariable String room, @RequestBody String text) {
        try {
            return ResponseEntity.ok(HandSummaries.from(handHistoryService.parseHeader(room, text)));
        } catch (HandParseException e) {
            return unprocessable(e);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    // POST /api/hands/{room}/batch : JSON array of raw texts, failures reported per hand
    @PostMapping(value = "/{room}/batch", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> batch(@PathVariable String room, @RequestBody List<String> texts) {
        try {
            return ResponseEntity.ok(handHistoryService.parseAll(room, texts));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/recent")
    public ResponseEntity<List<HandSummaryDTO>> recent(@RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(handHistoryService.recent(limit));
    }

    @GetMapping("/{ident}")
    public HandSummaryDTO byIdent(@PathVariable String ident) {
        return handHistoryService.findByIdent(ident)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown hand #" + ident));
    }

    private static ResponseEntity<?> unprocessable(HandParseException e) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", e.getMessage());
        body.put("stage", e.getStage() == null ? null : e.getStage().name());
        body.put("fragmentIndex", e.getFragmentIndex());
        return ResponseEntity.unprocessableEntity().body(body);
    }
}
