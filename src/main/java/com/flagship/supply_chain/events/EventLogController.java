package com.flagship.supply_chain.events;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Public read access to the event log. No principal header is required.
 */
@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
public class EventLogController {

    private static final int MAX_PAGE = 500;

    private final EventLog eventLog;

    @GetMapping
    public ResponseEntity<List<LoggedEvent>> events(
            @RequestParam(name = "after", defaultValue = "0") long after,
            @RequestParam(name = "limit", defaultValue = "100") int limit) {
        if (after < 0 || limit < 1) {
            throw new IllegalArgumentException("'after' must be >= 0 and 'limit' must be >= 1");
        }
        return ResponseEntity.ok(eventLog.after(after, Math.min(limit, MAX_PAGE)));
    }
}
