package io.github.drompincen.reportscheduler.gateway.controller;

import io.github.drompincen.reportscheduler.protocol.api.RunRecordResponse;
import io.github.drompincen.reportscheduler.runtime.history.RunHistoryService;
import org.springframework.data.domain.Page;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;

@RestController
@RequestMapping("/api/report-runs")
public class ReportRunController {

    private final RunHistoryService runHistoryService;

    public ReportRunController(RunHistoryService runHistoryService) {
        this.runHistoryService = runHistoryService;
    }

    @GetMapping
    public Page<RunRecordResponse> list(@RequestParam(required = false) String scheduleId,
                                        @RequestParam(defaultValue = "0") int page,
                                        @RequestParam(defaultValue = "20") int size) {
        return runHistoryService.listRuns(scheduleId, page, size).map(ReportResponses::toRunResponse);
    }

    @GetMapping("/stats")
    public ResponseEntity<?> stats(@RequestParam(required = false) String from,
                                   @RequestParam(required = false) String to) {
        try {
            Instant start = from != null ? Instant.parse(from) : null;
            Instant end = to != null ? Instant.parse(to) : null;
            return ResponseEntity.ok(runHistoryService.stats(start, end));
        } catch (DateTimeParseException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "from/to must be ISO-8601 instants"));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }
}
