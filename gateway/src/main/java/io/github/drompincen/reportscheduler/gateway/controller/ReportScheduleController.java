package io.github.drompincen.reportscheduler.gateway.controller;

import io.github.drompincen.reportscheduler.persistence.document.ReportScheduleDocument;
import io.github.drompincen.reportscheduler.protocol.api.RunRecordResponse;
import io.github.drompincen.reportscheduler.protocol.api.ScheduleRequest;
import io.github.drompincen.reportscheduler.protocol.api.ScheduleResponse;
import io.github.drompincen.reportscheduler.runtime.history.RunHistoryService;
import io.github.drompincen.reportscheduler.runtime.schedule.ReportScheduleService;
import io.github.drompincen.reportscheduler.runtime.schedule.ScheduleNotFoundException;
import io.github.drompincen.reportscheduler.runtime.schedule.ScheduleValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

@RestController
@RequestMapping("/api/report-schedules")
public class ReportScheduleController {

    private static final Logger log = LoggerFactory.getLogger(ReportScheduleController.class);

    private final ReportScheduleService scheduleService;
    private final RunHistoryService runHistoryService;

    public ReportScheduleController(ReportScheduleService scheduleService, RunHistoryService runHistoryService) {
        this.scheduleService = scheduleService;
        this.runHistoryService = runHistoryService;
    }

    @PostMapping
    public ResponseEntity<?> create(@RequestBody ScheduleRequest req,
                                    @RequestHeader(value = "X-User", required = false) String user) {
        return handle(() -> ResponseEntity.status(HttpStatus.CREATED)
                .body(ReportResponses.toScheduleResponse(scheduleService.create(req, user))));
    }

    @GetMapping
    public List<ScheduleResponse> list(@RequestParam(required = false) Boolean enabled,
                                       @RequestParam(defaultValue = "false") boolean errored) {
        List<ReportScheduleDocument> schedules = errored
                ? scheduleService.listErrored()
                : scheduleService.list(enabled);
        return schedules.stream().map(ReportResponses::toScheduleResponse).toList();
    }

    @GetMapping("/{scheduleId}")
    public ResponseEntity<?> get(@PathVariable String scheduleId) {
        return handle(() -> ResponseEntity.ok(ReportResponses.toScheduleResponse(scheduleService.get(scheduleId))));
    }

    @PutMapping("/{scheduleId}")
    public ResponseEntity<?> update(@PathVariable String scheduleId, @RequestBody ScheduleRequest req) {
        return handle(() -> ResponseEntity.ok(
                ReportResponses.toScheduleResponse(scheduleService.update(scheduleId, req))));
    }

    @DeleteMapping("/{scheduleId}")
    public ResponseEntity<?> delete(@PathVariable String scheduleId) {
        return handle(() -> {
            scheduleService.delete(scheduleId);
            return ResponseEntity.noContent().build();
        });
    }

    @PostMapping("/{scheduleId}/enable")
    public ResponseEntity<?> enable(@PathVariable String scheduleId) {
        return handle(() -> ResponseEntity.ok(
                ReportResponses.toScheduleResponse(scheduleService.setEnabled(scheduleId, true))));
    }

    @PostMapping("/{scheduleId}/disable")
    public ResponseEntity<?> disable(@PathVariable String scheduleId) {
        return handle(() -> ResponseEntity.ok(
                ReportResponses.toScheduleResponse(scheduleService.setEnabled(scheduleId, false))));
    }

    @PostMapping("/{scheduleId}/trigger")
    public ResponseEntity<?> trigger(@PathVariable String scheduleId) {
        return handle(() -> ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ReportResponses.toScheduleResponse(scheduleService.triggerNow(scheduleId))));
    }

    @GetMapping("/{scheduleId}/status")
    public ResponseEntity<?> status(@PathVariable String scheduleId) {
        return handle(() -> ResponseEntity.ok(ReportResponses.toStatusResponse(scheduleService.status(scheduleId))));
    }

    @GetMapping("/{scheduleId}/runs")
    public ResponseEntity<?> runs(@PathVariable String scheduleId,
                                  @RequestParam(defaultValue = "0") int page,
                                  @RequestParam(defaultValue = "20") int size) {
        return handle(() -> {
            scheduleService.get(scheduleId);
            Page<RunRecordResponse> runs = runHistoryService.listRuns(scheduleId, page, size)
                    .map(ReportResponses::toRunResponse);
            return ResponseEntity.ok(runs);
        });
    }

    private ResponseEntity<?> handle(Supplier<ResponseEntity<?>> action) {
        try {
            return action.get();
        } catch (ScheduleValidationException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage(), "details", e.getErrors()));
        } catch (ScheduleNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (OptimisticLockingFailureException e) {
            log.debug("Concurrent modification: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "Schedule was modified concurrently, reload and retry"));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }
}
