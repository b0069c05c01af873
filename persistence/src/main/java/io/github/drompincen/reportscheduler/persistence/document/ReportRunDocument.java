package io.github.drompincen.reportscheduler.persistence.document;

import io.github.drompincen.reportscheduler.protocol.api.OutputFormat;
import io.github.drompincen.reportscheduler.protocol.api.ResultStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Document(collection = "report_runs")
@CompoundIndex(name = "schedule_fired_idx", def = "{'scheduleId': 1, 'firedAt': -1}")
public class ReportRunDocument {

    @Id
    private String runId;
    private String scheduleId;
    private Instant scheduledFor;
    @Indexed
    private Instant firedAt;
    private Instant finishedAt;
    private long durationMs;
    private ResultStatus resultStatus;
    private String errorMessage;
    private String artifactRef;
    private List<OutputFormat> outputFormats = new ArrayList<>();
    private String instanceId;
    private Instant createdAt;

    public ReportRunDocument() {}

    public String getRunId() { return runId; }
    public void setRunId(String runId) { this.runId = runId; }
    public String getScheduleId() { return scheduleId; }
    public void setScheduleId(String scheduleId) { this.scheduleId = scheduleId; }
    public Instant getScheduledFor() { return scheduledFor; }
    public void setScheduledFor(Instant scheduledFor) { this.scheduledFor = scheduledFor; }
    public Instant getFiredAt() { return firedAt; }
    public void setFiredAt(Instant firedAt) { this.firedAt = firedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public void setFinishedAt(Instant finishedAt) { this.finishedAt = finishedAt; }
    public long getDurationMs() { return durationMs; }
    public void setDurationMs(long durationMs) { this.durationMs = durationMs; }
    public ResultStatus getResultStatus() { return resultStatus; }
    public void setResultStatus(ResultStatus resultStatus) { this.resultStatus = resultStatus; }
    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }
    public String getArtifactRef() { return artifactRef; }
    public void setArtifactRef(String artifactRef) { this.artifactRef = artifactRef; }
    public List<OutputFormat> getOutputFormats() { return outputFormats; }
    public void setOutputFormats(List<OutputFormat> outputFormats) { this.outputFormats = outputFormats; }
    public String getInstanceId() { return instanceId; }
    public void setInstanceId(String instanceId) { this.instanceId = instanceId; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
