package io.github.drompincen.reportscheduler.persistence.document;

import io.github.drompincen.reportscheduler.protocol.api.Frequency;
import io.github.drompincen.reportscheduler.protocol.api.OutputFormat;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Document(collection = "report_schedules")
@CompoundIndex(name = "due_idx", def = "{'enabled': 1, 'errorState': 1, 'nextRun': 1}")
public class ReportScheduleDocument {

    @Id
    private String scheduleId;
    private String name;
    private String description;
    private String reportId;
    private Frequency frequency;
    /** Wall-clock "HH:mm" in {@link #timezone}. */
    private String timeOfDay;
    private String timezone = "UTC";
    private Integer dayOfWeek;
    private Integer dayOfMonth;
    private boolean enabled = true;
    private Instant nextRun;
    private Instant lastRun;
    private long runCount;
    private long failureCount;
    private List<OutputFormat> outputFormats = new ArrayList<>();
    private List<String> recipients = new ArrayList<>();
    private boolean errorState;
    private String lastError;
    // claim marker, written only through conditional updates
    private String claimOwner;
    private Instant claimLeaseUntil;
    private String createdBy;
    @Version
    private long version;
    private Instant createdAt;
    private Instant updatedAt;

    public ReportScheduleDocument() {}

    public String getScheduleId() { return scheduleId; }
    public void setScheduleId(String scheduleId) { this.scheduleId = scheduleId; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public String getReportId() { return reportId; }
    public void setReportId(String reportId) { this.reportId = reportId; }
    public Frequency getFrequency() { return frequency; }
    public void setFrequency(Frequency frequency) { this.frequency = frequency; }
    public String getTimeOfDay() { return timeOfDay; }
    public void setTimeOfDay(String timeOfDay) { this.timeOfDay = timeOfDay; }
    public String getTimezone() { return timezone; }
    public void setTimezone(String timezone) { this.timezone = timezone; }
    public Integer getDayOfWeek() { return dayOfWeek; }
    public void setDayOfWeek(Integer dayOfWeek) { this.dayOfWeek = dayOfWeek; }
    public Integer getDayOfMonth() { return dayOfMonth; }
    public void setDayOfMonth(Integer dayOfMonth) { this.dayOfMonth = dayOfMonth; }
    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public Instant getNextRun() { return nextRun; }
    public void setNextRun(Instant nextRun) { this.nextRun = nextRun; }
    public Instant getLastRun() { return lastRun; }
    public void setLastRun(Instant lastRun) { this.lastRun = lastRun; }
    public long getRunCount() { return runCount; }
    public void setRunCount(long runCount) { this.runCount = runCount; }
    public long getFailureCount() { return failureCount; }
    public void setFailureCount(long failureCount) { this.failureCount = failureCount; }
    public List<OutputFormat> getOutputFormats() { return outputFormats; }
    public void setOutputFormats(List<OutputFormat> outputFormats) { this.outputFormats = outputFormats; }
    public List<String> getRecipients() { return recipients; }
    public void setRecipients(List<String> recipients) { this.recipients = recipients; }
    public boolean isErrorState() { return errorState; }
    public void setErrorState(boolean errorState) { this.errorState = errorState; }
    public String getLastError() { return lastError; }
    public void setLastError(String lastError) { this.lastError = lastError; }
    public String getClaimOwner() { return claimOwner; }
    public void setClaimOwner(String claimOwner) { this.claimOwner = claimOwner; }
    public Instant getClaimLeaseUntil() { return claimLeaseUntil; }
    public void setClaimLeaseUntil(Instant claimLeaseUntil) { this.claimLeaseUntil = claimLeaseUntil; }
    public String getCreatedBy() { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = createdBy; }
    public long getVersion() { return version; }
    public void setVersion(long version) { this.version = version; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
