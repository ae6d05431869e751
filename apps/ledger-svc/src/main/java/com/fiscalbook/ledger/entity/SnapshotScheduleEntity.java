package com.fiscalbook.ledger.entity;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "snapshot_schedules")
public class SnapshotScheduleEntity {
    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "fiscal_book_id", nullable = false, unique = true)
    private UUID fiscalBookId;

    @Column(name = "enabled", nullable = false)
    private boolean enabled;

    @Column(name = "frequency", nullable = false, length = 32)
    private String frequency;

    @Column(name = "day_of_week")
    private Integer dayOfWeek;

    @Column(name = "day_of_month")
    private Integer dayOfMonth;

    @Column(name = "retention_count", nullable = false)
    private int retentionCount;

    @ElementCollection
    @CollectionTable(name = "snapshot_schedule_auto_tags", joinColumns = @JoinColumn(name = "schedule_id"))
    @OrderColumn(name = "position")
    @Column(name = "tag", nullable = false)
    private List<String> autoTags = new ArrayList<>();

    @Column(name = "last_executed_at")
    private Instant lastExecutedAt;

    @Column(name = "next_execution_at")
    private Instant nextExecutionAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public SnapshotScheduleEntity() {}

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getFiscalBookId() { return fiscalBookId; }
    public void setFiscalBookId(UUID fiscalBookId) { this.fiscalBookId = fiscalBookId; }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getFrequency() { return frequency; }
    public void setFrequency(String frequency) { this.frequency = frequency; }

    public Integer getDayOfWeek() { return dayOfWeek; }
    public void setDayOfWeek(Integer dayOfWeek) { this.dayOfWeek = dayOfWeek; }

    public Integer getDayOfMonth() { return dayOfMonth; }
    public void setDayOfMonth(Integer dayOfMonth) { this.dayOfMonth = dayOfMonth; }

    public int getRetentionCount() { return retentionCount; }
    public void setRetentionCount(int retentionCount) { this.retentionCount = retentionCount; }

    public List<String> getAutoTags() { return autoTags; }
    public void setAutoTags(List<String> autoTags) { this.autoTags = autoTags; }

    public Instant getLastExecutedAt() { return lastExecutedAt; }
    public void setLastExecutedAt(Instant lastExecutedAt) { this.lastExecutedAt = lastExecutedAt; }

    public Instant getNextExecutionAt() { return nextExecutionAt; }
    public void setNextExecutionAt(Instant nextExecutionAt) { this.nextExecutionAt = nextExecutionAt; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
