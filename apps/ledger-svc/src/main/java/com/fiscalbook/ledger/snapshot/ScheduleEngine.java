package com.fiscalbook.ledger.snapshot;

import com.fiscalbook.ledger.config.FiscalbookProperties;
import com.fiscalbook.ledger.exception.InvalidRequestException;
import com.fiscalbook.ledger.exception.ResourceNotFoundException;
import com.fiscalbook.ledger.model.CreationSource;
import com.fiscalbook.ledger.model.FiscalBookSnapshot;
import com.fiscalbook.ledger.model.FiscalBookStatus;
import com.fiscalbook.ledger.model.ScheduleFrequency;
import com.fiscalbook.ledger.model.SnapshotSchedule;
import com.fiscalbook.ledger.repository.FiscalBookRepository;
import com.fiscalbook.ledger.repository.SnapshotStore;
import com.fiscalbook.ledger.repository.UnitOfWorkRunner;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Per-book snapshot schedules. Periodic schedules run when a caller invokes {@link #executeDue(Instant)};
 * event schedules run from {@link #createBeforeStatusChangeSnapshot(UUID, FiscalBookStatus)}.
 */
@Service
public class ScheduleEngine {

    private static final Logger log = LoggerFactory.getLogger(ScheduleEngine.class);

    static final String BEFORE_STATUS_CHANGE_TAG = "before-status-change";

    private final UnitOfWorkRunner unitOfWorkRunner;
    private final FiscalBookRepository fiscalBookRepository;
    private final SnapshotStore snapshotStore;
    private final SnapshotCapture snapshotCapture;
    private final SnapshotRetentionManager retentionManager;
    private final FiscalbookProperties.Snapshots settings;
    private final ZoneId zone;
    private final Clock clock;

    @Autowired
    public ScheduleEngine(UnitOfWorkRunner unitOfWorkRunner,
                          FiscalBookRepository fiscalBookRepository,
                          SnapshotStore snapshotStore,
                          SnapshotCapture snapshotCapture,
                          SnapshotRetentionManager retentionManager,
                          FiscalbookProperties properties) {
        this(unitOfWorkRunner, fiscalBookRepository, snapshotStore, snapshotCapture, retentionManager, properties, Clock.systemUTC());
    }

    ScheduleEngine(UnitOfWorkRunner unitOfWorkRunner,
                   FiscalBookRepository fiscalBookRepository,
                   SnapshotStore snapshotStore,
                   SnapshotCapture snapshotCapture,
                   SnapshotRetentionManager retentionManager,
                   FiscalbookProperties properties,
                   Clock clock) {
        this.unitOfWorkRunner = unitOfWorkRunner;
        this.fiscalBookRepository = fiscalBookRepository;
        this.snapshotStore = snapshotStore;
        this.snapshotCapture = snapshotCapture;
        this.retentionManager = retentionManager;
        this.settings = properties.snapshots();
        this.zone = settings.zoneId();
        this.clock = clock;
    }

    /**
     * Next periodic run strictly after {@code now}, at midnight in the configured zone; null for event schedules.
     * Weekly {@code dayOfWeek} counts from 0 = Sunday, and the current weekday maps to a week later.
     * A monthly {@code dayOfMonth} past the end of a month falls on that month's last day.
     */
    public Instant nextExecution(ScheduleFrequency frequency, Integer dayOfWeek, Integer dayOfMonth, Instant now) {
        ZonedDateTime local = now.atZone(zone);
        return switch (frequency) {
            case WEEKLY -> {
                int target = dayOfWeek == null ? 0 : dayOfWeek;
                int today = local.getDayOfWeek().getValue() % 7;
                int days = Math.floorMod(target - today, 7);
                if (days == 0) {
                    days = 7;
                }
                yield local.toLocalDate().plusDays(days).atStartOfDay(zone).toInstant();
            }
            case MONTHLY -> {
                int target = dayOfMonth == null ? 1 : dayOfMonth;
                YearMonth month = YearMonth.from(local);
                Instant candidate = dayIn(month, target).atStartOfDay(zone).toInstant();
                if (!candidate.isAfter(now)) {
                    candidate = dayIn(month.plusMonths(1), target).atStartOfDay(zone).toInstant();
                }
                yield candidate;
            }
            case BEFORE_STATUS_CHANGE -> null;
        };
    }

    private static LocalDate dayIn(YearMonth month, int dayOfMonth) {
        return month.atDay(Math.min(dayOfMonth, month.lengthOfMonth()));
    }

    public ScheduleExecutionResult executeDue() {
        return executeDue(clock.instant());
    }

    /**
     * Runs every enabled schedule due at {@code now}. A failing schedule is recorded and the rest still run.
     */
    public ScheduleExecutionResult executeDue(Instant now) {
        List<SnapshotSchedule> due = unitOfWorkRunner.readOnly(uow -> snapshotStore.findDueSchedules(uow, now));
        List<ScheduleExecutionResult.Executed> executed = new ArrayList<>();
        List<ScheduleExecutionResult.Failure> errors = new ArrayList<>();
        for (SnapshotSchedule schedule : due) {
            UUID bookId = schedule.fiscalBookId();
            try {
                FiscalBookSnapshot snapshot = snapshotCapture.capture(bookId, new CaptureRequest(
                        "Scheduled snapshot " + LocalDate.ofInstant(now, zone),
                        "Automatic snapshot created by " + schedule.frequency().value() + " schedule",
                        schedule.autoTags(),
                        CreationSource.SCHEDULED
                ));
                Instant nextRun = nextExecution(schedule.frequency(), schedule.dayOfWeek(), schedule.dayOfMonth(), now);
                recordExecution(bookId, now, nextRun);
                retentionManager.cleanup(bookId, schedule.retentionCount());
                executed.add(new ScheduleExecutionResult.Executed(bookId, snapshot.id(), nextRun));
            } catch (RuntimeException e) {
                log.error("Scheduled snapshot failed for fiscal book {}: {}", bookId, e.getMessage(), e);
                errors.add(new ScheduleExecutionResult.Failure(bookId, e.getMessage()));
            }
        }
        log.info("Schedule run at {}: {} executed, {} failed", now, executed.size(), errors.size());
        return new ScheduleExecutionResult(executed, errors);
    }

    /**
     * Safety snapshot ahead of a status transition, when the book has an enabled before-status-change schedule.
     * Never throws: failures are logged and reported as empty so the transition can proceed.
     */
    public Optional<FiscalBookSnapshot> createBeforeStatusChangeSnapshot(UUID fiscalBookId, FiscalBookStatus newStatus) {
        try {
            Optional<SnapshotSchedule> schedule = unitOfWorkRunner.readOnly(uow -> snapshotStore.findSchedule(uow, fiscalBookId));
            if (schedule.isEmpty()
                    || !schedule.get().enabled()
                    || schedule.get().frequency() != ScheduleFrequency.BEFORE_STATUS_CHANGE) {
                return Optional.empty();
            }
            Instant now = clock.instant();
            List<String> tags = new ArrayList<>(schedule.get().autoTags());
            tags.add(BEFORE_STATUS_CHANGE_TAG);
            String status = newStatus == null ? "unknown" : newStatus.value();
            FiscalBookSnapshot snapshot = snapshotCapture.capture(fiscalBookId, new CaptureRequest(
                    "Before " + status + " - " + LocalDate.ofInstant(now, zone),
                    "Automatic snapshot created before status change to " + status,
                    tags,
                    CreationSource.BEFORE_STATUS_CHANGE
            ));
            recordExecution(fiscalBookId, now, null);
            retentionManager.cleanup(fiscalBookId, schedule.get().retentionCount());
            return Optional.of(snapshot);
        } catch (RuntimeException e) {
            log.error("Before-status-change snapshot failed for fiscal book {}; status change proceeds", fiscalBookId, e);
            return Optional.empty();
        }
    }

    private void recordExecution(UUID fiscalBookId, Instant executedAt, Instant nextRun) {
        unitOfWorkRunner.inTransaction(uow -> snapshotStore.findSchedule(uow, fiscalBookId)
                .map(current -> snapshotStore.saveSchedule(uow, current.executed(executedAt, nextRun))));
    }

    public Optional<SnapshotSchedule> getSchedule(UUID fiscalBookId) {
        return unitOfWorkRunner.readOnly(uow -> snapshotStore.findSchedule(uow, fiscalBookId));
    }

    public SnapshotSchedule updateSchedule(UUID fiscalBookId, ScheduleSettings request) {
        validate(request);
        boolean enabled = request.enabled() == null || request.enabled();
        int retentionCount = request.retentionCount() != null ? request.retentionCount() : settings.defaultRetentionCount();
        Integer dayOfMonth = request.frequency() == ScheduleFrequency.MONTHLY && request.dayOfMonth() == null
                ? Integer.valueOf(1)
                : request.dayOfMonth();
        Instant now = clock.instant();

        SnapshotSchedule saved = unitOfWorkRunner.inTransaction(uow -> {
            fiscalBookRepository.findById(uow, fiscalBookId)
                    .orElseThrow(() -> ResourceNotFoundException.fiscalBook(fiscalBookId));
            Optional<SnapshotSchedule> existing = snapshotStore.findSchedule(uow, fiscalBookId);
            SnapshotSchedule schedule = new SnapshotSchedule(
                    existing.map(SnapshotSchedule::id).orElseGet(UUID::randomUUID),
                    fiscalBookId,
                    enabled,
                    request.frequency(),
                    request.dayOfWeek(),
                    dayOfMonth,
                    retentionCount,
                    request.autoTags(),
                    existing.map(SnapshotSchedule::lastExecutedAt).orElse(null),
                    enabled ? nextExecution(request.frequency(), request.dayOfWeek(), dayOfMonth, now) : null,
                    existing.map(SnapshotSchedule::createdAt).orElse(now),
                    now
            );
            return snapshotStore.saveSchedule(uow, schedule);
        });
        log.info("Snapshot schedule for fiscal book {} set to {} (enabled={}, next={})",
                fiscalBookId, saved.frequency().value(), saved.enabled(), saved.nextExecutionAt());
        return saved;
    }

    public SnapshotSchedule disableSchedule(UUID fiscalBookId) {
        Instant now = clock.instant();
        SnapshotSchedule disabled = unitOfWorkRunner.inTransaction(uow -> snapshotStore.findSchedule(uow, fiscalBookId)
                .map(current -> snapshotStore.saveSchedule(uow, current.disabled(now)))
                .orElseThrow(() -> ResourceNotFoundException.schedule(fiscalBookId)));
        log.info("Snapshot schedule for fiscal book {} disabled", fiscalBookId);
        return disabled;
    }

    private void validate(ScheduleSettings request) {
        if (request == null || request.frequency() == null) {
            throw new InvalidRequestException("frequency is required");
        }
        if (request.frequency() == ScheduleFrequency.WEEKLY
                && (request.dayOfWeek() == null || request.dayOfWeek() < 0 || request.dayOfWeek() > 6)) {
            throw new InvalidRequestException("dayOfWeek must be between 0 (Sunday) and 6 for weekly schedules");
        }
        if (request.dayOfMonth() != null && (request.dayOfMonth() < 1 || request.dayOfMonth() > 31)) {
            throw new InvalidRequestException("dayOfMonth must be between 1 and 31");
        }
        if (request.retentionCount() != null
                && (request.retentionCount() < 1 || request.retentionCount() > settings.maxRetentionCount())) {
            throw new InvalidRequestException("retentionCount must be between 1 and " + settings.maxRetentionCount());
        }
    }
}
