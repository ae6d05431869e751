package com.fiscalbook.ledger.service;

import com.fiscalbook.ledger.exception.InvalidRequestException;
import com.fiscalbook.ledger.exception.ResourceNotFoundException;
import com.fiscalbook.ledger.model.FiscalBook;
import com.fiscalbook.ledger.model.FiscalBookSnapshot;
import com.fiscalbook.ledger.model.FiscalBookStatus;
import com.fiscalbook.ledger.repository.FiscalBookRepository;
import com.fiscalbook.ledger.repository.UnitOfWorkRunner;
import com.fiscalbook.ledger.snapshot.ScheduleEngine;
import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Service
public class FiscalBookService {

    private static final Logger log = LoggerFactory.getLogger(FiscalBookService.class);

    private final UnitOfWorkRunner unitOfWorkRunner;
    private final FiscalBookRepository fiscalBookRepository;
    private final ScheduleEngine scheduleEngine;
    private final Clock clock;

    @Autowired
    public FiscalBookService(UnitOfWorkRunner unitOfWorkRunner,
                             FiscalBookRepository fiscalBookRepository,
                             ScheduleEngine scheduleEngine) {
        this(unitOfWorkRunner, fiscalBookRepository, scheduleEngine, Clock.systemUTC());
    }

    FiscalBookService(UnitOfWorkRunner unitOfWorkRunner,
                      FiscalBookRepository fiscalBookRepository,
                      ScheduleEngine scheduleEngine,
                      Clock clock) {
        this.unitOfWorkRunner = unitOfWorkRunner;
        this.fiscalBookRepository = fiscalBookRepository;
        this.scheduleEngine = scheduleEngine;
        this.clock = clock;
    }

    public FiscalBook getFiscalBook(UUID fiscalBookId) {
        return unitOfWorkRunner.readOnly(uow -> fiscalBookRepository.findById(uow, fiscalBookId))
                .orElseThrow(() -> ResourceNotFoundException.fiscalBook(fiscalBookId));
    }

    /**
     * Moves the book to {@code newStatus}. A configured before-status-change snapshot is taken first;
     * its outcome never blocks the transition.
     */
    public StatusChange changeStatus(UUID fiscalBookId, FiscalBookStatus newStatus) {
        if (newStatus == null) {
            throw new InvalidRequestException("status is required");
        }
        FiscalBook current = getFiscalBook(fiscalBookId);
        Optional<FiscalBookSnapshot> safetySnapshot = scheduleEngine.createBeforeStatusChangeSnapshot(fiscalBookId, newStatus);

        FiscalBook updated = unitOfWorkRunner.inTransaction(uow -> {
            FiscalBook book = fiscalBookRepository.findById(uow, fiscalBookId)
                    .orElseThrow(() -> ResourceNotFoundException.fiscalBook(fiscalBookId));
            return fiscalBookRepository.save(uow, book.withStatus(newStatus, clock.instant()));
        });
        log.info("Fiscal book {} status {} -> {} (safety snapshot: {})",
                fiscalBookId, current.status().value(), newStatus.value(),
                safetySnapshot.map(s -> s.id().toString()).orElse("none"));
        return new StatusChange(updated, safetySnapshot.map(FiscalBookSnapshot::id).orElse(null));
    }

    public record StatusChange(FiscalBook fiscalBook, UUID snapshotId) {
    }
}
