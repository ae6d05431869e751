package com.fiscalbook.ledger.snapshot;

import static com.fiscalbook.ledger.LedgerFixtures.book;
import static com.fiscalbook.ledger.LedgerFixtures.credit;
import static com.fiscalbook.ledger.LedgerFixtures.data;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fiscalbook.ledger.exception.InvalidRequestException;
import com.fiscalbook.ledger.exception.ProtectedResourceException;
import com.fiscalbook.ledger.exception.ResourceNotFoundException;
import com.fiscalbook.ledger.model.Annotation;
import com.fiscalbook.ledger.model.FiscalBookSnapshot;
import com.fiscalbook.ledger.model.ScheduleFrequency;
import com.fiscalbook.ledger.model.SnapshotTransaction;
import com.fiscalbook.ledger.model.Transaction;
import com.fiscalbook.ledger.repository.SnapshotStore.PageResult;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SnapshotServiceTest {

    private final UUID bookId = UUID.randomUUID();
    private InMemoryLedger ledger;
    private SnapshotService service;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryLedger();
        service = ledger.snapshotService;
        ledger.seed(book(bookId, "January"), credit(bookId, "sale", "100"));
    }

    @Test
    void listsNewestFirstWithTagFilterAndPaging() {
        FiscalBookSnapshot first = capture("first", List.of("q1"));
        FiscalBookSnapshot second = capture("second", List.of("q1", "audit"));
        FiscalBookSnapshot third = capture("third", List.of("audit"));

        PageResult<FiscalBookSnapshot> all = service.listSnapshots(bookId, null, null, null);
        PageResult<FiscalBookSnapshot> audited = service.listSnapshots(bookId, List.of("AUDIT"), null, null);
        PageResult<FiscalBookSnapshot> secondPage = service.listSnapshots(bookId, null, 1, 1);

        assertThat(all.items()).extracting(FiscalBookSnapshot::id).containsExactly(third.id(), second.id(), first.id());
        assertThat(audited.items()).extracting(FiscalBookSnapshot::id).containsExactly(third.id(), second.id());
        assertThat(secondPage.total()).isEqualTo(3);
        assertThat(secondPage.items()).extracting(FiscalBookSnapshot::id).containsExactly(second.id());
    }

    @Test
    void rejectsInvalidPaging() {
        assertThatThrownBy(() -> service.listSnapshots(bookId, null, 0, null))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> service.listSnapshots(bookId, null, null, -1))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void oversizedLimitIsCappedAtTheMaximum() {
        capture("only", List.of());

        assertThat(service.listSnapshots(bookId, null, 10_000, 0).items()).hasSize(1);
    }

    @Test
    void unknownSnapshotIsNotFound() {
        UUID missing = UUID.randomUUID();

        assertThatThrownBy(() -> service.getSnapshot(missing)).isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> service.listSnapshotTransactions(missing, null, null))
                .isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> service.deleteSnapshot(missing)).isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> service.updateTags(missing, List.of("x"))).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void snapshotTransactionsComeNewestDateFirst() {
        Transaction older = new Transaction(UUID.randomUUID(), bookId,
                data("older", "1", "debit", Instant.parse("2023-12-01T00:00:00Z")));
        ledger.runner.inTransaction(uow -> ledger.transactions.save(uow, older));
        FiscalBookSnapshot snapshot = capture("x", List.of());

        PageResult<SnapshotTransaction> page = service.listSnapshotTransactions(snapshot.id(), 1, 0);

        assertThat(page.total()).isEqualTo(2);
        assertThat(page.items()).singleElement()
                .satisfies(copy -> assertThat(copy.transactionData().transactionName()).isEqualTo("sale"));
    }

    @Test
    void tagsAreNormalizedAndReplaced() {
        FiscalBookSnapshot snapshot = capture("x", List.of("old"));

        FiscalBookSnapshot updated = service.updateTags(snapshot.id(), List.of(" Year-End ", "year-end", "Q4"));

        assertThat(updated.tags()).containsExactly("year-end", "q4");
        assertThatThrownBy(() -> service.updateTags(snapshot.id(), null))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("array");
    }

    @Test
    void protectedSnapshotCannotBeDeletedUntilUnprotected() {
        FiscalBookSnapshot snapshot = capture("x", List.of());
        service.setProtection(snapshot.id(), true);

        assertThatThrownBy(() -> service.deleteSnapshot(snapshot.id()))
                .isInstanceOf(ProtectedResourceException.class);

        service.setProtection(snapshot.id(), false);
        assertThat(service.deleteSnapshot(snapshot.id()).id()).isEqualTo(snapshot.id());
        assertThat(ledger.copies(snapshot.id())).isEmpty();
        assertThatThrownBy(() -> service.getSnapshot(snapshot.id())).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void protectionFlagIsRequired() {
        FiscalBookSnapshot snapshot = capture("x", List.of());

        assertThatThrownBy(() -> service.setProtection(snapshot.id(), null))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("boolean");
    }

    @Test
    void deleteAllRemovesSnapshotsAndScheduleTogether() {
        capture("a", List.of());
        capture("b", List.of());
        ledger.scheduleEngine.updateSchedule(bookId,
                new ScheduleSettings(true, ScheduleFrequency.MONTHLY, null, 1, null, null));

        assertThat(service.deleteAllForBook(bookId)).isEqualTo(2);
        assertThat(ledger.snapshots(bookId)).isEmpty();
        assertThat(ledger.scheduleEngine.getSchedule(bookId)).isEmpty();
    }

    @Test
    void deleteAllRefusesWhenAnySnapshotIsProtected() {
        capture("a", List.of());
        FiscalBookSnapshot guarded = capture("b", List.of());
        service.setProtection(guarded.id(), true);
        ledger.scheduleEngine.updateSchedule(bookId,
                new ScheduleSettings(true, ScheduleFrequency.MONTHLY, null, 1, null, null));

        assertThatThrownBy(() -> service.deleteAllForBook(bookId)).isInstanceOf(ProtectedResourceException.class);
        assertThat(ledger.snapshots(bookId)).hasSize(2);
        assertThat(ledger.scheduleEngine.getSchedule(bookId)).isPresent();
    }

    @Test
    void annotationsAppendWithDefaultAuthor() {
        FiscalBookSnapshot snapshot = capture("x", List.of());

        service.addAnnotation(snapshot.id(), "reviewed", "ana");
        FiscalBookSnapshot annotated = service.addAnnotation(snapshot.id(), "  archived copy ", null);

        assertThat(annotated.annotations()).extracting(Annotation::content).containsExactly("reviewed", "archived copy");
        assertThat(annotated.annotations()).extracting(Annotation::createdBy).containsExactly("ana", Annotation.DEFAULT_AUTHOR);
        assertThat(annotated.annotations().get(1).createdAt()).isEqualTo(ledger.clock.instant());
        assertThatThrownBy(() -> service.addAnnotation(snapshot.id(), " ", null))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void transactionAnnotationMustBelongToTheSnapshot() {
        FiscalBookSnapshot snapshot = capture("x", List.of());
        FiscalBookSnapshot other = capture("y", List.of());
        SnapshotTransaction copy = ledger.copies(snapshot.id()).get(0);

        SnapshotTransaction annotated = service.addTransactionAnnotation(snapshot.id(), copy.id(), "checked", "ana");

        assertThat(annotated.annotations()).singleElement()
                .satisfies(a -> assertThat(a.content()).isEqualTo("checked"));
        assertThatThrownBy(() -> service.addTransactionAnnotation(other.id(), copy.id(), "checked", null))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    private FiscalBookSnapshot capture(String name, List<String> tags) {
        FiscalBookSnapshot snapshot = ledger.capture.capture(bookId, CaptureRequest.manual(name, null, tags));
        ledger.clock.advance(Duration.ofMinutes(1));
        return snapshot;
    }
}
