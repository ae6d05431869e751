package com.fiscalbook.ledger.controller;

import static com.fiscalbook.ledger.LedgerFixtures.book;
import static com.fiscalbook.ledger.LedgerFixtures.credit;
import static com.fiscalbook.ledger.LedgerFixtures.debit;
import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fiscalbook.ledger.repository.FiscalBookRepository;
import com.fiscalbook.ledger.repository.TransactionRepository;
import com.fiscalbook.ledger.repository.UnitOfWorkRunner;
import com.fiscalbook.ledger.security.TraceIdFilter;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("memory")
class FiscalBookSnapshotsControllerTest {

    @Autowired
    MockMvc mockMvc;

    @Autowired
    UnitOfWorkRunner unitOfWorkRunner;

    @Autowired
    FiscalBookRepository fiscalBookRepository;

    @Autowired
    TransactionRepository transactionRepository;

    private UUID bookId;

    @BeforeEach
    void seedBook() {
        bookId = UUID.randomUUID();
        unitOfWorkRunner.inTransaction(uow -> {
            fiscalBookRepository.save(uow, book(bookId, "January"));
            transactionRepository.saveAll(uow, List.of(credit(bookId, "sale", "100"), debit(bookId, "rent", "50")));
            return null;
        });
    }

    @Test
    void createSnapshotReturnsCreatedWithStatistics() throws Exception {
        mockMvc.perform(post("/fiscal-book/{bookId}/snapshots", bookId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Month end\",\"description\":\"before close\",\"tags\":[\"Audit\"]}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("Snapshot created successfully"))
                .andExpect(jsonPath("$.data.snapshotName").value("Month end"))
                .andExpect(jsonPath("$.data.originalFiscalBookId").value(bookId.toString()))
                .andExpect(jsonPath("$.data.creationSource").value("manual"))
                .andExpect(jsonPath("$.data.tags[0]").value("audit"))
                .andExpect(jsonPath("$.data.isProtected").value(false))
                .andExpect(jsonPath("$.data.statistics.transactionCount").value(2))
                .andExpect(jsonPath("$.data.statistics.netAmount").value(50.0));
    }

    @Test
    void createIgnoresNullAndBlankTags() throws Exception {
        mockMvc.perform(post("/fiscal-book/{bookId}/snapshots", bookId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Month end\",\"tags\":[\"a\",null,\" \"]}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.tags.length()").value(1))
                .andExpect(jsonPath("$.data.tags[0]").value("a"));
    }

    @Test
    void createWithoutBodyUsesDefaults() throws Exception {
        mockMvc.perform(post("/fiscal-book/{bookId}/snapshots", bookId))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.snapshotName").value(org.hamcrest.Matchers.startsWith("Snapshot ")));
    }

    @Test
    void createForUnknownBookIsNotFound() throws Exception {
        UUID missing = UUID.randomUUID();
        mockMvc.perform(post("/fiscal-book/{bookId}/snapshots", missing)
                        .header(TraceIdFilter.TRACE_HEADER, "trace-123")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isNotFound())
                .andExpect(header().string(TraceIdFilter.TRACE_HEADER, "trace-123"))
                .andExpect(jsonPath("$.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.details.resource").value("Fiscal book"))
                .andExpect(jsonPath("$.details.id").value(missing.toString()))
                .andExpect(jsonPath("$.traceId").value("trace-123"));
    }

    @Test
    void listFiltersByTagsAndReportsPagination() throws Exception {
        create("{\"name\":\"a\",\"tags\":[\"q1\"]}");
        create("{\"name\":\"b\",\"tags\":[\"q1\",\"audit\"]}");
        create("{\"name\":\"c\",\"tags\":[\"audit\"]}");

        mockMvc.perform(get("/fiscal-book/{bookId}/snapshots", bookId).param("tags", "q1, audit"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(1))
                .andExpect(jsonPath("$.data[0].snapshotName").value("b"))
                .andExpect(jsonPath("$.pagination.total").value(1))
                .andExpect(jsonPath("$.pagination.hasMore").value(false));

        mockMvc.perform(get("/fiscal-book/{bookId}/snapshots", bookId).param("limit", "2").param("skip", "0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(2))
                .andExpect(jsonPath("$.pagination.total").value(3))
                .andExpect(jsonPath("$.pagination.limit").value(2))
                .andExpect(jsonPath("$.pagination.hasMore").value(true));
    }

    @Test
    void invalidPagingIsRejected() throws Exception {
        mockMvc.perform(get("/fiscal-book/{bookId}/snapshots", bookId).param("limit", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }

    @Test
    void deleteAllReportsDeletedCount() throws Exception {
        create("{\"name\":\"a\"}");
        create("{\"name\":\"b\"}");

        mockMvc.perform(delete("/fiscal-book/{bookId}/snapshots", bookId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.deletedCount").value(2));
    }

    @Test
    void scheduleLifecycle() throws Exception {
        mockMvc.perform(get("/fiscal-book/{bookId}/snapshots/schedule", bookId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("No schedule configured"))
                .andExpect(jsonPath("$.data").doesNotExist());

        mockMvc.perform(put("/fiscal-book/{bookId}/snapshots/schedule", bookId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"frequency\":\"weekly\",\"dayOfWeek\":1,\"retentionCount\":4,\"autoTags\":[\"Weekly\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.frequency").value("weekly"))
                .andExpect(jsonPath("$.data.enabled").value(true))
                .andExpect(jsonPath("$.data.retentionCount").value(4))
                .andExpect(jsonPath("$.data.autoTags[0]").value("weekly"))
                .andExpect(jsonPath("$.data.nextExecutionAt").exists());

        mockMvc.perform(delete("/fiscal-book/{bookId}/snapshots/schedule", bookId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.enabled").value(false))
                .andExpect(jsonPath("$.data.nextExecutionAt").doesNotExist());
    }

    @Test
    void weeklyScheduleWithoutDayIsRejected() throws Exception {
        mockMvc.perform(put("/fiscal-book/{bookId}/snapshots/schedule", bookId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"frequency\":\"weekly\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"))
                .andExpect(jsonPath("$.message").value(org.hamcrest.Matchers.containsString("dayOfWeek")));

        mockMvc.perform(put("/fiscal-book/{bookId}/snapshots/schedule", bookId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"frequency\":\"weekly\",\"dayOfWeek\":9}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void disablingMissingScheduleIsNotFound() throws Exception {
        mockMvc.perform(delete("/fiscal-book/{bookId}/snapshots/schedule", bookId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void malformedBookIdIsBadRequest() throws Exception {
        mockMvc.perform(get("/fiscal-book/{bookId}/snapshots", "not-a-uuid"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }

    @Test
    void tagParameterIsSplitOnCommas() {
        assertThat(FiscalBookSnapshotsController.parseTags(" a, ,b ")).containsExactly("a", "b");
        assertThat(FiscalBookSnapshotsController.parseTags(null)).isEmpty();
    }

    private void create(String body) throws Exception {
        mockMvc.perform(post("/fiscal-book/{bookId}/snapshots", bookId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated());
    }
}
