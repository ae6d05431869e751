package com.fiscalbook.ledger.controller;

import static com.fiscalbook.ledger.LedgerFixtures.book;
import static com.fiscalbook.ledger.LedgerFixtures.credit;
import static com.fiscalbook.ledger.LedgerFixtures.debit;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fiscalbook.ledger.model.Transaction;
import com.fiscalbook.ledger.repository.FiscalBookRepository;
import com.fiscalbook.ledger.repository.TransactionRepository;
import com.fiscalbook.ledger.repository.UnitOfWorkRunner;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("memory")
class SnapshotsControllerTest {

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    @Autowired
    UnitOfWorkRunner unitOfWorkRunner;

    @Autowired
    FiscalBookRepository fiscalBookRepository;

    @Autowired
    TransactionRepository transactionRepository;

    private UUID bookId;
    private Transaction sale;

    @BeforeEach
    void seedBook() {
        bookId = UUID.randomUUID();
        sale = credit(bookId, "sale", "100");
        unitOfWorkRunner.inTransaction(uow -> {
            fiscalBookRepository.save(uow, book(bookId, "January"));
            transactionRepository.saveAll(uow, List.of(sale, debit(bookId, "rent", "50")));
            return null;
        });
    }

    @Test
    void getReturnsSnapshotAndItsTransactions() throws Exception {
        String snapshotId = createSnapshot("Month end");

        mockMvc.perform(get("/snapshots/{id}", snapshotId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.id").value(snapshotId))
                .andExpect(jsonPath("$.data.fiscalBookData.bookName").value("January"))
                .andExpect(jsonPath("$.data.fiscalBookData.status").value("open"));

        mockMvc.perform(get("/snapshots/{id}/transactions", snapshotId).param("limit", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(1))
                .andExpect(jsonPath("$.data[0].snapshotId").value(snapshotId))
                .andExpect(jsonPath("$.pagination.total").value(2))
                .andExpect(jsonPath("$.pagination.hasMore").value(true));
    }

    @Test
    void unknownSnapshotIsNotFound() throws Exception {
        mockMvc.perform(get("/snapshots/{id}", UUID.randomUUID()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.details.resource").value("Snapshot"));
    }

    @Test
    void protectedSnapshotRefusesDeletion() throws Exception {
        String snapshotId = createSnapshot("Keep me");

        mockMvc.perform(put("/snapshots/{id}/protection", snapshotId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"isProtected\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Snapshot protected"))
                .andExpect(jsonPath("$.data.isProtected").value(true));

        mockMvc.perform(delete("/snapshots/{id}", snapshotId))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("PROTECTED_RESOURCE"))
                .andExpect(jsonPath("$.details.snapshotId").value(snapshotId));

        mockMvc.perform(delete("/fiscal-book/{bookId}/snapshots", bookId))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("PROTECTED_RESOURCE"));

        mockMvc.perform(put("/snapshots/{id}/protection", snapshotId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"isProtected\":false}"))
                .andExpect(status().isOk());
        mockMvc.perform(delete("/snapshots/{id}", snapshotId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Snapshot deleted successfully"));
    }

    @Test
    void protectionRequiresBooleanFlag() throws Exception {
        String snapshotId = createSnapshot("x");

        mockMvc.perform(put("/snapshots/{id}/protection", snapshotId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void protectionRejectsStringAndNumericFlags() throws Exception {
        String snapshotId = createSnapshot("x");

        for (String body : List.of("{\"isProtected\":\"true\"}", "{\"isProtected\":1}", "{\"isProtected\":null}")) {
            mockMvc.perform(put("/snapshots/{id}/protection", snapshotId)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                    .andExpect(jsonPath("$.message").value(containsString("isProtected must be a boolean")));
        }

        mockMvc.perform(get("/snapshots/{id}", snapshotId))
                .andExpect(jsonPath("$.data.isProtected").value(false));
    }

    @Test
    void tagsAreReplacedAndNormalized() throws Exception {
        String snapshotId = createSnapshot("x");

        mockMvc.perform(put("/snapshots/{id}/tags", snapshotId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tags\":[\" Year-End \",\"year-end\",\"Q4\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.tags.length()").value(2))
                .andExpect(jsonPath("$.data.tags[0]").value("year-end"))
                .andExpect(jsonPath("$.data.tags[1]").value("q4"));

        mockMvc.perform(put("/snapshots/{id}/tags", snapshotId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void annotationsAreAppended() throws Exception {
        String snapshotId = createSnapshot("x");
        MvcResult copies = mockMvc.perform(get("/snapshots/{id}/transactions", snapshotId))
                .andExpect(status().isOk())
                .andReturn();
        String copyId = objectMapper.readTree(copies.getResponse().getContentAsString()).path("data").get(0).path("id").asText();

        mockMvc.perform(post("/snapshots/{id}/annotations", snapshotId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"reviewed by audit\",\"createdBy\":\"ana\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.annotations[0].content").value("reviewed by audit"))
                .andExpect(jsonPath("$.data.annotations[0].createdBy").value("ana"));

        mockMvc.perform(post("/snapshots/{id}/transactions/{copyId}/annotations", snapshotId, copyId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"odd amount\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.annotations[0].createdBy").value("system"));

        mockMvc.perform(post("/snapshots/{id}/annotations", snapshotId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\" \"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void compareReportsModifiedTransaction() throws Exception {
        String snapshotId = createSnapshot("x");
        unitOfWorkRunner.inTransaction(uow ->
                transactionRepository.save(uow, sale.withData(sale.data().withTransactionValue("150"))));

        mockMvc.perform(get("/snapshots/{id}/compare", snapshotId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.counts.modified").value(1))
                .andExpect(jsonPath("$.data.counts.unchanged").value(1))
                .andExpect(jsonPath("$.data.modified[0].changes[0].field").value("transactionValue"))
                .andExpect(jsonPath("$.data.modified[0].changes[0].oldValue").value("100"))
                .andExpect(jsonPath("$.data.modified[0].changes[0].newValue").value("150"))
                .andExpect(jsonPath("$.data.summary.differences.totalIncomeDiff").value(50.0));
    }

    @Test
    void exportDownloadsCsvAttachment() throws Exception {
        String snapshotId = createSnapshot("Month end");

        mockMvc.perform(get("/snapshots/{id}/export", snapshotId).param("format", "csv"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, containsString("attachment")))
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, containsString(".csv")))
                .andExpect(header().string(HttpHeaders.CONTENT_TYPE, "text/csv;charset=UTF-8"))
                .andExpect(content().string(containsString("Date,Name,Description,Value")));

        mockMvc.perform(get("/snapshots/{id}/export", snapshotId).param("format", "pdf"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }

    @Test
    void exportDefaultsToJson() throws Exception {
        String snapshotId = createSnapshot("Month end");

        MvcResult result = mockMvc.perform(get("/snapshots/{id}/export", snapshotId))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andReturn();

        JsonNode document = objectMapper.readTree(result.getResponse().getContentAsString());
        assertThat(document.path("snapshot").path("name").asText()).isEqualTo("Month end");
        assertThat(document.path("transactions")).hasSize(2);
    }

    @Test
    void rollbackRestoresBookAndCreatesSafetySnapshot() throws Exception {
        String snapshotId = createSnapshot("Month end");
        unitOfWorkRunner.inTransaction(uow -> transactionRepository.save(uow, debit(bookId, "late fee", "5")));

        mockMvc.perform(post("/snapshots/{id}/rollback", snapshotId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.success").value(true))
                .andExpect(jsonPath("$.data.restoredTransactionCount").value(2))
                .andExpect(jsonPath("$.data.preRollbackSnapshotId").exists());

        List<Transaction> restored = unitOfWorkRunner.readOnly(uow -> transactionRepository.findByFiscalBookId(uow, bookId));
        assertThat(restored).hasSize(2);

        mockMvc.perform(get("/fiscal-book/{bookId}/snapshots", bookId).param("tags", "pre-rollback"))
                .andExpect(jsonPath("$.pagination.total").value(1));
    }

    @Test
    void rollbackCanSkipSafetySnapshot() throws Exception {
        String snapshotId = createSnapshot("Month end");

        mockMvc.perform(post("/snapshots/{id}/rollback", snapshotId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"createPreRollbackSnapshot\":false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.preRollbackSnapshotId").doesNotExist());
    }

    @Test
    void cloneCreatesNewOpenBook() throws Exception {
        String snapshotId = createSnapshot("Month end");

        MvcResult result = mockMvc.perform(post("/snapshots/{id}/clone", snapshotId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"bookPeriod\":\"2024-02\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.bookName").value("January (Copy)"))
                .andExpect(jsonPath("$.data.bookPeriod").value("2024-02"))
                .andExpect(jsonPath("$.data.status").value("open"))
                .andReturn();

        UUID cloneId = UUID.fromString(objectMapper.readTree(result.getResponse().getContentAsString())
                .path("data").path("id").asText());
        assertThat(cloneId).isNotEqualTo(bookId);
        List<Transaction> cloned = unitOfWorkRunner.readOnly(uow -> transactionRepository.findByFiscalBookId(uow, cloneId));
        assertThat(cloned).hasSize(2);
    }

    @Test
    void statusChangeTakesConfiguredSafetySnapshot() throws Exception {
        mockMvc.perform(put("/fiscal-book/{bookId}/snapshots/schedule", bookId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"frequency\":\"before-status-change\"}"))
                .andExpect(status().isOk());

        mockMvc.perform(put("/fiscal-book/{bookId}/status", bookId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"closed\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.fiscalBook.status").value("closed"))
                .andExpect(jsonPath("$.data.fiscalBook.closedAt").exists())
                .andExpect(jsonPath("$.data.snapshotId").exists());

        mockMvc.perform(get("/fiscal-book/{bookId}/snapshots", bookId).param("tags", "before-status-change"))
                .andExpect(jsonPath("$.data[0].creationSource").value("before-status-change"))
                .andExpect(jsonPath("$.data[0].fiscalBookData.status").value("open"));
    }

    @Test
    void unknownStatusIsMalformed() throws Exception {
        mockMvc.perform(put("/fiscal-book/{bookId}/status", bookId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"frozen\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MALFORMED_REQUEST"));
    }

    @Test
    void manualScheduleRunReportsOutcome() throws Exception {
        mockMvc.perform(post("/snapshots/schedules/execute"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.executed").isArray())
                .andExpect(jsonPath("$.data.errors").isArray());
    }

    private String createSnapshot(String name) throws Exception {
        MvcResult result = mockMvc.perform(post("/fiscal-book/{bookId}/snapshots", bookId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(java.util.Map.of("name", name))))
                .andExpect(status().isCreated())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).path("data").path("id").asText();
    }
}
