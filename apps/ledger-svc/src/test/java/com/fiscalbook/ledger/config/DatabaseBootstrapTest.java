package com.fiscalbook.ledger.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class DatabaseBootstrapTest {

    @Test
    void schemaScriptCoversEverySnapshotTable() throws Exception {
        String sql = DatabaseBootstrap.loadSchemaSql();

        assertThat(sql).doesNotContain("--");
        assertThat(sql).contains("fiscal_books", "transactions", "fiscal_book_snapshots",
                "snapshot_transactions", "snapshot_schedules");
    }

    @Test
    void splitsOnStatementTerminators() {
        List<String> statements = DatabaseBootstrap.splitStatements("create table a (id int);\ncreate index b on a(id);\n");

        assertThat(statements).hasSize(3);
        assertThat(statements.get(0).trim()).isEqualTo("create table a (id int)");
        assertThat(statements.get(2)).isBlank();
    }
}
