package com.fiscalbook.ledger.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Applies db/bootstrap/schema.sql once, when the snapshot tables are missing and
 * fiscalbook.db.bootstrap-enabled is set (env FISCALBOOK_DB_BOOTSTRAP=true).
 */
@Component
@Profile("!memory")
public class DatabaseBootstrap {
    private static final Logger log = LoggerFactory.getLogger(DatabaseBootstrap.class);

    static final String SCHEMA_RESOURCE = "db/bootstrap/schema.sql";

    private final DataSource dataSource;
    private final boolean enabled;

    public DatabaseBootstrap(DataSource dataSource,
                             @Value("${fiscalbook.db.bootstrap-enabled:false}") boolean enabled) {
        this.dataSource = dataSource;
        this.enabled = enabled;
    }

    @PostConstruct
    void maybeBootstrap() {
        if (!enabled) {
            log.info("DB bootstrap disabled (fiscalbook.db.bootstrap-enabled=false)");
            return;
        }
        try (Connection conn = dataSource.getConnection()) {
            if (snapshotTableExists(conn)) {
                log.info("DB bootstrap skipped: schema already present (fiscal_book_snapshots table exists)");
                return;
            }
            log.warn("DB bootstrap starting: applying {}", SCHEMA_RESOURCE);
            int applied = 0;
            for (String stmt : splitStatements(loadSchemaSql())) {
                String trimmed = stmt.trim();
                if (trimmed.isEmpty()) continue;
                try (Statement s = conn.createStatement()) {
                    s.execute(trimmed);
                    applied++;
                }
            }
            log.info("DB bootstrap completed: {} statements applied", applied);
        } catch (SQLException | IOException e) {
            // Startup continues; the first repository call surfaces the missing schema as a storage error.
            log.error("DB bootstrap failed (application will continue to start)", e);
        }
    }

    private boolean snapshotTableExists(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "select 1 from information_schema.tables where table_name = 'fiscal_book_snapshots' and table_schema = current_schema()")) {
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    static String loadSchemaSql() throws IOException {
        ClassPathResource res = new ClassPathResource(SCHEMA_RESOURCE);
        try (BufferedReader br = new BufferedReader(new InputStreamReader(res.getInputStream(), StandardCharsets.UTF_8))) {
            return br.lines()
                    .filter(line -> !line.trim().startsWith("--"))
                    .collect(Collectors.joining("\n"));
        }
    }

    // schema.sql contains no procedural blocks
    static List<String> splitStatements(String sql) {
        return Arrays.asList(sql.split(";"));
    }
}
