package com.bookkeeper.ingest.config;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

/**
 * Applies {@code db/bootstrap/schema.sql} when the {@code transactions} table does not exist yet.
 * Enabled with {@code bookkeeping.db.bootstrap-enabled=true}.
 */
@Component
public class DatabaseBootstrap {

    static final String SCHEMA_RESOURCE = "db/bootstrap/schema.sql";

    private static final Logger log = LoggerFactory.getLogger(DatabaseBootstrap.class);

    private final DataSource dataSource;
    private final boolean enabled;

    public DatabaseBootstrap(DataSource dataSource, BookkeepingProperties properties) {
        this.dataSource = dataSource;
        this.enabled = properties.db().bootstrapFlag();
    }

    @PostConstruct
    void maybeBootstrap() {
        if (!enabled) {
            log.info("DB bootstrap disabled (bookkeeping.db.bootstrap-enabled=false)");
            return;
        }
        try (Connection conn = dataSource.getConnection()) {
            if (transactionsTableExists(conn)) {
                log.info("DB bootstrap skipped: transactions table already present");
                return;
            }
            log.warn("DB bootstrap starting: applying {}", SCHEMA_RESOURCE);
            int applied = 0;
            for (String statement : splitStatements(loadSchema())) {
                try (Statement s = conn.createStatement()) {
                    s.execute(statement);
                    applied++;
                }
            }
            log.info("DB bootstrap completed: {} statements applied", applied);
        } catch (SQLException | IOException ex) {
            throw new IllegalStateException("DB bootstrap failed", ex);
        }
    }

    boolean transactionsTableExists(Connection conn) throws SQLException {
        DatabaseMetaData metaData = conn.getMetaData();
        for (String name : List.of("transactions", "TRANSACTIONS")) {
            try (ResultSet rs = metaData.getTables(null, null, name, new String[] {"TABLE"})) {
                if (rs.next()) {
                    return true;
                }
            }
        }
        return false;
    }

    private static String loadSchema() throws IOException {
        try (InputStream in = new ClassPathResource(SCHEMA_RESOURCE).getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    // schema.sql holds plain DDL, so splitting on ';' is enough
    static List<String> splitStatements(String sql) {
        String withoutComments = sql.lines()
                .filter(line -> !line.trim().startsWith("--"))
                .collect(Collectors.joining("\n"));
        return Arrays.stream(withoutComments.split(";"))
                .map(String::trim)
                .filter(statement -> !statement.isEmpty())
                .toList();
    }
}
