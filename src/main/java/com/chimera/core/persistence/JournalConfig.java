package com.chimera.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;

/**
 * Provides the {@link OperationJournal}.
 * <p>
 * When a {@link DataSource} is configured, a {@link JdbcOperationJournal} is
 * created and its tables ensured. Otherwise an {@link InMemoryOperationJournal}
 * is used, which loses all state on restart.
 */
@Configuration
public class JournalConfig {

    private static final Logger log = LoggerFactory.getLogger(JournalConfig.class);

    @Bean
    public OperationJournal operationJournal(ObjectProvider<DataSource> dataSource, ObjectMapper objectMapper)
            throws SQLException {
        DataSource ds = dataSource.getIfAvailable();
        if (ds == null) {
            log.info("No DataSource available; using in-memory operation journal (state will not persist across restarts)");
            return new InMemoryOperationJournal();
        }
        log.info("Configuring JDBC operation journal");
        var journal = new JdbcOperationJournal(ds, objectMapper);
        journal.createTables();
        return journal;
    }
}
