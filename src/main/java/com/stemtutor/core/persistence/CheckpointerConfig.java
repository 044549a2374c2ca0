package com.stemtutor.core.persistence;

import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.MemorySaver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Spring {@link Configuration} that provides the LangGraph4j
 * {@link BaseCheckpointSaver} sessions are persisted through.
 * <p>
 * With a {@link DataSource} (the {@code postgres} profile), a
 * {@link JdbcCheckpointSaver} keeps sessions durable across restarts and
 * instances. Otherwise an in-memory {@link MemorySaver} is used, which is
 * enough for a single instance in development.
 * <p>
 * The DataSource is looked up lazily: it is registered by auto-configuration,
 * after this class has been parsed.
 */
@Configuration
public class CheckpointerConfig {

    private static final Logger log = LoggerFactory.getLogger(CheckpointerConfig.class);

    @Bean
    public BaseCheckpointSaver checkpointSaver(ObjectProvider<DataSource> dataSource) throws Exception {
        DataSource ds = dataSource.getIfAvailable();
        if (ds == null) {
            log.info("No DataSource available; using in-memory checkpoint saver (sessions will not survive a restart)");
            return new MemorySaver();
        }
        log.info("Configuring JDBC checkpoint saver (PostgreSQL)");
        var saver = new JdbcCheckpointSaver(ds);
        saver.createTables();
        return saver;
    }
}
