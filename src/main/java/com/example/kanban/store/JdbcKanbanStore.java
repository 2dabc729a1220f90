package com.example.kanban.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link KanbanStore} backed by the SQLite datasource through Spring's JDBC support.
 * 
 * The envelope is a {@link TransactionTemplate}, so every {@link JdbcTemplate} call made on the
 * same thread while the callback runs (including the domain services') joins the transaction.
 * 
 * Pragma assignments made inside a transaction are connection-wide in SQLite and would outlive
 * it on the pooled connection, so the previous value is restored when the transaction completes.
 */
public class JdbcKanbanStore implements KanbanStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbcKanbanStore.class);

    private static final Pattern PRAGMA_ASSIGNMENT =
        Pattern.compile("^\\s*PRAGMA\\s+(\\w+)\\s*=", Pattern.CASE_INSENSITIVE);

    private final TransactionTemplate transactionTemplate;
    private final JdbcTemplate jdbcTemplate;

    public JdbcKanbanStore(TransactionTemplate transactionTemplate, JdbcTemplate jdbcTemplate) {
        this.transactionTemplate = transactionTemplate;
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public <T> T transaction(StoreCallback<T> callback) throws Exception {
        try {
            return transactionTemplate.execute(status -> {
                try {
                    return callback.doInStoreTransaction();
                } catch (RuntimeException e) {
                    throw e;
                } catch (Exception e) {
                    throw new CheckedCallbackException(e);
                }
            });
        } catch (CheckedCallbackException e) {
            throw e.checkedCause;
        }
    }

    @Override
    public void execute(String directive) {
        Matcher pragma = PRAGMA_ASSIGNMENT.matcher(directive);
        if (pragma.find() && TransactionSynchronizationManager.isSynchronizationActive()) {
            String name = pragma.group(1);
            List<String> previous = jdbcTemplate.queryForList("PRAGMA " + name, String.class);
            if (!previous.isEmpty()) {
                TransactionSynchronizationManager.registerSynchronization(
                    new PragmaRestore("PRAGMA " + name + " = " + previous.get(0)));
            }
        }
        logger.debug("Executing store directive: {}", directive);
        jdbcTemplate.execute(directive);
    }

    /**
     * Restores a pragma before the transaction completes, while its connection is still bound.
     */
    private final class PragmaRestore implements TransactionSynchronization {
        private final String restoreDirective;

        PragmaRestore(String restoreDirective) {
            this.restoreDirective = restoreDirective;
        }

        @Override
        public void beforeCompletion() {
            logger.debug("Restoring store directive: {}", restoreDirective);
            jdbcTemplate.execute(restoreDirective);
        }
    }

    /**
     * Carries a checked callback exception through {@link TransactionTemplate}, which only lets
     * unchecked exceptions trigger a rollback.
     */
    private static final class CheckedCallbackException extends RuntimeException {
        private final Exception checkedCause;

        CheckedCallbackException(Exception checkedCause) {
            super(checkedCause);
            this.checkedCause = checkedCause;
        }
    }
}
