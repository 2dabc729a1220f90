package com.example.kanban.config;

import com.example.kanban.saga.ServiceTransactionCoordinator;
import com.example.kanban.saga.TransactionDecorator;
import com.example.kanban.service.BoardService;
import com.example.kanban.service.NoteService;
import com.example.kanban.service.TagService;
import com.example.kanban.service.TaskDependencyService;
import com.example.kanban.service.TaskService;
import com.example.kanban.store.JdbcKanbanStore;
import com.example.kanban.store.KanbanStore;
import com.example.kanban.transaction.IsolationLevel;
import com.example.kanban.transaction.KanbanTransactionManager;
import com.example.kanban.transaction.RetryBackoff;
import com.example.kanban.transaction.TransactionMonitor;
import com.example.kanban.transaction.TransactionOptions;
import com.example.kanban.transaction.TransactionRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@ConditionalOnProperty(prefix = "kanban.transaction", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TransactionAutoConfiguration {
    
    private static final Logger logger = LoggerFactory.getLogger(TransactionAutoConfiguration.class);
    
    @Autowired
    private KanbanProperties kanbanProperties;
    
    @Bean
    public KanbanStore kanbanStore(PlatformTransactionManager platformTransactionManager, JdbcTemplate jdbcTemplate) {
        return new JdbcKanbanStore(new TransactionTemplate(platformTransactionManager), jdbcTemplate);
    }
    
    @Bean
    public TransactionRegistry transactionRegistry() {
        return new TransactionRegistry();
    }
    
    @Bean
    public TransactionMonitor transactionMonitor(MeterRegistry meterRegistry) {
        KanbanProperties.Monitor monitor = kanbanProperties.getMonitor();
        return new TransactionMonitor(meterRegistry, monitor.getMaxActiveTransactions(), monitor.getMinSuccessRate());
    }
    
    // Shut down by the transaction manager
    @Bean(destroyMethod = "")
    public ExecutorService kanbanTransactionWorker() {
        CustomizableThreadFactory threadFactory =
            new CustomizableThreadFactory(kanbanProperties.getWorker().getThreadNamePrefix());
        threadFactory.setDaemon(true);
        return Executors.newCachedThreadPool(threadFactory);
    }
    
    @Bean
    public RetryBackoff retryBackoff() {
        KanbanProperties.Retry retry = kanbanProperties.getRetry();
        return new RetryBackoff(retry.getInitialDelayMs(), retry.getMaxDelayMs(),
                                retry.getMultiplier(), retry.getJitterFactor());
    }
    
    @Bean(destroyMethod = "shutdown")
    public KanbanTransactionManager kanbanTransactionManager(KanbanStore kanbanStore,
                                                             TransactionRegistry transactionRegistry,
                                                             ExecutorService kanbanTransactionWorker,
                                                             RetryBackoff retryBackoff,
                                                             ObjectProvider<TransactionMonitor> transactionMonitor) {
        KanbanProperties.Transaction transaction = kanbanProperties.getTransaction();
        return new KanbanTransactionManager(kanbanStore, transactionRegistry, kanbanTransactionWorker, retryBackoff,
                                            transactionMonitor.getIfAvailable(), defaultOptions(transaction),
                                            transaction.getBatchSize());
    }
    
    @Bean
    public ServiceTransactionCoordinator serviceTransactionCoordinator(KanbanTransactionManager kanbanTransactionManager,
                                                                       BoardService boardService,
                                                                       TaskService taskService,
                                                                       TagService tagService,
                                                                       TaskDependencyService taskDependencyService,
                                                                       NoteService noteService) {
        return new ServiceTransactionCoordinator(kanbanTransactionManager, boardService, taskService, tagService,
                                                 taskDependencyService, noteService);
    }
    
    @Bean
    public TransactionDecorator transactionDecorator(ServiceTransactionCoordinator serviceTransactionCoordinator) {
        return TransactionDecorator.createTransactionDecorator(serviceTransactionCoordinator);
    }
    
    static TransactionOptions defaultOptions(KanbanProperties.Transaction transaction) {
        String isolationName = transaction.getDefaultIsolation();
        IsolationLevel isolation = IsolationLevel.fromName(isolationName).orElse(null);
        if (isolation == null && isolationName != null && !isolationName.isBlank()) {
            logger.warn("Unknown default isolation level '{}', using the store default", isolationName);
        }
        
        Duration timeout = transaction.getDefaultTimeoutMs() > 0
            ? Duration.ofMillis(transaction.getDefaultTimeoutMs())
            : null;
        
        return new TransactionOptions(isolation, timeout, transaction.isAutoRollback(), transaction.getRetryAttempts());
    }
}
