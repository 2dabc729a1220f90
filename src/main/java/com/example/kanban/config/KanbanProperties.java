package com.example.kanban.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "kanban")
public class KanbanProperties {
    
    private Transaction transaction = new Transaction();
    private Retry retry = new Retry();
    private Monitor monitor = new Monitor();
    private Worker worker = new Worker();
    
    public Transaction getTransaction() {
        return transaction;
    }
    
    public void setTransaction(Transaction transaction) {
        this.transaction = transaction;
    }
    
    public Retry getRetry() {
        return retry;
    }
    
    public void setRetry(Retry retry) {
        this.retry = retry;
    }
    
    public Monitor getMonitor() {
        return monitor;
    }
    
    public void setMonitor(Monitor monitor) {
        this.monitor = monitor;
    }
    
    public Worker getWorker() {
        return worker;
    }
    
    public void setWorker(Worker worker) {
        this.worker = worker;
    }
    
    public static class Transaction {
        private boolean enabled = true;
        private long defaultTimeoutMs = 0; // 0 = no deadline
        private String defaultIsolation = ""; // blank = store default
        private boolean autoRollback = true;
        private int retryAttempts = 0;
        private int batchSize = 100;
        
        public boolean isEnabled() {
            return enabled;
        }
        
        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
        
        public long getDefaultTimeoutMs() {
            return defaultTimeoutMs;
        }
        
        public void setDefaultTimeoutMs(long defaultTimeoutMs) {
            this.defaultTimeoutMs = defaultTimeoutMs;
        }
        
        public String getDefaultIsolation() {
            return defaultIsolation;
        }
        
        public void setDefaultIsolation(String defaultIsolation) {
            this.defaultIsolation = defaultIsolation;
        }
        
        public boolean isAutoRollback() {
            return autoRollback;
        }
        
        public void setAutoRollback(boolean autoRollback) {
            this.autoRollback = autoRollback;
        }
        
        public int getRetryAttempts() {
            return retryAttempts;
        }
        
        public void setRetryAttempts(int retryAttempts) {
            this.retryAttempts = retryAttempts;
        }
        
        public int getBatchSize() {
            return batchSize;
        }
        
        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }
    
    public static class Retry {
        private long initialDelayMs = 100;
        private long maxDelayMs = 5000;
        private double multiplier = 2.0;
        private double jitterFactor = 0.1;
        
        public long getInitialDelayMs() {
            return initialDelayMs;
        }
        
        public void setInitialDelayMs(long initialDelayMs) {
            this.initialDelayMs = initialDelayMs;
        }
        
        public long getMaxDelayMs() {
            return maxDelayMs;
        }
        
        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
        
        public double getMultiplier() {
            return multiplier;
        }
        
        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }
        
        public double getJitterFactor() {
            return jitterFactor;
        }
        
        public void setJitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
        }
    }
    
    public static class Monitor {
        private long maxActiveTransactions = 100;
        private double minSuccessRate = 95.0;
        
        public long getMaxActiveTransactions() {
            return maxActiveTransactions;
        }
        
        public void setMaxActiveTransactions(long maxActiveTransactions) {
            this.maxActiveTransactions = maxActiveTransactions;
        }
        
        public double getMinSuccessRate() {
            return minSuccessRate;
        }
        
        public void setMinSuccessRate(double minSuccessRate) {
            this.minSuccessRate = minSuccessRate;
        }
    }
    
    public static class Worker {
        private String threadNamePrefix = "kanban-tx-";
        
        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }
        
        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
