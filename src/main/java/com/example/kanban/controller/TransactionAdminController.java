package com.example.kanban.controller;

import com.example.kanban.saga.ServiceTransactionCoordinator;
import com.example.kanban.saga.TransactionMetrics;
import com.example.kanban.transaction.KanbanTransactionManager;
import com.example.kanban.transaction.TransactionMonitor;
import com.example.kanban.transaction.TransactionSnapshot;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Read-only view of the transactions in flight.
 */
@RestController
@RequestMapping("/api/transactions")
public class TransactionAdminController {

    @Autowired
    private KanbanTransactionManager transactionManager;

    @Autowired
    private ServiceTransactionCoordinator coordinator;

    @Autowired(required = false)
    private TransactionMonitor transactionMonitor;

    @GetMapping
    public List<TransactionSnapshot> getActiveTransactions() {
        return transactionManager.getActiveTransactions();
    }

    @GetMapping("/metrics")
    public TransactionMetrics getMetrics() {
        return coordinator.getTransactionMetrics();
    }

    @GetMapping("/statistics")
    public ResponseEntity<?> getStatistics() {
        if (transactionMonitor == null) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", "Transaction monitoring is disabled"));
        }
        return ResponseEntity.ok(transactionMonitor.getTransactionStatistics());
    }

    @GetMapping("/{transactionId}")
    public ResponseEntity<?> getTransaction(@PathVariable String transactionId) {
        return transactionManager.getTransaction(transactionId)
            .<ResponseEntity<?>>map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("error", "Transaction not found", "transactionId", transactionId)));
    }
}
