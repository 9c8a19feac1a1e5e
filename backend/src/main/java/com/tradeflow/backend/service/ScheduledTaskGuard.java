package com.tradeflow.backend.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
@RequiredArgsConstructor
public class ScheduledTaskGuard {

    private final AlertService alertService;

    public void run(String taskName, Runnable task) {
        try {
            task.run();
        } catch (Throwable t) {
            log.error("Scheduled task failed task={}", taskName, t);
            alertService.sendAlert("TASK_FAILED", "Scheduled task failed: " + taskName + ": " + t.getMessage());
        }
    }
}
