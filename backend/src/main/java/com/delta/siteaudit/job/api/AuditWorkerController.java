package com.delta.siteaudit.job.api;

import com.delta.siteaudit.job.service.AuditWorkerService;
import com.delta.siteaudit.job.service.WorkerStatusResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/worker")
public class AuditWorkerController {
    private final AuditWorkerService workerService;

    public AuditWorkerController(AuditWorkerService workerService) {
        this.workerService = workerService;
    }

    @PostMapping("/start")
    public WorkerStatusResponse start() {
        workerService.start();
        return workerService.getStatus();
    }

    @PostMapping("/stop")
    public WorkerStatusResponse stop() {
        workerService.stop();
        return workerService.getStatus();
    }

    @GetMapping("/status")
    public WorkerStatusResponse status() {
        return workerService.getStatus();
    }
}
