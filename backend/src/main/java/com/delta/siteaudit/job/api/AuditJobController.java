package com.delta.siteaudit.job.api;

import com.delta.siteaudit.access.ArtifactViewResponse;
import com.delta.siteaudit.access.ArtifactViewService;
import com.delta.siteaudit.access.CallerIdentity;
import com.delta.siteaudit.job.model.CreateJobRequest;
import com.delta.siteaudit.job.model.CreateJobResponse;
import com.delta.siteaudit.job.model.JobStatusView;
import com.delta.siteaudit.job.service.AuditJobService;
import com.delta.siteaudit.render.ArtifactExportService;
import com.delta.siteaudit.render.RenderedDocument;
import jakarta.validation.Valid;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api/jobs")
public class AuditJobController {
    static final String CALLER_HEADER = "X-Caller-Identity";

    private final AuditJobService jobService;
    private final ArtifactViewService viewService;
    private final ArtifactExportService exportService;

    public AuditJobController(
        AuditJobService jobService,
        ArtifactViewService viewService,
        ArtifactExportService exportService
    ) {
        this.jobService = jobService;
        this.viewService = viewService;
        this.exportService = exportService;
    }

    @PostMapping
    public ResponseEntity<CreateJobResponse> create(@Valid @RequestBody(required = false) CreateJobRequest request) {
        if (request == null) {
            throw new ResponseStatusException(BAD_REQUEST, "request body is required");
        }
        String jobId = jobService.createJob(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new CreateJobResponse(jobId));
    }

    @GetMapping("/{jobId}")
    public JobStatusView status(@PathVariable("jobId") String jobId) {
        return jobService.getStatus(jobId);
    }

    @PostMapping("/{jobId}/retry")
    public JobStatusView retry(@PathVariable("jobId") String jobId) {
        return jobService.retry(jobId);
    }

    @GetMapping("/{jobId}/artifact")
    public ArtifactViewResponse artifact(
        @PathVariable("jobId") String jobId,
        @RequestHeader(name = CALLER_HEADER, required = false) String caller
    ) {
        return viewService.getView(jobId, CallerIdentity.fromHeader(caller));
    }

    @GetMapping("/{jobId}/document")
    public ResponseEntity<byte[]> document(
        @PathVariable("jobId") String jobId,
        @RequestHeader(name = CALLER_HEADER, required = false) String caller
    ) {
        RenderedDocument document = exportService.export(jobId, CallerIdentity.fromHeader(caller));
        return ResponseEntity.ok()
            .contentType(MediaType.parseMediaType(document.contentType()))
            .header(
                HttpHeaders.CONTENT_DISPOSITION,
                ContentDisposition.attachment().filename(document.fileName()).build().toString()
            )
            .body(document.content());
    }
}
