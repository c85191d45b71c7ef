package com.delta.siteaudit.job.api;

import com.delta.siteaudit.access.JdbcEntitlementService;
import com.delta.siteaudit.generation.ArtifactFixtures;
import com.delta.siteaudit.job.model.ClaimedJob;
import com.delta.siteaudit.job.model.NewAuditJob;
import com.delta.siteaudit.job.persistence.ArtifactRepository;
import com.delta.siteaudit.job.persistence.AuditJobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import java.util.List;
import java.util.UUID;

import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.notNullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class AuditJobEndpointTest {
    private static final String CALLER_HEADER = "X-Caller-Identity";

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private AuditJobRepository jobRepository;

    @Autowired
    private ArtifactRepository artifactRepository;

    @Autowired
    private JdbcEntitlementService entitlementService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void createReturnsAcceptedWithJobIdAndStatusIsPending() throws Exception {
        String body = """
            {"target_domain": "https://www.Acme.example/", "comparison_domains": ["rival.example"], "locale": "en-US"}
            """;
        String response = mockMvc.perform(post("/api/jobs").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.job_id").value(notNullValue()))
            .andReturn()
            .getResponse()
            .getContentAsString();
        String jobId = ArtifactFixtures.MAPPER.readTree(response).get("job_id").asText();

        mockMvc.perform(get("/api/jobs/" + jobId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.job_id").value(jobId))
            .andExpect(jsonPath("$.status").value("PENDING"))
            .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void invalidCreateRequestsAreRejected() throws Exception {
        mockMvc.perform(post("/api/jobs").contentType(MediaType.APPLICATION_JSON).content("{\"target_domain\": \"localhost\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_request"));
        mockMvc.perform(post("/api/jobs").contentType(MediaType.APPLICATION_JSON).content("{\"locale\": \"en-US\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_request"));
        mockMvc.perform(post("/api/jobs").contentType(MediaType.APPLICATION_JSON).content("{not json"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_request"));
    }

    @Test
    void unknownJobIsNotFound() throws Exception {
        String missing = UUID.randomUUID().toString();
        mockMvc.perform(get("/api/jobs/" + missing))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("job_not_found"));
        mockMvc.perform(get("/api/jobs/" + missing + "/artifact"))
            .andExpect(status().isNotFound());
    }

    @Test
    void artifactIsNotReadyBeforeFirstVersion() throws Exception {
        String jobId = jobRepository.insert(new NewAuditJob("acme.example", List.of(), "en-US", null));

        mockMvc.perform(get("/api/jobs/" + jobId + "/artifact"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("artifact_not_ready"));
        mockMvc.perform(get("/api/jobs/" + jobId + "/document"))
            .andExpect(status().isConflict());
    }

    @Test
    void anonymousCallerSeesTeaserOnly() throws Exception {
        String jobId = jobWithArtifact();

        mockMvc.perform(get("/api/jobs/" + jobId + "/artifact"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.access_state").value("ANONYMOUS"))
            .andExpect(jsonPath("$.can_unlock").value(false))
            .andExpect(jsonPath("$.artifact_version").value(1))
            .andExpect(jsonPath("$.view.visibility_summary.headline").value("Assistants rarely recommend this business"))
            .andExpect(jsonPath("$.view.ai_interpretation.summary").exists())
            .andExpect(jsonPath("$.view.ai_interpretation.missing_elements").doesNotExist())
            .andExpect(jsonPath("$.view.packages").doesNotExist())
            .andExpect(jsonPath("$.redacted_section_ids", hasItem("packages")))
            .andExpect(jsonPath("$.redacted_section_ids", not(hasItem("visibility_summary"))));
    }

    @Test
    void registeredCallerSeesMoreAndCanUnlock() throws Exception {
        String jobId = jobWithArtifact();
        String caller = "caller-" + UUID.randomUUID();
        entitlementService.registerCaller(caller);

        mockMvc.perform(get("/api/jobs/" + jobId + "/artifact").header(CALLER_HEADER, caller))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.access_state").value("REGISTERED"))
            .andExpect(jsonPath("$.can_unlock").value(true))
            .andExpect(jsonPath("$.view.ai_interpretation.missing_elements").exists())
            .andExpect(jsonPath("$.view.decision_readiness_audit[0].status").value("present"))
            .andExpect(jsonPath("$.view.decision_readiness_audit[0].what_we_found").doesNotExist())
            .andExpect(jsonPath("$.view.packages").doesNotExist());
    }

    @Test
    void grantTakesEffectOnNextRead() throws Exception {
        String jobId = jobWithArtifact();
        String caller = "caller-" + UUID.randomUUID();
        entitlementService.registerCaller(caller);

        mockMvc.perform(get("/api/jobs/" + jobId + "/artifact").header(CALLER_HEADER, caller))
            .andExpect(jsonPath("$.access_state").value("REGISTERED"));

        entitlementService.grantForJob(caller, jobId);

        mockMvc.perform(get("/api/jobs/" + jobId + "/artifact").header(CALLER_HEADER, caller))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.access_state").value("ENTITLED"))
            .andExpect(jsonPath("$.can_unlock").value(false))
            .andExpect(jsonPath("$.redacted_section_ids").isEmpty())
            .andExpect(jsonPath("$.view.packages.entry.pages").value(10))
            .andExpect(jsonPath("$.view.appendix.sampled_urls[0]").value("https://acme.example/"));

        entitlementService.revokeAll(caller);

        mockMvc.perform(get("/api/jobs/" + jobId + "/artifact").header(CALLER_HEADER, caller))
            .andExpect(jsonPath("$.access_state").value("REGISTERED"));
    }

    @Test
    void documentRequiresEntitlementAndThenARenderer() throws Exception {
        String jobId = jobWithArtifact();
        String caller = "caller-" + UUID.randomUUID();
        entitlementService.registerCaller(caller);

        mockMvc.perform(get("/api/jobs/" + jobId + "/document").header(CALLER_HEADER, caller))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.error").value("not_entitled"));

        entitlementService.grantForJob(caller, jobId);

        mockMvc.perform(get("/api/jobs/" + jobId + "/document").header(CALLER_HEADER, caller))
            .andExpect(status().isNotImplemented())
            .andExpect(jsonPath("$.error").value("renderer_unavailable"));
    }

    @Test
    void workerStatusReportsStoppedPool() throws Exception {
        mockMvc.perform(get("/api/worker/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.running").value(false))
            .andExpect(jsonPath("$.pending_jobs").isNumber());
    }

    private String jobWithArtifact() {
        String jobId = jobRepository.insert(new NewAuditJob("acme.example", List.of(), "en-US", null));
        ClaimedJob claimed = jobRepository.claim(jobId, "endpoint-test-worker").orElseThrow();
        artifactRepository.insert(
            claimed,
            "2",
            ArtifactFixtures.json(ArtifactFixtures.storedTree()),
            List.of("https://acme.example/", "https://acme.example/pricing"),
            "test-model",
            1
        );
        return jobId;
    }
}
