package com.pagesentry.analyze.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pagesentry.analyze.dlq.DeadLetterQueue;
import com.pagesentry.analyze.model.DeadLetterStats;
import com.pagesentry.analyze.model.IngestSummary;
import com.pagesentry.analyze.model.UpiHandleSighting;
import com.pagesentry.analyze.persistence.AnalyzerJdbcRepository;
import com.pagesentry.analyze.policy.DomainPolicyService;
import com.pagesentry.analyze.service.BatchCoordinatorService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.zip.GZIPInputStream;

@RestController
@RequestMapping("/api")
public class AnalyzerController {
    private static final int MAX_UPI_HANDLES = 1000;

    private final BatchCoordinatorService coordinator;
    private final IngestPayloadParser payloadParser;
    private final DeadLetterQueue deadLetters;
    private final DomainPolicyService domainPolicy;
    private final AnalyzerJdbcRepository repository;
    private final ObjectMapper objectMapper;

    public AnalyzerController(
        BatchCoordinatorService coordinator,
        IngestPayloadParser payloadParser,
        DeadLetterQueue deadLetters,
        DomainPolicyService domainPolicy,
        AnalyzerJdbcRepository repository,
        ObjectMapper objectMapper
    ) {
        this.coordinator = coordinator;
        this.payloadParser = payloadParser;
        this.deadLetters = deadLetters;
        this.domainPolicy = domainPolicy;
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    @PostMapping("/ingest")
    public IngestSummary ingest(
        @RequestBody byte[] body,
        @RequestHeader(name = "Content-Encoding", required = false) String contentEncoding
    ) {
        JsonNode payload = readPayload(body, contentEncoding);
        return coordinator.process(payloadParser.parse(payload));
    }

    @GetMapping("/dlq/stats")
    public DeadLetterStats deadLetterStats() {
        return deadLetters.stats();
    }

    @GetMapping("/policy/render-domains")
    public RenderDomainsResponse renderDomains() {
        List<String> domains = new ArrayList<>(domainPolicy.forcedDomains());
        domains.sort(null);
        return new RenderDomainsResponse(domains, domainPolicy.escalatedDomainStats());
    }

    @PostMapping("/policy/render-domains")
    public RenderDomainsResponse addRenderDomain(@RequestBody RenderDomainRequest request) {
        if (request == null || request.domain() == null || request.domain().isBlank()) {
            throw new IllegalArgumentException("domain is required");
        }
        domainPolicy.addForcedDomain(request.domain(), DomainPolicyService.ORIGIN_MANUAL);
        return renderDomains();
    }

    @GetMapping("/upi-handles")
    public List<UpiHandleSighting> upiHandles(
        @RequestParam(name = "limit", required = false, defaultValue = "100") int limit
    ) {
        return repository.findUpiHandles(Math.max(1, Math.min(limit, MAX_UPI_HANDLES)));
    }

    JsonNode readPayload(byte[] body, String contentEncoding) {
        if (body == null || body.length == 0) {
            throw new IllegalArgumentException("empty ingest payload");
        }
        try (InputStream in = open(body, contentEncoding)) {
            return objectMapper.readTree(in);
        } catch (IOException e) {
            throw new IllegalArgumentException("unreadable ingest payload: " + e.getMessage(), e);
        }
    }

    private static InputStream open(byte[] body, String contentEncoding) throws IOException {
        InputStream raw = new ByteArrayInputStream(body);
        boolean declared = contentEncoding != null && contentEncoding.toLowerCase(Locale.ROOT).contains("gzip");
        boolean magic = body.length > 2 && (body[0] & 0xff) == 0x1f && (body[1] & 0xff) == 0x8b;
        return declared || magic ? new GZIPInputStream(raw) : raw;
    }
}
