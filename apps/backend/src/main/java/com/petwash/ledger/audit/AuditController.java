package com.petwash.ledger.audit;

import com.petwash.ledger.audit.dto.AuditEvent;
import com.petwash.ledger.audit.dto.AuditRecord;
import com.petwash.ledger.audit.dto.AuditVerifyReport;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.net.InetSocketAddress;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Producer and compliance-tooling surface. No route updates or deletes records.
 */
@RestController
@RequestMapping("/audit")
@RequiredArgsConstructor
public class AuditController {

    private final AuditLedgerService ledgerService;
    private final AuditVerifyService verifyService;
    private final AuditExportService exportService;

    @Operation(summary = "Append an event to its subject's chain")
    @PostMapping(value = "/events",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<AuditRecord> append(@RequestBody AuditEvent event, ServerHttpRequest request) {
        AuditEvent withProvenance = event.withProvenance(clientIp(request),
                request.getHeaders().getFirst(HttpHeaders.USER_AGENT));
        return Mono.fromCallable(() -> ledgerService.append(withProvenance))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "Verify a subject's chain")
    @GetMapping(value = "/verify", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<AuditVerifyReport> verify(@RequestParam String subjectId,
                                          @RequestParam(required = false) Boolean payload) {
        return Mono.fromCallable(() -> payload == null
                        ? verifyService.verify(subjectId)
                        : verifyService.verify(subjectId, payload))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "Hash of the latest record (tailHash)")
    @GetMapping(value = "/tail", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, Object>> tail(@RequestParam String subjectId) {
        return Mono.fromCallable(() -> {
            var rep = verifyService.verify(subjectId, false);
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("subjectId", subjectId);
            m.put("recordCount", rep.recordCount());
            m.put("tailHash", rep.tailHash()); // null for an empty chain
            return m;
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "Most recent records of a subject, newest first")
    @GetMapping(value = "/trail", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<List<AuditRecord>> trail(@RequestParam String subjectId,
                                         @RequestParam(required = false) Integer limit) {
        return Mono.fromCallable(() -> ledgerService.trail(subjectId, limit))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "Export a subject's chain as CSV (streaming)")
    @GetMapping(value = "/export/csv", produces = "text/csv")
    public Mono<Void> exportCsv(@RequestParam String subjectId, ServerHttpResponse resp) {
        return exportService.streamCsv(subjectId, resp);
    }

    @Operation(summary = "Export a subject's chain as NDJSON (streaming, one record per line)")
    @GetMapping(value = "/export/ndjson", produces = "application/x-ndjson")
    public Mono<Void> exportNdjson(@RequestParam String subjectId, ServerHttpResponse resp) {
        return exportService.streamNdjson(subjectId, resp);
    }

    private static String clientIp(ServerHttpRequest request) {
        String forwarded = request.getHeaders().getFirst("X-Forwarded-For");
        if (StringUtils.hasText(forwarded)) {
            return forwarded.split(",")[0].trim();
        }
        InetSocketAddress remote = request.getRemoteAddress();
        if (remote == null) return null;
        return remote.getAddress() != null ? remote.getAddress().getHostAddress() : remote.getHostString();
    }
}
