package com.petwash.ledger.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.petwash.ledger.audit.entity.AuditLedgerEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;

/**
 * Streams a subject's full chain in seq order, as stored. Exports are for offline audit and do
 * not verify anything themselves.
 */
@Service
@RequiredArgsConstructor
public class AuditExportService {

    static final String CSV_HEADER =
            "id,subject_id,seq,event_type,timestamp,ip_address,user_agent,previous_hash,hash,metadata\n";

    private final AuditVerifyService verifyService;
    private final AuditLedgerService ledgerService;
    private final ObjectMapper objectMapper;

    /** CSV, one row per record. */
    public Mono<Void> streamCsv(String subjectId, ServerHttpResponse resp) {
        resp.getHeaders().setContentType(MediaType.parseMediaType("text/csv; charset=UTF-8"));
        resp.getHeaders().setContentDisposition(attachment(subjectId, "csv"));

        DataBufferFactory buf = resp.bufferFactory();
        Flux<DataBuffer> body = chain(subjectId)
                .collectList()
                .flatMapMany(list -> Flux.just(CSV_HEADER)
                        .concatWith(Flux.fromIterable(list).map(this::toCsvLine)))
                .map(s -> buf.wrap(s.getBytes(StandardCharsets.UTF_8)));

        return resp.writeWith(body);
    }

    /** NDJSON, one {@code AuditRecord} per line. */
    public Mono<Void> streamNdjson(String subjectId, ServerHttpResponse resp) {
        resp.getHeaders().setContentType(MediaType.parseMediaType("application/x-ndjson; charset=UTF-8"));
        resp.getHeaders().setContentDisposition(attachment(subjectId, "ndjson"));

        DataBufferFactory buf = resp.bufferFactory();
        Flux<DataBuffer> body = chain(subjectId)
                .map(row -> {
                    try {
                        return objectMapper.writeValueAsString(ledgerService.toRecord(row)) + "\n";
                    } catch (JsonProcessingException e) {
                        throw new IllegalStateException("Cannot render audit record " + row.getId(), e);
                    }
                })
                .map(s -> buf.wrap(s.getBytes(StandardCharsets.UTF_8)));

        return resp.writeWith(body);
    }

    private Flux<AuditLedgerEntity> chain(String subjectId) {
        return Mono.fromCallable(() -> verifyService.fetchChain(subjectId))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapMany(Flux::fromIterable);
    }

    private static ContentDisposition attachment(String subjectId, String ext) {
        return ContentDisposition.attachment()
                .filename("audit-" + subjectId + "." + ext, StandardCharsets.UTF_8)
                .build();
    }

    String toCsvLine(AuditLedgerEntity r) {
        String ts = r.getEventTsMicros() == null ? ""
                : AuditHasher.formatTimestamp(AuditHasher.fromEpochMicros(r.getEventTsMicros()));
        return csv(r.getId()) + "," + csv(r.getSubjectId()) + "," + csv(r.getSeq()) + ","
                + csv(r.getEventType()) + "," + csv(ts) + "," + csv(r.getIpAddress()) + ","
                + csv(r.getUserAgent()) + "," + csv(r.getPreviousHash()) + "," + csv(r.getRecordHash()) + ","
                + csv(r.getMetadataJson()) + "\n";
    }

    private static String csv(Object v) {
        if (v == null) return "";
        String s = String.valueOf(v);
        boolean q = s.contains(",") || s.contains("\"") || s.contains("\n") || s.contains("\r");
        if (q) s = "\"" + s.replace("\"", "\"\"") + "\"";
        return s;
    }
}
