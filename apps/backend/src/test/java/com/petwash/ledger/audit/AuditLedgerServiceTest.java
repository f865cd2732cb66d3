package com.petwash.ledger.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.petwash.ledger.audit.dto.AuditEvent;
import com.petwash.ledger.audit.dto.AuditRecord;
import com.petwash.ledger.audit.entity.AuditLedgerEntity;
import com.petwash.ledger.audit.exception.AuditConcurrencyConflictException;
import com.petwash.ledger.audit.exception.AuditPersistenceException;
import com.petwash.ledger.audit.exception.AuditValidationException;
import com.petwash.ledger.audit.support.SubjectLockRegistry;
import com.petwash.ledger.config.LedgerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuditLedgerServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00.123456789Z");

    @Mock
    private AuditMapper mapper;

    @Mock
    private PlatformTransactionManager txManager;

    private final ObjectMapper om = new ObjectMapper();
    private final SubjectLockRegistry locks = new SubjectLockRegistry();
    private LedgerProperties props;
    private AuditLedgerService service;

    @BeforeEach
    void setUp() {
        props = new LedgerProperties();
        props.setMaxAppendAttempts(3);
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        AuditChainService chain = new AuditChainService(mapper, om);
        service = new AuditLedgerService(mapper, chain, locks, new TransactionTemplate(txManager), om, props, clock);
    }

    private static AuditLedgerEntity tail(long seq, String hash) {
        return AuditLedgerEntity.builder().id("tail-" + seq).subjectId("user-42").seq(seq).recordHash(hash).build();
    }

    @Test
    void firstAppendStartsTheChain() {
        when(mapper.selectTail("user-42")).thenReturn(null);

        AuditRecord rec = service.append("consent_granted", "user-42", Map.of("scope", "email"), "10.0.0.1", "JUnit");

        assertThat(rec.seq()).isEqualTo(1);
        assertThat(rec.previousHash()).isNull();
        assertThat(rec.timestamp()).isEqualTo(Instant.parse("2024-05-01T12:00:00.123456Z"));
        assertThat(rec.metadata()).containsEntry("scope", "email");
        assertThat(rec.hash()).isEqualTo(AuditHasher.sign(om,
                new AuditEvent("consent_granted", "user-42", Map.of("scope", "email"), "10.0.0.1", "JUnit"),
                rec.timestamp(), null));

        ArgumentCaptor<AuditLedgerEntity> row = ArgumentCaptor.forClass(AuditLedgerEntity.class);
        verify(mapper).insert(row.capture());
        assertThat(row.getValue().getMetadataJson()).isEqualTo("{\"scope\":\"email\"}");
        assertThat(row.getValue().getEventTsMicros()).isEqualTo(1714564800123456L);
        assertThat(row.getValue().getId()).isEqualTo(rec.id());
        verify(txManager).commit(any());
    }

    @Test
    void appendLinksToCurrentTail() {
        String prev = "aa".repeat(32);
        when(mapper.selectTail("user-42")).thenReturn(tail(7, prev));

        AuditRecord rec = service.append(AuditEvent.of("consent_revoked", "user-42", Map.of()));

        assertThat(rec.seq()).isEqualTo(8);
        assertThat(rec.previousHash()).isEqualTo(prev);
    }

    @Test
    void lostRaceIsRetriedAgainstTheNewTail() {
        String stale = "aa".repeat(32);
        String fresh = "bb".repeat(32);
        when(mapper.selectTail("user-42")).thenReturn(tail(1, stale), tail(2, fresh));
        when(mapper.insert(any()))
                .thenThrow(new DuplicateKeyException("uk_audit_subject_seq"))
                .thenReturn(1);

        AuditRecord rec = service.append(AuditEvent.of("payment_authorized", "user-42", Map.of("amount", 100)));

        assertThat(rec.seq()).isEqualTo(3);
        assertThat(rec.previousHash()).isEqualTo(fresh);
        verify(mapper, times(2)).selectTail("user-42");
        verify(mapper, times(2)).insert(any());
        verify(txManager).rollback(any());
        assertThat(locks.activeSubjects()).isZero();
    }

    @Test
    void conflictSurfacesOnceAttemptsAreExhausted() {
        when(mapper.selectTail("user-42")).thenReturn(tail(1, "aa".repeat(32)));
        when(mapper.insert(any())).thenThrow(new DuplicateKeyException("uk_audit_subject_seq"));

        assertThatThrownBy(() -> service.append(AuditEvent.of("payment_authorized", "user-42", Map.of())))
                .isInstanceOf(AuditConcurrencyConflictException.class);
        verify(mapper, times(3)).insert(any());
        assertThat(locks.activeSubjects()).isZero();
    }

    @Test
    void storageFailureIsSurfacedWithoutRetry() {
        when(mapper.selectTail("user-42")).thenReturn(null);
        when(mapper.insert(any())).thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> service.append(AuditEvent.of("payment_authorized", "user-42", Map.of())))
                .isInstanceOf(AuditPersistenceException.class)
                .hasMessageContaining("user-42")
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
        verify(mapper, times(1)).insert(any());
    }

    @Test
    void invalidEventsAreRejectedBeforeTouchingTheStore() {
        assertThatThrownBy(() -> service.append(AuditEvent.of("t", " ", Map.of())))
                .isInstanceOf(AuditValidationException.class).hasMessageContaining("subjectId");
        assertThatThrownBy(() -> service.append(AuditEvent.of(null, "user-1", Map.of())))
                .isInstanceOf(AuditValidationException.class).hasMessageContaining("eventType");
        assertThatThrownBy(() -> service.append(AuditEvent.of("t", "u".repeat(129), Map.of())))
                .isInstanceOf(AuditValidationException.class);
        assertThatThrownBy(() -> service.append(new AuditEvent("t", "user-1", Map.of(), "1".repeat(65), null)))
                .isInstanceOf(AuditValidationException.class).hasMessageContaining("ipAddress");
        assertThatThrownBy(() -> service.append(AuditEvent.of("t", "user-1", Map.of("bad", new Object()))))
                .isInstanceOf(AuditValidationException.class).hasMessageContaining("metadata");
        assertThatThrownBy(() -> service.append(AuditEvent.of("t", "user-1", Map.of("rate", Double.NaN))))
                .isInstanceOf(AuditValidationException.class).hasMessageContaining("metadata.rate");
        assertThatThrownBy(() -> service.append((AuditEvent) null))
                .isInstanceOf(AuditValidationException.class);

        verifyNoInteractions(mapper, txManager);
    }

    @Test
    void trailClampsLimit() {
        when(mapper.selectRecent(anyString(), anyInt())).thenReturn(List.of());

        service.trail("user-42", null);
        service.trail("user-42", 0);
        service.trail("user-42", 1_000_000);

        verify(mapper).selectRecent("user-42", 100);
        verify(mapper).selectRecent("user-42", 1);
        verify(mapper).selectRecent("user-42", 1000);
    }

    @Test
    void trailKeepsRecordsWithUnreadableMetadata() {
        AuditLedgerEntity row = AuditLedgerEntity.builder()
                .id("r1").subjectId("user-42").seq(1L).eventType("t")
                .metadataJson("{broken").eventTsMicros(0L).recordHash("cc".repeat(32)).build();
        when(mapper.selectRecent("user-42", 5)).thenReturn(List.of(row));

        List<AuditRecord> trail = service.trail("user-42", 5);

        assertThat(trail).hasSize(1);
        assertThat(trail.get(0).metadata()).isNull();
        assertThat(trail.get(0).timestamp()).isEqualTo(Instant.EPOCH);
    }
}
