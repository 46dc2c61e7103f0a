package com.aikb.rag.audit;

import com.aikb.rag.entity.AuditLogEntity;
import com.aikb.rag.repository.AuditLogRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for JpaAuditSink.
 */
@ExtendWith(MockitoExtension.class)
class JpaAuditSinkTest {

    @Mock
    private AuditLogRepository repository;

    @InjectMocks
    private JpaAuditSink sink;

    @Test
    @DisplayName("Should persist a successful entry with JSON metadata")
    void shouldPersistSuccessfulEntry() {
        AuditEntry entry = new AuditEntry("user-1", "Send to [EMAIL REDACTED]",
                Instant.parse("2026-03-01T10:15:30Z"), AuditEntry.SUCCESS, 0.0002,
                Map.of("sourceCount", 2, "citedDocIds", List.of("HR-001")));

        sink.log(entry);

        ArgumentCaptor<AuditLogEntity> captor = ArgumentCaptor.forClass(AuditLogEntity.class);
        verify(repository).save(captor.capture());
        AuditLogEntity saved = captor.getValue();
        assertThat(saved.getUserId()).isEqualTo("user-1");
        assertThat(saved.getRedactedQuery()).isEqualTo("Send to [EMAIL REDACTED]");
        assertThat(saved.getOutcome()).isEqualTo("SUCCESS");
        assertThat(saved.getSuccess()).isTrue();
        assertThat(saved.getCostEstimate()).isEqualTo(0.0002);
        assertThat(saved.getTimestamp()).isEqualTo(LocalDateTime.of(2026, 3, 1, 10, 15, 30));
        assertThat(saved.getMetadataJson()).contains("\"sourceCount\":2").contains("HR-001");
    }

    @Test
    @DisplayName("Should mark failure outcomes as unsuccessful")
    void shouldMarkFailures() {
        sink.log(new AuditEntry("user-1", "q", Instant.now(), "GENERATION_FAILED", 0.0, Map.of()));

        ArgumentCaptor<AuditLogEntity> captor = ArgumentCaptor.forClass(AuditLogEntity.class);
        verify(repository).save(captor.capture());
        assertThat(captor.getValue().getSuccess()).isFalse();
        assertThat(captor.getValue().getMetadataJson()).isNull();
    }

    @Test
    @DisplayName("Should propagate repository errors to the caller")
    void shouldPropagateRepositoryErrors() {
        when(repository.save(any())).thenThrow(new IllegalStateException("database is down"));

        assertThatThrownBy(() -> sink.log(new AuditEntry("u", "q", Instant.now(), "SUCCESS", 0.0, null)))
                .isInstanceOf(IllegalStateException.class);
    }
}
