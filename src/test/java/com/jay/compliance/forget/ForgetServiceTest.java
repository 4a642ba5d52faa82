package com.jay.compliance.forget;

import com.jay.compliance.config.ComplianceConfig;
import com.jay.compliance.entity.ForgetRequest;
import com.jay.compliance.layer3_cache.ForgetTombstones;
import com.jay.compliance.layer3_cache.LocalKeyValueStore;
import com.jay.compliance.layer6_audit.AuditLogger;
import com.jay.compliance.layer6_audit.PiiRedactor;
import com.jay.compliance.repository.ForgetRequestRepository;
import com.jay.compliance.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ForgetService")
class ForgetServiceTest {

    @Mock
    private ForgetRequestRepository repository;

    private final PiiRedactor redactor = new PiiRedactor("forget-key");
    private MutableClock clock;
    private ForgetTombstones tombstones;
    private ForgetService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T09:00:00Z");
        tombstones = new ForgetTombstones(new LocalKeyValueStore(clock), Duration.ofDays(1));
        service = new ForgetService(repository, tombstones, redactor, new AuditLogger(redactor),
            new ComplianceConfig(), clock);
    }

    @Test
    @DisplayName("submit persists only the hashed identifier")
    void submitHashes() {
        when(repository.save(any(ForgetRequest.class))).thenAnswer(inv -> {
            ForgetRequest r = inv.getArgument(0);
            r.setId(11L);
            return r;
        });

        ForgetRequest job = service.submit(" 1234 5678 ");

        ArgumentCaptor<ForgetRequest> saved = ArgumentCaptor.forClass(ForgetRequest.class);
        verify(repository).save(saved.capture());
        assertThat(saved.getValue().getSubjectHash())
            .isEqualTo(redactor.hashIdentifier("12345678"))
            .doesNotContain("12345678");
        assertThat(job.getId()).isEqualTo(11L);
        assertThat(job.getStatus()).isEqualTo(ForgetRequest.Status.PENDING);
    }

    @Test
    @DisplayName("blank identifier is rejected")
    void blankRejected() {
        assertThatThrownBy(() -> service.submit("  ")).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(repository);
    }

    @Test
    @DisplayName("processing writes a tombstone and completes the job")
    void process() {
        String hash = redactor.hashIdentifier("12345678");
        ForgetRequest pending = ForgetRequest.builder()
            .id(3L).subjectHash(hash).status(ForgetRequest.Status.PENDING).requestedAt(clock.instant()).build();
        when(repository.findByStatusOrderByIdAsc(eq(ForgetRequest.Status.PENDING), any(Pageable.class)))
            .thenReturn(List.of(pending));

        Instant pulledBefore = clock.instant().minusSeconds(60);
        assertThat(service.processPending()).isEqualTo(1);

        assertThat(pending.getStatus()).isEqualTo(ForgetRequest.Status.COMPLETED);
        assertThat(pending.getCompletedAt()).isEqualTo(clock.instant());
        verify(repository).save(pending);
        assertThat(tombstones.covers(hash, pulledBefore)).isTrue();
        assertThat(tombstones.covers(hash, clock.instant().plusSeconds(1))).isFalse();
        assertThat(tombstones.covers(redactor.hashIdentifier("87654321"), pulledBefore)).isFalse();
    }
}
