package com.eyelevel.ocrprocessor.repository;

import com.eyelevel.ocrprocessor.common.json.jackson.JacksonJsonParser;
import com.eyelevel.ocrprocessor.common.json.jackson.JacksonJsonSerializer;
import com.eyelevel.ocrprocessor.config.OcrProcessingConfig;
import com.eyelevel.ocrprocessor.exception.JobStoreException;
import com.eyelevel.ocrprocessor.exception.apiclient.JobNotFoundException;
import com.eyelevel.ocrprocessor.model.FileCategory;
import com.eyelevel.ocrprocessor.model.Job;
import com.eyelevel.ocrprocessor.model.JobResult;
import com.eyelevel.ocrprocessor.model.JobStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.ZSetOperations;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisJobStoreTest {

    private static final Duration RETENTION = Duration.ofHours(24);

    @Mock
    private StringRedisTemplate redisTemplate;
    @Mock
    private ValueOperations<String, String> valueOperations;
    @Mock
    private ZSetOperations<String, String> zSetOperations;

    private RedisJobStore store;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
        OcrProcessingConfig config = new OcrProcessingConfig();
        config.setRetention(RETENTION);
        store = new RedisJobStore(redisTemplate, new JacksonJsonSerializer(objectMapper),
                new JacksonJsonParser(objectMapper), config);
    }

    @Test
    void put_writesJsonUnderJobKeyWithRetentionTtl() {
        // Given
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        Job job = Job.builder().id("j1").fileName("scan.png").category(FileCategory.IMAGE)
                .status(JobStatus.PENDING).createdAt(Instant.parse("2024-05-01T10:00:00Z")).build();

        // When
        store.put(job);

        // Then
        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(valueOperations).set(eq("ocr:job:j1"), payload.capture(), eq(RETENTION));
        assertThat(payload.getValue()).contains("\"status\":\"pending\"").contains("\"category\":\"image\"");
    }

    @Test
    void get_parsesStoredJob() {
        // Given
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("ocr:job:j1"))
                .thenReturn("{\"id\":\"j1\",\"status\":\"processing\",\"progress\":30,\"category\":\"pdf\"}");

        // When / Then
        assertThat(store.get("j1")).get().satisfies(job -> {
            assertThat(job.getStatus()).isEqualTo(JobStatus.PROCESSING);
            assertThat(job.getProgress()).isEqualTo(30);
            assertThat(job.getCategory()).isEqualTo(FileCategory.PDF);
        });
    }

    @Test
    void putResult_refusesWhenJobIsGone() {
        // Given
        when(redisTemplate.hasKey("ocr:job:j1")).thenReturn(false);

        // When / Then
        assertThatThrownBy(() -> store.putResult("j1", JobResult.builder().jobId("j1").build()))
                .isInstanceOf(JobNotFoundException.class);
        verify(redisTemplate, never()).opsForValue();
    }

    @Test
    void putResult_writesResultKeyWithRetentionTtl() {
        // Given
        when(redisTemplate.hasKey("ocr:job:j1")).thenReturn(true);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);

        // When
        store.putResult("j1", JobResult.builder().jobId("j1").build());

        // Then
        verify(valueOperations).set(eq("ocr:result:j1"), anyString(), eq(RETENTION));
    }

    @Test
    void replace_usesConditionalSetWithRetentionTtl() {
        // Given
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfPresent(eq("ocr:job:j1"), anyString(), eq(RETENTION))).thenReturn(true);
        Job job = Job.builder().id("j1").status(JobStatus.PROCESSING).progress(70).build();

        // When / Then
        assertThat(store.replace(job)).isTrue();
        verify(valueOperations, never()).set(anyString(), anyString(), eq(RETENTION));
    }

    @Test
    void replace_reportsAbsentJob() {
        // Given
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfPresent(eq("ocr:job:j1"), anyString(), eq(RETENTION))).thenReturn(false);

        // When / Then
        assertThat(store.replace(Job.builder().id("j1").status(JobStatus.PROCESSING).build())).isFalse();
    }

    @Test
    void deleteResult_removesOnlyTheResultKey() {
        // When
        store.deleteResult("j1");

        // Then
        verify(redisTemplate).delete("ocr:result:j1");
        verify(redisTemplate, never()).delete(List.of("ocr:job:j1", "ocr:result:j1"));
    }

    @Test
    void sweepExpired_deletesKeysOfIndexedJobsOlderThanRetention() {
        // Given
        Instant now = Instant.parse("2024-05-02T12:00:00Z");
        double cutoff = now.minus(RETENTION).toEpochMilli() / 1000.0;
        when(redisTemplate.opsForZSet()).thenReturn(zSetOperations);
        when(zSetOperations.rangeByScore("ocr:jobs", 0, cutoff)).thenReturn(new LinkedHashSet<>(List.of("a", "b")));

        // When
        List<String> removed = store.sweepExpired(now);

        // Then
        assertThat(removed).containsExactly("a", "b");
        verify(redisTemplate).delete(List.of("ocr:job:a", "ocr:result:a"));
        verify(redisTemplate).delete(List.of("ocr:job:b", "ocr:result:b"));
        verify(zSetOperations).removeRangeByScore("ocr:jobs", 0, cutoff);
    }

    @Test
    void delete_removesBothKeysAndIndexEntry() {
        // Given
        when(redisTemplate.delete(List.of("ocr:job:j1", "ocr:result:j1"))).thenReturn(1L);
        when(redisTemplate.opsForZSet()).thenReturn(zSetOperations);

        // When / Then
        assertThat(store.delete("j1")).isTrue();
        verify(zSetOperations).remove("ocr:jobs", "j1");
    }

    @Test
    void redisFailuresSurfaceAsJobStoreException() {
        // Given
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("ocr:job:j1")).thenThrow(new RedisConnectionFailureException("connection refused"));

        // When / Then
        assertThatThrownBy(() -> store.get("j1"))
                .isInstanceOf(JobStoreException.class)
                .hasCauseInstanceOf(RedisConnectionFailureException.class);
    }
}
