package com.eyelevel.ocrprocessor.repository;

import com.eyelevel.ocrprocessor.common.json.JsonParser;
import com.eyelevel.ocrprocessor.common.json.JsonSerializer;
import com.eyelevel.ocrprocessor.config.OcrProcessingConfig;
import com.eyelevel.ocrprocessor.exception.JobStoreException;
import com.eyelevel.ocrprocessor.exception.apiclient.JobNotFoundException;
import com.eyelevel.ocrprocessor.model.Job;
import com.eyelevel.ocrprocessor.model.JobResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.util.CollectionUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Redis-backed {@link JobStore}.
 * <p>
 * Layout, with the configurable prefix {@code ocr}:
 * <ul>
 *     <li>{@code ocr:job:<id>} - JSON job record, expiring after the retention window.</li>
 *     <li>{@code ocr:result:<id>} - JSON result, expiring independently after the retention window.</li>
 *     <li>{@code ocr:jobs} - sorted set of job ids scored by creation time in epoch seconds.</li>
 * </ul>
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "app.processing.store", name = "type", havingValue = "redis", matchIfMissing = true)
public class RedisJobStore implements JobStore {

    private final StringRedisTemplate redisTemplate;
    private final JsonSerializer jsonSerializer;
    private final JsonParser jsonParser;
    private final Duration retention;
    private final String jobKeyPrefix;
    private final String resultKeyPrefix;
    private final String indexKey;

    public RedisJobStore(StringRedisTemplate redisTemplate, JsonSerializer jsonSerializer, JsonParser jsonParser,
                         OcrProcessingConfig config) {
        this.redisTemplate = redisTemplate;
        this.jsonSerializer = jsonSerializer;
        this.jsonParser = jsonParser;
        this.retention = config.getRetention();
        final String prefix = config.getStore().getKeyPrefix();
        this.jobKeyPrefix = prefix + ":job:";
        this.resultKeyPrefix = prefix + ":result:";
        this.indexKey = prefix + ":jobs";
        log.info("Redis job store initialized with key prefix '{}' and retention {}.", prefix, retention);
    }

    @Override
    public void put(Job job) {
        final String payload = jsonSerializer.serialize(job);
        execute("put job " + job.getId(), () -> {
            redisTemplate.opsForValue().set(jobKey(job.getId()), payload, retention);
            return null;
        });
    }

    @Override
    public boolean replace(Job job) {
        final String payload = jsonSerializer.serialize(job);
        final Boolean written = execute("replace job " + job.getId(),
                () -> redisTemplate.opsForValue().setIfPresent(jobKey(job.getId()), payload, retention));
        return Boolean.TRUE.equals(written);
    }

    @Override
    public Optional<Job> get(String jobId) {
        final String payload = execute("get job " + jobId, () -> redisTemplate.opsForValue().get(jobKey(jobId)));
        return Optional.ofNullable(payload).map(json -> jsonParser.parseObject(json, Job.class));
    }

    @Override
    public void putResult(String jobId, JobResult result) {
        final Boolean jobExists = execute("check job " + jobId, () -> redisTemplate.hasKey(jobKey(jobId)));
        if (!Boolean.TRUE.equals(jobExists)) {
            throw new JobNotFoundException(jobId);
        }
        final String payload = jsonSerializer.serialize(result);
        execute("put result " + jobId, () -> {
            redisTemplate.opsForValue().set(resultKey(jobId), payload, retention);
            return null;
        });
    }

    @Override
    public Optional<JobResult> getResult(String jobId) {
        final String payload = execute("get result " + jobId, () -> redisTemplate.opsForValue().get(resultKey(jobId)));
        return Optional.ofNullable(payload).map(json -> jsonParser.parseObject(json, JobResult.class));
    }

    @Override
    public void deleteResult(String jobId) {
        execute("delete result " + jobId, () -> redisTemplate.delete(resultKey(jobId)));
    }

    @Override
    public void indexAdd(String jobId, Instant timestamp) {
        execute("index job " + jobId, () -> redisTemplate.opsForZSet().add(indexKey, jobId, toScore(timestamp)));
    }

    @Override
    public List<String> sweepExpired(Instant now) {
        final double cutoff = toScore(now.minus(retention));
        final Set<String> expiredIds = execute("scan retention index",
                () -> redisTemplate.opsForZSet().rangeByScore(indexKey, 0, cutoff));

        if (CollectionUtils.isEmpty(expiredIds)) {
            log.debug("No index entries older than {}.", now.minus(retention));
            return List.of();
        }

        for (final String jobId : expiredIds) {
            // Either key may already be gone through its own TTL.
            execute("sweep job " + jobId, () -> redisTemplate.delete(List.of(jobKey(jobId), resultKey(jobId))));
        }
        execute("trim retention index", () -> redisTemplate.opsForZSet().removeRangeByScore(indexKey, 0, cutoff));
        log.debug("Swept {} expired job ids from '{}'.", expiredIds.size(), indexKey);
        return List.copyOf(expiredIds);
    }

    @Override
    public boolean delete(String jobId) {
        final Long removed = execute("delete job " + jobId,
                () -> redisTemplate.delete(List.of(jobKey(jobId), resultKey(jobId))));
        execute("unindex job " + jobId, () -> redisTemplate.opsForZSet().remove(indexKey, jobId));
        return removed != null && removed > 0;
    }

    private String jobKey(String jobId) {
        return jobKeyPrefix + jobId;
    }

    private String resultKey(String jobId) {
        return resultKeyPrefix + jobId;
    }

    private static double toScore(Instant instant) {
        return instant.toEpochMilli() / 1000.0;
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("Redis operation '{}' failed: {}", operation, e.getMessage());
            throw new JobStoreException("Job store operation failed: " + operation, e);
        }
    }
}
