package com.delayer.timer.infrastructure;

import com.delayer.timer.config.RedisConfig;
import com.delayer.timer.exception.JobMetadataNotFoundException;
import com.delayer.timer.exception.StoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.util.LinkedHashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RedisJobStore command mapping and error translation.
 */
@ExtendWith(MockitoExtension.class)
class RedisJobStoreTest {

    @Mock
    private RedisTemplate<String, String> redisTemplate;

    @Mock
    private ZSetOperations<String, String> zSetOperations;

    @Mock
    private HashOperations<String, Object, Object> hashOperations;

    @SuppressWarnings("rawtypes")
    private final RedisScript<List> promoteJobsScript = new DefaultRedisScript<>("return {0}", List.class);

    private RedisJobStore jobStore;

    @BeforeEach
    void setUp() {
        jobStore = new RedisJobStore(redisTemplate, promoteJobsScript);
    }

    @Test
    void testRangeByScore_ReturnsMembersInScoreOrder() {
        // Arrange
        when(redisTemplate.opsForZSet()).thenReturn(zSetOperations);
        when(zSetOperations.rangeByScore(StoreKeys.JOB_POOL, 0, 100))
                .thenReturn(new LinkedHashSet<>(List.of("job1", "job2")));

        // Act
        List<String> members = jobStore.rangeByScore(StoreKeys.JOB_POOL, 0, 100);

        // Assert
        assertEquals(List.of("job1", "job2"), members);
    }

    @Test
    void testRangeByScore_ConnectionFailure_TranslatedToStoreException() {
        // Arrange
        when(redisTemplate.opsForZSet()).thenReturn(zSetOperations);
        when(zSetOperations.rangeByScore(StoreKeys.JOB_POOL, 0, 100))
                .thenThrow(new RedisConnectionFailureException("Connection refused"));

        // Act & Assert
        StoreException e = assertThrows(StoreException.class,
                () -> jobStore.rangeByScore(StoreKeys.JOB_POOL, 0, 100));
        assertInstanceOf(RedisConnectionFailureException.class, e.getCause());
    }

    @Test
    void testGetField_ReturnsTopic() {
        // Arrange
        when(redisTemplate.opsForHash()).thenReturn(hashOperations);
        when(hashOperations.get("delayer:job_bucket:job1", "topic")).thenReturn("alerts");

        // Act & Assert
        assertEquals("alerts", jobStore.getField("delayer:job_bucket:job1", "topic"));
        verify(redisTemplate, never()).hasKey(any());
    }

    @Test
    void testGetField_MissingHash_ThrowsNotFound() {
        // Arrange
        when(redisTemplate.opsForHash()).thenReturn(hashOperations);
        when(hashOperations.get("delayer:job_bucket:job3", "topic")).thenReturn(null);
        when(redisTemplate.hasKey("delayer:job_bucket:job3")).thenReturn(false);

        // Act & Assert
        JobMetadataNotFoundException e = assertThrows(JobMetadataNotFoundException.class,
                () -> jobStore.getField("delayer:job_bucket:job3", "topic"));
        assertEquals("delayer:job_bucket:job3", e.getBucketKey());
    }

    @Test
    void testGetField_HashWithoutField_ReturnsNull() {
        // Arrange
        when(redisTemplate.opsForHash()).thenReturn(hashOperations);
        when(hashOperations.get("delayer:job_bucket:job5", "topic")).thenReturn(null);
        when(redisTemplate.hasKey("delayer:job_bucket:job5")).thenReturn(true);

        // Act & Assert
        assertNull(jobStore.getField("delayer:job_bucket:job5", "topic"));
    }

    @Test
    void testRemoveMembers_ReturnsRemovedCount() {
        // Arrange
        when(redisTemplate.opsForZSet()).thenReturn(zSetOperations);
        when(zSetOperations.remove(StoreKeys.JOB_POOL, "job3")).thenReturn(1L);

        // Act & Assert
        assertEquals(1L, jobStore.removeMembers(StoreKeys.JOB_POOL, List.of("job3")));
    }

    @Test
    void testRemoveAndAppend_ReturnsOnlyIdsTheScriptMoved() {
        // Arrange
        when(redisTemplate.execute(promoteJobsScript, List.of(StoreKeys.JOB_POOL, "delayer:ready_queue:alerts"),
                "job1", "job2")).thenReturn(List.of(4L, "job2"));

        // Act
        TransferResult result = jobStore.removeAndAppend(
                StoreKeys.JOB_POOL, "delayer:ready_queue:alerts", List.of("job1", "job2"));

        // Assert
        assertEquals(List.of("job2"), result.getMovedIds());
        assertEquals(1L, result.getRemoved());
        assertEquals(4L, result.getQueueLength());
    }

    @Test
    void testRemoveAndAppend_NothingMoved_ReturnsLengthOnly() {
        // Arrange
        when(redisTemplate.execute(promoteJobsScript, List.of(StoreKeys.JOB_POOL, "delayer:ready_queue:alerts"),
                "job1")).thenReturn(List.of(3L));

        // Act
        TransferResult result = jobStore.removeAndAppend(
                StoreKeys.JOB_POOL, "delayer:ready_queue:alerts", List.of("job1"));

        // Assert
        assertTrue(result.getMovedIds().isEmpty());
        assertEquals(3L, result.getQueueLength());
    }

    @Test
    void testRemoveAndAppend_EmptyReply_ThrowsStoreException() {
        // Arrange
        when(redisTemplate.execute(promoteJobsScript, List.of(StoreKeys.JOB_POOL, "delayer:ready_queue:alerts"),
                "job1")).thenReturn(List.of());

        // Act & Assert
        assertThrows(StoreException.class, () -> jobStore.removeAndAppend(
                StoreKeys.JOB_POOL, "delayer:ready_queue:alerts", List.of("job1")));
    }

    @Test
    void testRemoveAndAppend_ConnectionFailure_TranslatedToStoreException() {
        // Arrange
        when(redisTemplate.execute(promoteJobsScript, List.of(StoreKeys.JOB_POOL, "delayer:ready_queue:alerts"),
                "job1")).thenThrow(new RedisConnectionFailureException("Connection reset"));

        // Act & Assert
        StoreException e = assertThrows(StoreException.class, () -> jobStore.removeAndAppend(
                StoreKeys.JOB_POOL, "delayer:ready_queue:alerts", List.of("job1")));
        assertInstanceOf(RedisConnectionFailureException.class, e.getCause());
    }

    @Test
    void testPromoteJobsScript_PushesOnlyRemovedIds() {
        // Act
        String source = new RedisConfig().promoteJobsScript().getScriptAsString();

        // Assert
        assertTrue(source.contains("redis.call('ZREM', KEYS[1], id) == 1"));
        assertTrue(source.contains("'LPUSH', KEYS[2]"));
    }
}
