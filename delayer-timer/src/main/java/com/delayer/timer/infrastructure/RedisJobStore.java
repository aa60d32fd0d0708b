package com.delayer.timer.infrastructure;

import com.delayer.timer.exception.JobMetadataNotFoundException;
import com.delayer.timer.exception.StoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Redis implementation of {@link JobStore} on top of Spring Data Redis.
 * Spring's {@link DataAccessException}s are translated into {@link StoreException}.
 * Moves run as the {@code promote-jobs.lua} script so a job is pushed only by the call
 * that removed it from the pool.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RedisJobStore implements JobStore {

    private final RedisTemplate<String, String> redisTemplate;
    @SuppressWarnings("rawtypes")
    private final RedisScript<List> promoteJobsScript;

    @Override
    public List<String> rangeByScore(String key, double min, double max) {
        try {
            Set<String> members = redisTemplate.opsForZSet().rangeByScore(key, min, max);
            if (members == null) {
                // null only comes back inside a pipeline or transaction
                throw new StoreException("ZRANGEBYSCORE " + key + " returned no reply");
            }
            return new ArrayList<>(members);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to read " + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String getField(String key, String field) {
        try {
            Object value = redisTemplate.opsForHash().get(key, field);
            if (value != null) {
                return value.toString();
            }
            // Nil reply: tell a missing hash apart from a missing field
            Boolean exists = redisTemplate.hasKey(key);
            if (!Boolean.TRUE.equals(exists)) {
                throw new JobMetadataNotFoundException(key);
            }
            return null;
        } catch (DataAccessException e) {
            throw new StoreException("Failed to read " + key + "." + field + ": " + e.getMessage(), e);
        }
    }

    @Override
    public long removeMembers(String key, Collection<String> members) {
        if (members.isEmpty()) {
            return 0L;
        }
        try {
            Long removed = redisTemplate.opsForZSet().remove(key, members.toArray());
            return removed != null ? removed : 0L;
        } catch (DataAccessException e) {
            throw new StoreException("Failed to remove members from " + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public TransferResult removeAndAppend(String indexKey, String queueKey, List<String> members) {
        if (members.isEmpty()) {
            throw new IllegalArgumentException("members cannot be empty");
        }

        List<?> reply;
        try {
            reply = redisTemplate.execute(promoteJobsScript, List.of(indexKey, queueKey), members.toArray());
        } catch (DataAccessException e) {
            throw new StoreException("Moving jobs " + indexKey + " -> " + queueKey
                    + " failed: " + e.getMessage(), e);
        }

        if (reply == null || reply.isEmpty()) {
            throw new StoreException("Moving jobs " + indexKey + " -> " + queueKey
                    + " returned unexpected reply: " + reply);
        }

        log.debug("Script reply for {}: {}", queueKey, reply);
        List<String> moved = new ArrayList<>(reply.size() - 1);
        for (Object id : reply.subList(1, reply.size())) {
            moved.add(String.valueOf(id));
        }
        return new TransferResult(moved, toLong(reply.get(0)));
    }

    private static long toLong(Object reply) {
        if (reply instanceof Number) {
            return ((Number) reply).longValue();
        }
        throw new StoreException("Unexpected script reply: " + reply);
    }
}
