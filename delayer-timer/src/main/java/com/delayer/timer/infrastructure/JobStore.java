package com.delayer.timer.infrastructure;

import java.util.Collection;
import java.util.List;

/**
 * Store operations the timer needs. Implementations acquire a pooled connection per
 * call and release it before returning, on failure too.
 */
public interface JobStore {

    /**
     * Members of a sorted set whose score lies in [min, max].
     *
     * @return members in ascending score order, empty if none
     * @throws com.delayer.timer.exception.StoreException on connectivity or protocol failure
     */
    List<String> rangeByScore(String key, double min, double max);

    /**
     * Read one field of a hash.
     *
     * @return the field value, or null if the hash exists without that field
     * @throws com.delayer.timer.exception.JobMetadataNotFoundException if the hash does not exist
     * @throws com.delayer.timer.exception.StoreException on connectivity or protocol failure
     */
    String getField(String key, String field);

    /**
     * Remove members from a sorted set outside of any transaction.
     *
     * @return number of members actually removed
     */
    long removeMembers(String key, Collection<String> members);

    /**
     * Atomically remove {@code members} from the sorted set at {@code indexKey} and push onto
     * the list at {@code queueKey} exactly those that were removed. Members already gone from
     * the sorted set are not pushed.
     *
     * @return the pushed members and the list length afterwards
     * @throws com.delayer.timer.exception.StoreException if the store call fails
     */
    TransferResult removeAndAppend(String indexKey, String queueKey, List<String> members);
}
