package com.delayer.timer.service;

import com.delayer.timer.domain.ResolvedJob;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups resolved jobs by topic. Jobs without a topic are dropped.
 * Order inside a group follows the order of the input, which is lookup completion order.
 */
@Service
public class TopicGrouper {

    public Map<String, List<String>> group(List<ResolvedJob> resolvedJobs) {
        Map<String, List<String>> groups = new LinkedHashMap<>();
        for (ResolvedJob job : resolvedJobs) {
            if (!job.hasTopic()) {
                continue;
            }
            groups.computeIfAbsent(job.getTopic(), topic -> new ArrayList<>()).add(job.getJobId());
        }
        return groups;
    }
}
