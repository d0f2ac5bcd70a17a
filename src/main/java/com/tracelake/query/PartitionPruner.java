package com.tracelake.query;

import com.tracelake.domain.EventKind;
import com.tracelake.domain.Manifest;
import com.tracelake.domain.PartitionHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Drops partitions that cannot hold matching rows, using the manifest's
 * per-partition time bounds and key column bounds
 */
@Component
public class PartitionPruner {

    private static final Logger logger = LoggerFactory.getLogger(PartitionPruner.class);

    public List<PartitionHandle> prune(Manifest manifest, QuerySpec spec) {
        EventKind kind = spec.getKind();
        List<PartitionHandle> candidates = manifest.partitionsOf(kind);
        TimeRange range = spec.getFilters().getTimeRange();
        String keyValue = spec.getFilters().equalityValue(kind.getPruningColumn());

        List<PartitionHandle> selected = new ArrayList<>();
        for (PartitionHandle partition : candidates) {
            if (range != null && !range.overlaps(partition.getMinTsEpoch(), partition.getMaxTsEpoch())) {
                continue;
            }
            if (keyValue != null && !mayContain(partition, keyValue)) {
                continue;
            }
            selected.add(partition);
        }
        logger.debug("Pruned {} partitions to {} for {}", candidates.size(), selected.size(), spec);
        return selected;
    }

    private static boolean mayContain(PartitionHandle partition, String value) {
        if (partition.getMinKey() == null || partition.getMaxKey() == null) {
            // column is null in every row
            return false;
        }
        return value.compareTo(partition.getMinKey()) >= 0 && value.compareTo(partition.getMaxKey()) <= 0;
    }
}
