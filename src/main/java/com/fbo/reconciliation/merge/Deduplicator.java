package com.fbo.reconciliation.merge;

import com.fbo.reconciliation.core.model.FacilityRecord;
import com.fbo.reconciliation.rules.NormalizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses records of one location whose names normalize to the same key.
 *
 * <p>The winner of a collision is the verified record, then the one with the strictly greater
 * {@code lastUpdated}; remaining ties keep the record seen first. Only selection happens here,
 * no field content is carried over from the losers. Output is sorted by name (ordinal).</p>
 */
public class Deduplicator {
    private static final Logger log = LoggerFactory.getLogger(Deduplicator.class);

    static final Comparator<FacilityRecord> BY_NAME = Comparator.comparing(FacilityRecord::getName);

    private final NormalizationEngine normalizer;

    public Deduplicator(NormalizationEngine normalizer) {
        this.normalizer = normalizer;
    }

    public List<FacilityRecord> deduplicate(List<FacilityRecord> records) {
        Map<String, FacilityRecord> winners = new LinkedHashMap<>();
        int collapsed = 0;

        for (FacilityRecord candidate : records) {
            String key = normalizer.normalize(candidate.getName());
            FacilityRecord current = winners.get(key);
            if (current == null) {
                winners.put(key, candidate);
                continue;
            }
            collapsed++;
            if (beats(candidate, current)) {
                log.debug("dedup.replaced key='{}' kept='{}' dropped='{}'",
                        key, candidate.getName(), current.getName());
                winners.put(key, candidate);
            } else {
                log.debug("dedup.dropped key='{}' kept='{}' dropped='{}'",
                        key, current.getName(), candidate.getName());
            }
        }

        if (collapsed > 0) {
            log.debug("dedup.completed input={} output={} collapsed={}",
                    records.size(), winners.size(), collapsed);
        }

        List<FacilityRecord> result = new ArrayList<>(winners.values());
        result.sort(BY_NAME);
        return result;
    }

    /**
     * True if {@code challenger} should replace {@code current} as the group representative.
     */
    static boolean beats(FacilityRecord challenger, FacilityRecord current) {
        if (challenger.isVerified() != current.isVerified()) {
            return challenger.isVerified();
        }
        return challenger.getLastUpdated().isAfter(current.getLastUpdated());
    }
}
