package com.fbo.reconciliation.merge;

import com.fbo.reconciliation.core.model.FacilityRecord;
import com.fbo.reconciliation.rules.NormalizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges an incoming batch of records into the local collection of one location.
 *
 * <p>Local records are keyed by normalized name. Each incoming record is merged into its
 * match through {@link FieldMergePolicy}, or added when nothing local matches. The result goes
 * through {@link Deduplicator} once more, since the incoming batch may itself hold
 * near-duplicate names.</p>
 *
 * <p>The outcome depends on where {@code incoming} came from: the merge policy treats
 * import-labelled records differently from backend or user ones. No I/O happens here; the
 * caller persists the result.</p>
 */
public class Reconciler {
    private static final Logger log = LoggerFactory.getLogger(Reconciler.class);

    private final NormalizationEngine normalizer;
    private final Deduplicator deduplicator;
    private final FieldMergePolicy mergePolicy;

    public Reconciler(NormalizationEngine normalizer, Deduplicator deduplicator, FieldMergePolicy mergePolicy) {
        this.normalizer = normalizer;
        this.deduplicator = deduplicator;
        this.mergePolicy = mergePolicy;
    }

    public List<FacilityRecord> reconcile(List<FacilityRecord> local, List<FacilityRecord> incoming) {
        return reconcileWithSummary(local, incoming).records();
    }

    public ReconciliationSummary reconcileWithSummary(List<FacilityRecord> local, List<FacilityRecord> incoming) {
        Map<String, FacilityRecord> byKey = new LinkedHashMap<>();
        for (FacilityRecord record : deduplicator.deduplicate(local)) {
            byKey.put(normalizer.normalize(record.getName()), record);
        }

        int merged = 0;
        int added = 0;
        for (FacilityRecord record : incoming) {
            String key = normalizer.normalize(record.getName());
            FacilityRecord existing = byKey.get(key);
            if (existing != null) {
                byKey.put(key, mergePolicy.mergeFields(existing, record));
                merged++;
            } else {
                byKey.put(key, record);
                added++;
            }
        }

        List<FacilityRecord> values = new ArrayList<>(byKey.values());
        List<FacilityRecord> result = deduplicator.deduplicate(values);
        int collapsed = values.size() - result.size();

        log.debug("reconcile.completed local={} incoming={} merged={} added={} result={}",
                local.size(), incoming.size(), merged, added, result.size());
        return new ReconciliationSummary(result, merged, added, collapsed);
    }

    public NormalizationEngine getNormalizer() {
        return normalizer;
    }

    public FieldMergePolicy getMergePolicy() {
        return mergePolicy;
    }
}
