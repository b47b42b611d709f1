package com.fbo.reconciliation.bulk;

import com.fbo.reconciliation.cache.RemoteFetchCache;
import com.fbo.reconciliation.core.model.FacilityRecord;
import com.fbo.reconciliation.lock.LocalLocationLock;
import com.fbo.reconciliation.merge.Deduplicator;
import com.fbo.reconciliation.merge.FieldMergePolicy;
import com.fbo.reconciliation.merge.Reconciler;
import com.fbo.reconciliation.metrics.MetricsService;
import com.fbo.reconciliation.rules.FacilityNameRules;
import com.fbo.reconciliation.rules.NormalizationEngine;
import com.fbo.reconciliation.store.InMemoryLocalStore;
import com.fbo.reconciliation.store.StoreMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.StringReader;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BaselineLoaderTest {

    private static final Instant NOW = Instant.parse("2024-06-01T08:00:00Z");
    private static final String HEADER = "location_code,name,phone,radio_frequency,website,jet_a_price,avgas_price,"
            + "fuel_price_date,crew_car,crew_lounge,catering,maintenance,hangars,deice,oxygen,ground_power,"
            + "lavatory_service,handling_fee,overnight_fee,ramp_fee,ramp_fee_waived\n";
    private static final String DATASET = HEADER
            + "KSFO,Signature Aviation,650-555-0100,,,6.50,,2024-03-01,yes,,,,,,,,,,,,\n"
            + "KSFO,Atlantic,650-555-0200,,,,,,,,,,,,,,,,,,\n"
            + "KJFK,Sheltair,718-555-0300,,,,,,,,,,,,,,,,,,\n"
            + "KJFK,Too,short\n";

    @Mock
    private RemoteFetchCache fetchCache;

    @Mock
    private MetricsService metrics;

    private InMemoryLocalStore store;
    private BaselineLoader loader;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        NormalizationEngine normalizer = FacilityNameRules.createDefaultEngine();
        Reconciler reconciler = new Reconciler(normalizer, new Deduplicator(normalizer), new FieldMergePolicy());
        store = new InMemoryLocalStore();
        loader = new BaselineLoader(new CsvBaselineImporter(clock), store, new LocalLocationLock(), reconciler,
                fetchCache, metrics, clock);
    }

    @Test
    @DisplayName("First import should populate every location and record the version")
    void testFirstImport() {
        Optional<ImportResult> result = loader.loadIfNewer(new StringReader(DATASET), 2);

        assertTrue(result.isPresent());
        assertEquals(3, result.get().importedCount());
        assertEquals(2, store.get("KSFO").size());
        assertEquals(1, store.get("KJFK").size());
        assertEquals(new StoreMetadata(2, NOW), store.metadata());
        verify(fetchCache).invalidateAll();
        verify(metrics).recordImportSkipped(1L);
    }

    @Test
    @DisplayName("Should skip a dataset that is not newer than the stored one")
    void testSkipsOlderVersion() {
        store.updateMetadata(new StoreMetadata(2, NOW));

        assertTrue(loader.loadIfNewer(new StringReader(DATASET), 2).isEmpty());
        assertTrue(loader.loadIfNewer(new StringReader(DATASET), 1).isEmpty());

        assertTrue(store.locationCodes().isEmpty());
        verifyNoInteractions(fetchCache);
    }

    @Test
    @DisplayName("Forced reload should import even when the version is not newer")
    void testForceReload() {
        store.updateMetadata(new StoreMetadata(5, NOW));

        ImportResult result = loader.forceReload(new StringReader(DATASET), 5);

        assertEquals(3, result.importedCount());
        assertEquals(2, store.get("KSFO").size());
        assertEquals(5, store.metadata().importedDatasetVersion());
    }

    @Test
    @DisplayName("A version bump should keep user edits made since the previous import")
    void testKeepsUserEdits() {
        FacilityRecord edited = FacilityRecord.builder()
                .locationCode("KSFO")
                .name("Signature FBO")
                .phone("650-555-0199")
                .updatedBy("pilot")
                .lastUpdated(Instant.parse("2024-05-01T00:00:00Z"))
                .remoteIdentifier("r-1")
                .pendingUpload(true)
                .build();
        FacilityRecord userOnly = FacilityRecord.builder()
                .locationCode("KSFO").name("Ross").updatedBy("pilot").build();
        store.replace("KSFO", List.of(edited, userOnly));
        store.updateMetadata(new StoreMetadata(1, null));

        loader.loadIfNewer(new StringReader(DATASET), 2);

        List<FacilityRecord> ksfo = store.get("KSFO");
        assertEquals(List.of("Atlantic", "Ross", "Signature FBO"),
                ksfo.stream().map(FacilityRecord::getName).toList());

        FacilityRecord signature = ksfo.get(2);
        assertEquals("650-555-0199", signature.getPhone());
        assertEquals("r-1", signature.getRemoteIdentifier());
        assertTrue(signature.isVerified());
        assertTrue(signature.isPendingUpload());
        assertEquals("pilot", signature.getUpdatedBy());
        assertEquals(Instant.parse("2024-05-01T00:00:00Z"), signature.getLastUpdated());
        assertEquals(6.50, signature.getJetAPrice());
    }

    @Test
    @DisplayName("A clean dataset should not record skipped rows")
    void testNoSkippedMetricWhenClean() {
        loader.loadIfNewer(new StringReader(HEADER + "KSFO,Signature,,,,,,,,,,,,,,,,,,,\n"), 1);

        verify(metrics, never()).recordImportSkipped(anyLong());
    }
}
