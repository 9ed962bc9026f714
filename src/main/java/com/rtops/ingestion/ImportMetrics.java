package com.rtops.ingestion;

import com.rtops.ingestion.source.SourceKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Metrics collector for catalog import passes.
 * 
 * Tracks:
 * - Source attempts by kind and outcome (imported, missing, failed)
 * - Records inserted or enriched by source kind
 * - Duration of whole import passes
 */
@Component
public class ImportMetrics {
    
    private final MeterRegistry registry;
    private final Timer passDuration;
    
    public ImportMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.passDuration = Timer.builder("rtops.import.duration")
            .description("Duration of catalog import passes")
            .tag("component", "ingestion")
            .register(registry);
    }
    
    public void recordSource(SourceKind kind, SourceOutcome.Status status) {
        Counter.builder("rtops.import.sources")
            .description("Import source attempts by kind and outcome")
            .tag("kind", kind == null ? "unknown" : kind.getValue())
            .tag("outcome", status.getValue())
            .register(registry)
            .increment();
    }
    
    public void recordChanges(SourceKind kind, int changes) {
        if (changes <= 0) {
            return;
        }
        Counter.builder("rtops.import.changes")
            .description("Catalog records inserted or enriched by source kind")
            .tag("kind", kind == null ? "unknown" : kind.getValue())
            .register(registry)
            .increment(changes);
    }
    
    public void recordPassDuration(long millis) {
        passDuration.record(millis, TimeUnit.MILLISECONDS);
    }
}
