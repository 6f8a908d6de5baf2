package com.evcharge.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.evcharge.anomaly.config.AerospikeConfig;
import com.evcharge.anomaly.model.AnomalyLogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Append-only log of findings, one Aerospike record per finding.
 */
@Repository
public class AnomalyLogRepository {

    private static final Logger log = LoggerFactory.getLogger(AnomalyLogRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final ScanPolicy scanPolicy;

    public AnomalyLogRepository(AerospikeClient client,
                                @Qualifier("aerospikeNamespace") String namespace,
                                @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                @Qualifier("defaultScanPolicy") ScanPolicy scanPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.scanPolicy = scanPolicy;
    }

    public boolean isConnected() {
        return client.isConnected();
    }

    /**
     * Write every entry under a fresh random key. Stops at the first failed write.
     *
     * @return number of entries written
     * @throws AerospikeException if a write fails; entries before it stay written
     */
    public int saveAll(List<AnomalyLogEntry> entries) {
        int written = 0;
        for (AnomalyLogEntry entry : entries) {
            Key key = new Key(namespace, AerospikeConfig.SET_ANOMALY_LOGS, UUID.randomUUID().toString());
            client.put(writePolicy, key,
                    new Bin("sessionId", entry.getSessionId()),
                    new Bin("anomalyType", entry.getAnomalyType()),
                    new Bin("timestamp", entry.getTimestamp()),
                    new Bin("details", entry.getDetails()),
                    new Bin("detectedAt", entry.getDetectionTimestamp()),
                    new Bin("detectedAtMs", entry.getDetectedAtMs()));
            written++;
        }
        log.debug("Wrote {} anomaly log records", written);
        return written;
    }

    /**
     * @return up to {@code limit} entries, most recently detected first
     */
    public List<AnomalyLogEntry> findRecent(int limit) {
        List<AnomalyLogEntry> results = new ArrayList<>();

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ANOMALY_LOGS,
                (key, record) -> {
                    AnomalyLogEntry entry = mapRecord(record);
                    synchronized (results) {
                        results.add(entry);
                    }
                });

        results.sort(Comparator.comparingLong(AnomalyLogEntry::getDetectedAtMs).reversed());
        if (results.size() > limit) {
            return new ArrayList<>(results.subList(0, limit));
        }
        return results;
    }

    private AnomalyLogEntry mapRecord(Record record) {
        return AnomalyLogEntry.builder()
                .sessionId(record.getString("sessionId"))
                .anomalyType(record.getString("anomalyType"))
                .timestamp(record.getString("timestamp"))
                .details(record.getString("details"))
                .detectionTimestamp(record.getString("detectedAt"))
                .detectedAtMs(record.getLong("detectedAtMs"))
                .build();
    }
}
