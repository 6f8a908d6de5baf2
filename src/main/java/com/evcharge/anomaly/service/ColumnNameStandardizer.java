package com.evcharge.anomaly.service;

import com.evcharge.anomaly.model.CanonicalColumns;
import com.evcharge.anomaly.model.SessionDataset;
import com.evcharge.anomaly.model.SessionRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps the column headers seen in exported charging logs onto the canonical schema.
 *
 * Headers are lower-cased and trimmed, spaces and dots become underscores, then known
 * variants are renamed. Anything unrecognised keeps its normalised name.
 */
@Component
public class ColumnNameStandardizer {

    private static final Logger log = LoggerFactory.getLogger(ColumnNameStandardizer.class);

    // Keyed by normalised header
    private static final Map<String, String> VARIANTS = new HashMap<>();

    static {
        variants(CanonicalColumns.SESSION_ID, "sessionid", "session_id", "session_guid");
        variants(CanonicalColumns.USER_ID, "userid", "user_id", "customerid", "customer_id");
        variants(CanonicalColumns.CHARGER_ID, "chargerid", "charger_id", "chargingstationid",
                "charging_station_id", "stationid", "station_id");
        variants(CanonicalColumns.START_TIME, "starttime", "start_time", "starttimestamp",
                "start_timestamp", "timestamp");
        variants(CanonicalColumns.END_TIME, "endtime", "end_time", "endtimestamp", "end_timestamp");
        variants(CanonicalColumns.DURATION, "duration", "duration(min)", "duration_min", "chargingtime",
                "charging_time");
        variants(CanonicalColumns.ENERGY_KWH, "energy", "energy(kwh)", "energy_kwh", "energyconsumed",
                "energy_consumed", "kwh", "total_kwh");
        variants(CanonicalColumns.AMOUNT_INR, "payment", "amount", "amountinr", "amount_inr", "cost",
                "totalcost", "total_cost");
        variants(CanonicalColumns.IP_ADDRESS, "ipaddress", "ip_address", "sourceip", "source_ip");
        variants(CanonicalColumns.CPU_USAGE_PERCENT, "cpuusagepercent", "cpu_usage_percent", "cpuusage",
                "cpu_usage", "cpu_%", "cpu%");
        variants(CanonicalColumns.PACKETS_PER_SEC, "packetspersec", "packets_per_sec", "pps", "packetrate",
                "packet_rate");
        variants(CanonicalColumns.GEO_LOCATION, "geolocation", "geo_location", "location", "latlon",
                "lat/lon", "coordinates");
    }

    private static void variants(String canonical, String... names) {
        for (String name : names) {
            VARIANTS.put(name, canonical);
        }
    }

    static String normalise(String header) {
        return header.toLowerCase(Locale.ROOT).trim().replace(' ', '_').replace('.', '_');
    }

    public SessionDataset standardize(SessionDataset dataset) {
        // original header -> canonical name, first occurrence wins
        Map<String, String> renames = new LinkedHashMap<>();
        Map<String, String> mapped = new LinkedHashMap<>();
        List<String> columns = new ArrayList<>();

        for (String original : dataset.getColumns()) {
            String normalised = normalise(original);
            String target = VARIANTS.getOrDefault(normalised, normalised);
            if (columns.contains(target)) {
                log.warn("Column '{}' also maps to '{}'; keeping the earlier column", original, target);
                continue;
            }
            columns.add(target);
            renames.put(original, target);
            if (VARIANTS.containsKey(normalised)) {
                mapped.put(original, target);
            }
        }

        if (!mapped.isEmpty()) {
            log.info("Standardized columns: {}", mapped);
        }

        List<SessionRow> rows = new ArrayList<>(dataset.size());
        for (SessionRow row : dataset.getRows()) {
            Map<String, String> values = new LinkedHashMap<>();
            renames.forEach((original, target) -> values.put(target, row.get(original)));
            rows.add(new SessionRow(row.getPosition(), values));
        }
        return new SessionDataset(columns, rows);
    }
}
