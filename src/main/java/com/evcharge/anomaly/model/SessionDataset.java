package com.evcharge.anomaly.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tabular batch of charging sessions: ordered column names plus rows in upload order.
 * Immutable; transformations return a new dataset.
 */
public final class SessionDataset {

    private final List<String> columns;
    private final Set<String> columnSet;
    private final List<SessionRow> rows;

    public SessionDataset(List<String> columns, List<SessionRow> rows) {
        this.columns = List.copyOf(columns);
        this.columnSet = Collections.unmodifiableSet(new LinkedHashSet<>(columns));
        this.rows = List.copyOf(rows);
    }

    /**
     * Build a dataset from records keyed by column name, assigning positions in list order.
     */
    public static SessionDataset of(List<String> columns, List<Map<String, String>> records) {
        List<SessionRow> rows = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            rows.add(new SessionRow(i, records.get(i)));
        }
        return new SessionDataset(columns, rows);
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<SessionRow> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    /**
     * @return the requested columns that are not present, in the order requested
     */
    public List<String> missingColumns(Collection<String> required) {
        List<String> missing = new ArrayList<>();
        for (String column : required) {
            if (!columnSet.contains(column)) {
                missing.add(column);
            }
        }
        return missing;
    }

    public SessionDataset withParsedTimes() {
        List<SessionRow> parsed = new ArrayList<>(rows.size());
        for (SessionRow row : rows) {
            parsed.add(row.withParsedTimes());
        }
        return new SessionDataset(columns, parsed);
    }
}
