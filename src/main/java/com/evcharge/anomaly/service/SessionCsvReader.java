package com.evcharge.anomaly.service;

import com.evcharge.anomaly.engine.DatasetValidationException;
import com.evcharge.anomaly.model.SessionDataset;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses an uploaded UTF-8 CSV (header row first) into a {@link SessionDataset} of raw cells.
 */
@Component
public class SessionCsvReader {

    private static final Logger log = LoggerFactory.getLogger(SessionCsvReader.class);

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final CsvMapper csvMapper;

    public SessionCsvReader() {
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.csvMapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    /**
     * @throws DatasetValidationException if the file has no header row, is not valid UTF-8 or is not valid CSV
     */
    public SessionDataset read(InputStream input) {
        // Malformed bytes fail the upload instead of turning into U+FFFD
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);

        List<String[]> lines;
        try (Reader reader = new InputStreamReader(input, decoder);
             MappingIterator<String[]> it = csvMapper.readerFor(String[].class)
                     .with(CsvSchema.emptySchema())
                     .readValues(reader)) {
            lines = it.readAll();
        } catch (IOException | RuntimeException e) {
            if (isEncodingError(e)) {
                throw new DatasetValidationException("CSV file is not valid UTF-8", e);
            }
            throw new DatasetValidationException("Could not parse CSV file: " + e.getMessage(), e);
        }

        if (lines.isEmpty()) {
            throw new DatasetValidationException("CSV file has no header row");
        }

        List<String> columns = header(lines.get(0));
        List<Map<String, String>> records = new ArrayList<>(lines.size() - 1);
        for (int i = 1; i < lines.size(); i++) {
            records.add(toRecord(columns, lines.get(i), i + 1));
        }

        log.info("Read CSV with {} columns and {} rows", columns.size(), records.size());
        return SessionDataset.of(columns, records);
    }

    private static boolean isEncodingError(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof CharacterCodingException) {
                return true;
            }
        }
        return false;
    }

    private List<String> header(String[] cells) {
        List<String> columns = new ArrayList<>(cells.length);
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < cells.length; i++) {
            String name = cells[i] == null ? "" : cells[i];
            if (i == 0 && !name.isEmpty() && name.charAt(0) == BYTE_ORDER_MARK) {
                name = name.substring(1);
            }
            name = name.trim();
            if (name.isEmpty()) {
                name = "unnamed_" + i;
            }
            if (!seen.add(name)) {
                String renamed = name + "_" + i;
                log.warn("Duplicate CSV column '{}' at position {}; reading it as '{}'", name, i, renamed);
                name = renamed;
                seen.add(name);
            }
            columns.add(name);
        }
        return columns;
    }

    private Map<String, String> toRecord(List<String> columns, String[] cells, int lineNumber) {
        if (cells.length > columns.size()) {
            log.debug("Line {} has {} cells for {} columns; extra cells ignored",
                    lineNumber, cells.length, columns.size());
        }
        Map<String, String> record = new LinkedHashMap<>();
        for (int c = 0; c < columns.size(); c++) {
            // Short rows are padded with empty cells
            String cell = c < cells.length && cells[c] != null ? cells[c] : "";
            record.put(columns.get(c), cell);
        }
        return record;
    }
}
