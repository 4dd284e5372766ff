package com.netcracker.core.ddisync.service.inventory;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.netcracker.core.ddisync.exception.ValidationException;
import com.netcracker.core.ddisync.model.CidrBlock;
import com.netcracker.core.ddisync.model.NetworkRecord;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * Reads a CSV inventory export (header row required) into {@link NetworkRecord}s.
 * <p>
 * Header names are trimmed and matched case-insensitively. Columns {@code subnet}, {@code account},
 * {@code region} and a tag column named {@code TAG} or {@code TAGS} are mandatory. Rows without a subnet
 * are skipped; every other row must carry a valid subnet, which is stored in canonical form.
 */
@ApplicationScoped
@Slf4j
public class InventoryParser {
    static final String SUBNET = "subnet";
    static final String ACCOUNT = "account";
    static final String REGION = "region";
    static final List<String> REQUIRED_COLUMNS = List.of(SUBNET, ACCOUNT, REGION);
    static final List<String> TAG_COLUMNS = List.of("tag", "tags");

    private static final CsvMapper CSV_MAPPER = new CsvMapper();

    public InventoryParseResult parse(byte[] content) {
        return parse(new ByteArrayInputStream(content));
    }

    /**
     * @throws ValidationException listing every missing column, or every row with an invalid subnet
     */
    public InventoryParseResult parse(InputStream input) {
        List<String[]> rows = readRows(input);
        if (rows.isEmpty()) {
            throw new ValidationException(missingColumns(Map.of(), -1));
        }

        Map<String, Integer> columns = indexHeader(rows.get(0));
        int tagColumn = TAG_COLUMNS.stream()
                .filter(columns::containsKey)
                .map(columns::get)
                .findFirst()
                .orElse(-1);
        List<String> missing = missingColumns(columns, tagColumn);
        if (!missing.isEmpty()) {
            throw new ValidationException(missing);
        }

        String[] header = rows.get(0);
        List<NetworkRecord> networks = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        TreeSet<String> tagKeys = new TreeSet<>();
        int skipped = 0;
        for (int i = 1; i < rows.size(); i++) {
            String[] row = rows.get(i);
            String subnet = cell(row, columns.get(SUBNET));
            if (subnet.isEmpty()) {
                skipped++;
                continue;
            }
            String canonical;
            try {
                canonical = CidrBlock.canonicalize(subnet);
            } catch (ValidationException e) {
                // row numbers count the header as row 1
                errors.add("Row %d: %s".formatted(i + 1, e.getMessage()));
                continue;
            }
            Map<String, String> tags = TagParser.parse(cell(row, tagColumn));
            tagKeys.addAll(tags.keySet());
            networks.add(new NetworkRecord(
                    canonical,
                    cell(row, columns.get(ACCOUNT)),
                    cell(row, columns.get(REGION)),
                    tags,
                    rawFields(header, row),
                    null));
        }
        if (!errors.isEmpty()) {
            log.warn("Inventory export rejected: {} rows with invalid subnets", errors.size());
            throw new ValidationException(errors);
        }
        log.info("Parsed {} networks from inventory export ({} rows without subnet skipped, {} distinct tag keys)",
                networks.size(), skipped, tagKeys.size());
        return new InventoryParseResult(networks, new ArrayList<>(tagKeys));
    }

    private static List<String[]> readRows(InputStream input) {
        try (MappingIterator<String[]> it = CSV_MAPPER
                .readerFor(String[].class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .with(CsvParser.Feature.SKIP_EMPTY_LINES)
                .readValues(input)) {
            return it.readAll();
        } catch (IOException | RuntimeException e) {
            throw new ValidationException("Failed to read inventory export: " + e.getMessage(), e);
        }
    }

    private static Map<String, Integer> indexHeader(String[] header) {
        Map<String, Integer> columns = new LinkedHashMap<>();
        for (int i = 0; i < header.length; i++) {
            columns.putIfAbsent(normalizeHeader(header[i]), i);
        }
        return columns;
    }

    private static List<String> missingColumns(Map<String, Integer> columns, int tagColumn) {
        List<String> missing = new ArrayList<>();
        for (String column : REQUIRED_COLUMNS) {
            if (!columns.containsKey(column)) {
                missing.add("Missing required column: " + column);
            }
        }
        if (tagColumn < 0) {
            missing.add("Missing TAG column for extended attributes");
        }
        return missing;
    }

    private static Map<String, String> rawFields(String[] header, String[] row) {
        Map<String, String> raw = new LinkedHashMap<>();
        for (int i = 0; i < header.length; i++) {
            raw.put(cleanHeader(header[i]), cell(row, i));
        }
        return raw;
    }

    private static String cell(String[] row, int index) {
        if (index < 0 || index >= row.length || row[index] == null) {
            return "";
        }
        return row[index].trim();
    }

    private static String cleanHeader(String header) {
        if (header == null) {
            return "";
        }
        return header.replace("\uFEFF", "").trim();
    }

    private static String normalizeHeader(String header) {
        return cleanHeader(header).toLowerCase(Locale.ROOT);
    }
}
