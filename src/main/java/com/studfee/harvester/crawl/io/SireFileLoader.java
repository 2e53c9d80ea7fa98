package com.studfee.harvester.crawl.io;

import com.studfee.harvester.crawl.model.EntityQuery;
import com.studfee.harvester.crawl.service.InvalidInputSchemaException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PushbackReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads the sire list. The file must be a CSV with exactly the columns {@code Sire} and
 * {@code sale_year}.
 */
@Component
public class SireFileLoader {
    static final String SIRE_COLUMN = "Sire";
    static final String SALE_YEAR_COLUMN = "sale_year";
    private static final Set<String> REQUIRED_COLUMNS = Set.of(SIRE_COLUMN, SALE_YEAR_COLUMN);
    private static final int BYTE_ORDER_MARK = '\uFEFF';

    public List<EntityQuery> load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new InvalidInputSchemaException("input file not found: " + path);
        }
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (!fileName.endsWith(".csv")) {
            throw new InvalidInputSchemaException("input must be a .csv file: " + path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(reader);
        } catch (IOException e) {
            throw new InvalidInputSchemaException("failed to read " + path + ": " + e.getMessage(), e);
        }
    }

    public List<EntityQuery> parse(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .setTrim(true)
            .build();
        CSVParser parser;
        try {
            parser = CSVParser.parse(skipByteOrderMark(reader), format);
        } catch (IllegalArgumentException e) {
            throw new InvalidInputSchemaException("malformed header row: " + e.getMessage(), e);
        }
        try (parser) {
            Set<String> columns = new HashSet<>(parser.getHeaderNames());
            if (!columns.equals(REQUIRED_COLUMNS) || parser.getHeaderNames().size() != REQUIRED_COLUMNS.size()) {
                throw new InvalidInputSchemaException(
                    "file must contain exactly the columns: Sire, sale_year (found " + parser.getHeaderNames() + ")"
                );
            }
            List<EntityQuery> queries = new ArrayList<>();
            for (CSVRecord record : parser) {
                queries.add(toQuery(record));
            }
            return queries;
        }
    }

    // Spreadsheet exports prefix UTF-8 CSV with a byte order mark.
    private static Reader skipByteOrderMark(Reader reader) throws IOException {
        PushbackReader in = new PushbackReader(reader, 1);
        int first = in.read();
        if (first != -1 && first != BYTE_ORDER_MARK) {
            in.unread(first);
        }
        return in;
    }

    private EntityQuery toQuery(CSVRecord record) {
        String name = record.isSet(SIRE_COLUMN) ? record.get(SIRE_COLUMN) : null;
        if (name == null || name.isBlank()) {
            throw new InvalidInputSchemaException("record " + record.getRecordNumber() + " is missing the Sire value");
        }
        String rawYear = record.isSet(SALE_YEAR_COLUMN) ? record.get(SALE_YEAR_COLUMN) : null;
        Integer saleYear = null;
        if (rawYear != null && !rawYear.isBlank()) {
            try {
                saleYear = Integer.valueOf(rawYear.trim());
            } catch (NumberFormatException e) {
                throw new InvalidInputSchemaException(
                    "record " + record.getRecordNumber() + " has a non-numeric sale_year: " + rawYear, e
                );
            }
        }
        return new EntityQuery(name.trim(), saleYear);
    }
}
