package com.studfee.harvester.crawl.io;

import com.studfee.harvester.crawl.model.FactRow;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes harvested rows as {@code Sire,stud_fee_year,stud_fee_usd}.
 */
public class CsvFactRowWriter implements FactRowWriter {
    private static final Logger log = LoggerFactory.getLogger(CsvFactRowWriter.class);
    static final String[] HEADER = {"Sire", "stud_fee_year", "stud_fee_usd"};

    private final Path output;

    public CsvFactRowWriter(Path output) {
        this.output = output;
    }

    @Override
    public void write(List<FactRow> rows) {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(HEADER)
            .setRecordSeparator("\n")
            .build();
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8);
                 CSVPrinter printer = new CSVPrinter(writer, format)) {
                for (FactRow row : rows) {
                    printer.printRecord(row.name(), row.factYear(), row.amount());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed to write " + output, e);
        }
        log.info("{} rows written to {}", rows.size(), output);
    }
}
