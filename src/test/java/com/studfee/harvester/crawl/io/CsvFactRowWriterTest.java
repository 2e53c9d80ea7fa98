package com.studfee.harvester.crawl.io;

import com.studfee.harvester.crawl.model.FactRow;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CsvFactRowWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void writesTidyRowsWithHeader() throws IOException {
        Path output = tempDir.resolve("out/stud_fees.csv");

        new CsvFactRowWriter(output).write(List.of(
            new FactRow("Gio Ponti", 2016, 20000L),
            new FactRow("Yoshida (JPN)", 2020, 35000L)
        ));

        assertThat(Files.readAllLines(output, StandardCharsets.UTF_8)).containsExactly(
            "Sire,stud_fee_year,stud_fee_usd",
            "Gio Ponti,2016,20000",
            "Yoshida (JPN),2020,35000"
        );
    }

    @Test
    void emptyRunStillWritesHeader() throws IOException {
        Path output = tempDir.resolve("empty.csv");

        new CsvFactRowWriter(output).write(List.of());

        assertThat(Files.readAllLines(output, StandardCharsets.UTF_8)).containsExactly("Sire,stud_fee_year,stud_fee_usd");
    }

    @Test
    void quotesNamesContainingSeparators() throws IOException {
        Path output = tempDir.resolve("quoted.csv");

        new CsvFactRowWriter(output).write(List.of(new FactRow("Smart, Strike", 2008, 75000L)));

        assertThat(Files.readAllLines(output, StandardCharsets.UTF_8)).contains("\"Smart, Strike\",2008,75000");
    }
}
