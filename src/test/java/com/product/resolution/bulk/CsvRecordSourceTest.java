package com.product.resolution.bulk;

import com.product.resolution.core.model.ProductRecord;
import com.product.resolution.store.StoreException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class CsvRecordSourceTest {

    @TempDir
    Path tempDir;

    private Path write(String content) throws IOException {
        Path file = tempDir.resolve("records.csv");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private static List<ProductRecord> readAll(CsvRecordSource source) {
        try (Stream<ProductRecord> records = source.streamAll()) {
            return records.toList();
        }
    }

    @Test
    @DisplayName("Should read records with a header row")
    void testReadWithHeader() throws IOException {
        Path file = write("""
                id,source_key,manufacturer,part_number,title,description,unspsc,gtin
                A-1,contract-7,3M Company,14NV-4123,"Tape, 2in",,31201500,
                B-9,catalog-2,3M,14NV4123,Tape,"Says ""strong""\",,00012345678905
                """);

        List<ProductRecord> records = readAll(new CsvRecordSource(file));

        assertEquals(2, records.size());
        ProductRecord first = records.get(0);
        assertEquals("A-1", first.id());
        assertEquals("contract-7", first.sourceKey());
        assertEquals("Tape, 2in", first.title());
        assertEquals("", first.description());
        assertEquals("31201500", first.unspsc());
        assertEquals("Says \"strong\"", records.get(1).description());
        assertEquals("00012345678905", records.get(1).gtin());
    }

    @Test
    @DisplayName("Should accept alternate column names and a BOM")
    void testAlternateColumns() throws IOException {
        Path file = write("\uFEFFID,sourceKey,manufacturer_raw,partNumber\nA-1,s1,Eaton,BR120\n");

        ProductRecord record = readAll(new CsvRecordSource(file)).get(0);

        assertEquals("A-1", record.id());
        assertEquals("s1", record.sourceKey());
        assertEquals("Eaton", record.manufacturer());
        assertEquals("BR120", record.partNumber());
    }

    @Test
    @DisplayName("Should skip rows without id or with an unterminated quote")
    void testSkipsBadRows() throws IOException {
        Path file = write("""
                id,manufacturer
                A-1,Eaton
                ,Siemens
                A-2,"Broken

                A-3,ABB
                """);

        List<ProductRecord> records = readAll(new CsvRecordSource(file));

        assertEquals(List.of("A-1", "A-3"), records.stream().map(ProductRecord::id).toList());
    }

    @Test
    @DisplayName("Should fail without an id column")
    void testMissingIdColumn() throws IOException {
        Path file = write("name,manufacturer\nx,Eaton\n");

        assertThrows(StoreException.class, () -> new CsvRecordSource(file).streamAll());
    }

    @Test
    @DisplayName("Should fail on a missing file")
    void testMissingFile() {
        CsvRecordSource source = new CsvRecordSource(tempDir.resolve("absent.csv"));

        assertThrows(StoreException.class, source::streamAll);
    }

    @Test
    @DisplayName("Should look up records by id")
    void testGet() throws IOException {
        Path file = write("id,manufacturer\nA-1,Eaton\nA-2,ABB\n");
        CsvRecordSource source = new CsvRecordSource(file);

        assertEquals("ABB", source.get("A-2").orElseThrow().manufacturer());
        assertTrue(source.get("A-9").isEmpty());
    }

    @Test
    @DisplayName("Should report completion through the progress callback")
    void testProgress() throws IOException {
        Path file = write("id\nA-1\nA-2\n");
        List<String> messages = new ArrayList<>();

        readAll(new CsvRecordSource(file, (processed, total, message) -> messages.add(processed + ":" + message)));

        assertEquals(List.of("2:Read completed"), messages);
    }

    @Test
    @DisplayName("Empty file has no records")
    void testEmptyFile() throws IOException {
        assertTrue(readAll(new CsvRecordSource(write(""))).isEmpty());
    }
}
