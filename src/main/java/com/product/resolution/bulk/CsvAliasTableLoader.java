package com.product.resolution.bulk;

import com.product.resolution.alias.AliasTable;
import com.product.resolution.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads a manufacturer alias table from CSV.
 *
 * <pre>
 * canonical_name,aliases,status
 * 3M,"Minnesota Mining and Manufacturing|3M Company",found
 * Eaton,Eaton Corporation|Cutler-Hammer,found
 * </pre>
 *
 * <p>{@code original_name} is accepted for the canonical column and {@code aliases_text} for
 * the alias column. When a {@code status} column exists only rows with status {@code found}
 * are loaded.</p>
 */
public class CsvAliasTableLoader {
    private static final Logger log = LoggerFactory.getLogger(CsvAliasTableLoader.class);

    public AliasTable load(Path path) {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(reader);
        } catch (IOException e) {
            throw new StoreException("Cannot read alias table " + path, e);
        }
    }

    public AliasTable load(Reader reader) {
        AliasTable.Builder builder = AliasTable.builder();
        int loaded = 0;
        int skipped = 0;
        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            String headerLine = br.readLine();
            if (headerLine == null) {
                return builder.build();
            }
            Map<String, Integer> header = CsvSupport.headerIndex(headerLine);
            if (!header.containsKey("canonical_name") && !header.containsKey("original_name")) {
                throw new StoreException("Alias table has no 'canonical_name' column");
            }
            boolean hasStatus = header.containsKey("status");

            String line;
            long lineNumber = 1;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                List<String> row;
                try {
                    row = CsvSupport.parseLine(line);
                } catch (IllegalArgumentException e) {
                    log.warn("alias.row.skipped line={} reason='{}'", lineNumber, e.getMessage());
                    skipped++;
                    continue;
                }
                if (hasStatus && !"found".equalsIgnoreCase(CsvSupport.field(row, header, "status"))) {
                    skipped++;
                    continue;
                }
                String canonical = CsvSupport.field(row, header, "canonical_name", "original_name");
                if (canonical.isEmpty()) {
                    skipped++;
                    continue;
                }
                builder.addAliases(canonical, splitAliases(CsvSupport.field(row, header, "aliases", "aliases_text")));
                loaded++;
            }
        } catch (IOException e) {
            throw new StoreException("Cannot read alias table", e);
        }
        AliasTable table = builder.build();
        log.info("alias.table.loaded rows={} skipped={} canonical={} aliases={}",
                loaded, skipped, table.stats().canonicalCount(), table.stats().aliasCount());
        return table;
    }

    private static List<String> splitAliases(String value) {
        List<String> aliases = new ArrayList<>();
        for (String alias : value.split("\\|")) {
            if (!alias.isBlank()) {
                aliases.add(alias.trim());
            }
        }
        return aliases;
    }
}
