package com.trust.network.ingest;

import com.trust.network.core.model.IdentityMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the auxiliary identity table used to decorate nodes for display.
 *
 * <p>Expected CSV format (column order is free, header names are matched
 * case-insensitively):</p>
 * <pre>
 * Index,User Id,First Name,Last Name,Sex,Email,Phone,Date of birth,Job Title
 * 1,8717bbf45cCDbEe,Shelia,Mahoney,Male,pwarner@example.org,857.139.8239,2014-01-27,Probation officer
 * </pre>
 *
 * <p>{@code Index} is the node id. Rows with an unparsable index are skipped.</p>
 */
public class IdentityCsvReader {
    private static final Logger log = LoggerFactory.getLogger(IdentityCsvReader.class);

    static final String INDEX = "index";
    static final String FIRST_NAME = "first name";
    static final String LAST_NAME = "last name";
    static final String EMAIL = "email";
    static final String PHONE = "phone";
    static final String JOB_TITLE = "job title";

    public Map<Long, IdentityMetadata> read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public Map<Long, IdentityMetadata> read(Reader reader) throws IOException {
        BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
        Map<Long, IdentityMetadata> identities = new HashMap<>();

        String header = br.readLine();
        if (header == null) {
            return Map.of();
        }
        Map<String, Integer> columns = new HashMap<>();
        List<String> names = CsvLine.split(header);
        for (int i = 0; i < names.size(); i++) {
            columns.put(names.get(i).toLowerCase(Locale.ROOT), i);
        }
        if (!columns.containsKey(INDEX)) {
            throw new IOException("Identity table has no '" + INDEX + "' column: " + header);
        }

        String line;
        long lineNumber = 1;
        long skipped = 0;
        while ((line = br.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            List<String> fields = CsvLine.split(line);
            Long id = parseIndex(column(fields, columns, INDEX));
            if (id == null) {
                skipped++;
                log.debug("identity.skipped line={} reason=invalid index", lineNumber);
                continue;
            }
            String first = column(fields, columns, FIRST_NAME);
            String last = column(fields, columns, LAST_NAME);
            String name = ((first != null ? first : IdentityMetadata.UNKNOWN_NAME) + " "
                    + (last != null ? last : "")).trim();
            identities.put(id, new IdentityMetadata(name,
                    column(fields, columns, JOB_TITLE),
                    column(fields, columns, EMAIL),
                    column(fields, columns, PHONE)));
        }
        log.info("identity.read entries={} skipped={}", identities.size(), skipped);
        return identities;
    }

    private static Long parseIndex(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String column(List<String> fields, Map<String, Integer> columns, String name) {
        Integer index = columns.get(name);
        if (index == null || index >= fields.size()) {
            return null;
        }
        String value = fields.get(index);
        return value.isEmpty() ? null : value;
    }
}
