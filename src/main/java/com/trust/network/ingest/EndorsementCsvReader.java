package com.trust.network.ingest;

import com.trust.network.core.model.EndorsementRecord;
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

/**
 * Reads endorsement rows from CSV.
 *
 * <p>Expected format:</p>
 * <pre>
 * source_id,target_id,rating,timestamp
 * 7188,1,10,1407470400
 * 430,1,10,1376539200
 * </pre>
 *
 * <p>The header row is optional; a first line whose first field is not numeric is
 * treated as a header. Columns beyond the fourth are ignored. Rows with fewer than
 * four columns are passed on with the missing fields empty, so the network builder
 * reports them together with the other malformed records.</p>
 */
public class EndorsementCsvReader {
    private static final Logger log = LoggerFactory.getLogger(EndorsementCsvReader.class);
    private static final int PROGRESS_INTERVAL = 10_000;

    public List<EndorsementRecord> read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, ProgressCallback.NOOP);
        }
    }

    public List<EndorsementRecord> read(Reader reader, ProgressCallback callback) throws IOException {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<EndorsementRecord> records = new ArrayList<>();
        BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader);

        String line;
        long lineNumber = 0;
        boolean firstContentLine = true;
        while ((line = br.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            List<String> fields = CsvLine.split(line);
            if (firstContentLine) {
                firstContentLine = false;
                if (isHeader(fields)) {
                    log.debug("endorsements.header line={} header='{}'", lineNumber, line.trim());
                    continue;
                }
            }
            records.add(new EndorsementRecord(lineNumber,
                    field(fields, 0), field(fields, 1), field(fields, 2), field(fields, 3)));
            if (records.size() % PROGRESS_INTERVAL == 0) {
                cb.onProgress(records.size(), -1, "Read " + records.size() + " endorsements");
            }
        }
        cb.onProgress(records.size(), records.size(), "Read completed");
        log.info("endorsements.read records={} lines={}", records.size(), lineNumber);
        return records;
    }

    private static boolean isHeader(List<String> fields) {
        String first = fields.get(0);
        if (first.isEmpty()) {
            return false;
        }
        char c = first.charAt(0);
        return !(Character.isDigit(c) || c == '-' || c == '+');
    }

    private static String field(List<String> fields, int index) {
        return index < fields.size() ? fields.get(index) : null;
    }
}
