package io.github.yok.flexmerge.io;

import io.github.yok.flexmerge.core.Record;
import io.github.yok.flexmerge.util.CsvUtils;
import io.github.yok.flexmerge.util.ValueCoercion;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;

/**
 * Reads {@code <dir>/<source>.csv} into records.
 *
 * <p>
 * The header row names the fields. Every cell is a string; blank cells become {@code null}. A
 * missing file yields an empty list, so an optional table without source data is simply skipped.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class CsvRecordSource implements RecordSource {

    private final Path directory;

    @Override
    public List<Record> read(String source) throws IOException {
        Path csv = directory.resolve(source + ".csv");
        if (!Files.isRegularFile(csv)) {
            log.info("Source file not found, treated as empty: {}", csv);
            return new ArrayList<>();
        }
        List<Record> records = new ArrayList<>();
        try (CSVParser parser = CsvUtils.openCsvUtf8(csv)) {
            List<String> headers = parser.getHeaderNames();
            for (CSVRecord row : parser) {
                Record record = new Record();
                Map<String, String> cells = row.toMap();
                for (String header : headers) {
                    if (StringUtils.isBlank(header)) {
                        continue;
                    }
                    record.put(header.trim(), ValueCoercion.blankToNull(cells.get(header)));
                }
                records.add(record);
            }
        }
        log.info("Read {} records from {}", records.size(), csv);
        return records;
    }
}
