package io.github.yok.flexmerge.io;

import io.github.yok.flexmerge.core.RowResult;
import io.github.yok.flexmerge.util.CsvUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes the rejected rows of a table to {@code <dir>/<table>_invalid.csv}.
 *
 * <p>
 * The columns are the union of the rows' fields in order of first appearance, followed by
 * {@code failure_kind} and {@code failure_detail}. A table without rejections has its file from
 * an earlier run removed.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class CsvQuarantineWriter {

    static final String KIND_COLUMN = "failure_kind";
    static final String DETAIL_COLUMN = "failure_detail";

    private final Path directory;

    /**
     * Writes the rejected rows of one table.
     *
     * @param table destination table
     * @param rejections rejected rows
     * @return written file, or {@code null} when there is nothing to write
     * @throws IOException if the file cannot be written, or a previous file cannot be removed
     */
    public Path write(String table, List<RowResult> rejections) throws IOException {
        Path out = directory.resolve(table + "_invalid.csv");
        if (rejections.isEmpty()) {
            if (Files.deleteIfExists(out)) {
                log.info("Table[{}] no invalid rows; removed previous {}", table, out);
            }
            return null;
        }
        Set<String> fields = new LinkedHashSet<>();
        for (RowResult r : rejections) {
            fields.addAll(r.getRecord().fieldNames());
        }
        List<String> headers = new ArrayList<>(fields);
        headers.add(KIND_COLUMN);
        headers.add(DETAIL_COLUMN);

        List<List<Object>> rows = new ArrayList<>();
        for (RowResult r : rejections) {
            List<Object> row = new ArrayList<>();
            for (String f : fields) {
                row.add(r.getRecord().get(f));
            }
            row.add(r.getFailureKind());
            row.add(r.getDetail());
            rows.add(row);
        }
        CsvUtils.writeCsvUtf8(out, headers, rows);
        log.warn("Table[{}] {} invalid rows saved to {}", table, rows.size(), out);
        return out;
    }
}
