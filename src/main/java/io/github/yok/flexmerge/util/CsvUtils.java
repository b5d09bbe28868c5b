package io.github.yok.flexmerge.util;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.QuoteMode;
import org.apache.commons.io.input.BOMInputStream;

/**
 * Reads and writes the UTF-8 CSV files handled by the tool.
 *
 * @author Yasuharu.Okawauchi
 */
public final class CsvUtils {

    private CsvUtils() {
        // Utility class; do not instantiate.
    }

    /**
     * Opens a CSV file whose first record is the header. A UTF-8 byte order mark, as written by
     * spreadsheet exports, is skipped. Blank lines are ignored.
     *
     * @param csvFile file to read
     * @return parser; the caller closes it
     * @throws IOException if the file cannot be opened
     */
    public static CSVParser openCsvUtf8(Path csvFile) throws IOException {
        CSVFormat fmt = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true)
                .setIgnoreSurroundingSpaces(true).setIgnoreEmptyLines(true).get();
        Reader reader = new InputStreamReader(BOMInputStream.builder()
                .setInputStream(Files.newInputStream(csvFile)).get(), StandardCharsets.UTF_8);
        return CSVParser.parse(reader, fmt);
    }

    /**
     * Writes a CSV file in UTF-8 with minimal quoting, creating parent directories as needed.
     * {@code null} cells are written as empty fields.
     *
     * @param csvFile the destination CSV file (will be created or overwritten)
     * @param headers header columns written as the first record
     * @param rows data rows
     * @throws IOException if an I/O error occurs while writing the file
     */
    public static void writeCsvUtf8(Path csvFile, List<String> headers, List<List<Object>> rows)
            throws IOException {
        if (csvFile.getParent() != null) {
            Files.createDirectories(csvFile.getParent());
        }
        CSVFormat fmt = CSVFormat.DEFAULT.builder().setHeader(headers.toArray(new String[0]))
                .setQuoteMode(QuoteMode.MINIMAL).setRecordSeparator("\n").get();
        try (Writer w = Files.newBufferedWriter(csvFile, StandardCharsets.UTF_8);
                CSVPrinter printer = new CSVPrinter(w, fmt)) {
            for (List<Object> row : rows) {
                printer.printRecord(row);
            }
        }
    }
}
