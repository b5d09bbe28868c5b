package io.github.yok.flexmerge.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void writeCsvUtf8_正常ケース_親ディレクトリが存在しない_作成されて書き込まれること() throws Exception {
        Path out = tempDir.resolve("a/b/out.csv");

        CsvUtils.writeCsvUtf8(out, Arrays.asList("id", "note"),
                Arrays.asList(Arrays.asList((Object) 1L, "línea \"1\""),
                        Arrays.asList((Object) 2L, null)));

        List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
        assertEquals(Arrays.asList("id,note", "1,\"línea \"\"1\"\"\"", "2,"), lines);
    }

    @Test
    void openCsvUtf8_正常ケース_書き込んだCSVを読み込む_ヘッダと値が取得できること() throws Exception {
        Path out = tempDir.resolve("in.csv");
        CsvUtils.writeCsvUtf8(out, Arrays.asList("id", "name"),
                Collections.singletonList(Arrays.asList((Object) "7", "Iberia")));

        try (CSVParser parser = CsvUtils.openCsvUtf8(out)) {
            assertEquals(Arrays.asList("id", "name"), parser.getHeaderNames());
            List<CSVRecord> records = parser.getRecords();
            assertEquals(1, records.size());
            assertEquals("Iberia", records.get(0).get("name"));
        }
        assertTrue(Files.size(out) > 0);
    }
}
