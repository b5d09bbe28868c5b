package io.github.yok.flexmerge.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import io.github.yok.flexmerge.core.FailureKind;
import io.github.yok.flexmerge.core.Record;
import io.github.yok.flexmerge.core.RowResult;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvQuarantineWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void write_正常ケース_隔離行を指定する_全フィールドと失敗理由の列が出力されること() throws Exception {
        Path dir = tempDir.resolve("quarantine");
        List<RowResult> rejections = Arrays.asList(
                RowResult.quarantined(new Record().put("id", "11").put("terminal_id", "99"),
                        FailureKind.FK_UNRESOLVED, "terminal_id=99 not found in terminal"),
                RowResult.quarantined(new Record().put("id", "12").put("code", "A, B"),
                        FailureKind.WRITE_FAILED, "value too long"));

        Path out = new CsvQuarantineWriter(dir).write("gate", rejections);

        assertEquals(dir.resolve("gate_invalid.csv"), out);
        List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
        assertEquals(Arrays.asList("id,terminal_id,code,failure_kind,failure_detail",
                "11,99,,FK_UNRESOLVED,terminal_id=99 not found in terminal",
                "12,,\"A, B\",WRITE_FAILED,value too long"), lines);
    }

    @Test
    void write_正常ケース_隔離行がない_ファイルを作成せずnullが返ること() throws Exception {
        Path dir = tempDir.resolve("quarantine");

        assertNull(new CsvQuarantineWriter(dir).write("gate", Collections.emptyList()));
        assertFalse(Files.exists(dir));
    }

    @Test
    void write_正常ケース_前回の隔離ファイルがあり今回は隔離行がない_前回のファイルが削除されること()
            throws Exception {
        Path dir = Files.createDirectories(tempDir.resolve("quarantine"));
        Path previous = dir.resolve("gate_invalid.csv");
        Files.write(previous,
                Arrays.asList("id,failure_kind,failure_detail", "11,FK_UNRESOLVED,x"),
                StandardCharsets.UTF_8);

        assertNull(new CsvQuarantineWriter(dir).write("gate", Collections.emptyList()));
        assertFalse(Files.exists(previous));
    }
}
