package io.github.yok.flexmerge.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.flexmerge.core.Record;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvRecordSourceTest {

    @TempDir
    Path tempDir;

    @Test
    void read_正常ケース_CSVを読み込む_ヘッダ順のレコードが返り空欄はnullになること() throws Exception {
        Files.write(tempDir.resolve("gate.csv"),
                Arrays.asList("id, code ,terminal_id", "10,A1,1", "11, ,2", "", "12,C3,"),
                StandardCharsets.UTF_8);

        List<Record> records = new CsvRecordSource(tempDir).read("gate");

        assertEquals(3, records.size());
        assertEquals(Arrays.asList("id", "code", "terminal_id"),
                Arrays.asList(records.get(0).fieldNames().toArray()));
        assertEquals("A1", records.get(0).get("code"));
        assertTrue(records.get(1).has("code"));
        assertNull(records.get(1).get("code"));
        assertNull(records.get(2).get("terminal_id"));
    }

    @Test
    void read_正常ケース_BOM付きUTF8を読み込む_先頭列名にBOMが残らないこと() throws Exception {
        byte[] bom = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
        byte[] body = "PNR,Asiento\nAB123,12Ñ\n".getBytes(StandardCharsets.UTF_8);
        byte[] content = new byte[bom.length + body.length];
        System.arraycopy(bom, 0, content, 0, bom.length);
        System.arraycopy(body, 0, content, bom.length, body.length);
        Files.write(tempDir.resolve("reservas.csv"), content);

        List<Record> records = new CsvRecordSource(tempDir).read("reservas");

        assertEquals("AB123", records.get(0).get("PNR"));
        assertEquals("12Ñ", records.get(0).get("Asiento"));
    }

    @Test
    void read_正常ケース_ファイルが存在しない_空リストが返ること() throws Exception {
        assertTrue(new CsvRecordSource(tempDir).read("missing").isEmpty());
    }

    @Test
    void read_正常ケース_ヘッダだけのファイル_空リストが返ること() throws Exception {
        Files.write(tempDir.resolve("terminal.csv"), Arrays.asList("id,name"),
                StandardCharsets.UTF_8);

        assertTrue(new CsvRecordSource(tempDir).read("terminal").isEmpty());
    }
}
