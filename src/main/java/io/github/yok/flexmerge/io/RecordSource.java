package io.github.yok.flexmerge.io;

import io.github.yok.flexmerge.core.Record;
import java.io.IOException;
import java.util.List;

/**
 * Supplies the raw records of one source, in source order.
 */
public interface RecordSource {

    /**
     * Reads all records of a source.
     *
     * @param source source name (usually the table name)
     * @return records; empty when the source does not exist
     * @throws IOException if the source exists but cannot be read
     */
    List<Record> read(String source) throws IOException;
}
