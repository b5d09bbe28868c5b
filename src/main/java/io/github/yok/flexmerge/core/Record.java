package io.github.yok.flexmerge.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.apache.commons.lang3.Validate;

/**
 * One import row: an ordered mapping from field name to a scalar value.
 *
 * <p>
 * Values are {@link String}, {@link Long}, {@link Boolean} or {@code null}. A field that is present
 * with a {@code null} value is different from an absent field: {@link #has(String)} reports
 * presence only. Field lookups are case-insensitive because source headers and database column
 * names rarely agree on case; the spelling of the first {@link #put} wins.
 * </p>
 *
 * <p>
 * Records are mutable while the engine coerces and projects them, and are not thread-safe.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class Record {

    // lower-case key → original field name
    private final Map<String, String> names = new LinkedHashMap<>();

    // original field name → value
    private final Map<String, Object> values = new LinkedHashMap<>();

    /**
     * Creates an empty record.
     */
    public Record() {
        // empty
    }

    /**
     * Creates a record from raw field values, preserving iteration order.
     *
     * @param raw raw values; {@code null} values are kept as present-but-null fields
     * @return new record
     */
    public static Record of(Map<String, ?> raw) {
        Record record = new Record();
        if (raw != null) {
            raw.forEach(record::put);
        }
        return record;
    }

    /**
     * Returns whether the field is present (its value may still be {@code null}).
     *
     * @param field field name (case-insensitive)
     * @return {@code true} when present
     */
    public boolean has(String field) {
        return field != null && names.containsKey(key(field));
    }

    /**
     * Returns the raw value of a field.
     *
     * @param field field name (case-insensitive)
     * @return value, or {@code null} when absent or null
     */
    public Object get(String field) {
        if (field == null) {
            return null;
        }
        String name = names.get(key(field));
        return name == null ? null : values.get(name);
    }

    /**
     * Returns a field value as {@link Long} when it already holds one.
     *
     * @param field field name
     * @return value, or {@code null} when absent, null or not a {@link Long}
     */
    public Long getLong(String field) {
        Object v = get(field);
        return v instanceof Long ? (Long) v : null;
    }

    /**
     * Returns a field value as {@link Boolean} when it already holds one.
     *
     * @param field field name
     * @return value, or {@code null} when absent, null or not a {@link Boolean}
     */
    public Boolean getBoolean(String field) {
        Object v = get(field);
        return v instanceof Boolean ? (Boolean) v : null;
    }

    /**
     * Sets a field, keeping the position and spelling of an existing field with the same name.
     *
     * @param field field name
     * @param value value; may be {@code null}
     * @return this record
     */
    public Record put(String field, Object value) {
        Validate.notBlank(field, "field must not be blank.");
        String existing = names.putIfAbsent(key(field), field);
        values.put(existing == null ? field : existing, value);
        return this;
    }

    /**
     * Removes a field.
     *
     * @param field field name (case-insensitive)
     * @return previous value, or {@code null}
     */
    public Object remove(String field) {
        if (field == null) {
            return null;
        }
        String name = names.remove(key(field));
        return name == null ? null : values.remove(name);
    }

    /**
     * Renames a field in place. When {@code to} is already present, the record is left untouched.
     *
     * @param from current field name
     * @param to new field name
     * @return {@code true} when the field was renamed
     */
    public boolean rename(String from, String to) {
        if (!has(from) || has(to)) {
            return false;
        }
        Map<String, Object> copy = new LinkedHashMap<>(values);
        String fromName = names.get(key(from));
        names.clear();
        values.clear();
        copy.forEach((k, v) -> put(k.equals(fromName) ? to : k, v));
        return true;
    }

    /**
     * Returns the field names in insertion order.
     *
     * @return unmodifiable view of the field names
     */
    public Set<String> fieldNames() {
        return Collections.unmodifiableSet(values.keySet());
    }

    /**
     * Returns the fields as an unmodifiable ordered map.
     *
     * @return field map
     */
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    /**
     * Returns the number of present fields.
     *
     * @return field count
     */
    public int size() {
        return values.size();
    }

    /**
     * Returns an independent copy of this record.
     *
     * @return copy
     */
    public Record copy() {
        return Record.of(values);
    }

    private static String key(String field) {
        return field.toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Record)) {
            return false;
        }
        return values.equals(((Record) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
