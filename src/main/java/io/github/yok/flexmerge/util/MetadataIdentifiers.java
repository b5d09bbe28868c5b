package io.github.yok.flexmerge.util;

import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.Locale;

/**
 * Normalizes identifiers to the case the JDBC driver stores unquoted identifiers in.
 *
 * <p>
 * Some drivers match {@link DatabaseMetaData} lookups strictly against catalog identifiers. For
 * example, PostgreSQL stores unquoted identifiers in lower case and H2 in upper case, so
 * {@code getColumns(..., "reservation", ...)} returns nothing on H2.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class MetadataIdentifiers {

    private MetadataIdentifiers() {
        throw new AssertionError("MetadataIdentifiers must not be instantiated.");
    }

    /**
     * Normalizes an identifier based on {@link DatabaseMetaData#storesLowerCaseIdentifiers()} and
     * {@link DatabaseMetaData#storesUpperCaseIdentifiers()}. If neither flag is set, the
     * identifier is returned unchanged.
     *
     * @param meta JDBC metadata
     * @param identifier identifier; may be {@code null}
     * @return normalized identifier, or {@code null}
     * @throws SQLException if metadata access fails
     */
    public static String normalize(DatabaseMetaData meta, String identifier) throws SQLException {
        if (identifier == null) {
            return null;
        }
        if (meta.storesLowerCaseIdentifiers()) {
            return identifier.toLowerCase(Locale.ROOT);
        }
        if (meta.storesUpperCaseIdentifiers()) {
            return identifier.toUpperCase(Locale.ROOT);
        }
        return identifier;
    }
}
