package io.github.yok.flexmerge.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.commons.lang3.StringUtils;

/**
 * Normalizes raw import values into typed values.
 *
 * <p>
 * All coercions are pure and never throw: input that cannot be interpreted degrades to
 * {@code null}. Callers decide whether a {@code null} result may overwrite the original value.
 * </p>
 *
 * <ul>
 * <li>Integer identifiers: blank → {@code null}, {@code "3.0"} → {@code 3}, {@code "abc"} →
 * {@code null}. Values outside the {@code long} range are {@code null}, never wrapped.</li>
 * <li>Booleans: case-insensitive match against the truthy/falsy sets below.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public final class ValueCoercion {

    /** Values interpreted as {@code true}. */
    public static final Set<String> TRUTHY = Set.of("1", "true", "t", "yes", "y");

    /** Values interpreted as {@code false}. */
    public static final Set<String> FALSY = Set.of("0", "false", "f", "no", "n");

    // Long.MAX_VALUE has 19 digits
    private static final int MAX_LONG_DIGITS = 19;

    private final Set<String> truthy;

    /**
     * Creates a coercion helper with the default truthy set.
     */
    public ValueCoercion() {
        this(Set.of());
    }

    /**
     * Creates a coercion helper whose truthy set is extended with additional affirmatives (e.g.
     * {@code "si"}).
     *
     * @param truthyExtras additional truthy values; may be {@code null}
     */
    public ValueCoercion(Collection<String> truthyExtras) {
        if (truthyExtras == null || truthyExtras.isEmpty()) {
            this.truthy = TRUTHY;
        } else {
            Set<String> merged = truthyExtras.stream().filter(StringUtils::isNotBlank)
                    .map(s -> s.trim().toLowerCase(Locale.ROOT)).collect(Collectors.toSet());
            merged.addAll(TRUTHY);
            merged.removeAll(FALSY);
            this.truthy = Set.copyOf(merged);
        }
    }

    /**
     * Coerces a value to a {@link Long} identifier.
     *
     * @param value raw value; may be {@code null}
     * @return truncated integer value, or {@code null} when blank, not numeric or out of the
     *         {@code long} range
     */
    public Long toInteger(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Long) {
            return (Long) value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Boolean) {
            return null;
        }
        String s = StringUtils.trimToNull(value.toString());
        if (s == null) {
            return null;
        }
        BigDecimal number;
        try {
            number = new BigDecimal(s);
        } catch (NumberFormatException e) {
            return null;
        }
        // digits before the decimal point, known without expanding the exponent
        long integerDigits = (long) number.precision() - number.scale();
        if (integerDigits > MAX_LONG_DIGITS) {
            return null;
        }
        if (integerDigits <= 0) {
            return 0L;
        }
        try {
            return number.setScale(0, RoundingMode.DOWN).longValueExact();
        } catch (ArithmeticException e) {
            return null;
        }
    }

    /**
     * Coerces a value to a {@link Boolean}.
     *
     * @param value raw value; may be {@code null}
     * @return {@code true}/{@code false}, or {@code null} when the value is not boolean-looking
     */
    public Boolean toBoolean(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String s = StringUtils.trimToNull(value.toString());
        if (s == null) {
            return null;
        }
        s = s.toLowerCase(Locale.ROOT);
        if (truthy.contains(s)) {
            return Boolean.TRUE;
        }
        if (FALSY.contains(s)) {
            return Boolean.FALSE;
        }
        return null;
    }

    /**
     * Normalizes a raw string cell: blank becomes {@code null}, anything else is returned as-is.
     *
     * @param raw raw cell
     * @return {@code null} for blank input, otherwise {@code raw}
     */
    public static String blankToNull(String raw) {
        return StringUtils.isBlank(raw) ? null : raw;
    }
}
