package io.github.yok.flexmerge.core;

import io.github.yok.flexmerge.util.ValueCoercion;
import java.util.HashMap;
import java.util.Map;
import lombok.Getter;

/**
 * Run-scoped state shared by the engine components: the schema cache, the resolution cache and
 * the coercion rules.
 *
 * <p>
 * Owned by the orchestrator and passed down explicitly, so a test can seed or reset it per case.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class ReconciliationContext {

    // lower-case table name → schema
    private final Map<String, TableSchema> schemaCache = new HashMap<>();

    private final ResolutionCache resolutionCache = new ResolutionCache();

    private final ValueCoercion coercion;

    /**
     * Creates a context with the default coercion rules.
     */
    public ReconciliationContext() {
        this(new ValueCoercion());
    }

    /**
     * Creates a context.
     *
     * @param coercion coercion rules
     */
    public ReconciliationContext(ValueCoercion coercion) {
        this.coercion = coercion;
    }

    /**
     * Clears both caches.
     */
    public void reset() {
        schemaCache.clear();
        resolutionCache.clear();
    }
}
