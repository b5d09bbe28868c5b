package io.github.yok.flexmerge.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ForeignKeyResolverTest {

    private ReferenceIdSource source;
    private ReconciliationContext context;
    private ForeignKeyResolver resolver;

    @BeforeEach
    void setUp() {
        source = mock(ReferenceIdSource.class);
        context = new ReconciliationContext();
        resolver = new ForeignKeyResolver(context, source);
    }

    @Test
    void findViolation_正常ケース_キャッシュ済みの表を参照する_存在するidだけが通ること() throws Exception {
        context.getResolutionCache().put("parent", Arrays.asList(10L, 11L));
        List<ForeignKeyConstraint> fks =
                Collections.singletonList(ForeignKeyConstraint.required("parent_id", "parent"));

        assertNull(resolver.findViolation(new Record().put("parent_id", 11L), fks));
        assertEquals(fks.get(0),
                resolver.findViolation(new Record().put("parent_id", 99L), fks));
        assertEquals(fks.get(0),
                resolver.findViolation(new Record().put("parent_id", null), fks));
        verify(source, never()).loadIds(anyString());
    }

    @Test
    void resolves_正常ケース_同じ表を複数回問い合わせる_id一覧の取得は1回だけであること() throws Exception {
        when(source.loadIds("flight")).thenReturn(new HashSet<>(Arrays.asList(1L, 2L)));

        assertTrue(resolver.resolves("flight", 1L));
        assertTrue(resolver.resolves("FLIGHT", "2.0"));
        assertFalse(resolver.resolves("flight", 3L));
        verify(source, times(1)).loadIds("flight");
        assertTrue(context.getResolutionCache().isLoaded("flight"));
    }

    @Test
    void resolves_正常ケース_long範囲外のidを指定する_既存idに丸められずfalseが返ること() throws Exception {
        context.getResolutionCache().put("flight", Arrays.asList(10L, 11L));

        assertFalse(resolver.resolves("flight", "18446744073709551627"));
        assertFalse(resolver.resolves("flight", "1e30"));
        assertTrue(resolver.resolves("flight", "11"));
    }

    @Test
    void resolves_正常ケース_nullや数値でないidを指定する_問い合わせずにfalseが返ること() throws Exception {
        assertFalse(resolver.resolves("flight", null));
        assertFalse(resolver.resolves("flight", "abc"));
        assertFalse(resolver.resolves("flight", ""));
        verify(source, never()).loadIds(anyString());
    }

    @Test
    void resolves_異常ケース_id一覧の取得に失敗する_SQLExceptionが伝播しキャッシュされないこと() throws Exception {
        SQLException cause = new SQLException("boom");
        when(source.loadIds("flight")).thenThrow(cause);

        SQLException ex = assertThrows(SQLException.class, () -> resolver.resolves("flight", 1L));
        assertSame(cause, ex);
        assertFalse(context.getResolutionCache().isLoaded("flight"));
    }

    @Test
    void findViolation_正常ケース_必須列が欠落している_制約違反が返ること() throws Exception {
        context.getResolutionCache().put("passenger", Arrays.asList(1L));
        ForeignKeyConstraint fk = ForeignKeyConstraint.required("passenger_id", "passenger");

        assertSame(fk, resolver.findViolation(new Record().put("seat", "1A"),
                Collections.singletonList(fk)));
    }

    @Test
    void findViolation_正常ケース_最初の違反で打ち切る_後続の表は問い合わせないこと() throws Exception {
        context.getResolutionCache().put("passenger", Arrays.asList(1L));
        ForeignKeyConstraint first = ForeignKeyConstraint.required("passenger_id", "passenger");
        ForeignKeyConstraint second = ForeignKeyConstraint.required("flight_id", "flight");
        Record record = new Record().put("passenger_id", 7L).put("flight_id", 1L);

        assertSame(first, resolver.findViolation(record, Arrays.asList(first, second)));
        verify(source, never()).loadIds("flight");
    }

    @Test
    void findViolation_正常ケース_OPTIONAL指定でnull値_違反にならないこと() throws Exception {
        context.getResolutionCache().put("gate", Arrays.asList(1L));
        ForeignKeyConstraint fk =
                new ForeignKeyConstraint("gate_id", "gate", ForeignKeyPolicy.OPTIONAL);

        assertNull(resolver.findViolation(new Record().put("gate_id", null),
                Collections.singletonList(fk)));
        assertNull(resolver.findViolation(new Record(), Collections.singletonList(fk)));
        assertSame(fk, resolver.findViolation(new Record().put("gate_id", 9L),
                Collections.singletonList(fk)));
    }

    @Test
    void findViolation_正常ケース_CLEAR指定で未解決のid_nullに置き換えられ違反にならないこと() throws Exception {
        context.getResolutionCache().put("gate", Arrays.asList(1L));
        ForeignKeyConstraint fk = new ForeignKeyConstraint("gate_id", "gate", ForeignKeyPolicy.CLEAR);
        Record record = new Record().put("gate_id", 9L).put("flight_number", "IB100");

        assertNull(resolver.findViolation(record, Collections.singletonList(fk)));
        assertTrue(record.has("gate_id"));
        assertNull(record.get("gate_id"));
    }
}
