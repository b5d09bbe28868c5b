package io.github.yok.flexmerge.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.flexmerge.core.ForeignKeyConstraint;
import io.github.yok.flexmerge.core.TableLoadSpec;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class TableDependencyResolverTest {

    private static TableLoadSpec spec(String table, String... parents) {
        TableLoadSpec.TableLoadSpecBuilder builder = TableLoadSpec.builder().table(table);
        for (String parent : parents) {
            builder.foreignKey(ForeignKeyConstraint.required(parent + "_id", parent));
        }
        return builder.build();
    }

    private static List<String> names(List<TableLoadSpec> specs) {
        return specs.stream().map(TableLoadSpec::getTable).collect(Collectors.toList());
    }

    @Test
    void resolveLoadOrder_正常ケース_nullまたは空を指定する_空リストが返ること() {
        assertTrue(TableDependencyResolver.resolveLoadOrder(null).isEmpty());
        assertTrue(TableDependencyResolver.resolveLoadOrder(Collections.emptyList()).isEmpty());
    }

    @Test
    void resolveLoadOrder_正常ケース_子が先に並んでいる_親が先に並び替えられること() {
        List<TableLoadSpec> ordered = TableDependencyResolver.resolveLoadOrder(
                Arrays.asList(spec("flight", "gate", "aircraft"), spec("gate", "terminal"),
                        spec("aircraft", "airline"), spec("terminal"), spec("airline")));

        assertEquals(Arrays.asList("airline", "aircraft", "terminal", "gate", "flight"),
                names(ordered));
    }

    @Test
    void resolveLoadOrder_正常ケース_依存関係がない_アルファベット順になること() {
        List<TableLoadSpec> ordered = TableDependencyResolver
                .resolveLoadOrder(Arrays.asList(spec("passenger"), spec("Airline"), spec("gate")));
        assertEquals(Arrays.asList("Airline", "gate", "passenger"), names(ordered));
    }

    @Test
    void resolveLoadOrder_正常ケース_一覧外の表と自己参照を含む_無視されること() {
        List<TableLoadSpec> ordered = TableDependencyResolver.resolveLoadOrder(
                Arrays.asList(spec("change_log", "change_log"), spec("boarding_pass", "flight")));
        assertEquals(Arrays.asList("boarding_pass", "change_log"), names(ordered));
    }

    @Test
    void resolveLoadOrder_正常ケース_循環参照がある_循環部分が末尾にアルファベット順で追加されること() {
        List<TableLoadSpec> ordered = TableDependencyResolver.resolveLoadOrder(
                Arrays.asList(spec("b", "a"), spec("a", "b"), spec("z")));
        assertEquals(Arrays.asList("z", "a", "b"), names(ordered));
    }

    @Test
    void resolveLoadOrder_正常ケース_大文字小文字違いの重複がある_最初の定義が採用されること() {
        TableLoadSpec first = spec("Gate");
        List<TableLoadSpec> ordered =
                TableDependencyResolver.resolveLoadOrder(Arrays.asList(first, spec("GATE")));
        assertEquals(1, ordered.size());
        assertSame(first, ordered.get(0));
    }

    @Test
    void resolveLoadOrder_異常ケース_表名が空白_IllegalArgumentExceptionが送出されること() {
        List<TableLoadSpec> specs = Collections.singletonList(TableLoadSpec.builder().table(" ").build());
        assertThrows(IllegalArgumentException.class,
                () -> TableDependencyResolver.resolveLoadOrder(specs));
    }
}
