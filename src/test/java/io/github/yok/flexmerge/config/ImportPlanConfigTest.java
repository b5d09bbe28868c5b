package io.github.yok.flexmerge.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.flexmerge.core.ForeignKeyConstraint;
import io.github.yok.flexmerge.core.ForeignKeyPolicy;
import io.github.yok.flexmerge.core.LoadMode;
import io.github.yok.flexmerge.core.NaturalKeyMergeSpec;
import io.github.yok.flexmerge.core.TableLoadSpec;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class ImportPlanConfigTest {

    private static ImportPlanConfig.TableEntry table(String name) {
        ImportPlanConfig.TableEntry entry = new ImportPlanConfig.TableEntry();
        entry.setTable(name);
        return entry;
    }

    private static ImportPlanConfig.ForeignKeyEntry fk(String column, String references) {
        ImportPlanConfig.ForeignKeyEntry fk = new ImportPlanConfig.ForeignKeyEntry();
        fk.setColumn(column);
        fk.setReferences(references);
        return fk;
    }

    @Test
    void toMasterSpecs_正常ケース_モード未指定_INSERT_ONLYが適用されること() {
        ImportPlanConfig config = new ImportPlanConfig();
        ImportPlanConfig.TableEntry gate = table("gate");
        gate.getForeignKeys().add(fk("terminal_id", "terminal"));
        ImportPlanConfig.TableEntry airline = table("airline");
        airline.setMode(LoadMode.UPSERT);
        config.setMasters(Arrays.asList(gate, airline));

        List<TableLoadSpec> specs = config.toMasterSpecs();

        assertEquals(2, specs.size());
        assertEquals(LoadMode.INSERT_ONLY, specs.get(0).getMode());
        assertEquals(LoadMode.UPSERT, specs.get(1).getMode());
        assertEquals("gate", specs.get(0).getSource());
        assertEquals("id", specs.get(0).getIdColumn());
        ForeignKeyConstraint constraint = specs.get(0).getForeignKeys().get(0);
        assertEquals("terminal_id", constraint.getColumn());
        assertEquals("terminal", constraint.getReferencedTable());
        assertEquals(ForeignKeyPolicy.REQUIRED, constraint.getPolicy());
    }

    @Test
    void toDependentSpecs_正常ケース_モード未指定_UPSERTが適用され設定値が引き継がれること() {
        ImportPlanConfig config = new ImportPlanConfig();
        ImportPlanConfig.TableEntry passes = table("boarding_pass");
        passes.setSource("tarjetas");
        passes.setIdColumn("pass_id");
        passes.getBooleans().add("printed");
        passes.getAliases().put("Reserva", "reservation_id");
        ImportPlanConfig.ForeignKeyEntry gate = fk("gate_id", "gate");
        gate.setPolicy(ForeignKeyPolicy.CLEAR);
        passes.getForeignKeys().add(gate);
        config.setDependents(Arrays.asList(passes));

        TableLoadSpec spec = config.toDependentSpecs().get(0);

        assertEquals(LoadMode.UPSERT, spec.getMode());
        assertEquals("tarjetas", spec.getSource());
        assertEquals("pass_id", spec.getIdColumn());
        assertEquals(Arrays.asList("printed"), spec.getBooleanColumns());
        assertEquals("reservation_id", spec.getColumnAliases().get("Reserva"));
        assertEquals(ForeignKeyPolicy.CLEAR, spec.getForeignKeys().get(0).getPolicy());
    }

    @Test
    void toMergeSpec_正常ケース_マージ設定なし_nullが返ること() {
        ImportPlanConfig config = new ImportPlanConfig();
        assertNull(config.toMergeSpec());

        config.setNaturalKeyMerge(new ImportPlanConfig.MergeEntry());
        assertNull(config.toMergeSpec());
    }

    @Test
    void toMergeSpec_正常ケース_マージ設定あり_キー列と外部キー列と更新列の順で結合されること() {
        ImportPlanConfig config = new ImportPlanConfig();
        ImportPlanConfig.MergeEntry merge = new ImportPlanConfig.MergeEntry();
        merge.setTable("reservation");
        merge.setKeyColumns(Arrays.asList("locator", "flight_id"));
        merge.setMutableColumns(Arrays.asList("seat", "status"));
        merge.setRequiredSourceColumns(Arrays.asList("locator"));
        merge.setForeignKeys(Arrays.asList(fk("passenger_id", "passenger"),
                fk("flight_id", "flight")));
        merge.getAliases().put("PNR", "locator");
        config.setNaturalKeyMerge(merge);

        NaturalKeyMergeSpec spec = config.toMergeSpec();

        assertEquals("reservation", spec.getSource());
        assertEquals(Arrays.asList("locator", "flight_id", "passenger_id", "seat", "status"),
                spec.getMergeColumns());
        assertEquals(Arrays.asList("locator"), spec.getRequiredSourceColumns());
        assertEquals("locator", spec.getColumnAliases().get("PNR"));
        assertTrue(spec.getForeignKeys().stream()
                .allMatch(c -> c.getPolicy() == ForeignKeyPolicy.REQUIRED));
    }
}
