package io.github.yok.flexmerge.core;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.Validate;

/**
 * Caller-declared foreign key: a local column that must reference an identifier of another table.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ForeignKeyConstraint {

    private final String column;
    private final String referencedTable;
    private final ForeignKeyPolicy policy;

    /**
     * Creates a constraint.
     *
     * @param column local column name
     * @param referencedTable referenced table name
     * @param policy enforcement policy; {@code null} means {@link ForeignKeyPolicy#REQUIRED}
     */
    public ForeignKeyConstraint(String column, String referencedTable, ForeignKeyPolicy policy) {
        Validate.notBlank(column, "column must not be blank.");
        Validate.notBlank(referencedTable, "referencedTable must not be blank.");
        this.column = column;
        this.referencedTable = referencedTable;
        this.policy = policy == null ? ForeignKeyPolicy.REQUIRED : policy;
    }

    /**
     * Creates a {@link ForeignKeyPolicy#REQUIRED} constraint.
     *
     * @param column local column name
     * @param referencedTable referenced table name
     * @return constraint
     */
    public static ForeignKeyConstraint required(String column, String referencedTable) {
        return new ForeignKeyConstraint(column, referencedTable, ForeignKeyPolicy.REQUIRED);
    }
}
