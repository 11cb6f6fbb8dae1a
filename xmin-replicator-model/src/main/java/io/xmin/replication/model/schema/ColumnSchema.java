package io.xmin.replication.model.schema;

import java.io.Serializable;
import java.util.Objects;

@SuppressWarnings("unused")
public class ColumnSchema implements Serializable {

    private String name;
    private ElementType elementType;
    private boolean array;
    private String declaredType;
    private boolean nullable;
    private boolean primary;

    public ColumnSchema() { }

    public ColumnSchema(
            String name,
            ElementType elementType,
            boolean array,
            String declaredType,
            boolean nullable,
            boolean primary
    ) {
        this.name         = Identifiers.validate(name);
        this.elementType  = Objects.requireNonNull(elementType);
        this.array        = array;
        this.declaredType = declaredType;
        this.nullable     = nullable;
        this.primary      = primary;
    }

    public String getName() {
        return this.name;
    }

    public ElementType getElementType() {
        return this.elementType;
    }

    public boolean isArray() {
        return this.array;
    }

    /**
     * The type as rendered by {@code format_type}, e.g. {@code numeric(12,2)} or {@code integer[]}.
     */
    public String getDeclaredType() {
        return this.declaredType;
    }

    public boolean isNullable() {
        return this.nullable;
    }

    public boolean isPrimary() {
        return this.primary;
    }

    public ColumnSchema withPrimary(boolean primary) {
        return new ColumnSchema(this.name, this.elementType, this.array, this.declaredType, this.nullable, primary);
    }

    @Override
    public String toString() {
        return String.format("%s %s", this.name, this.declaredType);
    }
}
