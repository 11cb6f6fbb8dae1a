package io.xmin.replication.model.value;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

public final class PrimaryKey implements Serializable {
    private final List<TypedValue> values;

    public PrimaryKey(List<TypedValue> values) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("primary key requires at least one value");
        }

        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static PrimaryKey of(TypedValue... values) {
        return new PrimaryKey(Arrays.asList(values));
    }

    public List<TypedValue> getValues() {
        return this.values;
    }

    public int size() {
        return this.values.size();
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof PrimaryKey && this.values.equals(((PrimaryKey) other).values);
    }

    @Override
    public int hashCode() {
        return this.values.hashCode();
    }

    @Override
    public String toString() {
        return this.values.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
    }
}
