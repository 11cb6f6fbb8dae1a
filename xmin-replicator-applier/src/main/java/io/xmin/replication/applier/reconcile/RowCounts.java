package io.xmin.replication.applier.reconcile;

public class RowCounts {
    private final long source;
    private final long target;

    public RowCounts(long source, long target) {
        this.source = source;
        this.target = target;
    }

    public long getSource() {
        return this.source;
    }

    public long getTarget() {
        return this.target;
    }

    public boolean isConsistent() {
        return this.source == this.target;
    }

    @Override
    public String toString() {
        return String.format("source: %d | target: %d", this.source, this.target);
    }
}
