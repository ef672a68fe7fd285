package net.katagaitai.evmterm.trace;

import com.google.common.collect.ImmutableList;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

@Value
public class TraceTree {
    Trace label;
    ImmutableList<TraceTree> children;

    public TraceTree(@NonNull Trace label, @NonNull List<TraceTree> children) {
        this.label = label;
        this.children = ImmutableList.copyOf(children);
    }

    public static TraceTree leaf(Trace label) {
        return new TraceTree(label, ImmutableList.of());
    }

    public int size() {
        int size = 1;
        for (TraceTree child : children) {
            size += child.size();
        }
        return size;
    }
}
