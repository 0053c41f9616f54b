package pipelang.runtime.interpreter;

import java.util.AbstractList;
import java.util.Arrays;
import java.util.List;

/**
 * 不可变元组
 */
public final class PipeTuple extends AbstractList<Object> {

    private static final PipeTuple EMPTY = new PipeTuple(new Object[0]);

    private final Object[] items;

    private PipeTuple(Object[] items) {
        this.items = items;
    }

    public static PipeTuple of(Object... items) {
        return items.length == 0 ? EMPTY : new PipeTuple(items.clone());
    }

    public static PipeTuple copyOf(List<?> items) {
        return items.isEmpty() ? EMPTY : new PipeTuple(items.toArray());
    }

    @Override
    public Object get(int index) {
        return items[index];
    }

    @Override
    public int size() {
        return items.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PipeTuple)) return false;
        return Arrays.equals(items, ((PipeTuple) o).items);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(items);
    }

    @Override
    public String toString() {
        return Builtins.repr(this);
    }
}
