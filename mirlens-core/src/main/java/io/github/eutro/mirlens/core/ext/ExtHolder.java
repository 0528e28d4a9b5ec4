package io.github.eutro.mirlens.core.ext;

import org.jetbrains.annotations.Nullable;

import java.util.Arrays;

/**
 * An {@link ExtContainer} storing values in a slot array indexed by {@link Ext#getId() ext id}.
 * <p>
 * Exts are few and created once, as constants, so the array stays small. It is only
 * allocated on the first attach.
 */
public class ExtHolder implements ExtContainer {
    private Object @Nullable [] slots = null;
    private int size = 0;

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        int id = ext.getId();
        if (slots == null) {
            slots = new Object[Math.max(8, id + 1)];
        } else if (id >= slots.length) {
            slots = Arrays.copyOf(slots, Math.max(slots.length * 2, id + 1));
        }
        if (slots[id] == null) size++;
        slots[id] = value;
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        int id = ext.getId();
        if (slots == null || id >= slots.length || slots[id] == null) return;
        slots[id] = null;
        if (--size == 0) {
            slots = null;
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> @Nullable T getNullable(Ext<T> ext) {
        int id = ext.getId();
        if (slots == null || id >= slots.length) return null;
        return (T) slots[id];
    }
}
