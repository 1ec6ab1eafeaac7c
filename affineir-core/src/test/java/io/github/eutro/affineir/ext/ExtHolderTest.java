package io.github.eutro.affineir.ext;

import io.github.eutro.affineir.ops.OpKey;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ExtHolderTest {
    private static final Ext<String> NAME = Ext.create(String.class, "NAME");
    private static final Ext<Boolean> FLAG = Ext.create(Boolean.class, "FLAG");

    @Test
    void testAttachAndRemove() {
        ExtHolder holder = new ExtHolder();
        assertNull(holder.getNullable(NAME));
        assertFalse(holder.getExt(NAME).isPresent());

        holder.attachExt(NAME, "a");
        assertEquals("a", holder.getExtOrThrow(NAME));
        holder.attachExt(NAME, "b");
        assertEquals("b", holder.getNullable(NAME));

        holder.removeExt(NAME);
        assertEquals("dflt", holder.getExtOr(NAME, "dflt"));
        assertThrows(IllegalStateException.class, () -> holder.getExtOrThrow(NAME));
    }

    @Test
    void testCompute() {
        ExtHolder holder = new ExtHolder();
        int[] calls = {0};
        assertEquals("x", holder.getExtOrCompute(NAME, () -> {
            calls[0]++;
            return "x";
        }));
        assertEquals("x", holder.getExtOrCompute(NAME, () -> {
            calls[0]++;
            return "y";
        }));
        assertEquals(1, calls[0]);
    }

    @Test
    void testManyExts() {
        List<Ext<Integer>> exts = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            exts.add(Ext.create(Integer.class, "EXT_" + i));
        }
        ExtHolder holder = new ExtHolder();
        for (int i = exts.size() - 1; i >= 0; i--) {
            holder.attachExt(exts.get(i), i);
        }
        holder.removeExt(exts.get(3));
        holder.removeExt(exts.get(3));
        for (int i = 0; i < exts.size(); i++) {
            assertEquals(i == 3 ? null : i, holder.getNullable(exts.get(i)));
        }
        for (Ext<Integer> ext : exts) {
            holder.removeExt(ext);
        }
        assertNull(holder.getNullable(exts.get(0)));
        holder.attachExt(exts.get(5), 50);
        assertEquals(50, holder.getNullable(exts.get(5)));
    }

    @Test
    void testDelegation() {
        OpKey key = new OpKey("test.delegating");
        key.attachExt(FLAG, true);
        key.attachExt(NAME, "from key");
        DelegatingExtHolder holder = new DelegatingExtHolder() {
            @Override
            protected ExtContainer getDelegate() {
                return key;
            }
        };
        assertTrue(holder.hasFlag(FLAG));
        assertEquals("from key", holder.getNullable(NAME));

        holder.attachExt(NAME, "own");
        assertEquals("own", holder.getNullable(NAME));
        assertEquals("from key", key.getNullable(NAME));
    }

    @Test
    void testExtsAreDistinct() {
        Ext<String> other = Ext.create(String.class, "NAME");
        ExtHolder holder = new ExtHolder();
        holder.attachExt(NAME, "a");
        assertNull(holder.getNullable(other));
        assertTrue(NAME.compareTo(other) < 0);
    }
}
