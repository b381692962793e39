package com.ganesh.keep.key;

import com.ganesh.keep.codec.KeepCodec;
import com.ganesh.keep.storage.MemoryStorage;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class KeyDescriptorTest {

    private static KeyDescriptor plain(String name) {
        return KeyDescriptor.root(name, KeyKind.PLAIN, false, false, null);
    }

    @Test
    void testPlainKeyUsesItsNameAsId() {
        KeyDescriptor key = plain("settings");
        assertEquals("settings", key.getPhysicalId());
        assertEquals("settings", key.getStoredName());
        assertFalse(key.isExternal());
    }

    @Test
    void testSecureKeyIsHashedAndExternal() {
        KeyDescriptor key = KeyDescriptor.root("token", KeyKind.SECURE, false, false, null);
        assertEquals("2ot2qn2e", key.getPhysicalId());
        assertEquals(key.getPhysicalId(), key.getStoredName());
        assertEquals("token", key.getLogicalName());
        assertTrue(key.isExternal());
    }

    @Test
    void testCustomStorageForcesExternalPlacement() {
        KeyDescriptor key = KeyDescriptor.root("row", KeyKind.PLAIN, false, false, new MemoryStorage());
        assertTrue(key.isExternal());
    }

    @Test
    void testChildIdsAndNames() {
        KeyDescriptor parent = KeyDescriptor.root("drafts", KeyKind.PLAIN, true, false, null);
        KeyDescriptor child = parent.child("42");

        assertEquals("drafts$" + KeepCodec.hash("drafts$42"), child.getPhysicalId());
        assertEquals("drafts.42", child.getLogicalName());
        assertTrue(child.isExternal());
        assertTrue(child.isRemovable());
        assertSame(parent, child.getParent());

        assertTrue(parent.isDirectChild(child.getPhysicalId()));
        assertFalse(parent.isDirectChild(child.child("7").getPhysicalId()));
        assertFalse(parent.isDirectChild("drafts$"));
        assertFalse(parent.isDirectChild("draftsX"));
    }

    @Test
    void testUnusableNamesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> plain(""));
        assertThrows(IllegalArgumentException.class, () -> plain("a$b"));
        assertThrows(IllegalArgumentException.class, () -> plain("a/b"));
        assertThrows(IllegalArgumentException.class, () -> plain("a\\b"));
        assertThrows(IllegalArgumentException.class, () -> plain(".."));
        assertThrows(IllegalArgumentException.class, () -> plain("name.tmp"));
        assertThrows(IllegalArgumentException.class, () -> plain("x".repeat(300)));
        assertThrows(IllegalArgumentException.class, () -> plain("ok").child(""));

        // Secure names never reach the file system.
        assertDoesNotThrow(() -> KeyDescriptor.root("a/b$c", KeyKind.SECURE, false, false, null));
    }

    @Test
    void testCompatibility() {
        assertTrue(plain("a").isCompatible(plain("a")));
        assertFalse(plain("a").isCompatible(KeyDescriptor.root("a", KeyKind.PLAIN, true, false, null)));
        assertFalse(plain("a").isCompatible(KeyDescriptor.root("a", KeyKind.PLAIN, false, true, null)));
    }
}
