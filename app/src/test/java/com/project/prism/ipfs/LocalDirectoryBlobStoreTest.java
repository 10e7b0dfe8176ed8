package com.project.prism.ipfs;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalDirectoryBlobStoreTest {

    @TempDir
    Path dir;

    @Test
    void contentIdIsDerivedFromBytes() throws Exception {
        LocalDirectoryBlobStore store = new LocalDirectoryBlobStore(dir.resolve("blobs"));

        String first = store.put(new byte[]{1, 2, 3}, "a");
        String again = store.put(new byte[]{1, 2, 3}, "b");
        String other = store.put(new byte[]{3, 2, 1}, "c");

        assertEquals(first, again);
        assertNotEquals(first, other);
        assertTrue(first.startsWith(ContentIds.LOCAL_PREFIX));
        assertEquals(Set.of(first, other), store.list());
    }

    @Test
    void getReturnsStoredBytesWithOrWithoutUriPrefix() throws Exception {
        LocalDirectoryBlobStore store = new LocalDirectoryBlobStore(dir);
        String cid = store.put(new byte[]{7, 7}, "blob");

        assertArrayEquals(new byte[]{7, 7}, store.get(cid));
        assertArrayEquals(new byte[]{7, 7}, store.get(ContentIds.URI_PREFIX + cid));
    }

    @Test
    void unpinnedContentIsGone() throws Exception {
        LocalDirectoryBlobStore store = new LocalDirectoryBlobStore(dir);
        String cid = store.put(new byte[]{1}, "blob");

        store.unpin(cid);

        assertThrows(BlobNotFoundException.class, () -> store.get(cid));
        assertThrows(BlobNotFoundException.class, () -> store.unpin(cid));
        assertTrue(store.list().isEmpty());
    }

    @Test
    void testAuthCreatesTheDirectory() {
        assertTrue(new LocalDirectoryBlobStore(dir.resolve("nested/blobs")).testAuth());
    }

    @Test
    void contentIdsAreNormalized() {
        assertEquals("QmAbc123456", ContentIds.normalize(" ipfs://QmAbc123456 "));
        assertThrows(IllegalArgumentException.class, () -> ContentIds.normalize("short"));
        assertThrows(IllegalArgumentException.class, () -> ContentIds.normalize("Qm/../../secret"));
        assertThrows(IllegalArgumentException.class, () -> ContentIds.normalize(null));
    }
}
