package com.geodesk.upload.idmap;

import com.geodesk.upload.model.EntityType;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

public class IdMapTest
{
    @Rule public TemporaryFolder folder = new TemporaryFolder();

    @Test public void testRecordAndLookup()
    {
        IdMap map = new IdMap(new MemoryIdMapStorage());
        assertFalse(map.contains(EntityType.NODE, -1));
        assertFalse(map.lookup(EntityType.NODE, -1).isPresent());
        assertEquals(-1, map.resolve(EntityType.NODE, -1));

        map.record(EntityType.NODE, -1, 5001);
        assertTrue(map.contains(EntityType.NODE, -1));
        assertEquals(5001, map.lookup(EntityType.NODE, -1).getAsLong());
        assertEquals(5001, map.resolve(EntityType.NODE, -1));

        // Types have separate ID spaces
        assertFalse(map.contains(EntityType.WAY, -1));
        assertEquals(-1, map.resolve(EntityType.WAY, -1));
        assertEquals(1, map.size());
        assertEquals(0, map.size(EntityType.WAY));
    }

    @Test public void testRecordSameMappingTwice()
    {
        IdMap map = new IdMap(new MemoryIdMapStorage());
        map.record(EntityType.WAY, -7, 700);
        map.record(EntityType.WAY, -7, 700);
        assertEquals(1, map.size(EntityType.WAY));
    }

    @Test public void testConflict()
    {
        IdMap map = new IdMap(new MemoryIdMapStorage());
        map.record(EntityType.RELATION, -3, 300);
        try
        {
            map.record(EntityType.RELATION, -3, 301);
            fail("Expected IdConflictException");
        }
        catch(IdConflictException ex)
        {
            assertEquals(EntityType.RELATION, ex.type());
            assertEquals(-3, ex.sourceId());
        }
        assertEquals(300, map.resolve(EntityType.RELATION, -3));
    }

    @Test public void testRecordDeleted()
    {
        IdMap map = new IdMap(new MemoryIdMapStorage());
        map.recordDeleted(EntityType.NODE, 42);
        assertTrue(map.contains(EntityType.NODE, 42));
        assertEquals(42, map.resolve(EntityType.NODE, 42));
    }

    @Test public void testPersistAndLoad() throws Exception
    {
        Path path = folder.getRoot().toPath().resolve("input.osm.db");
        IdMap map = new IdMap(new FileIdMapStorage(path));
        map.load();
        assertEquals(0, map.size());
        map.record(EntityType.NODE, -1, 11);
        map.record(EntityType.NODE, -2, 12);
        map.record(EntityType.WAY, -1, 21);
        map.record(EntityType.RELATION, -1, 31);
        map.persist();
        assertTrue(Files.exists(path));

        IdMap restored = new IdMap(new FileIdMapStorage(path));
        restored.load();
        assertEquals(4, restored.size());
        assertEquals(12, restored.resolve(EntityType.NODE, -2));
        assertEquals(21, restored.resolve(EntityType.WAY, -1));
        assertEquals(31, restored.resolve(EntityType.RELATION, -1));
        assertNull(restored.pendingUpload());
    }

    @Test public void testLeftoverTempFileIsIgnored() throws Exception
    {
        Path path = folder.getRoot().toPath().resolve("map.db");
        IdMap map = new IdMap(new FileIdMapStorage(path));
        map.record(EntityType.NODE, -1, 11);
        map.persist();

        // A write that died before the rename leaves only the temp file
        Files.write(folder.getRoot().toPath().resolve("map.db.tmp"),
            new byte[] { 1, 2, 3, 4 });

        IdMap restored = new IdMap(new FileIdMapStorage(path));
        restored.load();
        assertEquals(1, restored.size());
        assertEquals(11, restored.resolve(EntityType.NODE, -1));
    }

    @Test public void testCorruptFileLoadsEmpty() throws Exception
    {
        Path path = folder.newFile("corrupt.db").toPath();
        Files.write(path, "not an id map".getBytes(StandardCharsets.UTF_8));
        IdMap map = new IdMap(new FileIdMapStorage(path));
        map.load();
        assertEquals(0, map.size());

        // The map is still usable, and persisting it replaces the bad file
        map.record(EntityType.NODE, -1, 1);
        map.persist();
        IdMap restored = new IdMap(new FileIdMapStorage(path));
        restored.load();
        assertEquals(1, restored.size());
    }

    @Test public void testMissingFileLoadsEmpty()
    {
        IdMap map = new IdMap(new FileIdMapStorage(
            folder.getRoot().toPath().resolve("missing.db")));
        map.load();
        assertEquals(0, map.size());
        assertNull(map.pendingUpload());
    }

    @Test public void testPendingMarker() throws Exception
    {
        Path path = folder.getRoot().toPath().resolve("pending.db");
        Path markerPath = folder.getRoot().toPath().resolve("pending.db.pending");
        IdMap map = new IdMap(new FileIdMapStorage(path));
        map.markPending("diffset of 3 entities in changeset 9");
        assertTrue(Files.exists(markerPath));

        // A run that dies here leaves the marker behind
        IdMap interrupted = new IdMap(new FileIdMapStorage(path));
        interrupted.load();
        assertEquals("diffset of 3 entities in changeset 9", interrupted.pendingUpload());

        map.record(EntityType.NODE, -1, 100);
        map.persist();
        assertFalse(Files.exists(markerPath));
        assertNull(map.pendingUpload());

        IdMap restored = new IdMap(new FileIdMapStorage(path));
        restored.load();
        assertNull(restored.pendingUpload());
        assertEquals(100, restored.resolve(EntityType.NODE, -1));
    }

    @Test public void testLoadReplacesContents()
    {
        MemoryIdMapStorage storage = new MemoryIdMapStorage();
        IdMap map = new IdMap(storage);
        map.record(EntityType.NODE, -1, 1);
        map.load();
        assertEquals(0, map.size());
    }
}
