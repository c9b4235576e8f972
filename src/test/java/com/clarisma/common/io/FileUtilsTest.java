package com.clarisma.common.io;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

public class FileUtilsTest
{
    @Rule public TemporaryFolder folder = new TemporaryFolder();

    @Test public void testExtensions()
    {
        assertEquals("gz", FileUtils.getExtension("data/benches.osm.gz"));
        assertEquals("", FileUtils.getExtension("data.d/benches"));
        assertEquals("benches.osm", FileUtils.pathWithDefaultExtension("benches", ".osm"));
        assertEquals("benches.osm", FileUtils.pathWithDefaultExtension("benches", "osm"));
        assertEquals("benches.xml", FileUtils.pathWithDefaultExtension("benches.xml", ".osm"));
        Path p = FileUtils.addExtension(Path.of("benches.osm"), "db");
        assertEquals("benches.osm.db", p.getFileName().toString());
    }

    @Test public void testReadIfExists() throws Exception
    {
        Path path = folder.getRoot().toPath().resolve("missing");
        assertNull(FileUtils.readIfExists(path));
        Files.write(path, new byte[] { 7 });
        assertArrayEquals(new byte[] { 7 }, FileUtils.readIfExists(path));
    }

    @Test public void testWriteAtomic() throws Exception
    {
        Path path = folder.getRoot().toPath().resolve("state.db");
        FileUtils.writeAtomic(path, "first".getBytes(StandardCharsets.UTF_8));
        FileUtils.writeAtomic(path, "second".getBytes(StandardCharsets.UTF_8));
        assertEquals("second", new String(Files.readAllBytes(path), StandardCharsets.UTF_8));
        assertFalse(Files.exists(folder.getRoot().toPath().resolve("state.db.tmp")));
    }
}
