package com.clarisma.common.cli;

import org.junit.Test;

import java.nio.file.Path;

import static org.junit.Assert.*;

public class ConverterTest
{
    @Test public void testConvert()
    {
        assertEquals(50_000, Converter.convert("50_000", int.class));
        assertEquals(7L, Converter.convert("7", Long.class));
        assertEquals(Boolean.TRUE, Converter.convert("yes", boolean.class));
        assertEquals(Path.of("ids.db"), Converter.convert("ids.db", Path.class));
        assertEquals("abc", Converter.convert("abc", String.class));
    }

    @Test public void testUnsupportedType()
    {
        try
        {
            Converter.convert("CREATE", Thread.State.class);
            fail("Expected IllegalArgumentException");
        }
        catch(IllegalArgumentException ex)
        {
            assertEquals("Unable to convert \"CREATE\" to State", ex.getMessage());
        }
    }
}
