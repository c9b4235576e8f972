package com.clarisma.common.cli;

import org.junit.Test;

import static org.junit.Assert.*;

public class ApplicationTest
{
    static class TestApp extends Application
    {
        Throwable error;

        @Override protected String version()
        {
            return "test 1.0";
        }

        @Override protected String description()
        {
            return "A test application";
        }

        @Override protected int error(Throwable ex, int verbosity)
        {
            error = ex;
            return 2;
        }
    }

    static class EchoCommand extends BasicCommand
    {
        @Parameter("0=?text")
        String text;

        @Override public int perform()
        {
            return text == null ? 0 : text.length();
        }

        @Override public int error(Throwable ex)
        {
            return 99;
        }
    }

    @Test public void testCommandClassName()
    {
        assertEquals("UploadCommand", Application.commandClassName("upload"));
        assertEquals("CheckIdMapCommand", Application.commandClassName("check-id-map"));
    }

    @Test public void testRun()
    {
        TestApp app = new TestApp();
        assertEquals(5, app.run(new EchoCommand(), new String[] { "hello", "-q" }));
        assertEquals(99, app.run(new EchoCommand(), new String[] { "--bogus" }));
    }

    @Test public void testUnknownCommand()
    {
        TestApp app = new TestApp();
        assertEquals(2, app.run(null, new String[] { "frobnicate", "-s" }));
        assertEquals("Unknown command: frobnicate", app.error.getMessage());
    }

    @Test public void testDefaultCommand()
    {
        TestApp app = new TestApp();
        assertEquals(0, app.run(null, new String[] { "--version", "--silent" }));
        assertNull(app.error);
    }
}
