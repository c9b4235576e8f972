package com.clarisma.common.cli;

import org.junit.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class CommandConfiguratorTest
{
    static class SampleCommand extends BasicCommand
    {
        String source;
        String target;
        List<String> labels = new ArrayList<>();

        @Option("limit,l=number: maximum")
        int limit;

        @Option("dry-run,n")
        boolean dryRun;

        @Option("output,o=file")
        Path output;

        @Parameter("0=source")
        void source(String s)
        {
            source = s;
        }

        @Parameter("1=?target")
        void target(String s)
        {
            target = s;
        }

        @Option("label=text: may be repeated")
        void label(String s)
        {
            labels.add(s);
        }

        @Override public int perform()
        {
            return 0;
        }

        @Override public int error(Throwable ex)
        {
            return 1;
        }
    }

    static class BadOrderCommand extends SampleCommand
    {
        @Parameter("2=extra")
        void extra(String s)
        {
        }
    }

    @Test public void testOptions() throws Exception
    {
        SampleCommand cmd = new SampleCommand();
        CommandConfigurator c = new CommandConfigurator(cmd);
        c.setOption("l", "1_000");
        c.setOption("n", null);
        c.setOption("output", "out.txt");
        c.setOption("label", "a");
        c.setOption("label", "b");
        c.setOption("verbose", null);
        assertEquals(1000, cmd.limit);
        assertTrue(cmd.dryRun);
        assertEquals(Path.of("out.txt"), cmd.output);
        assertEquals(List.of("a", "b"), cmd.labels);
        assertEquals(Verbosity.VERBOSE, cmd.verbosity());
    }

    @Test public void testBooleanValues() throws Exception
    {
        SampleCommand cmd = new SampleCommand();
        CommandConfigurator c = new CommandConfigurator(cmd);
        c.setOption("dry-run", "yes");
        assertTrue(cmd.dryRun);
        c.setOption("dry-run", "off");
        assertFalse(cmd.dryRun);
    }

    @Test public void testInvalidOptions() throws Exception
    {
        CommandConfigurator c = new CommandConfigurator(new SampleCommand());
        assertInvalid(c, "limit", "many", "Option limit: Must be a number, not \"many\"");
        assertInvalid(c, "limit", null, "Option limit: Value required");
        assertInvalid(c, "quiet", "please", "Option quiet: Cannot have a value");
        assertInvalid(c, "verbosity", "loud", "Option verbosity: \"loud\" is not a valid verbosity");
        assertInvalid(c, "colour", "blue", "Unknown option: colour");
    }

    private static void assertInvalid(CommandConfigurator c, String name, String value,
        String message) throws Exception
    {
        try
        {
            c.setOption(name, value);
            fail("Expected IllegalArgumentException");
        }
        catch(IllegalArgumentException ex)
        {
            assertTrue(ex.getMessage(), ex.getMessage().startsWith(message));
        }
    }

    @Test public void testParams() throws Exception
    {
        SampleCommand cmd = new SampleCommand();
        new CommandConfigurator(cmd).setParams(List.of("in.osm"));
        assertEquals("in.osm", cmd.source);
        assertNull(cmd.target);

        cmd = new SampleCommand();
        new CommandConfigurator(cmd).setParams(List.of("in.osm", "out.osm"));
        assertEquals("out.osm", cmd.target);
    }

    @Test public void testParamErrors() throws Exception
    {
        try
        {
            new CommandConfigurator(new SampleCommand()).setParams(List.of());
            fail("Expected IllegalArgumentException");
        }
        catch(IllegalArgumentException ex)
        {
            assertEquals("<source>: Missing argument", ex.getMessage());
        }
        try
        {
            new CommandConfigurator(new SampleCommand()).setParams(List.of("a", "b", "c", "d"));
            fail("Expected IllegalArgumentException");
        }
        catch(IllegalArgumentException ex)
        {
            assertEquals("Extraneous argument(s): c d", ex.getMessage());
        }
    }

    @Test(expected = IllegalStateException.class)
    public void testRequiredAfterOptional()
    {
        new CommandConfigurator(new BadOrderCommand());
    }

    @Test public void testDescribeOptions()
    {
        String help = new CommandConfigurator(new SampleCommand()).describeOptions();
        assertTrue(help, help.contains("--limit, -l=number"));
        assertTrue(help.contains("maximum"));
        assertTrue(help.contains("--dry-run, -n"));
        assertTrue(help.contains("--verbose, -v"));
    }
}
