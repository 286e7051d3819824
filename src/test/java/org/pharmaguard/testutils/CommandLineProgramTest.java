package org.pharmaguard.testutils;

import htsjdk.samtools.util.Log;
import org.pharmaguard.Main;
import org.pharmaguard.cmdline.StandardArgumentDefinitions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Utility class for CommandLine Program testing. The tested tool is named after the test class,
 * minus its "Test" or "IntegrationTest" suffix.
 */
public abstract class CommandLineProgramTest extends PgxBaseTest {

    /**
     * Returns the name for the tested tool.
     */
    public String getTestedToolName() {
        return getClass().getSimpleName().replaceAll("(Integration)?Test$", "");
    }

    public Object runCommandLine(final List<String> args) {
        return new Main().instanceMain(makeCommandLineArgs(args));
    }

    public Object runCommandLine(final String... args) {
        return runCommandLine(Arrays.asList(args));
    }

    /**
     * Builds "toolname args", adding a quiet verbosity unless the caller chose one.
     */
    public String[] makeCommandLineArgs(final List<String> args) {
        final List<String> curatedArgs = new ArrayList<>();
        curatedArgs.add(getTestedToolName());
        curatedArgs.addAll(args);
        if (!args.contains("--" + StandardArgumentDefinitions.VERBOSITY_NAME)) {
            curatedArgs.add("--" + StandardArgumentDefinitions.VERBOSITY_NAME);
            curatedArgs.add(Log.LogLevel.ERROR.name());
        }
        return curatedArgs.toArray(new String[0]);
    }
}
