package org.pharmaguard;

import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.pharmaguard.cmdline.CommandLineProgram;
import org.pharmaguard.cmdline.programgroups.PharmacogenomicsProgramGroup;
import org.pharmaguard.exceptions.UserException;
import org.pharmaguard.testutils.CommandLineProgramTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public final class MainTest extends CommandLineProgramTest {

    private static final int MAX_ALLOWABLE_ONE_LINE_SUMMARY_LENGTH = 120;

    private static final List<String> TOOL_NAMES =
            Arrays.asList("AnalyzePharmacogenomics", "SummarizeCohortRisk", "EvaluateConfidenceCalibration");

    @Test(expectedExceptions = UserException.class)
    public void testCommandNotFoundThrows(){
        new Main().instanceMain(new String[]{"Brain"});
    }

    @CommandLineProgramProperties(
            programGroup = PharmacogenomicsProgramGroup.class,
            summary = "OmitFromCommandLine test",
            oneLineSummary = "OmitFromCommandLine test",
            omitFromCommandLine = true)
    public static final class OmitFromCommandLineCLP extends CommandLineProgram {

        public static final int RETURN_VALUE = 1;

        @Override
        protected Object doWork() {
            return RETURN_VALUE;
        }
    }

    private static final class OmitFromCommandLineMain extends Main {
        @Override
        protected List<Class<? extends CommandLineProgram>> getClassList() {
            return Collections.singletonList(OmitFromCommandLineCLP.class);
        }
    }

    private static String captureStdout(final Runnable runnable) {
        final PrintStream original = System.out;
        final ByteArrayOutputStream captured = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
            runnable.run();
        } finally {
            System.setOut(original);
        }
        return captured.toString(StandardCharsets.UTF_8);
    }

    @Test
    public void testClpOmitFromCommandLine() {
        final OmitFromCommandLineMain main = new OmitFromCommandLineMain();
        final String clpName = "OmitFromCommandLineCLP";
        // the tool still runs when named explicitly
        Assert.assertEquals(main.instanceMain(new String[]{clpName, "--verbosity", "ERROR"}), OmitFromCommandLineCLP.RETURN_VALUE);
        final String usage = captureStdout(() -> main.instanceMain(new String[]{"-h"}));
        Assert.assertFalse(usage.contains(clpName));
    }

    @Test
    public void testUsageListsEveryTool() {
        final String usage = captureStdout(() -> Assert.assertNull(new Main().instanceMain(new String[]{"--help"})));
        for (final String tool : TOOL_NAMES) {
            Assert.assertTrue(usage.contains(tool), tool);
        }
    }

    @Test
    public void testEnsureShortDescriptionsAreShort() {
        for (final Class<? extends CommandLineProgram> clazz : new Main().getClassList()) {
            final CommandLineProgramProperties properties = Main.getProgramProperty(clazz);
            Assert.assertNotNull(properties, clazz.getSimpleName());
            Assert.assertTrue(properties.oneLineSummary().length() <= MAX_ALLOWABLE_ONE_LINE_SUMMARY_LENGTH,
                    String.format("One line summary for tool '%s' exceeds allowable length of %d",
                            clazz.getCanonicalName(), MAX_ALLOWABLE_ONE_LINE_SUMMARY_LENGTH));
        }
    }

    @Test
    public void testSuggestsCloseCommand() {
        final String message = Main.getSuggestedAlternateCommand(TOOL_NAMES, "AnalyzePharmacogenomic");
        Assert.assertTrue(message.startsWith("'AnalyzePharmacogenomic' is not a valid command."), message);
        Assert.assertTrue(message.contains("Did you mean this?"), message);
        Assert.assertTrue(message.contains("AnalyzePharmacogenomics"), message);
        Assert.assertFalse(message.contains("SummarizeCohortRisk"), message);
    }

    @Test
    public void testNoSuggestionForUnrelatedCommand() {
        final String message = Main.getSuggestedAlternateCommand(TOOL_NAMES, "Brain");
        Assert.assertFalse(message.contains("Did you mean"), message);
    }

    @Test
    public void testSubstringMatchingAllToolsGivesNoSuggestion() {
        final String message = Main.getSuggestedAlternateCommand(Arrays.asList("SummarizeCohortRisk", "SummarizeCohortRiskAgain"), "Summarize");
        Assert.assertFalse(message.contains("Did you mean"), message);
    }
}
