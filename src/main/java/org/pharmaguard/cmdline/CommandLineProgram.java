package org.pharmaguard.cmdline;

import htsjdk.samtools.metrics.Header;
import htsjdk.samtools.metrics.MetricBase;
import htsjdk.samtools.metrics.MetricsFile;
import htsjdk.samtools.metrics.StringHeader;
import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.ArgumentCollection;
import org.broadinstitute.barclay.argparser.CommandLineArgumentParser;
import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.barclay.argparser.CommandLineParser;
import org.broadinstitute.barclay.argparser.SpecialArgumentsCollection;
import org.pharmaguard.utils.LoggingUtils;
import org.pharmaguard.utils.Utils;
import org.pharmaguard.utils.config.ConfigFactory;
import org.pharmaguard.utils.config.PharmaGuardConfig;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Base class of the PharmaGuard tools.
 *
 * A tool declares its inputs as {@link Argument} fields, may check them together in
 * {@link #customCommandLineValidation()}, and does its work in {@link #doWork()}. The value {@code doWork} returns is
 * handed back to {@link org.pharmaguard.Main} unchanged. Exceptions thrown by a tool are not caught here.
 */
public abstract class CommandLineProgram {

    // Instance logger so that messages carry the concrete tool's name.
    protected final Logger logger = LogManager.getLogger(this.getClass());

    @ArgumentCollection(doc = "Special arguments that have meaning to the argument parsing system")
    public SpecialArgumentsCollection specialArgumentsCollection = new SpecialArgumentsCollection();

    @Argument(fullName = StandardArgumentDefinitions.VERBOSITY_NAME, shortName = StandardArgumentDefinitions.VERBOSITY_NAME,
            doc = "Control verbosity of logging.", common = true, optional = true)
    public Log.LogLevel VERBOSITY = Log.LogLevel.INFO;

    @Argument(fullName = StandardArgumentDefinitions.QUIET_NAME, doc = "Whether to suppress the start and end banners.",
            common = true, optional = true)
    public Boolean QUIET = false;

    // Declared so that it shows up in the usage; Main reads it before any tool is built.
    @Argument(fullName = StandardArgumentDefinitions.CONFIG_FILE_OPTION,
            doc = "A PharmaGuard configuration file overriding the bundled defaults.",
            common = true, optional = true)
    public String CONFIG_FILE = null;

    private CommandLineParser commandLineParser;

    private final List<Header> metricsHeaders = new ArrayList<>();

    private String commandLine;

    /**
     * Called after argument parsing and before {@link #doWork()}. Does nothing by default.
     */
    protected void onStartup() {}

    /**
     * @return the tool's result, possibly {@code null}
     */
    protected abstract Object doWork();

    /**
     * Called after {@link #doWork()}, also when it throws. Does nothing by default.
     */
    protected void onShutdown() {}

    private Object runTool() {
        try {
            onStartup();
            return doWork();
        } finally {
            onShutdown();
        }
    }

    /**
     * Parses {@code argv} and runs the tool.
     *
     * @return the result of {@link #doWork()}, or 0 when only help or version information was requested
     * @throws CommandLineException if the arguments do not parse or fail validation
     */
    public Object instanceMain(final String[] argv) {
        if (!parseArgs(argv)) {
            return 0;
        }
        final ZonedDateTime startDateTime = ZonedDateTime.now();
        metricsHeaders.add(new StringHeader(commandLine));
        metricsHeaders.add(new StringHeader("Started on: " + Utils.getDateTimeForDisplay(startDateTime)));

        LoggingUtils.setLoggingLevel(VERBOSITY);
        if (!QUIET) {
            printStartupMessage(startDateTime);
        }
        try {
            return runTool();
        } finally {
            if (!QUIET) {
                final long elapsedSeconds = Duration.between(startDateTime, ZonedDateTime.now()).getSeconds();
                logger.info(String.format("%s done. Elapsed time: %d s", getClass().getSimpleName(), elapsedSeconds));
            }
        }
    }

    /**
     * Override to check arguments against each other after parsing.
     *
     * @return {@code null} when the arguments are valid, otherwise one message per problem
     */
    protected String[] customCommandLineValidation() {
        return null;
    }

    /**
     * @return false if an information only argument like help was given and the tool should not run
     */
    protected final boolean parseArgs(final String[] argv) {
        final boolean parsed = getCommandLineParser().parseArguments(System.err, argv);
        commandLine = getCommandLineParser().getCommandLine();
        if (!parsed) {
            return false;
        }
        final String[] errors = customCommandLineValidation();
        if (errors != null) {
            throw new CommandLineException("Command Line Validation failed: " + String.join(", ", errors));
        }
        return true;
    }

    /**
     * A metrics file whose headers record the command line and start time of this run.
     */
    protected <A extends MetricBase, B extends Comparable<?>> MetricsFile<A, B> getMetricsFile() {
        final MetricsFile<A, B> file = new MetricsFile<>();
        metricsHeaders.forEach(file::addHeader);
        return file;
    }

    private void printStartupMessage(final ZonedDateTime startDateTime) {
        final PharmaGuardConfig config = ConfigFactory.getInstance().getPharmaGuardConfig();
        logger.info(Utils.dupChar('-', 60));
        logger.info(String.format("PharmaGuard v%s  %s", config.pgx_analysis_version(), getClass().getSimpleName()));
        logger.info(String.format("Java runtime: %s v%s",
                System.getProperty("java.vm.name"), System.getProperty("java.runtime.version")));
        logger.info("Start Date/Time: " + Utils.getDateTimeForDisplay(startDateTime));
        logger.info(Utils.dupChar('-', 60));
        ConfigFactory.logConfigFields(config, Log.LogLevel.DEBUG);
    }

    /**
     * @return the command line as parsed, or {@code null} before parsing
     */
    public final String getCommandLine() {
        return commandLine;
    }

    public final String getUsage() {
        return getCommandLineParser().usage(true, specialArgumentsCollection.SHOW_HIDDEN);
    }

    private CommandLineParser getCommandLineParser() {
        if (commandLineParser == null) {
            commandLineParser = new CommandLineArgumentParser(this);
        }
        return commandLineParser;
    }
}
