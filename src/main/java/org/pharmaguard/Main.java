package org.pharmaguard;

import htsjdk.samtools.util.StringUtil;
import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.pharmaguard.cmdline.CommandLineProgram;
import org.pharmaguard.cmdline.StandardArgumentDefinitions;
import org.pharmaguard.exceptions.PharmaGuardException;
import org.pharmaguard.exceptions.UserException;
import org.pharmaguard.tools.pgx.AnalyzePharmacogenomics;
import org.pharmaguard.tools.pgx.EvaluateConfidenceCalibration;
import org.pharmaguard.tools.pgx.SummarizeCohortRisk;
import org.pharmaguard.utils.Utils;
import org.pharmaguard.utils.config.ConfigFactory;

import java.io.PrintStream;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * This is the main class of PharmaGuard and is the way of executing individual command line programs.
 *
 * The first argument names the tool by its simple class name; the rest are handed to that tool.
 * Subclasses may override {@link #getClassList()}, {@link #handleResult(Object)} and
 * {@link #handleNonUserException(Exception)}.
 */
public class Main {

    static {
        Utils.forceJVMLocaleToUSEnglish();
    }

    /**
     * exit value when an issue with the commandline is detected, ie CommandLineException.
     */
    public static final int COMMANDLINE_EXCEPTION_EXIT_VALUE = 1;

    /**
     * Exit value when an unrecoverable {@link UserException} occurs.
     */
    public static final int USER_EXCEPTION_EXIT_VALUE = 2;

    /**
     * exit value when any unrecoverable exception other than {@link UserException} occurs
     */
    public static final int ANY_OTHER_EXCEPTION_EXIT_VALUE = 3;

    private static final String STACK_TRACE_ON_USER_EXCEPTION_PROPERTY = "PHARMAGUARD_STACKTRACE_ON_USER_EXCEPTION";

    private static final String COMMAND_LINE_NAME = "pharmaguard";

    /**
     * Prints the given message (may be null) to the provided stream, adding adornments and formatting.
     */
    protected static void printDecoratedExceptionMessage(final PrintStream ps, final Exception e, final String prefix){
        Utils.nonNull(ps, "stream");
        Utils.nonNull(e, "exception");
        ps.println("***********************************************************************");
        ps.println();
        ps.println(prefix + e.getMessage());
        ps.println();
        ps.println("***********************************************************************");
    }

    /**
     * The tools available on the command line.
     */
    protected List<Class<? extends CommandLineProgram>> getClassList() {
        return Arrays.asList(AnalyzePharmacogenomics.class, SummarizeCohortRisk.class, EvaluateConfidenceCalibration.class);
    }

    /**
     * Pulls the config file option out of the arguments and initializes the configuration before any tool
     * reads its defaults.
     */
    protected void parseArgsForConfigSetup(final String[] args) {
        ConfigFactory.getInstance().initializeConfigurationsFromCommandLineArgs(args, "--" + StandardArgumentDefinitions.CONFIG_FILE_OPTION);
    }

    /**
     * This method is not intended to be used outside of the PharmaGuard framework and tests.
     */
    public Object instanceMain(final String[] args) {
        final CommandLineProgram program = setupConfigAndExtractProgram(args);
        return runCommandLineProgram(program, args);
    }

    protected CommandLineProgram setupConfigAndExtractProgram(final String[] args) {
        parseArgsForConfigSetup(args);
        return extractCommandLineProgram(args);
    }

    /**
     * Run the given command line program with the raw arguments from the command line
     * @param rawArgs these are the raw arguments from the command line, the first will be stripped off
     * @return the result of running {@code program} with the given args, possibly null
     */
    protected static Object runCommandLineProgram(final CommandLineProgram program, final String[] rawArgs) {
        if (null == program) return null; // help was requested without a tool
        final String[] mainArgs = Arrays.copyOfRange(rawArgs, 1, rawArgs.length);
        return program.instanceMain(mainArgs);
    }

    /**
     * The entry point from the command line. This is the only method allowed to call System.exit.
     */
    protected final void mainEntry(final String[] args) {
        CommandLineProgram program = null;
        try {
            program = setupConfigAndExtractProgram(args);
            final Object result = runCommandLineProgram(program, args);
            handleResult(result);
        } catch (final CommandLineException e){
            if (program != null) {
                System.err.println(program.getUsage());
            }
            handleUserException(e);
            System.exit(COMMANDLINE_EXCEPTION_EXIT_VALUE);
        } catch (final UserException e){
            handleUserException(e);
            System.exit(USER_EXCEPTION_EXIT_VALUE);
        } catch (final Exception e){
            handleNonUserException(e);
            System.exit(ANY_OTHER_EXCEPTION_EXIT_VALUE);
        }
    }

    /**
     * Handle the result returned for a tool. Default implementation prints a message with the string value of the object if it is not null.
     */
    protected void handleResult(final Object result) {
        if (result != null) {
            System.out.println("Tool returned:\n" + result);
        }
    }

    /**
     * Prints a decorated message, and the stack trace only when configured to.
     */
    protected void handleUserException(final Exception e) {
        printDecoratedExceptionMessage(System.err, e, "A USER ERROR has occurred: ");

        if (printStackTraceOnUserExceptions()) {
            e.printStackTrace();
        } else {
            System.err.println(String.format(
                    "Set the system property %s (-D%s=true) or pgx.stacktrace_on_user_exception to print the stack trace.",
                    STACK_TRACE_ON_USER_EXCEPTION_PROPERTY,
                    STACK_TRACE_ON_USER_EXCEPTION_PROPERTY));
        }
    }

    /**
     * Handle any exception that does not come from the user. Default implementation prints the stack trace.
     */
    protected void handleNonUserException(final Exception exception) {
        exception.printStackTrace();
    }

    public static void main(final String[] args) {
        new Main().mainEntry(args);
    }

    private static boolean printStackTraceOnUserExceptions() {
        return "true".equals(System.getenv(STACK_TRACE_ON_USER_EXCEPTION_PROPERTY))
                || Boolean.getBoolean(STACK_TRACE_ON_USER_EXCEPTION_PROPERTY)
                || ConfigFactory.getInstance().getPharmaGuardConfig().pgx_stacktrace_on_user_exception();
    }

    /**
     * @return the tool named by the first argument, or null if help was requested
     * @throws UserException if the first argument names no tool
     */
    private CommandLineProgram extractCommandLineProgram(final String[] args) {
        final Map<String, Class<? extends CommandLineProgram>> simpleNameToClass = new LinkedHashMap<>();
        for (final Class<? extends CommandLineProgram> clazz : getClassList()) {
            if (getProgramProperty(clazz) == null) {
                throw new PharmaGuardException("The class " + clazz.getSimpleName() + " is missing the required CommandLineProgramProperties annotation");
            }
            if (simpleNameToClass.put(clazz.getSimpleName(), clazz) != null) {
                throw new PharmaGuardException("Simple class name collision: " + clazz.getName());
            }
        }

        if (args.length < 1 || args[0].equals("-h") || args[0].equals("--help")) {
            printUsage(System.out, simpleNameToClass.values());
            return null;
        }
        final Class<? extends CommandLineProgram> clazz = simpleNameToClass.get(args[0]);
        if (clazz == null) {
            printUsage(System.err, simpleNameToClass.values());
            throw new UserException(getSuggestedAlternateCommand(simpleNameToClass.keySet(), args[0]));
        }
        try {
            return clazz.getDeclaredConstructor().newInstance();
        } catch (final InstantiationException | IllegalAccessException | NoSuchMethodException | InvocationTargetException e) {
            throw new PharmaGuardException("could not instantiate " + clazz.getName(), e);
        }
    }

    public static CommandLineProgramProperties getProgramProperty(final Class<?> clazz) {
        return clazz.getAnnotation(CommandLineProgramProperties.class);
    }

    private static void printUsage(final PrintStream destinationStream, final Iterable<Class<? extends CommandLineProgram>> classes) {
        final StringBuilder builder = new StringBuilder();
        builder.append("USAGE: " + COMMAND_LINE_NAME + " <program name> [-h]\n\n")
                .append("Available Programs:\n");

        final Map<String, CommandLineProgramGroup> groupsByName = new TreeMap<>();
        final Map<String, List<Class<?>>> programsByGroup = new TreeMap<>();
        for (final Class<?> clazz : classes) {
            final CommandLineProgramProperties property = getProgramProperty(clazz);
            if (property.omitFromCommandLine()) {
                continue;
            }
            final CommandLineProgramGroup group;
            try {
                group = property.programGroup().getDeclaredConstructor().newInstance();
            } catch (final InstantiationException | IllegalAccessException | NoSuchMethodException | InvocationTargetException e) {
                throw new PharmaGuardException("could not instantiate " + property.programGroup().getName(), e);
            }
            groupsByName.putIfAbsent(group.getName(), group);
            programsByGroup.computeIfAbsent(group.getName(), k -> new ArrayList<>()).add(clazz);
        }

        for (final Map.Entry<String, List<Class<?>>> entry : programsByGroup.entrySet()) {
            final CommandLineProgramGroup programGroup = groupsByName.get(entry.getKey());
            builder.append("--------------------------------------------------------------------------------------\n");
            builder.append(String.format("%-48s %-45s\n", programGroup.getName() + ":", programGroup.getDescription()));
            entry.getValue().sort(Comparator.comparing(Class::getSimpleName));
            for (final Class<?> clazz : entry.getValue()) {
                builder.append(String.format("    %-45s%s\n", clazz.getSimpleName(), getProgramProperty(clazz).oneLineSummary()));
            }
            builder.append("\n");
        }
        builder.append("--------------------------------------------------------------------------------------\n");
        destinationStream.println(builder);
    }

    /**
     * similarity floor for matching in getSuggestedAlternateCommand *
     */
    private static final int HELP_SIMILARITY_FLOOR = 7;
    private static final int MINIMUM_SUBSTRING_LENGTH = 5;

    /**
     * When a command does not match any known command, searches for similar commands, using the same method as GIT *
     * @return returns an error message including the closest match if relevant.
     */
    public static String getSuggestedAlternateCommand(final Iterable<String> toolNames, final String command) {
        final Map<String, Integer> distances = new LinkedHashMap<>();

        int bestDistance = Integer.MAX_VALUE;
        int bestN = 0;
        for (final String name : toolNames) {
            if (name.equals(command)) {
                throw new PharmaGuardException.ShouldNeverReachHereException("Command matches: " + command);
            }
            final int distance;
            if (name.startsWith(command) || (MINIMUM_SUBSTRING_LENGTH <= command.length() && name.contains(command))) {
                distance = 0;
            } else {
                distance = StringUtil.levenshteinDistance(command, name, 0, 2, 1, 4);
            }
            distances.put(name, distance);

            if (distance < bestDistance) {
                bestDistance = distance;
                bestN = 1;
            } else if (distance == bestDistance) {
                bestN++;
            }
        }

        // Upper bound on the similarity score
        if (0 == bestDistance && bestN == distances.size()) {
            bestDistance = HELP_SIMILARITY_FLOOR + 1;
        }

        final StringBuilder message = new StringBuilder();
        message.append(String.format("'%s' is not a valid command.", command));
        message.append(System.lineSeparator());
        if (bestDistance < HELP_SIMILARITY_FLOOR) {
            message.append(String.format("Did you mean %s?", (bestN < 2) ? "this" : "one of these"));
            message.append(System.lineSeparator());
            for (final Map.Entry<String, Integer> entry : distances.entrySet()) {
                if (bestDistance == entry.getValue()) {
                    message.append(String.format("        %s", entry.getKey()));
                }
            }
        }
        return message.toString();
    }
}
