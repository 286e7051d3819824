package org.pharmaguard.exceptions;

import java.io.File;
import java.nio.file.Path;

/**
 * <p/>
 * Class UserException.
 * <p/>
 * This exception is for errors that are due to user mistakes, such as non-existent or malformed files,
 * or a rule catalog that fails validation.
 */
public class UserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public UserException(final String msg) {
        super(msg);
    }

    public UserException(final String message, final Throwable throwable) {
        super(message, throwable);
    }

    protected static String getMessage(final Throwable t) {
        final String message = t.getMessage();
        return message != null ? message : t.getClass().getName();
    }

    /**
     * Subtypes of UserException for common kinds of errors
     */

    /**
     * <p/>
     * Class UserException.CouldNotReadInputFile
     * <p/>
     * For generic errors opening/reading from input files
     */
    public static class CouldNotReadInputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotReadInputFile(final Path file, final String message, final Throwable cause) {
            super(String.format("Couldn't read file %s. Error was: %s", file.toAbsolutePath().toUri(), message), cause);
        }

        public CouldNotReadInputFile(final Path path, final Exception e) {
            this(path, getMessage(e), e);
        }

        public CouldNotReadInputFile(final String source, final String message, final Throwable cause) {
            super(String.format("Couldn't read %s. Error was: %s", source, message), cause);
        }
    }

    public static class CouldNotCreateOutputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotCreateOutputFile(final File file, final String message, final Exception e) {
            super(String.format("Couldn't write file %s because %s with exception %s", file.getAbsolutePath(), message, getMessage(e)), e);
        }
    }

    public static class BadInput extends UserException {
        private static final long serialVersionUID = 0L;

        public BadInput(final String message) {
            super(String.format("Bad input: %s", message));
        }
    }

    public static class MalformedFile extends UserException {
        private static final long serialVersionUID = 0L;

        public MalformedFile(final String source, final String message) {
            super(String.format("File %s is malformed: %s", source, message));
        }

        public MalformedFile(final String source, final String message, final Exception e) {
            super(String.format("File %s is malformed: %s caused by %s", source, message, getMessage(e)), e);
        }
    }

    /**
     * A rule catalog that cannot be used for inference. Raised once, at load time, never per analysis.
     */
    public static class MalformedRuleCatalog extends UserException {
        private static final long serialVersionUID = 0L;

        public MalformedRuleCatalog(final String source, final String message) {
            super(String.format("Rule catalog %s is invalid: %s", source, message));
        }

        public MalformedRuleCatalog(final String source, final String message, final Throwable cause) {
            super(String.format("Rule catalog %s is invalid: %s", source, message), cause);
        }
    }
}
