package org.pharmaguard.exceptions;

/**
 * <p/>
 * Class PharmaGuardException.
 * <p/>
 * This exception is for errors that are beyond the user's control, such as internal pre/post condition failures
 * and "this should never happen" kinds of scenarios.
 */
public class PharmaGuardException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public PharmaGuardException( String msg ) {
        super(msg);
    }

    public PharmaGuardException( String message, Throwable throwable ) {
        super(message, throwable);
    }

    /*
      Subtypes of PharmaGuardException for common kinds of errors
     */

    /**
     * <p/>
     * For wrapping errors that are believed to never be reachable
     */
    public static class ShouldNeverReachHereException extends PharmaGuardException {
        private static final long serialVersionUID = 0L;
        public ShouldNeverReachHereException( final String s ) {
            super(s);
        }
        public ShouldNeverReachHereException( final String s, final Throwable throwable ) {
            super(s, throwable);
        }
        public ShouldNeverReachHereException( final Throwable throwable) {this("Should never reach here.", throwable);}
    }

    /**
     * Thrown when a pipeline stage produces a value that violates one of its output bounds,
     * e.g. a confidence component outside [0,1].
     */
    public static class PipelineInvariantViolation extends PharmaGuardException {
        private static final long serialVersionUID = 0L;

        public PipelineInvariantViolation( final String stage, final String message ) {
            super(String.format("Stage %s produced an invalid value: %s", stage, message));
        }
    }
}
