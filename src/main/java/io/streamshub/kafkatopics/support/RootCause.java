package io.streamshub.kafkatopics.support;

/**
 * Utility to find the root cause of a throwable
 */
public final class RootCause {

    private RootCause() {
    }

    /**
     * Walk the cause chain of a throwable.
     *
     * @param thrown the Throwable, possibly null
     * @return the innermost cause of {@code thrown}, or {@code null} when
     *         thrown is {@code null}
     */
    public static Throwable of(Throwable thrown) {
        if (thrown == null) {
            return null;
        }

        Throwable rootCause = thrown;

        while (rootCause.getCause() != null && rootCause.getCause() != rootCause) {
            rootCause = rootCause.getCause();
        }

        return rootCause;
    }

    /**
     * Describe a failure by its root cause, for single line error output.
     *
     * @param thrown the Throwable, not null
     * @return the root cause message, or its class name when it has no message
     */
    public static String describe(Throwable thrown) {
        Throwable rootCause = of(thrown);
        String message = rootCause.getMessage();

        if (message == null || message.isBlank()) {
            return rootCause.getClass().getSimpleName();
        }

        return message;
    }
}
