package deskmigrator.exceptions;

/**
 * Wraps an uncategorized failure, keeping the original message.
 */
public class UnknownMigrationException extends MigrateException {

    public UnknownMigrationException(String component, Throwable cause) {
        super(describe(cause), component, null, null, cause);
    }

    private static String describe(Throwable cause) {
        if (cause == null) return "An unknown error occurred";
        String msg = cause.getMessage();
        return msg != null ? msg : cause.getClass().getName();
    }
}
