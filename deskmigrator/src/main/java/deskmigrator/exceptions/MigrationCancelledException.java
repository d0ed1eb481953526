package deskmigrator.exceptions;

/**
 * Exception raised when a job is cancelled. Cancellation is observed at
 * component boundaries only; in-flight adapter calls are not interrupted.
 *
 * @see deskmigrator.engine.CancellationToken
 */
public class MigrationCancelledException extends MigrateException {

    public MigrationCancelledException(String jobId, String nextComponent) {
        super("Job " + jobId + " cancelled", nextComponent, null, "cancel");
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CANCELLED;
    }
}
