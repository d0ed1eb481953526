package deskmigrator.exceptions;

/**
 * Exception thrown when a source fetch or a target create fails.
 *
 * <p>Adapters throw this directly; the component migrator also wraps
 * unexpected runtime failures and timeouts of adapter calls into it, adding
 * the component and, for creates, the offending record's source id.
 *
 * @see deskmigrator.adapter.SourceAdapter
 * @see deskmigrator.adapter.TargetAdapter
 */
public class AdapterException extends MigrateException {

    public AdapterException(String message) {
        super(message);
    }

    public AdapterException(String message, Throwable cause) {
        super(message, cause);
    }

    public AdapterException(String message, String component, String sourceRecordId, String stage) {
        super(message, component, sourceRecordId, stage);
    }

    public AdapterException(String message,
                            String component,
                            String sourceRecordId,
                            String stage,
                            Throwable cause) {
        super(message, component, sourceRecordId, stage, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.ADAPTER;
    }
}
