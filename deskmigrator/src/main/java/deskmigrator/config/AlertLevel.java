package deskmigrator.config;

/**
 * Alert level for migration logging.
 *
 * <p>Controls the minimum severity of events written by
 * {@link deskmigrator.alert.MigrationAlertLogger}. Configured via the
 * {@code migration.alert.level} property.
 *
 * <ul>
 *   <li>{@link #DEBUG} - every event: job and component start/completion, warnings, errors</li>
 *   <li>{@link #WARNING} - warnings (cancellation, audit failures) and errors</li>
 *   <li>{@link #ERROR} - failed jobs only</li>
 * </ul>
 *
 * @see MigrationConfig#alertLevel()
 */
public enum AlertLevel {
    DEBUG,
    WARNING,
    ERROR
}
