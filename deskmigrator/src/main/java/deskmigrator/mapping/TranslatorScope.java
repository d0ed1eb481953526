package deskmigrator.mapping;

/**
 * Lifetime of an {@link IdentifierTranslator}.
 *
 * @see TranslatorProvider
 */
public enum TranslatorScope {
    /** A fresh table per job run. */
    JOB,
    /**
     * One table per target instance, shared by every job migrating into it.
     * Later jobs may reference entities created by earlier ones; re-running the
     * same components without {@link TranslatorProvider#reset(String)} fails
     * with duplicate mappings.
     */
    TARGET_INSTANCE
}
