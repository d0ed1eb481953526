package deskmigrator.mapping;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Hands out the {@link IdentifierTranslator} a job should use, according to
 * the configured {@link TranslatorScope}.
 */
public final class TranslatorProvider {

    private static final Logger log = LoggerFactory.getLogger(TranslatorProvider.class);

    private final TranslatorScope scope;
    private final ConcurrentMap<String, IdentifierTranslator> byTarget = new ConcurrentHashMap<>();

    public TranslatorProvider(TranslatorScope scope) {
        this.scope = Objects.requireNonNull(scope, "scope");
    }

    public TranslatorScope scope() {
        return scope;
    }

    /**
     * Returns the translator for a job.
     *
     * @param jobId the job id (used for logging only)
     * @param targetInstanceId the target instance id
     * @return a new translator in {@link TranslatorScope#JOB} scope, otherwise the target's shared one
     */
    public IdentifierTranslator translatorFor(String jobId, String targetInstanceId) {
        if (scope == TranslatorScope.JOB) {
            return new IdentifierTranslator();
        }
        IdentifierTranslator translator = byTarget.computeIfAbsent(targetInstanceId, k -> new IdentifierTranslator());
        log.debug("Job {} uses shared translator for target {} ({} mappings)",
                jobId, targetInstanceId, translator.size());
        return translator;
    }

    /**
     * Clears the shared table of a target instance so the same components can be migrated again.
     * No-op in {@link TranslatorScope#JOB} scope.
     */
    public void reset(String targetInstanceId) {
        IdentifierTranslator translator = byTarget.get(targetInstanceId);
        if (translator != null) {
            log.info("Resetting identifier scope for target {} ({} mappings dropped)",
                    targetInstanceId, translator.size());
            translator.clear();
        }
    }
}
