package deskmigrator.adapter;

import deskmigrator.mapping.IdMapping;

/**
 * Durable, append-only record of identifier mappings.
 *
 * <p>Appends are best-effort: the engine logs a failed append and carries on.
 * Sinks shared between jobs must accept concurrent appends; the job id and
 * target instance id are available in {@link IdMapping#metadata()}.
 */
@FunctionalInterface
public interface AuditSink {

    void append(IdMapping mapping) throws Exception;
}
