package deskmigrator.adapter;

import deskmigrator.mapping.IdMapping;

/**
 * Default sink used when no audit trail is configured.
 */
public enum NoopAuditSink implements AuditSink {
    INSTANCE;

    @Override
    public void append(IdMapping mapping) { /* no-op */ }
}
