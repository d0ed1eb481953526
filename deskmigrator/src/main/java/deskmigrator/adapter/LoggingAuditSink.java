package deskmigrator.adapter;

import deskmigrator.mapping.IdMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each mapping to the {@code migration.audit} logger as a key=value line.
 */
public final class LoggingAuditSink implements AuditSink {

    private static final Logger log = LoggerFactory.getLogger("migration.audit");

    @Override
    public void append(IdMapping mapping) {
        log.info("ID_MAPPING job={} target={} type={} source_id={} target_id={}",
                mapping.metadata().get(IdMapping.JOB_ID),
                mapping.metadata().get(IdMapping.TARGET_INSTANCE_ID),
                mapping.entityType(),
                mapping.sourceId(),
                mapping.targetId());
    }
}
