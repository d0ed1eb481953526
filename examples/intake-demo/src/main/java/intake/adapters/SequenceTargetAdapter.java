package intake.adapters;

import deskmigrator.adapter.MigrationRecord;
import deskmigrator.adapter.TargetAdapter;
import deskmigrator.annotations.TargetComponent;
import deskmigrator.job.InstanceRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Stand-in target instance that accepts every record and mints sequential ids
 * per target subdomain, e.g. {@code acme-us-10001}.
 */
@TargetComponent
public class SequenceTargetAdapter implements TargetAdapter {

    private static final Logger log = LoggerFactory.getLogger(SequenceTargetAdapter.class);

    private final Map<String, AtomicLong> sequences = new ConcurrentHashMap<>();

    @Override
    public String create(String component, MigrationRecord record, InstanceRef target) {
        long next = sequences.computeIfAbsent(target.subdomain(), k -> new AtomicLong(10_000)).incrementAndGet();
        String id = target.subdomain() + "-" + next;
        log.info("Created {} {} in {} (source id {})", component, id, target.name(), record.sourceId());
        return id;
    }
}
