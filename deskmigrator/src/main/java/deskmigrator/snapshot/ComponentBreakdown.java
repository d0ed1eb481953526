package deskmigrator.snapshot;

/**
 * Per-component metadata stored in a snapshot.
 *
 * @param recordCount number of records captured for the component
 * @param byteSize size of the stored blob in bytes
 * @param storageLocation where the blob lives, relative to the snapshot store
 */
public record ComponentBreakdown(long recordCount, long byteSize, String storageLocation) {
}
