package dev.evalkit.dataset;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Read access to dataset versions. */
public interface DatasetProvider {
    /** All items of a version in dataset order, or empty when the version does not exist. */
    Optional<List<DatasetItem>> getVersionItems(long datasetVersionId);

    Optional<DatasetItem> getItem(long itemId);

    /** Implementation for test doubling and embedded use */
    class InMemoryImpl implements DatasetProvider {
        private final Map<Long, List<DatasetItem>> versions = new ConcurrentHashMap<>();

        public InMemoryImpl putVersion(long datasetVersionId, List<DatasetItem> items) {
            versions.put(datasetVersionId, List.copyOf(items));
            return this;
        }

        @Override
        public Optional<List<DatasetItem>> getVersionItems(long datasetVersionId) {
            return Optional.ofNullable(versions.get(datasetVersionId));
        }

        @Override
        public Optional<DatasetItem> getItem(long itemId) {
            return versions.values().stream()
                    .flatMap(List::stream)
                    .filter(item -> item.id() == itemId)
                    .findFirst();
        }
    }
}
