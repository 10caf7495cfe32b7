package io.vena.docsync.local.memory;

import io.vena.docsync.core.Target;
import io.vena.docsync.local.IndexEntry;
import io.vena.docsync.local.IndexManager;
import io.vena.docsync.local.TargetIndexMatcher;
import io.vena.docsync.model.Document;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.FieldIndex;
import io.vena.docsync.model.IndexOffset;
import io.vena.docsync.model.ResourcePath;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class MemoryIndexManager implements IndexManager {
	private final Map<String, Set<ResourcePath>> collectionParents = new HashMap<>();
	private final Map<String, Map<Integer, FieldIndex>> fieldIndexes = new TreeMap<>();
	private final Map<Integer, Map<DocumentKey, List<IndexEntry>>> entriesByIndexId = new HashMap<>();
	private int nextIndexId = 1;
	private long highestSequenceNumber = 0;

	@Override
	public void start() {
	}

	@Override
	public void addToCollectionParentIndex(ResourcePath collectionPath) {
		String collectionId = collectionPath.getLastSegment();
		ResourcePath parentPath = collectionPath.popLast();
		collectionParents.computeIfAbsent(collectionId, id -> new TreeSet<>()).add(parentPath);
	}

	@Override
	public List<ResourcePath> getCollectionParents(String collectionId) {
		Set<ResourcePath> parents = collectionParents.get(collectionId);
		return parents == null ? List.of() : new ArrayList<>(parents);
	}

	@Override
	public void addFieldIndex(FieldIndex index) {
		FieldIndex stored = index.withIndexId(nextIndexId++);
		fieldIndexes.computeIfAbsent(index.collectionGroup(), g -> new TreeMap<>()).put(stored.indexId(), stored);
		entriesByIndexId.put(stored.indexId(), new TreeMap<>());
		LOGGER.debug("Added field index {}", stored);
	}

	@Override
	public void deleteFieldIndex(FieldIndex index) {
		Map<Integer, FieldIndex> indexes = fieldIndexes.get(index.collectionGroup());
		if (indexes != null) {
			indexes.remove(index.indexId());
			if (indexes.isEmpty()) {
				fieldIndexes.remove(index.collectionGroup());
			}
		}
		entriesByIndexId.remove(index.indexId());
		LOGGER.debug("Deleted field index {}", index);
	}

	@Override
	public Collection<FieldIndex> getFieldIndexes(String collectionGroup) {
		Map<Integer, FieldIndex> indexes = fieldIndexes.get(collectionGroup);
		return indexes == null ? List.of() : new ArrayList<>(indexes.values());
	}

	@Override
	public Collection<FieldIndex> getFieldIndexes() {
		List<FieldIndex> result = new ArrayList<>();
		for (Map<Integer, FieldIndex> indexes: fieldIndexes.values()) {
			result.addAll(indexes.values());
		}
		return result;
	}

	@Override
	public @Nullable String getNextCollectionGroupToUpdate() {
		String result = null;
		long lowestSequenceNumber = Long.MAX_VALUE;
		for (Map.Entry<String, Map<Integer, FieldIndex>> entry: fieldIndexes.entrySet()) {
			for (FieldIndex index: entry.getValue().values()) {
				if (index.indexState().sequenceNumber() < lowestSequenceNumber) {
					lowestSequenceNumber = index.indexState().sequenceNumber();
					result = entry.getKey();
				}
			}
		}
		return result;
	}

	@Override
	public void updateCollectionGroup(String collectionGroup, IndexOffset offset) {
		Map<Integer, FieldIndex> indexes = fieldIndexes.get(collectionGroup);
		if (indexes == null) {
			return;
		}
		long sequenceNumber = ++highestSequenceNumber;
		indexes.replaceAll((id, index) -> index.withIndexState(new FieldIndex.IndexState(sequenceNumber, offset)));
	}

	@Override
	public void updateIndexEntries(Map<DocumentKey, ? extends Document> documents) {
		for (Map.Entry<DocumentKey, ? extends Document> entry: documents.entrySet()) {
			for (FieldIndex index: getFieldIndexes(entry.getKey().getCollectionGroup())) {
				Map<DocumentKey, List<IndexEntry>> entries = entriesByIndexId.get(index.indexId());
				List<IndexEntry> newEntries = TargetIndexMatcher.computeEntries(index, entry.getValue());
				if (newEntries.isEmpty()) {
					entries.remove(entry.getKey());
				} else {
					entries.put(entry.getKey(), newEntries);
				}
			}
		}
	}

	@Override
	public IndexType getIndexType(Target target) {
		TargetIndexMatcher matcher = new TargetIndexMatcher(target);
		FieldIndex index = matcher.selectIndex(getFieldIndexes(target.collectionGroupForIndex()));
		return index == null ? IndexType.NONE : matcher.coverage(index);
	}

	@Override
	public @Nullable List<DocumentKey> getDocumentsMatchingTarget(Target target) {
		TargetIndexMatcher matcher = new TargetIndexMatcher(target);
		FieldIndex index = matcher.selectIndex(getFieldIndexes(target.collectionGroupForIndex()));
		if (index == null) {
			return null;
		}
		Set<DocumentKey> result = new LinkedHashSet<>();
		for (List<IndexEntry> entries: entriesByIndexId.get(index.indexId()).values()) {
			for (IndexEntry entry: entries) {
				if (isInScope(target, entry.documentKey()) && matcher.entryMatches(index, entry)) {
					result.add(entry.documentKey());
					break;
				}
			}
		}
		LOGGER.trace("Index {} matched {} documents for {}", index.indexId(), result.size(), target);
		return new ArrayList<>(result);
	}

	private static boolean isInScope(Target target, DocumentKey key) {
		if (target.collectionGroup() != null) {
			return target.path().isPrefixOf(key.path());
		} else {
			return target.path().isImmediateParentOf(key.path());
		}
	}

	@Override
	public IndexOffset getMinOffset(Target target) {
		TargetIndexMatcher matcher = new TargetIndexMatcher(target);
		FieldIndex index = matcher.selectIndex(getFieldIndexes(target.collectionGroupForIndex()));
		return index == null ? IndexOffset.NONE : index.indexState().offset();
	}

	@Override
	public IndexOffset getMinOffset(String collectionGroup) {
		IndexOffset result = null;
		for (FieldIndex index: getFieldIndexes(collectionGroup)) {
			IndexOffset offset = index.indexState().offset();
			if (result == null || offset.compareTo(result) < 0) {
				result = offset;
			}
		}
		return result == null ? IndexOffset.NONE : result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(MemoryIndexManager.class);
}
