package io.vena.docsync.local;

import io.vena.docsync.DocSyncSettings;
import io.vena.docsync.auth.User;
import io.vena.docsync.core.Query;
import io.vena.docsync.local.IndexManager.IndexType;
import io.vena.docsync.local.memory.MemoryPersistence;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.DocumentSet;
import io.vena.docsync.model.FieldIndex;
import io.vena.docsync.model.FieldIndex.Segment;
import io.vena.docsync.model.MutableDocument;
import io.vena.docsync.remote.RemoteEvent;
import io.vena.docsync.remote.TargetChange;
import io.vena.docsync.util.ByteString;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static io.vena.docsync.TestUtil.doc;
import static io.vena.docsync.TestUtil.filter;
import static io.vena.docsync.TestUtil.key;
import static io.vena.docsync.TestUtil.map;
import static io.vena.docsync.TestUtil.orderBy;
import static io.vena.docsync.TestUtil.query;
import static io.vena.docsync.TestUtil.setMutation;
import static io.vena.docsync.TestUtil.version;
import static io.vena.docsync.core.FieldFilter.Operator.EQUAL;
import static io.vena.docsync.local.TransactionMode.READ_ONLY;
import static io.vena.docsync.local.TransactionMode.READ_WRITE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueryEngineTest {
	final DocSyncSettings settings = DocSyncSettings.builder().build();
	final Query openRooms = query("rooms").filter(filter("open", EQUAL, true));
	MemoryPersistence persistence;
	LocalStore localStore;

	@BeforeEach
	void setup() {
		persistence = new MemoryPersistence(settings);
		persistence.start();
		localStore = new LocalStore(persistence, new QueryEngine(), User.UNAUTHENTICATED, settings);
		localStore.start();
	}

	@AfterEach
	void teardown() {
		persistence.shutdown();
	}

	@Test
	void previousResults_combineWithLaterChanges() {
		int targetId = localStore.allocateTarget(openRooms.toTarget()).targetId();
		applyRemoteEvent(targetId, 1, doc("rooms/a", 1, map("open", true)));
		int allRoomsTarget = localStore.allocateTarget(query("rooms").toTarget()).targetId();
		applyRemoteEvent(allRoomsTarget, 1, doc("rooms/b", 1, map("open", false)));
		localStore.notifyLocalViewChanges(List.of(new LocalViewChanges(targetId, false, Set.of(key("rooms/a")), Set.of())));

		// Changed after the target was last consistent
		applyRemoteEvent(allRoomsTarget, 2, doc("rooms/c", 2, map("open", true)));
		localStore.writeLocally(List.of(setMutation("rooms/d", map("open", true))));

		Set<DocumentKey> expected = Set.of(key("rooms/a"), key("rooms/c"), key("rooms/d"));
		assertEquals(expected, localStore.executeQuery(openRooms, true).documents().keySet());
		assertEquals(expected, localStore.executeQuery(openRooms, false).documents().keySet());
	}

	@Test
	void documentLeavingResults_isDropped() {
		int targetId = localStore.allocateTarget(openRooms.toTarget()).targetId();
		applyRemoteEvent(targetId, 1, doc("rooms/a", 1, map("open", true)), doc("rooms/b", 1, map("open", true)));
		localStore.notifyLocalViewChanges(List.of(new LocalViewChanges(targetId, false, Set.of(key("rooms/a"), key("rooms/b")), Set.of())));

		localStore.writeLocally(List.of(setMutation("rooms/b", map("open", false))));

		assertEquals(Set.of(key("rooms/a")), localStore.executeQuery(openRooms, true).documents().keySet());
	}

	@Test
	void limitQuery_needsRefillWhenPreviousResultsChanged() {
		QueryEngine queryEngine = new QueryEngine();
		Query limited = query("rooms").orderBy(orderBy("n")).limitToFirst(2);
		MutableDocument a = doc("rooms/a", 1, map("n", 1));
		MutableDocument b = doc("rooms/b", 1, map("n", 2));
		DocumentSet both = DocumentSet.emptySet(limited.comparator()).add(a).add(b);
		DocumentSet one = DocumentSet.emptySet(limited.comparator()).add(a);

		assertFalse(queryEngine.needsRefill(limited, 2, both, version(1)));
		assertTrue(queryEngine.needsRefill(limited, 2, one, version(1)), "A document dropped out");
		assertTrue(queryEngine.needsRefill(limited, 2, both, version(0)), "The edge document changed after the results");

		DocumentSet pendingEdge = DocumentSet.emptySet(limited.comparator()).add(a)
			.add(doc("rooms/b", 1, map("n", 2)).setHasLocalMutations());
		assertTrue(queryEngine.needsRefill(limited, 2, pendingEdge, version(1)), "The edge document has a pending write");

		assertFalse(queryEngine.needsRefill(query("rooms"), 2, one, version(1)), "Only limit queries can miss documents");
	}

	@Test
	void indexedQuery_readsCandidatesFromIndex() {
		int allRooms = localStore.allocateTarget(query("rooms").toTarget()).targetId();
		applyRemoteEvent(allRooms, 1, doc("rooms/a", 1, map("open", true)), doc("rooms/b", 1, map("open", false)));
		localStore.configureFieldIndexes(List.of(FieldIndex.create("rooms", List.of(Segment.ascending("open")))));
		assertEquals(2, localStore.backfillIndexes());
		assertEquals(IndexType.FULL, persistence.runTransaction("Index type", READ_ONLY,
			() -> indexManager().getIndexType(openRooms.toTarget())));

		// Cached at the backfilled offset without an index entry, so the index hides it
		persistence.runTransaction("Add unindexed document", READ_WRITE,
			() -> persistence.getRemoteDocumentCache().add(doc("rooms/a2", 1, map("open", true)), version(1)));
		assertEquals(Set.of(key("rooms/a")), localStore.executeQuery(openRooms, false).documents().keySet());

		// Changed after the backfill
		applyRemoteEvent(allRooms, 2, doc("rooms/c", 2, map("open", true)), doc("rooms/a", 2, map("open", false)));
		assertEquals(Set.of(key("rooms/c")), localStore.executeQuery(openRooms, false).documents().keySet());
	}

	@Test
	void partialIndex_limitQueryStillFindsFirstDocument() {
		int allRooms = localStore.allocateTarget(query("rooms").toTarget()).targetId();
		applyRemoteEvent(allRooms, 1,
			doc("rooms/a", 1, map("open", true, "n", 2)),
			doc("rooms/b", 1, map("open", false, "n", 0)),
			doc("rooms/c", 1, map("open", true, "n", 1)));
		localStore.configureFieldIndexes(List.of(FieldIndex.create("rooms", List.of(Segment.ascending("open")))));
		localStore.backfillIndexes();
		Query firstOpenRoom = openRooms.orderBy(orderBy("n")).limitToFirst(1);
		assertEquals(IndexType.PARTIAL, persistence.runTransaction("Index type", READ_ONLY,
			() -> indexManager().getIndexType(firstOpenRoom.toTarget())));

		Set<DocumentKey> results = localStore.executeQuery(firstOpenRoom, false).documents().keySet();
		assertTrue(results.contains(key("rooms/c")), "The first match by n is among the candidates");
		assertFalse(results.contains(key("rooms/b")));
	}

	@Test
	void indexOnOtherField_fallsBackToCollectionScan() {
		int allRooms = localStore.allocateTarget(query("rooms").toTarget()).targetId();
		applyRemoteEvent(allRooms, 1, doc("rooms/a", 1, map("open", true, "n", 1)), doc("rooms/b", 1, map("open", false, "n", 2)));
		localStore.configureFieldIndexes(List.of(FieldIndex.create("rooms", List.of(Segment.ascending("n")))));
		localStore.backfillIndexes();
		assertEquals(IndexType.NONE, persistence.runTransaction("Index type", READ_ONLY,
			() -> indexManager().getIndexType(openRooms.toTarget())));

		assertEquals(Set.of(key("rooms/a")), localStore.executeQuery(openRooms, false).documents().keySet());
	}

	private IndexManager indexManager() {
		return persistence.getIndexManager(User.UNAUTHENTICATED);
	}

	private void applyRemoteEvent(int targetId, long snapshotVersion, MutableDocument... documents) {
		Map<DocumentKey, MutableDocument> updates = new HashMap<>();
		TreeSet<DocumentKey> added = new TreeSet<>();
		for (MutableDocument document: documents) {
			updates.put(document.key(), document);
			added.add(document.key());
		}
		TargetChange change = new TargetChange(ByteString.copyFromUtf8("token-" + snapshotVersion), true, added, new TreeSet<>(), new TreeSet<>());
		localStore.applyRemoteEvent(new RemoteEvent(version(snapshotVersion), Map.of(targetId, change), Map.of(), updates, Set.of()));
	}
}
