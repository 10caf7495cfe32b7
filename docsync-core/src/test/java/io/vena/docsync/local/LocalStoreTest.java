package io.vena.docsync.local;

import io.vena.docsync.DocSyncSettings;
import io.vena.docsync.auth.User;
import io.vena.docsync.core.Query;
import io.vena.docsync.local.memory.MemoryPersistence;
import io.vena.docsync.model.Document;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.MutableDocument;
import io.vena.docsync.model.SnapshotVersion;
import io.vena.docsync.model.mutation.Mutation;
import io.vena.docsync.model.mutation.MutationBatch;
import io.vena.docsync.model.mutation.MutationBatchResult;
import io.vena.docsync.model.mutation.MutationResult;
import io.vena.docsync.remote.RemoteEvent;
import io.vena.docsync.remote.TargetChange;
import io.vena.docsync.util.ByteString;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static io.vena.docsync.TestUtil.deleteMutation;
import static io.vena.docsync.TestUtil.deletedDoc;
import static io.vena.docsync.TestUtil.doc;
import static io.vena.docsync.TestUtil.key;
import static io.vena.docsync.TestUtil.map;
import static io.vena.docsync.TestUtil.mutationResult;
import static io.vena.docsync.TestUtil.patchMutation;
import static io.vena.docsync.TestUtil.query;
import static io.vena.docsync.TestUtil.setMutation;
import static io.vena.docsync.TestUtil.targetChange;
import static io.vena.docsync.TestUtil.version;
import static io.vena.docsync.TestUtil.wrapObject;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalStoreTest {
	final DocSyncSettings settings = DocSyncSettings.builder().build();
	final Query rooms = query("rooms");
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
	void localWrite_isVisibleWithPendingFlag() {
		LocalDocumentsResult result = localStore.writeLocally(List.of(setMutation("rooms/a", map("n", 1))));

		Document written = result.documents().get(key("rooms/a"));
		assertNotNull(written);
		assertEquals(wrapObject(map("n", 1)), written.data());
		assertTrue(written.hasLocalMutations());
		assertEquals(written, localStore.readDocument(key("rooms/a")));
		assertEquals(result.batchId(), localStore.getHighestUnacknowledgedBatchId());
	}

	@Test
	void acknowledgingFirstBatch_keepsLaterBatchesApplied() {
		listenAndPin(rooms, "rooms/a");
		int first = localStore.writeLocally(List.of(setMutation("rooms/a", map("n", 1)))).batchId();
		int second = localStore.writeLocally(List.of(patchMutation("rooms/a", map("n", 2)))).batchId();

		Map<DocumentKey, Document> changed = acknowledge(first, 2);
		Document afterFirst = changed.get(key("rooms/a"));
		assertEquals(wrapObject(map("n", 2)), afterFirst.data(), "The second batch is still applied");
		assertTrue(afterFirst.hasLocalMutations());
		assertEquals(second, localStore.getHighestUnacknowledgedBatchId());

		Document afterSecond = acknowledge(second, 3).get(key("rooms/a"));
		assertEquals(wrapObject(map("n", 2)), afterSecond.data());
		assertFalse(afterSecond.hasLocalMutations());
		assertTrue(afterSecond.hasCommittedMutations());
		assertEquals(version(3), afterSecond.version());
		assertEquals(MutationBatch.UNKNOWN, localStore.getHighestUnacknowledgedBatchId());
		assertNull(localStore.getNextMutationBatch(MutationBatch.UNKNOWN));
	}

	@Test
	void rejectedBatch_revertsToRemoteDocument() {
		int targetId = localStore.allocateTarget(rooms.toTarget()).targetId();
		applyRemoteDocument(targetId, 1, doc("rooms/a", 1, map("n", 1)));

		int batchId = localStore.writeLocally(List.of(patchMutation("rooms/a", map("n", 5)))).batchId();
		assertEquals(wrapObject(map("n", 5)), localStore.readDocument(key("rooms/a")).data());

		Document reverted = localStore.rejectBatch(batchId).get(key("rooms/a"));
		assertEquals(wrapObject(map("n", 1)), reverted.data());
		assertFalse(reverted.hasLocalMutations());
		assertThrows(IllegalStateException.class, () -> localStore.rejectBatch(batchId));
	}

	@Test
	void rejectingMiddleBatch_keepsOthers() {
		int targetId = localStore.allocateTarget(rooms.toTarget()).targetId();
		applyRemoteDocument(targetId, 1, doc("rooms/a", 1, map("a", 0, "b", 0, "c", 0)));

		localStore.writeLocally(List.of(patchMutation("rooms/a", map("a", 1))));
		int middle = localStore.writeLocally(List.of(patchMutation("rooms/a", map("b", 1)))).batchId();
		localStore.writeLocally(List.of(patchMutation("rooms/a", map("c", 1))));

		Document result = localStore.rejectBatch(middle).get(key("rooms/a"));
		assertEquals(wrapObject(map("a", 1, "b", 0, "c", 1)), result.data());
		assertTrue(result.hasLocalMutations());
	}

	@Test
	void remoteChangeUnderPendingWrite_keepsLocalFields() {
		int targetId = localStore.allocateTarget(rooms.toTarget()).targetId();
		applyRemoteDocument(targetId, 1, doc("rooms/a", 1, map("n", 1, "m", 1)));
		localStore.writeLocally(List.of(patchMutation("rooms/a", map("n", 5))));

		Map<DocumentKey, Document> changed = applyRemoteDocument(targetId, 2, doc("rooms/a", 2, map("n", 2, "m", 2)));

		Document local = changed.get(key("rooms/a"));
		assertEquals(wrapObject(map("n", 5, "m", 2)), local.data());
		assertTrue(local.hasLocalMutations());
	}

	@Test
	void outdatedRemoteDocument_isIgnored() {
		int targetId = localStore.allocateTarget(rooms.toTarget()).targetId();
		applyRemoteDocument(targetId, 2, doc("rooms/a", 2, map("n", 2)));

		Map<DocumentKey, Document> changed = applyRemoteDocument(targetId, 3, doc("rooms/a", 1, map("n", 1)));

		assertFalse(changed.containsKey(key("rooms/a")));
		assertEquals(wrapObject(map("n", 2)), localStore.readDocument(key("rooms/a")).data());
	}

	@Test
	void snapshotVersionGoingBackwards_throws() {
		int targetId = localStore.allocateTarget(rooms.toTarget()).targetId();
		applyRemoteDocument(targetId, 5, doc("rooms/a", 5, map()));
		assertThrows(IllegalStateException.class, () -> applyRemoteDocument(targetId, 4, doc("rooms/b", 4, map())));
	}

	@Test
	void deletionAtVersionZero_removesFromCache() {
		int targetId = localStore.allocateTarget(rooms.toTarget()).targetId();
		applyRemoteDocument(targetId, 1, doc("rooms/a", 1, map("n", 1)));

		applyRemoteDocument(targetId, 2, deletedDoc("rooms/a", 0));
		assertFalse(localStore.readDocument(key("rooms/a")).isValidDocument());
	}

	@Test
	void executeQuery_combinesRemoteAndLocalDocuments() {
		int targetId = localStore.allocateTarget(rooms.toTarget()).targetId();
		applyRemoteDocument(targetId, 1, doc("rooms/a", 1, map("n", 1)));
		localStore.writeLocally(List.of(setMutation("rooms/b", map("n", 2))));

		QueryResult result = localStore.executeQuery(rooms, true);

		assertEquals(Set.of(key("rooms/a"), key("rooms/b")), result.documents().keySet());
		assertEquals(Set.of(key("rooms/a")), result.remoteKeys());
	}

	@Test
	void localDeletion_hidesDocumentFromQueries() {
		int targetId = localStore.allocateTarget(rooms.toTarget()).targetId();
		applyRemoteDocument(targetId, 1, doc("rooms/a", 1, map("n", 1)));

		localStore.writeLocally(List.of(deleteMutation("rooms/a")));

		assertTrue(localStore.executeQuery(rooms, false).documents().isEmpty());
		Document deleted = localStore.readDocument(key("rooms/a"));
		assertTrue(deleted.isNoDocument());
		assertTrue(deleted.hasLocalMutations());
	}

	@Test
	void releasedTarget_documentsAreCollected() {
		int targetId = localStore.allocateTarget(rooms.toTarget()).targetId();
		applyRemoteDocument(targetId, 1, doc("rooms/a", 1, map("n", 1)));
		assertTrue(localStore.readDocument(key("rooms/a")).isFoundDocument());

		localStore.releaseTarget(targetId);

		assertFalse(localStore.readDocument(key("rooms/a")).isValidDocument());
		assertThrows(IllegalStateException.class, () -> localStore.releaseTarget(targetId));
	}

	@Test
	void allocatingSameTargetTwice_returnsSameId() {
		TargetData first = localStore.allocateTarget(rooms.toTarget());
		TargetData second = localStore.allocateTarget(rooms.toTarget());
		TargetData other = localStore.allocateTarget(query("users").toTarget());
		assertEquals(first.targetId(), second.targetId());
		assertTrue(other.targetId() != first.targetId());
		assertEquals(first, localStore.getTargetData(rooms.toTarget()));
	}

	@Test
	void remoteEvent_updatesResumeToken() {
		int targetId = localStore.allocateTarget(rooms.toTarget()).targetId();
		applyRemoteDocument(targetId, 7, doc("rooms/a", 7, map()));

		TargetData targetData = localStore.getTargetData(rooms.toTarget());
		assertEquals(ByteString.copyFromUtf8("resume"), targetData.resumeToken());
		assertEquals(version(7), targetData.snapshotVersion());
		assertEquals(version(7), localStore.getLastRemoteSnapshotVersion());
		assertEquals(Set.of(key("rooms/a")), localStore.getRemoteDocumentKeys(targetId));
	}

	@Test
	void targetMismatch_clearsResumeToken() {
		int targetId = localStore.allocateTarget(rooms.toTarget()).targetId();
		applyRemoteDocument(targetId, 1, doc("rooms/a", 1, map()));

		localStore.applyRemoteEvent(new RemoteEvent(version(2),
			Map.of(targetId, TargetChange.createSynthesizedTargetChangeForCurrentChange(false, ByteString.EMPTY)),
			Map.of(targetId, QueryPurpose.EXISTENCE_FILTER_MISMATCH),
			Map.of(), Set.of()));

		TargetData targetData = localStore.getTargetData(rooms.toTarget());
		assertTrue(targetData.resumeToken().isEmpty());
		assertEquals(SnapshotVersion.NONE, targetData.snapshotVersion());
	}

	@Test
	void resumeTokenPersistence() {
		TargetData none = new TargetData(rooms.toTarget(), 2, 0, QueryPurpose.LISTEN);
		TargetData first = none.withResumeToken(ByteString.copyFromUtf8("t1"), SnapshotVersion.ofMicros(1_000_000));
		TargetData soon = first.withResumeToken(ByteString.copyFromUtf8("t2"), SnapshotVersion.ofMicros(2_000_000));
		TargetData late = first.withResumeToken(ByteString.copyFromUtf8("t3"), SnapshotVersion.ofMicros(1_000_000 + 300_000_000));
		TargetChange quiet = TargetChange.createSynthesizedTargetChangeForCurrentChange(true, ByteString.copyFromUtf8("t2"));
		TargetChange busy = targetChange(true, "rooms/a");
		long maxAge = 300_000;

		assertFalse(LocalStore.shouldPersistTargetData(none, none, quiet, maxAge), "No token to persist");
		assertTrue(LocalStore.shouldPersistTargetData(none, first, quiet, maxAge), "First token");
		assertFalse(LocalStore.shouldPersistTargetData(first, soon, quiet, maxAge), "Fresh token without changes stays in memory");
		assertTrue(LocalStore.shouldPersistTargetData(first, late, quiet, maxAge), "Persisted token got too old");
		assertTrue(LocalStore.shouldPersistTargetData(first, soon, busy, maxAge), "Documents changed");
	}

	@Test
	void userChange_swapsPendingWrites() {
		localStore.writeLocally(List.of(setMutation("rooms/a", map("owner", "ada"))));

		Map<DocumentKey, Document> changed = localStore.handleUserChange(new User("bob"));
		assertTrue(changed.containsKey(key("rooms/a")), "Documents written by either user are reported");
		assertFalse(changed.get(key("rooms/a")).isFoundDocument());
		assertEquals(MutationBatch.UNKNOWN, localStore.getHighestUnacknowledgedBatchId());

		changed = localStore.handleUserChange(User.UNAUTHENTICATED);
		assertEquals(wrapObject(map("owner", "ada")), changed.get(key("rooms/a")).data());
	}

	private void listenAndPin(Query query, String... keys) {
		int targetId = localStore.allocateTarget(query.toTarget()).targetId();
		Set<DocumentKey> pinned = new TreeSet<>();
		for (String key: keys) {
			pinned.add(key(key));
		}
		localStore.notifyLocalViewChanges(List.of(new LocalViewChanges(targetId, true, pinned, Set.of())));
	}

	private Map<DocumentKey, Document> acknowledge(int batchId, long commitVersion) {
		MutationBatch batch = localStore.getNextMutationBatch(batchId - 1);
		assertNotNull(batch);
		assertEquals(batchId, batch.batchId());
		List<MutationResult> results = new ArrayList<>();
		for (Mutation ignored: batch.mutations()) {
			results.add(mutationResult(commitVersion));
		}
		return localStore.acknowledgeBatch(MutationBatchResult.create(batch, version(commitVersion), results, ByteString.EMPTY));
	}

	private Map<DocumentKey, Document> applyRemoteDocument(int targetId, long snapshotVersion, MutableDocument... documents) {
		Map<DocumentKey, MutableDocument> updates = new HashMap<>();
		TreeSet<DocumentKey> added = new TreeSet<>();
		for (MutableDocument document: documents) {
			updates.put(document.key(), document);
			if (document.isFoundDocument()) {
				added.add(document.key());
			}
		}
		TargetChange change = new TargetChange(ByteString.copyFromUtf8("resume"), true, added, new TreeSet<>(), new TreeSet<>());
		return localStore.applyRemoteEvent(new RemoteEvent(version(snapshotVersion), Map.of(targetId, change), Map.of(), updates, Set.of()));
	}
}
