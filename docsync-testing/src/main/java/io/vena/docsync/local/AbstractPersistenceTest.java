package io.vena.docsync.local;

import io.vena.docsync.DocSyncSettings;
import io.vena.docsync.auth.User;
import io.vena.docsync.bundle.BundleMetadata;
import io.vena.docsync.bundle.BundledQuery;
import io.vena.docsync.bundle.NamedQuery;
import io.vena.docsync.core.FieldFilter;
import io.vena.docsync.core.OrderBy;
import io.vena.docsync.core.Query;
import io.vena.docsync.core.Target;
import io.vena.docsync.exceptions.TransientPersistenceException;
import io.vena.docsync.local.IndexManager.IndexType;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.FieldIndex;
import io.vena.docsync.model.FieldIndex.Segment;
import io.vena.docsync.model.FieldPath;
import io.vena.docsync.model.IndexOffset;
import io.vena.docsync.model.MutableDocument;
import io.vena.docsync.model.ResourcePath;
import io.vena.docsync.model.SnapshotVersion;
import io.vena.docsync.model.mutation.DeleteMutation;
import io.vena.docsync.model.mutation.Mutation;
import io.vena.docsync.model.mutation.MutationBatch;
import io.vena.docsync.model.mutation.Overlay;
import io.vena.docsync.model.mutation.Precondition;
import io.vena.docsync.model.mutation.SetMutation;
import io.vena.docsync.model.value.Values;
import io.vena.docsync.remote.RemoteEvent;
import io.vena.docsync.remote.TargetChange;
import io.vena.docsync.util.ByteString;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.docsync.core.FieldFilter.Operator.EQUAL;
import static io.vena.docsync.local.TransactionMode.READ_ONLY;
import static io.vena.docsync.local.TransactionMode.READ_WRITE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests the contract of the stores of a {@link Persistence}, which every implementation must honour.
 *
 * <p>
 * Use this by extending it and supplying a value for the {@link #persistenceFactory} to test.
 */
public abstract class AbstractPersistenceTest {
	// Subclass can initialize this as desired
	protected Function<DocSyncSettings, Persistence> persistenceFactory;

	protected final User alice = new User("alice");
	protected final User bob = new User("bob");
	protected Persistence persistence;

	@BeforeEach
	void logStart(TestInfo testInfo) {
		logTest("/=== Start", testInfo);
	}

	@AfterEach
	void logDone(TestInfo testInfo) {
		if (persistence != null && persistence.isStarted()) {
			persistence.shutdown();
		}
		logTest("\\=== Done", testInfo);
	}

	private static void logTest(String verb, TestInfo testInfo) {
		String method =
			testInfo.getTestClass().map(Class::getSimpleName).orElse(null)
				+ "."
				+ testInfo.getTestMethod().map(Method::getName).orElse(null);
		LOGGER.info("{} {} {}", verb, method, testInfo.getDisplayName());
	}

	protected Persistence startPersistence() {
		persistence = persistenceFactory.apply(DocSyncSettings.builder().build());
		persistence.start();
		persistence.getRemoteDocumentCache().setIndexManager(persistence.getIndexManager(alice));
		return persistence;
	}

	// Remote documents

	@Test
	void remoteDocuments_addGetRemove() {
		startPersistence();
		RemoteDocumentCache cache = persistence.getRemoteDocumentCache();
		MutableDocument room = doc("rooms/eros", 10, Map.of("name", "Eros"));
		write(() -> cache.add(room, version(10)));

		MutableDocument read = read(() -> cache.get(key("rooms/eros")));
		assertEquals(room, read);
		assertEquals(version(10), read.readTime());

		write(() -> cache.removeAll(List.of(key("rooms/eros"))));
		assertFalse(read(() -> cache.get(key("rooms/eros"))).isValidDocument(), "Removed document is invalid");
	}

	@Test
	void remoteDocuments_keepsDeletedDocuments() {
		startPersistence();
		RemoteDocumentCache cache = persistence.getRemoteDocumentCache();
		write(() -> cache.add(MutableDocument.newNoDocument(key("rooms/gone"), version(5)), version(5)));
		MutableDocument read = read(() -> cache.get(key("rooms/gone")));
		assertTrue(read.isNoDocument());
		assertEquals(version(5), read.version());
	}

	@Test
	void remoteDocuments_returnsCopies() {
		startPersistence();
		RemoteDocumentCache cache = persistence.getRemoteDocumentCache();
		write(() -> cache.add(doc("rooms/eros", 10, Map.of("name", "Eros")), version(10)));
		read(() -> cache.get(key("rooms/eros"))).setData(Values.objectFromJava(Map.of("name", "Changed")));
		assertEquals(Values.objectFromJava(Map.of("name", "Eros")), read(() -> cache.get(key("rooms/eros"))).data(),
			"Modifying a returned document must not affect the cache");
	}

	@Test
	void remoteDocuments_getAllHasEntryForEveryKey() {
		startPersistence();
		RemoteDocumentCache cache = persistence.getRemoteDocumentCache();
		write(() -> cache.add(doc("rooms/a", 1, Map.of()), version(1)));
		Map<DocumentKey, MutableDocument> result = read(() -> cache.getAll(List.of(key("rooms/a"), key("rooms/b"))));
		assertEquals(2, result.size());
		assertTrue(result.get(key("rooms/a")).isFoundDocument());
		assertFalse(result.get(key("rooms/b")).isValidDocument());
	}

	@Test
	void remoteDocuments_matchingQuery() {
		startPersistence();
		RemoteDocumentCache cache = persistence.getRemoteDocumentCache();
		write(() -> {
			cache.add(doc("rooms/a", 1, Map.of("open", true)), version(1));
			cache.add(doc("rooms/b", 2, Map.of("open", false)), version(2));
			cache.add(doc("rooms/c", 3, Map.of("open", true)), version(3));
			cache.add(doc("rooms/a/messages/1", 4, Map.of("open", true)), version(4));
			cache.add(doc("roomsies/d", 5, Map.of("open", true)), version(5));
		});
		Query query = Query.atPath(ResourcePath.fromString("rooms"));

		Map<DocumentKey, MutableDocument> all = read(() -> cache.getDocumentsMatchingQuery(query, IndexOffset.NONE, Set.of()));
		assertEquals(Set.of(key("rooms/a"), key("rooms/b"), key("rooms/c")), all.keySet(), "Only immediate children of the collection");

		Map<DocumentKey, MutableDocument> recent = read(() -> cache.getDocumentsMatchingQuery(query, IndexOffset.createSuccessor(version(1), IndexOffset.INITIAL_LARGEST_BATCH_ID), Set.of()));
		assertEquals(Set.of(key("rooms/b"), key("rooms/c")), recent.keySet(), "Only documents read after the offset");
	}

	@Test
	void remoteDocuments_collectionGroupInReadTimeOrder() {
		startPersistence();
		RemoteDocumentCache cache = persistence.getRemoteDocumentCache();
		write(() -> {
			cache.add(doc("rooms/a/messages/1", 1, Map.of()), version(30));
			cache.add(doc("users/b/messages/2", 1, Map.of()), version(10));
			cache.add(doc("rooms/c/messages/3", 1, Map.of()), version(20));
			cache.add(doc("rooms/c/other/4", 1, Map.of()), version(5));
		});
		Map<DocumentKey, MutableDocument> firstTwo = read(() -> cache.getAll("messages", IndexOffset.NONE, 2));
		assertEquals(Set.of(key("users/b/messages/2"), key("rooms/c/messages/3")), firstTwo.keySet());

		Map<DocumentKey, MutableDocument> rest = read(() -> cache.getAll("messages", IndexOffset.createSuccessor(version(20), IndexOffset.INITIAL_LARGEST_BATCH_ID), 10));
		assertEquals(Set.of(key("rooms/a/messages/1")), rest.keySet());
	}

	@Test
	void remoteDocuments_rejectsVersionZero() {
		startPersistence();
		RemoteDocumentCache cache = persistence.getRemoteDocumentCache();
		assertThrows(IllegalArgumentException.class, () ->
			write(() -> cache.add(doc("rooms/a", 1, Map.of()), SnapshotVersion.NONE)));
	}

	// Mutation queue

	@Test
	void mutationQueue_assignsIncreasingBatchIds() {
		startPersistence();
		MutationQueue queue = startQueue(alice);
		MutationBatch first = write(() -> queue.addMutationBatch(Instant.EPOCH, List.of(), List.of(set("rooms/a"))));
		MutationBatch second = write(() -> queue.addMutationBatch(Instant.EPOCH, List.of(), List.of(set("rooms/b"))));
		assertTrue(second.batchId() > first.batchId());
		assertEquals(second.batchId(), read(queue::getHighestUnacknowledgedBatchId));
		assertEquals(List.of(first, second), read(queue::getAllMutationBatches));
	}

	@Test
	void mutationQueue_lookups() {
		startPersistence();
		MutationQueue queue = startQueue(alice);
		MutationBatch first = write(() -> queue.addMutationBatch(Instant.EPOCH, List.of(), List.of(set("rooms/a"))));
		MutationBatch second = write(() -> queue.addMutationBatch(Instant.EPOCH, List.of(), List.of(set("rooms/b"), set("rooms/a"))));
		MutationBatch third = write(() -> queue.addMutationBatch(Instant.EPOCH, List.of(), List.of(set("users/x"))));

		assertEquals(second, read(() -> queue.lookupMutationBatch(second.batchId())));
		assertNull(read(() -> queue.lookupMutationBatch(third.batchId() + 1)));
		assertEquals(second, read(() -> queue.getNextMutationBatchAfterBatchId(first.batchId())));
		assertEquals(first, read(() -> queue.getNextMutationBatchAfterBatchId(MutationBatch.UNKNOWN)));
		assertNull(read(() -> queue.getNextMutationBatchAfterBatchId(third.batchId())));

		assertEquals(List.of(first, second), read(() -> queue.getAllMutationBatchesAffectingDocumentKey(key("rooms/a"))));
		assertEquals(List.of(second, third), read(() -> queue.getAllMutationBatchesAffectingDocumentKeys(List.of(key("rooms/b"), key("users/x")))));
		assertEquals(List.of(first, second), read(() -> queue.getAllMutationBatchesAffectingQuery(Query.atPath(ResourcePath.fromString("rooms")))));
		assertTrue(read(() -> queue.containsKey(key("users/x"))));
		assertTrue(read(() -> persistence.mutationQueuesContainKey(key("users/x"))));
	}

	@Test
	void mutationQueue_acknowledgeAndRemoveInOrder() {
		startPersistence();
		MutationQueue queue = startQueue(alice);
		MutationBatch first = write(() -> queue.addMutationBatch(Instant.EPOCH, List.of(), List.of(set("rooms/a"))));
		MutationBatch second = write(() -> queue.addMutationBatch(Instant.EPOCH, List.of(), List.of(set("rooms/b"))));

		assertThrows(IllegalStateException.class, () -> write(() -> queue.acknowledgeBatch(second, ByteString.copyFromUtf8("token"))),
			"Only the first batch can be acknowledged");
		assertThrows(IllegalStateException.class, () -> write(() -> queue.removeMutationBatch(second)),
			"Only the first batch can be removed");

		write(() -> {
			queue.acknowledgeBatch(first, ByteString.copyFromUtf8("token-1"));
			queue.removeMutationBatch(first);
		});
		assertEquals(ByteString.copyFromUtf8("token-1"), read(queue::getLastStreamToken));
		assertEquals(List.of(second), read(queue::getAllMutationBatches));
		assertFalse(read(() -> queue.containsKey(key("rooms/a"))));

		write(() -> queue.removeMutationBatch(second));
		assertTrue(read(queue::isEmpty));
		assertEquals(MutationBatch.UNKNOWN, (int) read(queue::getHighestUnacknowledgedBatchId));
		write(queue::performConsistencyCheck);
	}

	@Test
	void mutationQueue_separatePerUser() {
		startPersistence();
		MutationQueue aliceQueue = startQueue(alice);
		MutationQueue bobQueue = startQueue(bob);
		write(() -> aliceQueue.addMutationBatch(Instant.EPOCH, List.of(), List.of(set("rooms/a"))));
		assertTrue(read(bobQueue::isEmpty));
		assertFalse(read(aliceQueue::isEmpty));
		assertTrue(read(() -> persistence.mutationQueuesContainKey(key("rooms/a"))), "Any user's queue counts");
	}

	@Test
	void mutationQueue_streamToken() {
		startPersistence();
		MutationQueue queue = startQueue(alice);
		assertEquals(ByteString.EMPTY, read(queue::getLastStreamToken));
		write(() -> queue.setLastStreamToken(ByteString.copyFromUtf8("abc")));
		assertEquals(ByteString.copyFromUtf8("abc"), read(queue::getLastStreamToken));
	}

	// Targets

	@Test
	void targetCache_addUpdateRemove() {
		startPersistence();
		TargetCache cache = persistence.getTargetCache();
		TargetData targetData = targetData("rooms", 2);
		write(() -> cache.addTargetData(targetData));
		assertEquals(targetData, read(() -> cache.getTargetData(targetData.target())));
		assertEquals(1, (long) read(cache::getTargetCount));
		assertEquals(2, (int) read(cache::getHighestTargetId));
		assertThrows(IllegalStateException.class, () -> write(() -> cache.addTargetData(targetData)));

		TargetData updated = targetData.withResumeToken(ByteString.copyFromUtf8("resume"), version(7));
		write(() -> cache.updateTargetData(updated));
		assertEquals(updated, read(() -> cache.getTargetData(targetData.target())));

		List<TargetData> all = new ArrayList<>();
		read(() -> {
			cache.forEachTarget(all::add);
			return null;
		});
		assertEquals(List.of(updated), all);

		write(() -> cache.removeTargetData(updated));
		assertNull(read(() -> cache.getTargetData(targetData.target())));
		assertEquals(2, (int) read(cache::getHighestTargetId), "Highest target id survives removal");
	}

	@Test
	void targetCache_matchingKeys() {
		startPersistence();
		TargetCache cache = persistence.getTargetCache();
		TargetData rooms = targetData("rooms", 2);
		TargetData users = targetData("users", 4);
		write(() -> {
			cache.addTargetData(rooms);
			cache.addTargetData(users);
			cache.addMatchingKeys(Set.of(key("rooms/a"), key("rooms/b")), 2);
			cache.addMatchingKeys(Set.of(key("users/x")), 4);
		});
		assertEquals(new TreeSet<>(Set.of(key("rooms/a"), key("rooms/b"))), read(() -> cache.getMatchingKeysForTargetId(2)));
		assertTrue(read(() -> cache.containsKey(key("users/x"))));

		write(() -> cache.removeMatchingKeys(Set.of(key("rooms/a")), 2));
		assertEquals(new TreeSet<>(Set.of(key("rooms/b"))), read(() -> cache.getMatchingKeysForTargetId(2)));
		assertFalse(read(() -> cache.containsKey(key("rooms/a"))));

		write(() -> cache.removeTargetData(users));
		assertFalse(read(() -> cache.containsKey(key("users/x"))), "Removing a target removes its keys");
	}

	@Test
	void targetCache_lastRemoteSnapshotVersion() {
		startPersistence();
		TargetCache cache = persistence.getTargetCache();
		assertEquals(SnapshotVersion.NONE, read(cache::getLastRemoteSnapshotVersion));
		write(() -> cache.setLastRemoteSnapshotVersion(version(42)));
		assertEquals(version(42), read(cache::getLastRemoteSnapshotVersion));
	}

	// Overlays

	@Test
	void overlays_saveAndRemoveByBatch() {
		startPersistence();
		DocumentOverlayCache cache = persistence.getDocumentOverlayCache(alice);
		Mutation setA = set("rooms/a");
		Mutation setB = set("rooms/b");
		Mutation deleteC = new DeleteMutation(key("rooms/c"), Precondition.NONE);
		write(() -> {
			cache.saveOverlays(1, Map.of(key("rooms/a"), setA, key("rooms/b"), setB));
			cache.saveOverlays(2, Map.of(key("rooms/c"), deleteC));
		});
		assertEquals(new Overlay(1, setA), read(() -> cache.getOverlay(key("rooms/a"))));
		assertEquals(Set.of(key("rooms/a"), key("rooms/c")),
			read(() -> cache.getOverlays(new TreeSet<>(Set.of(key("rooms/a"), key("rooms/c"), key("rooms/z"))))).keySet());

		write(() -> cache.removeOverlaysForBatchId(1));
		assertNull(read(() -> cache.getOverlay(key("rooms/a"))));
		assertNull(read(() -> cache.getOverlay(key("rooms/b"))));
		assertEquals(new Overlay(2, deleteC), read(() -> cache.getOverlay(key("rooms/c"))));
	}

	@Test
	void overlays_replacedByLaterBatch() {
		startPersistence();
		DocumentOverlayCache cache = persistence.getDocumentOverlayCache(alice);
		Mutation later = new DeleteMutation(key("rooms/a"), Precondition.NONE);
		write(() -> {
			cache.saveOverlays(1, Map.of(key("rooms/a"), set("rooms/a")));
			cache.saveOverlays(3, Map.of(key("rooms/a"), later));
		});
		assertEquals(new Overlay(3, later), read(() -> cache.getOverlay(key("rooms/a"))));
		write(() -> cache.removeOverlaysForBatchId(1));
		assertEquals(new Overlay(3, later), read(() -> cache.getOverlay(key("rooms/a"))), "The old batch no longer owns the overlay");
	}

	@Test
	void overlays_byCollectionSinceBatch() {
		startPersistence();
		DocumentOverlayCache cache = persistence.getDocumentOverlayCache(alice);
		write(() -> {
			cache.saveOverlays(1, Map.of(key("rooms/a"), set("rooms/a")));
			cache.saveOverlays(2, Map.of(key("rooms/b"), set("rooms/b"), key("rooms/b/messages/1"), set("rooms/b/messages/1")));
			cache.saveOverlays(3, Map.of(key("users/x/messages/2"), set("users/x/messages/2")));
		});
		assertEquals(Set.of(key("rooms/b")), read(() -> cache.getOverlays(ResourcePath.fromString("rooms"), 1)).keySet());
		assertEquals(Set.of(key("rooms/a"), key("rooms/b")), read(() -> cache.getOverlays(ResourcePath.fromString("rooms"), -1)).keySet());
		assertEquals(Set.of(key("rooms/b/messages/1"), key("users/x/messages/2")), read(() -> cache.getOverlays("messages", 0, 10)).keySet());
		assertEquals(Set.of(key("rooms/b/messages/1")), read(() -> cache.getOverlays("messages", 0, 1)).keySet(), "Stops after the first whole batch");
	}

	@Test
	void overlays_separatePerUser() {
		startPersistence();
		write(() -> persistence.getDocumentOverlayCache(alice).saveOverlays(1, Map.of(key("rooms/a"), set("rooms/a"))));
		assertNull(read(() -> persistence.getDocumentOverlayCache(bob).getOverlay(key("rooms/a"))));
	}

	// Bundles

	@Test
	void bundles_metadataAndNamedQueries() {
		startPersistence();
		BundleCache cache = persistence.getBundleCache();
		BundleMetadata metadata = new BundleMetadata("bundle-1", 1, version(100), 3, 1234);
		NamedQuery namedQuery = new NamedQuery("open-rooms",
			new BundledQuery(Query.atPath(ResourcePath.fromString("rooms")).toTarget(), Query.LimitType.LIMIT_TO_FIRST),
			version(100));
		assertNull(read(() -> cache.getBundleMetadata("bundle-1")));
		write(() -> {
			cache.saveBundleMetadata(metadata);
			cache.saveNamedQuery(namedQuery);
		});
		assertEquals(metadata, read(() -> cache.getBundleMetadata("bundle-1")));
		assertEquals(namedQuery, read(() -> cache.getNamedQuery("open-rooms")));
		assertNull(read(() -> cache.getNamedQuery("closed-rooms")));
	}

	// Transactions

	@Test
	void transactions_cannotNest() {
		startPersistence();
		assertThrows(IllegalStateException.class, () ->
			persistence.runTransaction("outer", READ_WRITE, () ->
				persistence.runTransaction("inner", READ_ONLY, () -> { })));
		assertNotNull(read(() -> "still usable"));
	}

	@Test
	void transactions_returnValue() {
		startPersistence();
		assertEquals(123, (int) persistence.runTransaction("value", READ_ONLY, () -> 123));
	}

	// Indexes

	@Test
	void indexManager_entriesServeMatchingTargets() {
		startPersistence();
		IndexManager indexManager = persistence.getIndexManager(alice);
		write(() -> {
			indexManager.addFieldIndex(FieldIndex.create("rooms", List.of(Segment.ascending("open"))));
			indexManager.addFieldIndex(FieldIndex.create("people", List.of(Segment.descending("age"))));
		});
		List<FieldIndex> roomIndexes = List.copyOf(read(() -> indexManager.getFieldIndexes("rooms")));
		assertEquals(1, roomIndexes.size());
		FieldIndex roomIndex = roomIndexes.get(0);
		assertNotEquals(FieldIndex.UNKNOWN_ID, roomIndex.indexId());
		assertEquals(FieldIndex.INITIAL_STATE, roomIndex.indexState());
		assertEquals(2, read(() -> indexManager.getFieldIndexes()).size());

		Target openRooms = roomsQuery().filter(FieldFilter.create(FieldPath.fromDotSeparatedString("open"), EQUAL, Values.fromJava(true))).toTarget();
		Target openRoomsByName = roomsQuery()
			.filter(FieldFilter.create(FieldPath.fromDotSeparatedString("open"), EQUAL, Values.fromJava(true)))
			.orderBy(OrderBy.ascending(FieldPath.fromDotSeparatedString("name")))
			.toTarget();
		Target roomsByName = roomsQuery().orderBy(OrderBy.ascending(FieldPath.fromDotSeparatedString("name"))).toTarget();
		assertEquals(IndexType.FULL, read(() -> indexManager.getIndexType(openRooms)));
		assertEquals(IndexType.PARTIAL, read(() -> indexManager.getIndexType(openRoomsByName)));
		assertEquals(IndexType.NONE, read(() -> indexManager.getIndexType(roomsByName)));
		assertNull(read(() -> indexManager.getDocumentsMatchingTarget(roomsByName)));

		write(() -> indexManager.updateIndexEntries(Map.of(
			key("rooms/a"), doc("rooms/a", 1, Map.of("open", true)),
			key("rooms/b"), doc("rooms/b", 1, Map.of("open", false)),
			key("rooms/c"), doc("rooms/c", 1, Map.of("name", "No open field")),
			key("rooms/d"), doc("rooms/d", 1, Map.of("open", true)))));
		assertEquals(List.of(key("rooms/a"), key("rooms/d")), read(() -> indexManager.getDocumentsMatchingTarget(openRooms)));

		write(() -> indexManager.updateIndexEntries(Map.of(key("rooms/a"), doc("rooms/a", 2, Map.of("open", false)))));
		assertEquals(List.of(key("rooms/d")), read(() -> indexManager.getDocumentsMatchingTarget(openRooms)));

		write(() -> indexManager.updateIndexEntries(Map.of(key("rooms/d"), MutableDocument.newNoDocument(key("rooms/d"), version(3)))));
		assertEquals(List.of(), read(() -> indexManager.getDocumentsMatchingTarget(openRooms)),
			"A deleted document has no entries");

		write(() -> indexManager.deleteFieldIndex(roomIndex));
		assertEquals(List.of(), List.copyOf(read(() -> indexManager.getFieldIndexes("rooms"))));
		assertEquals(IndexType.NONE, read(() -> indexManager.getIndexType(openRooms)));
		assertNull(read(() -> indexManager.getDocumentsMatchingTarget(openRooms)));
	}

	@Test
	void indexManager_backfillOffsets() {
		startPersistence();
		IndexManager indexManager = persistence.getIndexManager(alice);
		assertNull(read(indexManager::getNextCollectionGroupToUpdate), "No indexes to update");
		write(() -> {
			indexManager.addFieldIndex(FieldIndex.create("rooms", List.of(Segment.ascending("open"))));
			indexManager.addFieldIndex(FieldIndex.create("people", List.of(Segment.descending("age"))));
		});
		assertEquals(IndexOffset.NONE, read(() -> indexManager.getMinOffset("rooms")));
		assertEquals(IndexOffset.NONE, read(() -> indexManager.getMinOffset("nothing-indexed")));

		IndexOffset roomsOffset = new IndexOffset(version(5), key("rooms/b"), 3);
		write(() -> indexManager.updateCollectionGroup("rooms", roomsOffset));
		assertEquals(roomsOffset, read(() -> indexManager.getMinOffset("rooms")));
		Target openRooms = roomsQuery().filter(FieldFilter.create(FieldPath.fromDotSeparatedString("open"), EQUAL, Values.fromJava(true))).toTarget();
		assertEquals(roomsOffset, read(() -> indexManager.getMinOffset(openRooms)));
		assertEquals("people", read(indexManager::getNextCollectionGroupToUpdate), "Least recently updated goes next");

		write(() -> indexManager.updateCollectionGroup("people", IndexOffset.create(version(6), 4)));
		assertEquals("rooms", read(indexManager::getNextCollectionGroupToUpdate));
	}

	// Local store

	@Test
	void localStore_retriedRemoteEventPersistsResumeToken() {
		startPersistence();
		AtomicInteger failuresLeft = new AtomicInteger(1);
		TargetCache flakyTargetCache = failingFirstCalls(TargetCache.class, persistence.getTargetCache(), "updateTargetData", failuresLeft);
		Persistence flakyPersistence = new ForwardingPersistence(persistence) {
			@Override
			public TargetCache getTargetCache() {
				return flakyTargetCache;
			}
		};
		LocalStore localStore = new LocalStore(flakyPersistence, new QueryEngine(), alice, DocSyncSettings.builder().build());
		localStore.start();
		Target rooms = roomsQuery().toTarget();
		int targetId = localStore.allocateTarget(rooms).targetId();

		ByteString token = ByteString.copyFromUtf8("token-10");
		localStore.applyRemoteEvent(new RemoteEvent(version(10),
			Map.of(targetId, TargetChange.createSynthesizedTargetChangeForCurrentChange(true, token)),
			Map.of(), Map.of(), Set.of()));

		assertEquals(0, failuresLeft.get(), "First attempt should have failed");
		TargetData persisted = read(() -> persistence.getTargetCache().getTargetData(rooms));
		assertEquals(token, persisted.resumeToken());
		assertEquals(version(10), persisted.snapshotVersion());
		assertEquals(token, localStore.getTargetData(rooms).resumeToken());
	}

	// Helpers

	protected MutationQueue startQueue(User user) {
		MutationQueue queue = persistence.getMutationQueue(user, persistence.getIndexManager(user));
		write(queue::start);
		return queue;
	}

	protected <T> T read(Supplier<T> action) {
		return persistence.runTransaction("test read", READ_ONLY, action);
	}

	protected <T> T write(Supplier<T> action) {
		return persistence.runTransaction("test write", READ_WRITE, action);
	}

	protected void write(Runnable action) {
		persistence.runTransaction("test write", READ_WRITE, action);
	}

	/**
	 * @return a proxy for <code>downstream</code> whose method <code>methodName</code> throws
	 * {@link TransientPersistenceException} while <code>failuresLeft</code> is positive, counting it down.
	 */
	@SuppressWarnings("unchecked")
	protected static <T> T failingFirstCalls(Class<T> type, T downstream, String methodName, AtomicInteger failuresLeft) {
		return (T) Proxy.newProxyInstance(type.getClassLoader(), new Class<?>[] { type }, (proxy, method, args) -> {
			if (method.getName().equals(methodName) && failuresLeft.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
				throw new TransientPersistenceException("Simulated failure in " + methodName);
			}
			try {
				return method.invoke(downstream, args);
			} catch (InvocationTargetException e) {
				throw e.getCause();
			}
		});
	}

	protected static Query roomsQuery() {
		return Query.atPath(ResourcePath.fromString("rooms"));
	}

	protected static DocumentKey key(String path) {
		return DocumentKey.fromPathString(path);
	}

	protected static SnapshotVersion version(long micros) {
		return SnapshotVersion.ofMicros(micros);
	}

	protected static MutableDocument doc(String path, long version, Map<String, ?> fields) {
		return MutableDocument.newFoundDocument(key(path), version(version), Values.objectFromJava(fields));
	}

	protected static SetMutation set(String path) {
		return new SetMutation(key(path), Values.objectFromJava(Map.of("path", path)), Precondition.NONE);
	}

	protected static TargetData targetData(String path, int targetId) {
		return new TargetData(Query.atPath(ResourcePath.fromString(path)).toTarget(), targetId, 0, QueryPurpose.LISTEN);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(AbstractPersistenceTest.class);
}
