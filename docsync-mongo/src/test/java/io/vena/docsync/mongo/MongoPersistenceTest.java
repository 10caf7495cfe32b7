package io.vena.docsync.mongo;

import io.vena.docsync.DocSyncSettings;
import io.vena.docsync.auth.User;
import io.vena.docsync.local.MutationQueue;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.MutableDocument;
import io.vena.docsync.model.SnapshotVersion;
import io.vena.docsync.model.mutation.MutationBatch;
import io.vena.docsync.model.mutation.Precondition;
import io.vena.docsync.model.mutation.SetMutation;
import io.vena.docsync.model.value.Values;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

import static io.vena.docsync.local.TransactionMode.READ_ONLY;
import static io.vena.docsync.local.TransactionMode.READ_WRITE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Behaviour specific to a durable, shared cache.
 */
@UsesMongoService
@Testcontainers(disabledWithoutDocker = true)
class MongoPersistenceTest {
	private static final String DATABASE = MongoPersistenceTest.class.getSimpleName();
	private static MongoService mongoService;
	private final User alice = new User("alice");

	@BeforeAll
	static void setupMongoConnection() {
		mongoService = new MongoService();
	}

	@BeforeEach
	void dropDatabase() {
		mongoService.client().getDatabase(DATABASE).drop();
	}

	@Test
	void contentsSurviveRestart() {
		DocumentKey key = DocumentKey.fromPathString("rooms/eros");
		MutableDocument room = MutableDocument.newFoundDocument(key, SnapshotVersion.ofMicros(10), Values.objectFromJava(Map.of("name", "Eros")));

		MongoPersistence before = newPersistence();
		before.start();
		before.getRemoteDocumentCache().setIndexManager(before.getIndexManager(alice));
		MutationQueue beforeQueue = before.getMutationQueue(alice, before.getIndexManager(alice));
		before.runTransaction("start queue", READ_WRITE, beforeQueue::start);
		before.runTransaction("write", READ_WRITE, () -> before.getRemoteDocumentCache().add(room, SnapshotVersion.ofMicros(10)));
		MutationBatch batch = before.runTransaction("write", READ_WRITE, () -> beforeQueue.addMutationBatch(Instant.EPOCH, List.of(), List.of(set(key))));
		before.shutdown();

		MongoPersistence after = newPersistence();
		after.start();
		try {
			after.getRemoteDocumentCache().setIndexManager(after.getIndexManager(alice));
			MutationQueue afterQueue = after.getMutationQueue(alice, after.getIndexManager(alice));
			after.runTransaction("start queue", READ_WRITE, afterQueue::start);
			assertEquals(room, after.runTransaction("read", READ_ONLY, () -> after.getRemoteDocumentCache().get(key)));
			assertEquals(List.of(batch), after.runTransaction("read", READ_ONLY, afterQueue::getAllMutationBatches));
			assertTrue(after.runTransaction("read", READ_ONLY, () -> after.mutationQueuesContainKey(key)));

			MutationBatch next = after.runTransaction("write", READ_WRITE, () -> afterQueue.addMutationBatch(Instant.EPOCH, List.of(), List.of(set(key))));
			assertTrue(next.batchId() > batch.batchId(), "Batch ids are not reused after a restart");
		} finally {
			after.shutdown();
		}
	}

	@Test
	void storesRequireTransaction() {
		MongoPersistence persistence = newPersistence();
		persistence.start();
		try {
			assertThrows(IllegalStateException.class, () -> persistence.getRemoteDocumentCache().get(DocumentKey.fromPathString("rooms/eros")));
		} finally {
			persistence.shutdown();
		}
	}

	@Test
	void invalidSettings() {
		MongoPersistenceSettings noDatabase = MongoPersistenceSettings.builder().build();
		assertThrows(IllegalArgumentException.class, () ->
			new MongoPersistence(DocSyncSettings.builder().build(), noDatabase, mongoService.client()));
	}

	private MongoPersistence newPersistence() {
		return new MongoPersistence(DocSyncSettings.builder().build(), MongoPersistenceSettings.builder()
			.database(DATABASE)
			.build(), mongoService.client());
	}

	private static SetMutation set(DocumentKey key) {
		return new SetMutation(key, Values.objectFromJava(Map.of("name", "Eros")), Precondition.NONE);
	}
}
