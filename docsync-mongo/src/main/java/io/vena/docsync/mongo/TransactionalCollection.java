package io.vena.docsync.mongo;

import com.mongodb.MongoException;
import com.mongodb.client.ClientSession;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.model.UpdateOptions;
import io.vena.docsync.exceptions.PersistenceException;
import io.vena.docsync.exceptions.TransientPersistenceException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.bson.BsonDocument;
import org.bson.BsonValue;
import org.bson.conversions.Bson;
import org.jetbrains.annotations.Nullable;

import static com.mongodb.MongoException.TRANSIENT_TRANSACTION_ERROR_LABEL;
import static com.mongodb.client.model.Filters.eq;

/**
 * A collection whose every operation runs in the {@link ClientSession} of the
 * transaction active on the calling thread.
 *
 * <p>
 * Reads return fully materialized lists, so that no cursor outlives its transaction.
 * A {@link MongoException} is translated to a {@link TransientPersistenceException}
 * when MongoDB says retrying the transaction may help, and to a {@link PersistenceException} otherwise.
 */
final class TransactionalCollection {
	private final MongoCollection<BsonDocument> downstream;
	private final Supplier<ClientSession> currentSession;

	TransactionalCollection(MongoCollection<BsonDocument> downstream, Supplier<ClientSession> currentSession) {
		this.downstream = downstream;
		this.currentSession = currentSession;
	}

	String name() {
		return downstream.getNamespace().getCollectionName();
	}

	List<BsonDocument> find(Bson filter) {
		return translated(() -> downstream.find(currentSession.get(), filter).into(new ArrayList<>()));
	}

	List<BsonDocument> find(Bson filter, Bson sort) {
		return translated(() -> downstream.find(currentSession.get(), filter).sort(sort).into(new ArrayList<>()));
	}

	@Nullable BsonDocument findFirst(Bson filter, Bson sort) {
		return translated(() -> downstream.find(currentSession.get(), filter).sort(sort).limit(1).first());
	}

	@Nullable BsonDocument findById(BsonValue id) {
		return translated(() -> downstream.find(currentSession.get(), eq("_id", id)).first());
	}

	boolean exists(Bson filter) {
		return translated(() -> downstream.find(currentSession.get(), filter).limit(1).first() != null);
	}

	long count(Bson filter) {
		return translated(() -> downstream.countDocuments(currentSession.get(), filter));
	}

	void insert(BsonDocument document) {
		translated(() -> downstream.insertOne(currentSession.get(), document));
	}

	/**
	 * Inserts or replaces the document with the same <code>_id</code>.
	 */
	void upsert(BsonDocument document) {
		translated(() -> downstream.replaceOne(currentSession.get(), eq("_id", document.get("_id")), document, new ReplaceOptions().upsert(true)));
	}

	void update(Bson filter, Bson update, boolean upsert) {
		translated(() -> downstream.updateOne(currentSession.get(), filter, update, new UpdateOptions().upsert(upsert)));
	}

	long deleteMany(Bson filter) {
		return translated(() -> downstream.deleteMany(currentSession.get(), filter).getDeletedCount());
	}

	private <T> T translated(Supplier<T> operation) {
		try {
			return operation.get();
		} catch (MongoException e) {
			throw translate(e, name());
		}
	}

	static PersistenceException translate(MongoException e, String context) {
		if (e.hasErrorLabel(TRANSIENT_TRANSACTION_ERROR_LABEL)) {
			return new TransientPersistenceException("Transient error in " + context, e);
		} else {
			return new PersistenceException("Error in " + context, e);
		}
	}
}
