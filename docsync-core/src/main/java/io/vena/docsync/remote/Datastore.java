package io.vena.docsync.remote;

import io.vena.docsync.DocSyncSettings;
import io.vena.docsync.auth.CredentialsProvider;
import io.vena.docsync.auth.User;
import io.vena.docsync.exceptions.DocSyncException.Code;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.MutableDocument;
import io.vena.docsync.util.AsyncQueue;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import lombok.Getter;

/**
 * Attaches credentials to calls on a {@link Connection}, and decides which errors are worth retrying.
 */
public class Datastore {
	@Getter private final Connection connection;
	@Getter private final AsyncQueue asyncQueue;
	@Getter private final DocSyncSettings settings;
	private final CredentialsProvider<User> authProvider;
	private final CredentialsProvider<String> appCheckProvider;

	public Datastore(Connection connection, AsyncQueue asyncQueue, DocSyncSettings settings, CredentialsProvider<User> authProvider, CredentialsProvider<String> appCheckProvider) {
		this.connection = connection;
		this.asyncQueue = asyncQueue;
		this.settings = settings;
		this.authProvider = authProvider;
		this.appCheckProvider = appCheckProvider;
	}

	public WatchStream createWatchStream(WatchStream.Callback listener) {
		return new WatchStream(this, listener);
	}

	public WriteStream createWriteStream(WriteStream.Callback listener) {
		return new WriteStream(this, listener);
	}

	/**
	 * Fetches both tokens concurrently. The future may complete on any thread.
	 */
	CompletableFuture<CallCredentials> fetchCredentials() {
		CompletableFuture<String> authToken = authProvider.getToken();
		CompletableFuture<String> appCheckToken = appCheckProvider.getToken();
		return authToken.thenCombine(appCheckToken, CallCredentials::new);
	}

	/**
	 * Called when the backend rejects a call as unauthenticated.
	 */
	void invalidateTokens() {
		authProvider.invalidateToken();
		appCheckProvider.invalidateToken();
	}

	/**
	 * Reads the given documents from the backend, bypassing the local cache.
	 * The future completes on the async queue.
	 */
	public CompletableFuture<List<MutableDocument>> lookup(List<DocumentKey> keys) {
		CompletableFuture<List<MutableDocument>> result = new CompletableFuture<>();
		fetchCredentials()
			.thenCompose(credentials -> connection.lookup(keys, credentials))
			.whenComplete((documents, error) -> asyncQueue.enqueueAndForget(() -> {
				if (error == null) {
					result.complete(documents);
				} else {
					if (Status.fromThrowable(error).code() == Code.UNAUTHENTICATED) {
						invalidateTokens();
					}
					result.completeExceptionally(Status.fromThrowable(error).asException());
				}
			}));
		return result;
	}

	/**
	 * @return true if retrying the same call cannot succeed
	 */
	public static boolean isPermanentError(Status status) {
		return isPermanentError(status.code());
	}

	public static boolean isPermanentError(Code code) {
		switch (code) {
			case OK:
				throw new IllegalArgumentException("Treated status OK as error");
			case CANCELLED:
			case UNKNOWN:
			case DEADLINE_EXCEEDED:
			case RESOURCE_EXHAUSTED:
			case INTERNAL:
			case UNAVAILABLE:
			case UNAUTHENTICATED:
				return false;
			case INVALID_ARGUMENT:
			case NOT_FOUND:
			case ALREADY_EXISTS:
			case PERMISSION_DENIED:
			case FAILED_PRECONDITION:
			case ABORTED:
			case OUT_OF_RANGE:
			case UNIMPLEMENTED:
			case DATA_LOSS:
				return true;
			default:
				throw new IllegalArgumentException("Unknown status code: " + code);
		}
	}

	/**
	 * Writes aborted by contention are retried, unlike other aborted calls.
	 */
	public static boolean isPermanentWriteError(Status status) {
		return isPermanentError(status) && status.code() != Code.ABORTED;
	}
}
