package io.vena.docsync.remote;

import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.MutableDocument;
import io.vena.docsync.remote.wire.ListenRequest;
import io.vena.docsync.remote.wire.ListenResponse;
import io.vena.docsync.remote.wire.WriteRequest;
import io.vena.docsync.remote.wire.WriteResponse;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * The transport to the backend: two long-lived bidirectional streams and one unary call.
 * Encoding messages for the network is up to the implementation.
 */
public interface Connection {
	ConnectionStream<ListenRequest> openListenStream(CallCredentials credentials, StreamObserver<ListenResponse> observer);

	ConnectionStream<WriteRequest> openWriteStream(CallCredentials credentials, StreamObserver<WriteResponse> observer);

	/**
	 * Reads documents directly from the backend.
	 *
	 * @return one document per key: found, or a missing document at the read time
	 */
	CompletableFuture<List<MutableDocument>> lookup(List<DocumentKey> keys, CallCredentials credentials);
}
