package io.vena.docsync.remote;

import io.vena.docsync.model.SnapshotVersion;
import io.vena.docsync.model.mutation.Mutation;
import io.vena.docsync.model.mutation.MutationResult;
import io.vena.docsync.remote.wire.WriteRequest;
import io.vena.docsync.remote.wire.WriteResponse;
import io.vena.docsync.util.AsyncQueue.TimerId;
import io.vena.docsync.util.ByteString;
import java.util.ArrayList;
import java.util.List;

/**
 * The write stream. Each stream starts with a handshake whose response carries a stream token;
 * every later request sends back the token of the last response, acknowledging it.
 */
public class WriteStream extends AbstractStream<WriteRequest, WriteResponse, WriteStream.Callback> {
	public interface Callback extends AbstractStream.StreamCallback {
		void onHandshakeComplete();

		/**
		 * @param results one per mutation of the acknowledged batch
		 */
		void onWriteResponse(SnapshotVersion commitVersion, List<MutationResult> results);
	}

	private boolean handshakeComplete = false;
	private ByteString lastStreamToken = ByteString.EMPTY;

	WriteStream(Datastore datastore, Callback listener) {
		super(datastore, "Write", TimerId.WRITE_STREAM_CONNECTION_BACKOFF, TimerId.WRITE_STREAM_IDLE, listener);
	}

	@Override
	public void start() {
		handshakeComplete = false;
		super.start();
	}

	@Override
	protected void tearDown() {
		if (handshakeComplete) {
			// Acknowledges the last response so the backend can release it.
			writeMutations(List.of());
		}
	}

	public boolean isHandshakeComplete() {
		return handshakeComplete;
	}

	public ByteString lastStreamToken() {
		return lastStreamToken;
	}

	/**
	 * Sets the token to send with the next request; normally the token persisted with the mutation queue.
	 */
	public void setLastStreamToken(ByteString streamToken) {
		lastStreamToken = streamToken;
	}

	public void writeHandshake() {
		if (!isOpen()) {
			throw new IllegalStateException("Writing handshake on a closed stream");
		}
		if (handshakeComplete) {
			throw new IllegalStateException("Handshake already completed");
		}
		writeRequest(WriteRequest.handshake());
	}

	public void writeMutations(List<Mutation> mutations) {
		if (!isOpen()) {
			throw new IllegalStateException("Writing mutations on a closed stream");
		}
		if (!handshakeComplete) {
			throw new IllegalStateException("Handshake must be complete before writing mutations");
		}
		writeRequest(new WriteRequest(lastStreamToken, mutations));
	}

	@Override
	protected ConnectionStream<WriteRequest> startCall(CallCredentials credentials, StreamObserver<WriteResponse> observer) {
		return datastore.connection().openWriteStream(credentials, observer);
	}

	@Override
	protected void onNext(WriteResponse response) {
		lastStreamToken = response.streamToken();

		if (!handshakeComplete) {
			handshakeComplete = true;
			listener.onHandshakeComplete();
		} else {
			// A response to a write means the connection works.
			backoff.reset();

			SnapshotVersion commitVersion = response.commitTime();
			List<MutationResult> results = new ArrayList<>(response.writeResults().size());
			for (MutationResult result: response.writeResults()) {
				// Writes that changed nothing, like a verify, report no version of their own.
				if (SnapshotVersion.NONE.equals(result.version())) {
					results.add(new MutationResult(commitVersion, result.transformResults()));
				} else {
					results.add(result);
				}
			}
			listener.onWriteResponse(commitVersion, results);
		}
	}
}
