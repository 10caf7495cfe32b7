package io.vena.docsync.remote;

/**
 * Receives the events of one stream opened on a {@link Connection}.
 * Methods may be called from any thread; <code>onClose</code> is called at most once, last.
 */
public interface StreamObserver<RespT> {
	void onOpen();

	void onMessage(RespT response);

	void onClose(Status status);
}
