package io.vena.docsync.remote;

/**
 * The sending side of a stream opened on a {@link Connection}.
 */
public interface ConnectionStream<ReqT> {
	void send(ReqT request);

	/**
	 * Closes the stream from the client side. Idempotent;
	 * the observer is not called after this.
	 */
	void close();
}
