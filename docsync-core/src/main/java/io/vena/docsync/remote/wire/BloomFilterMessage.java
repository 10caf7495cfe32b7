package io.vena.docsync.remote.wire;

import io.vena.docsync.util.ByteString;

/**
 * A bloom filter over the full names of the documents matching a target.
 *
 * @param padding the number of unused bits at the end of the last byte of <code>bitmap</code>
 */
public record BloomFilterMessage(ByteString bitmap, int padding, int hashCount) { }
