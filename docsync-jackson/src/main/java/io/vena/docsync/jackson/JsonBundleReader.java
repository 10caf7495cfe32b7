package io.vena.docsync.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.vena.docsync.bundle.BundleElement;
import io.vena.docsync.bundle.BundleMetadata;
import io.vena.docsync.bundle.BundleSource;
import io.vena.docsync.model.DatabaseId;
import java.io.BufferedInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a bundle in its byte format: a sequence of elements, each a decimal byte count
 * followed by that many bytes of UTF-8 JSON as written by {@link JsonBundleWriter}.
 *
 * <p>
 * Not thread safe.
 */
public class JsonBundleReader implements BundleSource {
	private final ObjectMapper mapper;
	private final InputStream input;
	private @Nullable BundleMetadata metadata = null;
	private long bytesRead = 0;

	public JsonBundleReader(DatabaseId databaseId, InputStream input) {
		this.mapper = new ObjectMapper().registerModule(new JacksonBundlePlugin().moduleFor(databaseId));
		this.input = new BufferedInputStream(input);
	}

	@Override
	public BundleMetadata getBundleMetadata() throws IOException {
		if (metadata == null) {
			BundleElement first = readElement();
			if (first instanceof BundleMetadata) {
				metadata = (BundleMetadata) first;
				LOGGER.debug("Reading bundle {} with {} documents", metadata.bundleId(), metadata.totalDocuments());
			} else if (first == null) {
				throw new EOFException("Bundle is empty");
			} else {
				throw new IOException("Bundle must start with its metadata, not " + first.getClass().getSimpleName());
			}
		}
		return metadata;
	}

	@Override
	public @Nullable BundleElement getNextElement() throws IOException {
		getBundleMetadata();
		BundleElement result = readElement();
		if (result instanceof BundleMetadata) {
			throw new IOException("Bundle has a second metadata element");
		}
		return result;
	}

	@Override
	public long getBytesRead() {
		return bytesRead;
	}

	@Override
	public void close() throws IOException {
		input.close();
	}

	/**
	 * @return null at the end of the input
	 */
	private @Nullable BundleElement readElement() throws IOException {
		StringBuilder prefix = new StringBuilder();
		int b;
		while ((b = input.read()) != '{') {
			if (b == -1) {
				if (prefix.length() == 0) {
					return null;
				} else {
					throw new EOFException("Bundle ended inside a length prefix after " + bytesRead + " bytes");
				}
			} else if (b < '0' || b > '9') {
				throw new IOException("Unexpected character in length prefix at byte " + (bytesRead + prefix.length()) + ": " + (char) b);
			}
			prefix.append((char) b);
		}
		if (prefix.length() == 0) {
			throw new IOException("Missing length prefix at byte " + bytesRead);
		}

		int length;
		try {
			length = Integer.parseInt(prefix.toString());
		} catch (NumberFormatException e) {
			throw new IOException("Invalid length prefix: " + prefix, e);
		}
		if (length < 1) {
			throw new IOException("Invalid element length: " + length);
		}

		// The opening brace has already been read
		byte[] json = new byte[length];
		json[0] = '{';
		int count = input.readNBytes(json, 1, length - 1);
		if (count != length - 1) {
			throw new EOFException("Bundle ended inside an element after " + (bytesRead + prefix.length() + 1 + count) + " bytes");
		}
		bytesRead += prefix.length() + length;
		BundleElement element = mapper.readValue(json, BundleElement.class);
		LOGGER.trace("Read {}", element);
		return element;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JsonBundleReader.class);
}
