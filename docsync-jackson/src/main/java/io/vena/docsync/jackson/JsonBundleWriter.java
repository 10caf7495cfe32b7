package io.vena.docsync.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.vena.docsync.bundle.BundleDocument;
import io.vena.docsync.bundle.BundleElement;
import io.vena.docsync.bundle.BundleMetadata;
import io.vena.docsync.bundle.BundledDocumentMetadata;
import io.vena.docsync.bundle.NamedQuery;
import io.vena.docsync.model.DatabaseId;
import io.vena.docsync.model.MutableDocument;
import io.vena.docsync.model.SnapshotVersion;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static java.nio.charset.StandardCharsets.US_ASCII;

/**
 * Writes bundle elements in the format read by {@link JsonBundleReader}.
 * The metadata must be written first, and its <code>totalBytes</code> must match the bundle;
 * {@link #buildBundle} takes care of both.
 */
public class JsonBundleWriter implements Closeable {
	private final ObjectMapper mapper;
	private final OutputStream output;

	public JsonBundleWriter(DatabaseId databaseId, OutputStream output) {
		this.mapper = new ObjectMapper().registerModule(new JacksonBundlePlugin().moduleFor(databaseId));
		this.output = output;
	}

	/**
	 * @return the number of bytes written
	 */
	public long write(BundleElement element) throws IOException {
		byte[] json = mapper.writeValueAsBytes(element);
		byte[] prefix = Integer.toString(json.length).getBytes(US_ASCII);
		output.write(prefix);
		output.write(json);
		return prefix.length + json.length;
	}

	@Override
	public void close() throws IOException {
		output.close();
	}

	/**
	 * Assembles a complete bundle whose metadata counts the given documents and
	 * the bytes of everything that follows it.
	 *
	 * @param documents found documents; each is listed under the names of the queries whose results include it
	 */
	public static byte[] buildBundle(
		DatabaseId databaseId,
		String bundleId,
		SnapshotVersion createTime,
		List<NamedQuery> namedQueries,
		Map<MutableDocument, List<String>> documents
	) throws IOException {
		List<BundleElement> body = new ArrayList<>(namedQueries);
		for (Map.Entry<MutableDocument, List<String>> entry: documents.entrySet()) {
			MutableDocument document = entry.getKey();
			body.add(new BundledDocumentMetadata(document.key(), createTime, document.isFoundDocument(), entry.getValue()));
			if (document.isFoundDocument()) {
				body.add(new BundleDocument(document));
			}
		}

		ByteArrayOutputStream bodyBytes = new ByteArrayOutputStream();
		try (JsonBundleWriter writer = new JsonBundleWriter(databaseId, bodyBytes)) {
			for (BundleElement element: body) {
				writer.write(element);
			}
		}

		// totalBytes includes the metadata element itself, whose size depends on totalBytes
		long metadataSize = 0;
		while (true) {
			BundleMetadata metadata = new BundleMetadata(bundleId, 1, createTime, documents.size(), metadataSize + bodyBytes.size());
			ByteArrayOutputStream result = new ByteArrayOutputStream();
			long written = new JsonBundleWriter(databaseId, result).write(metadata);
			if (written == metadataSize) {
				bodyBytes.writeTo(result);
				return result.toByteArray();
			}
			metadataSize = written;
		}
	}
}
