package io.vena.docsync.jackson;

import io.vena.docsync.bundle.BundleCallback;
import io.vena.docsync.bundle.BundleDocument;
import io.vena.docsync.bundle.BundleElement;
import io.vena.docsync.bundle.BundleLoader;
import io.vena.docsync.bundle.BundleMetadata;
import io.vena.docsync.bundle.BundledDocumentMetadata;
import io.vena.docsync.bundle.BundledQuery;
import io.vena.docsync.bundle.LoadBundleTaskProgress;
import io.vena.docsync.bundle.NamedQuery;
import io.vena.docsync.core.Query;
import io.vena.docsync.model.DatabaseId;
import io.vena.docsync.model.Document;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.FieldPath;
import io.vena.docsync.model.MutableDocument;
import io.vena.docsync.model.ResourcePath;
import io.vena.docsync.model.SnapshotVersion;
import io.vena.docsync.model.value.StringValue;
import io.vena.docsync.model.value.Values;
import java.io.ByteArrayInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonBundleReaderTest {
	static final DatabaseId DATABASE_ID = DatabaseId.forProject("test-project");
	static final SnapshotVersion CREATE_TIME = SnapshotVersion.ofMicros(1_000_000);

	byte[] bundle;

	@BeforeEach
	void buildBundle() throws IOException {
		NamedQuery rooms = new NamedQuery("rooms",
			new BundledQuery(Query.atPath(ResourcePath.fromString("rooms")).toTarget(), Query.LimitType.LIMIT_TO_FIRST),
			CREATE_TIME);
		Map<MutableDocument, List<String>> documents = new LinkedHashMap<>();
		documents.put(found("rooms/a", "Ünïcödé name"), List.of("rooms"));
		documents.put(MutableDocument.newNoDocument(DocumentKey.fromPathString("rooms/gone"), CREATE_TIME), List.of());
		documents.put(found("rooms/b", "B"), List.of("rooms"));
		bundle = JsonBundleWriter.buildBundle(DATABASE_ID, "test-bundle", CREATE_TIME, List.of(rooms), documents);
	}

	static MutableDocument found(String path, String name) {
		return MutableDocument.newFoundDocument(DocumentKey.fromPathString(path), SnapshotVersion.ofMicros(500_000),
			Values.objectFromJava(Map.of("name", name)));
	}

	@Test
	void readsEveryElementInOrder() throws IOException {
		try (JsonBundleReader reader = new JsonBundleReader(DATABASE_ID, new ByteArrayInputStream(bundle))) {
			BundleMetadata metadata = reader.getBundleMetadata();
			assertEquals("test-bundle", metadata.bundleId());
			assertEquals(3, metadata.totalDocuments());
			assertEquals(bundle.length, metadata.totalBytes(), "Total includes the metadata itself");
			assertEquals(metadata, reader.getBundleMetadata(), "Metadata is read only once");

			List<BundleElement> elements = new ArrayList<>();
			BundleElement element;
			while ((element = reader.getNextElement()) != null) {
				elements.add(element);
			}
			assertEquals(6, elements.size());
			assertInstanceOf(NamedQuery.class, elements.get(0));
			assertEquals(DocumentKey.fromPathString("rooms/a"), ((BundledDocumentMetadata) elements.get(1)).key());
			assertEquals(new StringValue("Ünïcödé name"), ((BundleDocument) elements.get(2)).document().field(FieldPath.of("name")));
			BundledDocumentMetadata gone = (BundledDocumentMetadata) elements.get(3);
			assertEquals(false, gone.exists());
			assertInstanceOf(BundledDocumentMetadata.class, elements.get(4));
			assertInstanceOf(BundleDocument.class, elements.get(5));

			assertEquals(bundle.length, reader.getBytesRead());
			assertNull(reader.getNextElement(), "End of bundle stays at the end");
		}
	}

	@Test
	void loaderReportsProgressToTheEnd() throws IOException {
		RecordingCallback callback = new RecordingCallback();
		LoadBundleTaskProgress last = null;
		try (JsonBundleReader reader = new JsonBundleReader(DATABASE_ID, new ByteArrayInputStream(bundle))) {
			BundleLoader loader = new BundleLoader(callback, reader.getBundleMetadata());
			long bytesRead = reader.getBytesRead();
			BundleElement element;
			while ((element = reader.getNextElement()) != null) {
				LoadBundleTaskProgress progress = loader.addElement(element, reader.getBytesRead() - bytesRead);
				bytesRead = reader.getBytesRead();
				if (progress != null) {
					last = progress;
				}
			}
			loader.applyChanges();
		}
		assertEquals(3, last.documentsLoaded());
		assertEquals(bundle.length - firstElementLength(), last.bytesLoaded(), "Progress counts what follows the metadata");
		assertEquals(List.of("rooms/a", "rooms/b", "rooms/gone"), callback.documentPaths);
		assertEquals(2, callback.namedQueryKeys.get("rooms").size());
		assertEquals("test-bundle", callback.savedBundle.bundleId());
	}

	@Test
	void emptyInput_throws() {
		JsonBundleReader reader = new JsonBundleReader(DATABASE_ID, new ByteArrayInputStream(new byte[0]));
		assertThrows(EOFException.class, reader::getBundleMetadata);
	}

	@Test
	void truncatedInput_throws() throws IOException {
		byte[] truncated = Arrays.copyOf(bundle, bundle.length - 10);
		try (JsonBundleReader reader = new JsonBundleReader(DATABASE_ID, new ByteArrayInputStream(truncated))) {
			reader.getBundleMetadata();
			assertThrows(EOFException.class, () -> {
				while (reader.getNextElement() != null) {
					// Keep reading
				}
			});
		}
	}

	@Test
	void missingMetadata_throws() throws IOException {
		byte[] withoutMetadata = Arrays.copyOfRange(bundle, firstElementLength(), bundle.length);
		try (JsonBundleReader reader = new JsonBundleReader(DATABASE_ID, new ByteArrayInputStream(withoutMetadata))) {
			IOException e = assertThrows(IOException.class, reader::getBundleMetadata);
			assertThat(e.getMessage(), containsString("metadata"));
		}
	}

	@Test
	void badLengthPrefix_throws() {
		byte[] garbage = "12x{}".getBytes(UTF_8);
		JsonBundleReader reader = new JsonBundleReader(DATABASE_ID, new ByteArrayInputStream(garbage));
		IOException e = assertThrows(IOException.class, reader::getBundleMetadata);
		assertThat(e.getMessage(), containsString("length prefix"));
	}

	@Test
	void lengthCountsBytesNotCharacters() throws IOException {
		String json = "{\"metadata\": {\"id\": \"é\", \"createTime\": \"2020-01-01T00:00:00Z\"}}";
		byte[] bytes = json.getBytes(UTF_8);
		byte[] element = (bytes.length + json).getBytes(UTF_8);
		try (JsonBundleReader reader = new JsonBundleReader(DATABASE_ID, new ByteArrayInputStream(element))) {
			assertEquals("é", reader.getBundleMetadata().bundleId());
			assertEquals(element.length, reader.getBytesRead());
			assertNull(reader.getNextElement());
		}
	}

	private int firstElementLength() {
		int prefixEnd = 0;
		while (bundle[prefixEnd] != '{') {
			prefixEnd++;
		}
		int length = Integer.parseInt(new String(bundle, 0, prefixEnd, UTF_8));
		assertTrue(length > 0);
		return prefixEnd + length;
	}

	static final class RecordingCallback implements BundleCallback {
		final List<String> documentPaths = new ArrayList<>();
		final Map<String, SortedSet<DocumentKey>> namedQueryKeys = new TreeMap<>();
		BundleMetadata savedBundle;

		@Override
		public Map<DocumentKey, Document> applyBundledDocuments(Map<DocumentKey, MutableDocument> documents, String bundleId) {
			for (DocumentKey key: documents.keySet()) {
				documentPaths.add(key.path().canonicalString());
			}
			return Map.copyOf(documents);
		}

		@Override
		public void saveNamedQuery(NamedQuery namedQuery, SortedSet<DocumentKey> documentKeys) {
			namedQueryKeys.put(namedQuery.name(), documentKeys);
		}

		@Override
		public void saveBundle(BundleMetadata bundleMetadata) {
			savedBundle = bundleMetadata;
		}
	}
}
