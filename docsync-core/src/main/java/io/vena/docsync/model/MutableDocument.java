package io.vena.docsync.model;

import io.vena.docsync.model.value.ObjectValue;
import io.vena.docsync.model.value.Value;
import org.jetbrains.annotations.Nullable;

/**
 * A document whose state changes as mutations and remote updates are applied to it.
 * The <code>convertTo</code> and <code>set</code> methods return <code>this</code> for chaining.
 */
public final class MutableDocument implements Document {
	private enum DocumentType {
		INVALID,
		FOUND_DOCUMENT,
		NO_DOCUMENT,
		UNKNOWN_DOCUMENT
	}

	private enum DocumentState {
		HAS_LOCAL_MUTATIONS,
		HAS_COMMITTED_MUTATIONS,
		SYNCED
	}

	private final DocumentKey key;
	private DocumentType documentType;
	private SnapshotVersion version;
	private SnapshotVersion readTime;
	private ObjectValue value;
	private DocumentState documentState;

	private MutableDocument(DocumentKey key, DocumentType documentType, SnapshotVersion version, SnapshotVersion readTime, ObjectValue value, DocumentState documentState) {
		this.key = key;
		this.documentType = documentType;
		this.version = version;
		this.readTime = readTime;
		this.value = value;
		this.documentState = documentState;
	}

	public static MutableDocument newInvalidDocument(DocumentKey key) {
		return new MutableDocument(key, DocumentType.INVALID, SnapshotVersion.NONE, SnapshotVersion.NONE, ObjectValue.empty(), DocumentState.SYNCED);
	}

	public static MutableDocument newFoundDocument(DocumentKey key, SnapshotVersion version, ObjectValue value) {
		return newInvalidDocument(key).convertToFoundDocument(version, value);
	}

	public static MutableDocument newNoDocument(DocumentKey key, SnapshotVersion version) {
		return newInvalidDocument(key).convertToNoDocument(version);
	}

	public static MutableDocument newUnknownDocument(DocumentKey key, SnapshotVersion version) {
		return newInvalidDocument(key).convertToUnknownDocument(version);
	}

	public MutableDocument convertToFoundDocument(SnapshotVersion version, ObjectValue value) {
		this.version = version;
		this.documentType = DocumentType.FOUND_DOCUMENT;
		this.value = value;
		this.documentState = DocumentState.SYNCED;
		return this;
	}

	public MutableDocument convertToNoDocument(SnapshotVersion version) {
		this.version = version;
		this.documentType = DocumentType.NO_DOCUMENT;
		this.value = ObjectValue.empty();
		this.documentState = DocumentState.SYNCED;
		return this;
	}

	public MutableDocument convertToUnknownDocument(SnapshotVersion version) {
		this.version = version;
		this.documentType = DocumentType.UNKNOWN_DOCUMENT;
		this.value = ObjectValue.empty();
		this.documentState = DocumentState.HAS_COMMITTED_MUTATIONS;
		return this;
	}

	public MutableDocument setHasCommittedMutations() {
		this.documentState = DocumentState.HAS_COMMITTED_MUTATIONS;
		return this;
	}

	/**
	 * Also resets the version: a locally mutated document has no backend version.
	 */
	public MutableDocument setHasLocalMutations() {
		this.documentState = DocumentState.HAS_LOCAL_MUTATIONS;
		this.version = SnapshotVersion.NONE;
		return this;
	}

	public MutableDocument setReadTime(SnapshotVersion readTime) {
		this.readTime = readTime;
		return this;
	}

	/**
	 * Replaces the data of a found document without changing its type or state.
	 */
	public MutableDocument setData(ObjectValue value) {
		this.value = value;
		return this;
	}

	@Override public DocumentKey key() { return key; }
	@Override public SnapshotVersion version() { return version; }
	@Override public SnapshotVersion readTime() { return readTime; }
	@Override public ObjectValue data() { return value; }
	@Override public @Nullable Value field(FieldPath path) { return value.get(path); }
	@Override public boolean isValidDocument() { return documentType != DocumentType.INVALID; }
	@Override public boolean isFoundDocument() { return documentType == DocumentType.FOUND_DOCUMENT; }
	@Override public boolean isNoDocument() { return documentType == DocumentType.NO_DOCUMENT; }
	@Override public boolean isUnknownDocument() { return documentType == DocumentType.UNKNOWN_DOCUMENT; }
	@Override public boolean hasLocalMutations() { return documentState == DocumentState.HAS_LOCAL_MUTATIONS; }
	@Override public boolean hasCommittedMutations() { return documentState == DocumentState.HAS_COMMITTED_MUTATIONS; }

	@Override
	public MutableDocument mutableCopy() {
		return new MutableDocument(key, documentType, version, readTime, value, documentState);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof MutableDocument)) return false;
		MutableDocument other = (MutableDocument) o;
		return key.equals(other.key)
			&& version.equals(other.version)
			&& documentType == other.documentType
			&& documentState == other.documentState
			&& value.equals(other.value);
	}

	@Override
	public int hashCode() {
		return key.hashCode();
	}

	@Override
	public String toString() {
		return "Document{key=" + key
			+ ", version=" + version
			+ ", readTime=" + readTime
			+ ", type=" + documentType
			+ ", documentState=" + documentState
			+ ", value=" + value
			+ "}";
	}
}
