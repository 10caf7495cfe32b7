package io.vena.docsync.remote;

import io.vena.docsync.core.DocumentViewChange;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.util.ByteString;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * What the {@link WatchChangeAggregator} has accumulated for one target since the last
 * {@link RemoteEvent}.
 */
final class TargetState {
	/**
	 * Outstanding listen and unlisten requests. Changes for the target are ignored until this is zero.
	 */
	private int outstandingResponses = 0;

	private final Map<DocumentKey, DocumentViewChange.Type> documentChanges = new HashMap<>();

	/**
	 * New targets start with pending changes so their first snapshot is raised even if it is empty.
	 */
	private boolean hasPendingChanges = true;

	private ByteString resumeToken = ByteString.EMPTY;
	private boolean current = false;

	boolean isCurrent() {
		return current;
	}

	boolean isPending() {
		return outstandingResponses != 0;
	}

	boolean hasPendingChanges() {
		return hasPendingChanges;
	}

	ByteString resumeToken() {
		return resumeToken;
	}

	/**
	 * Ignores empty tokens, which the backend sends when it has nothing newer.
	 */
	void updateResumeToken(ByteString resumeToken) {
		if (!resumeToken.isEmpty()) {
			hasPendingChanges = true;
			this.resumeToken = resumeToken;
		}
	}

	TargetChange toTargetChange() {
		SortedSet<DocumentKey> added = new TreeSet<>();
		SortedSet<DocumentKey> modified = new TreeSet<>();
		SortedSet<DocumentKey> removed = new TreeSet<>();
		for (Map.Entry<DocumentKey, DocumentViewChange.Type> entry: documentChanges.entrySet()) {
			switch (entry.getValue()) {
				case ADDED:
					added.add(entry.getKey());
					break;
				case MODIFIED:
					modified.add(entry.getKey());
					break;
				case REMOVED:
					removed.add(entry.getKey());
					break;
				default:
					throw new IllegalStateException("Unexpected change type for target: " + entry.getValue());
			}
		}
		return new TargetChange(resumeToken, current, added, modified, removed);
	}

	void clearPendingChanges() {
		hasPendingChanges = false;
		documentChanges.clear();
	}

	void addDocumentChange(DocumentKey key, DocumentViewChange.Type changeType) {
		hasPendingChanges = true;
		documentChanges.put(key, changeType);
	}

	void removeDocumentChange(DocumentKey key) {
		hasPendingChanges = true;
		documentChanges.remove(key);
	}

	void recordPendingTargetRequest() {
		++outstandingResponses;
	}

	void recordTargetResponse() {
		--outstandingResponses;
		if (outstandingResponses < 0) {
			throw new IllegalStateException("More target responses than requests");
		}
	}

	void markCurrent() {
		hasPendingChanges = true;
		current = true;
	}
}
