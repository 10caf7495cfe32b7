package io.vena.docsync.remote;

import io.vena.docsync.local.QueryPurpose;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.MutableDocument;
import io.vena.docsync.model.SnapshotVersion;
import java.util.Map;
import java.util.Set;

/**
 * Everything the watch stream reported up to one consistent snapshot.
 *
 * @param targetChanges the changes for every target that changed, by target id
 * @param targetMismatches targets whose existence filter disagreed with the local state,
 *                         and which must be re-listened from scratch, with the purpose of the new listen
 * @param documentUpdates the new state of every changed document
 * @param resolvedLimboDocuments keys that were in limbo and are not matched by any non-limbo target
 */
public record RemoteEvent(
	SnapshotVersion snapshotVersion,
	Map<Integer, TargetChange> targetChanges,
	Map<Integer, QueryPurpose> targetMismatches,
	Map<DocumentKey, MutableDocument> documentUpdates,
	Set<DocumentKey> resolvedLimboDocuments
) {
	public RemoteEvent {
		targetChanges = Map.copyOf(targetChanges);
		targetMismatches = Map.copyOf(targetMismatches);
		documentUpdates = Map.copyOf(documentUpdates);
		resolvedLimboDocuments = Set.copyOf(resolvedLimboDocuments);
	}
}
