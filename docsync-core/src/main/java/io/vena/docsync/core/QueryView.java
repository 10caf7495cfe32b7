package io.vena.docsync.core;

/**
 * A query being listened to, the target it is listened to with, and its view.
 * Several queries may share a target.
 */
record QueryView(Query query, int targetId, View view) { }
