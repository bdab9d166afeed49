/**
 * Immutable data model of a sync run: sources and tasks, inferred schemas, parsed records and
 * outcomes.
 */
package io.github.yok.flashsync.model;
