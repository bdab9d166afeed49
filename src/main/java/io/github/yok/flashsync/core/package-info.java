/**
 * Sync pipeline: schema inference, destination reconciliation, extract-and-load, and the
 * concurrent orchestration of one worker per table.
 */
package io.github.yok.flashsync.core;
