/**
 * Source database access: per-worker connection pools and the MySQL type mapping used for schema
 * inference.
 */
package io.github.yok.flashsync.db;
