/**
 * BigQuery implementation of the destination abstraction.
 */
package io.github.yok.flashsync.destination.bigquery;
