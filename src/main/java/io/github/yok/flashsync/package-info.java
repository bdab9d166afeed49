/**
 * MySQL to BigQuery table synchronization.
 */
package io.github.yok.flashsync;
