/**
 * Checked exceptions of the sync pipeline.
 *
 * <p>
 * Everything except {@link io.github.yok.flashsync.error.RowParseException} is fatal to the task
 * that raised it and cancels the rest of the run.
 * </p>
 */
package io.github.yok.flashsync.error;
