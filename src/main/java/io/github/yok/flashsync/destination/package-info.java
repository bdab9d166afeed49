/**
 * Destination abstraction: table lifecycle and truncate-and-reload bulk loads.
 */
package io.github.yok.flashsync.destination;
