/**
 * Small helpers: fatal error reporting, duration parsing and date/time formatting.
 */
package io.github.yok.flashsync.util;
