/**
 * Row parsing: turns positioned JDBC rows into serializable records.
 */
package io.github.yok.flashsync.parser;
