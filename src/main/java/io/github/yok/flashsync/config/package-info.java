/**
 * Configuration model bound from {@code application.yml}: destination, run, pool and source
 * settings, plus their validation and the source catalog built from them.
 */
package io.github.yok.flashsync.config;
