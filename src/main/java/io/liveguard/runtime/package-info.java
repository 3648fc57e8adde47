/**
 * Runtime wiring package.
 *
 * <p>{@link io.liveguard.runtime.LiveGuardRuntime} builds the SQLite adapters, key cache,
 * ingest gate, worker and ranking refresher from one data root, and exposes the
 * operational surface used by the CLI and the HTTP endpoint.
 */
package io.liveguard.runtime;
