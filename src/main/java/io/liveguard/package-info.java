/**
 * LiveGuard source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.liveguard.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.liveguard.cli.LiveGuardCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.liveguard.ingest.IngestGate} admits or rejects signed heartbeats.</li>
 *   <li>{@code io.liveguard.worker.HeartbeatWorker} turns queued jobs into derived server state.</li>
 *   <li>{@code io.liveguard.engine.DerivedStateCalculator} combines the pure status, confidence, uptime, anomaly and quality rules.</li>
 * </ul>
 */
package io.liveguard;
