/**
 * resolvequeue source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.resolvequeue.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.resolvequeue.cli.ResolveQueueCommand} maps commands to queue APIs.</li>
 *   <li>{@code io.resolvequeue.runtime.ResolutionQueue} is the submission, worker and operator facade.</li>
 *   <li>{@code io.resolvequeue.storage.JobStore} is the authoritative persistence layer: claim, report, reclaim.</li>
 * </ul>
 */
package io.resolvequeue;
