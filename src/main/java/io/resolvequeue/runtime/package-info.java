/**
 * Queue facade.
 *
 * <p>{@link io.resolvequeue.runtime.ResolutionQueue} owns the effective settings, the clock
 * and audit logging, and delegates every state change to the job store.
 */
package io.resolvequeue.runtime;
