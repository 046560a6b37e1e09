/**
 * Runtime orchestration package.
 *
 * <p>{@link io.querygate.runtime.QueryGateRuntime} validates a plan, gates it against the tenant's
 * limits, executes the surviving steps with retries and replays finished steps for a repeated
 * workflow. It also records audit rows and the counters behind {@code stats} and {@code metrics}.
 */
package io.querygate.runtime;
