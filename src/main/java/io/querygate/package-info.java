/**
 * QueryGate source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.querygate.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.querygate.cli.QueryGateCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.querygate.runtime.QueryGateRuntime} wires the gate, the executor and the step cache into one run.</li>
 *   <li>{@code io.querygate.safety.SqlSafetyAnalyzer} decides whether a single SQL statement may run at all.</li>
 * </ul>
 */
package io.querygate;
