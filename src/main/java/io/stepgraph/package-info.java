/**
 * stepgraph source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.stepgraph.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.stepgraph.graph.GraphBuilder} declares and validates graphs.</li>
 *   <li>{@code io.stepgraph.runtime.GraphExecutor} runs and resumes one run step by step.</li>
 *   <li>{@code io.stepgraph.storage.CheckpointStore} is the authoritative persistence layer.</li>
 * </ul>
 */
package io.stepgraph;
