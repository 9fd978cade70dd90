/**
 * Runtime orchestration package.
 *
 * <p>{@link io.zeroledger.runtime.Orchestrator} owns the process lifecycle: the single-writer
 * lock, ledger recovery, the worker pool and the message loop feeding the acceptance pipeline.
 */
package io.zeroledger.runtime;
