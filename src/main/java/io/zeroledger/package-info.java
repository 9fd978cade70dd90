/**
 * ZeroLedger source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.zeroledger.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.zeroledger.cli.ZeroLedgerCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.zeroledger.runtime.Orchestrator} wires lock, recovery, acceptance and scheduling.</li>
 *   <li>{@code io.zeroledger.ledger.Ledger} is the authoritative record of results.</li>
 * </ul>
 */
package io.zeroledger;
