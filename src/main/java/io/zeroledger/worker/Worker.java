package io.zeroledger.worker;

import com.fasterxml.jackson.databind.JsonNode;
import io.zeroledger.model.Job;

import java.util.List;

/**
 * Computes candidate results for a job. Workers never touch the ledger or the state
 * snapshot; the orchestrator validates whatever shape they return.
 */
public interface Worker {
    String id();

    List<JsonNode> compute(Job job) throws Exception;
}
