package io.zeroledger.contract;

import com.fasterxml.jackson.databind.JsonNode;
import io.zeroledger.model.ResultPayload;

/**
 * Schema a worker result must satisfy before it is considered for acceptance.
 * Implementations throw {@link ValidationException} for a payload they refuse.
 */
@FunctionalInterface
public interface ResultContract {
    ResultPayload validate(JsonNode raw);
}
