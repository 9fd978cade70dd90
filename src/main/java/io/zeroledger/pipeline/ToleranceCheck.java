package io.zeroledger.pipeline;

import io.zeroledger.model.ResultPayload;

import java.util.Optional;

/**
 * Numeric acceptance criterion applied to a structurally valid result.
 */
@FunctionalInterface
public interface ToleranceCheck {
    /**
     * @return the rejection detail when the payload is out of tolerance, empty otherwise
     */
    Optional<String> violation(ResultPayload payload);
}
