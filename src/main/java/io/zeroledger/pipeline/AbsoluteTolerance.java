package io.zeroledger.pipeline;

import io.zeroledger.model.ResultPayload;

import java.util.Optional;

/**
 * Accepts a result when {@code |root_val| < epsRoot}. The bound itself is out of tolerance.
 */
public final class AbsoluteTolerance implements ToleranceCheck {
    private final double epsRoot;

    public AbsoluteTolerance(double epsRoot) {
        if (!(epsRoot > 0.0d) || !Double.isFinite(epsRoot)) {
            throw new IllegalArgumentException("epsRoot must be a positive finite number: " + epsRoot);
        }
        this.epsRoot = epsRoot;
    }

    public double epsRoot() {
        return epsRoot;
    }

    @Override
    public Optional<String> violation(ResultPayload payload) {
        double residual = Math.abs(payload.rootVal());
        if (residual < epsRoot) {
            return Optional.empty();
        }
        return Optional.of("|root_val|=" + residual + " >= eps_root=" + epsRoot);
    }
}
