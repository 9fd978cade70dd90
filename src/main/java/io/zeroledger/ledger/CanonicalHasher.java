package io.zeroledger.ledger;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.zeroledger.model.ResultPayload;
import io.zeroledger.util.Hashing;
import io.zeroledger.util.Jsons;

import java.math.BigDecimal;

/**
 * Content identity of a result. Only {@code t} and {@code root_val} take part; the whole
 * {@code meta} object (method, iteration count, timings) is volatile and excluded.
 * Numbers are rendered in a canonical decimal form and keys are emitted sorted.
 */
public final class CanonicalHasher {

    public String hash(ResultPayload payload) {
        return Hashing.sha256Tagged(canonicalForm(payload));
    }

    public String canonicalForm(ResultPayload payload) {
        ObjectNode canon = JsonNodeFactory.instance.objectNode();
        canon.put("root_val", normalize(payload.rootVal()));
        canon.put("t", normalize(payload.t()));
        return Jsons.toCompactJson(canon);
    }

    static String normalize(double value) {
        if (value == 0.0d) {
            return "0";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toString();
    }
}
