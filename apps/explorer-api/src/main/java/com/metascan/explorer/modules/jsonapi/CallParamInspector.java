package com.metascan.explorer.modules.jsonapi;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.metascan.explorer.config.ExplorerProperties;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.crypto.digests.Blake2bDigest;
import org.springframework.stereotype.Component;
import org.web3j.utils.Numeric;

/**
 * Replaces oversized hex call arguments with a downloadable reference
 * {@code "<extrinsic id>/<blake2b-256 hex>"}. Nested argument lists and wrapped calls are walked.
 */
@Slf4j
@Component
public class CallParamInspector {

    static final String BOXED_CALL = "Box<Call>";
    static final String DOWNLOADABLE = "DownloadableBytesHash";

    private final int maxInlineLength;

    public CallParamInspector(ExplorerProperties properties) {
        this.maxInlineLength = properties.getParams().getMaxInlineLength();
    }

    /**
     * Rewrites {@code params} in place and returns it.
     */
    public JsonNode inspect(JsonNode params, String identifier) {
        if (params == null || !params.isArray()) {
            return params;
        }
        for (JsonNode element : (ArrayNode) params) {
            if (!element.isObject() || !element.has("value") || !element.has("type")) {
                continue;
            }
            ObjectNode param = (ObjectNode) element;
            JsonNode value = param.get("value");
            if (value.isArray()) {
                inspect(value, identifier);
            } else if (BOXED_CALL.equals(param.get("type").asText())) {
                if (value.isObject()) {
                    inspect(value.get("call_args"), identifier);
                }
            } else if (value.isTextual() && value.asText().length() > maxInlineLength) {
                String digest = blake2b256(value.asText());
                log.debug("Replaced {} char param {} of {} by reference",
                        value.asText().length(), param.path("name").asText(), identifier);
                param.put("value", identifier + "/" + digest);
                param.put("type", DOWNLOADABLE);
                param.put("valueRaw", "");
            }
        }
        return params;
    }

    static String blake2b256(String hex) {
        byte[] bytes = Numeric.hexStringToByteArray(hex);
        Blake2bDigest digest = new Blake2bDigest(256);
        digest.update(bytes, 0, bytes.length);
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return Numeric.toHexStringNoPrefix(out);
    }
}
