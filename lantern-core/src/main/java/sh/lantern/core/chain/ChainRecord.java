// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.chain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A decrypted record owned by the account.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChainRecord(String id, String owner, Map<String, Object> data, String nonce) {

    public ChainRecord {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
}
