// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.wallet.permission;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import sh.lantern.core.types.Capability;
import sh.lantern.core.types.Origin;

/**
 * A capability request waiting for the user, as published on the {@link ApprovalChannel}.
 *
 * @param id           opaque id to pass back to {@link PermissionBroker#resolve}
 * @param origin       requesting origin
 * @param kind         dialog to show
 * @param capabilities capabilities granted on approval
 * @param payload      details for the dialog (amounts, program, message); never secrets
 * @param requestedAt  epoch millis
 */
public record ApprovalRequest(
        String id,
        Origin origin,
        ApprovalKind kind,
        Set<Capability> capabilities,
        Map<String, Object> payload,
        long requestedAt) {

    public ApprovalRequest {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(kind, "kind");
        if (capabilities == null || capabilities.isEmpty()) {
            throw new IllegalArgumentException("capabilities cannot be empty");
        }
        capabilities = Collections.unmodifiableSet(EnumSet.copyOf(capabilities));
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
