// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import org.jspecify.annotations.Nullable;

import sh.lantern.core.types.Capability;

/**
 * Capabilities an origin holds over the wallet.
 *
 * <p>An instance never carries an empty capability set; revoking the last capability deletes the
 * whole entry instead.
 *
 * @param origin         normalized origin the grant belongs to
 * @param capabilities   granted capabilities, never empty
 * @param address        wallet address the origin was connected with
 * @param connectedAt    first grant, epoch millis
 * @param lastAccessedAt last grant or use, epoch millis
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SitePermission(
        String origin,
        Set<Capability> capabilities,
        String address,
        long connectedAt,
        long lastAccessedAt) {

    public SitePermission {
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(address, "address");
        if (capabilities == null || capabilities.isEmpty()) {
            throw new IllegalArgumentException("SitePermission requires at least one capability");
        }
        capabilities = Collections.unmodifiableSet(EnumSet.copyOf(capabilities));
    }

    public boolean has(final Capability capability) {
        return capabilities.contains(capability);
    }

    public boolean hasAll(final Set<Capability> requested) {
        return capabilities.containsAll(requested);
    }

    /**
     * Returns a copy holding the union of the current and {@code added} capabilities.
     */
    public SitePermission grant(final Set<Capability> added, final long now) {
        final EnumSet<Capability> merged = EnumSet.copyOf(capabilities);
        merged.addAll(added);
        return new SitePermission(origin, merged, address, connectedAt, now);
    }

    /**
     * Returns a copy without {@code capability}, or {@code null} if none would remain.
     */
    public @Nullable SitePermission revoke(final Capability capability) {
        final EnumSet<Capability> remaining = EnumSet.copyOf(capabilities);
        remaining.remove(capability);
        if (remaining.isEmpty()) {
            return null;
        }
        return new SitePermission(origin, remaining, address, connectedAt, lastAccessedAt);
    }

    public SitePermission touchedAt(final long now) {
        return new SitePermission(origin, capabilities, address, connectedAt, now);
    }
}
