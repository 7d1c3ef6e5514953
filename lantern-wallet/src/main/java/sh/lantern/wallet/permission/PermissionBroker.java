// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.wallet.permission;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;

import sh.lantern.core.error.ApprovalTimeoutException;
import sh.lantern.core.error.PermissionDeniedException;
import sh.lantern.core.error.StorageException;
import sh.lantern.core.error.ValidationException;
import sh.lantern.core.model.SitePermission;
import sh.lantern.core.types.Capability;
import sh.lantern.core.types.Origin;
import sh.lantern.wallet.WalletConfig;
import sh.lantern.wallet.concurrent.ScheduledTask;
import sh.lantern.wallet.concurrent.TaskScheduler;
import sh.lantern.wallet.store.JsonFiles;
import sh.lantern.wallet.store.PermissionStore;

/**
 * Decides which web origins may use which wallet capabilities, asking the user when needed.
 *
 * <p>
 * <strong>Grant table:</strong> one {@link SitePermission} per origin, written through to the
 * {@link PermissionStore} on every change. Grants only grow through approval (set union) and only
 * shrink through explicit revocation, disconnection or cleanup.
 *
 * <p>
 * <strong>Approval flow:</strong>
 * <ol>
 * <li>{@link #requestCapability} returns an already-completed future when the origin holds every
 * requested capability</li>
 * <li>Otherwise it registers a pending request, publishes it on the {@link ApprovalChannel} and
 * returns a future</li>
 * <li>{@link #resolve} completes the future with the user's answer; an approval merges the
 * requested capabilities into the grant first</li>
 * <li>{@link #requestConsent} follows the same path for one-off actions, but always prompts and
 * never changes the grant table</li>
 * <li>After {@link WalletConfig#approvalTimeout()} the future fails with
 * {@link ApprovalTimeoutException}</li>
 * </ol>
 * Whichever of resolve and timeout removes the pending entry first wins; the other finds nothing
 * and does nothing.
 *
 * <p>
 * <strong>Thread Safety:</strong> pending requests live in a concurrent map and are taken with a
 * single atomic remove. Grant table changes are serialized on this instance. Callers never block
 * on the user.
 *
 * @since 0.1.0
 */
public final class PermissionBroker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PermissionBroker.class);

    private static final TypeReference<List<SitePermission>> SITES = new TypeReference<>() {};

    private final WalletConfig config;
    private final PermissionStore store;
    private final TaskScheduler scheduler;
    private final ApprovalChannel channel;

    private final Map<String, SitePermission> sites = new LinkedHashMap<>();
    private final Map<String, Pending> pending = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public PermissionBroker(
            final WalletConfig config,
            final PermissionStore store,
            final TaskScheduler scheduler,
            final ApprovalChannel channel) {
        this.config = Objects.requireNonNull(config, "config");
        this.store = Objects.requireNonNull(store, "store");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.channel = Objects.requireNonNull(channel, "channel");
        for (SitePermission site : store.load()) {
            sites.put(site.origin(), site);
        }
        log.debug("Loaded {} connected sites", sites.size());
    }

    // ==================== Grant table ====================

    public synchronized boolean isConnected(final Origin origin) {
        return hasCapability(origin, Capability.CONNECT);
    }

    public synchronized boolean hasCapability(final Origin origin, final Capability capability) {
        final SitePermission site = sites.get(origin.value());
        return site != null && site.has(capability);
    }

    public synchronized Optional<SitePermission> sitePermission(final Origin origin) {
        return Optional.ofNullable(sites.get(origin.value()));
    }

    public synchronized List<SitePermission> connectedSites() {
        return List.copyOf(sites.values());
    }

    /**
     * Adds {@code capabilities} to the origin's grant, creating it if needed.
     *
     * @return the updated grant
     */
    public synchronized SitePermission grant(
            final Origin origin, final Set<Capability> capabilities, final String address) {
        Objects.requireNonNull(address, "address");
        final long now = scheduler.now();
        final SitePermission existing = sites.get(origin.value());
        final SitePermission updated = existing == null
                ? new SitePermission(origin.value(), capabilities, address, now, now)
                : existing.grant(capabilities, now);
        final Map<String, SitePermission> next = new LinkedHashMap<>(sites);
        next.put(origin.value(), updated);
        commit(next);
        log.info("Granted {} to {}", capabilities, origin);
        return updated;
    }

    /**
     * Removes one capability; revoking the last one disconnects the origin.
     */
    public synchronized void revokeCapability(final Origin origin, final Capability capability) {
        final SitePermission site = sites.get(origin.value());
        if (site == null) {
            return;
        }
        final SitePermission remaining = site.revoke(capability);
        final Map<String, SitePermission> next = new LinkedHashMap<>(sites);
        if (remaining == null) {
            next.remove(origin.value());
        } else {
            next.put(origin.value(), remaining);
        }
        commit(next);
        log.info("Revoked {} from {}", capability, origin);
    }

    public synchronized void disconnect(final Origin origin) {
        if (sites.containsKey(origin.value())) {
            final Map<String, SitePermission> next = new LinkedHashMap<>(sites);
            next.remove(origin.value());
            commit(next);
            log.info("Disconnected {}", origin);
        }
    }

    public synchronized void disconnectAll() {
        commit(new LinkedHashMap<>());
        log.info("Disconnected all sites");
    }

    /**
     * Refreshes the origin's last access time, if it holds a grant.
     */
    public synchronized void touch(final Origin origin) {
        final SitePermission site = sites.get(origin.value());
        if (site != null) {
            final Map<String, SitePermission> next = new LinkedHashMap<>(sites);
            next.put(origin.value(), site.touchedAt(scheduler.now()));
            commit(next);
        }
    }

    public int cleanupExpired() {
        return cleanupExpired(config.permissionRetention());
    }

    /**
     * Drops grants not used within {@code maxAge}.
     *
     * @return the number of origins removed
     */
    public synchronized int cleanupExpired(final Duration maxAge) {
        final long cutoff = scheduler.now() - maxAge.toMillis();
        final Map<String, SitePermission> next = new LinkedHashMap<>(sites);
        next.values().removeIf(site -> site.lastAccessedAt() < cutoff);
        final int removed = sites.size() - next.size();
        if (removed > 0) {
            commit(next);
            log.info("Cleaned up {} expired site permissions", removed);
        }
        return removed;
    }

    public synchronized String exportPermissions() {
        try {
            return JsonFiles.mapper().writeValueAsString(new ArrayList<>(sites.values()));
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize site permissions", e);
        }
    }

    /**
     * Merges grants from {@link #exportPermissions()}. Capabilities for an origin already present
     * are unioned with the current grant.
     *
     * @return the number of origins imported
     * @throws ValidationException if {@code json} is not an exported permission list
     */
    public synchronized int importPermissions(final String json) {
        final List<SitePermission> incoming;
        try {
            incoming = JsonFiles.mapper().readValue(json, SITES);
        } catch (IOException | IllegalArgumentException e) {
            throw new ValidationException("Invalid permission export", e);
        }
        if (incoming == null) {
            throw new ValidationException("Invalid permission export");
        }
        final Map<String, SitePermission> next = new LinkedHashMap<>(sites);
        for (SitePermission site : incoming) {
            next.merge(site.origin(), site,
                    (current, imported) -> current.grant(imported.capabilities(), current.lastAccessedAt()));
        }
        commit(next);
        log.info("Imported permissions for {} sites", incoming.size());
        return incoming.size();
    }

    // ==================== Approvals ====================

    /**
     * Asks for {@code capabilities} on behalf of {@code origin}.
     *
     * @param address wallet address recorded with a new grant
     * @return a future completing with {@code true} on approval and {@code false} on rejection, or
     *         failing with {@link ApprovalTimeoutException}
     */
    public CompletableFuture<Boolean> requestCapability(
            final Origin origin,
            final Set<Capability> capabilities,
            final ApprovalKind kind,
            final Map<String, Object> payload,
            final String address) {
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(address, "address");
        if (capabilities == null || capabilities.isEmpty()) {
            throw new IllegalArgumentException("capabilities cannot be empty");
        }
        final EnumSet<Capability> requested = EnumSet.copyOf(capabilities);

        synchronized (this) {
            final SitePermission site = sites.get(origin.value());
            if (site != null && site.hasAll(requested)) {
                final Map<String, SitePermission> next = new LinkedHashMap<>(sites);
                next.put(origin.value(), site.touchedAt(scheduler.now()));
                commit(next);
                return CompletableFuture.completedFuture(Boolean.TRUE);
            }
        }

        return enqueue(origin, requested, kind, payload, address, true);
    }

    public CompletableFuture<Boolean> requestCapability(
            final Origin origin, final Capability capability, final ApprovalKind kind, final String address) {
        return requestCapability(origin, EnumSet.of(capability), kind, Map.of(), address);
    }

    /**
     * Asks the user to approve a single action, such as one transaction or one signature.
     *
     * <p>
     * Unlike {@link #requestCapability}, this always prompts, even when the origin already holds
     * {@code capability}, and an approval is not added to the grant table.
     *
     * @return a future completing with the user's answer, or failing with
     *         {@link ApprovalTimeoutException}
     */
    public CompletableFuture<Boolean> requestConsent(
            final Origin origin,
            final Capability capability,
            final ApprovalKind kind,
            final Map<String, Object> payload) {
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(capability, "capability");
        return enqueue(origin, EnumSet.of(capability), kind, payload, null, false);
    }

    private CompletableFuture<Boolean> enqueue(
            final Origin origin,
            final Set<Capability> requested,
            final ApprovalKind kind,
            final Map<String, Object> payload,
            final @Nullable String address,
            final boolean remember) {
        final ApprovalRequest request = new ApprovalRequest(
                UUID.randomUUID().toString(), origin, kind, requested, payload, scheduler.now());
        final Pending entry = new Pending(request, address, remember, sequence.getAndIncrement());
        pending.put(request.id(), entry);
        entry.timeout = scheduler.schedule(() -> expire(request.id()), config.approvalTimeout());
        try {
            channel.publish(request);
        } catch (RuntimeException e) {
            if (pending.remove(request.id(), entry)) {
                entry.timeout.cancel();
            }
            throw e;
        }
        log.debug("Approval {} pending for {} {}", request.id(), origin, requested);
        return entry.future;
    }

    /**
     * Delivers the user's answer for a pending request. Unknown or already settled ids are
     * logged and ignored.
     *
     * @return whether a pending request was settled
     */
    public boolean resolve(final String requestId, final boolean granted) {
        final Pending entry = pending.remove(requestId);
        if (entry == null) {
            log.warn("Approval request {} not found", requestId);
            return false;
        }
        entry.timeout.cancel();
        if (granted && entry.remember) {
            try {
                grant(entry.request.origin(), entry.request.capabilities(), entry.address);
            } catch (RuntimeException e) {
                entry.future.completeExceptionally(e);
                throw e;
            }
        } else if (!granted) {
            log.info("User rejected {} for {}", entry.request.capabilities(), entry.request.origin());
        }
        entry.future.complete(granted);
        return true;
    }

    /**
     * Resolves the oldest pending request of {@code origin}, for callers that did not keep the
     * request id.
     *
     * @return the id of the settled request, or empty when the origin has none pending
     */
    public Optional<String> resolveOldest(final Origin origin, final boolean granted) {
        while (true) {
            final Optional<Pending> oldest = pending.values().stream()
                    .filter(p -> p.request.origin().equals(origin))
                    .min(Comparator.comparingLong(p -> p.sequence));
            if (oldest.isEmpty()) {
                return Optional.empty();
            }
            final String id = oldest.get().request.id();
            if (resolve(id, granted)) {
                return Optional.of(id);
            }
        }
    }

    /**
     * Pending requests in arrival order, optionally only those of {@code origin}.
     */
    public List<ApprovalRequest> pendingRequests(final @Nullable Origin origin) {
        return pending.values().stream()
                .filter(p -> origin == null || p.request.origin().equals(origin))
                .sorted(Comparator.comparingLong(p -> p.sequence))
                .map(p -> p.request)
                .toList();
    }

    public List<ApprovalRequest> pendingRequests() {
        return pendingRequests(null);
    }

    /**
     * Fails every pending request with a {@link PermissionDeniedException}.
     */
    @Override
    public void close() {
        for (String id : List.copyOf(pending.keySet())) {
            final Pending entry = pending.remove(id);
            if (entry == null) {
                continue;
            }
            entry.timeout.cancel();
            channel.withdraw(id);
            entry.future.completeExceptionally(new PermissionDeniedException(
                    entry.request.origin().value(), "Wallet closed before the request was answered"));
        }
    }

    private void expire(final String requestId) {
        final Pending entry = pending.remove(requestId);
        if (entry == null) {
            return;
        }
        log.info("Approval {} for {} timed out", requestId, entry.request.origin());
        channel.withdraw(requestId);
        entry.future.completeExceptionally(new ApprovalTimeoutException(requestId, config.approvalTimeout()));
    }

    /**
     * Writes {@code next} through to the store, then makes it the live table. A failed write
     * leaves the live table untouched.
     */
    private void commit(final Map<String, SitePermission> next) {
        store.save(next.values());
        sites.clear();
        sites.putAll(next);
    }

    private static final class Pending {
        final ApprovalRequest request;
        final @Nullable String address;
        final boolean remember;
        final long sequence;
        final CompletableFuture<Boolean> future = new CompletableFuture<>();
        volatile ScheduledTask timeout = ScheduledTask.NONE;

        Pending(final ApprovalRequest request, final @Nullable String address, final boolean remember,
                final long sequence) {
            this.request = request;
            this.address = address;
            this.remember = remember;
            this.sequence = sequence;
        }
    }
}
