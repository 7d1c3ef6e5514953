// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.wallet.store;

import java.util.Collection;
import java.util.List;

import sh.lantern.core.model.SitePermission;

/**
 * Persistence for the per-origin capability grants. {@link #save} replaces the whole table.
 */
public interface PermissionStore {

    List<SitePermission> load();

    void save(Collection<SitePermission> sites);
}
