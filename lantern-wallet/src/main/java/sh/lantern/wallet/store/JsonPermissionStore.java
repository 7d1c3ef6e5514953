// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.wallet.store;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;

import sh.lantern.core.model.SitePermission;

/**
 * {@link PermissionStore} backed by {@code permissions.json}, a {@code sites} object keyed by
 * origin.
 */
public final class JsonPermissionStore implements PermissionStore {

    private static final TypeReference<Document> TYPE = new TypeReference<>() {};

    private final Path file;

    public JsonPermissionStore(final Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    @Override
    public synchronized List<SitePermission> load() {
        return JsonFiles.read(file, TYPE)
                .map(doc -> doc.sites() == null
                        ? List.<SitePermission>of()
                        : List.copyOf(doc.sites().values()))
                .orElse(List.of());
    }

    @Override
    public synchronized void save(final Collection<SitePermission> sites) {
        final Map<String, SitePermission> byOrigin = new LinkedHashMap<>();
        for (SitePermission site : new ArrayList<>(sites)) {
            byOrigin.put(site.origin(), site);
        }
        JsonFiles.write(file, new Document(byOrigin));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Document(Map<String, SitePermission> sites) {
    }
}
