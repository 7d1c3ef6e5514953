// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.chain;

import java.util.Objects;

import sh.lantern.core.crypto.SecretBuffer;
import sh.lantern.core.types.Address;

/**
 * Public data the blockchain client derives from an imported private key.
 */
public record ImportedAccount(Address address, SecretBuffer viewKey) {

    public ImportedAccount {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(viewKey, "viewKey");
    }
}
