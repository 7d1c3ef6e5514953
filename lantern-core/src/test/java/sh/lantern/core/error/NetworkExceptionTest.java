// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.error;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NetworkExceptionTest {

    @Test
    void prefixesMessageWithRequestId() {
        final NetworkException ex = new NetworkException(-32000, "boom", null, 7L);

        assertEquals("[requestId=7] boom", ex.getMessage());
        assertEquals(7L, ex.requestId());
    }

    @Test
    void classifiesNotFoundAndInsufficientBalance() {
        assertTrue(new NetworkException(NetworkException.NOT_FOUND, "Transaction not found", null, null).isNotFound());
        assertTrue(new NetworkException(-32000, "Insufficient balance for fee", null, null).isInsufficientBalance());
        assertFalse(new NetworkException(-32000, "timeout", null, null).isNotFound());
    }

    @Test
    void subclassesShareTheSealedRoot() {
        assertInstanceOf(LanternException.class, new NotConnectedException("https://app.example"));
        assertInstanceOf(PermissionDeniedException.class, new NotConnectedException("https://app.example"));
        assertInstanceOf(ValidationException.class, new WalletExistsException());
        assertInstanceOf(AuthenticationException.class, new InvalidPasswordException());
    }
}
