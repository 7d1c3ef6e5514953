// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.core.types;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.EnumSet;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

class CapabilityTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void usesCamelCaseWireNames() throws Exception {
        assertEquals("\"viewKey\"", mapper.writeValueAsString(Capability.VIEW_KEY));

        final Set<Capability> parsed = mapper.readValue("[\"connect\",\"viewKey\",\"DECRYPT\"]",
                new TypeReference<Set<Capability>>() {});

        assertEquals(EnumSet.of(Capability.CONNECT, Capability.VIEW_KEY, Capability.DECRYPT), parsed);
    }

    @Test
    void rejectsUnknownName() {
        assertThrows(IllegalArgumentException.class, () -> Capability.fromWireName("teleport"));
    }
}
