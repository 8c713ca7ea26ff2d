package com.vpnbot.api.vpn;

import lombok.val;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PanelUsernameGeneratorTest {

    @Test
    void generate() {
        val generator = new PanelUsernameGenerator("test-secret");
        val first = generator.generate(42, 1);
        assertTrue(first.matches("u42_[0-9a-f]{8}"), first);
        assertEquals(first, generator.generate(42, 1));
        assertEquals(first + "_2", generator.generate(42, 2));
        assertNotEquals(first, generator.generate(43, 1).replace("u43_", "u42_"));
    }

    @Test
    void generate_withDifferentSecrets() {
        val a = new PanelUsernameGenerator("secret-a").generate(42, 1);
        val b = new PanelUsernameGenerator("secret-b").generate(42, 1);
        assertNotEquals(a, b);
    }

    @Test
    void generate_withInvalidAttempt() {
        val generator = new PanelUsernameGenerator("test-secret");
        assertThrows(IllegalArgumentException.class, () -> generator.generate(42, 0));
    }
}
