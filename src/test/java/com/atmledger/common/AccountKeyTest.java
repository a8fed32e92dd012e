package com.atmledger.common;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AccountKeyTest {

    @Test
    void testValueSemanticsAsMapKey() {
        Map<AccountKey, String> owners = new HashMap<>();
        owners.put(AccountKey.of(12345678L, 1234), "Sam Sepiol");

        assertEquals("Sam Sepiol", owners.get(AccountKey.of(12345678L, 1234)));
        assertNull(owners.get(AccountKey.of(12345678L, 4321)));
        assertNull(owners.get(AccountKey.of(87654321L, 1234)));
    }

    @Test
    void testNegativePartsRejected() {
        assertThrows(IllegalArgumentException.class, () -> AccountKey.of(-1L, 1234));
        assertThrows(IllegalArgumentException.class, () -> AccountKey.of(12345678L, -1));
    }

    @Test
    void testToStringHidesPin() {
        String text = AccountKey.of(12345678L, 9876).toString();

        assertTrue(text.contains("12345678"));
        assertFalse(text.contains("9876"));
    }
}
