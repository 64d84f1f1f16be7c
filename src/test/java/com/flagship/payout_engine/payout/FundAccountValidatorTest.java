package com.flagship.payout_engine.payout;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FundAccountValidatorTest {

    @Test
    @DisplayName("Indian mobile numbers normalise to +91 form")
    void testPhoneNormalisation() {
        assertEquals("+919876543210", FundAccountValidator.phone("9876543210"));
        assertEquals("+919876543210", FundAccountValidator.phone("09876543210"));
        assertEquals("+919876543210", FundAccountValidator.phone("919876543210"));
        assertEquals("+919876543210", FundAccountValidator.phone("+91 98765-43210"));
        assertNull(FundAccountValidator.phone("  "));

        assertThrows(IllegalArgumentException.class, () -> FundAccountValidator.phone("5876543210"));
        assertThrows(IllegalArgumentException.class, () -> FundAccountValidator.phone("+1 415 555 0100"));
    }

    @Test
    @DisplayName("IFSC is uppercased and must have a zero in the fifth position")
    void testIfsc() {
        assertEquals("HDFC0001234", FundAccountValidator.ifsc(" hdfc0001234 "));

        assertThrows(IllegalArgumentException.class, () -> FundAccountValidator.ifsc("HDFC1001234"));
        assertThrows(IllegalArgumentException.class, () -> FundAccountValidator.ifsc("HDF0001234"));
        assertThrows(IllegalArgumentException.class, () -> FundAccountValidator.ifsc(null));
    }

    @Test
    @DisplayName("Account numbers are 9 to 18 digits, spaces ignored")
    void testAccountNumber() {
        assertEquals("123456789012", FundAccountValidator.accountNumber("1234 5678 9012"));

        assertThrows(IllegalArgumentException.class, () -> FundAccountValidator.accountNumber("12345678"));
        assertThrows(IllegalArgumentException.class, () -> FundAccountValidator.accountNumber("1234567890123456789"));
        assertThrows(IllegalArgumentException.class, () -> FundAccountValidator.accountNumber("12345678A0"));
    }

    @Test
    @DisplayName("UPI addresses need a handle and a provider of at most 40 characters in total")
    void testVpa() {
        assertEquals("asha.rao@okhdfc", FundAccountValidator.vpa(" asha.rao@okhdfc "));
        assertEquals("98765-43210@ybl", FundAccountValidator.vpa("98765-43210@ybl"));

        assertThrows(IllegalArgumentException.class, () -> FundAccountValidator.vpa("asha.rao"));
        assertThrows(IllegalArgumentException.class, () -> FundAccountValidator.vpa("ab@okhdfc"));
        assertThrows(IllegalArgumentException.class, () -> FundAccountValidator.vpa("asha@1bank"));
        assertThrows(IllegalArgumentException.class,
                () -> FundAccountValidator.vpa("a".repeat(35) + "@okhdfc"));
    }

    @Test
    @DisplayName("Holder name is required and trimmed")
    void testHolderName() {
        assertEquals("Asha Rao", FundAccountValidator.holderName("  Asha Rao "));
        assertThrows(IllegalArgumentException.class, () -> FundAccountValidator.holderName(" "));
        assertThrows(IllegalArgumentException.class, () -> FundAccountValidator.holderName("x".repeat(121)));
    }
}
