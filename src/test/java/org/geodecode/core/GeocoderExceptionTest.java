package org.geodecode.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("GeocoderException Tests")
class GeocoderExceptionTest {

    @Test
    @DisplayName("Three-arg constructor preserves reason code, message prefix, and cause")
    void testThreeArgConstructor() {
        IllegalStateException cause = new IllegalStateException("boom");
        GeocoderException ex = new GeocoderException(
                GeocoderException.REASON_INDEX_INCONSISTENT,
                "details",
                cause
        );

        assertEquals(GeocoderException.REASON_INDEX_INCONSISTENT, ex.reasonCode());
        assertTrue(ex.getMessage().startsWith("[INDEX_INCONSISTENT] details"));
        assertSame(cause, ex.getCause());
    }

    @Test
    @DisplayName("Blank or null reason code is rejected deterministically")
    void testBlankReasonCodeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new GeocoderException(" ", "details"));
        assertThrows(NullPointerException.class, () -> new GeocoderException(null, "details"));
        assertThrows(NullPointerException.class, () -> new GeocoderException("REASON", null));
    }
}
