package com.ableclub.monitor.events.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventKeysTest {

    @Test
    void idIgnoresCaseAndWhitespaceNoise() {
        String first = EventKeys.externalId("  Edge AI   Summit ", "2026/03/01");
        String second = EventKeys.externalId("edge ai summit", "2026/03/01 ");

        assertEquals(first, second);
        assertEquals(64, first.length());
        assertTrue(first.matches("[0-9a-f]+"));
    }

    @Test
    void sameTitleOnDifferentDateIsDifferentEvent() {
        assertNotEquals(
            EventKeys.externalId("Edge AI Summit", "2026/03/01"),
            EventKeys.externalId("Edge AI Summit", "2026/09/01")
        );
    }

    @Test
    void missingDateStillProducesStableId() {
        assertEquals(EventKeys.externalId("Webinar", null), EventKeys.externalId("Webinar", null));
    }
}
