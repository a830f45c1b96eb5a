package com.wayfarer.server.ai;

import com.wayfarer.pojo.dto.TravelerProfileDTO;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IntentGateTest {

    @Test
    void shouldResearch_whenMessageCarriesPlanningIntent() {
        assertTrue(IntentGate.shouldResearch("Can you PLAN something for me?", TravelerProfileDTO.defaults()));
        assertTrue(IntentGate.shouldResearch("I want to travel to Peru", null));
        assertTrue(IntentGate.shouldResearch("thinking about a holiday", null));
    }

    @Test
    void shouldResearch_whenProfileHasDestination() {
        TravelerProfileDTO profile = TravelerProfileDTO.defaults();
        profile.setDestination("Hanoi");

        assertTrue(IntentGate.shouldResearch("I love noodles", profile));
    }

    @Test
    void shouldNotResearch_withoutIntentOrDestination() {
        assertFalse(IntentGate.shouldResearch("I love noodles", TravelerProfileDTO.defaults()));
        assertFalse(IntentGate.shouldResearch("", null));
    }
}
