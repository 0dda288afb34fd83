package io.cortexr.config;

import io.cortexr.tool.ServerDescriptor;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CortexPropertiesTest {

    @Test
    void shouldApplyDefaults() {
        var props = new CortexProperties(null, null, null, null);

        assertTrue(props.toolServers().isEmpty());
        assertEquals("conservative", props.strategy().planningMode());
        assertEquals(3, props.strategy().maxSteps());
        assertEquals(3, props.strategy().maxLifelinesPerStep());
        assertFalse(props.strategy().memoryFallbackEnabled());
        assertEquals(5, props.sandbox().maxToolCalls());
        assertEquals(2, props.memory().injectionMaxResults());
        assertEquals(300.0, props.memory().injectionDistanceThreshold());
        assertEquals(5, props.memory().refreshIntervalMinutes());
        assertTrue(props.memory().refreshEnabled());
    }

    @Test
    void shouldRecognizeExploratoryMode() {
        assertTrue(new CortexProperties.Strategy("Exploratory", null, null, null).isExploratory());
        assertFalse(new CortexProperties.Strategy("conservative", null, null, null).isExploratory());
    }

    @Test
    void shouldRejectInvalidStrategy() {
        assertThrows(IllegalArgumentException.class, () -> new CortexProperties.Strategy(null, 0, null, null));
        assertThrows(IllegalArgumentException.class, () -> new CortexProperties.Strategy(null, null, -1, null));
    }

    @Test
    void shouldDefaultServerDescriptor() {
        var server = new ServerDescriptor("math", "python", null, null, null);
        var props = new CortexProperties(List.of(server), null, null, null);

        ServerDescriptor bound = props.toolServers().get(0);
        assertTrue(bound.isEnabled());
        assertEquals(30, bound.requestTimeoutSeconds());
        assertTrue(bound.args().isEmpty());
        assertTrue(bound.env().isEmpty());
        assertEquals("", bound.description());
    }
}
