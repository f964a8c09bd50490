package com.fleetload.core.util;

import com.fleetload.core.model.LoadSnapshot;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonUtilsTest {

    @Test
    void testSnapshotSerializesAllFields() {
        LoadSnapshot snapshot = LoadSnapshot.builder()
            .loadAverage(0.25)
            .loadStdDev(0.05)
            .endpointCount(1)
            .endpointLoads(Map.of("worker-1", 0.25))
            .collectedAtMs(42L)
            .build();

        Map<?, ?> json = JsonUtils.readValue(JsonUtils.writeValueAsString(snapshot), Map.class);

        assertEquals(0.25, json.get("loadAverage"));
        assertEquals(0.05, json.get("loadStdDev"));
        assertEquals(1, json.get("endpointCount"));
        assertEquals(Map.of("worker-1", 0.25), json.get("endpointLoads"));
        assertEquals(42, json.get("collectedAtMs"));
    }

    @Test
    void testMalformedJsonIsRejected() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
            () -> JsonUtils.readValue("{not json", Map.class));

        assertNotNull(error.getCause());
    }
}
