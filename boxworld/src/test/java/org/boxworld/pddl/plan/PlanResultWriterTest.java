package org.boxworld.pddl.plan;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlanResultWriterTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void writesStepsAsSingleKeyObjects() throws Exception {
        PlanResult result = new PlanResult(List.of(
            new PlanStep("unstack", List.of("b1", "l1")),
            new PlanStep("noop", List.of())), 7L);

        JsonNode json = mapper.readTree(new PlanResultWriter(mapper).write(result));

        assertEquals(mapper.readTree("{\"plan\": [{\"unstack\": [\"b1\", \"l1\"]}, {\"noop\": []}], \"cost\": 7}"),
            json);
    }

    @Test
    void missingCostIsNull() {
        PlanResult result = new PlanResult(List.of(), null);

        JsonNode json = new PlanResultWriter().toJson(result);

        assertTrue(json.get("cost").isNull());
        assertEquals(0, json.get("plan").size());
    }

    @Test
    void negativeCostIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new PlanResult(List.of(), -1L));
    }
}
