package org.boxworld.pddl.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Renders a {@link PlanResult} as JSON: {@code {"plan": [{"action": ["arg", ...]}, ...], "cost": N}},
 * with a null cost when the planner did not report one.
 */
public class PlanResultWriter {
    private final ObjectMapper mapper;

    public PlanResultWriter() {
        this(new ObjectMapper());
    }

    public PlanResultWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectNode toJson(PlanResult result) {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode plan = root.putArray("plan");
        for (PlanStep step : result.getSteps()) {
            ArrayNode arguments = plan.addObject().putArray(step.getAction());
            step.getArguments().forEach(arguments::add);
        }
        if (result.getCost().isPresent()) {
            root.put("cost", result.getCost().getAsLong());
        } else {
            root.putNull("cost");
        }
        return root;
    }

    public String write(PlanResult result) throws JsonProcessingException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(result));
    }
}
