package com.example.quorum.agent;

import com.example.quorum.model.TaskSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Chooses which agents answer a given attempt of a task.
 *
 * <p>If the task spec carries a {@value #ROLE_ATTRIBUTE} attribute and the pool has agents of that
 * role, only those are eligible. Agents are taken round-robin from an offset derived from the task id,
 * so independent tasks spread across the pool; fan-outs larger than the pool repeat agents.
 */
public class AgentSelector {

    public static final String ROLE_ATTRIBUTE = "role";

    private final List<Agent> agents;
    private final AgentSelection selection;

    public AgentSelector(List<Agent> agents, AgentSelection selection) {
        if (agents == null || agents.isEmpty()) {
            throw new IllegalArgumentException("Agent pool must not be empty");
        }
        this.agents = List.copyOf(agents);
        this.selection = selection != null ? selection : AgentSelection.ROTATE;
    }

    /**
     * @param attempt 1-based attempt number
     * @param count number of agents required
     */
    public List<Agent> select(String taskId, TaskSpec spec, int attempt, int count) {
        List<Agent> eligible = eligibleFor(spec);
        int size = eligible.size();
        int base = Math.floorMod(taskId.hashCode(), size);
        int shift = selection == AgentSelection.ROTATE ? (attempt - 1) * count : 0;

        List<Agent> chosen = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            chosen.add(eligible.get(Math.floorMod(base + shift + i, size)));
        }
        return chosen;
    }

    public List<Agent> getAgents() {
        return agents;
    }

    public AgentSelection getSelection() {
        return selection;
    }

    private List<Agent> eligibleFor(TaskSpec spec) {
        String requested = spec != null ? spec.getAttributes().get(ROLE_ATTRIBUTE) : null;
        if (requested == null) {
            return agents;
        }
        List<Agent> matching = agents.stream()
            .filter(agent -> agent.getRole() != null && agent.getRole().name().equalsIgnoreCase(requested))
            .collect(Collectors.toList());
        return matching.isEmpty() ? agents : matching;
    }
}
