package com.gridcast.core.graph;

import com.gridcast.core.model.AgentPhase;
import com.gridcast.core.state.AgentGraphState;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} for the agent decision cycle.
 * <p>
 * One node per {@link AgentPhase}. Every node returns the phase it moved the session to, and the
 * conditional edges only map the successors that phase may legally reach:
 * <pre>
 *   START -> perceive -> reason -> [route]
 *            -> done -> END
 *            -> failed -> END  (oracle gave up)
 *            -> plan -> [route]
 *               -> reason  (plan rejected)
 *               -> act -> reflect -> [route]
 *                  -> done -> END
 *                  -> adapt -> [route]
 *                     -> reason  (next iteration)
 *                     -> failed -> END  (iteration cap)
 * </pre>
 * Any non-terminal node may also route to {@code failed}, which is how aborts end a session.
 * The recursion limit is the hard ceiling on the number of steps.
 */
public class AgentGraph {

    private static final Logger log = LoggerFactory.getLogger(AgentGraph.class);

    /**
     * Runs one phase for the session named by the state and returns the state update.
     */
    @FunctionalInterface
    public interface PhaseNode {
        Map<String, Object> apply(AgentPhase phase, AgentGraphState state);
    }

    private final CompiledGraph<AgentGraphState> compiledGraph;
    private final int recursionLimit;

    public AgentGraph(PhaseNode phases, int recursionLimit) throws GraphStateException {
        String perceive = node(AgentPhase.PERCEIVE);
        String reason = node(AgentPhase.REASON);
        String plan = node(AgentPhase.PLAN);
        String act = node(AgentPhase.ACT);
        String reflect = node(AgentPhase.REFLECT);
        String adapt = node(AgentPhase.ADAPT);
        String done = node(AgentPhase.DONE);
        String failed = node(AgentPhase.FAILED);

        var graph = new StateGraph<>(AgentGraphState.SCHEMA, AgentGraphState::new)
                .addNode(perceive, node_async(state -> phases.apply(AgentPhase.PERCEIVE, state)))
                .addNode(reason, node_async(state -> phases.apply(AgentPhase.REASON, state)))
                .addNode(plan, node_async(state -> phases.apply(AgentPhase.PLAN, state)))
                .addNode(act, node_async(state -> phases.apply(AgentPhase.ACT, state)))
                .addNode(reflect, node_async(state -> phases.apply(AgentPhase.REFLECT, state)))
                .addNode(adapt, node_async(state -> phases.apply(AgentPhase.ADAPT, state)))
                .addNode(done, node_async(state -> Map.of("phase", AgentPhase.DONE.name())))
                .addNode(failed, node_async(state -> Map.of("phase", AgentPhase.FAILED.name())))
                .addEdge(START, perceive)
                .addConditionalEdges(perceive,
                        edge_async(this::route),
                        Map.of(reason, reason, failed, failed))
                .addConditionalEdges(reason,
                        edge_async(this::route),
                        Map.of(plan, plan, done, done, failed, failed))
                .addConditionalEdges(plan,
                        edge_async(this::route),
                        Map.of(act, act, reason, reason, failed, failed))
                .addConditionalEdges(act,
                        edge_async(this::route),
                        Map.of(reflect, reflect, failed, failed))
                .addConditionalEdges(reflect,
                        edge_async(this::route),
                        Map.of(done, done, adapt, adapt, failed, failed))
                .addConditionalEdges(adapt,
                        edge_async(this::route),
                        Map.of(reason, reason, failed, failed))
                .addEdge(done, END)
                .addEdge(failed, END);

        this.recursionLimit = recursionLimit;
        this.compiledGraph = graph.compile(CompileConfig.builder()
                .recursionLimit(recursionLimit)
                .build());
        log.info("Agent graph compiled with a recursion limit of {}", recursionLimit);
    }

    /**
     * Node id of a phase.
     */
    public static String node(AgentPhase phase) {
        return phase.name().toLowerCase(Locale.ROOT);
    }

    /**
     * Follows the phase the node moved the session to. Targets missing from a node's edge
     * mapping are rejected by the graph.
     */
    String route(AgentGraphState state) {
        return node(state.phase());
    }

    public CompiledGraph<AgentGraphState> getCompiledGraph() {
        return compiledGraph;
    }

    public int recursionLimit() {
        return recursionLimit;
    }
}
