package com.renflow.renflow_backend.engine;

import com.renflow.renflow_backend.emitter.BlockEmitter;
import com.renflow.renflow_backend.emitter.BlockEmitterRegistry;
import com.renflow.renflow_backend.emitter.BranchEmitter;
import com.renflow.renflow_backend.emitter.RenderContext;
import com.renflow.renflow_backend.emitter.ScriptText;
import com.renflow.renflow_backend.graph.ConnectionIndex;
import com.renflow.renflow_backend.graph.ConnectionIndexBuilder;
import com.renflow.renflow_backend.graph.Successor;
import com.renflow.renflow_backend.model.domain.Block;
import com.renflow.renflow_backend.model.domain.BlockType;
import com.renflow.renflow_backend.model.domain.Scene;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Linearizes one scene graph into script lines.
 *
 * Traversal starts from the scene's start blocks and follows connections depth first:
 * <ul>
 *   <li>every block is emitted at most once; a block already visited is skipped, which also cuts cycles</li>
 *   <li>a merge point (two or more predecessors) waits until all its forward predecessors are visited</li>
 *   <li>if/while/for render the chains behind their outputs as nested bodies, each body on its own
 *       copy of the visited set; sequential successors share the caller's set</li>
 * </ul>
 * Blocks the traversal never reaches are emitted afterwards at the base indent, top to bottom.
 * Without any start block the whole scene is emitted in dependency order instead.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SceneRenderer {

    private final ConnectionIndexBuilder indexBuilder;
    private final BlockEmitterRegistry emitterRegistry;

    public String render(Scene scene, RenderContext context) {
        RenderContext sceneContext = context.forScene(scene);
        StringBuilder out = new StringBuilder();

        if (scene.getBlocks().isEmpty()) {
            out.append(ScriptText.line(ScriptText.INDENT, ScriptText.PASS));
            out.append("\n");
            return out.toString();
        }

        ConnectionIndex index = indexBuilder.build(scene);
        Traversal traversal = new Traversal(index, sceneContext);

        if (index.getStartBlocks().isEmpty()) {
            // Every block sits on a cycle: no entry into the graph, fall back to canvas layout
            log.debug("Scene {} has no start block, emitting {} blocks in layout order", scene.getId(), scene.getBlocks().size());
            for (Block block : index.topologicalOrder()) {
                if (!block.getType().isDefinitionOnly()) {
                    out.append(traversal.emitStandalone(block, ScriptText.INDENT));
                }
            }
        } else {
            Set<String> visited = new HashSet<>();
            for (Block start : index.getStartBlocks()) {
                out.append(traversal.chain(start.getId(), visited, ScriptText.INDENT));
            }
            out.append(traversal.resumeDeferred(visited, ScriptText.INDENT));
            // Only blocks the index kept: a malformed or duplicate id is never emitted
            List<Block> leftovers = scene.getBlocks().stream()
                    .filter(b -> index.block(b.getId()) == b)
                    .filter(b -> !traversal.isRendered(b.getId()) && !b.getType().isDefinitionOnly())
                    .sorted(ConnectionIndex.CANVAS_ORDER)
                    .toList();
            for (Block block : leftovers) {
                log.debug("Block {} ({}) is not reachable from a start block in scene {}", block.getId(), block.getType(), scene.getId());
                out.append(traversal.emitStandalone(block, ScriptText.INDENT));
            }
        }

        out.append("\n");
        return out.toString();
    }

    /**
     * Bookkeeping for one scene: which blocks have been emitted anywhere, and which merge points
     * are still waiting for a predecessor.
     */
    private final class Traversal {

        private final ConnectionIndex index;
        private final RenderContext context;
        private final Set<String> reachable;
        private final Set<String> rendered = new HashSet<>();
        private final Set<String> deferred = new LinkedHashSet<>();

        Traversal(ConnectionIndex index, RenderContext context) {
            this.index = index;
            this.context = context;
            this.reachable = index.reachableFromStart();
        }

        boolean isRendered(String blockId) {
            return rendered.contains(blockId);
        }

        String chain(String blockId, Set<String> visited, String indent) {
            if (visited.contains(blockId)) return "";
            Block block = index.block(blockId);
            if (block == null) return "";

            if (waitsForPredecessor(blockId, visited)) {
                deferred.add(blockId);
                return "";
            }
            visited.add(blockId);
            rendered.add(blockId);
            deferred.remove(blockId);

            BlockEmitter emitter = emitterRegistry.get(block.getType());
            if (block.getType().isBranching() && emitter instanceof BranchEmitter branch && branch.isComplete(block)) {
                return branch(block, branch, visited, indent);
            }

            StringBuilder out = new StringBuilder();
            if (!block.getType().isDefinitionOnly()) {
                out.append(emitter.emit(block, indent, context));
            }
            for (Successor next : index.successors(blockId)) {
                out.append(chain(next.blockId(), visited, indent));
            }
            return out.toString();
        }

        private String branch(Block block, BranchEmitter emitter, Set<String> visited, String indent) {
            String nested = indent + ScriptText.INDENT;
            List<String> targets = index.branchTargets(block.getId());
            int bodies = block.getType() == BlockType.IF ? 2 : 1;

            List<String> renderedBodies = new ArrayList<>();
            List<Set<String>> bodyVisits = new ArrayList<>();
            for (int i = 0; i < bodies; i++) {
                if (i < targets.size()) {
                    Set<String> bodyVisited = new HashSet<>(visited);
                    renderedBodies.add(chain(targets.get(i), bodyVisited, nested));
                    bodyVisits.add(bodyVisited);
                } else {
                    renderedBodies.add(null);
                }
            }

            StringBuilder out = new StringBuilder(emitter.emit(block, indent, context,
                    renderedBodies.get(0), bodies > 1 ? renderedBodies.get(1) : null));

            // Bodies have rejoined: whatever they visited is behind us now
            bodyVisits.forEach(visited::addAll);
            out.append(resumeDeferred(visited, indent));
            return out.toString();
        }

        // Merge points whose last predecessor was rendered inside a body continue after the construct
        String resumeDeferred(Set<String> visited, String indent) {
            StringBuilder out = new StringBuilder();
            boolean progressed = true;
            while (progressed) {
                progressed = false;
                for (String blockId : new ArrayList<>(deferred)) {
                    if (visited.contains(blockId)) {
                        deferred.remove(blockId);
                    } else if (!waitsForPredecessor(blockId, visited)) {
                        out.append(chain(blockId, visited, indent));
                        progressed = true;
                    }
                }
            }
            return out.toString();
        }

        /*
         * A predecessor the block can reach itself is a loop back edge, not a branch that has to
         * finish first. A predecessor no start block leads to is never visited. Neither holds the block back.
         */
        private boolean waitsForPredecessor(String blockId, Set<String> visited) {
            Set<String> predecessors = index.predecessors(blockId);
            if (predecessors.size() < 2) return false;
            for (String predecessor : predecessors) {
                if (visited.contains(predecessor) || predecessor.equals(blockId)) continue;
                if (!reachable.contains(predecessor)) continue;
                if (index.isReachable(blockId, predecessor)) continue;
                return true;
            }
            return false;
        }

        String emitStandalone(Block block, String indent) {
            return emitterRegistry.get(block.getType()).emit(block, indent, context);
        }
    }
}
