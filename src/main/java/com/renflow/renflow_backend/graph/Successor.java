package com.renflow.renflow_backend.graph;

/**
 * One outgoing edge in the forward map.
 *
 * @param blockId  destination block
 * @param distance canvas distance between the two blocks, the tie-break for parallel edges
 * @param portName name of the source port the edge leaves from ("out", "true", "false", "loop")
 */
public record Successor(String blockId, double distance, String portName) {
}
