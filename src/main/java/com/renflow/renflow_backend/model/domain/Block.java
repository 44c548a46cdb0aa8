package com.renflow.renflow_backend.model.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Block {

    private String id;

    private BlockType type;

    // Loosely typed editor values: strings, numbers, booleans, lists of choice maps
    @Builder.Default
    private Map<String, Object> params = new LinkedHashMap<>();

    // Canvas position, only used to order blocks the graph does not order
    private double x;
    private double y;

    public double distanceTo(Block other) {
        return Math.hypot(other.x - x, other.y - y);
    }
}
