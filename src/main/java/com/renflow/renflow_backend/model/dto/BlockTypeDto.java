package com.renflow.renflow_backend.model.dto;

import com.renflow.renflow_backend.model.domain.BlockType;

/**
 * Palette metadata for one block type.
 */
public record BlockTypeDto(
    BlockType type,
    boolean definitionOnly,
    boolean branching,
    boolean hasInputPort
) {
    public static BlockTypeDto of(BlockType type) {
        return new BlockTypeDto(type, type.isDefinitionOnly(), type.isBranching(), type.hasInputPort());
    }
}
