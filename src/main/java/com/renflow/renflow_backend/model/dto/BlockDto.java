package com.renflow.renflow_backend.model.dto;

import com.renflow.renflow_backend.model.domain.BlockType;

import java.util.Map;

public record BlockDto(
    String id,
    BlockType type,
    Map<String, Object> params,
    Double x,
    Double y
) {}
