package com.renflow.renflow_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.renflow.renflow_backend.model.domain.PortDirection;

public record PortDto(
    String id,
    @JsonProperty("node_id") @JsonAlias("blockId") String nodeId,
    String name,
    PortDirection direction
) {}
