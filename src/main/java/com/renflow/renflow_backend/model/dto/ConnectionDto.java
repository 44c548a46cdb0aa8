package com.renflow.renflow_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

public record ConnectionDto(
    String id,
    @JsonProperty("from_port_id") @JsonAlias("fromPortId") String fromPortId,
    @JsonProperty("to_port_id") @JsonAlias("toPortId") String toPortId
) {}
