package com.renflow.renflow_backend.model.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Port {

    private String id;

    // Owning block, referenced by id
    private String blockId;

    // "in", "out", "true", "false", "loop"
    private String name;

    private PortDirection direction;
}
