package com.renflow.renflow_backend.model.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Connection {

    private String id;

    private String fromPortId;

    private String toPortId;
}
