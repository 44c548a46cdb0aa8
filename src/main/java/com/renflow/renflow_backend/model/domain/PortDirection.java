package com.renflow.renflow_backend.model.domain;

public enum PortDirection {
    INPUT,
    OUTPUT
}
