package com.renflow.renflow_backend.model.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CharacterProfile {

    // Name shown in the say window; blank renders Character(None)
    private String displayName;
}
