package com.renflow.renflow_backend.emitter;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ScriptTextTest {

    @Test
    void literalPassesPythonValuesThrough() {
        assertThat(ScriptText.literal("10")).isEqualTo("10");
        assertThat(ScriptText.literal("-3.5")).isEqualTo("-3.5");
        assertThat(ScriptText.literal("1e3")).isEqualTo("1e3");
        assertThat(ScriptText.literal("True")).isEqualTo("True");
        assertThat(ScriptText.literal("None")).isEqualTo("None");
        assertThat(ScriptText.literal("\"already\"")).isEqualTo("\"already\"");
        assertThat(ScriptText.literal("[1, 2]")).isEqualTo("[1, 2]");
        assertThat(ScriptText.literal("{'a': 1}")).isEqualTo("{'a': 1}");
    }

    @Test
    void literalQuotesEverythingElse() {
        assertThat(ScriptText.literal("hello")).isEqualTo("\"hello\"");
        assertThat(ScriptText.literal("true")).isEqualTo("\"true\"");
        assertThat(ScriptText.literal("say \"hi\"")).isEqualTo("\"say \\\"hi\\\"\"");
        assertThat(ScriptText.literal("")).isEqualTo("\"\"");
        assertThat(ScriptText.literal(null)).isEqualTo("\"\"");
    }

    @Test
    void characterDefinitionEscapesSingleQuotes() {
        assertThat(ScriptText.characterDefinition("", "Jane", " Jane's "))
                .isEqualTo("define Jane = Character('Jane\\'s')\n");
        assertThat(ScriptText.characterDefinition("", "narrator", " "))
                .isEqualTo("define narrator = Character(None)\n");
    }
}
