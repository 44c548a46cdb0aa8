package com.renflow.renflow_backend.service;

import com.renflow.renflow_backend.SceneBuilder;
import com.renflow.renflow_backend.emitter.EmitterFixtures;
import com.renflow.renflow_backend.engine.DefinitionCollector;
import com.renflow.renflow_backend.engine.LabelCollector;
import com.renflow.renflow_backend.engine.SceneRenderer;
import com.renflow.renflow_backend.engine.ScriptAssembler;
import com.renflow.renflow_backend.engine.ScriptFormat;
import com.renflow.renflow_backend.graph.ConnectionIndexBuilder;
import com.renflow.renflow_backend.model.domain.BlockType;
import com.renflow.renflow_backend.model.domain.Project;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ScriptGenerationServiceTest {

    private final ScriptGenerationService service = new ScriptGenerationService(new ScriptAssembler(
            ScriptFormat.defaults(), new DefinitionCollector(), new LabelCollector(),
            new SceneRenderer(new ConnectionIndexBuilder(), EmitterFixtures.registry())));

    @Test
    void missingProjectYieldsNothing() {
        assertThat(service.generate(null)).isEmpty();
        assertThat(service.generateDefinitions(null)).isEmpty();
    }

    @Test
    void projectWithoutScenesYieldsEmptyScript() {
        assertThat(service.generate(new Project("Empty"))).contains("");
    }

    @Test
    void generatesScriptWithoutTouchingTheProject() {
        Project project = new Project("Demo");
        project.addScene(SceneBuilder.scene("s1", "intro")
                .block("start", BlockType.START, 0, 0, Map.of("label", "intro"))
                .block("say", BlockType.SAY, 0, 100, Map.of("who", "Eileen", "text", "Hi"))
                .connect("start", "say")
                .build());
        String before = project.toString();

        assertThat(service.generate(project)).hasValueSatisfying(script ->
                assertThat(script).contains("label intro:\n    Eileen \"Hi\"\n"));
        assertThat(project.toString()).isEqualTo(before);
        assertThat(project.getCharacters()).isEmpty();
    }
}
