package com.renflow.renflow_backend.engine;

import com.renflow.renflow_backend.SceneBuilder;
import com.renflow.renflow_backend.emitter.EmitterFixtures;
import com.renflow.renflow_backend.graph.ConnectionIndexBuilder;
import com.renflow.renflow_backend.model.domain.BlockType;
import com.renflow.renflow_backend.model.domain.CharacterProfile;
import com.renflow.renflow_backend.model.domain.Project;
import com.renflow.renflow_backend.model.domain.Scene;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ScriptAssemblerTest {

    private static final String HEADER = """
            # Generated by RenPy Node Editor
            # This file is auto-generated. Do not edit manually.

            """;

    private final ScriptAssembler assembler = assembler(ScriptFormat.defaults());

    private static ScriptAssembler assembler(ScriptFormat format) {
        return new ScriptAssembler(format, new DefinitionCollector(), new LabelCollector(),
                new SceneRenderer(new ConnectionIndexBuilder(), EmitterFixtures.registry()));
    }

    private static Project dialogueProject() {
        Project project = new Project("Demo");
        project.getCharacters().put("Jane Doe", new CharacterProfile("Jane"));
        project.addScene(SceneBuilder.scene("s1", "intro")
                .block("start", BlockType.START, 0, 0, Map.of("label", "intro"))
                .block("say", BlockType.SAY, 0, 100, Map.of("who", "Jane Doe", "text", "Hi"))
                .connect("start", "say")
                .build());
        return project;
    }

    @Test
    void projectWithoutScenesGeneratesNothing() {
        assertThat(assembler.generate(new Project("Empty"))).isEmpty();
    }

    @Test
    void singleDialogue() {
        assertThat(assembler.generate(dialogueProject())).isEqualTo(HEADER + """
                # Character Definitions
                define Jane_Doe = Character('Jane')

                # Entry point
                label start:
                    jump intro

                label intro:
                    Jane_Doe "Hi"

                """);
    }

    @Test
    void generationIsRepeatable() {
        Project project = dialogueProject();

        assertThat(assembler.generate(project)).isEqualTo(assembler.generate(project));
    }

    @Test
    void withoutEntryMarkerTheEntryLabelReturns() {
        Project project = new Project("Loose");
        project.addScene(SceneBuilder.scene("s1", "loose")
                .block("a", BlockType.NARRATION, 0, 0, Map.of("text", "Hello"))
                .build());

        assertThat(assembler.generate(project)).isEqualTo(HEADER + """
                # Entry point
                label start:
                    return

                    "Hello"

                """);
    }

    @Test
    void userLabelNamedStartIsRenamedEverywhere() {
        Project project = new Project("Clash");
        project.addScene(SceneBuilder.scene("s1", "start")
                .block("start", BlockType.START, 0, 0, Map.of("label", "start"))
                .block("jump", BlockType.JUMP, 0, 100, Map.of("target", "start"))
                .connect("start", "jump")
                .build());

        String script = assembler.generate(project);

        assertThat(script).contains("label start:\n    jump start_entry\n");
        assertThat(script).contains("label start_entry:\n    jump start_entry\n");
        assertThat(script).containsOnlyOnce("label start:");
    }

    @Test
    void menuJumpsAcrossScenesAndDropsUnknownTargets() {
        Project project = new Project("Menus");
        project.addScene(SceneBuilder.scene("s1", "intro")
                .block("start", BlockType.START, 0, 0, Map.of("label", "intro"))
                .block("menu", BlockType.MENU, 0, 100, Map.of("choices", List.of(
                        Map.of("text", "Forest", "jump", "forest", "condition", "brave"),
                        Map.of("text", "Cave", "jump", "cave"))))
                .connect("start", "menu")
                .build());
        project.addScene(SceneBuilder.scene("s2", "forest")
                .block("start", BlockType.START, 0, 0)
                .block("say", BlockType.NARRATION, 0, 100, Map.of("text", "Trees."))
                .connect("start", "say")
                .build());

        String script = assembler.generate(project);

        assertThat(script).contains("""
                label intro:
                    menu:
                        "Forest" if brave:
                            jump forest
                        "Cave":
                            pass

                label forest:
                    "Trees."
                """);
        assertThat(script).contains("label start:\n    jump intro\n");
    }

    @Test
    void definitionsAreMergedSortedAndNormalized() {
        Project project = new Project("Stage");
        project.getImages().put("bg room", "images/room.png");
        project.getCharacters().put("Jane Doe", new CharacterProfile("Jane"));
        project.getCharacters().put("Jane-Doe", new CharacterProfile("Impostor"));
        project.addScene(SceneBuilder.scene("s1", "intro")
                .block("start", BlockType.START, 0, 0, Map.of("label", "intro"))
                .block("img", BlockType.IMAGE, 200, 0, Map.of("name", "bg night", "path", "night.png"))
                .block("scene", BlockType.SCENE, 0, 100, Map.of("background", "bg room"))
                .block("show", BlockType.SHOW, 0, 200, Map.of("character", "Bob"))
                .block("say", BlockType.SAY, 0, 300, Map.of("who", "Jane-Doe", "text", "Me"))
                .connect("start", "scene")
                .connect("scene", "show")
                .connect("show", "say")
                .build());

        String script = assembler.generate(project);

        assertThat(assembler.generateDefinitions(project)).isEqualTo("""
                # Image Definitions
                image bg_night = "night.png"
                image bg_room = "images/room.png"

                # Character Definitions
                define Bob = Character('Bob')
                define Jane_Doe = Character('Jane')

                """);
        assertThat(script).contains("""
                label intro:
                    scene bg_room
                    show Bob
                    Jane_Doe "Me"
                """);
        assertThat(script).doesNotContain("Impostor");
    }

    @Test
    void inlineCharacterBlockIsHoisted() {
        Project project = new Project("Inline");
        project.addScene(SceneBuilder.scene("s1", "intro")
                .block("char", BlockType.CHARACTER, 200, 0, Map.of("name", "Eileen", "display_name", "Eileen V."))
                .block("say", BlockType.SAY, 0, 0, Map.of("who", "Eileen", "text", "Hello"))
                .build());

        String script = assembler.generate(project);

        assertThat(script).contains("# Character Definitions\ndefine Eileen = Character('Eileen V.')\n\n");
        assertThat(script).endsWith("    Eileen \"Hello\"\n\n");
        assertThat(script).containsOnlyOnce("define Eileen");
    }

    @Test
    void headerAndEntryLabelComeFromTheFormat() {
        ScriptFormat format = new ScriptFormat("# Custom title", "# Custom notice", "begin");

        String script = assembler(format).generate(dialogueProject());

        assertThat(script).startsWith("# Custom title\n# Custom notice\n\n");
        assertThat(script).contains("label begin:\n    jump intro\n");
    }

    @Test
    void emptySceneKeepsItsPlaceholder() {
        Project project = dialogueProject();
        project.addScene(new Scene("s2", "Empty", "empty"));

        assertThat(assembler.generate(project)).endsWith("    Jane_Doe \"Hi\"\n\n    pass\n\n");
    }
}
