package com.renflow.renflow_backend.emitter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.renflow.renflow_backend.model.domain.Block;
import com.renflow.renflow_backend.model.domain.BlockType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Renders MENU blocks.
 *
 * Params:
 * {
 *   "question": "Where to?",
 *   "choices": [ { "text": "Go", "jump": "forest", "condition": "has_key" }, "Stay" ]
 * }
 *
 * "choices" may also arrive as a string: a JSON array, or failing that a comma separated list of
 * bare choice texts. Each choice becomes a sub-block of the menu whose body jumps to its target,
 * or is a placeholder when the choice has no target or the target label is not declared anywhere.
 */
@Slf4j
@Component
@RequiredArgsConstructor
class MenuEmitter implements BlockEmitter {

    private final ObjectMapper objectMapper;

    @Override
    public BlockType supportedType() {
        return BlockType.MENU;
    }

    @Override
    public String emit(Block block, String indent, RenderContext context) {
        BlockParams params = BlockParams.of(block);
        List<Choice> choices = parseChoices(params.raw("choices", "options"));
        if (choices.isEmpty()) {
            log.debug("Menu block {} has no choices with text, skipping", block.getId());
            return "";
        }

        String choiceIndent = indent + ScriptText.INDENT;
        String bodyIndent = choiceIndent + ScriptText.INDENT;

        StringBuilder out = new StringBuilder();
        String question = params.text("question", "prompt");
        if (!question.isEmpty()) {
            out.append(ScriptText.line(indent, ScriptText.quoted(question)));
        }
        out.append(ScriptText.line(indent, "menu:"));

        for (Choice choice : choices) {
            String caption = ScriptText.quoted(choice.text());
            if (!choice.condition().isEmpty()) {
                caption += " if " + choice.condition();
            }
            out.append(ScriptText.line(choiceIndent, caption + ":"));
            out.append(ScriptText.line(bodyIndent, body(choice, block, context)));
        }
        return out.toString();
    }

    private String body(Choice choice, Block block, RenderContext context) {
        if (choice.jump().isEmpty()) return ScriptText.PASS;

        String label = context.labels().resolve(choice.jump());
        if (!context.isKnownLabel(label)) {
            log.debug("Menu block {}: choice '{}' jumps to undeclared label '{}', jump dropped", block.getId(), choice.text(), label);
            return ScriptText.PASS;
        }
        return "jump " + label;
    }

    // ── Choice parsing ────────────────────────────────────────────────────────

    @SuppressWarnings("unchecked")
    private List<Choice> parseChoices(Object raw) {
        List<Choice> choices = new ArrayList<>();
        if (raw instanceof String text) {
            raw = parseText(text);
        }
        if (!(raw instanceof Collection<?> items)) {
            return choices;
        }
        for (Object item : items) {
            Choice choice = item instanceof Map<?, ?> map
                    ? Choice.from(BlockParams.of((Map<String, Object>) map))
                    : new Choice(item == null ? "" : String.valueOf(item).trim(), "", "");
            if (!choice.text().isEmpty()) {
                choices.add(choice);
            }
        }
        return choices;
    }

    private Object parseText(String text) {
        try {
            JsonNode node = objectMapper.readTree(text);
            if (node != null && node.isArray()) {
                return objectMapper.convertValue(node, List.class);
            }
        } catch (JsonProcessingException e) {
            log.debug("Menu choices are not JSON, reading them as a comma separated list");
        }
        return Arrays.stream(text.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private record Choice(String text, String jump, String condition) {

        static Choice from(BlockParams params) {
            return new Choice(params.text("text"), params.text("jump"), params.text("condition"));
        }
    }
}
