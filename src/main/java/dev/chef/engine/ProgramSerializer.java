package dev.chef.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.chef.model.Ingredient;
import dev.chef.model.Instruction;
import dev.chef.model.Program;
import dev.chef.model.Recipe;

import java.io.UncheckedIOException;
import java.util.List;

/**
 * Renders a built program as JSON, for inspecting what the parser and builder
 * made of a recipe file.
 */
public final class ProgramSerializer {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ProgramSerializer() {}

    public static ObjectNode toTree(Program program) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("main", program.mainRecipe());
        ArrayNode recipes = root.putArray("recipes");
        for (Recipe recipe : program.recipes().values()) {
            recipes.add(recipeNode(recipe));
        }
        return root;
    }

    public static String toJson(Program program) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toTree(program));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialise program", e);
        }
    }

    private static ObjectNode recipeNode(Recipe recipe) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("name", recipe.name());

        ArrayNode ingredients = node.putArray("ingredients");
        for (Ingredient ingredient : recipe.ingredients()) {
            ObjectNode item = ingredients.addObject();
            item.put("name", ingredient.name());
            if (ingredient.initialValue() != null) {
                item.put("initialValue", ingredient.initialValue());
            } else {
                item.putNull("initialValue");
            }
            item.put("kind", ingredient.kind().name());
        }

        ArrayNode steps = node.putArray("instructions");
        List<Instruction> instructions = recipe.instructions();
        for (int i = 0; i < instructions.size(); i++) {
            Instruction instruction = instructions.get(i);
            ObjectNode step = steps.addObject();
            step.put("step", i + 1);
            step.put("type", instruction.getClass().getSimpleName());
            step.put("text", InstructionFormatter.format(instruction));
            if (instruction instanceof Instruction.LoopStart start) {
                step.put("endStep", start.end() + 1);
            } else if (instruction instanceof Instruction.LoopEnd end) {
                step.put("startStep", end.start() + 1);
            } else if (instruction instanceof Instruction.Break brk) {
                step.put("loopEndStep", brk.loopEnd() + 1);
            }
        }
        return node;
    }
}
