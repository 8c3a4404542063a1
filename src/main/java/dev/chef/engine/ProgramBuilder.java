package dev.chef.engine;

import dev.chef.model.Instruction;
import dev.chef.model.ParsedRecipe;
import dev.chef.model.Program;
import dev.chef.model.Recipe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns parsed recipes into a runnable {@link Program}: the first recipe becomes
 * the main one, loops and breaks get their jump targets, and the result is
 * validated. Building stops at the first problem.
 */
public final class ProgramBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(ProgramBuilder.class);

    private ProgramBuilder() {}

    /**
     * @throws ChefBuildException on an empty recipe list, duplicate recipes,
     *                            unmatched loops, a break outside any loop or a
     *                            call to a missing recipe
     */
    public static Program build(List<ParsedRecipe> parsed) {
        if (parsed.isEmpty()) {
            throw new ChefBuildException("A program needs at least one recipe");
        }

        var recipes = new LinkedHashMap<String, Recipe>();
        for (ParsedRecipe recipe : parsed) {
            if (recipes.containsKey(recipe.title())) {
                throw new ChefBuildException(recipe.title(), "defined more than once");
            }
            recipes.put(recipe.title(), buildRecipe(recipe));
        }

        Program program = new Program(recipes, parsed.get(0).title());
        List<ProgramValidator.Problem> problems = ProgramValidator.validate(program);
        if (!problems.isEmpty()) {
            ProgramValidator.Problem first = problems.get(0);
            throw new ChefBuildException(first.recipe(), first.message());
        }
        LOG.debug("Built program with {} recipes, main recipe '{}'", recipes.size(), program.mainRecipe());
        return program;
    }

    static Recipe buildRecipe(ParsedRecipe parsed) {
        var instructions = new ArrayList<>(parsed.instructions());
        if (parsed.serves() != null) {
            instructions.add(new Instruction.PrintStacks(parsed.serves()));
        }
        return new Recipe(parsed.title(), parsed.ingredients(), resolveLoops(parsed.title(), instructions));
    }

    /**
     * Link every loop start with its end and every break with the end of the
     * loop enclosing it.
     * <p>
     * An end closes the nearest still-open start whose verb it names, looking
     * down from the innermost one; starts above it stay open and must be closed
     * later. Loops with the same verb therefore nest strictly.
     */
    static List<Instruction> resolveLoops(String recipeName, List<Instruction> instructions) {
        var resolved = new ArrayList<>(instructions);
        var open = new ArrayList<OpenLoop>();
        var breaks = new LinkedHashMap<Integer, OpenLoop>();

        for (int i = 0; i < resolved.size(); i++) {
            Instruction instruction = resolved.get(i);
            if (instruction instanceof Instruction.LoopStart start) {
                open.add(new OpenLoop(i, LoopKeyword.closingFormOf(start.verb())));
            } else if (instruction instanceof Instruction.LoopEnd end) {
                int match = nearestOpen(open, end.keyword());
                if (match < 0) {
                    throw new ChefBuildException(recipeName,
                        "\"%s until %s\" closes no open loop".formatted(end.verb(), end.keyword()));
                }
                OpenLoop loop = open.remove(match);
                loop.end = i;
                var start = (Instruction.LoopStart) resolved.get(loop.start);
                resolved.set(loop.start, start.resolved(loop.keyword, i));
                resolved.set(i, end.resolved(loop.start));
                LOG.debug("Recipe '{}': loop '{}' spans steps {}..{}", recipeName, start.verb(), loop.start + 1, i + 1);
            } else if (instruction instanceof Instruction.Break) {
                if (open.isEmpty()) {
                    throw new ChefBuildException(recipeName, "\"Set aside\" at step %d is outside any loop".formatted(i + 1));
                }
                breaks.put(i, open.get(open.size() - 1));
            }
        }

        if (!open.isEmpty()) {
            OpenLoop loop = open.get(0);
            var start = (Instruction.LoopStart) resolved.get(loop.start);
            throw new ChefBuildException(recipeName,
                "loop \"%s the %s\" at step %d is never closed by \"until %s\""
                    .formatted(start.verb(), start.ingredient(), loop.start + 1, loop.keyword));
        }

        for (Map.Entry<Integer, OpenLoop> entry : breaks.entrySet()) {
            var instruction = (Instruction.Break) resolved.get(entry.getKey());
            resolved.set(entry.getKey(), instruction.resolved(entry.getValue().end));
        }
        return resolved;
    }

    private static int nearestOpen(List<OpenLoop> open, String keyword) {
        for (int j = open.size() - 1; j >= 0; j--) {
            if (open.get(j).keyword.equals(keyword)) {
                return j;
            }
        }
        return -1;
    }

    private static final class OpenLoop {
        final int start;
        final String keyword;
        int end = Instruction.UNRESOLVED;

        OpenLoop(int start, String keyword) {
            this.start = start;
            this.keyword = keyword;
        }
    }
}
