package dev.chef.engine;

import dev.chef.model.Instruction;
import dev.chef.model.Program;
import dev.chef.model.Recipe;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks a built program for problems that span recipes or that the parser
 * cannot see on its own.
 */
public final class ProgramValidator {

    private ProgramValidator() {}

    /** One problem found in a recipe. */
    public record Problem(String recipe, String message) {}

    /**
     * Validate a program. Returns an empty list if valid.
     */
    public static List<Problem> validate(Program program) {
        var problems = new ArrayList<Problem>();

        for (Recipe recipe : program.recipes().values()) {
            List<Instruction> instructions = recipe.instructions();
            for (int i = 0; i < instructions.size(); i++) {
                Instruction instruction = instructions.get(i);
                int step = i + 1;

                // Calls must name a recipe of this program
                if (instruction instanceof Instruction.Call call && !program.recipes().containsKey(call.recipe())) {
                    problems.add(new Problem(recipe.name(),
                        "step %d serves with unknown recipe '%s'".formatted(step, call.recipe())));
                }

                // Serving counts
                if (instruction instanceof Instruction.PrintStacks print && print.dishes() < 1) {
                    problems.add(new Problem(recipe.name(), "must serve at least 1, not " + print.dishes()));
                }

                // Loop edges point at each other
                if (instruction instanceof Instruction.LoopStart start && !pairsWith(instructions, i, start)) {
                    problems.add(new Problem(recipe.name(), "loop at step %d is not closed".formatted(step)));
                }
                if (instruction instanceof Instruction.Break brk
                        && !(brk.loopEnd() > i && brk.loopEnd() < instructions.size()
                             && instructions.get(brk.loopEnd()) instanceof Instruction.LoopEnd)) {
                    problems.add(new Problem(recipe.name(), "\"Set aside\" at step %d leaves no loop".formatted(step)));
                }
            }
        }

        return problems;
    }

    private static boolean pairsWith(List<Instruction> instructions, int index, Instruction.LoopStart start) {
        if (start.end() <= index || start.end() >= instructions.size()) {
            return false;
        }
        return instructions.get(start.end()) instanceof Instruction.LoopEnd end
            && end.start() == index
            && end.keyword().equals(start.keyword());
    }
}
