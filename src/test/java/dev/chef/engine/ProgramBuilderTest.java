package dev.chef.engine;

import dev.chef.model.Ingredient;
import dev.chef.model.IngredientKind;
import dev.chef.model.Instruction;
import dev.chef.model.ParsedRecipe;
import dev.chef.model.Program;
import dev.chef.model.Recipe;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProgramBuilderTest {

    private static ParsedRecipe recipe(String title, Integer serves, Instruction... instructions) {
        return new ParsedRecipe(title, null, List.of(new Ingredient("a", 1, IngredientKind.DRY)),
            null, null, null, List.of(instructions), serves, 1);
    }

    private static List<Instruction> resolve(Instruction... instructions) {
        return ProgramBuilder.resolveLoops("test", List.of(instructions));
    }

    @Test
    void firstRecipeIsMain() {
        Program program = ProgramBuilder.build(List.of(
            recipe("Main", 1, new Instruction.Call("Helper")),
            recipe("Helper", null, new Instruction.Push("a", 1))));

        assertThat(program.mainRecipe()).isEqualTo("Main");
        assertThat(program.main().name()).isEqualTo("Main");
        assertThat(program.recipes().keySet()).containsExactly("Main", "Helper");
    }

    @Test
    void servesBecomesAFinalPrintStacks() {
        Program program = ProgramBuilder.build(List.of(recipe("Main", 3, new Instruction.Push("a", 1))));

        assertThat(program.main().instructions()).containsExactly(
            new Instruction.Push("a", 1),
            new Instruction.PrintStacks(3));
    }

    @Test
    void resolvesNestedLoopsWithDifferentVerbs() {
        List<Instruction> resolved = resolve(
            new Instruction.LoopStart("Sift", "flour"),
            new Instruction.LoopStart("Mash", "potatoes"),
            new Instruction.Push("flour", 1),
            new Instruction.LoopEnd("Mash", null, "mashed"),
            new Instruction.LoopEnd("Sift", "flour", "sifted"));

        assertThat(resolved.get(0)).isEqualTo(new Instruction.LoopStart("Sift", "flour", "sifted", 4));
        assertThat(resolved.get(1)).isEqualTo(new Instruction.LoopStart("Mash", "potatoes", "mashed", 3));
        assertThat(resolved.get(3)).isEqualTo(new Instruction.LoopEnd("Mash", null, "mashed", 1));
        assertThat(resolved.get(4)).isEqualTo(new Instruction.LoopEnd("Sift", "flour", "sifted", 0));
    }

    @Test
    void sameVerbLoopsNestStrictly() {
        List<Instruction> resolved = resolve(
            new Instruction.LoopStart("Whisk", "eggs"),
            new Instruction.LoopStart("Whisk", "cream"),
            new Instruction.LoopEnd("Whisk", "cream", "whisked"),
            new Instruction.LoopEnd("Whisk", "eggs", "whisked"));

        assertThat(((Instruction.LoopStart) resolved.get(0)).end()).isEqualTo(3);
        assertThat(((Instruction.LoopStart) resolved.get(1)).end()).isEqualTo(2);
        assertThat(((Instruction.LoopEnd) resolved.get(2)).start()).isEqualTo(1);
        assertThat(((Instruction.LoopEnd) resolved.get(3)).start()).isEqualTo(0);
    }

    @Test
    void endClosesNearestMatchingStartBelowTheTop() {
        List<Instruction> resolved = resolve(
            new Instruction.LoopStart("Sift", "flour"),
            new Instruction.LoopStart("Mash", "potatoes"),
            new Instruction.LoopEnd("Sift", null, "sifted"),
            new Instruction.LoopEnd("Mash", null, "mashed"));

        assertThat(((Instruction.LoopStart) resolved.get(0)).end()).isEqualTo(2);
        assertThat(((Instruction.LoopStart) resolved.get(1)).end()).isEqualTo(3);
    }

    @Test
    void verbEndingInEIsClosedWithD() {
        List<Instruction> resolved = resolve(
            new Instruction.LoopStart("Bake", "cake"),
            new Instruction.LoopEnd("Bake", "cake", "baked"));

        assertThat(resolved.get(0)).isEqualTo(new Instruction.LoopStart("Bake", "cake", "baked", 1));
    }

    @Test
    void everyLoopStartPointsAtAMatchingEnd() {
        Program program = ProgramLoader.loadFromString("""
            Loops.

            Ingredients.
            2 g a
            2 g b
            2 g c

            Method.
            Sift the a. Mash the b. Sift the c. Put a into the mixing bowl.
            Sift the c until sifted. Mash the b until mashed. Bake the c. Bake until baked.
            Sift the a until sifted.
            """);

        List<Instruction> instructions = program.main().instructions();
        for (int i = 0; i < instructions.size(); i++) {
            if (instructions.get(i) instanceof Instruction.LoopStart start) {
                assertThat(instructions.get(start.end())).isInstanceOfSatisfying(Instruction.LoopEnd.class, end -> {
                    assertThat(end.keyword()).isEqualTo(start.keyword());
                });
                assertThat(((Instruction.LoopEnd) instructions.get(start.end())).start()).isEqualTo(i);
            }
        }
        assertThat(((Instruction.LoopStart) instructions.get(0)).end()).isEqualTo(8);
        assertThat(((Instruction.LoopStart) instructions.get(1)).end()).isEqualTo(5);
        assertThat(((Instruction.LoopStart) instructions.get(2)).end()).isEqualTo(4);
    }

    @Test
    void breakJumpsOutOfInnermostLoop() {
        List<Instruction> resolved = resolve(
            new Instruction.LoopStart("Sift", "flour"),
            new Instruction.LoopStart("Mash", "potatoes"),
            new Instruction.Break(),
            new Instruction.LoopEnd("Mash", null, "mashed"),
            new Instruction.Break(),
            new Instruction.LoopEnd("Sift", null, "sifted"));

        assertThat(resolved.get(2)).isEqualTo(new Instruction.Break(3));
        assertThat(resolved.get(4)).isEqualTo(new Instruction.Break(5));
    }

    @Test
    void endWithoutStartFails() {
        assertThatThrownBy(() -> resolve(
            new Instruction.LoopStart("Sift", "flour"),
            new Instruction.LoopEnd("Mash", null, "mashed")))
            .isInstanceOfSatisfying(ChefBuildException.class, e -> assertThat(e.recipeName()).isEqualTo("test"))
            .hasMessageContaining("closes no open loop");
    }

    @Test
    void unclosedStartFails() {
        assertThatThrownBy(() -> resolve(
            new Instruction.LoopStart("Sift", "flour"),
            new Instruction.Push("flour", 1)))
            .isInstanceOf(ChefBuildException.class)
            .hasMessageContaining("never closed by \"until sifted\"");
    }

    @Test
    void breakOutsideLoopFails() {
        assertThatThrownBy(() -> resolve(new Instruction.Break()))
            .isInstanceOf(ChefBuildException.class)
            .hasMessageContaining("outside any loop");
    }

    @Test
    void callToMissingRecipeFails() {
        assertThatThrownBy(() -> ProgramBuilder.build(List.of(
            recipe("Main", null, new Instruction.Call("Gravy")))))
            .isInstanceOfSatisfying(ChefBuildException.class, e -> assertThat(e.recipeName()).isEqualTo("Main"))
            .hasMessageContaining("unknown recipe 'Gravy'");
    }

    @Test
    void emptyRecipeListFails() {
        assertThatThrownBy(() -> ProgramBuilder.build(List.of()))
            .isInstanceOfSatisfying(ChefBuildException.class, e -> assertThat(e.recipeName()).isNull())
            .hasMessage("A program needs at least one recipe");
    }

    @Test
    void duplicateRecipeFails() {
        assertThatThrownBy(() -> ProgramBuilder.build(List.of(
            recipe("Main", null, new Instruction.Push("a", 1)),
            recipe("Main", null, new Instruction.Push("a", 1)))))
            .isInstanceOf(ChefBuildException.class)
            .hasMessageContaining("defined more than once");
    }

    @Test
    void zeroServingsFails() {
        assertThatThrownBy(() -> ProgramBuilder.build(List.of(recipe("Main", 0, new Instruction.Push("a", 1)))))
            .isInstanceOf(ChefBuildException.class)
            .hasMessageContaining("at least 1");
    }

    @Test
    void validatorReportsUnresolvedLoops() {
        var recipe = new Recipe("Raw", List.of(), List.of(
            new Instruction.LoopStart("Sift", "flour"),
            new Instruction.LoopEnd("Sift", null, "sifted")));

        var problems = ProgramValidator.validate(new Program(Map.of("Raw", recipe), "Raw"));

        assertThat(problems).containsExactly(new ProgramValidator.Problem("Raw", "loop at step 1 is not closed"));
    }
}
