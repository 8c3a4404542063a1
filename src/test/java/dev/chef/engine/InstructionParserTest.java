package dev.chef.engine;

import dev.chef.model.Instruction;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InstructionParserTest {

    private static Instruction parse(String statement) {
        return InstructionParser.parse(statement, 1);
    }

    @Test
    void parsesEveryInstructionKind() {
        assertThat(parse("Take flour from refrigerator.")).isEqualTo(new Instruction.Read("flour"));
        assertThat(parse("Put flour into the mixing bowl.")).isEqualTo(new Instruction.Push("flour", 1));
        assertThat(parse("Fold flour into the mixing bowl.")).isEqualTo(new Instruction.Pop(1, "flour"));
        assertThat(parse("Add flour to the mixing bowl.")).isEqualTo(new Instruction.Add("flour", 1));
        assertThat(parse("Remove flour from the mixing bowl.")).isEqualTo(new Instruction.Subtract("flour", 1));
        assertThat(parse("Combine flour into the mixing bowl.")).isEqualTo(new Instruction.Multiply("flour", 1));
        assertThat(parse("Divide flour into the mixing bowl.")).isEqualTo(new Instruction.Divide("flour", 1));
        assertThat(parse("Add dry ingredients to the mixing bowl.")).isEqualTo(new Instruction.AddDry(1));
        assertThat(parse("Liquefy flour.")).isEqualTo(new Instruction.Liquefy("flour"));
        assertThat(parse("Liquefy contents of the mixing bowl.")).isEqualTo(new Instruction.LiquefyContents(1));
        assertThat(parse("Stir the mixing bowl for 3 minutes.")).isEqualTo(new Instruction.Stir(3, 1));
        assertThat(parse("Stir flour into the mixing bowl.")).isEqualTo(new Instruction.StirIngredient("flour", 1));
        assertThat(parse("Mix the mixing bowl well.")).isEqualTo(new Instruction.Mix(1));
        assertThat(parse("Clean the mixing bowl.")).isEqualTo(new Instruction.ClearStack(1));
        assertThat(parse("Pour contents of the mixing bowl into the baking dish."))
            .isEqualTo(new Instruction.CopyStack(1, 1));
        assertThat(parse("Set aside.")).isEqualTo(new Instruction.Break());
        assertThat(parse("Serve with chocolate sauce.")).isEqualTo(new Instruction.Call("chocolate sauce"));
        assertThat(parse("Refrigerate.")).isEqualTo(new Instruction.Return(null));
        assertThat(parse("Refrigerate for 2 hours.")).isEqualTo(new Instruction.Return(2));
    }

    @Test
    void optionalTheAndBowlNumberGiveTheSameInstruction() {
        var expected = new Instruction.Add("sugar", 2);

        assertThat(parse("Add sugar to mixing bowl 2.")).isEqualTo(expected);
        assertThat(parse("Add sugar to the mixing bowl 2.")).isEqualTo(expected);
        assertThat(parse("Add sugar to the 2nd mixing bowl.")).isEqualTo(expected);
        assertThat(parse("Add sugar to 2nd mixing bowl.")).isEqualTo(expected);
    }

    @Test
    void bowlDefaultsToOne() {
        assertThat(parse("Add sugar.")).isEqualTo(new Instruction.Add("sugar", 1));
        assertThat(parse("Remove sugar.")).isEqualTo(new Instruction.Subtract("sugar", 1));
        assertThat(parse("Combine sugar.")).isEqualTo(new Instruction.Multiply("sugar", 1));
        assertThat(parse("Divide sugar.")).isEqualTo(new Instruction.Divide("sugar", 1));
        assertThat(parse("Add dry ingredients.")).isEqualTo(new Instruction.AddDry(1));
        assertThat(parse("Stir for 1 minute.")).isEqualTo(new Instruction.Stir(1, 1));
        assertThat(parse("Mix well.")).isEqualTo(new Instruction.Mix(1));
        assertThat(parse("Take sugar from the refrigerator.")).isEqualTo(new Instruction.Read("sugar"));
    }

    @Test
    void specificPhrasingsWinOverGenericOnes() {
        assertThat(parse("Add dry ingredients to mixing bowl 3.")).isEqualTo(new Instruction.AddDry(3));
        assertThat(parse("Liquify contents of the 2nd mixing bowl.")).isEqualTo(new Instruction.LiquefyContents(2));
        assertThat(parse("Stir the 2nd mixing bowl for 4 minutes.")).isEqualTo(new Instruction.Stir(4, 2));
    }

    @Test
    void pourNamesBothContainers() {
        assertThat(parse("Pour contents of the 3rd mixing bowl into the 2nd baking dish."))
            .isEqualTo(new Instruction.CopyStack(3, 2));
        assertThat(parse("Pour contents of mixing bowl 3 into baking dish 2."))
            .isEqualTo(new Instruction.CopyStack(3, 2));
    }

    @Test
    void unknownVerbWithTheIsALoopStart() {
        assertThat(parse("Sift the flour.")).isEqualTo(new Instruction.LoopStart("Sift", "flour"));
    }

    @Test
    void loopEndWithAndWithoutIngredient() {
        assertThat(parse("Sift the flour until sifted."))
            .isEqualTo(new Instruction.LoopEnd("Sift", "flour", "sifted"));
        assertThat(parse("Sift until sifted."))
            .isEqualTo(new Instruction.LoopEnd("Sift", null, "sifted"));
    }

    @Test
    void lineBreaksAndExtraSpacesAreInsignificant() {
        assertThat(parse("Put  flour\n into the\tmixing bowl."))
            .isEqualTo(new Instruction.Push("flour", 1));
    }

    @Test
    void refrigerateHoursMustAgreeInNumber() {
        assertThat(parse("Refrigerate for 1 hour.")).isEqualTo(new Instruction.Return(1));

        assertThatThrownBy(() -> parse("Refrigerate for 1 hours."))
            .isInstanceOf(ChefSyntaxException.class)
            .hasMessageContaining("does not agree");
        assertThatThrownBy(() -> parse("Refrigerate for 3 hour."))
            .isInstanceOf(ChefSyntaxException.class);
        assertThatThrownBy(() -> parse("Refrigerate for 0 hours."))
            .isInstanceOf(ChefSyntaxException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"Bake.", "Preheat oven.", "Put flour.", "Fold sugar."})
    void rejectsUnrecognisedStatements(String statement) {
        assertThatThrownBy(() -> InstructionParser.parse(statement, 7))
            .hasMessageStartingWith("Line 7:")
            .isInstanceOfSatisfying(ChefSyntaxException.class, e -> assertThat(e.lineNumber()).isEqualTo(7));
    }

    @Test
    void rejectsBowlZero() {
        assertThatThrownBy(() -> parse("Put flour into mixing bowl 0."))
            .isInstanceOf(ChefSyntaxException.class)
            .hasMessageContaining("start at 1");
    }
}
