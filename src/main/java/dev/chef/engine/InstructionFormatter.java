package dev.chef.engine;

import dev.chef.model.Instruction;

/**
 * Writes an instruction back as a canonical method statement. Parsing the result
 * gives back an equal instruction, apart from resolved loop targets.
 */
public final class InstructionFormatter {

    private InstructionFormatter() {}

    public static String format(Instruction instruction) {
        var sb = new StringBuilder();
        if (instruction instanceof Instruction.Read read) {
            sb.append("Take ").append(read.ingredient()).append(" from the refrigerator");
        } else if (instruction instanceof Instruction.Push push) {
            sb.append("Put ").append(push.ingredient()).append(" into ").append(bowl(push.bowl()));
        } else if (instruction instanceof Instruction.Pop pop) {
            sb.append("Fold ").append(pop.ingredient()).append(" into ").append(bowl(pop.bowl()));
        } else if (instruction instanceof Instruction.Add add) {
            sb.append("Add ").append(add.ingredient()).append(" to ").append(bowl(add.bowl()));
        } else if (instruction instanceof Instruction.Subtract subtract) {
            sb.append("Remove ").append(subtract.ingredient()).append(" from ").append(bowl(subtract.bowl()));
        } else if (instruction instanceof Instruction.Multiply multiply) {
            sb.append("Combine ").append(multiply.ingredient()).append(" into ").append(bowl(multiply.bowl()));
        } else if (instruction instanceof Instruction.Divide divide) {
            sb.append("Divide ").append(divide.ingredient()).append(" into ").append(bowl(divide.bowl()));
        } else if (instruction instanceof Instruction.AddDry addDry) {
            sb.append("Add dry ingredients to ").append(bowl(addDry.bowl()));
        } else if (instruction instanceof Instruction.Liquefy liquefy) {
            sb.append("Liquefy ").append(liquefy.ingredient());
        } else if (instruction instanceof Instruction.LiquefyContents contents) {
            sb.append("Liquefy contents of ").append(bowl(contents.bowl()));
        } else if (instruction instanceof Instruction.Stir stir) {
            sb.append("Stir ").append(bowl(stir.bowl())).append(" for ").append(stir.minutes())
              .append(stir.minutes() == 1 ? " minute" : " minutes");
        } else if (instruction instanceof Instruction.StirIngredient stir) {
            sb.append("Stir ").append(stir.ingredient()).append(" into ").append(bowl(stir.bowl()));
        } else if (instruction instanceof Instruction.Mix mix) {
            sb.append("Mix ").append(bowl(mix.bowl())).append(" well");
        } else if (instruction instanceof Instruction.ClearStack clean) {
            sb.append("Clean ").append(bowl(clean.bowl()));
        } else if (instruction instanceof Instruction.CopyStack pour) {
            sb.append("Pour contents of ").append(bowl(pour.bowl())).append(" into ").append(dish(pour.dish()));
        } else if (instruction instanceof Instruction.LoopStart start) {
            sb.append(start.verb()).append(" the ").append(start.ingredient());
        } else if (instruction instanceof Instruction.LoopEnd end) {
            sb.append(end.verb());
            if (end.ingredient() != null) {
                sb.append(" the ").append(end.ingredient());
            }
            sb.append(" until ").append(end.keyword());
        } else if (instruction instanceof Instruction.Break) {
            sb.append("Set aside");
        } else if (instruction instanceof Instruction.Call call) {
            sb.append("Serve with ").append(call.recipe());
        } else if (instruction instanceof Instruction.Return ret) {
            sb.append("Refrigerate");
            if (ret.hours() != null) {
                sb.append(" for ").append(ret.hours()).append(ret.hours() == 1 ? " hour" : " hours");
            }
        } else if (instruction instanceof Instruction.PrintStacks print) {
            sb.append("Serves ").append(print.dishes());
        } else {
            throw new IllegalArgumentException("Unknown instruction: " + instruction);
        }
        return sb.append('.').toString();
    }

    private static String bowl(int n) {
        return n == 1 ? "the mixing bowl" : "the mixing bowl " + n;
    }

    private static String dish(int n) {
        return n == 1 ? "the baking dish" : "the baking dish " + n;
    }
}
