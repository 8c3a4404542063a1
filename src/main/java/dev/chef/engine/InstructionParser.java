package dev.chef.engine;

import dev.chef.model.Instruction;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognises a single method statement.
 * <p>
 * Statements are matched against an ordered list of phrasings and the first match
 * wins, so specific phrasings ("Add dry ingredients", "Add X to mixing bowl 2")
 * come before the generic ones they would otherwise be swallowed by. The generic
 * loop forms come last.
 */
public final class InstructionParser {

    private static final Map<String, String> PLACEHOLDERS = Map.of(
        "{ing}", "(?<ing>[^.]+?)",
        "{recipe}", "(?<recipe>[^.]+?)",
        "{n}", "(?<n>\\d+)",
        "{bowl}", "(?:the )?(?:(?<bowlOrd>\\d+)(?:st|nd|rd|th) )?mixing bowl(?: (?<bowlNum>\\d+))?",
        "{dish}", "(?:the )?(?:(?<dishOrd>\\d+)(?:st|nd|rd|th) )?baking dish(?: (?<dishNum>\\d+))?"
    );

    private static final List<Alternative> ALTERNATIVES = new ArrayList<>();

    static {
        on("Take {ing} from (?:the )?refrigerator", m -> new Instruction.Read(ing(m)));
        on("Put {ing} into {bowl}", m -> new Instruction.Push(ing(m), bowl(m)));
        on("Fold {ing} into {bowl}", m -> new Instruction.Pop(bowl(m), ing(m)));
        on("Add dry ingredients(?: to {bowl})?", m -> new Instruction.AddDry(bowl(m)));
        on("Add {ing} to {bowl}", m -> new Instruction.Add(ing(m), bowl(m)));
        on("Add {ing}", m -> new Instruction.Add(ing(m), 1));
        on("Remove {ing} from {bowl}", m -> new Instruction.Subtract(ing(m), bowl(m)));
        on("Remove {ing}", m -> new Instruction.Subtract(ing(m), 1));
        on("Combine {ing} into {bowl}", m -> new Instruction.Multiply(ing(m), bowl(m)));
        on("Combine {ing}", m -> new Instruction.Multiply(ing(m), 1));
        on("Divide {ing} into {bowl}", m -> new Instruction.Divide(ing(m), bowl(m)));
        on("Divide {ing}", m -> new Instruction.Divide(ing(m), 1));
        on("Liqu[ei]fy contents of {bowl}", m -> new Instruction.LiquefyContents(bowl(m)));
        on("Liqu[ei]fy {ing}", m -> new Instruction.Liquefy(ing(m)));
        on("Stir(?: {bowl})? for {n} minutes?", m -> new Instruction.Stir(number(m), bowl(m)));
        on("Stir {ing} into {bowl}", m -> new Instruction.StirIngredient(ing(m), bowl(m)));
        on("Mix(?: {bowl})? well", m -> new Instruction.Mix(bowl(m)));
        on("Clean {bowl}", m -> new Instruction.ClearStack(bowl(m)));
        on("Pour contents of {bowl} into {dish}", m -> new Instruction.CopyStack(bowl(m), dish(m)));
        on("Set aside", m -> new Instruction.Break());
        on("Serve with {recipe}", m -> new Instruction.Call(m.group("recipe")));
        on("Refrigerate", m -> new Instruction.Return(null));
        on("Refrigerate for {n} (?<unit>hours?)", m -> new Instruction.Return(hours(m)));
        on("(?<verb>[A-Za-z]+)(?: the {ing})? until (?<keyword>[A-Za-z]+)",
            m -> new Instruction.LoopEnd(m.group("verb"), m.group("ing"), m.group("keyword").toLowerCase(Locale.ROOT)));
        on("(?<verb>[A-Za-z]+) the {ing}", m -> new Instruction.LoopStart(m.group("verb"), ing(m)));
    }

    private InstructionParser() {}

    /**
     * Parse one statement. The trailing period is optional and runs of whitespace,
     * line breaks included, count as a single space.
     *
     * @param statement  the statement text
     * @param lineNumber line the statement starts on, for error reporting
     */
    public static Instruction parse(String statement, int lineNumber) {
        String text = normalize(statement);
        for (Alternative alternative : ALTERNATIVES) {
            Matcher matcher = alternative.pattern().matcher(text);
            if (matcher.matches()) {
                try {
                    return alternative.factory().apply(matcher);
                } catch (IllegalArgumentException e) {
                    throw new ChefSyntaxException(lineNumber, e.getMessage() + ": \"" + text + ".\"");
                }
            }
        }
        throw new ChefSyntaxException(lineNumber, "Unrecognised method statement: \"" + text + ".\"");
    }

    static String normalize(String statement) {
        String text = statement.strip().replaceAll("\\s+", " ");
        return text.endsWith(".") ? text.substring(0, text.length() - 1).stripTrailing() : text;
    }

    private static void on(String template, Function<Matcher, Instruction> factory) {
        String regex = template;
        for (var entry : PLACEHOLDERS.entrySet()) {
            regex = regex.replace(entry.getKey(), entry.getValue());
        }
        ALTERNATIVES.add(new Alternative(Pattern.compile(regex), factory));
    }

    private static String ing(Matcher m) {
        return m.group("ing").strip();
    }

    private static int number(Matcher m) {
        return Integer.parseInt(m.group("n"));
    }

    private static int bowl(Matcher m) {
        return container(m, "bowlOrd", "bowlNum", "mixing bowl");
    }

    private static int dish(Matcher m) {
        return container(m, "dishOrd", "dishNum", "baking dish");
    }

    private static int container(Matcher m, String ordinalGroup, String numberGroup, String what) {
        String ordinal = optionalGroup(m, ordinalGroup);
        String number = optionalGroup(m, numberGroup);
        if (ordinal != null && number != null) {
            throw new IllegalArgumentException(what + " number given twice");
        }
        String digits = ordinal != null ? ordinal : number;
        int value = digits == null ? 1 : Integer.parseInt(digits);
        if (value < 1) {
            throw new IllegalArgumentException(what + " numbers start at 1");
        }
        return value;
    }

    // Patterns without a bowl reference have no such group at all.
    private static String optionalGroup(Matcher m, String group) {
        return m.pattern().pattern().contains("(?<" + group + ">") ? m.group(group) : null;
    }

    private static int hours(Matcher m) {
        int hours = number(m);
        boolean plural = m.group("unit").equals("hours");
        if (hours < 1) {
            throw new IllegalArgumentException("Refrigeration time must be at least 1 hour");
        }
        if (plural != (hours > 1)) {
            throw new IllegalArgumentException("\"" + hours + " " + m.group("unit") + "\" does not agree in number");
        }
        return hours;
    }

    private record Alternative(Pattern pattern, Function<Matcher, Instruction> factory) {}
}
