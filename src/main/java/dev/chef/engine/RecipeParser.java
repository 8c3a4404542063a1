package dev.chef.engine;

import dev.chef.model.Ingredient;
import dev.chef.model.IngredientKind;
import dev.chef.model.Instruction;
import dev.chef.model.Measure;
import dev.chef.model.ParsedRecipe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads recipe text into one {@link ParsedRecipe} per recipe.
 * <p>
 * Blank lines delimit the sections of a recipe and the recipes themselves. A
 * recipe is a title, an optional comment, an optional ingredient list, optional
 * cooking time and oven temperature, the method, and an optional serving count.
 * The first line that does not fit aborts the whole parse.
 */
public final class RecipeParser {

    private static final Logger LOG = LoggerFactory.getLogger(RecipeParser.class);

    private static final String INGREDIENTS_HEADER = "Ingredients.";
    private static final String METHOD_HEADER = "Method.";

    private static final Pattern COOKING_TIME =
        Pattern.compile("Cooking time: (\\d+) (minutes?|hours?)\\.");
    private static final Pattern OVEN =
        Pattern.compile("Pre-heat oven to (\\d+) degrees Celsius(?: \\(gas mark (\\d+)\\))?\\.");
    private static final Pattern SERVES = Pattern.compile("Serves (\\d+)\\.");
    private static final Pattern NUMBER = Pattern.compile("\\d+");

    // Real-world measures that Chef does not define.
    private static final Set<String> UNSUPPORTED_MEASURES = Set.of(
        "oz", "ounce", "ounces", "lb", "lbs", "pound", "pounds", "pint", "pints",
        "quart", "quarts", "gallon", "gallons", "mg", "cl", "dl",
        "litre", "litres", "liter", "liters"
    );

    private RecipeParser() {}

    /**
     * Parse a whole program.
     *
     * @return the recipes in the order they appear, at least one
     * @throws ChefSyntaxException on the first line that does not fit the grammar
     */
    public static List<ParsedRecipe> parse(String text) {
        List<Paragraph> paragraphs = paragraphs(text);
        if (paragraphs.isEmpty()) {
            throw new ChefSyntaxException(1, "No recipe found");
        }

        var recipes = new ArrayList<ParsedRecipe>();
        var cursor = new Cursor(paragraphs);
        while (cursor.hasNext()) {
            ParsedRecipe recipe = parseRecipe(cursor);
            LOG.debug("Parsed recipe '{}': {} ingredients, {} method statements",
                recipe.title(), recipe.ingredients().size(), recipe.instructions().size());
            recipes.add(recipe);
        }
        return recipes;
    }

    private static ParsedRecipe parseRecipe(Cursor cursor) {
        Paragraph titleParagraph = cursor.next();
        String title = parseTitle(titleParagraph);

        String comment = null;
        if (cursor.hasNext() && !isSectionHeader(cursor.peek())) {
            comment = cursor.next().joined();
        }

        List<Ingredient> ingredients = List.of();
        if (cursor.hasNext() && cursor.peek().firstLine().equals(INGREDIENTS_HEADER)) {
            ingredients = parseIngredients(cursor.next());
        }

        Integer cookingTime = null;
        Integer ovenTemperature = null;
        Integer gasMark = null;
        while (cursor.hasNext() && isKitchenSetting(cursor.peek().firstLine())) {
            for (Line line : cursor.next().lines()) {
                Matcher time = COOKING_TIME.matcher(line.text());
                Matcher oven = OVEN.matcher(line.text());
                if (time.matches()) {
                    int amount = parseNumber(time.group(1), line.number());
                    cookingTime = time.group(2).startsWith("hour") ? amount * 60 : amount;
                } else if (oven.matches()) {
                    ovenTemperature = parseNumber(oven.group(1), line.number());
                    gasMark = oven.group(2) == null ? null : parseNumber(oven.group(2), line.number());
                } else {
                    throw new ChefSyntaxException(line.number(),
                        "Expected cooking time or oven temperature, found \"" + line.text() + "\"");
                }
            }
        }

        if (!cursor.hasNext() || !cursor.peek().firstLine().startsWith(METHOD_HEADER)) {
            int lineNumber = cursor.hasNext() ? cursor.peek().number() : titleParagraph.number();
            throw new ChefSyntaxException(lineNumber, "Recipe '" + title + "' has no \"Method.\" section");
        }
        List<Instruction> instructions = parseMethod(cursor.next());

        Integer serves = null;
        if (cursor.hasNext() && cursor.peek().firstLine().startsWith("Serves")) {
            serves = parseServes(cursor.next());
        }

        return new ParsedRecipe(title, comment, ingredients, cookingTime, ovenTemperature, gasMark,
            instructions, serves, titleParagraph.number());
    }

    private static String parseTitle(Paragraph paragraph) {
        if (paragraph.lines().size() != 1) {
            throw new ChefSyntaxException(paragraph.lines().get(1).number(),
                "Recipe title must be followed by a blank line, found \"" + paragraph.lines().get(1).text() + "\"");
        }
        String line = paragraph.firstLine();
        if (!line.endsWith(".") || line.length() == 1) {
            throw new ChefSyntaxException(paragraph.number(), "Recipe title must end with a period: \"" + line + "\"");
        }
        return line.substring(0, line.length() - 1).strip();
    }

    private static boolean isSectionHeader(Paragraph paragraph) {
        String first = paragraph.firstLine();
        return first.equals(INGREDIENTS_HEADER) || first.startsWith(METHOD_HEADER) || isKitchenSetting(first);
    }

    private static boolean isKitchenSetting(String line) {
        return line.startsWith("Cooking time:") || line.startsWith("Pre-heat oven");
    }

    private static List<Ingredient> parseIngredients(Paragraph paragraph) {
        List<Line> lines = paragraph.lines();
        if (lines.size() < 2) {
            throw new ChefSyntaxException(paragraph.number(), "Ingredient list is empty");
        }
        var ingredients = new ArrayList<Ingredient>();
        for (Line line : lines.subList(1, lines.size())) {
            ingredients.add(parseIngredient(line.text(), line.number()));
        }
        return ingredients;
    }

    /**
     * Parse one ingredient line: an optional amount, an optional measure that may
     * be heaped or level, and a name.
     */
    static Ingredient parseIngredient(String text, int lineNumber) {
        List<String> words = Arrays.asList(text.strip().split("\\s+"));
        int i = 0;

        Integer amount = null;
        if (words.size() > 1 && NUMBER.matcher(words.get(0)).matches()) {
            amount = parseNumber(words.get(0), lineNumber);
            i++;
        }

        boolean heapedOrLevel = false;
        if (i < words.size() - 1 && (words.get(i).equals("heaped") || words.get(i).equals("level"))) {
            heapedOrLevel = true;
            i++;
        }

        Measure measure = null;
        if (i < words.size() - 1) {
            String token = words.get(i);
            Optional<Measure> found = Measure.fromToken(token);
            if (found.isPresent()) {
                measure = found.get();
                i++;
            } else if (heapedOrLevel || UNSUPPORTED_MEASURES.contains(token.toLowerCase(Locale.ROOT))) {
                throw new ChefSyntaxException(lineNumber, "Unrecognised measure '" + token + "'");
            }
        } else if (heapedOrLevel) {
            throw new ChefSyntaxException(lineNumber, "Heaped or level needs a measure: \"" + text.strip() + "\"");
        }

        String name = String.join(" ", words.subList(i, words.size()));
        if (name.isBlank()) {
            throw new ChefSyntaxException(lineNumber, "Ingredient has no name");
        }
        IngredientKind kind = measure == null ? IngredientKind.EITHER : measure.kind(heapedOrLevel);
        return new Ingredient(name, amount, kind);
    }

    private static List<Instruction> parseMethod(Paragraph paragraph) {
        var instructions = new ArrayList<Instruction>();
        var sentence = new StringBuilder();
        int sentenceLine = -1;

        List<Line> lines = paragraph.lines();
        for (int l = 0; l < lines.size(); l++) {
            Line line = lines.get(l);
            String text = l == 0 ? line.text().substring(METHOD_HEADER.length()) : line.text();
            for (int c = 0; c < text.length(); c++) {
                char ch = text.charAt(c);
                if (sentenceLine < 0 && !Character.isWhitespace(ch)) {
                    sentenceLine = line.number();
                }
                sentence.append(ch);
                if (ch == '.') {
                    instructions.add(InstructionParser.parse(sentence.toString(), sentenceLine));
                    sentence.setLength(0);
                    sentenceLine = -1;
                }
            }
            sentence.append(' ');
        }

        if (sentenceLine >= 0) {
            throw new ChefSyntaxException(sentenceLine,
                "Method statement must end with a period: \"" + sentence.toString().strip() + "\"");
        }
        if (instructions.isEmpty()) {
            throw new ChefSyntaxException(paragraph.number(), "Method has no statements");
        }
        return instructions;
    }

    private static int parseServes(Paragraph paragraph) {
        if (paragraph.lines().size() != 1) {
            Line extra = paragraph.lines().get(1);
            throw new ChefSyntaxException(extra.number(),
                "Recipes must be separated by a blank line, found \"" + extra.text() + "\"");
        }
        Matcher matcher = SERVES.matcher(paragraph.firstLine());
        if (!matcher.matches()) {
            throw new ChefSyntaxException(paragraph.number(), "Malformed serving count: \"" + paragraph.firstLine() + "\"");
        }
        return parseNumber(matcher.group(1), paragraph.number());
    }

    private static int parseNumber(String digits, int lineNumber) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new ChefSyntaxException(lineNumber, "Number out of range: " + digits);
        }
    }

    static List<Paragraph> paragraphs(String text) {
        String[] rawLines = text.replace("\r\n", "\n").replace('\r', '\n').split("\n", -1);
        var paragraphs = new ArrayList<Paragraph>();
        var current = new ArrayList<Line>();
        for (int n = 0; n < rawLines.length; n++) {
            String stripped = rawLines[n].strip();
            if (stripped.isEmpty()) {
                if (!current.isEmpty()) {
                    paragraphs.add(new Paragraph(List.copyOf(current)));
                    current.clear();
                }
            } else {
                current.add(new Line(n + 1, stripped));
            }
        }
        if (!current.isEmpty()) {
            paragraphs.add(new Paragraph(List.copyOf(current)));
        }
        return paragraphs;
    }

    record Line(int number, String text) {}

    record Paragraph(List<Line> lines) {
        int number() { return lines.get(0).number(); }

        String firstLine() { return lines.get(0).text(); }

        String joined() {
            return String.join("\n", lines.stream().map(Line::text).toList());
        }
    }

    private static final class Cursor {
        private final List<Paragraph> paragraphs;
        private int position;

        Cursor(List<Paragraph> paragraphs) {
            this.paragraphs = paragraphs;
        }

        boolean hasNext() { return position < paragraphs.size(); }

        Paragraph peek() { return paragraphs.get(position); }

        Paragraph next() { return paragraphs.get(position++); }
    }
}
