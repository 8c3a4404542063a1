package dev.chef.engine;

import dev.chef.model.Program;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and builds programs from recipe text.
 */
public final class ProgramLoader {

    private ProgramLoader() {}

    /**
     * Load a program from a UTF-8 recipe file.
     */
    public static Program loadFromFile(Path path) throws IOException {
        return loadFromString(Files.readString(path, StandardCharsets.UTF_8));
    }

    /**
     * Parse and build a program from recipe text.
     */
    public static Program loadFromString(String text) {
        return ProgramBuilder.build(RecipeParser.parse(text));
    }
}
