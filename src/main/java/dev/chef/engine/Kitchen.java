package dev.chef.engine;

import dev.chef.io.InputSource;
import dev.chef.io.OutputSink;
import dev.chef.model.Instruction;
import dev.chef.model.KitchenLimits;
import dev.chef.model.Program;
import dev.chef.model.Recipe;
import dev.chef.model.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.NoSuchElementException;
import java.util.Random;

/**
 * Runs a built program: cooks the main recipe, calling auxiliary recipes as it
 * goes, and serves the baking dishes at the end.
 * <p>
 * A recipe call hands the callee a copy of every mixing bowl the caller has used
 * and copies the callee's bowls back over the caller's when it finishes. Baking
 * dishes never cross a call.
 */
public final class Kitchen {

    private static final Logger LOG = LoggerFactory.getLogger(Kitchen.class);

    private final KitchenLimits limits;
    private final Random random;

    public Kitchen() {
        this(KitchenLimits.defaults());
    }

    public Kitchen(KitchenLimits limits) {
        this.limits = limits;
        this.random = limits.seed() == null ? new Random() : new Random(limits.seed());
    }

    /**
     * Cook the main recipe of {@code program}.
     *
     * @throws ChefRuntimeException on the first fatal condition; whatever was
     *                              already served stays written to {@code output}
     */
    public void run(Program program, InputSource input, OutputSink output) {
        run(program, new Frame(program.main(), 0), input, output);
    }

    /**
     * Cook in a frame supplied by the caller, whose bowls and dishes can be
     * inspected afterwards.
     */
    void run(Program program, Frame main, InputSource input, OutputSink output) {
        LOG.debug("Cooking '{}'", main.recipe().name());
        var session = new Session(program, input, output);
        try {
            cook(session, main);
        } finally {
            output.flush();
        }
        LOG.debug("Finished '{}' after {} steps", main.recipe().name(), session.steps);
    }

    private void cook(Session session, Frame frame) {
        Recipe recipe = frame.recipe();
        while (!frame.finished()) {
            int index = frame.pointer();
            Instruction instruction = recipe.instructions().get(index);
            if (LOG.isTraceEnabled()) {
                LOG.trace("{} step {}: {}", recipe.name(), index + 1, instruction);
            }
            boolean refrigerated;
            try {
                countStep(session);
                refrigerated = execute(session, frame, instruction);
            } catch (IllegalStateException | IllegalArgumentException | NoSuchElementException | ArithmeticException e) {
                throw new ChefRuntimeException(recipe.name(), index, e.getMessage(), e);
            }
            if (refrigerated) {
                return;
            }
        }
    }

    /**
     * Execute one instruction and move the pointer.
     *
     * @return true if the recipe ends here
     */
    private boolean execute(Session session, Frame frame, Instruction instruction) {
        if (instruction instanceof Instruction.Read read) {
            boolean liquid = frame.kindOf(read.ingredient()).startsLiquid();
            frame.setValue(read.ingredient(), new Value(session.input.nextValue(), liquid));
        } else if (instruction instanceof Instruction.Push push) {
            frame.bowl(push.bowl()).push(frame.valueOf(push.ingredient()));
        } else if (instruction instanceof Instruction.Pop pop) {
            frame.kindOf(pop.ingredient()); // unknown ingredient fails before the bowl is touched
            // the popped cell may still be held by the ingredient that was put in
            frame.setValue(pop.ingredient(), nonEmptyBowl(frame, pop.bowl()).pop().copy());
        } else if (instruction instanceof Instruction.Arithmetic arithmetic) {
            combine(frame, arithmetic);
        } else if (instruction instanceof Instruction.AddDry addDry) {
            frame.bowl(addDry.bowl()).push(Value.dry(frame.dryTotal()));
        } else if (instruction instanceof Instruction.Liquefy liquefy) {
            frame.valueOf(liquefy.ingredient()).liquefy();
        } else if (instruction instanceof Instruction.LiquefyContents contents) {
            frame.bowl(contents.bowl()).liquefyAll();
        } else if (instruction instanceof Instruction.Stir stir) {
            nonEmptyBowl(frame, stir.bowl()).stir(stir.minutes());
        } else if (instruction instanceof Instruction.StirIngredient stir) {
            int depth = frame.valueOf(stir.ingredient()).number();
            nonEmptyBowl(frame, stir.bowl()).stir(depth);
        } else if (instruction instanceof Instruction.Mix mix) {
            frame.bowl(mix.bowl()).shuffle(random);
        } else if (instruction instanceof Instruction.ClearStack clean) {
            frame.bowl(clean.bowl()).clear();
        } else if (instruction instanceof Instruction.CopyStack pour) {
            frame.dish(pour.dish()).pourFrom(frame.bowl(pour.bowl()));
        } else if (instruction instanceof Instruction.LoopStart start) {
            if (frame.valueOf(start.ingredient()).number() == 0) {
                frame.jumpTo(start.end() + 1);
                return false;
            }
        } else if (instruction instanceof Instruction.LoopEnd end) {
            if (end.ingredient() != null) {
                Value value = frame.valueOf(end.ingredient());
                frame.setValue(end.ingredient(), value.withNumber(value.number() - 1));
            }
            frame.jumpTo(end.start());
            return false;
        } else if (instruction instanceof Instruction.Break brk) {
            frame.jumpTo(brk.loopEnd() + 1);
            return false;
        } else if (instruction instanceof Instruction.Call call) {
            serveWith(session, frame, call.recipe());
        } else if (instruction instanceof Instruction.Return ret) {
            if (ret.hours() != null && isMain(frame)) {
                serve(session, frame, ret.hours());
            }
            return true;
        } else if (instruction instanceof Instruction.PrintStacks print) {
            if (isMain(frame)) {
                serve(session, frame, print.dishes());
            }
        } else {
            throw new IllegalStateException("Unknown instruction: " + instruction);
        }
        frame.advance();
        return false;
    }

    private static void combine(Frame frame, Instruction.Arithmetic arithmetic) {
        Value operand = frame.valueOf(arithmetic.ingredient());
        ValueStack bowl = nonEmptyBowl(frame, arithmetic.bowl());
        if (arithmetic instanceof Instruction.Divide && operand.number() == 0) {
            throw new ArithmeticException("division by zero: '" + arithmetic.ingredient() + "' is 0");
        }
        int result = arithmetic.apply(bowl.peek().number(), operand.number());
        bowl.replaceTop(new Value(result, operand.liquid()));
    }

    private void serveWith(Session session, Frame caller, String recipeName) {
        Recipe recipe = session.program.recipe(recipeName)
            .orElseThrow(() -> new IllegalStateException("no recipe named '" + recipeName + "'"));
        if (caller.depth() + 1 >= limits.maxCallDepth()) {
            throw new IllegalStateException("recipes nested deeper than " + limits.maxCallDepth());
        }

        var callee = new Frame(recipe, caller.depth() + 1);
        callee.copyBowlsFrom(caller);
        LOG.debug("'{}' serves with '{}' (depth {})", caller.recipe().name(), recipeName, callee.depth());
        cook(session, callee);
        callee.copyBowlsInto(caller);
        LOG.debug("'{}' is back from '{}'", caller.recipe().name(), recipeName);
    }

    private static void serve(Session session, Frame frame, int dishes) {
        LOG.debug("Serving {} dish(es)", dishes);
        for (int n = 1; n <= dishes; n++) {
            if (n > 1) {
                session.output.write("\n");
            }
            ValueStack dish = frame.dish(n);
            while (!dish.isEmpty()) {
                session.output.write(dish.pop().render());
            }
        }
    }

    private void countStep(Session session) {
        session.steps++;
        if (limits.maxSteps() > 0 && session.steps > limits.maxSteps()) {
            throw new IllegalStateException("gave up after " + limits.maxSteps() + " steps");
        }
    }

    private static ValueStack nonEmptyBowl(Frame frame, int n) {
        ValueStack bowl = frame.bowl(n);
        if (bowl.isEmpty()) {
            throw new IllegalStateException("mixing bowl " + n + " is empty");
        }
        return bowl;
    }

    private static boolean isMain(Frame frame) {
        return frame.depth() == 0;
    }

    private static final class Session {
        final Program program;
        final InputSource input;
        final OutputSink output;
        long steps;

        Session(Program program, InputSource input, OutputSink output) {
            this.program = program;
            this.input = input;
            this.output = output;
        }
    }
}
