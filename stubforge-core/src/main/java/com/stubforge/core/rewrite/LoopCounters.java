package com.stubforge.core.rewrite;

import com.stubforge.core.model.Cmd;
import com.stubforge.core.model.VariableCommand;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Names of loop index variables, one per nesting depth.
 *
 * <p>Names come from the pool {@code i, j, k, ..., z, a, ..., h}, skipping any letter that
 * matches (ignoring case) an identifier or loop count of the stub. When the pool runs out
 * the letters are reused with a numeric suffix ({@code i1, j1, ...}).
 */
public final class LoopCounters {

    static final List<String> POOL = List.of(
        "i", "j", "k", "l", "m", "n", "o", "p", "q", "r", "s", "t", "u",
        "v", "w", "x", "y", "z", "a", "b", "c", "d", "e", "f", "g", "h");

    private final Set<String> reserved;
    private final List<String> names = new ArrayList<>();
    private int round;

    private LoopCounters(Set<String> reserved) {
        this.reserved = reserved;
    }

    /**
     * Creates the counters for a command tree, avoiding every name the tree uses.
     *
     * @param commands top-level commands
     * @return loop counters for this tree
     */
    public static LoopCounters forCommands(List<Cmd> commands) {
        Set<String> reserved = new HashSet<>();
        commands.forEach(command -> collectNames(command, reserved));
        return new LoopCounters(reserved);
    }

    /**
     * Returns the loop index name used at {@code depth} (0 for an outermost loop).
     *
     * @param depth nesting depth
     * @return index variable name
     */
    public String nameAt(int depth) {
        while (names.size() <= depth) {
            String suffix = round == 0 ? "" : Integer.toString(round);
            for (String letter : POOL) {
                String candidate = letter + suffix;
                if (!reserved.contains(candidate)) {
                    names.add(candidate);
                }
            }
            round++;
        }
        return names.get(depth);
    }

    public List<String> first(int count) {
        List<String> result = new ArrayList<>(count);
        for (int depth = 0; depth < count; depth++) {
            result.add(nameAt(depth));
        }
        return result;
    }

    /**
     * Returns how many loop index variables a command needs: a loop adds one level to
     * its body, a loopline needs one, anything else none.
     *
     * @param command command to measure
     * @return nesting depth
     */
    public static int nestingDepth(Cmd command) {
        if (command instanceof Cmd.Loop loop) {
            return 1 + nestingDepth(loop.body());
        }
        if (command instanceof Cmd.LoopLine) {
            return 1;
        }
        return 0;
    }

    public static int maxNestingDepth(List<Cmd> commands) {
        return commands.stream().mapToInt(LoopCounters::nestingDepth).max().orElse(0);
    }

    private static void collectNames(Cmd command, Set<String> names) {
        if (command instanceof Cmd.Read read) {
            read.variables().forEach(variable -> addVariable(variable, names));
        } else if (command instanceof Cmd.LoopLine loopLine) {
            names.add(lower(loopLine.countVariable()));
            loopLine.variables().forEach(variable -> addVariable(variable, names));
        } else if (command instanceof Cmd.Loop loop) {
            names.add(lower(loop.countVariable()));
            collectNames(loop.body(), names);
        } else if (command instanceof Cmd.Opaque opaque) {
            opaque.artifact().children().forEach(child -> collectNames(child, names));
        }
    }

    private static void addVariable(VariableCommand variable, Set<String> names) {
        names.add(lower(variable.identifier()));
    }

    private static String lower(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
