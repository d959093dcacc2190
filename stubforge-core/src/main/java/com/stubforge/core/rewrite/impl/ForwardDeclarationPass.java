package com.stubforge.core.rewrite.impl;

import com.stubforge.core.model.Cmd;
import com.stubforge.core.model.ForwardDeclarations;
import com.stubforge.core.model.VarType;
import com.stubforge.core.model.VariableCommand;
import com.stubforge.core.rewrite.LoopCounters;
import com.stubforge.core.rewrite.RewritePass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Hoists every variable declaration to the top of the program.
 *
 * <p>For languages such as Pascal, where variables are declared in a block before any
 * statement. Each identifier is declared once (first occurrence wins) and one integer
 * counter is added per loop nesting level.
 */
public class ForwardDeclarationPass implements RewritePass {

    private static final Logger log = LoggerFactory.getLogger(ForwardDeclarationPass.class);

    @Override
    public String getId() {
        return "forward-declarations";
    }

    @Override
    public String getDisplayName() {
        return "Forward Declarations";
    }

    @Override
    public List<Cmd> apply(List<Cmd> commands) {
        List<VariableCommand> declarations = new ArrayList<>();
        Set<String> declared = new HashSet<>();
        for (Cmd command : commands) {
            collect(command, declarations, declared);
        }

        int depth = LoopCounters.maxNestingDepth(commands);
        for (String counter : LoopCounters.forCommands(commands).first(depth)) {
            if (declared.add(counter)) {
                declarations.add(VariableCommand.of(counter, VarType.INT));
            }
        }

        log.debug("Hoisted {} declarations ({} loop counters)", declarations.size(), depth);
        return List.of(new Cmd.Opaque(new ForwardDeclarations(declarations, commands)));
    }

    private static void collect(Cmd command, List<VariableCommand> declarations, Set<String> declared) {
        if (command instanceof Cmd.Read read) {
            addAll(read.variables(), declarations, declared);
        } else if (command instanceof Cmd.LoopLine loopLine) {
            addAll(loopLine.variables(), declarations, declared);
        } else if (command instanceof Cmd.Loop loop) {
            collect(loop.body(), declarations, declared);
        }
    }

    private static void addAll(List<VariableCommand> variables, List<VariableCommand> declarations, Set<String> declared) {
        for (VariableCommand variable : variables) {
            if (declared.add(variable.identifier())) {
                declarations.add(variable);
            }
        }
    }
}
