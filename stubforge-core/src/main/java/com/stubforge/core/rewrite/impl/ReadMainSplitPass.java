package com.stubforge.core.rewrite.impl;

import com.stubforge.core.model.Cmd;
import com.stubforge.core.model.ReadMainSplit;
import com.stubforge.core.rewrite.RewritePass;

import java.util.ArrayList;
import java.util.List;

/**
 * Moves top-level reads in front of everything else, keeping the order within each group.
 */
public class ReadMainSplitPass implements RewritePass {

    @Override
    public String getId() {
        return "read-main-split";
    }

    @Override
    public String getDisplayName() {
        return "Read/Main Split";
    }

    @Override
    public List<Cmd> apply(List<Cmd> commands) {
        List<Cmd> reads = new ArrayList<>();
        List<Cmd> main = new ArrayList<>();
        for (Cmd command : commands) {
            if (command instanceof Cmd.Read) {
                reads.add(command);
            } else {
                main.add(command);
            }
        }
        return List.of(new Cmd.Opaque(new ReadMainSplit(reads, main)));
    }
}
