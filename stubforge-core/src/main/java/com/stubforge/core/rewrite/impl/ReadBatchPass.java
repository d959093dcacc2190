package com.stubforge.core.rewrite.impl;

import com.stubforge.core.model.Cmd;
import com.stubforge.core.model.ReadBatch;
import com.stubforge.core.rewrite.RewritePass;

import java.util.ArrayList;
import java.util.List;

/**
 * Groups each run of consecutive top-level reads with the commands that follow it.
 *
 * <p>A later run of reads is itself batched and placed inside the preceding batch, so
 * in {@code let}-style languages every read value is in scope for the rest of the
 * program. Commands before the first read stay at the top level.
 */
public class ReadBatchPass implements RewritePass {

    @Override
    public String getId() {
        return "read-batch";
    }

    @Override
    public String getDisplayName() {
        return "Read Batches";
    }

    @Override
    public List<Cmd> apply(List<Cmd> commands) {
        return batchFrom(commands, 0);
    }

    private static List<Cmd> batchFrom(List<Cmd> commands, int start) {
        List<Cmd> result = new ArrayList<>();
        int index = start;
        while (index < commands.size() && !(commands.get(index) instanceof Cmd.Read)) {
            result.add(commands.get(index++));
        }
        if (index == commands.size()) {
            return result;
        }

        List<Cmd> reads = new ArrayList<>();
        while (index < commands.size() && commands.get(index) instanceof Cmd.Read) {
            reads.add(commands.get(index++));
        }
        result.add(new Cmd.Opaque(new ReadBatch(reads, batchFrom(commands, index))));
        return result;
    }
}
