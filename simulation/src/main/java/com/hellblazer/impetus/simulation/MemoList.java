package com.hellblazer.impetus.simulation;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A set of {@link Memorizable} callbacks memorized together.
 *
 * @author hal.hildebrand
 */
public class MemoList implements Memorizable {

    private final List<Memorizable> memorizables = new CopyOnWriteArrayList<>();

    public void addMemo(Memorizable memorizable) {
        if (!memorizables.contains(memorizable)) {
            memorizables.add(memorizable);
        }
    }

    public void removeMemo(Memorizable memorizable) {
        memorizables.remove(memorizable);
    }

    public List<Memorizable> getMemos() {
        return List.copyOf(memorizables);
    }

    @Override
    public void memorize() {
        memorizables.forEach(Memorizable::memorize);
    }
}
