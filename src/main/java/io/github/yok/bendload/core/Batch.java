package io.github.yok.bendload.core;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import lombok.ToString;

/**
 * Ordered group of raw lines dispatched as one {@code INSERT}.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString(exclude = "lines")
public final class Batch {

    // 1-based position of this batch within the load
    private final int index;

    private final List<String> lines;

    public Batch(int index, List<String> lines) {
        this.index = index;
        this.lines = ImmutableList.copyOf(lines);
    }

    public int size() {
        return lines.size();
    }
}
