package com.sievesql.generator;

import com.sievesql.exception.SerializeError;
import com.sievesql.frame.Anchor;
import com.sievesql.frame.Frame;
import com.sievesql.frame.Phrase;
import com.sievesql.mark.Marked;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * State of a single serialization: the frame index, the aliases and the
 * output buffer.
 *
 * <p>Dialects render clauses through this context; {@link #dump(Phrase)}
 * and {@link #dump(Frame)} dispatch back to the dialect, so a dialect only
 * overrides the cases it renders differently.
 */
public final class SerializationContext {

    private final Dialect dialect;
    private final SqlWriter writer = new SqlWriter();
    private final Map<Integer, Frame> frameByTag = new HashMap<>();
    private final Map<Integer, List<String>> selectAliasesByTag = new HashMap<>();
    private final Map<Integer, String> frameAliasByTag = new HashMap<>();
    private final Deque<Boolean> withAliasesStack = new ArrayDeque<>();
    private boolean withAliases;

    public SerializationContext(Dialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
    }

    public Dialect dialect() {
        return dialect;
    }

    // ==================== Frame index ====================

    /**
     * Indexes every frame of the tree by its tag.
     */
    public void setTree(Frame root) {
        Deque<Frame> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            Frame frame = queue.poll();
            frameByTag.put(frame.tag(), frame);
            queue.addAll(frame.kids());
        }
    }

    public Frame frame(int tag) {
        Frame frame = frameByTag.get(tag);
        if (frame == null) {
            throw new IllegalStateException("unknown frame tag: " + tag);
        }
        return frame;
    }

    // ==================== Aliases ====================

    public void setSelectAliases(int tag, List<String> aliases) {
        selectAliasesByTag.put(tag, new ArrayList<>(aliases));
    }

    public List<String> selectAliases(int tag) {
        List<String> aliases = selectAliasesByTag.get(tag);
        if (aliases == null) {
            throw new IllegalStateException("no select aliases for frame " + tag);
        }
        return aliases;
    }

    public void setFrameAlias(int tag, String alias) {
        frameAliasByTag.put(tag, alias);
    }

    public String frameAlias(int tag) {
        String alias = frameAliasByTag.get(tag);
        if (alias == null) {
            throw new IllegalStateException("no alias for frame " + tag);
        }
        return alias;
    }

    public boolean withAliases() {
        return withAliases;
    }

    public void pushWithAliases(boolean value) {
        withAliasesStack.push(withAliases);
        withAliases = value;
    }

    public void popWithAliases() {
        withAliases = withAliasesStack.pop();
    }

    // ==================== Output ====================

    public SerializationContext write(String data) {
        writer.write(data);
        return this;
    }

    public SerializationContext name(String name, Marked origin) {
        try {
            writer.write(SqlQuoting.quoteName(name));
        } catch (IllegalArgumentException exc) {
            throw new SerializeError(exc.getMessage(), origin.mark(), exc);
        }
        return this;
    }

    public SerializationContext literal(String value, Marked origin) {
        try {
            writer.write(SqlQuoting.quoteLiteral(value));
        } catch (IllegalArgumentException exc) {
            throw new SerializeError(exc.getMessage(), origin.mark(), exc);
        }
        return this;
    }

    public SerializationContext dump(Phrase phrase) {
        dialect.dumpPhrase(phrase, this);
        return this;
    }

    public SerializationContext dump(Frame frame) {
        dialect.dumpFrame(frame, this);
        return this;
    }

    public SerializationContext dump(Anchor anchor) {
        dialect.dumpAnchor(anchor, this);
        return this;
    }

    /**
     * Dumps the phrases separated by {@code separator}.
     */
    public SerializationContext union(List<Phrase> phrases, String separator) {
        for (int i = 0; i < phrases.size(); i++) {
            if (i > 0) {
                writer.write(separator);
            }
            dump(phrases.get(i));
        }
        return this;
    }

    public void newline() {
        writer.newline();
    }

    public void indent() {
        writer.indent();
    }

    public void dedent() {
        writer.dedent();
    }

    public String flush() {
        return writer.flush();
    }
}
