package com.vidnyan.pyguard.domain.traversal;

import com.vidnyan.pyguard.domain.syntax.Node;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * One entry of the traversal stack.
 * Besides its kind and owning node it carries per-scan tallies and markers,
 * which lets rules accumulate facts about a region without holding state themselves.
 */
public final class ScopeFrame {

    private final FrameKind kind;
    private final Node node;
    private final Set<String> boundNames;
    private final String iteratedName;
    private final Map<String, Integer> tallies = new HashMap<>();
    private final Set<String> marks = new HashSet<>();

    ScopeFrame(FrameKind kind, Node node, Set<String> boundNames, String iteratedName) {
        this.kind = kind;
        this.node = node;
        this.boundNames = Set.copyOf(boundNames);
        this.iteratedName = iteratedName;
    }

    public FrameKind kind() {
        return kind;
    }

    public Node node() {
        return node;
    }

    /**
     * Names bound on entry: loop or comprehension targets.
     */
    public Set<String> boundNames() {
        return boundNames;
    }

    public boolean binds(String name) {
        return boundNames.contains(name);
    }

    /**
     * For a {@code for} loop over a plain name ({@code for x in items}), that name; otherwise null.
     */
    public String iteratedName() {
        return iteratedName;
    }

    public int tally(String key) {
        return tally(key, 1);
    }

    public int tally(String key, int amount) {
        return tallies.merge(key, amount, Integer::sum);
    }

    public int count(String key) {
        return tallies.getOrDefault(key, 0);
    }

    public void mark(String key) {
        marks.add(key);
    }

    public boolean isMarked(String key) {
        return marks.contains(key);
    }

    /**
     * @return true the first time the key is marked on this frame
     */
    public boolean markOnce(String key) {
        return marks.add(key);
    }

    @Override
    public String toString() {
        return kind + "@" + node.line();
    }
}
