package com.vidnyan.pyguard.domain.traversal;

import com.vidnyan.pyguard.domain.syntax.Node;
import com.vidnyan.pyguard.domain.syntax.NodeKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read view of where the walker currently is: the frame stack and the ancestor path.
 * Only {@link ContextTrackingWalker} pushes and pops; rules query.
 * <p>
 * Guard, loop, handler and nesting queries stop at the nearest function frame,
 * so a nested function never inherits the context of the code that defines it.
 */
public final class TraversalContext {

    private final List<String> lines;
    private final List<ScopeFrame> frames = new ArrayList<>();
    private final List<Node> path = new ArrayList<>();

    TraversalContext(List<String> lines) {
        this.lines = lines;
    }

    // ---------------------------------------------------------------- walker

    ScopeFrame push(FrameKind kind, Node node, Set<String> boundNames, String iteratedName) {
        ScopeFrame frame = new ScopeFrame(kind, node, boundNames, iteratedName);
        frames.add(frame);
        return frame;
    }

    ScopeFrame push(FrameKind kind, Node node) {
        return push(kind, node, Set.of(), null);
    }

    void pop() {
        frames.remove(frames.size() - 1);
    }

    void descend(Node node) {
        path.add(node);
    }

    void ascend() {
        path.remove(path.size() - 1);
    }

    // ------------------------------------------------------------- ancestors

    /**
     * Parent of the node currently being checked, or empty at the module.
     */
    public Optional<Node> parent() {
        return path.isEmpty() ? Optional.empty() : Optional.of(path.get(path.size() - 1));
    }

    /**
     * Ancestor {@code levels} above the current node; {@code ancestor(1)} is the parent.
     */
    public Optional<Node> ancestor(int levels) {
        int index = path.size() - levels;
        return index >= 0 && levels > 0 ? Optional.of(path.get(index)) : Optional.empty();
    }

    public List<Node> path() {
        return Collections.unmodifiableList(path);
    }

    // ---------------------------------------------------------------- frames

    public ScopeFrame current() {
        return frames.get(frames.size() - 1);
    }

    public ScopeFrame module() {
        return frames.get(0);
    }

    public List<ScopeFrame> frames() {
        return Collections.unmodifiableList(frames);
    }

    /**
     * Innermost function frame (def, async def or lambda).
     */
    public Optional<ScopeFrame> nearestFunction() {
        for (int i = frames.size() - 1; i >= 0; i--) {
            if (frames.get(i).kind() == FrameKind.FUNCTION) {
                return Optional.of(frames.get(i));
            }
        }
        return Optional.empty();
    }

    /**
     * Innermost {@code def} / {@code async def} frame, skipping lambdas.
     */
    public Optional<ScopeFrame> nearestDef() {
        for (int i = frames.size() - 1; i >= 0; i--) {
            ScopeFrame frame = frames.get(i);
            if (frame.kind() == FrameKind.FUNCTION && frame.node().kind().isFunction()) {
                return Optional.of(frame);
            }
        }
        return Optional.empty();
    }

    /**
     * Innermost def frame, or the module frame outside any function.
     */
    public ScopeFrame scope() {
        return nearestDef().orElse(module());
    }

    public boolean isInFunction() {
        return nearestFunction().isPresent();
    }

    /**
     * Innermost frame of the given kind within the current function.
     */
    public Optional<ScopeFrame> nearest(FrameKind kind) {
        for (int i = frames.size() - 1; i >= 0; i--) {
            ScopeFrame frame = frames.get(i);
            if (frame.kind() == kind) {
                return Optional.of(frame);
            }
            if (frame.kind() == FrameKind.FUNCTION) {
                break;
            }
        }
        return Optional.empty();
    }

    public boolean isGuarded() {
        return nearest(FrameKind.GUARDED).isPresent();
    }

    public boolean isInLoop() {
        return nearest(FrameKind.LOOP).isPresent();
    }

    public boolean isInHandler() {
        return nearest(FrameKind.HANDLER).isPresent();
    }

    public boolean isInFinally() {
        return nearest(FrameKind.FINALLY).isPresent();
    }

    /**
     * Loop or comprehension: code that runs repeatedly.
     */
    public boolean isRepeated() {
        return isInLoop() || nearest(FrameKind.COMPREHENSION).isPresent();
    }

    /**
     * Number of enclosing control blocks within the current function.
     */
    public int controlDepth() {
        int depth = 0;
        for (int i = frames.size() - 1; i >= 0; i--) {
            FrameKind kind = frames.get(i).kind();
            if (kind == FrameKind.FUNCTION) {
                break;
            }
            if (kind.isControlBlock()) {
                depth++;
            }
        }
        return depth;
    }

    /**
     * Number of enclosing {@code def} frames.
     */
    public int defDepth() {
        int depth = 0;
        for (ScopeFrame frame : frames) {
            if (frame.kind() == FrameKind.FUNCTION && frame.node().kind().isFunction()) {
                depth++;
            }
        }
        return depth;
    }

    /**
     * Comprehension frames between here and the nearest function.
     */
    public int comprehensionDepth() {
        int depth = 0;
        for (int i = frames.size() - 1; i >= 0; i--) {
            FrameKind kind = frames.get(i).kind();
            if (kind == FrameKind.FUNCTION) {
                break;
            }
            if (kind == FrameKind.COMPREHENSION) {
                depth++;
            }
        }
        return depth;
    }

    /**
     * The {@code for} loop within the current function iterating over {@code name}, if any.
     */
    public Optional<ScopeFrame> loopOver(String name) {
        for (int i = frames.size() - 1; i >= 0; i--) {
            ScopeFrame frame = frames.get(i);
            if (frame.kind() == FrameKind.FUNCTION) {
                break;
            }
            if (frame.kind() == FrameKind.LOOP && name.equals(frame.iteratedName())) {
                return Optional.of(frame);
            }
        }
        return Optional.empty();
    }

    /**
     * For code inside a closure, the loop or comprehension frame directly enclosing
     * that closure (other blocks in between are skipped, another function stops the search).
     */
    public Optional<ScopeFrame> loopAroundClosure() {
        int closure = -1;
        for (int i = frames.size() - 1; i >= 0; i--) {
            if (frames.get(i).kind() == FrameKind.FUNCTION) {
                closure = i;
                break;
            }
        }
        for (int i = closure - 1; i >= 0; i--) {
            ScopeFrame frame = frames.get(i);
            FrameKind kind = frame.kind();
            if (kind == FrameKind.LOOP || kind == FrameKind.COMPREHENSION) {
                return Optional.of(frame);
            }
            if (kind == FrameKind.FUNCTION || kind == FrameKind.CLASS || kind == FrameKind.MODULE) {
                break;
            }
        }
        return Optional.empty();
    }

    public boolean isDirectlyIn(FrameKind kind) {
        return current().kind() == kind;
    }

    public boolean parentIs(NodeKind kind) {
        return parent().map(node -> node.kind() == kind).orElse(false);
    }

    // ---------------------------------------------------------------- source

    /**
     * Trimmed physical source line, or null when out of range.
     */
    public String sourceLine(int line) {
        if (line < 1 || line > lines.size()) {
            return null;
        }
        return lines.get(line - 1).strip();
    }
}
