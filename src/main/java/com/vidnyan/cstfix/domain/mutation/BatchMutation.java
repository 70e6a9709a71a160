package com.vidnyan.cstfix.domain.mutation;

import com.vidnyan.cstfix.domain.query.SyntaxQueries;
import com.vidnyan.cstfix.domain.syntax.SyntaxConstructionException;
import com.vidnyan.cstfix.domain.syntax.SyntaxCursor;
import com.vidnyan.cstfix.domain.syntax.SyntaxElement;
import com.vidnyan.cstfix.domain.syntax.SyntaxGrammar;
import com.vidnyan.cstfix.domain.syntax.SyntaxNode;
import com.vidnyan.cstfix.domain.syntax.SyntaxToken;
import com.vidnyan.cstfix.domain.syntax.SyntaxTree;
import com.vidnyan.cstfix.domain.syntax.ast.AstNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Edit log recorded against one immutable base tree.
 * <p>
 * Recording an edit never touches the base tree. {@link #commit()} validates the whole batch
 * (every target reachable, no two targets nested, every replacement fits its slot) and only
 * then rebuilds the root-to-edit paths; all other subtrees are carried over by reference.
 * A batch is owned by whoever created it and is not thread-safe.
 */
@Slf4j
public final class BatchMutation {

    private final SyntaxTree base;
    private final List<Edit> edits = new ArrayList<>();

    public BatchMutation(SyntaxTree base) {
        this.base = Objects.requireNonNull(base, "base");
    }

    public SyntaxTree base() {
        return base;
    }

    public boolean isEmpty() {
        return edits.isEmpty();
    }

    public int size() {
        return edits.size();
    }

    public BatchMutation replaceNode(SyntaxCursor old, SyntaxNode replacement) {
        return record(Target.at(old), Objects.requireNonNull(replacement, "replacement"));
    }

    public BatchMutation replaceNode(AstNode old, SyntaxNode replacement) {
        return replaceNode(old.syntax(), replacement);
    }

    /**
     * Replaces the first occurrence, in document order, of {@code old} (by reference).
     */
    public BatchMutation replaceNode(SyntaxNode old, SyntaxNode replacement) {
        return record(Target.of(old), Objects.requireNonNull(replacement, "replacement"));
    }

    public BatchMutation replaceToken(SyntaxCursor old, SyntaxToken replacement) {
        return record(Target.at(old), Objects.requireNonNull(replacement, "replacement"));
    }

    public BatchMutation replaceToken(SyntaxToken old, SyntaxToken replacement) {
        return record(Target.of(old), Objects.requireNonNull(replacement, "replacement"));
    }

    /**
     * Empties the slot holding {@code old}; only legal for optional slots.
     */
    public BatchMutation removeNode(SyntaxCursor old) {
        return record(Target.at(old), null);
    }

    public BatchMutation removeNode(AstNode old) {
        return removeNode(old.syntax());
    }

    /**
     * Validates and applies every recorded edit, returning a new tree.
     *
     * @throws BatchMutationException if any edit is unreachable, overlaps another, or does not fit
     */
    public SyntaxTree commit() {
        List<ResolvedEdit> resolved = resolve();
        if (resolved.isEmpty()) {
            return base;
        }
        EditTrie trie = new EditTrie();
        for (ResolvedEdit edit : resolved) {
            trie.insert(edit.path(), edit.replacement());
        }
        try {
            SyntaxElement root = rebuild(base.root(), trie);
            log.debug("Committed {} edits", resolved.size());
            return SyntaxTree.of((SyntaxNode) root);
        } catch (SyntaxConstructionException e) {
            throw new BatchMutationException("Replacement produced an invalid tree: " + e.getMessage(), e);
        }
    }

    /**
     * The batch expressed as text edits on the base tree's source, sorted by offset.
     *
     * @throws BatchMutationException under the same conditions as {@link #commit()}
     */
    public List<TextEdit> textEdits() {
        List<TextEdit> textEdits = new ArrayList<>();
        for (ResolvedEdit edit : resolve()) {
            String text = edit.replacement() == null ? "" : edit.replacement().fullText();
            textEdits.add(new TextEdit(edit.target().fullRange(), text));
        }
        textEdits.sort(Comparator.comparingInt(e -> e.range().start()));
        return textEdits;
    }

    private BatchMutation record(Target target, SyntaxElement replacement) {
        edits.add(new Edit(target, replacement));
        return this;
    }

    private List<ResolvedEdit> resolve() {
        List<ResolvedEdit> resolved = new ArrayList<>(edits.size());
        for (Edit edit : edits) {
            SyntaxCursor target = locate(edit.target());
            resolved.add(new ResolvedEdit(target, target.path(), edit.replacement()));
        }
        for (int i = 0; i < resolved.size(); i++) {
            for (int j = i + 1; j < resolved.size(); j++) {
                ResolvedEdit a = resolved.get(i);
                ResolvedEdit b = resolved.get(j);
                if (isPrefix(a.path(), b.path()) || isPrefix(b.path(), a.path())) {
                    throw new BatchMutationException(String.format(
                            "Overlapping edits on %s and %s", a.target(), b.target()));
                }
            }
        }
        for (ResolvedEdit edit : resolved) {
            checkFits(edit);
        }
        return resolved;
    }

    private SyntaxCursor locate(Target target) {
        if (target.cursor() != null) {
            SyntaxCursor cursor = target.cursor();
            if (cursor.tree() != base) {
                throw new BatchMutationException(cursor + " belongs to a different tree than this batch");
            }
            Optional<SyntaxCursor> found = Optional.of(base.rootCursor());
            for (int slot : cursor.path()) {
                found = found.flatMap(c -> c.child(slot));
            }
            if (found.isEmpty() || found.get().element() != cursor.element()) {
                throw new BatchMutationException(cursor + " is not reachable in the base tree");
            }
            return found.get();
        }
        return SyntaxQueries.preorder(base)
                .filter(c -> c.element() == target.element())
                .findFirst()
                .orElseThrow(() -> new BatchMutationException(
                        target.element() + " is not reachable in the base tree"));
    }

    private static void checkFits(ResolvedEdit edit) {
        Optional<SyntaxCursor> parent = edit.target().parent();
        SyntaxElement replacement = edit.replacement();
        if (parent.isEmpty()) {
            if (replacement == null || !replacement.isNode()) {
                throw new BatchMutationException("The root can only be replaced by another node");
            }
            return;
        }
        SyntaxNode owner = parent.get().node();
        int slot = edit.target().slot();
        if (replacement == null) {
            if (!SyntaxGrammar.isOptional(owner.kind(), slot)) {
                throw new BatchMutationException(String.format(
                        "Cannot remove %s: slot %d of %s is required", edit.target(), slot, owner.kind()));
            }
            return;
        }
        if (!SyntaxGrammar.accepts(owner.kind(), slot, replacement.kind())) {
            throw new BatchMutationException(String.format(
                    "%s does not fit slot %d of %s (was %s)", replacement.kind(), slot, owner.kind(), edit.target().kind()));
        }
    }

    private static boolean isPrefix(List<Integer> prefix, List<Integer> path) {
        return prefix.size() <= path.size() && path.subList(0, prefix.size()).equals(prefix);
    }

    private static SyntaxElement rebuild(SyntaxElement current, EditTrie trie) {
        if (trie.terminal) {
            return trie.replacement;
        }
        SyntaxNode node = current.asNode();
        List<SyntaxElement> slots = new ArrayList<>(node.slots());
        for (Map.Entry<Integer, EditTrie> entry : trie.children.entrySet()) {
            int index = entry.getKey();
            slots.set(index, rebuild(node.slot(index), entry.getValue()));
        }
        return SyntaxNode.create(node.kind(), slots);
    }

    private record Target(SyntaxCursor cursor, SyntaxElement element) {

        static Target at(SyntaxCursor cursor) {
            return new Target(Objects.requireNonNull(cursor, "old"), cursor.element());
        }

        static Target of(SyntaxElement element) {
            return new Target(null, Objects.requireNonNull(element, "old"));
        }
    }

    private record Edit(Target target, SyntaxElement replacement) {
    }

    private record ResolvedEdit(SyntaxCursor target, List<Integer> path, SyntaxElement replacement) {
    }

    private static final class EditTrie {

        private final Map<Integer, EditTrie> children = new TreeMap<>();
        private boolean terminal;
        private SyntaxElement replacement;

        void insert(List<Integer> path, SyntaxElement replacement) {
            EditTrie node = this;
            for (int slot : path) {
                node = node.children.computeIfAbsent(slot, k -> new EditTrie());
            }
            node.terminal = true;
            node.replacement = replacement;
        }
    }
}
