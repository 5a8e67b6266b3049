package org.solsmt.parsing;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * A parsed S-expression: either an {@link Atom} or an {@link SList} of nodes.
 * The two cases are closed; consumers distinguish them with
 * {@link #match(Function, Function)} or a {@link Visitor}.
 */
public abstract class Node {

    private Node() {
    }

    public static Atom atom(String text) {
        return new Atom(text, false);
    }

    public static Atom quotedAtom(String text) {
        return new Atom(text, true);
    }

    public static SList list(Node... items) {
        return new SList(List.of(items));
    }

    public static SList list(List<Node> items) {
        return new SList(items);
    }

    public abstract <T> T accept(Visitor<T> visitor);

    /**
     * Applies the function matching this node's case.
     */
    public abstract <T> T match(Function<Atom, T> onAtom, Function<SList, T> onList);

    public boolean isAtom() {
        return match(a -> true, l -> false);
    }

    public boolean isList() {
        return !isAtom();
    }

    /**
     * A leaf token. For a quoted atom ({@code |two words|}) the text is the
     * content between the pipes.
     */
    public static final class Atom extends Node {
        private final String text;
        private final boolean quoted;

        private Atom(String text, boolean quoted) {
            this.text = Objects.requireNonNull(text, "Atom text cannot be null");
            this.quoted = quoted;
        }

        public String getText() {
            return text;
        }

        public boolean isQuoted() {
            return quoted;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitAtom(this);
        }

        @Override
        public <T> T match(Function<Atom, T> onAtom, Function<SList, T> onList) {
            return onAtom.apply(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            Atom atom = (Atom) o;
            return quoted == atom.quoted && text.equals(atom.text);
        }

        @Override
        public int hashCode() {
            return Objects.hash(text, quoted);
        }

        @Override
        public String toString() {
            return quoted ? "|" + text + "|" : text;
        }
    }

    /**
     * An ordered list of nodes.
     */
    public static final class SList extends Node {
        private final List<Node> items;

        private SList(List<Node> items) {
            this.items = List.copyOf(Objects.requireNonNull(items, "List items cannot be null"));
        }

        public List<Node> getItems() {
            return items;
        }

        public int size() {
            return items.size();
        }

        public boolean isEmpty() {
            return items.isEmpty();
        }

        public Node get(int index) {
            return items.get(index);
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitList(this);
        }

        @Override
        public <T> T match(Function<Atom, T> onAtom, Function<SList, T> onList) {
            return onList.apply(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            return items.equals(((SList) o).items);
        }

        @Override
        public int hashCode() {
            return items.hashCode();
        }

        @Override
        public String toString() {
            return items.stream().map(Node::toString).collect(Collectors.joining(" ", "(", ")"));
        }
    }

    public interface Visitor<T> {
        T visitAtom(Atom atom);

        T visitList(SList list);
    }
}
