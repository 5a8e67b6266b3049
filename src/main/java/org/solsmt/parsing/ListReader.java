package org.solsmt.parsing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.solsmt.core.ErrorKind;
import org.solsmt.core.SmtScriptException;
import org.solsmt.core.SolSmtConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads S-expressions one at a time from a piece of text. Has no knowledge of
 * what the expressions mean.
 */
public final class ListReader {

    private static final Logger logger = LoggerFactory.getLogger(ListReader.class);

    private static final char QUOTE = '|';

    private final String data;
    private final int maxDepth;
    private final boolean strictParentheses;
    private int pos = 0;

    public ListReader(String data) {
        this(data, SolSmtConfig.defaults());
    }

    public ListReader(String data, SolSmtConfig config) {
        this.data = Objects.requireNonNull(data, "Input cannot be null");
        this.maxDepth = config.getMaxDepth();
        this.strictParentheses = config.isStrictParentheses();
    }

    /**
     * Reads the next node and moves past it.
     * At the end of the input this returns an empty atom.
     * @return the node.
     * @throws SmtScriptException if nesting exceeds the configured depth, or in
     *     strict mode if the input ends inside a list.
     */
    public Node read() {
        return readNode(0);
    }

    /**
     * @return true if anything other than whitespace is left.
     */
    public boolean hasRemaining() {
        skipWhitespace();
        return pos < data.length();
    }

    public String remaining() {
        return data.substring(pos);
    }

    public int getPosition() {
        return pos;
    }

    /**
     * @return the input between two positions, used for diagnostics.
     */
    public String slice(int from, int to) {
        return data.substring(from, to);
    }

    private Node readNode(int depth) {
        skipWhitespace();
        if (peek() != '(') {
            return readToken();
        }
        if (depth >= maxDepth) {
            logger.error("List nesting exceeds {} at offset {}", maxDepth, pos);
            throw new SmtScriptException(ErrorKind.NESTING_TOO_DEEP,
                    "List nesting exceeds " + maxDepth + " at offset " + pos);
        }
        int start = pos;
        advance();
        skipWhitespace();
        List<Node> items = new ArrayList<>();
        while (pos < data.length() && peek() != ')') {
            items.add(readNode(depth + 1));
            skipWhitespace();
        }
        if (peek() == ')') {
            advance();
        } else if (strictParentheses) {
            logger.error("Input ended inside the list opened at offset {}", start);
            throw new SmtScriptException(ErrorKind.UNTERMINATED_LIST,
                    "Input ended inside the list opened at offset " + start);
        } else {
            logger.warn("Input ended inside the list opened at offset {}, using the {} items read so far",
                    start, items.size());
        }
        return Node.list(items);
    }

    private Node.Atom readToken() {
        int start = pos;
        if (peek() == QUOTE) {
            advance();
            while (pos < data.length() && peek() != QUOTE) {
                advance();
            }
            String text = data.substring(start + 1, pos);
            if (pos < data.length()) {
                advance();
            } else {
                logger.warn("Quoted atom starting at offset {} is not closed", start);
            }
            return Node.quotedAtom(text);
        }
        while (pos < data.length()) {
            char c = peek();
            if (Character.isWhitespace(c) || c == '(' || c == ')') {
                break;
            }
            advance();
        }
        return Node.atom(data.substring(start, pos));
    }

    private void skipWhitespace() {
        while (pos < data.length() && Character.isWhitespace(data.charAt(pos))) {
            pos++;
        }
    }

    private char peek() {
        return pos < data.length() ? data.charAt(pos) : 0;
    }

    private void advance() {
        pos++;
    }
}
