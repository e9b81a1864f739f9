package io.github.cyfko.gdsyntax.core.syntax;

import io.github.cyfko.gdsyntax.core.exception.InvalidStateException;

/**
 * Offset, line and column of a point of the root text.
 * <p>
 * Locating walks the leaves of the root once, in source order, counting characters and line
 * feeds until the target token is entered (start) or left (end).
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
record TextLocation(int offset, int line, int column) {

    static TextLocation startOf(SyntaxToken token) {
        return locate(token, false);
    }

    static TextLocation endOf(SyntaxToken token) {
        return locate(token, true);
    }

    private static TextLocation locate(SyntaxToken token, boolean end) {
        Cursor cursor = new Cursor(token, end);
        if (!cursor.walk(token.getRoot())) {
            throw new InvalidStateException("Token is not part of its root: " + token.getClass().getSimpleName());
        }
        return new TextLocation(cursor.offset, cursor.line, cursor.column);
    }

    private static final class Cursor {
        private final SyntaxToken target;
        private final boolean end;
        private int offset;
        private int line;
        private int column;

        private Cursor(SyntaxToken target, boolean end) {
            this.target = target;
            this.end = end;
        }

        /**
         * @return whether the target point was reached
         */
        private boolean walk(SyntaxToken token) {
            if (token == target && !end) {
                return true;
            }
            if (token instanceof SyntaxNode node) {
                for (SyntaxToken child : node.getForm()) {
                    if (walk(child)) {
                        return true;
                    }
                }
            } else {
                advance(token.toString());
            }
            return token == target;
        }

        private void advance(String text) {
            for (int i = 0; i < text.length(); i++) {
                if (text.charAt(i) == '\n') {
                    line++;
                    column = 0;
                } else {
                    column++;
                }
            }
            offset += text.length();
        }
    }
}
