package io.github.cyfko.gdsyntax.core.reading;

import io.github.cyfko.gdsyntax.core.syntax.SyntaxToken;
import io.github.cyfko.gdsyntax.core.syntax.tokens.CarriageReturn;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Indentation;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Space;

import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Character classes and small text utilities shared by readers.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ResolvingHelper {

    /** Stops an invalid span at a carriage return; line feeds always stop it. */
    public static final Predicate<Character> LINE_END = c -> c == '\r';

    private static final String OPERATOR_CHARS = "+-*/%=!<>&|^";

    private ResolvingHelper() {}

    public static boolean isSpace(char c) {
        return c == ' ' || c == '\t';
    }

    public static boolean isIdentifierStartChar(char c) {
        return c == '_' || Character.isLetter(c);
    }

    public static boolean isIdentifierChar(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }

    public static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    public static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    public static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }

    public static boolean isOperatorChar(char c) {
        return OPERATOR_CHARS.indexOf(c) >= 0;
    }

    public static boolean isTypeStartChar(char c) {
        return isIdentifierStartChar(c) || isQuote(c);
    }

    public static boolean isIdentifier(String text) {
        if (text == null || text.isEmpty() || !isIdentifierStartChar(text.charAt(0))) {
            return false;
        }
        for (int i = 1; i < text.length(); i++) {
            if (!isIdentifierChar(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Invalid-span terminator for list items: a space, a comma, the closer or a carriage return.
     */
    public static Predicate<Character> listItemEnd(Character closer) {
        return c -> isSpace(c) || c == ',' || c == '\r' || (closer != null && c == closer);
    }

    /**
     * Indentation width of leading whitespace; carriage returns do not count.
     */
    public static int computeIndentation(CharSequence text, int tabWidth) {
        int width = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width += tabWidth;
            }
        }
        return width;
    }

    /**
     * Splits raw leading whitespace into tokens: runs of spaces and tabs become {@link Indentation}
     * (or {@link Space} when {@code indentation} is false), carriage returns stay separate.
     */
    public static void emitWhitespace(CharSequence text, boolean indentation, Consumer<SyntaxToken> sink) {
        StringBuilder run = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\r') {
                flushRun(run, indentation, sink);
                sink.accept(new CarriageReturn());
            } else {
                run.append(c);
            }
        }
        flushRun(run, indentation, sink);
    }

    private static void flushRun(StringBuilder run, boolean indentation, Consumer<SyntaxToken> sink) {
        if (run.length() == 0) {
            return;
        }
        sink.accept(indentation ? Indentation.of(run.toString()) : Space.of(run.toString()));
        run.setLength(0);
    }
}
