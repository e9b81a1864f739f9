package io.github.cyfko.gdsyntax.core.syntax.tokens;

import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.syntax.SyntaxToken;

/**
 * A string literal with its quotes and escapes kept as written.
 *
 * <h2>Reading rules</h2>
 * <ul>
 *   <li>a single quote character opens a one-line string; two identical quotes form the empty
 *       string; three open a multi-line string closed by the same three quotes</li>
 *   <li>a backslash escapes the next character, whatever it is</li>
 *   <li>a one-line string not closed before the end of the line ends there, unterminated</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class StringToken extends SyntaxToken {

    private enum Phase { OPENING, CONTENT, CLOSED }

    private Phase phase = Phase.OPENING;
    private char quote;
    private int openingCount;
    private int closingCount;
    private int pendingQuotes;
    private boolean escaped;
    private final StringBuilder content = new StringBuilder();

    public StringToken() {}

    /**
     * Builds a closed literal around raw content; escapes in {@code value} are kept as they are.
     */
    public static StringToken of(String value, StringBoundingType bounding) {
        StringToken token = new StringToken();
        token.quote = bounding.getQuote();
        token.openingCount = bounding.getCount();
        token.closingCount = bounding.getCount();
        token.content.append(value);
        token.phase = Phase.CLOSED;
        return token;
    }

    /**
     * @return the text between the quotes, escapes not interpreted
     */
    public String getValue() {
        return content.toString();
    }

    public StringBoundingType getBoundingType() {
        return StringBoundingType.of(quote, openingCount);
    }

    public boolean isClosed() {
        return closingCount == openingCount && openingCount > 0;
    }

    @Override
    public void handleChar(char c, ReadingState state) {
        read(c, state);
    }

    @Override
    public void handleNewLineChar(ReadingState state) {
        read('\n', state);
    }

    @Override
    public void handleCarriageReturnChar(ReadingState state) {
        read('\r', state);
    }

    @Override
    public void handleSharpChar(ReadingState state) {
        read('#', state);
    }

    @Override
    public void handleLeftSlashChar(ReadingState state) {
        read('\\', state);
    }

    @Override
    public void forceComplete(ReadingState state) {
        if (phase == Phase.OPENING && openingCount == 2) {
            openingCount = 1;
            closingCount = 1;
        }
        flushPendingQuotes();
        state.pop();
    }

    private void read(char c, ReadingState state) {
        switch (phase) {
            case OPENING -> readOpening(c, state);
            case CONTENT -> readContent(c, state);
            case CLOSED -> state.popAndPass(c);
        }
    }

    private void readOpening(char c, ReadingState state) {
        if (openingCount == 0) {
            quote = c;
            openingCount = 1;
            return;
        }
        if (c == quote) {
            openingCount++;
            if (openingCount == 3) {
                phase = Phase.CONTENT;
            }
            return;
        }
        if (openingCount == 2) {
            // empty string
            openingCount = 1;
            closingCount = 1;
            phase = Phase.CLOSED;
            state.popAndPass(c);
            return;
        }
        phase = Phase.CONTENT;
        readContent(c, state);
    }

    private void readContent(char c, ReadingState state) {
        if (escaped) {
            content.append(c);
            escaped = false;
            return;
        }
        if (openingCount == 1) {
            if (c == quote) {
                closingCount = 1;
                phase = Phase.CLOSED;
                state.pop();
            } else if (c == '\n') {
                phase = Phase.CLOSED;
                state.popAndPass(c);
            } else {
                escaped = c == '\\';
                content.append(c);
            }
            return;
        }
        if (c == quote) {
            pendingQuotes++;
            if (pendingQuotes == 3) {
                pendingQuotes = 0;
                closingCount = 3;
                phase = Phase.CLOSED;
                state.pop();
            }
            return;
        }
        flushPendingQuotes();
        escaped = c == '\\';
        content.append(c);
    }

    private void flushPendingQuotes() {
        content.append(String.valueOf(quote).repeat(pendingQuotes));
        pendingQuotes = 0;
    }

    @Override
    public String toString() {
        String q = String.valueOf(quote);
        return q.repeat(openingCount) + content + q.repeat(pendingQuotes) + q.repeat(closingCount);
    }

    @Override
    public StringToken clone() {
        StringToken copy = new StringToken();
        copy.phase = phase;
        copy.quote = quote;
        copy.openingCount = openingCount;
        copy.closingCount = closingCount;
        copy.pendingQuotes = pendingQuotes;
        copy.escaped = escaped;
        copy.content.append(content);
        return copy;
    }
}
