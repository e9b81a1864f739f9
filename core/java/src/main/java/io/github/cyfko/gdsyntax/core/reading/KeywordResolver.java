package io.github.cyfko.gdsyntax.core.reading;

import io.github.cyfko.gdsyntax.core.syntax.tokens.Keyword;

import java.util.Objects;

/**
 * Reads one word and hands it to its owner as a {@link Keyword}; the owner checks its type.
 * Receiving a character that cannot start a word is reported as a skip.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class KeywordResolver extends Reader {

    private final TokenReceiver<Keyword> owner;
    private final StringBuilder word = new StringBuilder();

    public KeywordResolver(TokenReceiver<Keyword> owner) {
        this.owner = Objects.requireNonNull(owner, "Keyword owner cannot be null");
    }

    @Override
    public void handleChar(char c, ReadingState state) {
        boolean accepted = word.length() == 0
                ? ResolvingHelper.isIdentifierStartChar(c)
                : ResolvingHelper.isIdentifierChar(c);
        if (accepted) {
            word.append(c);
            return;
        }
        complete(state);
        state.passChar(c);
    }

    @Override
    public void handleNewLineChar(ReadingState state) {
        complete(state);
        state.passChar('\n');
    }

    @Override
    public void forceComplete(ReadingState state) {
        complete(state);
    }

    private void complete(ReadingState state) {
        state.pop();
        if (word.length() == 0) {
            owner.handleReceivedTokenSkip();
        } else {
            owner.handleReceivedToken(Keyword.of(word.toString()));
        }
    }
}
