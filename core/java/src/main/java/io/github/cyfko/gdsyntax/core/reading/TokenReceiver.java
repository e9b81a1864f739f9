package io.github.cyfko.gdsyntax.core.reading;

import io.github.cyfko.gdsyntax.core.syntax.SyntaxToken;

import java.util.function.Consumer;

/**
 * Callback through which a resolver hands its result to the node that pushed it.
 * <p>
 * Exactly one of the two methods is called, right after the resolver popped itself and before
 * it passes on the character that ended it.
 * </p>
 *
 * @param <T> the kind of token produced
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface TokenReceiver<T extends SyntaxToken> {

    void handleReceivedToken(T token);

    /**
     * Signals that nothing could be read at the current position.
     */
    void handleReceivedTokenSkip();

    static <T extends SyntaxToken> TokenReceiver<T> of(Consumer<T> onToken, Runnable onSkip) {
        return new TokenReceiver<>() {
            @Override
            public void handleReceivedToken(T token) {
                onToken.accept(token);
            }

            @Override
            public void handleReceivedTokenSkip() {
                onSkip.run();
            }
        };
    }
}
