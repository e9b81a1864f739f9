package io.github.cyfko.gdsyntax.core.syntax.declarations;

import io.github.cyfko.gdsyntax.core.reading.KeywordResolver;
import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.reading.TokenReceiver;
import io.github.cyfko.gdsyntax.core.syntax.IndentedTokensList;
import io.github.cyfko.gdsyntax.core.syntax.tokens.KeywordType;

/**
 * The {@code get} and {@code set} accessors of a member variable, as an indented block or inline
 * after the colon, separated by {@code ,} or {@code ;}.
 */
public final class AccessorsList extends IndentedTokensList<AccessorDeclaration> {

    public AccessorsList(int parentIndentation) {
        super(AccessorDeclaration.class, parentIndentation);
    }

    @Override
    protected boolean isSeparator(char c) {
        return c == ';' || c == ',';
    }

    @Override
    protected void readElement(char c, int lineIndentation, ReadingState state) {
        state.pushAndPass(new KeywordResolver(TokenReceiver.of(keyword -> {
            AccessorDeclaration accessor;
            if (keyword.is(KeywordType.GET)) {
                accessor = new GetAccessorDeclaration(lineIndentation);
            } else if (keyword.is(KeywordType.SET)) {
                accessor = new SetAccessorDeclaration(lineIndentation);
            } else {
                elementSkipped();
                state.passString(keyword.toString());
                return;
            }
            addElement(accessor);
            state.push(accessor);
            state.passString(keyword.toString());
        }, this::elementSkipped)), c);
    }

    @Override
    protected AccessorsList createEmptyInstance() {
        return new AccessorsList(getParentIndentation());
    }
}
