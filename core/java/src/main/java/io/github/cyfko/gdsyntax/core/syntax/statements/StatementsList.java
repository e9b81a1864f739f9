package io.github.cyfko.gdsyntax.core.syntax.statements;

import io.github.cyfko.gdsyntax.core.reading.KeywordResolver;
import io.github.cyfko.gdsyntax.core.reading.ReadingState;
import io.github.cyfko.gdsyntax.core.reading.ResolvingHelper;
import io.github.cyfko.gdsyntax.core.reading.TokenReceiver;
import io.github.cyfko.gdsyntax.core.syntax.IndentedTokensList;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Keyword;
import io.github.cyfko.gdsyntax.core.syntax.tokens.KeywordType;

/**
 * A block of statements: method and lambda bodies, branches, loop bodies.
 * <p>
 * The first word of a line selects the statement: {@code if}, {@code for}, {@code while},
 * {@code match}, {@code var} and {@code const} have dedicated nodes, everything else is an
 * {@link ExpressionStatement}.
 * </p>
 */
public final class StatementsList extends IndentedTokensList<Statement> {

    public StatementsList(int parentIndentation) {
        super(Statement.class, parentIndentation);
    }

    private StatementsList() {
        super(Statement.class);
    }

    /**
     * @return a top-level block accepting every line
     */
    public static StatementsList root() {
        return new StatementsList();
    }

    @Override
    protected void readElement(char c, int lineIndentation, ReadingState state) {
        if (!ResolvingHelper.isIdentifierStartChar(c)) {
            start(new ExpressionStatement(lineIndentation), state);
            state.passChar(c);
            return;
        }
        state.pushAndPass(new KeywordResolver(TokenReceiver.of(keyword -> {
            start(create(keyword, lineIndentation), state);
            state.passString(keyword.toString());
        }, this::elementSkipped)), c);
    }

    private static Statement create(Keyword keyword, int lineIndentation) {
        KeywordType type = keyword.getType();
        if (type == null) {
            return new ExpressionStatement(lineIndentation);
        }
        return switch (type) {
            case IF -> new IfStatement(lineIndentation);
            case FOR -> new ForStatement(lineIndentation);
            case WHILE -> new WhileStatement(lineIndentation);
            case MATCH -> new MatchStatement(lineIndentation);
            case VAR, CONST -> new VariableDeclarationStatement(lineIndentation);
            default -> new ExpressionStatement(lineIndentation);
        };
    }

    private void start(Statement statement, ReadingState state) {
        addElement(statement);
        state.push(statement);
    }

    @Override
    protected StatementsList createEmptyInstance() {
        return isRoot() ? root() : new StatementsList(getParentIndentation());
    }
}
