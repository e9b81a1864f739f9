package io.github.cyfko.gdsyntax.core.syntax.declarations;

import io.github.cyfko.gdsyntax.core.ScriptReaderFactory;
import io.github.cyfko.gdsyntax.core.api.ScriptReader;
import io.github.cyfko.gdsyntax.core.syntax.SyntaxToken;
import io.github.cyfko.gdsyntax.core.syntax.TokensForm;
import io.github.cyfko.gdsyntax.core.syntax.expressions.NumberExpression;
import io.github.cyfko.gdsyntax.core.syntax.expressions.PassExpression;
import io.github.cyfko.gdsyntax.core.syntax.statements.ExpressionStatement;
import io.github.cyfko.gdsyntax.core.syntax.statements.StatementsList;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Identifier;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Indentation;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Keyword;
import io.github.cyfko.gdsyntax.core.syntax.tokens.KeywordType;
import io.github.cyfko.gdsyntax.core.syntax.tokens.NewLine;
import io.github.cyfko.gdsyntax.core.syntax.tokens.NumberToken;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Punctuation;
import io.github.cyfko.gdsyntax.core.syntax.tokens.PunctuationType;
import io.github.cyfko.gdsyntax.core.syntax.tokens.Space;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for trees assembled slot by slot instead of read from text.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("Direct Construction Tests")
class DirectConstructionTest {

    private static final String SCRIPT = "var x = 1\nfunc run(delta):\n\tpass\nenum State { IDLE, RUN = 2 }\n";

    private final ScriptReader reader = ScriptReaderFactory.create();

    // ==================== Builders ====================

    private static VariableDeclaration variable(String name, String value) {
        VariableDeclaration variable = new VariableDeclaration(0);
        TokensForm<VariableDeclaration.State> form = variable.getForm();
        form.set(VariableDeclaration.State.VAR.slot(), Keyword.of(KeywordType.VAR));
        form.addBefore(VariableDeclaration.State.IDENTIFIER.slot(), Space.of(" "));
        form.set(VariableDeclaration.State.IDENTIFIER.slot(), Identifier.of(name));
        form.addBefore(VariableDeclaration.State.ASSIGN.slot(), Space.of(" "));
        form.set(VariableDeclaration.State.ASSIGN.slot(), Punctuation.of(PunctuationType.ASSIGN));
        form.addBefore(VariableDeclaration.State.INITIALIZER.slot(), Space.of(" "));
        form.set(VariableDeclaration.State.INITIALIZER.slot(), new NumberExpression(NumberToken.of(value)));
        form.setState(VariableDeclaration.State.COMPLETED);
        return variable;
    }

    private static MethodDeclaration method(String name, String parameter) {
        MethodDeclaration method = new MethodDeclaration(0);
        TokensForm<MethodDeclaration.State> form = method.getForm();
        form.set(MethodDeclaration.State.FUNC.slot(), Keyword.of(KeywordType.FUNC));
        form.addBefore(MethodDeclaration.State.IDENTIFIER.slot(), Space.of(" "));
        form.set(MethodDeclaration.State.IDENTIFIER.slot(), Identifier.of(name));
        form.set(MethodDeclaration.State.OPEN.slot(), Punctuation.of(PunctuationType.OPEN_BRACKET));

        ParameterDeclaration declaration = new ParameterDeclaration(0);
        declaration.getForm().set(ParameterDeclaration.State.IDENTIFIER.slot(), Identifier.of(parameter));
        declaration.getForm().setState(ParameterDeclaration.State.COMPLETED);
        ParametersList parameters = new ParametersList(0);
        parameters.getForm().addToEnd(declaration);
        form.set(MethodDeclaration.State.PARAMETERS.slot(), parameters);

        form.set(MethodDeclaration.State.CLOSE.slot(), Punctuation.of(PunctuationType.CLOSE_BRACKET));
        form.set(MethodDeclaration.State.COLON.slot(), Punctuation.of(PunctuationType.COLON));

        ExpressionStatement pass = new ExpressionStatement(4);
        pass.getForm().set(ExpressionStatement.State.EXPRESSION.slot(), new PassExpression(Keyword.of(KeywordType.PASS)));
        pass.getForm().setState(ExpressionStatement.State.COMPLETED);
        StatementsList statements = new StatementsList(0);
        statements.getForm().addToEnd(new NewLine());
        statements.getForm().addToEnd(Indentation.of("\t"));
        statements.getForm().addToEnd(pass);
        form.set(MethodDeclaration.State.STATEMENTS.slot(), statements);
        form.setState(MethodDeclaration.State.COMPLETED);
        return method;
    }

    private static EnumDeclaration enumeration() {
        EnumDeclaration enumeration = new EnumDeclaration(0);
        TokensForm<EnumDeclaration.State> form = enumeration.getForm();
        form.set(EnumDeclaration.State.ENUM.slot(), Keyword.of(KeywordType.ENUM));
        form.addBefore(EnumDeclaration.State.NAME.slot(), Space.of(" "));
        form.set(EnumDeclaration.State.NAME.slot(), Identifier.of("State"));
        form.addBefore(EnumDeclaration.State.OPEN.slot(), Space.of(" "));
        form.set(EnumDeclaration.State.OPEN.slot(), Punctuation.of(PunctuationType.OPEN_FIGURE_BRACKET));

        EnumValueDeclaration idle = new EnumValueDeclaration(0);
        idle.getForm().set(EnumValueDeclaration.State.NAME.slot(), Identifier.of("IDLE"));
        idle.getForm().setState(EnumValueDeclaration.State.COMPLETED);

        EnumValueDeclaration run = new EnumValueDeclaration(0);
        TokensForm<EnumValueDeclaration.State> runForm = run.getForm();
        runForm.set(EnumValueDeclaration.State.NAME.slot(), Identifier.of("RUN"));
        runForm.addBefore(EnumValueDeclaration.State.ASSIGN.slot(), Space.of(" "));
        runForm.set(EnumValueDeclaration.State.ASSIGN.slot(), Punctuation.of(PunctuationType.ASSIGN));
        runForm.addBefore(EnumValueDeclaration.State.VALUE.slot(), Space.of(" "));
        runForm.set(EnumValueDeclaration.State.VALUE.slot(), new NumberExpression(NumberToken.of("2")));
        runForm.setState(EnumValueDeclaration.State.COMPLETED);

        EnumValuesList values = new EnumValuesList(0);
        values.getForm().addToEnd(Space.of(" "));
        values.getForm().addToEnd(idle);
        values.getForm().addToEnd(Punctuation.of(PunctuationType.COMMA));
        values.getForm().addToEnd(Space.of(" "));
        values.getForm().addToEnd(run);
        values.getForm().addToEnd(Space.of(" "));
        form.set(EnumDeclaration.State.VALUES.slot(), values);

        form.set(EnumDeclaration.State.CLOSE.slot(), Punctuation.of(PunctuationType.CLOSE_FIGURE_BRACKET));
        form.setState(EnumDeclaration.State.COMPLETED);
        return enumeration;
    }

    private static ClassDeclaration script() {
        ClassDeclaration script = new ClassDeclaration();
        List<SyntaxToken> members = List.of(
                variable("x", "1"), new NewLine(),
                method("run", "delta"), new NewLine(),
                enumeration(), new NewLine());
        members.forEach(script.getMembersList().getForm()::addToEnd);
        return script;
    }

    // ==================== Assembled scripts ====================

    @Test
    @DisplayName("An assembled script serializes to its source text")
    void testSerializes() {
        // Given / When
        ClassDeclaration script = script();

        // Then
        assertEquals(SCRIPT, script.toString());
        assertTrue(script.getInvalidTokens().isEmpty());
    }

    @Test
    @DisplayName("An assembled script re-reads to the same text with no invalid token")
    void testReparses() {
        // Given
        String text = script().toString();

        // When
        ClassDeclaration parsed = reader.parseFileContent(text);

        // Then
        assertEquals(text, parsed.toString());
        assertTrue(parsed.getInvalidTokens().isEmpty());
    }

    @Test
    @DisplayName("An assembled script answers the same queries as a parsed one")
    void testQueries() {
        ClassDeclaration script = script();
        ClassDeclaration parsed = reader.parseFileContent(SCRIPT);

        for (ClassDeclaration declaration : List.of(script, parsed)) {
            VariableDeclaration x = declaration.getVariables().get(0);
            assertEquals("x", x.getIdentifier().getName());
            assertEquals(1, ((NumberExpression) x.getInitializer()).getNumber().getLongValue());

            MethodDeclaration run = declaration.getMethods().get(0);
            assertEquals("run", run.getName());
            assertEquals("delta", run.getParameters().get(0).getIdentifier().getName());
            assertEquals(1, run.getStatements().getElements().size());

            EnumDeclaration state = declaration.getEnums().get(0);
            assertEquals("State", state.getName().getName());
            assertEquals(List.of("IDLE", "RUN"),
                    state.getValues().stream().map(value -> value.getName().getName()).toList());
            assertNull(state.getValues().get(0).getValue());
            assertEquals("2", state.getValues().get(1).getValue().toString());
        }
    }

    @Test
    @DisplayName("Assembled tokens know their parents and positions")
    void testParentsAndPositions() {
        ClassDeclaration script = script();
        EnumDeclaration state = script.getEnums().get(0);

        script.getAllTokens().skip(1).forEach(token -> assertNotNull(token.getParent()));
        assertSame(script.getMembersList(), state.getParent());
        assertEquals(3, state.getStartLine());
        assertEquals(0, state.getStartColumn());
        assertEquals(SCRIPT.indexOf("RUN"), state.getValues().get(1).getStartPosition());
    }
}
