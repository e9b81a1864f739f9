package io.github.cyfko.gdsyntax.core.syntax.declarations;

import io.github.cyfko.gdsyntax.core.ScriptReaderFactory;
import io.github.cyfko.gdsyntax.core.api.ScriptReader;
import io.github.cyfko.gdsyntax.core.syntax.expressions.CallExpression;
import io.github.cyfko.gdsyntax.core.syntax.expressions.NumberExpression;
import io.github.cyfko.gdsyntax.core.syntax.expressions.StringExpression;
import io.github.cyfko.gdsyntax.core.syntax.types.ArrayTypeNode;
import io.github.cyfko.gdsyntax.core.syntax.types.DictionaryTypeNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for class-level declarations: attributes, variables, methods, signals, enums
 * and inner classes.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("Class Members Tests")
class ClassMembersTest {

    private final ScriptReader reader = ScriptReaderFactory.create();

    private ClassDeclaration read(String script) {
        ClassDeclaration declaration = reader.parseFileContent(script);
        assertEquals(script, declaration.toString());
        return declaration;
    }

    // ==================== Attributes ====================

    @Nested
    @DisplayName("Attributes")
    class Attributes {

        @Test
        @DisplayName("class_name with icon path")
        void testClassNameWithIcon() {
            ClassDeclaration declaration = read("class_name Enemy, \"res://enemy.svg\"\n");

            ClassNameAttribute className = declaration.getMembers().stream()
                    .filter(ClassNameAttribute.class::isInstance)
                    .map(ClassNameAttribute.class::cast)
                    .findFirst()
                    .orElseThrow();
            assertEquals("Enemy", className.getName().getName());
            assertEquals("res://enemy.svg", className.getIconPath());
        }

        @Test
        @DisplayName("class_name and extends on one line")
        void testClassNameExtendsSameLine() {
            ClassDeclaration declaration = read("class_name Player extends CharacterBody2D\n");

            assertEquals("Player", declaration.getClassName().orElseThrow());
            assertEquals("CharacterBody2D", declaration.getExtends().orElseThrow().getTypeName());
        }

        @Test
        @DisplayName("extends a script path")
        void testExtendsPath() {
            ClassDeclaration declaration = read("extends \"res://base.gd\"\n");

            assertTrue(declaration.getExtends().isPresent());
            assertTrue(declaration.getInvalidTokens().isEmpty());
        }

        @Test
        @DisplayName("Annotations with arguments precede the annotated member")
        void testAnnotationWithArguments() {
            ClassDeclaration declaration = read("@export_range(0, 100, 5) var volume: int = 50\n");

            CustomAttribute attribute = declaration.getAttributes().get(0);
            assertEquals("export_range", attribute.getName());
            assertEquals(3, attribute.getArguments().size());
            assertEquals(1, declaration.getVariables().size());
        }

        @Test
        @DisplayName("Annotation on its own line")
        void testAnnotationOwnLine() {
            ClassDeclaration declaration = read("@onready\nvar label = $Label\n");

            assertEquals("onready", declaration.getAttributes().get(0).getName());
            assertTrue(declaration.getAttributes().get(0).getArguments().isEmpty());
            assertEquals("label", declaration.getVariables().get(0).getIdentifier().getName());
        }
    }

    // ==================== Variables ====================

    @Nested
    @DisplayName("Variables")
    class Variables {

        @Test
        @DisplayName("Constant with inferred type")
        void testInferredConstant() {
            VariableDeclaration speed = read("const SPEED := 300.0\n").getVariables().get(0);

            assertTrue(speed.isConstant());
            assertTrue(speed.isTypeInferred());
            assertNull(speed.getType());
            assertInstanceOf(NumberExpression.class, speed.getInitializer());
        }

        @Test
        @DisplayName("Static variable without initializer")
        void testStaticVariable() {
            VariableDeclaration count = read("static var count: int\n").getVariables().get(0);

            assertTrue(count.isStatic());
            assertFalse(count.isConstant());
            assertEquals("int", count.getType().getTypeName());
            assertNull(count.getInitializer());
        }

        @Test
        @DisplayName("Typed collections")
        void testTypedCollections() {
            List<VariableDeclaration> variables = read(
                    "var names: Array[String] = []\nvar scores: Dictionary[String, int] = {}\n").getVariables();

            ArrayTypeNode array = assertInstanceOf(ArrayTypeNode.class, variables.get(0).getType());
            assertEquals("String", array.getElementType().getTypeName());
            DictionaryTypeNode dictionary = assertInstanceOf(DictionaryTypeNode.class, variables.get(1).getType());
            assertEquals("String", dictionary.getKeyType().getTypeName());
            assertEquals("int", dictionary.getValueType().getTypeName());
        }

        @Test
        @DisplayName("Property with accessor blocks")
        void testAccessorBlocks() {
            VariableDeclaration health = read(
                    "var health: int = 100:\n\tget:\n\t\treturn health\n\tset(value):\n\t\thealth = value\n")
                    .getVariables().get(0);

            List<AccessorDeclaration> accessors = health.getAccessors();
            assertEquals(2, accessors.size());
            assertInstanceOf(GetAccessorDeclaration.class, accessors.get(0));
            SetAccessorDeclaration setter = assertInstanceOf(SetAccessorDeclaration.class, accessors.get(1));
            assertEquals("value", setter.getParameter().getName());
            assertEquals(1, setter.getStatements().getElements().size());
        }

        @Test
        @DisplayName("Property with accessors bound to methods")
        void testAccessorMethods() {
            VariableDeclaration ratio = read("var ratio: float:\n\tget = get_ratio, set = set_ratio\n")
                    .getVariables().get(0);

            assertEquals("float", ratio.getType().getTypeName());
            List<AccessorDeclaration> accessors = ratio.getAccessors();
            assertEquals(2, accessors.size());
            assertEquals("get_ratio", accessors.get(0).getMethod().getName());
            assertEquals("set_ratio", accessors.get(1).getMethod().getName());
        }

        @Test
        @DisplayName("Untyped property with accessors")
        void testUntypedAccessors() {
            ClassDeclaration declaration = read("var value:\n\tget:\n\t\treturn 1\n");

            VariableDeclaration value = declaration.getVariables().get(0);
            assertNull(value.getType());
            assertEquals(1, value.getAccessors().size());
            assertTrue(declaration.getInvalidTokens().isEmpty());
        }
    }

    // ==================== Methods ====================

    @Nested
    @DisplayName("Methods")
    class Methods {

        @Test
        @DisplayName("Parameters with types and defaults")
        void testParameters() {
            MethodDeclaration add = read("func add(a: int, b := 2, c = 3) -> int:\n\treturn a + b + c\n")
                    .getMethods().get(0);

            assertEquals("add", add.getName());
            assertEquals("int", add.getReturnType().getTypeName());
            List<ParameterDeclaration> parameters = add.getParameters();
            assertEquals(3, parameters.size());
            assertEquals("int", parameters.get(0).getType().getTypeName());
            assertNull(parameters.get(0).getDefaultValue());
            assertNotNull(parameters.get(1).getDefaultValue());
            assertEquals("c", parameters.get(2).getIdentifier().getName());
        }

        @Test
        @DisplayName("Static method")
        void testStaticMethod() {
            MethodDeclaration create = read("static func create():\n\treturn null\n").getMethods().get(0);

            assertTrue(create.isStatic());
        }

        @Test
        @DisplayName("Methods follow each other after a dedent")
        void testSuccessiveMethods() {
            ClassDeclaration declaration = read("func a():\n\tpass\n\n\nfunc b():\n\tpass\n");

            assertEquals(List.of("a", "b"), declaration.getMethods().stream().map(MethodDeclaration::getName).toList());
        }

        @Test
        @DisplayName("Inline body")
        void testInlineBody() {
            MethodDeclaration f = read("func f(): return 1\nfunc g(): pass\n").getMethods().get(0);

            assertTrue(f.getStatements().isInline());
            assertEquals(1, f.getStatements().getElements().size());
        }
    }

    // ==================== Signals, enums and inner classes ====================

    @Nested
    @DisplayName("Signals, enums and inner classes")
    class Others {

        @Test
        @DisplayName("Signal with and without parameters")
        void testSignals() {
            List<SignalDeclaration> signals = read("signal hit(damage: int, source)\nsignal died\n").getSignals();

            assertEquals(2, signals.size());
            assertEquals("hit", signals.get(0).getName().getName());
            assertEquals(2, signals.get(0).getParameters().size());
            assertTrue(signals.get(1).getParameters().isEmpty());
        }

        @Test
        @DisplayName("Anonymous enum across lines")
        void testAnonymousEnum() {
            EnumDeclaration anonymous = read("enum {\n\tA,\n\tB = 2,\n}\n").getEnums().get(0);

            assertNull(anonymous.getName());
            assertEquals(2, anonymous.getValues().size());
            assertEquals("B", anonymous.getValues().get(1).getName().getName());
        }

        @Test
        @DisplayName("An enum value missing its comma is invalid")
        void testEnumValueWithoutComma() {
            ClassDeclaration script = read("enum E {A B, C}\n");
            EnumDeclaration enumeration = script.getEnums().get(0);

            assertEquals(List.of("A", "C"),
                    enumeration.getValues().stream().map(value -> value.getName().getName()).toList());
            assertEquals(1, script.getInvalidTokens().size());
            assertEquals("B", script.getInvalidTokens().get(0).toString());
        }

        @Test
        @DisplayName("A call argument missing its comma is invalid")
        void testArgumentWithoutComma() {
            ClassDeclaration script = read("var v = max(1 2)\n");

            CallExpression call = (CallExpression) script.getVariables().get(0).getInitializer();
            assertEquals(1, call.getParameters().size());
            assertEquals("2", script.getInvalidTokens().get(0).toString());
        }

        @Test
        @DisplayName("Inner class with its own members")
        void testInnerClass() {
            ClassDeclaration declaration = read(
                    "class Item extends Resource:\n\tvar id = \"x\"\n\tfunc use():\n\t\tpass\nvar after = 1\n");

            InnerClassDeclaration item = declaration.getInnerClasses().get(0);
            assertEquals("Item", item.getName().getName());
            assertEquals("Resource", item.getBase().getTypeName());
            assertEquals(1, item.getVariables().size());
            assertInstanceOf(StringExpression.class, item.getVariables().get(0).getInitializer());
            assertEquals(1, item.getMethods().size());
            assertEquals("after", declaration.getVariables().get(0).getIdentifier().getName());
        }

        @Test
        @DisplayName("Preloaded constant")
        void testPreload() {
            VariableDeclaration scene = read("const Scene = preload(\"res://scene.tscn\")\n").getVariables().get(0);

            assertTrue(assertInstanceOf(CallExpression.class, scene.getInitializer()).isResourceLoad());
        }
    }
}
