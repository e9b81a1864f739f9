package io.github.cyfko.gdsyntax.core.syntax.declarations;

import io.github.cyfko.gdsyntax.core.syntax.tokens.Identifier;
import io.github.cyfko.gdsyntax.core.syntax.types.TypeNode;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A class body, either the script itself or an inner class, with typed views over its members.
 *
 * <pre>{@code
 * ClassDeclaration script = reader.parseFileContent(source);
 * boolean tool = script.isTool();
 * script.getMethods().forEach(m -> System.out.println(m.getName()));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface MembersOwner {

    /**
     * @return every member in source order
     */
    List<ClassMember> getMembers();

    default List<VariableDeclaration> getVariables() {
        return membersOf(VariableDeclaration.class);
    }

    default List<MethodDeclaration> getMethods() {
        return membersOf(MethodDeclaration.class);
    }

    default List<SignalDeclaration> getSignals() {
        return membersOf(SignalDeclaration.class);
    }

    default List<EnumDeclaration> getEnums() {
        return membersOf(EnumDeclaration.class);
    }

    default List<InnerClassDeclaration> getInnerClasses() {
        return membersOf(InnerClassDeclaration.class);
    }

    default List<CustomAttribute> getAttributes() {
        return membersOf(CustomAttribute.class);
    }

    /**
     * @return whether the class is marked with {@code tool} or {@code @tool}
     */
    default boolean isTool() {
        return !membersOf(ToolAttribute.class).isEmpty()
                || getAttributes().stream().anyMatch(attribute -> "tool".equals(attribute.getName()));
    }

    default Optional<TypeNode> getExtends() {
        return membersOf(ExtendsAttribute.class).stream()
                .map(ExtendsAttribute::getType)
                .filter(type -> type != null)
                .findFirst();
    }

    default Optional<String> getClassName() {
        return membersOf(ClassNameAttribute.class).stream()
                .map(ClassNameAttribute::getName)
                .filter(name -> name != null)
                .map(Identifier::getName)
                .findFirst();
    }

    private <T extends ClassMember> List<T> membersOf(Class<T> type) {
        return getMembers().stream()
                .filter(type::isInstance)
                .map(type::cast)
                .collect(Collectors.toList());
    }
}
