package io.opscan.operation;

import io.opscan.model.FieldSymbol;
import io.opscan.model.Location;
import io.opscan.model.MethodSymbol;
import io.opscan.model.ParameterSymbol;
import io.opscan.model.TypeSymbol;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A node of the resolved operation tree handed over by the host compiler.
 * <p>
 * The hierarchy is closed: every {@link OperationKind} maps to one nested record, so a
 * {@code switch} over {@link #kind()} is exhaustive. Child references that the host could
 * not bind are null; {@link #children()} skips them.
 */
public sealed interface Operation {

    OperationKind kind();

    /**
     * Result type of the operation, null for statements and untyped expressions.
     */
    TypeSymbol type();

    /**
     * Direct children in source order.
     */
    List<Operation> children();

    /**
     * True if the host synthesized this node rather than the user writing it.
     */
    boolean isImplicit();

    Location location();

    /**
     * Compile-time constant value of this operation, if any.
     */
    default Optional<Object> constantValue() {
        return Optional.empty();
    }

    private static List<Operation> nonNull(Operation... operations) {
        List<Operation> result = new ArrayList<>(operations.length);
        for (Operation operation : operations) {
            if (operation != null) {
                result.add(operation);
            }
        }
        return List.copyOf(result);
    }

    private static List<Operation> concat(Operation head, List<Operation> tail) {
        List<Operation> result = new ArrayList<>(tail.size() + 1);
        if (head != null) {
            result.add(head);
        }
        result.addAll(tail);
        return List.copyOf(result);
    }

    private static List<Operation> copyOf(List<Operation> operations) {
        if (operations == null) {
            return List.of();
        }
        return operations.stream().filter(Objects::nonNull).toList();
    }

    private static Location orNone(Location location) {
        return location != null ? location : Location.NONE;
    }

    // ---- Statements ----

    record Block(List<Operation> operations, boolean isImplicit, Location location) implements Operation {
        public Block {
            operations = copyOf(operations);
            location = orNone(location);
        }

        public static Block of(Operation... operations) {
            return new Block(Arrays.asList(operations), false, Location.NONE);
        }

        @Override
        public OperationKind kind() {
            return OperationKind.BLOCK;
        }

        @Override
        public TypeSymbol type() {
            return null;
        }

        @Override
        public List<Operation> children() {
            return operations;
        }
    }

    record ExpressionStatement(Operation operation, boolean isImplicit, Location location) implements Operation {
        public ExpressionStatement {
            location = orNone(location);
        }

        @Override
        public OperationKind kind() {
            return OperationKind.EXPRESSION_STATEMENT;
        }

        @Override
        public TypeSymbol type() {
            return null;
        }

        @Override
        public List<Operation> children() {
            return nonNull(operation);
        }
    }

    record VariableDeclaration(String name, TypeSymbol type, Operation initializer,
                               boolean isImplicit, Location location) implements Operation {
        public VariableDeclaration {
            location = orNone(location);
        }

        @Override
        public OperationKind kind() {
            return OperationKind.VARIABLE_DECLARATION;
        }

        @Override
        public List<Operation> children() {
            return nonNull(initializer);
        }
    }

    /**
     * A return statement. {@code returnedValue} is null for a bare {@code return;}.
     */
    record Return(Operation returnedValue, boolean isImplicit, Location location) implements Operation {
        public Return {
            location = orNone(location);
        }

        @Override
        public OperationKind kind() {
            return OperationKind.RETURN;
        }

        @Override
        public TypeSymbol type() {
            return null;
        }

        @Override
        public List<Operation> children() {
            return nonNull(returnedValue);
        }
    }

    record Throw(Operation exception, boolean isImplicit, Location location) implements Operation {
        public Throw {
            location = orNone(location);
        }

        @Override
        public OperationKind kind() {
            return OperationKind.THROW;
        }

        @Override
        public TypeSymbol type() {
            return null;
        }

        @Override
        public List<Operation> children() {
            return nonNull(exception);
        }
    }

    /**
     * An if statement (null type) or a conditional expression (typed).
     */
    record Conditional(Operation condition, Operation whenTrue, Operation whenFalse, TypeSymbol type,
                       boolean isImplicit, Location location) implements Operation {
        public Conditional {
            location = orNone(location);
        }

        @Override
        public OperationKind kind() {
            return OperationKind.CONDITIONAL;
        }

        @Override
        public List<Operation> children() {
            return nonNull(condition, whenTrue, whenFalse);
        }
    }

    // ---- Expressions ----

    record Literal(Object value, TypeSymbol type, boolean isImplicit, Location location) implements Operation {
        public Literal {
            location = orNone(location);
        }

        @Override
        public OperationKind kind() {
            return OperationKind.LITERAL;
        }

        @Override
        public List<Operation> children() {
            return List.of();
        }

        @Override
        public Optional<Object> constantValue() {
            return Optional.ofNullable(value);
        }
    }

    record Conversion(Operation operand, TypeSymbol type, boolean isImplicit, Location location) implements Operation {
        public Conversion {
            location = orNone(location);
        }

        @Override
        public OperationKind kind() {
            return OperationKind.CONVERSION;
        }

        @Override
        public List<Operation> children() {
            return nonNull(operand);
        }

        @Override
        public Optional<Object> constantValue() {
            return operand != null ? operand.constantValue() : Optional.empty();
        }
    }

    /**
     * A binary operator. {@code foldedValue} is the constant the host folded the expression to, if any.
     */
    record Binary(String operator, Operation left, Operation right, TypeSymbol type, Object foldedValue,
                  boolean isImplicit, Location location) implements Operation {
        public Binary {
            location = orNone(location);
        }

        @Override
        public OperationKind kind() {
            return OperationKind.BINARY;
        }

        @Override
        public List<Operation> children() {
            return nonNull(left, right);
        }

        @Override
        public Optional<Object> constantValue() {
            return Optional.ofNullable(foldedValue);
        }
    }

    record LocalReference(String name, TypeSymbol type, boolean isImplicit, Location location) implements Operation {
        public LocalReference {
            location = orNone(location);
        }

        @Override
        public OperationKind kind() {
            return OperationKind.LOCAL_REFERENCE;
        }

        @Override
        public List<Operation> children() {
            return List.of();
        }
    }

    record ParameterReference(ParameterSymbol parameter, boolean isImplicit, Location location) implements Operation {
        public ParameterReference {
            Objects.requireNonNull(parameter, "parameter");
            location = orNone(location);
        }

        @Override
        public OperationKind kind() {
            return OperationKind.PARAMETER_REFERENCE;
        }

        @Override
        public TypeSymbol type() {
            return parameter.type();
        }

        @Override
        public List<Operation> children() {
            return List.of();
        }
    }

    /**
     * {@code this} (explicit or the implicit receiver of an instance member access).
     */
    record InstanceReference(TypeSymbol type, boolean isImplicit, Location location) implements Operation {
        public InstanceReference {
            location = orNone(location);
        }

        @Override
        public OperationKind kind() {
            return OperationKind.INSTANCE_REFERENCE;
        }

        @Override
        public List<Operation> children() {
            return List.of();
        }
    }

    /**
     * A field access. {@code field} is null when the host could not bind the member.
     */
    record FieldReference(FieldSymbol field, Operation instance, boolean isImplicit, Location location)
            implements Operation {
        public FieldReference {
            location = orNone(location);
        }

        @Override
        public OperationKind kind() {
            return OperationKind.FIELD_REFERENCE;
        }

        @Override
        public TypeSymbol type() {
            return field != null ? field.type() : null;
        }

        @Override
        public List<Operation> children() {
            return nonNull(instance);
        }

        @Override
        public Optional<Object> constantValue() {
            return field != null ? field.constant() : Optional.empty();
        }
    }

    /**
     * {@code target = value}. Either side may be null in erroneous code.
     */
    record SimpleAssignment(Operation target, Operation value, TypeSymbol type,
                            boolean isImplicit, Location location) implements Operation {
        public SimpleAssignment {
            location = orNone(location);
        }

        @Override
        public OperationKind kind() {
            return OperationKind.SIMPLE_ASSIGNMENT;
        }

        @Override
        public List<Operation> children() {
            return nonNull(target, value);
        }
    }

    record Invocation(MethodSymbol targetMethod, Operation instance, List<Operation> arguments,
                      boolean isImplicit, Location location) implements Operation {
        public Invocation {
            Objects.requireNonNull(targetMethod, "targetMethod");
            arguments = copyOf(arguments);
            location = orNone(location);
        }

        @Override
        public OperationKind kind() {
            return OperationKind.INVOCATION;
        }

        @Override
        public TypeSymbol type() {
            return targetMethod.returnType();
        }

        @Override
        public List<Operation> children() {
            return concat(instance, arguments);
        }
    }

    record ObjectCreation(MethodSymbol constructor, List<Operation> arguments, TypeSymbol type,
                          boolean isImplicit, Location location) implements Operation {
        public ObjectCreation {
            arguments = copyOf(arguments);
            location = orNone(location);
        }

        @Override
        public OperationKind kind() {
            return OperationKind.OBJECT_CREATION;
        }

        @Override
        public List<Operation> children() {
            return arguments;
        }
    }

    /**
     * Creation of a delegate of {@code type} from a lambda or a method group.
     */
    record DelegateCreation(Operation target, TypeSymbol type, boolean isImplicit, Location location)
            implements Operation {
        public DelegateCreation {
            location = orNone(location);
        }

        @Override
        public OperationKind kind() {
            return OperationKind.DELEGATE_CREATION;
        }

        @Override
        public List<Operation> children() {
            return nonNull(target);
        }
    }

    record AnonymousFunction(MethodSymbol symbol, Block body, boolean isImplicit, Location location)
            implements Operation {
        public AnonymousFunction {
            Objects.requireNonNull(symbol, "symbol");
            location = orNone(location);
        }

        @Override
        public OperationKind kind() {
            return OperationKind.ANONYMOUS_FUNCTION;
        }

        @Override
        public TypeSymbol type() {
            return null;
        }

        @Override
        public List<Operation> children() {
            return nonNull(body);
        }
    }

    record MethodReference(MethodSymbol method, Operation instance, TypeSymbol type,
                           boolean isImplicit, Location location) implements Operation {
        public MethodReference {
            Objects.requireNonNull(method, "method");
            location = orNone(location);
        }

        @Override
        public OperationKind kind() {
            return OperationKind.METHOD_REFERENCE;
        }

        @Override
        public List<Operation> children() {
            return nonNull(instance);
        }
    }

    record Invalid(List<Operation> operands, TypeSymbol type, boolean isImplicit, Location location)
            implements Operation {
        public Invalid {
            operands = copyOf(operands);
            location = orNone(location);
        }

        @Override
        public OperationKind kind() {
            return OperationKind.INVALID;
        }

        @Override
        public List<Operation> children() {
            return operands;
        }
    }
}
