package io.opscan.semantics;

import io.opscan.model.FieldSymbol;
import io.opscan.model.MethodSymbol;
import io.opscan.operation.Operation;

/**
 * A top-level operation tree: a method body or a field initializer.
 *
 * @param root        Root operation of the tree
 * @param ownerMethod Method whose body this is, null for field initializers
 * @param ownerField  Field this initializes, null for method bodies
 */
public record OperationBlock(Operation root, MethodSymbol ownerMethod, FieldSymbol ownerField) {

    public OperationBlock {
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }
        if ((ownerMethod == null) == (ownerField == null)) {
            throw new IllegalArgumentException("block must be owned by exactly one method or field");
        }
    }

    public static OperationBlock methodBody(MethodSymbol method, Operation.Block body) {
        return new OperationBlock(body, method, null);
    }

    public static OperationBlock fieldInitializer(FieldSymbol field, Operation initializer) {
        return new OperationBlock(initializer, null, field);
    }

    /**
     * Returns a display name of the owning symbol.
     */
    public String owner() {
        return ownerMethod != null ? ownerMethod.signature() : ownerField.qualifiedName();
    }
}
