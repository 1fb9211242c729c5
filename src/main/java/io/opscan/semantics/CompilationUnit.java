package io.opscan.semantics;

import io.opscan.model.FieldSymbol;
import io.opscan.model.MethodSymbol;
import io.opscan.operation.Operation;

import java.util.ArrayList;
import java.util.List;

/**
 * One source file of a compilation with the operation blocks it declares.
 *
 * @param path      Source path as reported by the host
 * @param generated Whether the host classified the file as generated code
 * @param blocks    Method bodies and field initializers declared in the file, in source order
 */
public record CompilationUnit(String path, boolean generated, List<OperationBlock> blocks) {

    public CompilationUnit {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path cannot be null or blank");
        }
        blocks = blocks != null ? List.copyOf(blocks) : List.of();
    }

    public static Builder builder(String path) {
        return new Builder(path);
    }

    public static class Builder {
        private final String path;
        private boolean generated;
        private final List<OperationBlock> blocks = new ArrayList<>();

        private Builder(String path) {
            this.path = path;
        }

        public Builder generated(boolean generated) {
            this.generated = generated;
            return this;
        }

        public Builder method(MethodSymbol method, Operation.Block body) {
            blocks.add(OperationBlock.methodBody(method, body));
            return this;
        }

        public Builder initializer(FieldSymbol field, Operation initializer) {
            blocks.add(OperationBlock.fieldInitializer(field, initializer));
            return this;
        }

        public CompilationUnit build() {
            return new CompilationUnit(path, generated, blocks);
        }
    }
}
