package io.opscan.snapshot;

import io.opscan.model.FieldSymbol;
import io.opscan.model.Location;
import io.opscan.model.MethodKind;
import io.opscan.model.MethodSymbol;
import io.opscan.model.NativeImport;
import io.opscan.model.ParameterSymbol;
import io.opscan.model.SpecialType;
import io.opscan.model.TypeKind;
import io.opscan.model.TypeSymbol;
import io.opscan.operation.Operation;
import io.opscan.operation.OperationKind;
import io.opscan.semantics.Compilation;
import io.opscan.semantics.CompilationUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads a compilation snapshot exported by the host compiler.
 * <p>
 * The snapshot is YAML (JSON works too) with three top-level keys:
 * <ul>
 *   <li>{@code compilation}: compilation name</li>
 *   <li>{@code references}: metadata-only types (no bodies)</li>
 *   <li>{@code units}: source files, each with {@code path}, {@code generated} and declared
 *       {@code types}; types carry {@code fields} (optional {@code initializer}) and
 *       {@code methods} (optional {@code body})</li>
 * </ul>
 * Operations are maps keyed by {@code op} (an {@link OperationKind} name, case-insensitive)
 * with an optional {@code span} ({@code line:col-line:col}) and {@code implicit} flag.
 * Types that are referenced but never declared load as error types.
 */
public class SnapshotLoader {

    private static final Logger log = LoggerFactory.getLogger(SnapshotLoader.class);

    private final Map<String, TypeSymbol> declaredTypes = new LinkedHashMap<>();
    private final Map<String, TypeSymbol> errorTypes = new HashMap<>();
    private final Map<String, FieldSymbol> fields = new HashMap<>();
    private final Map<String, MethodSymbol> methodsBySignature = new HashMap<>();
    private final Map<String, List<MethodSymbol>> methodsByName = new HashMap<>();

    /**
     * Loads a snapshot file. The compilation name defaults to the file name.
     */
    public static Compilation load(Path path) throws IOException, SnapshotException {
        try (InputStream is = Files.newInputStream(path)) {
            return load(is, path.getFileName().toString());
        }
    }

    public static Compilation load(InputStream is, String defaultName) throws SnapshotException {
        Object raw;
        try {
            raw = new Yaml().load(is);
        } catch (YAMLException e) {
            throw new SnapshotException("Invalid snapshot " + defaultName + ": " + e.getMessage(), e);
        }
        if (!(raw instanceof Map<?, ?> root)) {
            throw new SnapshotException("Snapshot " + defaultName + " must be a map at the top level");
        }
        try {
            return new SnapshotLoader().read(root, defaultName);
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new SnapshotException("Inconsistent snapshot " + defaultName + ": " + e.getMessage(), e);
        }
    }

    private Compilation read(Map<?, ?> root, String defaultName) throws SnapshotException {
        String name = optionalString(root, "compilation");
        Compilation.Builder builder = Compilation.builder(name != null ? name : defaultName);

        List<Map<?, ?>> references = maps(root.get("references"), "references");
        List<Map<?, ?>> units = maps(root.get("units"), "units");

        // Pass 1: all type symbols, so members and bodies can refer to types declared later.
        List<TypeDeclaration> declarations = new ArrayList<>();
        for (int i = 0; i < references.size(); i++) {
            declareType(references.get(i), null, "references[" + i + "]");
            declarations.add(new TypeDeclaration(references.get(i), null));
        }
        for (int u = 0; u < units.size(); u++) {
            Map<?, ?> unit = units.get(u);
            String unitPath = requiredString(unit, "path", "units[" + u + "]");
            List<Map<?, ?>> types = maps(unit.get("types"), "units[" + u + "].types");
            for (int t = 0; t < types.size(); t++) {
                declareType(types.get(t), unitPath, "units[" + u + "].types[" + t + "]");
                declarations.add(new TypeDeclaration(types.get(t), unitPath));
            }
        }
        declaredTypes.values().forEach(builder::addType);

        // Pass 2: member symbols.
        for (TypeDeclaration declaration : declarations) {
            declareMembers(declaration.type(), declaration.unitPath() == null, builder);
        }

        // Pass 3: operation trees.
        for (int u = 0; u < units.size(); u++) {
            builder.addUnit(readUnit(units.get(u), "units[" + u + "]"));
        }

        if (!errorTypes.isEmpty()) {
            log.debug("Snapshot {} references undeclared types: {}", defaultName, errorTypes.keySet());
        }
        return builder.build();
    }

    // ---- Symbols ----

    /**
     * A raw type entry and the unit declaring it (null for references).
     */
    private record TypeDeclaration(Map<?, ?> type, String unitPath) {}

    private void declareType(Map<?, ?> type, String unitPath, String where) throws SnapshotException {
        String name = requiredString(type, "name", where);
        if (declaredTypes.containsKey(name)) {
            throw new SnapshotException(where + ": duplicate type " + name);
        }
        TypeKind kind = enumValue(TypeKind.class, optionalString(type, "kind"), TypeKind.CLASS, where + ".kind");
        if (kind == TypeKind.ERROR) {
            throw new SnapshotException(where + ": error types cannot be declared");
        }
        SpecialType special = enumValue(SpecialType.class, optionalString(type, "special"), SpecialType.NONE,
                where + ".special");
        Location location = unitPath != null ? span(type, unitPath, where) : Location.NONE;

        declaredTypes.put(name, new TypeSymbol(
                name,
                kind,
                special,
                optionalString(type, "base"),
                strings(type.get("interfaces"), where + ".interfaces"),
                bool(type, "finalizer", where),
                location));
    }

    private void declareMembers(Map<?, ?> type, boolean metadataOnly, Compilation.Builder builder)
            throws SnapshotException {
        String typeName = String.valueOf(type.get("name"));
        TypeSymbol owner = declaredTypes.get(typeName);
        String where = "type " + typeName;

        List<Map<?, ?>> fieldMaps = maps(type.get("fields"), where + ".fields");
        for (Map<?, ?> field : fieldMaps) {
            String fieldName = requiredString(field, "name", where + ".fields");
            FieldSymbol symbol = new FieldSymbol(
                    fieldName,
                    owner,
                    typeRef(requiredString(field, "type", where + "." + fieldName)),
                    bool(field, "static", where + "." + fieldName),
                    field.get("constant"));
            if (fields.putIfAbsent(symbol.qualifiedName(), symbol) != null) {
                throw new SnapshotException(where + ": duplicate field " + fieldName);
            }
            builder.addField(symbol);
        }

        List<Map<?, ?>> methodMaps = maps(type.get("methods"), where + ".methods");
        for (Map<?, ?> method : methodMaps) {
            String methodName = requiredString(method, "name", where + ".methods");
            String methodWhere = where + "." + methodName;
            if (metadataOnly && method.get("body") != null) {
                throw new SnapshotException(methodWhere + ": referenced types cannot declare bodies");
            }
            MethodSymbol symbol = new MethodSymbol(
                    methodName,
                    owner,
                    typeRef(optionalString(method, "returns") != null ? optionalString(method, "returns") : "System.Void"),
                    parameters(method.get("parameters"), methodWhere),
                    bool(method, "static", methodWhere),
                    enumValue(MethodKind.class, optionalString(method, "kind"), MethodKind.ORDINARY, methodWhere + ".kind"),
                    nativeImport(method.get("nativeImport"), methodName, methodWhere));
            if (methodsBySignature.putIfAbsent(symbol.signature(), symbol) != null) {
                throw new SnapshotException(methodWhere + ": duplicate method " + symbol.signature());
            }
            methodsByName.computeIfAbsent(typeName + "." + methodName, k -> new ArrayList<>()).add(symbol);
            builder.addMethod(symbol);
        }
    }

    private List<ParameterSymbol> parameters(Object raw, String where) throws SnapshotException {
        List<Map<?, ?>> maps = maps(raw, where + ".parameters");
        List<ParameterSymbol> parameters = new ArrayList<>(maps.size());
        for (int i = 0; i < maps.size(); i++) {
            Map<?, ?> parameter = maps.get(i);
            String name = optionalString(parameter, "name");
            parameters.add(new ParameterSymbol(
                    name != null ? name : "arg" + i,
                    typeRef(requiredString(parameter, "type", where + ".parameters[" + i + "]")),
                    i));
        }
        return parameters;
    }

    private NativeImport nativeImport(Object raw, String methodName, String where) throws SnapshotException {
        if (raw == null) {
            return null;
        }
        if (!(raw instanceof Map<?, ?> map)) {
            throw new SnapshotException(where + ".nativeImport must be a map");
        }
        String entryPoint = optionalString(map, "entryPoint");
        return new NativeImport(requiredString(map, "library", where + ".nativeImport"),
                entryPoint != null ? entryPoint : methodName);
    }

    private TypeSymbol typeRef(String name) {
        TypeSymbol declared = declaredTypes.get(name);
        if (declared != null) {
            return declared;
        }
        return errorTypes.computeIfAbsent(name, TypeSymbol::error);
    }

    private TypeSymbol optionalTypeRef(Map<?, ?> map, String key) {
        String name = optionalString(map, key);
        return name != null ? typeRef(name) : null;
    }

    // ---- Units and operations ----

    /**
     * Where an operation tree sits: its unit, enclosing type and parameters in scope.
     */
    private static final class Scope {
        final String unitPath;
        final TypeSymbol enclosingType;
        final Deque<List<ParameterSymbol>> parameters = new ArrayDeque<>();

        Scope(String unitPath, TypeSymbol enclosingType) {
            this.unitPath = unitPath;
            this.enclosingType = enclosingType;
        }
    }

    private CompilationUnit readUnit(Map<?, ?> unit, String where) throws SnapshotException {
        String path = requiredString(unit, "path", where);
        CompilationUnit.Builder builder = CompilationUnit.builder(path).generated(bool(unit, "generated", where));

        for (Map<?, ?> type : maps(unit.get("types"), where + ".types")) {
            String typeName = String.valueOf(type.get("name"));
            TypeSymbol owner = declaredTypes.get(typeName);

            for (Map<?, ?> field : maps(type.get("fields"), typeName + ".fields")) {
                Object initializer = field.get("initializer");
                if (initializer != null) {
                    FieldSymbol symbol = fields.get(typeName + "." + field.get("name"));
                    Scope scope = new Scope(path, owner);
                    builder.initializer(symbol, operation(initializer, scope, symbol.qualifiedName()));
                }
            }

            for (Map<?, ?> method : maps(type.get("methods"), typeName + ".methods")) {
                Object body = method.get("body");
                if (body == null) {
                    continue;
                }
                MethodSymbol symbol = resolveDeclaredMethod(typeName, method);
                Scope scope = new Scope(path, owner);
                scope.parameters.push(symbol.parameters());
                Operation root = operation(body, scope, symbol.signature());
                if (!(root instanceof Operation.Block block)) {
                    throw new SnapshotException(symbol.signature() + ": body must be a block operation");
                }
                builder.method(symbol, block);
            }
        }
        return builder.build();
    }

    private MethodSymbol resolveDeclaredMethod(String typeName, Map<?, ?> method) {
        StringBuilder signature = new StringBuilder(typeName).append('.').append(method.get("name")).append('(');
        List<Map<?, ?>> parameters = maps0(method.get("parameters"));
        for (int i = 0; i < parameters.size(); i++) {
            if (i > 0) {
                signature.append(',');
            }
            signature.append(parameters.get(i).get("type"));
        }
        signature.append(')');

        MethodSymbol symbol = methodsBySignature.get(signature.toString());
        if (symbol == null) {
            throw new IllegalStateException("Method " + signature + " was not declared");
        }
        return symbol;
    }

    private Operation operation(Object raw, Scope scope, String where) throws SnapshotException {
        if (raw == null) {
            return null;
        }
        if (!(raw instanceof Map<?, ?> map)) {
            throw new SnapshotException(where + ": operation must be a map, got " + raw);
        }

        OperationKind kind = enumValue(OperationKind.class, requiredString(map, "op", where), null, where + ".op");
        String here = where + "/" + kind.name().toLowerCase(Locale.ROOT);
        boolean implicit = bool(map, "implicit", here);
        Location location = span(map, scope.unitPath, here);

        try {
            return switch (kind) {
                case BLOCK -> new Operation.Block(operations(map.get("operations"), scope, here), implicit, location);
                case EXPRESSION_STATEMENT -> new Operation.ExpressionStatement(
                        operation(map.get("operation"), scope, here), implicit, location);
                case VARIABLE_DECLARATION -> new Operation.VariableDeclaration(
                        requiredString(map, "name", here), optionalTypeRef(map, "type"),
                        operation(map.get("initializer"), scope, here), implicit, location);
                case RETURN -> new Operation.Return(operation(map.get("value"), scope, here), implicit, location);
                case THROW -> new Operation.Throw(operation(map.get("value"), scope, here), implicit, location);
                case CONDITIONAL -> new Operation.Conditional(
                        operation(map.get("condition"), scope, here),
                        operation(map.get("whenTrue"), scope, here),
                        operation(map.get("whenFalse"), scope, here),
                        optionalTypeRef(map, "type"), implicit, location);
                case LITERAL -> literal(map, here, implicit, location);
                case CONVERSION -> new Operation.Conversion(
                        operation(map.get("operand"), scope, here), optionalTypeRef(map, "type"), implicit, location);
                case BINARY -> new Operation.Binary(
                        optionalString(map, "operator"),
                        operation(map.get("left"), scope, here),
                        operation(map.get("right"), scope, here),
                        optionalTypeRef(map, "type"), map.get("constant"), implicit, location);
                case LOCAL_REFERENCE -> new Operation.LocalReference(
                        requiredString(map, "name", here), optionalTypeRef(map, "type"), implicit, location);
                case PARAMETER_REFERENCE -> parameterReference(map, scope, here, implicit, location);
                case INSTANCE_REFERENCE -> new Operation.InstanceReference(
                        map.containsKey("type") ? optionalTypeRef(map, "type") : scope.enclosingType, implicit, location);
                case FIELD_REFERENCE -> new Operation.FieldReference(
                        resolveField(requiredString(map, "field", here), scope),
                        operation(map.get("instance"), scope, here), implicit, location);
                case SIMPLE_ASSIGNMENT -> new Operation.SimpleAssignment(
                        operation(map.get("target"), scope, here),
                        operation(map.get("value"), scope, here),
                        optionalTypeRef(map, "type"), implicit, location);
                case INVOCATION -> invocation(map, scope, here, implicit, location);
                case OBJECT_CREATION -> new Operation.ObjectCreation(
                        map.containsKey("constructor") ? resolveMethod(optionalString(map, "constructor"), scope, here) : null,
                        operations(map.get("arguments"), scope, here),
                        optionalTypeRef(map, "type"), implicit, location);
                case DELEGATE_CREATION -> new Operation.DelegateCreation(
                        operation(map.get("target"), scope, here), optionalTypeRef(map, "type"), implicit, location);
                case ANONYMOUS_FUNCTION -> anonymousFunction(map, scope, here, implicit, location);
                case METHOD_REFERENCE -> methodReference(map, scope, here, implicit, location);
                case INVALID -> new Operation.Invalid(
                        operations(map.get("operands"), scope, here), optionalTypeRef(map, "type"), implicit, location);
            };
        } catch (IllegalArgumentException e) {
            throw new SnapshotException(here + ": " + e.getMessage(), e);
        }
    }

    private List<Operation> operations(Object raw, Scope scope, String where) throws SnapshotException {
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List<?> list)) {
            throw new SnapshotException(where + ": expected a list of operations");
        }
        List<Operation> result = new ArrayList<>(list.size());
        for (int i = 0; i < list.size(); i++) {
            result.add(operation(list.get(i), scope, where + "[" + i + "]"));
        }
        return result;
    }

    private Operation literal(Map<?, ?> map, String where, boolean implicit, Location location)
            throws SnapshotException {
        Object value = map.get("value");
        TypeSymbol type = optionalTypeRef(map, "type");
        if (type == null && value != null) {
            type = typeRef(literalTypeName(value, where));
        }
        return new Operation.Literal(value, type, implicit, location);
    }

    private static String literalTypeName(Object value, String where) throws SnapshotException {
        if (value instanceof Boolean) {
            return "System.Boolean";
        }
        if (value instanceof Integer) {
            return "System.Int32";
        }
        if (value instanceof Long) {
            return "System.Int64";
        }
        if (value instanceof Double) {
            return "System.Double";
        }
        if (value instanceof String) {
            return "System.String";
        }
        throw new SnapshotException(where + ": literal value '" + value + "' needs an explicit type");
    }

    private Operation parameterReference(Map<?, ?> map, Scope scope, String where, boolean implicit,
                                         Location location) throws SnapshotException {
        String name = requiredString(map, "name", where);
        for (List<ParameterSymbol> frame : scope.parameters) {
            for (ParameterSymbol parameter : frame) {
                if (parameter.name().equals(name)) {
                    return new Operation.ParameterReference(parameter, implicit, location);
                }
            }
        }
        log.debug("{}: unknown parameter '{}', loading as invalid operation", where, name);
        return new Operation.Invalid(List.of(), null, implicit, location);
    }

    private Operation invocation(Map<?, ?> map, Scope scope, String where, boolean implicit,
                                 Location location) throws SnapshotException {
        MethodSymbol method = resolveMethod(requiredString(map, "method", where), scope, where);
        Operation instance = operation(map.get("instance"), scope, where);
        List<Operation> arguments = operations(map.get("arguments"), scope, where);
        if (method == null) {
            List<Operation> operands = new ArrayList<>();
            if (instance != null) {
                operands.add(instance);
            }
            operands.addAll(arguments);
            return new Operation.Invalid(operands, null, implicit, location);
        }
        return new Operation.Invocation(method, instance, arguments, implicit, location);
    }

    private Operation methodReference(Map<?, ?> map, Scope scope, String where, boolean implicit,
                                      Location location) throws SnapshotException {
        MethodSymbol method = resolveMethod(requiredString(map, "method", where), scope, where);
        Operation instance = operation(map.get("instance"), scope, where);
        if (method == null) {
            return new Operation.Invalid(instance != null ? List.of(instance) : List.of(), null, implicit, location);
        }
        return new Operation.MethodReference(method, instance, optionalTypeRef(map, "type"), implicit, location);
    }

    private Operation anonymousFunction(Map<?, ?> map, Scope scope, String where, boolean implicit,
                                        Location location) throws SnapshotException {
        String returns = optionalString(map, "returns");
        MethodSymbol symbol = new MethodSymbol(
                "lambda",
                scope.enclosingType,
                typeRef(returns != null ? returns : "System.Void"),
                parameters(map.get("parameters"), where),
                false,
                MethodKind.ANONYMOUS_FUNCTION,
                null);

        scope.parameters.push(symbol.parameters());
        try {
            Operation body = operation(map.get("body"), scope, where);
            if (body != null && !(body instanceof Operation.Block)) {
                throw new SnapshotException(where + ": anonymous function body must be a block operation");
            }
            return new Operation.AnonymousFunction(symbol, (Operation.Block) body, implicit, location);
        } finally {
            scope.parameters.pop();
        }
    }

    /**
     * Resolves {@code Type.field}, or a bare field name against the enclosing type.
     * Unknown fields resolve to null, as the host does for unbound members.
     */
    private FieldSymbol resolveField(String reference, Scope scope) {
        FieldSymbol field = fields.get(reference);
        if (field == null && scope.enclosingType != null) {
            field = fields.get(scope.enclosingType.metadataName() + "." + reference);
        }
        if (field == null) {
            log.debug("Unresolved field reference '{}' in {}", reference, scope.unitPath);
        }
        return field;
    }

    /**
     * Resolves a full signature {@code Type.name(P1,P2)}, a {@code Type.name}, or a bare name
     * against the enclosing type. Returns null for unknown methods.
     */
    private MethodSymbol resolveMethod(String reference, Scope scope, String where) throws SnapshotException {
        if (reference.contains("(")) {
            MethodSymbol method = methodsBySignature.get(reference);
            if (method == null) {
                log.debug("{}: unresolved method '{}'", where, reference);
            }
            return method;
        }

        List<MethodSymbol> candidates = methodsByName.get(reference);
        if (candidates == null && scope.enclosingType != null) {
            candidates = methodsByName.get(scope.enclosingType.metadataName() + "." + reference);
        }
        if (candidates == null || candidates.isEmpty()) {
            log.debug("{}: unresolved method '{}'", where, reference);
            return null;
        }
        if (candidates.size() > 1) {
            throw new SnapshotException(where + ": method reference '" + reference
                    + "' is ambiguous, use a full signature");
        }
        return candidates.get(0);
    }

    // ---- Raw value helpers ----

    private static Location span(Map<?, ?> map, String unitPath, String where) throws SnapshotException {
        Object span = map.get("span");
        try {
            return span != null ? Location.parse(unitPath, span.toString()) : new Location(unitPath, 0, 0, 0, 0);
        } catch (IllegalArgumentException e) {
            throw new SnapshotException(where + ": " + e.getMessage(), e);
        }
    }

    private static String optionalString(Map<?, ?> map, String key) {
        Object value = map.get(key);
        return value != null ? value.toString() : null;
    }

    private static String requiredString(Map<?, ?> map, String key, String where) throws SnapshotException {
        String value = optionalString(map, key);
        if (value == null || value.isBlank()) {
            throw new SnapshotException(where + ": missing '" + key + "'");
        }
        return value;
    }

    private static boolean bool(Map<?, ?> map, String key, String where) throws SnapshotException {
        Object value = map.get(key);
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        throw new SnapshotException(where + ": '" + key + "' must be true or false");
    }

    private static List<Map<?, ?>> maps(Object raw, String where) throws SnapshotException {
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List<?> list)) {
            throw new SnapshotException(where + ": expected a list");
        }
        List<Map<?, ?>> result = new ArrayList<>(list.size());
        for (Object item : list) {
            if (!(item instanceof Map<?, ?> map)) {
                throw new SnapshotException(where + ": expected a list of maps");
            }
            result.add(map);
        }
        return result;
    }

    private static List<Map<?, ?>> maps0(Object raw) {
        if (!(raw instanceof List<?> list)) {
            return List.of();
        }
        List<Map<?, ?>> result = new ArrayList<>();
        for (Object item : list) {
            if (item instanceof Map<?, ?> map) {
                result.add(map);
            }
        }
        return result;
    }

    private static List<String> strings(Object raw, String where) throws SnapshotException {
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List<?> list)) {
            throw new SnapshotException(where + ": expected a list of names");
        }
        return list.stream().map(String::valueOf).toList();
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, String value, E defaultValue, String where)
            throws SnapshotException {
        if (value == null) {
            if (defaultValue == null) {
                throw new SnapshotException(where + ": missing value");
            }
            return defaultValue;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return Enum.valueOf(type, normalized);
        } catch (IllegalArgumentException e) {
            throw new SnapshotException(where + ": unknown " + type.getSimpleName() + " '" + value + "'");
        }
    }
}
