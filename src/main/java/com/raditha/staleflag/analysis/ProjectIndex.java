package com.raditha.staleflag.analysis;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.raditha.staleflag.model.Binding;
import com.raditha.staleflag.model.BindingKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Project-wide index of named types and the fields they declare.
 * <p>
 * Built once from every parsed unit before any resolution starts. Supertypes and
 * the fields visible on each type are resolved while building, so lookups never
 * walk another unit's tree and resolvers on different threads can share the index
 * while each of them rewrites its own unit.
 */
public class ProjectIndex {

    private final Map<String, TypeEntry> types = new LinkedHashMap<>();
    private final Map<CompilationUnit, Map<String, String>> unitTypes = new IdentityHashMap<>();
    private final Map<String, Map<String, Binding>> visibleFields = new HashMap<>();

    /**
     * A named type and its fields.
     *
     * @param fqn        fully qualified name
     * @param unitName   the unit declaring it
     * @param fields     fields and enum constants by name
     * @param supertypes fully qualified names of the extended and implemented project types
     */
    public record TypeEntry(
            String fqn,
            String unitName,
            Map<String, Binding> fields,
            List<String> supertypes) {
    }

    public static ProjectIndex build(Map<String, CompilationUnit> units) {
        ProjectIndex index = new ProjectIndex();
        Map<String, List<String>> written = new LinkedHashMap<>();
        Map<String, CompilationUnit> declaredIn = new HashMap<>();
        units.forEach((unitName, cu) -> index.addUnit(unitName, cu, written, declaredIn));

        written.forEach((fqn, names) -> {
            CompilationUnit cu = declaredIn.get(fqn);
            List<String> supertypes = names.stream()
                    .map(name -> index.resolveType(cu, name))
                    .flatMap(Optional::stream)
                    .toList();
            TypeEntry entry = index.types.get(fqn);
            index.types.put(fqn, new TypeEntry(fqn, entry.unitName(), entry.fields(), supertypes));
        });
        for (String fqn : index.types.keySet()) {
            Map<String, Binding> fields = new LinkedHashMap<>();
            index.collectFields(fqn, fields, new HashSet<>(), true);
            index.visibleFields.put(fqn, Collections.unmodifiableMap(fields));
        }
        return index;
    }

    @SuppressWarnings("unchecked")
    private void addUnit(String unitName, CompilationUnit cu, Map<String, List<String>> written,
            Map<String, CompilationUnit> declaredIn) {
        Map<String, String> declared = new HashMap<>();
        for (TypeDeclaration<?> type : cu.findAll(TypeDeclaration.class)) {
            Optional<String> fqn = type.getFullyQualifiedName();
            if (fqn.isEmpty()) {
                continue;
            }
            declared.putIfAbsent(type.getNameAsString(), fqn.get());
            Map<String, Binding> fields = new LinkedHashMap<>();
            for (Binding binding : fieldBindings(type, fqn.get())) {
                fields.put(binding.name(), binding);
            }
            types.put(fqn.get(), new TypeEntry(fqn.get(), unitName, Collections.unmodifiableMap(fields), List.of()));
            written.put(fqn.get(), supertypeNames(type));
            declaredIn.put(fqn.get(), cu);
        }
        unitTypes.put(cu, declared);
    }

    /**
     * Field and enum constant bindings declared directly by a type.
     *
     * @param ownerType fully qualified name, null for types that have none
     */
    public static List<Binding> fieldBindings(TypeDeclaration<?> type, String ownerType) {
        boolean isInterface = type instanceof ClassOrInterfaceDeclaration c && c.isInterface();
        List<Binding> bindings = new ArrayList<>(memberBindings(type.getMembers(), ownerType, isInterface));
        if (type instanceof EnumDeclaration enumDeclaration) {
            boolean exported = enumDeclaration.isPublic() || enumDeclaration.isProtected();
            for (EnumConstantDeclaration constant : enumDeclaration.getEntries()) {
                bindings.add(new Binding(constant.getNameAsString(), BindingKind.ENUM_CONSTANT,
                        constant, null, ownerType, exported, false));
            }
        }
        return bindings;
    }

    /**
     * Field bindings for a list of members, e.g. an anonymous class body.
     */
    public static List<Binding> memberBindings(NodeList<BodyDeclaration<?>> members, String ownerType,
            boolean isInterface) {
        List<Binding> bindings = new ArrayList<>();
        for (BodyDeclaration<?> member : members) {
            if (!(member instanceof FieldDeclaration field)) {
                continue;
            }
            for (VariableDeclarator variable : field.getVariables()) {
                boolean constant = (isInterface || field.isStatic() && field.isFinal())
                        && variable.getInitializer().isPresent();
                boolean exported = isInterface || field.isPublic() || field.isProtected();
                bindings.add(new Binding(
                        variable.getNameAsString(),
                        constant ? BindingKind.CONSTANT : BindingKind.FIELD,
                        variable,
                        variable.getInitializer().orElse(null),
                        ownerType,
                        exported,
                        field.isPrivate()));
            }
        }
        return bindings;
    }

    private static List<String> supertypeNames(TypeDeclaration<?> type) {
        List<ClassOrInterfaceType> supertypes = new ArrayList<>();
        if (type instanceof ClassOrInterfaceDeclaration c) {
            supertypes.addAll(c.getExtendedTypes());
            supertypes.addAll(c.getImplementedTypes());
        } else if (type instanceof EnumDeclaration e) {
            supertypes.addAll(e.getImplementedTypes());
        } else if (type instanceof RecordDeclaration r) {
            supertypes.addAll(r.getImplementedTypes());
        }
        return supertypes.stream().map(ClassOrInterfaceType::getNameWithScope).toList();
    }

    public Optional<TypeEntry> getType(String fqn) {
        return Optional.ofNullable(types.get(fqn));
    }

    public Optional<Binding> findByKey(String key) {
        int hash = key.lastIndexOf('#');
        if (hash < 0) {
            return Optional.empty();
        }
        return getType(key.substring(0, hash)).map(t -> t.fields().get(key.substring(hash + 1)));
    }

    /**
     * Fields visible on a type by simple name: its own plus non-private fields
     * inherited from project supertypes. Own fields hide inherited ones.
     */
    public Map<String, Binding> fieldsOf(String fqn) {
        return visibleFields.getOrDefault(fqn, Map.of());
    }

    private void collectFields(String fqn, Map<String, Binding> result, Set<String> visited, boolean own) {
        TypeEntry entry = types.get(fqn);
        if (entry == null || !visited.add(fqn)) {
            return;
        }
        for (Binding binding : entry.fields().values()) {
            if (own || !binding.privateMember()) {
                result.putIfAbsent(binding.name(), binding);
            }
        }
        for (String supertype : entry.supertypes()) {
            collectFields(supertype, result, visited, false);
        }
    }

    /**
     * Resolve a type name as written in a unit to a project type.
     * Handles qualified names, nested types, single-type and on-demand imports and
     * the unit's own package.
     */
    public Optional<String> resolveType(CompilationUnit cu, String name) {
        if (types.containsKey(name)) {
            return Optional.of(name);
        }
        int dot = name.indexOf('.');
        String first = dot > 0 ? name.substring(0, dot) : name;
        String rest = dot > 0 ? name.substring(dot) : "";
        return resolveSimpleType(cu, first).map(head -> head + rest).filter(types::containsKey);
    }

    private Optional<String> resolveSimpleType(CompilationUnit cu, String simpleName) {
        Map<String, String> declared = unitTypes.get(cu);
        String own = declared != null ? declared.get(simpleName) : declaredTypeName(cu, simpleName);
        if (own != null) {
            return Optional.of(own);
        }
        for (ImportDeclaration imp : cu.getImports()) {
            if (!imp.isStatic() && !imp.isAsterisk() && imp.getName().getIdentifier().equals(simpleName)) {
                return Optional.of(imp.getNameAsString());
            }
        }
        String packagePrefix = cu.getPackageDeclaration().map(p -> p.getNameAsString() + ".").orElse("");
        if (types.containsKey(packagePrefix + simpleName)) {
            return Optional.of(packagePrefix + simpleName);
        }
        for (ImportDeclaration imp : cu.getImports()) {
            if (!imp.isStatic() && imp.isAsterisk() && types.containsKey(imp.getNameAsString() + "." + simpleName)) {
                return Optional.of(imp.getNameAsString() + "." + simpleName);
            }
        }
        return Optional.empty();
    }

    /**
     * Types of a unit that was not indexed.
     */
    @SuppressWarnings("unchecked")
    private static String declaredTypeName(CompilationUnit cu, String simpleName) {
        for (TypeDeclaration<?> type : cu.findAll(TypeDeclaration.class)) {
            if (type.getNameAsString().equals(simpleName) && type.getFullyQualifiedName().isPresent()) {
                return type.getFullyQualifiedName().get();
            }
        }
        return null;
    }

    /**
     * Bindings brought into a unit by {@code import static} declarations of project
     * constants and enum constants.
     */
    public List<Binding> staticImportBindings(CompilationUnit cu) {
        List<Binding> bindings = new ArrayList<>();
        for (ImportDeclaration imp : cu.getImports()) {
            if (!imp.isStatic()) {
                continue;
            }
            String name = imp.getNameAsString();
            if (imp.isAsterisk()) {
                getType(name).ifPresent(t -> t.fields().values().stream()
                        .filter(b -> b.kind().isShared())
                        .forEach(bindings::add));
                continue;
            }
            int dot = name.lastIndexOf('.');
            if (dot > 0) {
                String member = name.substring(dot + 1);
                getType(name.substring(0, dot))
                        .map(t -> t.fields().get(member))
                        .filter(b -> b.kind().isShared())
                        .ifPresent(bindings::add);
            }
        }
        return bindings;
    }

    /**
     * Every enum constant in the project with the given simple name.
     */
    public List<Binding> enumConstantsNamed(String name) {
        List<Binding> result = new ArrayList<>();
        for (TypeEntry entry : types.values()) {
            Binding binding = entry.fields().get(name);
            if (binding != null && binding.kind() == BindingKind.ENUM_CONSTANT) {
                result.add(binding);
            }
        }
        return result;
    }

    public int size() {
        return types.size();
    }
}
