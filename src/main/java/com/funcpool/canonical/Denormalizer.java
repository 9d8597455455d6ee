package com.funcpool.canonical;

import com.funcpool.exception.PythonSyntaxException;
import com.funcpool.exception.SchemaException;
import com.funcpool.model.syntax.Expr;
import com.funcpool.model.syntax.ImportName;
import com.funcpool.model.syntax.Module;
import com.funcpool.model.syntax.Node;
import com.funcpool.model.syntax.NodeRewriter;
import com.funcpool.model.syntax.Stmt;
import com.funcpool.model.syntax.SyntaxTrees;
import com.funcpool.parser.PythonParser;
import com.funcpool.parser.PythonUnparser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Restores the surface form of a canonical function from one of its mappings: original names,
 * dependency aliases and docstring.
 */
public class Denormalizer {

    private static final String STORED_CODE = "<stored>";

    /**
     * Rebuilds readable source from canonical text.
     *
     * @param docstring docstring to show; empty removes any docstring present in the canonical text
     * @throws SchemaException when the canonical text and the mapping do not fit together
     */
    public String denormalize(String canonicalCode, Map<String, String> nameMapping,
                              Map<String, String> aliasMapping, String docstring) {
        Module module = parseStored(canonicalCode);
        Stmt.FunctionDef function = singleFunction(module);
        if (!Identifiers.ENTRY_SLOT.equals(function.getName())) {
            throw new SchemaException("Canonical function is named '" + function.getName() + "' instead of "
                    + Identifiers.ENTRY_SLOT);
        }
        if (!nameMapping.containsKey(Identifiers.ENTRY_SLOT)) {
            throw new SchemaException("Name mapping has no entry for " + Identifiers.ENTRY_SLOT);
        }

        replaceDocstring(function, docstring);
        restoreAliases(module, aliasMapping);
        module.accept(new IdentifierRenamer(nameMapping));

        Set<String> unmapped = new TreeSet<>();
        for (Node node : SyntaxTrees.breadthFirst(module)) {
            for (String name : Canonicalizer.boundIdentifiers(node)) {
                if (Identifiers.isSlot(name) && !nameMapping.containsKey(name)) {
                    unmapped.add(name);
                }
            }
        }
        if (!unmapped.isEmpty()) {
            throw new SchemaException("Name mapping does not cover " + String.join(", ", unmapped));
        }
        return PythonUnparser.unparse(module);
    }

    /**
     * Removes pool imports and imports of the runtime module; the program harness binds those
     * names itself.
     */
    public String stripPoolImports(String source) {
        Module module = PythonParser.parse(source, STORED_CODE);
        module.getBody().removeIf(stmt -> stmt instanceof Stmt.ImportFrom from
                && from.getLevel() == 0
                && (Identifiers.POOL_MODULE.equals(from.getModule())
                    || Identifiers.RUNTIME_MODULE.equals(from.getModule())));
        return PythonUnparser.unparse(module);
    }

    /**
     * Hashes imported from the pool by canonical text, in import order.
     */
    public List<String> dependencies(String canonicalCode) {
        List<String> hashes = new ArrayList<>();
        for (Stmt stmt : parseStored(canonicalCode).getBody()) {
            if (stmt instanceof Stmt.ImportFrom from && Canonicalizer.isPoolImport(from)) {
                for (ImportName name : from.getNames()) {
                    String hash = Identifiers.hashOfReference(name.getName());
                    if (hash != null && !hashes.contains(hash)) {
                        hashes.add(hash);
                    }
                }
            }
        }
        return hashes;
    }

    private static Module parseStored(String canonicalCode) {
        try {
            return PythonParser.parse(canonicalCode, STORED_CODE);
        } catch (PythonSyntaxException e) {
            throw new SchemaException("Stored canonical code does not parse: " + e.getMessage(), e);
        }
    }

    private static Stmt.FunctionDef singleFunction(Module module) {
        Stmt.FunctionDef function = null;
        for (Stmt stmt : module.getBody()) {
            if (stmt instanceof Stmt.FunctionDef def) {
                if (function != null) {
                    throw new SchemaException("Canonical code defines more than one function");
                }
                function = def;
            }
        }
        if (function == null) {
            throw new SchemaException("Canonical code defines no function");
        }
        return function;
    }

    private static void replaceDocstring(Stmt.FunctionDef function, String docstring) {
        List<Stmt> body = new ArrayList<>(function.getBody());
        boolean present = SyntaxTrees.docstringOf(body) != null;
        if (docstring != null && !docstring.isEmpty()) {
            Stmt.ExprStmt replacement = new Stmt.ExprStmt(Expr.Constant.string(docstring));
            if (present) {
                body.set(0, replacement);
            } else {
                body.add(0, replacement);
            }
        } else if (present) {
            body.remove(0);
        }
        function.setBody(body);
    }

    private static void restoreAliases(Module module, Map<String, String> aliasMapping) {
        Set<String> imported = new HashSet<>();
        for (Stmt stmt : module.getBody()) {
            if (stmt instanceof Stmt.ImportFrom from && Canonicalizer.isPoolImport(from)) {
                for (ImportName name : from.getNames()) {
                    String hash = Identifiers.hashOfReference(name.getName());
                    if (hash != null && aliasMapping.containsKey(hash)) {
                        name.setAsname(aliasMapping.get(hash));
                        imported.add(hash);
                    }
                }
            }
        }
        Set<String> stray = new TreeSet<>(aliasMapping.keySet());
        stray.removeAll(imported);
        if (!stray.isEmpty()) {
            throw new SchemaException("Alias mapping names functions that are not imported: "
                    + String.join(", ", stray));
        }
        module.accept(new AliasRestorer(aliasMapping));
    }

    /**
     * Turns {@code object_<hash>._fp_v_0} back into the alias recorded for the hash.
     */
    private static class AliasRestorer extends NodeRewriter {
        private final Map<String, String> aliasMapping;

        AliasRestorer(Map<String, String> aliasMapping) {
            this.aliasMapping = aliasMapping;
        }

        @Override
        public Node visitAttribute(Expr.Attribute node) {
            if (node.getValue() instanceof Expr.Name receiver && Identifiers.ENTRY_SLOT.equals(node.getAttr())) {
                String hash = Identifiers.hashOfReference(receiver.getId());
                if (hash != null && aliasMapping.containsKey(hash)) {
                    return new Expr.Name(aliasMapping.get(hash));
                }
            }
            return super.visitAttribute(node);
        }
    }
}
