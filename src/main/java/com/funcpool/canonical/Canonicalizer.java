package com.funcpool.canonical;

import com.funcpool.exception.StructuralException;
import com.funcpool.model.syntax.Arg;
import com.funcpool.model.syntax.ExceptHandler;
import com.funcpool.model.syntax.Expr;
import com.funcpool.model.syntax.ImportName;
import com.funcpool.model.syntax.Module;
import com.funcpool.model.syntax.Node;
import com.funcpool.model.syntax.NodeRewriter;
import com.funcpool.model.syntax.Stmt;
import com.funcpool.model.syntax.SyntaxTrees;
import com.funcpool.parser.PythonParser;
import com.funcpool.parser.PythonUnparser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reduces a function source file to its canonical form: imports sorted, local identifiers replaced
 * by numbered slots, pool aliases replaced by hash references. Two sources that differ only in
 * local names, docstring, comments, layout or import order canonicalize to the same text.
 */
public class Canonicalizer {
    private static final Logger log = LoggerFactory.getLogger(Canonicalizer.class);

    private static final Comparator<List<String>> NAME_TUPLES = (a, b) -> {
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int cmp = a.get(i).compareTo(b.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(a.size(), b.size());
    };

    /**
     * {@code from} imports first, ordered by module then by sorted imported names; plain imports
     * after them, ordered by sorted imported names.
     */
    static final Comparator<Stmt> IMPORT_ORDER = (a, b) -> {
        boolean aFrom = a instanceof Stmt.ImportFrom;
        boolean bFrom = b instanceof Stmt.ImportFrom;
        if (aFrom != bFrom) {
            return aFrom ? -1 : 1;
        }
        if (aFrom) {
            int cmp = fromModule((Stmt.ImportFrom) a).compareTo(fromModule((Stmt.ImportFrom) b));
            if (cmp != 0) {
                return cmp;
            }
        }
        return NAME_TUPLES.compare(sortedNames(a), sortedNames(b));
    };

    /**
     * Canonicalizes the source of one function file.
     *
     * @throws com.funcpool.exception.PythonSyntaxException when the source does not parse
     * @throws StructuralException when the file is not imports plus exactly one function
     */
    public CanonicalForm canonicalize(String source, String fileName) {
        return canonicalize(PythonParser.parse(source, fileName), fileName);
    }

    /**
     * Canonicalizes a parsed module. The module is rewritten in place.
     */
    public CanonicalForm canonicalize(Module module, String fileName) {
        List<Stmt> imports = new ArrayList<>();
        Stmt.FunctionDef function = null;
        for (Stmt stmt : module.getBody()) {
            if (stmt instanceof Stmt.Import || stmt instanceof Stmt.ImportFrom) {
                imports.add(stmt);
            } else if (stmt instanceof Stmt.FunctionDef def) {
                if (function != null) {
                    throw new StructuralException("Only one function definition is allowed per file",
                            fileName, stmt.getSourceLine());
                }
                function = def;
            } else {
                throw new StructuralException("Only imports and a single function definition are allowed at "
                        + "top level, found " + describe(stmt), fileName, stmt.getSourceLine());
            }
        }
        if (function == null) {
            throw new StructuralException("No function definition found in file", fileName, 0);
        }
        imports.sort(IMPORT_ORDER);

        String functionName = function.getName();
        Expr.Constant docstringNode = SyntaxTrees.docstringOf(function.getBody());
        String docstring = docstringNode == null ? "" : cleanDocstring(docstringNode.getValue());

        Map<String, String> aliasMapping = new LinkedHashMap<>();
        List<String> dependencies = stripPoolAliases(imports, aliasMapping, fileName);
        List<String> checks = checkTargets(function);

        Set<String> excluded = new HashSet<>(aliasMapping.values());
        for (Stmt stmt : imports) {
            for (ImportName name : importNames(stmt)) {
                excluded.add(name.boundName());
            }
        }
        Map<String, String> forward = assignSlots(function, excluded);

        Map<String, String> aliasToHash = new LinkedHashMap<>();
        aliasMapping.forEach((hash, alias) -> aliasToHash.put(alias, hash));
        function.accept(new AliasReferenceRewriter(aliasToHash));
        function.accept(new IdentifierRenamer(forward));

        List<Stmt> body = new ArrayList<>(imports);
        body.add(function);
        Module canonical = new Module(body);
        String withDocstring = PythonUnparser.unparse(canonical);
        String withoutDocstring = withDocstring;
        if (docstringNode != null) {
            List<Stmt> fullBody = function.getBody();
            function.setBody(new ArrayList<>(fullBody.subList(1, fullBody.size())));
            withoutDocstring = PythonUnparser.unparse(canonical);
            function.setBody(fullBody);
        }

        Map<String, String> nameMapping = new LinkedHashMap<>();
        forward.forEach((original, slot) -> nameMapping.put(slot, original));
        log.debug("Canonicalized {}: function '{}', {} slots, {} dependencies", fileName, functionName,
                nameMapping.size(), dependencies.size());

        return CanonicalForm.builder()
                .functionName(functionName)
                .withDocstring(withDocstring)
                .withoutDocstring(withoutDocstring)
                .docstring(docstring)
                .nameMapping(Collections.unmodifiableMap(nameMapping))
                .aliasMapping(Collections.unmodifiableMap(aliasMapping))
                .checks(List.copyOf(checks))
                .dependencies(List.copyOf(dependencies))
                .build();
    }

    /**
     * Removes {@code as alias} from pool imports, recording each alias by hash, and returns the
     * imported hashes in import order.
     */
    private static List<String> stripPoolAliases(List<Stmt> imports, Map<String, String> aliasMapping,
                                                 String fileName) {
        Set<String> dependencies = new LinkedHashSet<>();
        for (Stmt stmt : imports) {
            if (!(stmt instanceof Stmt.ImportFrom from) || !isPoolImport(from)) {
                continue;
            }
            for (ImportName name : from.getNames()) {
                String hash = Identifiers.hashOfReference(name.getName());
                if (hash == null) {
                    throw new StructuralException("Pool imports must name " + Identifiers.OBJECT_PREFIX
                            + "<sha256 hash>, found '" + name.getName() + "'", fileName, stmt.getSourceLine());
                }
                if (name.getAsname() != null) {
                    String previous = aliasMapping.put(hash, name.getAsname());
                    if (previous != null && !previous.equals(name.getAsname())) {
                        throw new StructuralException("Function " + hash + " is imported under two aliases, '"
                                + previous + "' and '" + name.getAsname() + "'", fileName, stmt.getSourceLine());
                    }
                    name.setAsname(null);
                }
                dependencies.add(hash);
            }
        }
        return new ArrayList<>(dependencies);
    }

    static boolean isPoolImport(Stmt.ImportFrom from) {
        return from.getLevel() == 0 && Identifiers.POOL_MODULE.equals(from.getModule());
    }

    /**
     * Hashes named by {@code @check(object_<hash>)} decorators.
     */
    static List<String> checkTargets(Stmt.FunctionDef function) {
        List<String> checks = new ArrayList<>();
        for (Expr decorator : function.getDecorators()) {
            if (decorator instanceof Expr.Call call
                    && call.getFunc() instanceof Expr.Name func
                    && Identifiers.CHECK_DECORATOR.equals(func.getId())
                    && call.getArgs().size() == 1
                    && call.getKeywords().isEmpty()
                    && call.getArgs().get(0) instanceof Expr.Name target) {
                String hash = Identifiers.hashOfReference(target.getId());
                if (hash != null && !checks.contains(hash)) {
                    checks.add(hash);
                }
            }
        }
        return checks;
    }

    /**
     * Assigns slots in breadth-first order of first occurrence, the function's own name first.
     */
    private static Map<String, String> assignSlots(Stmt.FunctionDef function, Set<String> excluded) {
        Map<String, String> forward = new LinkedHashMap<>();
        forward.put(function.getName(), Identifiers.ENTRY_SLOT);
        for (Node node : SyntaxTrees.breadthFirst(function)) {
            for (String name : boundIdentifiers(node)) {
                if (forward.containsKey(name) || excluded.contains(name)
                        || PythonBuiltins.contains(name) || Identifiers.isObjectReference(name)) {
                    continue;
                }
                forward.put(name, Identifiers.slot(forward.size()));
            }
        }
        return forward;
    }

    static List<String> boundIdentifiers(Node node) {
        if (node instanceof Expr.Name name) {
            return List.of(name.getId());
        }
        if (node instanceof Arg arg) {
            return List.of(arg.getName());
        }
        if (node instanceof Stmt.FunctionDef def) {
            return List.of(def.getName());
        }
        if (node instanceof Stmt.ClassDef def) {
            return List.of(def.getName());
        }
        if (node instanceof ExceptHandler handler && handler.getName() != null) {
            return List.of(handler.getName());
        }
        if (node instanceof Stmt.Global global) {
            return global.getNames();
        }
        if (node instanceof Stmt.Nonlocal nonlocal) {
            return nonlocal.getNames();
        }
        return List.of();
    }

    /**
     * Python's {@code inspect.cleandoc}: tabs expanded, the common indentation of all lines after
     * the first removed, leading whitespace of the first line removed, leading and trailing empty
     * lines dropped.
     */
    public static String cleanDocstring(String docstring) {
        List<String> lines = new ArrayList<>(List.of(expandTabs(docstring).split("\n", -1)));
        int margin = Integer.MAX_VALUE;
        for (String line : lines.subList(1, lines.size())) {
            int content = line.stripLeading().length();
            if (content > 0) {
                margin = Math.min(margin, line.length() - content);
            }
        }
        lines.set(0, lines.get(0).stripLeading());
        if (margin < Integer.MAX_VALUE) {
            for (int i = 1; i < lines.size(); i++) {
                String line = lines.get(i);
                lines.set(i, line.length() <= margin ? "" : line.substring(margin));
            }
        }
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        while (!lines.isEmpty() && lines.get(0).isEmpty()) {
            lines.remove(0);
        }
        return String.join("\n", lines);
    }

    private static String expandTabs(String text) {
        if (text.indexOf('\t') < 0) {
            return text;
        }
        StringBuilder out = new StringBuilder();
        int column = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\t') {
                int spaces = 8 - column % 8;
                out.append(" ".repeat(spaces));
                column += spaces;
            } else {
                out.append(c);
                column = c == '\n' || c == '\r' ? 0 : column + 1;
            }
        }
        return out.toString();
    }

    private static String fromModule(Stmt.ImportFrom from) {
        return ".".repeat(from.getLevel()) + (from.getModule() == null ? "" : from.getModule());
    }

    private static List<String> sortedNames(Stmt stmt) {
        List<String> names = new ArrayList<>();
        for (ImportName name : importNames(stmt)) {
            names.add(name.getName());
        }
        Collections.sort(names);
        return names;
    }

    private static List<ImportName> importNames(Stmt stmt) {
        if (stmt instanceof Stmt.Import plain) {
            return plain.getNames();
        }
        if (stmt instanceof Stmt.ImportFrom from) {
            return from.getNames();
        }
        return List.of();
    }

    private static String describe(Stmt stmt) {
        if (stmt instanceof Stmt.ClassDef def) {
            return "class '" + def.getName() + "'";
        }
        if (stmt instanceof Stmt.ExprStmt) {
            return "an expression statement";
        }
        return "a statement of type " + stmt.getClass().getSimpleName();
    }

    /**
     * Replaces each bare name equal to a dependency alias by {@code object_<hash>._fp_v_0}.
     */
    private static class AliasReferenceRewriter extends NodeRewriter {
        private final Map<String, String> aliasToHash;

        AliasReferenceRewriter(Map<String, String> aliasToHash) {
            this.aliasToHash = aliasToHash;
        }

        @Override
        public Node visitName(Expr.Name node) {
            String hash = aliasToHash.get(node.getId());
            if (hash == null) {
                return node;
            }
            return new Expr.Attribute(new Expr.Name(Identifiers.objectReference(hash)), Identifiers.ENTRY_SLOT);
        }
    }
}
