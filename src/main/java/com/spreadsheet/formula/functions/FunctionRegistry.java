package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.exceptions.UnknownFunctionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Case-insensitive function lookup, split by namespace.
 * Compatibility prefixes ("_xlfn.", "_xlws.") are stripped before lookup,
 * and the EXTENDED namespace wins over STANDARD.
 */
public class FunctionRegistry {
    private static final Logger log = LoggerFactory.getLogger(FunctionRegistry.class);

    private final Map<FunctionNamespace, Map<String, FormulaFunction>> functions = new EnumMap<>(FunctionNamespace.class);
    private final List<String> compatibilityPrefixes = new ArrayList<>();

    public FunctionRegistry(Collection<? extends FormulaFunction> initialFunctions, Collection<String> compatibilityPrefixes) {
        for (FunctionNamespace namespace : FunctionNamespace.values()) {
            functions.put(namespace, new LinkedHashMap<>());
        }
        for (String prefix : compatibilityPrefixes) {
            this.compatibilityPrefixes.add(prefix.toUpperCase(Locale.ROOT));
        }
        for (FormulaFunction function : initialFunctions) {
            register(function);
        }
        log.info("Function registry ready with {} function(s)", size());
    }

    /**
     * Adds a function to its namespace.
     * Throws IllegalArgumentException if the name is already taken there.
     */
    public void register(FormulaFunction function) {
        if (!(function instanceof EagerFormulaFunction) && !(function instanceof LazyFormulaFunction)) {
            throw new IllegalArgumentException("Function " + function.getName()
                    + " must implement EagerFormulaFunction or LazyFormulaFunction");
        }
        String key = normalize(function.getName());
        Map<String, FormulaFunction> namespace = functions.get(function.getNamespace());
        if (namespace.containsKey(key)) {
            throw new IllegalArgumentException("Formula function \"" + function.getName() + "\" is already registered");
        }
        namespace.put(key, function);
        log.debug("Registered {} function {}", function.getNamespace(), key);
    }

    /**
     * Finds the function for a name as written in a formula.
     * Throws UnknownFunctionException when nothing is registered under it.
     */
    public FormulaFunction lookup(String name) {
        FormulaFunction function = find(name);
        if (function == null) {
            throw new UnknownFunctionException(name);
        }
        return function;
    }

    /**
     * Like {@link #lookup(String)} but returns null for unknown names.
     */
    public FormulaFunction find(String name) {
        String key = stripCompatibilityPrefixes(normalize(name));
        FormulaFunction extended = functions.get(FunctionNamespace.EXTENDED).get(key);
        if (extended != null) {
            return extended;
        }
        return functions.get(FunctionNamespace.STANDARD).get(key);
    }

    public boolean contains(String name) {
        return find(name) != null;
    }

    /**
     * All registered functions, EXTENDED ones first.
     */
    public List<FormulaFunction> listFunctions() {
        List<FormulaFunction> all = new ArrayList<>();
        all.addAll(functions.get(FunctionNamespace.EXTENDED).values());
        all.addAll(functions.get(FunctionNamespace.STANDARD).values());
        return all;
    }

    public List<FormulaFunction> getFunctionsByCategory(String category) {
        List<FormulaFunction> matching = new ArrayList<>();
        for (FormulaFunction function : listFunctions()) {
            if (category.equalsIgnoreCase(function.getCategory())) {
                matching.add(function);
            }
        }
        return matching;
    }

    public int size() {
        int count = 0;
        for (Map<String, FormulaFunction> namespace : functions.values()) {
            count += namespace.size();
        }
        return count;
    }

    private String stripCompatibilityPrefixes(String name) {
        String current = name;
        boolean stripped = true;
        while (stripped) {
            stripped = false;
            for (String prefix : compatibilityPrefixes) {
                if (current.startsWith(prefix) && current.length() > prefix.length()) {
                    current = current.substring(prefix.length());
                    stripped = true;
                }
            }
        }
        return current;
    }

    private static String normalize(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Function name must not be empty");
        }
        return name.trim().toUpperCase(Locale.ROOT);
    }
}
