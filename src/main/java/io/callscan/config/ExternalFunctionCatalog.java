package io.callscan.config;

import io.callscan.model.ExternalFunctionCategory;
import io.callscan.model.ExternalFunctionInfo;
import io.callscan.model.FunctionSummary;
import io.callscan.model.FunctionSummary.GlobalEffect;
import io.callscan.model.FunctionSummary.ParameterSummary;
import io.callscan.model.FunctionSummary.ReturnSummary;
import io.callscan.model.ParameterMode;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Catalog of well-known library, POSIX and system functions.
 * <p>
 * Lookup is by exact name; names missing from the catalog are classified by
 * naming pattern into a generic, conservatively unsafe record. Classification
 * depends on the name alone. Instances are immutable once loaded.
 */
public class ExternalFunctionCatalog {

    private static final String DEFAULT_CATALOG = "/external-functions.yaml";
    private static final String ENTRIES_KEY = "externalFunctions";

    private static final Pattern POSIX_PREFIX = Pattern.compile("^(pthread|sem|fork|exec|socket|bind|listen)");
    private static final Pattern POSIX_IO_SUFFIX = Pattern.compile("_(read|write|open|close)$");
    private static final Pattern SYSTEM_PREFIX = Pattern.compile("^(system|exec|fork|spawn)");

    private final Map<String, ExternalFunctionInfo> entries;

    private ExternalFunctionCatalog(Map<String, ExternalFunctionInfo> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    /**
     * Returns the built-in catalog, loaded once from the classpath.
     */
    public static ExternalFunctionCatalog defaultCatalog() {
        return DefaultHolder.INSTANCE;
    }

    private static final class DefaultHolder {
        private static final ExternalFunctionCatalog INSTANCE = loadDefault();
    }

    /**
     * Loads the built-in catalog from the classpath.
     */
    public static ExternalFunctionCatalog loadDefault() {
        try (InputStream is = ExternalFunctionCatalog.class.getResourceAsStream(DEFAULT_CATALOG)) {
            if (is == null) {
                throw new IllegalStateException("Default external function catalog not found: " + DEFAULT_CATALOG);
            }
            return load(is);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load default external function catalog", e);
        }
    }

    /**
     * Loads a catalog from a YAML file with a top-level {@code externalFunctions} list.
     */
    public static ExternalFunctionCatalog loadFromFile(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return load(is);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid external function catalog " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads a catalog from an input stream.
     *
     * @throws IllegalArgumentException if an entry is malformed
     */
    public static ExternalFunctionCatalog load(InputStream is) {
        Yaml yaml = new Yaml();
        Object data = yaml.load(is);
        if (data instanceof Map<?, ?> map) {
            return of(parseEntries(map.get(ENTRIES_KEY)));
        }
        return of(List.of());
    }

    /**
     * Creates a catalog from explicit entries; a later entry replaces an earlier one of the same name.
     */
    public static ExternalFunctionCatalog of(Collection<ExternalFunctionInfo> infos) {
        Map<String, ExternalFunctionInfo> byName = new LinkedHashMap<>();
        for (ExternalFunctionInfo info : infos) {
            byName.put(info.name(), info);
        }
        return new ExternalFunctionCatalog(byName);
    }

    /**
     * Parses a YAML list of catalog entries.
     *
     * @throws IllegalArgumentException if an entry lacks a name or has an unknown category
     */
    static List<ExternalFunctionInfo> parseEntries(Object value) {
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        List<ExternalFunctionInfo> result = new ArrayList<>();
        for (Object item : list) {
            if (!(item instanceof Map<?, ?> entry)) {
                throw new IllegalArgumentException("Catalog entry must be a mapping: " + item);
            }
            Object name = entry.get("name");
            if (name == null || name.toString().isBlank()) {
                throw new IllegalArgumentException("Catalog entry without a name: " + entry);
            }
            Object category = entry.get("category");
            ExternalFunctionInfo info = new ExternalFunctionInfo(
                    name.toString().trim(),
                    category == null ? ExternalFunctionCategory.UNKNOWN : ExternalFunctionCategory.fromLabel(category.toString()),
                    stringOr(entry.get("description"), ""),
                    Boolean.TRUE.equals(entry.get("safe")),
                    entry.get("parameters") instanceof Number n ? n.intValue() : ExternalFunctionInfo.VARIADIC,
                    stringOr(entry.get("returnType"), "auto")
            );
            Object summary = entry.get("summary");
            if (summary != null) {
                info = info.withSummary(parseSummary(info, summary));
            }
            result.add(info);
        }
        return result;
    }

    /**
     * Parses the {@code summary} block of an entry. Parameters are indexed by list
     * position; the return type defaults to the entry's.
     */
    private static FunctionSummary parseSummary(ExternalFunctionInfo info, Object value) {
        if (!(value instanceof Map<?, ?> summary)) {
            throw new IllegalArgumentException("Summary of " + info.name() + " must be a mapping");
        }

        List<ParameterSummary> parameters = new ArrayList<>();
        for (Map<?, ?> param : mappings(summary.get("parameters"), info.name())) {
            int index = parameters.size();
            Object mode = param.get("mode");
            parameters.add(new ParameterSummary(
                    index,
                    stringOr(param.get("name"), "arg" + index),
                    mode == null ? ParameterMode.IN : ParameterMode.fromLabel(mode.toString()),
                    Boolean.TRUE.equals(param.get("taints")),
                    stringOr(param.get("description"), "")
            ));
        }

        ReturnSummary returnValue = ReturnSummary.VOID;
        Object returns = summary.get("returns");
        if (returns instanceof Map<?, ?> ret) {
            List<Integer> depends = new ArrayList<>();
            if (ret.get("depends") instanceof List<?> indices) {
                for (Object i : indices) {
                    if (!(i instanceof Number n) || n.intValue() < 0 || n.intValue() >= parameters.size()) {
                        throw new IllegalArgumentException("Return of " + info.name() + " depends on unknown parameter: " + i);
                    }
                    depends.add(n.intValue());
                }
            }
            returnValue = new ReturnSummary(
                    stringOr(ret.get("type"), info.returnType()),
                    Boolean.TRUE.equals(ret.get("tainted")),
                    depends,
                    stringOr(ret.get("description"), "")
            );
        } else if (returns != null) {
            throw new IllegalArgumentException("Return summary of " + info.name() + " must be a mapping");
        }

        List<GlobalEffect> globalEffects = new ArrayList<>();
        for (Map<?, ?> effect : mappings(summary.get("globalEffects"), info.name())) {
            Object variable = effect.get("variable");
            if (variable == null || variable.toString().isBlank()) {
                throw new IllegalArgumentException("Global effect of " + info.name() + " without a variable");
            }
            globalEffects.add(new GlobalEffect(
                    variable.toString(),
                    Boolean.TRUE.equals(effect.get("modified")),
                    Boolean.TRUE.equals(effect.get("tainted")),
                    stringOr(effect.get("description"), "")
            ));
        }

        return new FunctionSummary(
                info.name(),
                stringOr(summary.get("category"), ""),
                stringOr(summary.get("description"), info.description()),
                parameters,
                returnValue,
                globalEffects
        );
    }

    private static List<Map<?, ?>> mappings(Object value, String owner) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException("Expected a list in the summary of " + owner + ": " + value);
        }
        List<Map<?, ?>> result = new ArrayList<>();
        for (Object item : list) {
            if (!(item instanceof Map<?, ?> map)) {
                throw new IllegalArgumentException("Expected a mapping in the summary of " + owner + ": " + item);
            }
            result.add(map);
        }
        return result;
    }

    private static String stringOr(Object value, String fallback) {
        return value == null ? fallback : value.toString();
    }

    /**
     * Merges this catalog with another, with the other taking precedence.
     */
    public ExternalFunctionCatalog merge(ExternalFunctionCatalog other) {
        Map<String, ExternalFunctionInfo> merged = new LinkedHashMap<>(entries);
        merged.putAll(other.entries);
        return new ExternalFunctionCatalog(merged);
    }

    /**
     * Returns the curated entry for the given name, or empty if not in the catalog.
     */
    public Optional<ExternalFunctionInfo> lookup(String name) {
        return Optional.ofNullable(entries.get(name));
    }

    public boolean contains(String name) {
        return entries.containsKey(name);
    }

    /**
     * Returns the effect summary of a library function, or empty if it has none.
     */
    public Optional<FunctionSummary> summary(String name) {
        return lookup(name).map(ExternalFunctionInfo::summary);
    }

    public boolean hasSummary(String name) {
        return summary(name).isPresent();
    }

    /**
     * Returns the summaries of one functional group ("string", "memory", "io", ...).
     */
    public List<FunctionSummary> summariesByCategory(String category) {
        return entries.values().stream()
                .map(ExternalFunctionInfo::summary)
                .filter(summary -> summary != null && summary.category().equals(category))
                .toList();
    }

    public List<String> summarizedFunctions() {
        return entries.values().stream()
                .filter(ExternalFunctionInfo::hasSummary)
                .map(ExternalFunctionInfo::name)
                .toList();
    }

    /**
     * Returns a copy of this catalog with the summary attached to its function,
     * replacing any previous summary. A function not yet in the catalog is added
     * with its pattern-based category.
     */
    public ExternalFunctionCatalog withSummary(FunctionSummary summary) {
        Map<String, ExternalFunctionInfo> updated = new LinkedHashMap<>(entries);
        updated.put(summary.name(), describe(summary.name()).withSummary(summary));
        return new ExternalFunctionCatalog(updated);
    }

    /**
     * Returns the curated entry, or a generic unsafe record categorized by naming pattern.
     */
    public ExternalFunctionInfo describe(String name) {
        ExternalFunctionInfo known = entries.get(name);
        if (known != null) {
            return known;
        }
        return ExternalFunctionInfo.unknown(name, categorizeUnknown(name));
    }

    /**
     * Guesses the category of a function missing from the catalog from its name.
     */
    public static ExternalFunctionCategory categorizeUnknown(String name) {
        if (name.startsWith("std::")) {
            return ExternalFunctionCategory.CPP_STDLIB;
        }
        if (POSIX_PREFIX.matcher(name).find() || POSIX_IO_SUFFIX.matcher(name).find()) {
            return ExternalFunctionCategory.POSIX;
        }
        if (SYSTEM_PREFIX.matcher(name).find()) {
            return ExternalFunctionCategory.SYSTEM;
        }
        return ExternalFunctionCategory.UNKNOWN;
    }

    public Collection<ExternalFunctionInfo> entries() {
        return entries.values();
    }

    /**
     * Returns the catalog entries of one category.
     */
    public List<ExternalFunctionInfo> byCategory(ExternalFunctionCategory category) {
        return entries.values().stream()
                .filter(info -> info.category() == category)
                .toList();
    }

    public int size() {
        return entries.size();
    }
}
