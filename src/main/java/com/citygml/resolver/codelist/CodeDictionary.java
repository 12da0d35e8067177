package com.citygml.resolver.codelist;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Code to meaning table defined by one CityGML codelist document.
 * Immutable once built; identity is the source path or URL.
 */
@Getter
@ToString(exclude = "entries")
@EqualsAndHashCode(of = "source")
public final class CodeDictionary {

    private final String source;
    private final Map<String, String> entries;

    public CodeDictionary(String source, Map<String, String> entries) {
        this.source = source;
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    /**
     * Load a codelist from a local path or an http(s) URL.
     *
     * @throws DictionaryLoadException if the source cannot be read or parsed
     */
    public static CodeDictionary load(String source) {
        return new CodeDictionaryParser().parse(source);
    }

    /**
     * Exact, case-sensitive lookup. Unknown codes are absent, never an error.
     */
    public Optional<String> lookup(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(code));
    }

    public List<String> codes() {
        return List.copyOf(entries.keySet());
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
