package com.idl.compiler.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Represents a fully parsed IDL file.
 */
@Data
@Builder
public class Program {
    private String sourceFile;
    private List<IncludeNode> includes;
    private Map<String, String> namespaces;
    private List<Definition> definitions;

    public static ProgramBuilder builder() {
        return new ProgramBuilder()
                .includes(new ArrayList<>())
                .namespaces(new LinkedHashMap<>())
                .definitions(new ArrayList<>());
    }

    /**
     * Find a definition by its name.
     */
    public Optional<Definition> findDefinition(String name) {
        return definitions.stream()
                .filter(d -> d.getName().equals(name))
                .findFirst();
    }
}
