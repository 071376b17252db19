package com.idl.compiler.compile;

import com.idl.compiler.compile.exception.DuplicateNameException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tracks the names claimed within one namespace, remembering where each was first used.
 */
public class Namespace {

    private final Map<String, Integer> lines = new LinkedHashMap<>();

    /**
     * Claim a name; the first occurrence wins.
     *
     * @throws DuplicateNameException if the name was already claimed
     */
    public void claim(String name, int line) {
        Integer original = lines.putIfAbsent(name, line);
        if (original != null) {
            throw new DuplicateNameException(name, original);
        }
    }

    public boolean contains(String name) {
        return lines.containsKey(name);
    }
}
