package com.idl.compiler.util;

/**
 * Utility for deriving module names from IDL file paths.
 */
public class NamingUtil {

    private NamingUtil() {
        // Utility class
    }

    /**
     * {@code "common/shared.thrift"} becomes {@code "shared"}.
     */
    public static String moduleName(String path) {
        if (path == null || path.isBlank()) {
            return "main";
        }
        String name = path;
        int lastSlash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (lastSlash >= 0) {
            name = name.substring(lastSlash + 1);
        }
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        return name;
    }
}
