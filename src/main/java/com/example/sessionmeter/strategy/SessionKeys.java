package com.example.sessionmeter.strategy;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Escaping for key components. The delimiters used by session keys and daily usage keys are
 * prefixed with a backslash inside a component, so plain identifiers are left untouched and two
 * different tuples can never produce the same key.
 */
public final class SessionKeys {

    private static final String RESERVED = "\\@-_:";

    private SessionKeys() {
    }

    public static String escape(String component) {
        if (component == null) {
            return "";
        }
        StringBuilder sb = null;
        for (int i = 0; i < component.length(); i++) {
            char c = component.charAt(i);
            if (RESERVED.indexOf(c) >= 0) {
                if (sb == null) {
                    sb = new StringBuilder(component.length() + 4);
                    sb.append(component, 0, i);
                }
                sb.append('\\');
            }
            if (sb != null) {
                sb.append(c);
            }
        }
        return sb == null ? component : sb.toString();
    }

    public static String join(Collection<String> components, String delimiter) {
        return components.stream().map(SessionKeys::escape).collect(Collectors.joining(delimiter));
    }
}
