package com.citygml.resolver.frequency;

import java.util.ArrayList;
import java.util.List;

import com.citygml.resolver.codelist.CodeDictionary;

/**
 * Decodes raw field values into labels.
 *
 * <ul>
 *   <li>{@code "401"} -> meaning of 401, or "401" when the code is unknown</li>
 *   <li>{@code "[401, 402]"} -> group of the decoded elements</li>
 *   <li>{@code "[[1, 2], 3]"} -> nested group</li>
 * </ul>
 * Values with unbalanced brackets are treated as one opaque code.
 */
public class BracketValueDecoder {

    public Label decode(CodeDictionary dictionary, String raw) {
        String value = raw == null ? "" : raw.trim();

        if (isBracketList(value)) {
            List<Label> members = new ArrayList<>();
            for (String element : splitTopLevel(value.substring(1, value.length() - 1))) {
                members.add(decode(dictionary, element));
            }
            return new GroupLabel(members);
        }
        return new ScalarLabel(dictionary.lookup(value).orElse(value));
    }

    static boolean isBracketList(String value) {
        return value.length() >= 2
                && value.charAt(0) == '['
                && value.charAt(value.length() - 1) == ']'
                && isBalanced(value);
    }

    /**
     * Brackets balance and the outer pair encloses the whole value:
     * {@code "[1], [2]"} starts and ends with brackets but is not one list.
     */
    static boolean isBalanced(String value) {
        int depth = 0;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '[') {
                depth++;
            } else if (c == ']') {
                depth--;
                if (depth < 0) {
                    return false;
                }
                if (depth == 0 && i != value.length() - 1) {
                    return false;
                }
            }
        }
        return depth == 0;
    }

    /**
     * Split on commas that are not nested inside brackets. An empty interior
     * yields a single empty element.
     */
    static List<String> splitTopLevel(String interior) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < interior.length(); i++) {
            char c = interior.charAt(i);
            if (c == '[') {
                depth++;
            } else if (c == ']') {
                depth--;
            } else if (c == ',' && depth == 0) {
                parts.add(interior.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(interior.substring(start));
        return parts;
    }
}
