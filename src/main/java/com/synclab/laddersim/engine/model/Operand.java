package com.synclab.laddersim.engine.model;

import java.util.regex.Pattern;

/**
 * Helpers for operand strings: tag addresses ({@code Tag}, {@code Tag.Member}, {@code Tag[3]})
 * and numeric literals. Operands never carry type information; the owning opcode decides.
 */
public final class Operand {

    /** Separator between an address and the parser's display-only description. */
    public static final char DESCRIPTION_SEPARATOR = '§';

    private static final Pattern LITERAL =
            Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private Operand() {
    }

    public static String strip(String raw) {
        if (raw == null) {
            return "";
        }
        int idx = raw.indexOf(DESCRIPTION_SEPARATOR);
        String address = idx >= 0 ? raw.substring(0, idx) : raw;
        return address.trim();
    }

    public static boolean isLiteral(String operand) {
        return operand != null && LITERAL.matcher(operand.trim()).matches();
    }

    /** Parses a numeric literal, or returns {@code NaN} when the operand is not one. */
    public static double parseLiteral(String operand) {
        if (!isLiteral(operand)) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(operand.trim());
        } catch (NumberFormatException ex) {
            return Double.NaN;
        }
    }

    /** {@code Motor.DN -> Motor}, {@code Arr[2].DN -> Arr}, {@code Arr[2] -> Arr}. */
    public static String baseTag(String address) {
        String tag = strip(address);
        int end = tag.length();
        int dot = tag.indexOf('.');
        if (dot >= 0) {
            end = Math.min(end, dot);
        }
        int bracket = tag.indexOf('[');
        if (bracket >= 0) {
            end = Math.min(end, bracket);
        }
        return tag.substring(0, end);
    }

    /** Everything before the last member separator, or {@code null} when there is no member. */
    public static String parentOf(String address) {
        int dot = address.lastIndexOf('.');
        return dot > 0 ? address.substring(0, dot) : null;
    }

    /** Upper-cased last member, or {@code null} when there is no member. */
    public static String memberOf(String address) {
        int dot = address.lastIndexOf('.');
        if (dot <= 0 || dot == address.length() - 1) {
            return null;
        }
        return address.substring(dot + 1).toUpperCase();
    }

    /**
     * Address of the {@code offset}-th element starting at {@code address}:
     * {@code Arr[2] + 3 -> Arr[5]}, {@code Arr + 3 -> Arr[3]}.
     */
    public static String element(String address, int offset) {
        String tag = strip(address);
        if (tag.endsWith("]")) {
            int open = tag.lastIndexOf('[');
            if (open > 0) {
                try {
                    int start = Integer.parseInt(tag.substring(open + 1, tag.length() - 1).trim());
                    return tag.substring(0, open) + "[" + (start + offset) + "]";
                } catch (NumberFormatException ex) {
                    // indirect index such as Arr[Idx] is not simulated
                    return tag;
                }
            }
        }
        return tag + "[" + offset + "]";
    }

    public static boolean isUnspecified(String operand) {
        String tag = strip(operand);
        return tag.isEmpty() || "?".equals(tag);
    }
}
