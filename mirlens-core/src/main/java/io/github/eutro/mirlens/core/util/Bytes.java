package io.github.eutro.mirlens.core.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for rendering raw allocation bytes.
 */
public final class Bytes {
    private Bytes() {
    }

    /**
     * Drop the uninitialised (null) bytes of an allocation.
     *
     * @param bytes The bytes, with null for uninitialised bytes.
     * @return The initialised bytes, in order.
     */
    public static List<Byte> concrete(List<Byte> bytes) {
        List<Byte> out = new ArrayList<>(bytes.size());
        for (Byte b : bytes) {
            if (b != null) out.add(b);
        }
        return out;
    }

    /**
     * Interpret up to 8 bytes as an unsigned little-endian integer.
     *
     * @param bytes The bytes, least significant first.
     * @return The value, formatted as an unsigned decimal.
     */
    public static String unsignedLittleEndian(List<Byte> bytes) {
        if (bytes.size() > 8) throw new IllegalArgumentException("too many bytes: " + bytes.size());
        long acc = 0;
        for (int i = 0; i < bytes.size(); i++) {
            acc |= (bytes.get(i) & 0xFFL) << (i * 8);
        }
        return Long.toUnsignedString(acc);
    }

    public static boolean isAscii(List<Byte> bytes) {
        for (byte b : bytes) {
            if (b < 0) return false;
        }
        return true;
    }

    /**
     * Escape ASCII text for display inside double quotes.
     * <p>
     * Tabs, carriage returns, newlines, quotes and backslashes get backslash escapes,
     * other control characters as a braced hex escape.
     *
     * @param s The text.
     * @return The escaped text.
     */
    public static String escape(CharSequence s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\t':
                    sb.append("\\t");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\'':
                    sb.append("\\'");
                    break;
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                default:
                    if (c < 0x20 || c >= 0x7F) {
                        sb.append("\\u{").append(Integer.toHexString(c)).append('}');
                    } else {
                        sb.append(c);
                    }
            }
        }
        return sb.toString();
    }
}
