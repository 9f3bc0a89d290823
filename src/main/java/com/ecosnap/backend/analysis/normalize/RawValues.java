package com.ecosnap.backend.analysis.normalize;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 寬鬆解析上游傳來的值（數字可能是字串、清單可能是逗號字串）。
 */
final class RawValues {

    private RawValues() {}

    // ✅ 只抓非負數字（含小數）："100 g" / "~300" / "約 120"
    private static final Pattern FIRST_NUMBER = Pattern.compile("(\\d+(?:\\.\\d+)?)");

    private static final Pattern GRAMS = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*(g|gram|grams|ml|milliliter|milliliters)\\b");

    private static final Pattern LIST_SPLIT = Pattern.compile("[,;\\n]");

    static String text(Object v) {
        if (v == null || v instanceof Map<?, ?>) return null;
        if (v instanceof Collection<?> c) {
            List<String> parts = stringList(c);
            return parts.isEmpty() ? null : String.join(", ", parts);
        }
        String s = String.valueOf(v).trim().replaceAll("\\s+", " ");
        return s.isEmpty() ? null : s;
    }

    /**
     * 支援：
     * - number: 123.4
     * - string: "123.4" / " 1,234.5 " / "100 g" / "~300" / "1/2" / "null"
     * 負數、NaN、無法解析 → null
     */
    static Double number(Object v) {
        if (v == null) return null;
        if (v instanceof Number n) {
            double d = n.doubleValue();
            return (Double.isFinite(d) && d >= 0.0) ? d : null;
        }
        if (!(v instanceof CharSequence)) return null;

        String t = v.toString().trim().replace(",", "").toLowerCase(Locale.ROOT);
        if (t.isEmpty()) return null;
        if (t.equals("null") || t.equals("n/a") || t.equals("na") || t.equals("unknown")) return null;
        if (t.startsWith("-")) return null;

        int slash = t.indexOf('/');
        if (slash > 0 && slash < t.length() - 1) {
            try {
                double a = Double.parseDouble(t.substring(0, slash).trim());
                double b = Double.parseDouble(t.substring(slash + 1).trim());
                if (b != 0.0) return a / b;
            } catch (NumberFormatException ignored) {
                // "1/2 cup" 之類：往下抓第一個數字
            }
        }

        Matcher m = FIRST_NUMBER.matcher(t);
        if (m.find()) {
            try {
                return Double.parseDouble(m.group(1));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    static boolean bool(Object v) {
        if (v == null) return false;
        if (v instanceof Boolean b) return b;
        if (v instanceof Number n) return n.doubleValue() != 0.0;
        String s = v.toString().trim().toLowerCase(Locale.ROOT);
        return s.equals("true") || s.equals("yes") || s.equals("y") || s.equals("1");
    }

    /** List 或逗號/分號/換行分隔的字串都吃 */
    static List<String> stringList(Object v) {
        List<String> out = new ArrayList<>();
        if (v == null) return out;

        if (v instanceof Collection<?> c) {
            for (Object it : c) {
                if (it == null) continue;
                String s = String.valueOf(it).trim().replaceAll("\\s+", " ");
                if (!s.isEmpty()) out.add(s);
            }
            return out;
        }

        for (String part : LIST_SPLIT.split(String.valueOf(v))) {
            String s = part.trim().replaceAll("\\s+", " ");
            if (!s.isEmpty()) out.add(s);
        }
        return out;
    }

    /** "180 g" / "250ml" → 180 / 250；"1 cup" → null */
    static Double servingGrams(String servingSize) {
        if (servingSize == null) return null;
        Matcher m = GRAMS.matcher(servingSize.toLowerCase(Locale.ROOT));
        if (!m.find()) return null;
        try {
            double g = Double.parseDouble(m.group(1));
            return g > 0 ? g : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
