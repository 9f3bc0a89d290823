package com.ecosnap.backend.analysis.scoring;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 一個關鍵字 → 加減分。只在字首比對（"plastic" 不會命中 "bioplastic"），字尾可以接複數。
 */
record KeywordRule(String keyword, int delta, Pattern pattern) {

    static KeywordRule of(String keyword, int delta) {
        Pattern p = Pattern.compile("(?<![a-z])" + Pattern.quote(keyword.toLowerCase(Locale.ROOT)));
        return new KeywordRule(keyword, delta, p);
    }

    boolean matches(String lowerText) {
        return lowerText != null && pattern.matcher(lowerText).find();
    }

    /** 整個字才算：「india」不會命中 "indiana" */
    static Pattern wordPattern(String word) {
        return Pattern.compile("(?<![a-z])" + Pattern.quote(word.toLowerCase(Locale.ROOT)) + "(?![a-z])");
    }

    /** 跟 {@link #wordPattern} 一樣，但前面接 "non-" / "non " 的否定寫法不算 */
    static Pattern affirmedWordPattern(String word) {
        return Pattern.compile("(?<![a-z])(?<!non-)(?<!non )" + Pattern.quote(word.toLowerCase(Locale.ROOT)) + "(?![a-z])");
    }

    /** 每條規則最多算一次 */
    static int sum(List<KeywordRule> rules, String lowerText) {
        int total = 0;
        for (KeywordRule r : rules) {
            if (r.matches(lowerText)) total += r.delta;
        }
        return total;
    }
}
