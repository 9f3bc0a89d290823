package com.ecosnap.backend.analysis.scoring;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 需要標記的添加物。比對以「每個成分」為單位，一個成分最多算一次。
 */
public final class AdditiveDenylist {

    private AdditiveDenylist() {}

    private static final List<String> TOKENS = List.of(
            "msg",
            "monosodium glutamate",
            "artificial color",
            "artificial colour",
            "artificial flavor",
            "artificial flavour",
            "artificial sweetener",
            "preservative",
            "hydrogenated",
            "high fructose corn syrup",
            "sodium nitrite",
            "sodium benzoate",
            "potassium bromate",
            "tbhq",
            "butylated hydroxy",
            "aspartame",
            "red 40",
            "yellow 5",
            "yellow 6",
            "carrageenan"
    );

    private static final List<Pattern> PATTERNS = new ArrayList<>();

    static {
        for (String t : TOKENS) {
            PATTERNS.add(Pattern.compile("(?<![a-z])" + Pattern.quote(t)));
        }
    }

    /** 回傳被標記的成分（原字串，保持順序） */
    public static List<String> flagged(List<String> ingredients) {
        List<String> out = new ArrayList<>();
        if (ingredients == null) return out;
        for (String ing : ingredients) {
            if (ing == null) continue;
            String lower = ing.toLowerCase(Locale.ROOT);
            for (Pattern p : PATTERNS) {
                if (p.matcher(lower).find()) {
                    out.add(ing);
                    break;
                }
            }
        }
        return out;
    }
}
