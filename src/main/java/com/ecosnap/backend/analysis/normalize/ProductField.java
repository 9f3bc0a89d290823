package com.ecosnap.backend.analysis.normalize;

import java.util.List;

/**
 * 正規欄位 + 別名。別名都是 canonical 形式（小寫、去掉分隔符），
 * 例如 originCountry / origin_country / Origin-Country 都會變成 "origincountry"。
 * 別名順序就是同一筆資料出現多個別名時的優先序。
 */
public enum ProductField {
    PRODUCT_NAME("productname", "name", "product", "title", "itemname"),
    BRAND("brand", "brandname", "brands", "manufacturer"),
    CATEGORY("category", "productcategory", "categories", "type"),
    INGREDIENTS("ingredients", "ingredientlist", "ingredientstext"),
    CERTIFICATIONS("certifications", "certification", "certs", "labels", "ecolabels"),
    PACKAGING("packaging", "packagingtype", "packagingdescription", "packagingmaterial", "package"),
    ORIGIN("origincountry", "countryoforigin", "origin", "country", "madein", "manufacturingplace"),
    MATERIALS("materials", "material", "composition"),
    NUTRITION("nutritionfacts", "nutrition", "nutriments", "nutritioninfo"),

    ORGANIC("organic", "isorganic"),
    FAIR_TRADE("fairtrade", "isfairtrade"),
    LOCALLY_SOURCED("locallysourced", "islocallysourced", "locallyproduced", "local"),
    CARBON_NEUTRAL("carbonneutral", "iscarbonneutral"),

    // ===== nutrition（巢狀或頂層都可以）=====
    CALORIES("calories", "kcal", "energykcal", "caloriesperserving"),
    PROTEIN("proteing", "protein", "proteins"),
    CARBS("carbsg", "carbs", "carbohydratesg", "carbohydrates", "carbohydrate"),
    FAT("fatg", "fat", "totalfat"),
    FIBER("fiberg", "fiber", "fibre", "dietaryfiber"),
    SUGAR("sugarg", "sugar", "sugars", "totalsugars"),
    SODIUM_MG("sodiummg", "sodium"),
    SODIUM_G("sodiumg"),
    SALT_G("saltg", "salt"),
    SERVING_SIZE("servingsize", "serving", "portion");

    private final List<String> aliases;

    ProductField(String... aliases) {
        this.aliases = List.of(aliases);
    }

    public List<String> aliases() {
        return aliases;
    }

    public boolean objectValued() {
        return this == NUTRITION;
    }
}
