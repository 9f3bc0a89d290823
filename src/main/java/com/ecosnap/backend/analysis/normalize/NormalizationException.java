package com.ecosnap.backend.analysis.normalize;

import lombok.Getter;

/**
 * 唯一會傳到引擎呼叫端的錯誤：原始資料缺少商品名稱。
 */
@Getter
public class NormalizationException extends RuntimeException {

    public static final String PRODUCT_NAME_REQUIRED = "PRODUCT_NAME_REQUIRED";

    private final String code;

    public NormalizationException(String code, String message) {
        super(message);
        this.code = code;
    }

    public static NormalizationException productNameRequired() {
        return new NormalizationException(PRODUCT_NAME_REQUIRED, "product name is required");
    }
}
