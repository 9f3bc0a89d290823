package com.ecosnap.backend.analysis.model;

import java.util.Objects;

/**
 * 單一欄位的值 + 來源（AI 或 heuristic）。AI 回應可以只覆蓋部分欄位。
 */
public record Sourced<T>(T value, SignalSource source) {

    public Sourced {
        Objects.requireNonNull(source, "source");
    }

    public static <T> Sourced<T> ai(T value) {
        return new Sourced<>(value, SignalSource.AI);
    }

    public static <T> Sourced<T> heuristic(T value) {
        return new Sourced<>(value, SignalSource.HEURISTIC);
    }

    public boolean fromAi() {
        return source == SignalSource.AI;
    }
}
