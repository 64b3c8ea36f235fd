package io.conductor.core.model;

public record Usage(int promptTokens, int completionTokens, int totalTokens) {

    public static Usage empty() {
        return new Usage(0, 0, 0);
    }

    public static Usage of(int promptTokens, int completionTokens) {
        return new Usage(promptTokens, completionTokens, promptTokens + completionTokens);
    }

    public boolean isEmpty() {
        return promptTokens == 0 && completionTokens == 0 && totalTokens == 0;
    }
}
