package com.gs.ep.pdftranslator.translate;

/**
 * Translation backends that can be selected by name.
 */
public enum TranslationServiceId {

    GOOGLE("google"),

    /**
     * SiliconFlow chat completions (OpenAI compatible).
     */
    SILICONFLOW("siliconflow"),

    OPENAI("openai");

    private final String serviceName;

    TranslationServiceId(String serviceName) {
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }

    public static TranslationServiceId fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase();
            for (TranslationServiceId id : values()) {
                if (id.serviceName.equals(normalized)) {
                    return id;
                }
            }
        }
        throw new IllegalArgumentException("Unknown translation service: " + name);
    }

    @Override
    public String toString() {
        return serviceName;
    }
}
