package com.gs.ep.pdftranslator.translate;

import com.gs.ep.pdftranslator.config.TranslationConfig;

import java.io.IOException;

/**
 * 根据服务标识创建翻译器实例。
 */
public final class TranslatorRegistry {

    private TranslatorRegistry() {
    }

    public static Translator create(String serviceName, TranslationConfig config) throws IOException {
        return create(TranslationServiceId.fromName(serviceName), config);
    }

    public static Translator create(TranslationServiceId serviceId, TranslationConfig config) throws IOException {
        switch (serviceId) {
            case SILICONFLOW:
            case OPENAI:
                return new ChatCompletionTranslator(config, serviceId);
            case GOOGLE:
            default:
                return new GoogleTranslator(config);
        }
    }
}
