package com.gs.ep.pdftranslator.translate;

import com.gs.ep.pdftranslator.config.TranslationConfig;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class TranslatorRegistryTest {

    private final TranslationConfig config = new TranslationConfig(new Properties());

    @Test
    void create_withGoogle_shouldReturnGoogleTranslator() throws IOException {
        assertTrue(TranslatorRegistry.create("google", config) instanceof GoogleTranslator);
    }

    @Test
    void create_withChatServices_shouldUseServiceNameAsEngine() throws IOException {
        Translator siliconflow = TranslatorRegistry.create("SiliconFlow", config);
        Translator openai = TranslatorRegistry.create("openai", config);

        assertTrue(siliconflow instanceof ChatCompletionTranslator);
        assertEquals("siliconflow", siliconflow.getName());
        assertEquals("openai", openai.getName());
    }

    @Test
    void create_withUnknownService_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> TranslatorRegistry.create("babelfish", config));
    }
}
