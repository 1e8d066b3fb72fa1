package com.edgechat.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AppConfigLoaderTest {
    @TempDir
    Path tempDir;

    @Test
    void shouldLoadRuntimeAndModelsFromYaml() throws Exception {
        Path configPath = tempDir.resolve("application.yml");
        Files.writeString(configPath, """
                runtime:
                  timeoutMs: 5000
                  modelsDir: /sdcard/models
                  genieLibrary: chatapp
                  defaults:
                    topK: 16
                    accelerator: CPU
                  unknownSetting: true
                models:
                  - name: Gemma
                    downloadFileName: gemma.task
                    llmSupportImage: true
                    configValues:
                      temperature: 0.6
                  - name: Phi Genie
                    version: "2"
                    genieModelDir: phi_bundle
                    configValues:
                      accelerator: Genie
                """);

        AppConfig config = new AppConfigLoader().load(configPath);

        assertEquals(5000, config.getRuntime().getTimeoutMs());
        assertEquals("/sdcard/models", config.getRuntime().getModelsDir());
        assertEquals("chatapp", config.getRuntime().getGenieLibrary());
        assertEquals(16, config.getRuntime().getDefaults().getTopK());
        assertEquals(1024, config.getRuntime().getDefaults().getMaxTokens());
        assertEquals("CPU", config.getRuntime().getDefaults().getAccelerator());
        assertEquals(2, config.getModels().size());
        AppConfig.ModelConfig gemma = config.getModels().get(0);
        assertEquals("1", gemma.getVersion());
        assertTrue(gemma.isLlmSupportImage());
        assertEquals(0.6, gemma.getConfigValues().get("temperature"));
        AppConfig.ModelConfig phi = config.getModels().get(1);
        assertEquals("phi_bundle", phi.getGenieModelDir());
        assertEquals("htp_backend_ext_config.json", phi.getGenieHtpConfig());
        assertFalse(phi.isLlmSupportImage());
    }

    @Test
    void shouldReturnDefaultsWhenFileIsMissing() throws Exception {
        AppConfig config = new AppConfigLoader().load(tempDir.resolve("missing.yml"));

        assertEquals("models", config.getRuntime().getModelsDir());
        assertTrue(config.getModels().isEmpty());
    }

    @Test
    void shouldLoadBundledApplicationConfig() throws Exception {
        AppConfig config = new AppConfigLoader().load(Path.of("src/main/resources/application.yml"));

        ModelCatalog catalog = ModelCatalog.fromConfig(config);
        assertEquals(3, catalog.names().size());
        assertTrue(catalog.find("Llama-3.2-3B-Genie").isPresent());
    }
}
