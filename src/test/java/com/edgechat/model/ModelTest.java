package com.edgechat.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Map;

import org.junit.jupiter.api.Test;

class ModelTest {

    @Test
    void shouldConvertConfigValuesToRequestedType() {
        Model model = model("Gemma", false, Map.of(
                ConfigKey.MAX_TOKENS, 512.0,
                ConfigKey.TOPK, "32",
                ConfigKey.TOPP, 1,
                ConfigKey.TEMPERATURE, "0.25"));

        assertEquals(512, model.getIntConfigValue(ConfigKey.MAX_TOKENS, 1));
        assertEquals(32, model.getIntConfigValue(ConfigKey.TOPK, 1));
        assertEquals(1.0f, model.getFloatConfigValue(ConfigKey.TOPP, 0.5f));
        assertEquals(0.25f, model.getFloatConfigValue(ConfigKey.TEMPERATURE, 1.0f));
    }

    @Test
    void shouldFallBackToDefaultForMissingOrUnparseableValues() {
        Model model = model("Gemma", false, Map.of(ConfigKey.TOPK, "many"));

        assertEquals(40, model.getIntConfigValue(ConfigKey.TOPK, 40));
        assertEquals(0.9f, model.getFloatConfigValue(ConfigKey.TOPP, 0.9f));
        assertEquals("GPU", model.getStringConfigValue(ConfigKey.ACCELERATOR, "GPU"));
    }

    @Test
    void setConfigValueShouldOverrideAndClear() {
        Model model = model("Gemma", false, Map.of(ConfigKey.ACCELERATOR, "GPU"));

        model.setConfigValue(ConfigKey.ACCELERATOR, "CPU");
        assertEquals("CPU", model.getStringConfigValue(ConfigKey.ACCELERATOR, "GPU"));

        model.setConfigValue(ConfigKey.ACCELERATOR, null);
        assertEquals("GPU", model.getStringConfigValue(ConfigKey.ACCELERATOR, "GPU"));
    }

    @Test
    void shouldResolveDownloadedModelUnderNormalizedNameAndVersion() {
        Model model = new Model("Gemma 3n/E2B", "20250520", "gemma.task", false, false, "bundle", "htp.json", Map.of());

        assertEquals(Path.of("/models/Gemma_3n_E2B/20250520/gemma.task"), model.getPath(Path.of("/models")));
        assertEquals(Path.of("/models/Gemma_3n_E2B/20250520/bundle"), model.getPath(Path.of("/models"), "bundle"));
    }

    @Test
    void shouldResolveImportedModelDirectlyUnderModelsDir() {
        Model model = new Model("mine", null, "mine.task", true, false, "bundle", "htp.json", Map.of());

        assertEquals(Model.DEFAULT_VERSION, model.getVersion());
        assertEquals(Path.of("/models/mine.task"), model.getPath(Path.of("/models")));
    }

    @Test
    void shouldRejectPathWithoutFileName() {
        Model model = model("Genie only", false, Map.of());

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> model.getPath(Path.of("/models")));
        assertTrue(ex.getMessage().contains("Genie only"));
    }

    @Test
    void shouldLookUpEnumsLeniently() {
        assertEquals(ConfigKey.TOPK, ConfigKey.fromId(" topk ").orElseThrow());
        assertTrue(ConfigKey.fromId("seed").isEmpty());
        assertEquals(Accelerator.GENIE, Accelerator.fromLabel("genie").orElseThrow());
        assertTrue(Accelerator.fromLabel(null).isEmpty());
    }

    private static Model model(String name, boolean supportImage, Map<ConfigKey, Object> values) {
        return new Model(name, "1", null, false, supportImage, "bundle", "htp.json", values);
    }
}
