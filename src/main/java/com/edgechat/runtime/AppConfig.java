package com.edgechat.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.edgechat.inference.genie.JniGenieBindings;
import com.edgechat.model.InferenceDefaults;
import com.edgechat.model.Model;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private RuntimeConfig runtime = new RuntimeConfig();
    private List<ModelConfig> models = new ArrayList<>();

    public RuntimeConfig getRuntime() {
        return runtime;
    }

    public void setRuntime(RuntimeConfig runtime) {
        this.runtime = runtime == null ? new RuntimeConfig() : runtime;
    }

    public List<ModelConfig> getModels() {
        return models;
    }

    public void setModels(List<ModelConfig> models) {
        this.models = models == null ? new ArrayList<>() : models;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RuntimeConfig {
        private int timeoutMs = 120000;
        private String modelsDir = "models";
        private String genieLibrary = JniGenieBindings.DEFAULT_LIBRARY;
        private DefaultsConfig defaults = new DefaultsConfig();

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public String getModelsDir() {
            return modelsDir;
        }

        public void setModelsDir(String modelsDir) {
            this.modelsDir = modelsDir;
        }

        public String getGenieLibrary() {
            return genieLibrary;
        }

        public void setGenieLibrary(String genieLibrary) {
            this.genieLibrary = genieLibrary;
        }

        public DefaultsConfig getDefaults() {
            return defaults;
        }

        public void setDefaults(DefaultsConfig defaults) {
            this.defaults = defaults == null ? new DefaultsConfig() : defaults;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DefaultsConfig {
        private int maxTokens = InferenceDefaults.DEFAULT_MAX_TOKEN;
        private int topK = InferenceDefaults.DEFAULT_TOPK;
        private float topP = InferenceDefaults.DEFAULT_TOPP;
        private float temperature = InferenceDefaults.DEFAULT_TEMPERATURE;
        private String accelerator = InferenceDefaults.standard().accelerator();

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public int getTopK() {
            return topK;
        }

        public void setTopK(int topK) {
            this.topK = topK;
        }

        public float getTopP() {
            return topP;
        }

        public void setTopP(float topP) {
            this.topP = topP;
        }

        public float getTemperature() {
            return temperature;
        }

        public void setTemperature(float temperature) {
            this.temperature = temperature;
        }

        public String getAccelerator() {
            return accelerator;
        }

        public void setAccelerator(String accelerator) {
            this.accelerator = accelerator;
        }

        public InferenceDefaults toInferenceDefaults() {
            return new InferenceDefaults(maxTokens, topK, topP, temperature, accelerator);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ModelConfig {
        private String name;
        private String version = Model.DEFAULT_VERSION;
        private String downloadFileName;
        private boolean imported;
        private boolean llmSupportImage;
        private String genieModelDir = "genie_bundle";
        private String genieHtpConfig = "htp_backend_ext_config.json";
        private Map<String, Object> configValues = new LinkedHashMap<>();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getVersion() {
            return version;
        }

        public void setVersion(String version) {
            this.version = version;
        }

        public String getDownloadFileName() {
            return downloadFileName;
        }

        public void setDownloadFileName(String downloadFileName) {
            this.downloadFileName = downloadFileName;
        }

        public boolean isImported() {
            return imported;
        }

        public void setImported(boolean imported) {
            this.imported = imported;
        }

        public boolean isLlmSupportImage() {
            return llmSupportImage;
        }

        public void setLlmSupportImage(boolean llmSupportImage) {
            this.llmSupportImage = llmSupportImage;
        }

        public String getGenieModelDir() {
            return genieModelDir;
        }

        public void setGenieModelDir(String genieModelDir) {
            this.genieModelDir = genieModelDir;
        }

        public String getGenieHtpConfig() {
            return genieHtpConfig;
        }

        public void setGenieHtpConfig(String genieHtpConfig) {
            this.genieHtpConfig = genieHtpConfig;
        }

        public Map<String, Object> getConfigValues() {
            return configValues;
        }

        public void setConfigValues(Map<String, Object> configValues) {
            this.configValues = configValues == null ? new LinkedHashMap<>() : configValues;
        }
    }
}
