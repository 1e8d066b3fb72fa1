package com.edgechat.inference.genie;

@FunctionalInterface
public interface GenieEngineFactory {
    GenieEngine create(String modelDirPath, String htpConfigPath);

    static GenieEngineFactory jni(String libraryName) {
        return (modelDirPath, htpConfigPath) ->
                new GenieEngine(modelDirPath, htpConfigPath, new JniGenieBindings(libraryName));
    }
}
