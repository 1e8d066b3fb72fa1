package com.edgechat.inference.genie;

import java.util.HashSet;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class JniGenieBindings implements GenieBindings {
    private static final Logger log = LoggerFactory.getLogger(JniGenieBindings.class);
    public static final String DEFAULT_LIBRARY = "genie_wrapper";
    private static final Set<String> loadedLibraries = new HashSet<>();

    public JniGenieBindings() {
        this(DEFAULT_LIBRARY);
    }

    public JniGenieBindings(String libraryName) {
        loadLibrary(libraryName);
    }

    static synchronized void loadLibrary(String libraryName) {
        if (loadedLibraries.contains(libraryName)) {
            return;
        }
        try {
            System.loadLibrary(libraryName);
        } catch (UnsatisfiedLinkError e) {
            log.error("Failed to load native library {} from java.library.path={}",
                    libraryName,
                    System.getProperty("java.library.path"));
            throw new GenieException("Native library " + libraryName + " is not available: " + e.getMessage(), e);
        }
        loadedLibraries.add(libraryName);
        log.debug("Loaded native library {}", libraryName);
    }

    @Override
    public native long loadModel(String modelDirPath, String htpConfigPath);

    @Override
    public native void getResponseForPrompt(long nativeHandle, String userInput, StringCallback callback);

    @Override
    public native void freeModel(long nativeHandle);
}
