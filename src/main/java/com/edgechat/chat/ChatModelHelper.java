package com.edgechat.chat;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.edgechat.inference.CleanUpListener;
import com.edgechat.inference.ResultListener;
import com.edgechat.inference.genie.GenieEngine;
import com.edgechat.inference.genie.GenieEngineFactory;
import com.edgechat.inference.genie.StringCallback;
import com.edgechat.inference.task.EngineOptions;
import com.edgechat.inference.task.LlmEngine;
import com.edgechat.inference.task.LlmSession;
import com.edgechat.inference.task.LlmTaskRuntime;
import com.edgechat.inference.task.PreferredBackend;
import com.edgechat.inference.task.SessionOptions;
import com.edgechat.inference.task.TaskErrorMessages;
import com.edgechat.model.Accelerator;
import com.edgechat.model.ConfigKey;
import com.edgechat.model.GenieModelInstance;
import com.edgechat.model.InferenceDefaults;
import com.edgechat.model.Model;
import com.edgechat.model.ModelInstance;
import com.edgechat.model.TaskModelInstance;

/**
 * Creates, resets, runs and releases the backend attached to a {@link Model}.
 *
 * <p>Models whose accelerator is {@code Genie} run on the native Genie engine; every other model
 * runs on the LLM task runtime. Failures never escape as exceptions: they reach the caller through
 * the {@code onDone} or {@link ResultListener} callbacks.
 */
public class ChatModelHelper {
    private static final Logger log = LoggerFactory.getLogger(ChatModelHelper.class);

    static final String NOT_INITIALIZED_MESSAGE = "Error: Model not initialized or already cleaned up.";
    static final String NULL_SESSION_MESSAGE = "Error: LLM task session is null.";

    private final Path modelsDir;
    private final InferenceDefaults defaults;
    private final LlmTaskRuntime taskRuntime;
    private final GenieEngineFactory genieEngineFactory;
    // Indexed by model name.
    private final Map<String, CleanUpListener> cleanUpListeners = new ConcurrentHashMap<>();

    public ChatModelHelper(
            Path modelsDir,
            InferenceDefaults defaults,
            LlmTaskRuntime taskRuntime,
            GenieEngineFactory genieEngineFactory) {
        this.modelsDir = Objects.requireNonNull(modelsDir, "modelsDir");
        this.defaults = Objects.requireNonNull(defaults, "defaults");
        this.taskRuntime = Objects.requireNonNull(taskRuntime, "taskRuntime");
        this.genieEngineFactory = Objects.requireNonNull(genieEngineFactory, "genieEngineFactory");
    }

    /**
     * Builds the backend for {@code model} and stores it as the model's instance. A backend already
     * attached to the model is released first, so a failed re-initialization leaves no instance.
     *
     * @param onDone called exactly once, with an empty string on success or a readable error
     */
    public void initialize(Model model, Consumer<String> onDone) {
        String accelerator = model.getStringConfigValue(ConfigKey.ACCELERATOR, defaults.accelerator());
        log.debug("Initializing model '{}' for accelerator {}", model.getName(), accelerator);
        if (model.getInstance() != null) {
            log.info("Model '{}' is already initialized; releasing the previous instance", model.getName());
            cleanUp(model);
        }

        if (Accelerator.GENIE.label().equalsIgnoreCase(accelerator)) {
            try {
                String modelDir = model.getPath(modelsDir, model.getGenieModelDir()).toString();
                String htpConfig = model.getPath(modelsDir, model.getGenieHtpConfig()).toString();
                log.debug("Loading Genie model from {} with HTP config {}", modelDir, htpConfig);
                GenieEngine engine = genieEngineFactory.create(modelDir, htpConfig);
                model.setInstance(new GenieModelInstance(engine));
                log.info("Genie engine initialized for model '{}'", model.getName());
            } catch (RuntimeException e) {
                log.error("Failed to initialize Genie engine for model '{}': {}", model.getName(), e.getMessage(), e);
                onDone.accept("Failed to load Genie model: " + e.getMessage());
                return;
            }
        } else {
            int maxTokens = model.getIntConfigValue(ConfigKey.MAX_TOKENS, defaults.maxTokens());
            PreferredBackend preferredBackend = preferredBackend(accelerator);
            LlmEngine engine = null;
            try {
                EngineOptions engineOptions = EngineOptions.builder()
                        .setModelPath(model.getPath(modelsDir).toString())
                        .setMaxTokens(maxTokens)
                        .setPreferredBackend(preferredBackend)
                        .setMaxNumImages(model.isLlmSupportImage() ? 1 : 0)
                        .build();
                engine = taskRuntime.createEngine(engineOptions);
                LlmSession session = taskRuntime.createSession(engine, sessionOptions(model));
                model.setInstance(new TaskModelInstance(engine, session));
                log.info("LLM task runtime {} initialized for model '{}' on {}",
                        taskRuntime.name(),
                        model.getName(),
                        preferredBackend);
            } catch (RuntimeException e) {
                log.error("Failed to initialize LLM task runtime for model '{}': {}", model.getName(), e.getMessage(), e);
                closeQuietly(engine);
                onDone.accept(TaskErrorMessages.cleanUp(e.getMessage()));
                return;
            }
        }
        onDone.accept("");
    }

    /**
     * Replaces the task-runtime session of {@code model} with a fresh one using the model's current
     * sampling values.
     */
    public void resetSession(Model model) {
        log.debug("Resetting session for model '{}'", model.getName());
        ModelInstance instance = model.getInstance();
        if (instance == null) {
            return;
        }

        if (instance instanceof TaskModelInstance taskInstance) {
            LlmSession previous = taskInstance.session();
            taskInstance.replaceSession(null);
            if (previous != null) {
                try {
                    previous.close();
                } catch (RuntimeException e) {
                    log.warn("Failed to close previous session for model '{}'", model.getName(), e);
                }
            }
            try {
                taskInstance.replaceSession(taskRuntime.createSession(taskInstance.engine(), sessionOptions(model)));
                log.debug("LLM task session reset for model '{}'", model.getName());
            } catch (RuntimeException e) {
                log.error("Failed to create a new session for model '{}': {}", model.getName(), e.getMessage(), e);
            }
        } else if (instance instanceof GenieModelInstance) {
            log.info("Resetting session is not applicable for the Genie engine. Model: {}", model.getName());
        }
    }

    /**
     * Releases the backend of {@code model}, then invokes and drops the pending cleanup listener.
     * Safe to call more than once.
     */
    public void cleanUp(Model model) {
        ModelInstance instance = model.getInstance();
        if (instance == null) {
            return;
        }
        log.debug("Cleaning up model '{}' with instance type {}", model.getName(), instance.getClass().getSimpleName());

        try {
            if (instance instanceof TaskModelInstance taskInstance) {
                LlmSession session = taskInstance.session();
                try {
                    if (session != null) {
                        session.close();
                    }
                } finally {
                    taskInstance.engine().close();
                }
            } else if (instance instanceof GenieModelInstance genieInstance) {
                genieInstance.engine().close();
            }
        } catch (RuntimeException e) {
            log.error("Error during cleanUp for model '{}': {}", model.getName(), e.getMessage(), e);
        } finally {
            CleanUpListener onCleanUp = cleanUpListeners.remove(model.getName());
            model.setInstance(null);
            if (onCleanUp != null) {
                onCleanUp.onCleanUp();
            }
            log.debug("Clean up finished for model '{}'", model.getName());
        }
    }

    public void runInference(
            Model model,
            String input,
            ResultListener resultListener,
            CleanUpListener cleanUpListener) {
        runInference(model, input, resultListener, cleanUpListener, null);
    }

    /**
     * Submits {@code input} (and optionally {@code image}) to the model's backend. The answer streams
     * to {@code resultListener}, which sees exactly one invocation with {@code done == true}.
     */
    public void runInference(
            Model model,
            String input,
            ResultListener resultListener,
            CleanUpListener cleanUpListener,
            BufferedImage image) {
        ModelInstance instance = model.getInstance();
        if (instance == null) {
            log.error("Model instance is null for '{}'. Cannot run inference.", model.getName());
            resultListener.onResult(NOT_INITIALIZED_MESSAGE, true);
            return;
        }

        if (cleanUpListener != null) {
            cleanUpListeners.putIfAbsent(model.getName(), cleanUpListener);
        }

        if (instance instanceof TaskModelInstance taskInstance) {
            runOnTaskRuntime(model, taskInstance, input, image, resultListener);
        } else if (instance instanceof GenieModelInstance genieInstance) {
            runOnGenie(model, genieInstance.engine(), input, image, resultListener);
        }
    }

    boolean hasPendingCleanUpListener(String modelName) {
        return cleanUpListeners.containsKey(modelName);
    }

    private void runOnTaskRuntime(
            Model model,
            TaskModelInstance instance,
            String input,
            BufferedImage image,
            ResultListener resultListener) {
        LlmSession session = instance.session();
        if (session == null) {
            resultListener.onResult(NULL_SESSION_MESSAGE, true);
            return;
        }
        try {
            // The text chunk goes in before the image for vision models.
            session.addQueryChunk(input);
            if (image != null && model.isLlmSupportImage()) {
                session.addImage(image);
            } else if (image != null) {
                log.warn("Model '{}' does not support images; image ignored", model.getName());
            }
            session.generateResponseAsync(resultListener);
            log.debug("Generation submitted to LLM task runtime for model '{}'", model.getName());
        } catch (RuntimeException e) {
            log.error("LLM task runtime rejected the request for model '{}': {}", model.getName(), e.getMessage(), e);
            resultListener.onResult("Error: " + TaskErrorMessages.cleanUp(e.getMessage()), true);
        }
    }

    private void runOnGenie(
            Model model,
            GenieEngine engine,
            String input,
            BufferedImage image,
            ResultListener resultListener) {
        if (image != null) {
            log.warn("Genie engine does not support image input; image ignored for model '{}'", model.getName());
        }
        StringCallback callback = new GenieCallbackAdapter(model.getName(), resultListener);
        try {
            engine.getResponseForPrompt(input, callback);
            log.debug("Generation submitted to Genie engine for model '{}'", model.getName());
        } catch (RuntimeException e) {
            log.error("Genie engine rejected the request for model '{}'", model.getName(), e);
            callback.onError(e.getMessage() != null ? e.getMessage() : e.toString());
        }
    }

    private SessionOptions sessionOptions(Model model) {
        return SessionOptions.builder()
                .setTopK(model.getIntConfigValue(ConfigKey.TOPK, defaults.topK()))
                .setTopP(model.getFloatConfigValue(ConfigKey.TOPP, defaults.topP()))
                .setTemperature(model.getFloatConfigValue(ConfigKey.TEMPERATURE, defaults.temperature()))
                .setEnableVisionModality(model.isLlmSupportImage())
                .build();
    }

    static PreferredBackend preferredBackend(String accelerator) {
        return Accelerator.fromLabel(accelerator)
                .filter(value -> value == Accelerator.CPU)
                .map(value -> PreferredBackend.CPU)
                .orElse(PreferredBackend.GPU);
    }

    private static void closeQuietly(LlmEngine engine) {
        if (engine == null) {
            return;
        }
        try {
            engine.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close partially initialized engine", e);
        }
    }

    /**
     * Maps the three-callback shape of the native engine onto a {@link ResultListener}. Only the
     * first terminal signal is forwarded.
     */
    static final class GenieCallbackAdapter implements StringCallback {
        private final String modelName;
        private final ResultListener resultListener;
        private final AtomicBoolean finished = new AtomicBoolean();

        GenieCallbackAdapter(String modelName, ResultListener resultListener) {
            this.modelName = modelName;
            this.resultListener = resultListener;
        }

        @Override
        public void onResponse(String token) {
            if (finished.get()) {
                log.debug("Dropping Genie token after completion for model '{}'", modelName);
                return;
            }
            resultListener.onResult(token, false);
        }

        @Override
        public void onError(String errorMessage) {
            log.error("Genie error for model '{}': {}", modelName, errorMessage);
            if (finished.compareAndSet(false, true)) {
                resultListener.onResult("Error from Genie: " + errorMessage, true);
            }
        }

        @Override
        public void onComplete() {
            if (finished.compareAndSet(false, true)) {
                log.info("Genie inference complete for model '{}'", modelName);
                resultListener.onResult("", true);
            }
        }
    }
}
