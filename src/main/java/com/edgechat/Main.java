package com.edgechat;

import java.awt.image.BufferedImage;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.edgechat.chat.ChatModelHelper;
import com.edgechat.chat.StreamingResponseCollector;
import com.edgechat.inference.genie.GenieEngineFactory;
import com.edgechat.inference.task.LlmTaskRuntime;
import com.edgechat.inference.task.LlmTaskRuntimes;
import com.edgechat.model.ConfigKey;
import com.edgechat.model.Model;
import com.edgechat.runtime.AppConfig;
import com.edgechat.runtime.AppConfigLoader;
import com.edgechat.runtime.ModelCatalog;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "edge-chat",
        mixinStandardHelpOptions = true,
        version = "edge-chat 0.1.0",
        description = "Chat with on-device LLMs through the LLM task runtime or the Genie native engine.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE_ERROR = 2;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    Path configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "chat")
    Mode mode;

    @Option(names = { "-m", "--model" }, description = "Model name from the config")
    String modelName;

    @Option(names = "--prompt", description = "Prompt text for prompt mode")
    String prompt;

    @Option(names = "--image", description = "Image attached to the prompt (vision models only)")
    Path imagePath;

    @Option(names = "--accelerator", description = "Overrides the model accelerator (CPU, GPU, Genie)")
    String accelerator;

    private final LlmTaskRuntime taskRuntime;
    private final GenieEngineFactory genieEngineFactory;
    private final InputStream input;
    private final PrintStream out;
    private int timeoutMs;

    enum Mode {
        list,
        prompt,
        chat
    }

    public Main() {
        this(LlmTaskRuntimes.load(), null, System.in, System.out);
    }

    Main(LlmTaskRuntime taskRuntime, GenieEngineFactory genieEngineFactory, InputStream input, PrintStream out) {
        this.taskRuntime = taskRuntime;
        this.genieEngineFactory = genieEngineFactory;
        this.input = input;
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = new AppConfigLoader().load(configPath);
        ModelCatalog catalog = ModelCatalog.fromConfig(config);
        timeoutMs = config.getRuntime().getTimeoutMs();

        log.info("Starting edge-chat in {} mode", mode);
        log.info("Using config file: {}", configPath);

        if (mode == Mode.list) {
            listModels(catalog, config);
            return EXIT_OK;
        }

        if (modelName == null || modelName.isBlank()) {
            log.error("--model is required in {} mode; known models: {}", mode, catalog.names());
            return EXIT_USAGE_ERROR;
        }
        Optional<Model> found = catalog.find(modelName);
        if (found.isEmpty()) {
            log.error("Unknown model {}; known models: {}", modelName, catalog.names());
            return EXIT_USAGE_ERROR;
        }
        Model model = found.get();
        if (accelerator != null && !accelerator.isBlank()) {
            model.setConfigValue(ConfigKey.ACCELERATOR, accelerator);
        }
        if (mode == Mode.prompt && (prompt == null || prompt.isBlank())) {
            log.error("--prompt is required in prompt mode");
            return EXIT_USAGE_ERROR;
        }
        BufferedImage image = null;
        if (imagePath != null) {
            image = readImage(imagePath);
            if (image == null) {
                return EXIT_USAGE_ERROR;
            }
        }

        ChatModelHelper helper = createHelper(config);
        AtomicReference<String> initError = new AtomicReference<>("");
        helper.initialize(model, initError::set);
        if (!initError.get().isEmpty()) {
            log.error("Model {} failed to initialize: {}", model.getName(), initError.get());
            out.println(initError.get());
            return EXIT_FAILURE;
        }

        try {
            if (mode == Mode.prompt) {
                return runTurn(helper, model, prompt, image) ? EXIT_OK : EXIT_FAILURE;
            }
            return runChat(helper, model, image);
        } finally {
            helper.cleanUp(model);
        }
    }

    ChatModelHelper createHelper(AppConfig config) {
        AppConfig.RuntimeConfig runtime = config.getRuntime();
        GenieEngineFactory factory = genieEngineFactory != null
                ? genieEngineFactory
                : GenieEngineFactory.jni(runtime.getGenieLibrary());
        return new ChatModelHelper(
                Path.of(runtime.getModelsDir()),
                runtime.getDefaults().toInferenceDefaults(),
                taskRuntime,
                factory);
    }

    private void listModels(ModelCatalog catalog, AppConfig config) {
        String defaultAccelerator = config.getRuntime().getDefaults().getAccelerator();
        for (Model model : catalog.models()) {
            String modelAccelerator = model.getStringConfigValue(ConfigKey.ACCELERATOR, defaultAccelerator);
            out.printf("%s\taccelerator=%s\timage=%s%n", model.getName(), modelAccelerator, model.isLlmSupportImage());
        }
        log.info("Listed {} models", catalog.names().size());
    }

    private int runChat(ChatModelHelper helper, Model model, BufferedImage initialImage) throws IOException, InterruptedException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
        BufferedImage pendingImage = initialImage;

        out.println("edge-chat ready with " + model.getName() + ". Type /help for commands.");
        while (true) {
            out.print("you> ");
            out.flush();
            String line = reader.readLine();
            if (line == null) {
                return EXIT_OK;
            }
            String promptInput = line.trim();
            if (promptInput.isEmpty()) {
                continue;
            }
            if ("/exit".equals(promptInput) || "/quit".equals(promptInput)) {
                return EXIT_OK;
            }
            if ("/help".equals(promptInput)) {
                out.println("Commands: /help, /reset, /image <path>, /exit");
                continue;
            }
            if ("/reset".equals(promptInput)) {
                helper.resetSession(model);
                out.println("Session reset.");
                continue;
            }
            if (promptInput.startsWith("/image")) {
                String argument = promptInput.substring("/image".length()).trim();
                if (argument.isEmpty()) {
                    out.println("Usage: /image <path>");
                    continue;
                }
                pendingImage = readImage(Path.of(argument));
                if (pendingImage != null) {
                    out.println("Image attached to the next prompt.");
                }
                continue;
            }

            // A failed turn is reported inline; the chat keeps going.
            runTurn(helper, model, promptInput, pendingImage);
            pendingImage = null;
        }
    }

    private boolean runTurn(ChatModelHelper helper, Model model, String text, BufferedImage image) throws InterruptedException {
        StreamingResponseCollector collector = new StreamingResponseCollector(chunk -> {
            out.print(chunk);
            out.flush();
        });
        out.print("assistant> ");
        helper.runInference(
                model,
                text,
                collector,
                () -> log.debug("Model {} released", model.getName()),
                image);
        boolean finished = collector.await(timeoutMs, TimeUnit.MILLISECONDS);
        out.println();
        if (!finished) {
            log.warn("No terminal response from model {} within {} ms", model.getName(), timeoutMs);
            return false;
        }
        log.info("chat.telemetry model={} chunks={} chunksPerSec={} firstChunkLatencyMs={} error={}",
                model.getName(),
                collector.chunkCount(),
                String.format(Locale.ROOT, "%.2f", collector.chunksPerSecond()),
                collector.firstChunkLatencyMs(),
                collector.isError());
        return !collector.isError();
    }

    private BufferedImage readImage(Path path) {
        if (!Files.isRegularFile(path)) {
            log.error("Image file {} does not exist", path);
            return null;
        }
        try {
            BufferedImage image = ImageIO.read(path.toFile());
            if (image == null) {
                log.error("Unsupported image format: {}", path);
            }
            return image;
        } catch (IOException e) {
            log.error("Unable to read image {}", path, e);
            return null;
        }
    }
}
