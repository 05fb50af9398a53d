package com.quickshare.upload.client;

import com.quickshare.upload.client.exception.UploadCancelledException;
import com.quickshare.upload.client.exception.UploadException;
import com.quickshare.upload.client.source.UploadSource;
import com.quickshare.upload.model.ProgressSnapshot;
import com.quickshare.upload.model.UploadOutcome;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;

public class ClientApp {

    static final String BASE_URL_ENV = "QUICKSHARE_API_BASE_URL";
    static final String DEFAULT_BASE_URL = "http://localhost:8000/v1";

    public static void main(String[] args) {
        if (args.length == 0 || (args.length == 1 && args[0].equalsIgnoreCase("--help"))) {
            printHelp();
            return;
        }

        Map<String, String> params = parseArgs(args);

        if (!params.containsKey("filePath")) {
            System.err.println("Error: Missing required argument: filePath");
            printHelp();
            System.exit(1);
        }

        try {
            Path filePath = Paths.get(params.get("filePath"));
            String apiBaseUrl = resolveBaseUrl(params, System.getenv(BASE_URL_ENV));
            int chunkSize = Integer.parseInt(params.getOrDefault("chunkSize",
                    String.valueOf(UploadOrchestrator.DEFAULT_CHUNK_SIZE)));

            ChunkedUploadClient.Builder builder = new ChunkedUploadClient.Builder()
                    .apiBaseUrl(apiBaseUrl)
                    .chunkSize(chunkSize);
            if (params.containsKey("timeoutSeconds")) {
                builder.requestTimeout(Duration.ofSeconds(Long.parseLong(params.get("timeoutSeconds"))));
            }
            ChunkedUploadClient client = builder.build();

            UploadOrchestrator orchestrator = client.newOrchestrator(new ConsoleProgress());
            Thread cancelOnExit = new Thread(() -> {
                if (orchestrator.cancel()) {
                    System.err.println("Upload cancelled.");
                }
            }, "upload-cancel");
            Runtime.getRuntime().addShutdownHook(cancelOnExit);

            System.out.println("Starting upload for file: " + filePath + " to " + client.getApiBaseUrl());
            UploadOutcome outcome = orchestrator.start(UploadSource.of(filePath), params.get("fileName")).join();
            Runtime.getRuntime().removeShutdownHook(cancelOnExit);
            System.out.println();
            System.out.println("Upload completed successfully. Upload ID: " + outcome.getSessionId());
            System.out.println("Download URL: " + outcome.getDownloadLocator());

        } catch (Exception e) {
            Throwable failure = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            System.out.println();
            System.err.println("Upload failed: " + failure.getMessage());
            // For a CLI, printing the high-level error is more user-friendly than a stack trace.
            if (failure.getCause() != null) {
                System.err.println("Cause: " + failure.getCause().getMessage());
            }
            if (failure instanceof UploadException && !(failure instanceof UploadCancelledException)) {
                UploadException error = (UploadException) failure;
                if (error.getSessionId() != null) {
                    System.err.println("Session: " + error.getSessionId() + ", acknowledged chunks: "
                            + error.getSucceededChunks());
                }
            }
            System.exit(1);
        }
    }

    /**
     * Base URL from {@code --apiBaseUrl}, else the environment, else the local default.
     */
    static String resolveBaseUrl(Map<String, String> params, String fromEnv) {
        String fromArgs = params.get("apiBaseUrl");
        if (fromArgs != null && !fromArgs.isBlank()) {
            return fromArgs;
        }
        if (fromEnv != null && !fromEnv.isBlank()) {
            return fromEnv;
        }
        return DEFAULT_BASE_URL;
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> params = new HashMap<>();
        for (String arg : args) {
            if (arg.startsWith("--")) {
                String[] parts = arg.substring(2).split("=", 2);
                if (parts.length == 2) {
                    params.put(parts[0], parts[1]);
                }
            }
        }
        return params;
    }

    private static void printHelp() {
        System.out.println("Usage: java -jar quickshare-upload-client.jar [options]");
        System.out.println("Options:");
        System.out.println("  --filePath=<path>          : Required. Path to the file to upload.");
        System.out.println("  --apiBaseUrl=<url>         : Optional. The service base URL (default: $" + BASE_URL_ENV
                + " or " + DEFAULT_BASE_URL + ").");
        System.out.println("  --fileName=<name>          : Optional. Name announced to the server (default: the file's name).");
        System.out.println("  --chunkSize=<bytes>        : Optional. Bytes per chunk (default: "
                + UploadOrchestrator.DEFAULT_CHUNK_SIZE + ").");
        System.out.println("  --timeoutSeconds=<num>     : Optional. Per-request timeout (default: none).");
        System.out.println("  --help                     : Print this help message.");
    }

    /**
     * Prints a single progress line, rewritten in place.
     */
    static class ConsoleProgress implements UploadListener {
        @Override
        public void onProgress(ProgressSnapshot snapshot) {
            System.out.print(String.format("\rUploading chunk %d/%d: %3d%% (%d/%d bytes)",
                    snapshot.getCurrentChunkIndex(), snapshot.getTotalChunks(), snapshot.getPercentage(),
                    snapshot.getUploadedBytes(), snapshot.getTotalBytes()));
        }
    }
}
