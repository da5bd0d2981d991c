package com.ttennebkram.focusstack.serialization;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.ttennebkram.focusstack.model.FailurePolicy;
import com.ttennebkram.focusstack.model.StackJob;
import com.ttennebkram.focusstack.tasks.SaveImgTask;

import java.io.File;
import java.io.FileReader;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

/**
 * Reads and writes stack job documents.
 *
 * Format:
 * <pre>
 * {
 *   "threads": 4, "openClLimit": 1, "failurePolicy": "SKIP_DEPENDENTS",
 *   "waitImages": 0.0, "jpgQuality": 95, "noCrop": false, "verbose": false,
 *   "timeoutMs": -1, "alphaMask": "mask.png",
 *   "images": [ { "input": "a.jpg", "output": "a_out.jpg" } ]
 * }
 * </pre>
 * Every field except "images" is optional. Relative paths are resolved against
 * the directory of the job file.
 */
public class StackJobSerializer {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    /**
     * Save a job to a JSON file. Paths are written as stored in the job.
     */
    public static void save(String path, StackJob job) throws IOException {
        JsonObject root = new JsonObject();

        root.addProperty("threads", job.getThreads());
        root.addProperty("openClLimit", job.getOpenClLimit());
        root.addProperty("failurePolicy", job.getFailurePolicy().name());
        root.addProperty("waitImages", job.getWaitImages());
        root.addProperty("jpgQuality", job.getJpgQuality());
        root.addProperty("noCrop", job.isNoCrop());
        root.addProperty("verbose", job.isVerbose());
        root.addProperty("timeoutMs", job.getTimeoutMs());
        if (job.getAlphaMask() != null) {
            root.addProperty("alphaMask", job.getAlphaMask());
        }

        JsonArray imagesArray = new JsonArray();
        for (StackJob.ImageEntry entry : job.getImages()) {
            JsonObject imageJson = new JsonObject();
            imageJson.addProperty("input", entry.input);
            imageJson.addProperty("output", entry.output);
            imagesArray.add(imageJson);
        }
        root.add("images", imagesArray);

        try (FileWriter writer = new FileWriter(path, StandardCharsets.UTF_8)) {
            GSON.toJson(root, writer);
        }
    }

    /**
     * Load a job from a JSON file, resolving relative paths against the file's directory.
     *
     * @throws IOException if the file cannot be read
     * @throws JsonParseException if the file is not valid JSON
     * @throws IllegalArgumentException if the document is not a usable job
     */
    public static StackJob load(String path) throws IOException {
        File file = new File(path);
        File baseDir = file.getAbsoluteFile().getParentFile();
        try (FileReader reader = new FileReader(file, StandardCharsets.UTF_8)) {
            return parse(reader, baseDir);
        }
    }

    /**
     * Parse a job from a JSON string. Relative paths stay relative.
     */
    public static StackJob fromJson(String json) {
        return parse(new StringReader(json), null);
    }

    private static StackJob parse(Reader reader, File baseDir) {
        JsonElement parsed = JsonParser.parseReader(reader);
        if (!parsed.isJsonObject()) {
            throw new IllegalArgumentException("Stack job must be a JSON object");
        }
        JsonObject root = parsed.getAsJsonObject();

        StackJob job = new StackJob();
        if (root.has("threads")) {
            job.setThreads(primitive(root, "threads").getAsInt());
        }
        if (root.has("openClLimit")) {
            job.setOpenClLimit(primitive(root, "openClLimit").getAsInt());
        }
        if (root.has("failurePolicy")) {
            job.setFailurePolicy(FailurePolicy.fromName(primitive(root, "failurePolicy").getAsString()));
        }
        if (root.has("waitImages")) {
            job.setWaitImages(primitive(root, "waitImages").getAsDouble());
        }
        if (root.has("jpgQuality")) {
            job.setJpgQuality(primitive(root, "jpgQuality").getAsInt());
        }
        if (root.has("noCrop")) {
            job.setNoCrop(primitive(root, "noCrop").getAsBoolean());
        }
        if (root.has("verbose")) {
            job.setVerbose(primitive(root, "verbose").getAsBoolean());
        }
        if (root.has("timeoutMs")) {
            job.setTimeoutMs(primitive(root, "timeoutMs").getAsLong());
        }
        if (root.has("alphaMask") && !root.get("alphaMask").isJsonNull()) {
            job.setAlphaMask(resolve(primitive(root, "alphaMask").getAsString(), baseDir));
        }

        if (!root.has("images") || !root.get("images").isJsonArray()) {
            throw new IllegalArgumentException("Stack job has no \"images\" list");
        }
        for (JsonElement elem : root.getAsJsonArray("images")) {
            if (!elem.isJsonObject()) {
                throw new IllegalArgumentException("Image entry must be an object: " + elem);
            }
            JsonObject imageJson = elem.getAsJsonObject();
            if (!imageJson.has("input")) {
                throw new IllegalArgumentException("Image entry without \"input\": " + imageJson);
            }
            String input = resolve(primitive(imageJson, "input").getAsString(), baseDir);
            String output = imageJson.has("output") && !imageJson.get("output").isJsonNull()
                    ? resolve(primitive(imageJson, "output").getAsString(), baseDir)
                    : SaveImgTask.MEMORY_PATH;
            job.addImage(input, output);
        }
        if (job.getImages().isEmpty()) {
            throw new IllegalArgumentException("Stack job has no images");
        }

        if (job.getThreads() < 1) {
            throw new IllegalArgumentException("threads must be at least 1, got " + job.getThreads());
        }
        if (job.getOpenClLimit() < 1) {
            throw new IllegalArgumentException("openClLimit must be at least 1, got " + job.getOpenClLimit());
        }
        if (job.getJpgQuality() < 0 || job.getJpgQuality() > 100) {
            throw new IllegalArgumentException("jpgQuality must be 0-100, got " + job.getJpgQuality());
        }

        return job;
    }

    /**
     * Value of a scalar field. Gson's getAsX throws unchecked exceptions of several types
     * for objects, arrays and nulls; those become IllegalArgumentException here.
     */
    private static JsonPrimitive primitive(JsonObject obj, String key) {
        JsonElement value = obj.get(key);
        if (value == null || !value.isJsonPrimitive()) {
            throw new IllegalArgumentException("\"" + key + "\" must be a number, string or boolean, got " + value);
        }
        return value.getAsJsonPrimitive();
    }

    /**
     * Resolve a path against the job file directory. Absolute paths, empty paths and
     * the in-memory sentinel are returned as-is.
     */
    private static String resolve(String path, File baseDir) {
        if (path == null || path.isEmpty() || SaveImgTask.MEMORY_PATH.equals(path) || baseDir == null) {
            return path;
        }
        File file = new File(path);
        if (file.isAbsolute()) {
            return path;
        }
        return new File(baseDir, path).getAbsolutePath();
    }
}
