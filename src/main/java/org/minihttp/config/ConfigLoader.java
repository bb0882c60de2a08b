package org.minihttp.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Builds a {@link ServerConfig} from three layers, later ones winning:
 * <ol>
 *   <li>the classpath resource {@value #DEFAULT_RESOURCE}, if present</li>
 *   <li>a JSON file named with {@code -c/--config}</li>
 *   <li>the remaining command line flags</li>
 * </ol>
 */
public final class ConfigLoader {

    public static final String DEFAULT_RESOURCE = "server.json";

    public static final String USAGE =
            "usage: Httpd [-c config.json] [-b address] [-p port] [-r root] [-t readTimeoutMs]"
                    + " [-w backlog] [-v] [--no-keep-alive]";

    private static final Gson gson = new GsonBuilder().create();

    private ConfigLoader() {}

    /**
     * @throws IllegalArgumentException on unknown flags, bad values or an invalid JSON document
     * @throws IOException if the config file cannot be read
     */
    public static ServerConfig load(String... args) throws IOException {
        JsonObject merged = readResource(DEFAULT_RESOURCE);
        String file = configFileFlag(args);
        if (file != null) {
            try (Reader r = Files.newBufferedReader(Path.of(file), StandardCharsets.UTF_8)) {
                overlay(merged, parseObject(r, file));
            }
        }
        ServerConfig cfg = fromJson(merged);
        applyFlags(cfg, args);
        return cfg.validate();
    }

    /** Binds a JSON object onto a fresh config; absent keys keep their defaults. */
    public static ServerConfig fromJson(JsonObject json) {
        warnUnknownKeys(json);
        try {
            ServerConfig cfg = gson.fromJson(json, ServerConfig.class);
            return cfg == null ? new ServerConfig() : cfg;
        } catch (JsonParseException | NumberFormatException e) {
            throw new IllegalArgumentException("invalid configuration: " + e.getMessage(), e);
        }
    }

    public static ServerConfig fromJson(Reader reader) {
        return fromJson(parseObject(reader, "reader"));
    }

    /** Applies command line flags other than {@code -c} onto {@code cfg}. */
    public static void applyFlags(ServerConfig cfg, String... args) {
        for (int i = 0; i < args.length; i++) {
            String flag = args[i];
            switch (flag) {
                case "-c", "--config" -> i++; // consumed by load()
                case "-b", "--bind" -> cfg.setBindAddress(value(args, ++i, flag));
                case "-p", "--port" -> cfg.setPort(intValue(args, ++i, flag));
                case "-r", "--root" -> cfg.setDocumentRoot(value(args, ++i, flag));
                case "-t", "--timeout" -> cfg.setReadTimeoutMs(intValue(args, ++i, flag));
                case "-w", "--backlog" -> cfg.setBacklog(intValue(args, ++i, flag));
                case "-v", "--verbose" -> cfg.setVerbose(true);
                case "--no-keep-alive" -> cfg.setKeepAlive(false);
                default -> throw new IllegalArgumentException("unknown option '" + flag + "'\n" + USAGE);
            }
        }
    }

    private static String configFileFlag(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("-c".equals(args[i]) || "--config".equals(args[i])) {
                return value(args, i + 1, args[i]);
            }
        }
        return null;
    }

    private static String value(String[] args, int i, String flag) {
        if (i >= args.length) throw new IllegalArgumentException(flag + " needs a value\n" + USAGE);
        return args[i];
    }

    private static int intValue(String[] args, int i, String flag) {
        String v = value(args, i, flag);
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(flag + " expects a number, got '" + v + "'\n" + USAGE);
        }
    }

    private static JsonObject readResource(String name) throws IOException {
        InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(name);
        if (in == null) return new JsonObject();
        try (Reader r = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return parseObject(r, name);
        }
    }

    private static JsonObject parseObject(Reader r, String origin) {
        JsonElement el;
        try {
            el = JsonParser.parseReader(r);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("invalid JSON in " + origin + ": " + e.getMessage(), e);
        }
        if (el.isJsonNull()) return new JsonObject();
        if (!el.isJsonObject()) {
            throw new IllegalArgumentException(origin + " must contain a JSON object");
        }
        return el.getAsJsonObject();
    }

    private static void overlay(JsonObject base, JsonObject top) {
        for (Map.Entry<String, JsonElement> e : top.entrySet()) {
            base.add(e.getKey(), e.getValue());
        }
    }

    private static void warnUnknownKeys(JsonObject json) {
        Set<String> known = new HashSet<>();
        for (Field f : ServerConfig.class.getDeclaredFields()) {
            if (!Modifier.isStatic(f.getModifiers())) known.add(f.getName());
        }
        for (String key : json.keySet()) {
            if (!known.contains(key)) {
                System.err.println("[Config] ignoring unknown setting '" + key + "'");
            }
        }
    }
}
