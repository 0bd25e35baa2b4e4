package com.mimecast.smime.config;

import com.google.gson.Gson;
import com.google.gson.Strictness;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Root configuration.
 *
 * <p>Reads a JSON5 file (comments and unquoted keys permitted) with Gson in lenient mode.
 * <br>Sections: <code>store</code> and <code>security</code>.
 */
public class SmimeConfig extends ConfigFoundation {
    private static final Logger log = LogManager.getLogger(SmimeConfig.class);

    /**
     * Classpath resource used when no file is given.
     */
    public static final String DEFAULT_RESOURCE = "smime.json5";

    private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

    /**
     * Constructs a new SmimeConfig instance.
     *
     * @param map Configuration map.
     */
    public SmimeConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Loads configuration from the classpath default.
     *
     * @return SmimeConfig instance.
     * @throws IOException Unable to read the resource.
     */
    public static SmimeConfig load() throws IOException {
        try (InputStream is = SmimeConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) {
                throw new IOException("Missing classpath resource: " + DEFAULT_RESOURCE);
            }
            return new SmimeConfig(read(new InputStreamReader(is, StandardCharsets.UTF_8)));
        }
    }

    /**
     * Loads configuration from a file.
     *
     * @param path File path.
     * @return SmimeConfig instance.
     * @throws IOException Unable to read the file.
     */
    public static SmimeConfig load(Path path) throws IOException {
        log.info("Loading configuration from {}", path);
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return new SmimeConfig(read(reader));
        }
    }

    private static Map<String, Object> read(Reader reader) throws IOException {
        JsonReader jsonReader = new JsonReader(reader);
        jsonReader.setStrictness(Strictness.LENIENT);
        try {
            return new Gson().fromJson(jsonReader, MAP_TYPE);
        } catch (RuntimeException e) {
            throw new IOException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Gets store configuration.
     *
     * @return StoreConfig instance.
     */
    public StoreConfig getStore() {
        return new StoreConfig(getMapProperty("store"));
    }

    /**
     * Gets security configuration.
     *
     * @return SecurityConfig instance.
     */
    public SecurityConfig getSecurity() {
        return new SecurityConfig(getMapProperty("security"));
    }
}
