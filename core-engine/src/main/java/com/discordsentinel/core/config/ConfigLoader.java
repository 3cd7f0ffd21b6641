package com.discordsentinel.core.config;

import com.discordsentinel.core.model.DiscordQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads discord queries from YAML.
 *
 * <p>
 * {@link #load()} uses the file named by {@value #ENV_CONFIG_PATH} when it
 * exists and {@value #DEFAULT_RESOURCE} on the classpath otherwise. Sources
 * are read as UTF-8; duplicate keys are a syntax error. Every loaded
 * configuration has been through {@link DiscordConfig#validate()}, so a bad
 * window length or mode surfaces before any series is searched.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Environment variable holding a path to a query file. */
    public static final String ENV_CONFIG_PATH = "DISCORD_CONFIG_PATH";

    /** Classpath fallback. */
    public static final String DEFAULT_RESOURCE = "discord.yml";

    private ConfigLoader() {
        // utility class — not instantiable
    }

    // ---------------------------------------------------------------
    // Sources
    // ---------------------------------------------------------------

    /**
     * @return queries from {@value #ENV_CONFIG_PATH}, or from
     *         {@value #DEFAULT_RESOURCE} when the variable is unset or points
     *         nowhere
     */
    public static DiscordConfig load() {
        String override = System.getenv(ENV_CONFIG_PATH);
        if (override != null && !override.isBlank()) {
            Path path = Path.of(override);
            if (Files.isRegularFile(path)) {
                return fromFile(path);
            }
            LOG.warn("{} points to {}, which is not a file; using classpath {}",
                    ENV_CONFIG_PATH, override, DEFAULT_RESOURCE);
        }
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @see #fromFile(Path)
     */
    public static DiscordConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        return fromFile(Path.of(path));
    }

    /**
     * @param path YAML file
     * @return the validated queries
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if the file cannot be read, is not
     *                                  valid YAML or holds an invalid query
     */
    public static DiscordConfig fromFile(Path path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.toString());
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read discord queries from " + path, e);
        }
    }

    /**
     * @param resource classpath resource name
     * @return the validated queries
     * @throws IllegalArgumentException if no such resource exists
     * @throws IllegalStateException    if the resource is not valid YAML or
     *                                  holds an invalid query
     */
    public static DiscordConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return read(reader, "classpath:" + resource);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read discord queries from classpath:"
                    + resource, e);
        }
    }

    /**
     * Parse queries held in a string, e.g. passed on a command line.
     *
     * @param yaml YAML document with a top-level {@code queries} list
     * @return the validated queries
     * @throws IllegalStateException if the text is not valid YAML or holds an
     *                               invalid query
     */
    public static DiscordConfig fromYaml(String yaml) {
        Objects.requireNonNull(yaml, "YAML must not be null");
        return read(new StringReader(yaml), "inline YAML");
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static DiscordConfig read(Reader reader, String source) {
        DiscordConfig config;
        try {
            config = newYaml().load(reader);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed discord configuration in " + source
                    + ": " + e.getMessage(), e);
        }

        if (config == null) {
            LOG.warn("{} is empty; no discord queries to run", source);
            return new DiscordConfig();
        }
        config.validate();

        for (DiscordQuery query : config.getQueries()) {
            LOG.debug("Query [{}]: discordLength={} wordSize={} alphabetSize={} mode={}",
                    query.getName(), query.getDiscordLength(), query.getWordSize(),
                    query.getAlphabetSize(), query.getMode());
        }
        LOG.info("Loaded {} discord query(ies) from {}", config.getQueries().size(), source);
        return config;
    }

    private static Yaml newYaml() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        return new Yaml(new Constructor(DiscordConfig.class, options));
    }
}
