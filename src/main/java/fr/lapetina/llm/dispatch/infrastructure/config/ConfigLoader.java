package fr.lapetina.llm.dispatch.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeId;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.resolver.Resolver;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Configuration loader.
 *
 * Supports:
 * - Loading from file system, then classpath
 * - {@code ${VAR}} and {@code ${VAR:-default}} placeholders in scalar values
 * - Validation of the provider list
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final Resolver RESOLVER = new Resolver();

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)(?::-([^}]*))?}");

    private final Path configPath;
    private final Map<String, String> environment;

    public ConfigLoader(String configPath) {
        this(configPath, System.getenv());
    }

    public ConfigLoader(String configPath, Map<String, String> environment) {
        this.configPath = Paths.get(configPath);
        this.environment = Map.copyOf(environment);
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The validated configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public DispatchConfig load() {
        return parse(readSource(), environment);
    }

    /**
     * Parses and validates a YAML document.
     *
     * Placeholders are expanded in scalar values of the parsed document, so comments are never
     * expanded and substituted values are never read as YAML syntax.
     */
    public static DispatchConfig parse(String yamlText, Map<String, String> environment) {
        Yaml yaml = new Yaml(new Constructor(DispatchConfig.class, new LoaderOptions()));
        DispatchConfig config;
        try {
            Node root = yaml.compose(new StringReader(yamlText));
            if (root == null) {
                throw new ConfigurationException("Configuration is empty");
            }
            StringWriter expanded = new StringWriter();
            yaml.serialize(expandNode(root, environment), expanded);
            config = yaml.load(expanded.toString());
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
        }
        if (config == null) {
            throw new ConfigurationException("Configuration is empty");
        }
        validate(config);
        return config;
    }

    private String readSource() {
        // Try file system first
        if (Files.exists(configPath)) {
            try {
                log.info("Loading configuration from file: {}", configPath);
                return Files.readString(configPath, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new ConfigurationException("Failed to load configuration from: " + configPath, e);
            }
        }

        // Try classpath
        String classpathResource = configPath.toString().replace('\\', '/');
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = ConfigLoader.class.getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return new String(is.readAllBytes(), StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    /**
     * Replaces placeholders with environment values.
     *
     * @throws ConfigurationException if a variable without default is not set
     */
    static String expand(String text, Map<String, String> environment) {
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String fallback = matcher.group(2);
            String value = environment.get(name);
            if (value == null || (value.isEmpty() && fallback != null)) {
                if (fallback == null) {
                    throw new ConfigurationException("Environment variable not set: " + name);
                }
                value = fallback;
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static Node expandNode(Node node, Map<String, String> environment) {
        if (node instanceof ScalarNode) {
            ScalarNode scalar = (ScalarNode) node;
            String value = expand(scalar.getValue(), environment);
            if (value.equals(scalar.getValue())) {
                return scalar;
            }
            // Plain scalars are re-typed from their new value; quoted ones stay strings.
            Tag tag = scalar.getScalarStyle() == DumperOptions.ScalarStyle.PLAIN
                    ? RESOLVER.resolve(NodeId.scalar, value, true)
                    : scalar.getTag();
            return new ScalarNode(tag, value, scalar.getStartMark(), scalar.getEndMark(), scalar.getScalarStyle());
        }
        if (node instanceof MappingNode) {
            MappingNode mapping = (MappingNode) node;
            List<NodeTuple> tuples = new ArrayList<>(mapping.getValue().size());
            for (NodeTuple tuple : mapping.getValue()) {
                tuples.add(new NodeTuple(tuple.getKeyNode(), expandNode(tuple.getValueNode(), environment)));
            }
            mapping.setValue(tuples);
        } else if (node instanceof SequenceNode) {
            List<Node> items = ((SequenceNode) node).getValue();
            for (int i = 0; i < items.size(); i++) {
                items.set(i, expandNode(items.get(i), environment));
            }
        }
        return node;
    }

    private static void validate(DispatchConfig config) {
        if (config.getProviders() == null || config.getProviders().isEmpty()) {
            throw new ConfigurationException("At least one provider must be configured");
        }
        Set<String> ids = new HashSet<>();
        Set<String> enabledIds = new HashSet<>();
        for (DispatchConfig.ProviderConfig provider : config.getProviders()) {
            if (provider.getId() == null || provider.getId().isBlank()) {
                throw new ConfigurationException("Provider id is required");
            }
            if (!ids.add(provider.getId())) {
                throw new ConfigurationException("Duplicate provider id: " + provider.getId());
            }
            if (provider.getBaseUrl() == null || provider.getBaseUrl().isBlank()) {
                throw new ConfigurationException("Base URL is required for provider: " + provider.getId());
            }
            if (provider.isEnabled()) {
                enabledIds.add(provider.getId());
            }
        }
        if (config.getComposite() == null) {
            config.setComposite(new DispatchConfig.CompositeConfig());
        }
        if (config.getPool() == null) {
            config.setPool(new DispatchConfig.PoolConfig());
        }
        if (config.getProxy() == null) {
            config.setProxy(new DispatchConfig.ProxyConfig());
        }
        if (config.getMetrics() == null) {
            config.setMetrics(new DispatchConfig.MetricsConfig());
        }
        if (config.getComposite().getDefaultTargets() == null) {
            config.getComposite().setDefaultTargets(new ArrayList<>());
        }
        for (String target : config.getComposite().getDefaultTargets()) {
            if (!ids.contains(target)) {
                throw new ConfigurationException("Unknown default target: " + target);
            }
            if (!enabledIds.contains(target)) {
                throw new ConfigurationException("Default target is disabled: " + target);
            }
        }
        log.debug("Configuration validated: providers={}", ids);
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
