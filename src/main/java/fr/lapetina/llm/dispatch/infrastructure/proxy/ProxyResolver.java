package fr.lapetina.llm.dispatch.infrastructure.proxy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Decides which proxy, if any, a client uses.
 *
 * Precedence:
 * - an explicit proxy URL wins and disables environment lookup entirely
 * - otherwise HTTPS_PROXY / HTTP_PROXY (either case), honouring NO_PROXY
 * - otherwise no proxy
 *
 * The environment is copied at construction and never re-read, so resolution is a pure
 * function of the explicit value and the target.
 */
public final class ProxyResolver {

    private static final Logger log = LoggerFactory.getLogger(ProxyResolver.class);

    private static final List<String> SUPPORTED_PREFIXES = List.of("http://", "https://");

    private final Map<String, String> environment;
    private final List<String> noProxy;

    public ProxyResolver(Map<String, String> environment) {
        this.environment = Map.copyOf(environment);
        this.noProxy = parseNoProxy(lookup("NO_PROXY").orElse(""));
    }

    /**
     * Snapshots the process environment.
     */
    public static ProxyResolver fromSystemEnvironment() {
        return new ProxyResolver(System.getenv());
    }

    /**
     * A resolver that never consults the environment.
     */
    public static ProxyResolver withoutEnvironment() {
        return new ProxyResolver(Map.of());
    }

    /**
     * Resolves without a target; the environment lookup prefers HTTPS_PROXY, then HTTP_PROXY.
     *
     * @throws InvalidProxyConfigException if {@code explicitProxy} is set but unusable
     */
    public ResolvedProxy resolve(String explicitProxy) {
        return resolve(explicitProxy, null);
    }

    /**
     * Resolves the proxy for connections to {@code target}.
     *
     * @param explicitProxy configured proxy URL; null or blank means not configured
     * @param target        provider URL, used to pick the environment variable and apply NO_PROXY
     * @throws InvalidProxyConfigException if {@code explicitProxy} is set but unusable
     */
    public ResolvedProxy resolve(String explicitProxy, URI target) {
        if (explicitProxy != null && !explicitProxy.isBlank()) {
            ResolvedProxy resolved = ResolvedProxy.explicit(parseExplicit(explicitProxy.trim()));
            log.debug("Proxy resolved: source={}, proxy={}, target={}", resolved.source(), resolved.redacted(), target);
            return resolved;
        }
        ResolvedProxy resolved = resolveFromEnvironment(target);
        log.debug("Proxy resolved: source={}, proxy={}, target={}", resolved.source(), resolved.redacted(), target);
        return resolved;
    }

    private URI parseExplicit(String value) {
        boolean supported = SUPPORTED_PREFIXES.stream().anyMatch(value::startsWith);
        if (!supported) {
            throw new InvalidProxyConfigException(value,
                    "proxy URL must start with http:// or https://");
        }
        URI uri;
        try {
            uri = new URI(value);
        } catch (URISyntaxException e) {
            throw new InvalidProxyConfigException(value, "malformed proxy URL: " + e.getReason(), e);
        }
        if (uri.getHost() == null || uri.getHost().isEmpty()) {
            throw new InvalidProxyConfigException(value, "proxy URL has no host");
        }
        return uri;
    }

    private ResolvedProxy resolveFromEnvironment(URI target) {
        if (target != null && isExcluded(target.getHost())) {
            log.debug("Target excluded by NO_PROXY: host={}", target.getHost());
            return ResolvedProxy.none();
        }

        List<String> variables = new ArrayList<>();
        if (target == null || "https".equalsIgnoreCase(target.getScheme())) {
            variables.add("HTTPS_PROXY");
        }
        variables.add("HTTP_PROXY");

        for (String variable : variables) {
            Optional<String> value = lookup(variable);
            if (value.isPresent()) {
                return parseEnvironment(variable, value.get())
                        .map(ResolvedProxy::environment)
                        .orElse(ResolvedProxy.none());
            }
        }
        return ResolvedProxy.none();
    }

    private Optional<URI> parseEnvironment(String variable, String value) {
        String candidate = value.contains("://") ? value : "http://" + value;
        if (SUPPORTED_PREFIXES.stream().noneMatch(candidate.toLowerCase(Locale.ROOT)::startsWith)) {
            log.warn("Ignoring {}: unsupported proxy scheme", variable);
            return Optional.empty();
        }
        try {
            URI uri = new URI(candidate);
            if (uri.getHost() == null) {
                log.warn("Ignoring {}: proxy URL has no host", variable);
                return Optional.empty();
            }
            return Optional.of(uri);
        } catch (URISyntaxException e) {
            log.warn("Ignoring {}: malformed proxy URL ({})", variable, e.getReason());
            return Optional.empty();
        }
    }

    /**
     * Upper-case name first, then lower-case, as curl does. Blank values count as unset.
     */
    private Optional<String> lookup(String upperCaseName) {
        String value = environment.get(upperCaseName);
        if (value == null || value.isBlank()) {
            value = environment.get(upperCaseName.toLowerCase(Locale.ROOT));
        }
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    private static List<String> parseNoProxy(String value) {
        List<String> entries = new ArrayList<>();
        for (String raw : value.split(",")) {
            String entry = raw.trim().toLowerCase(Locale.ROOT);
            if (entry.isEmpty()) {
                continue;
            }
            int colon = entry.lastIndexOf(':');
            if (colon > 0 && entry.indexOf(':') == colon) {
                entry = entry.substring(0, colon);
            }
            if (entry.startsWith("*.")) {
                entry = entry.substring(1);
            }
            entries.add(entry);
        }
        return List.copyOf(entries);
    }

    boolean isExcluded(String host) {
        if (host == null || noProxy.isEmpty()) {
            return false;
        }
        String normalized = host.toLowerCase(Locale.ROOT);
        for (String entry : noProxy) {
            if (entry.equals("*")) {
                return true;
            }
            String domain = entry.startsWith(".") ? entry.substring(1) : entry;
            if (normalized.equals(domain) || normalized.endsWith("." + domain)) {
                return true;
            }
        }
        return false;
    }
}
