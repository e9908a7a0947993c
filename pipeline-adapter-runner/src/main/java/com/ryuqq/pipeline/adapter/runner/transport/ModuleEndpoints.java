package com.ryuqq.pipeline.adapter.runner.transport;

import com.ryuqq.pipeline.core.contract.ModuleName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Direct-delivery endpoints per module.
 *
 * <p>Populated once at startup and passed into the transport; never mutated afterwards. Each
 * module may have several endpoints, tried in order until one acknowledges.</p>
 *
 * <p><strong>Environment lookup</strong> ({@link #fromEnvironment()}): {@code CEO_API_URL},
 * {@code CFO_API_URL}, {@code COO_API_URL}, {@code CMO_API_URL} and {@code CDO_API_URL} give
 * each module's base URL; the module's receive path is appended:</p>
 * <ul>
 *   <li>ceo - {@code /ceo/events/receive}</li>
 *   <li>cfo - {@code /cfo/events/receive}</li>
 *   <li>coo - {@code /coo/events/receive}</li>
 *   <li>cmo - {@code /api/events/webhook}</li>
 *   <li>cdo - {@code /cdo/events/receive}</li>
 * </ul>
 * <p>Blank or missing variables leave the module without endpoints.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ModuleEndpoints {

    private static final Logger log = LoggerFactory.getLogger(ModuleEndpoints.class);

    private static final Map<ModuleName, String> RECEIVE_PATHS;

    static {
        EnumMap<ModuleName, String> paths = new EnumMap<>(ModuleName.class);
        paths.put(ModuleName.EXECUTIVE, "/ceo/events/receive");
        paths.put(ModuleName.FINANCE, "/cfo/events/receive");
        paths.put(ModuleName.OPERATIONS, "/coo/events/receive");
        paths.put(ModuleName.MARKETING, "/api/events/webhook");
        paths.put(ModuleName.DESIGN, "/cdo/events/receive");
        RECEIVE_PATHS = Collections.unmodifiableMap(paths);
    }

    private final Map<ModuleName, List<URI>> endpoints;

    private ModuleEndpoints(Map<ModuleName, List<URI>> endpoints) {
        EnumMap<ModuleName, List<URI>> copy = new EnumMap<>(ModuleName.class);
        endpoints.forEach((module, uris) -> {
            if (module == null || uris == null) {
                throw new IllegalArgumentException("endpoint entries cannot be null");
            }
            if (!uris.isEmpty()) {
                copy.put(module, List.copyOf(uris));
            }
        });
        this.endpoints = Collections.unmodifiableMap(copy);
    }

    public static ModuleEndpoints empty() {
        return new ModuleEndpoints(Map.of());
    }

    /**
     * @param endpoints endpoints per module
     * @return immutable endpoint table
     */
    public static ModuleEndpoints of(Map<ModuleName, List<URI>> endpoints) {
        if (endpoints == null) {
            throw new IllegalArgumentException("endpoints cannot be null");
        }
        return new ModuleEndpoints(endpoints);
    }

    /**
     * Reads base URLs from environment variables, then system properties of the same name.
     *
     * @return endpoint table
     */
    public static ModuleEndpoints fromEnvironment() {
        return fromEnvironment(key -> {
            String value = System.getenv(key);
            return value == null || value.isBlank() ? System.getProperty(key) : value;
        });
    }

    /**
     * Reads base URLs with the given lookup.
     *
     * @param lookup variable name to value (may return null)
     * @return endpoint table
     * @throws IllegalArgumentException when a configured URL is not a valid absolute URI
     */
    public static ModuleEndpoints fromEnvironment(Function<String, String> lookup) {
        if (lookup == null) {
            throw new IllegalArgumentException("lookup cannot be null");
        }
        EnumMap<ModuleName, List<URI>> table = new EnumMap<>(ModuleName.class);
        for (ModuleName module : ModuleName.values()) {
            String variable = module.wireName().toUpperCase(Locale.ROOT) + "_API_URL";
            String baseUrl = lookup.apply(variable);
            if (baseUrl == null || baseUrl.isBlank()) {
                continue;
            }
            URI endpoint = receiveEndpoint(module, baseUrl.trim());
            table.put(module, List.of(endpoint));
            log.info("Direct endpoint for {} configured from {}: {}", module.wireName(), variable, endpoint);
        }
        return new ModuleEndpoints(table);
    }

    /**
     * Builds a module's receive endpoint from its base URL.
     *
     * @param module the module
     * @param baseUrl base URL, with or without trailing slash
     * @return absolute endpoint URI
     */
    public static URI receiveEndpoint(ModuleName module, String baseUrl) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        URI uri;
        try {
            uri = URI.create(base + RECEIVE_PATHS.get(module));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid base URL for " + module.wireName() + ": " + baseUrl, e);
        }
        if (!uri.isAbsolute()) {
            throw new IllegalArgumentException("Base URL must be absolute for " + module.wireName() + ": " + baseUrl);
        }
        return uri;
    }

    /**
     * Adds an endpoint, returning a new table.
     *
     * @param module the module
     * @param endpoint endpoint to append
     * @return new table
     */
    public ModuleEndpoints with(ModuleName module, URI endpoint) {
        if (module == null || endpoint == null) {
            throw new IllegalArgumentException("module and endpoint cannot be null");
        }
        EnumMap<ModuleName, List<URI>> table = new EnumMap<>(ModuleName.class);
        table.putAll(endpoints);
        List<URI> uris = new ArrayList<>(table.getOrDefault(module, List.of()));
        uris.add(endpoint);
        table.put(module, uris);
        return new ModuleEndpoints(table);
    }

    /**
     * @param module the module
     * @return endpoints in preference order (empty when none)
     */
    public List<URI> endpointsFor(ModuleName module) {
        return endpoints.getOrDefault(module, List.of());
    }

    public Set<ModuleName> configuredModules() {
        return endpoints.keySet();
    }

    public boolean isEmpty() {
        return endpoints.isEmpty();
    }

    @Override
    public String toString() {
        return "ModuleEndpoints" + endpoints;
    }
}
