package com.threatlens.core.policy;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable catalog of {@link PolicyPack}s.
 *
 * <p>Built once at start-up, typically from the bundled {@code policy-packs.yaml}, and read
 * concurrently without locking afterwards. The first registered pack is the default.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * PolicyPackRegistry registry = PolicyPackRegistry.loadDefault();
 * PolicyPack pack = registry.find("tenant-isolation").orElse(registry.defaultPack());
 * }</pre>
 */
public final class PolicyPackRegistry {

    private static final Logger log = LoggerFactory.getLogger(PolicyPackRegistry.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<List<PolicyPack>> PACK_LIST = new TypeReference<>() {};

    /** Classpath location of the bundled catalog. */
    public static final String DEFAULT_RESOURCE = "policy-packs.yaml";

    private final Map<String, PolicyPack> packsById;

    private PolicyPackRegistry(List<PolicyPack> packs) {
        if (packs.isEmpty()) {
            throw new IllegalStateException("At least one policy pack must be registered");
        }
        Map<String, PolicyPack> byId = new LinkedHashMap<>();
        for (PolicyPack pack : packs) {
            if (byId.putIfAbsent(pack.id(), pack) != null) {
                throw new IllegalStateException("Duplicate policy pack id: " + pack.id());
            }
        }
        this.packsById = Collections.unmodifiableMap(byId);
    }

    /**
     * Creates a registry from explicit packs; the first is the default.
     *
     * @param packs packs in listing order
     * @return registry
     * @throws IllegalStateException if the list is empty or ids repeat
     */
    public static PolicyPackRegistry of(List<PolicyPack> packs) {
        return new PolicyPackRegistry(new ArrayList<>(packs));
    }

    /**
     * Loads the bundled catalog from {@value #DEFAULT_RESOURCE}.
     *
     * @return registry
     * @throws IllegalStateException if the resource is missing or invalid
     */
    public static PolicyPackRegistry loadDefault() {
        return fromResource(DEFAULT_RESOURCE);
    }

    /**
     * Loads a catalog from a classpath YAML resource holding a list of packs.
     *
     * @param resource classpath resource name
     * @return registry
     * @throws IllegalStateException if the resource is missing or invalid
     */
    public static PolicyPackRegistry fromResource(String resource) {
        ClassLoader loader = PolicyPackRegistry.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Policy pack catalog not found on classpath: " + resource);
            }
            List<PolicyPack> packs = YAML_MAPPER.readValue(in, PACK_LIST);
            PolicyPackRegistry registry = of(packs == null ? List.of() : packs);
            log.debug("Loaded {} policy packs from {}: {}", registry.ids().size(), resource, registry.ids());
            return registry;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read policy pack catalog " + resource + ": " + e.getMessage(), e);
        }
    }

    /**
     * Returns the pack used when a request names none.
     *
     * @return default pack
     */
    public PolicyPack defaultPack() {
        return packsById.values().iterator().next();
    }

    /**
     * Looks up a pack by id.
     *
     * @param packId pack id
     * @return pack, or empty if unknown
     */
    public Optional<PolicyPack> find(String packId) {
        return Optional.ofNullable(packsById.get(packId));
    }

    /**
     * Returns all packs in registration order.
     *
     * @return unmodifiable pack list
     */
    public List<PolicyPack> list() {
        return List.copyOf(packsById.values());
    }

    /**
     * Returns all pack ids in registration order.
     *
     * @return unmodifiable id list
     */
    public List<String> ids() {
        return List.copyOf(packsById.keySet());
    }
}
