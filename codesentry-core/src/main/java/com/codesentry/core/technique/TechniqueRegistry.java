package com.codesentry.core.technique;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Ordered, append-only list of registered techniques.
 *
 * <p>Techniques are registered explicitly at process startup, then the registry is
 * {@link #freeze() frozen} and becomes read-only for every run. Registration order is
 * execution order.</p>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * TechniqueRegistry registry = new TechniqueRegistry();
 * BuiltInTechniques.registerAll(registry);
 * registry.register(new MyTechnique());
 * registry.freeze();
 *
 * engine.run(files, registry.list(), baseDir, options);
 * }</pre>
 */
public class TechniqueRegistry {

    private static final Logger log = LoggerFactory.getLogger(TechniqueRegistry.class);
    private static final Pattern KEBAB_CASE = Pattern.compile("[a-z0-9]+(-[a-z0-9]+)*");

    private final List<Technique> techniques = new ArrayList<>();
    private final Set<String> ids = new LinkedHashSet<>();
    private boolean frozen;

    /**
     * Registers a technique at the end of the execution order.
     *
     * @param technique technique to register
     * @return this registry
     * @throws TechniqueRegistrationException if the technique is malformed, its id is
     *     already registered, or the registry is frozen
     */
    public synchronized TechniqueRegistry register(Technique technique) {
        if (frozen) {
            throw new TechniqueRegistrationException(
                "Registry is frozen; cannot register " + (technique == null ? "null" : technique.getId()));
        }
        if (technique == null) {
            throw new TechniqueRegistrationException("Technique must not be null");
        }
        String id = technique.getId();
        if (id == null || id.isBlank()) {
            throw new TechniqueRegistrationException(
                "Technique " + technique.getClass().getName() + " has no id");
        }
        if (!KEBAB_CASE.matcher(id).matches()) {
            throw new TechniqueRegistrationException("Technique id must be kebab-case: '" + id + "'");
        }
        if (!ids.add(id)) {
            throw new TechniqueRegistrationException("Duplicate technique id: " + id);
        }
        techniques.add(technique);
        log.debug("Registered technique {} ({})", id, technique.isGlobal() ? "global" : "per-file");
        return this;
    }

    /**
     * Registers several techniques in order.
     *
     * @param toRegister techniques to register
     * @return this registry
     */
    public TechniqueRegistry registerAll(Collection<? extends Technique> toRegister) {
        toRegister.forEach(this::register);
        return this;
    }

    /**
     * Makes the registry read-only.
     *
     * @return this registry
     */
    public synchronized TechniqueRegistry freeze() {
        frozen = true;
        return this;
    }

    /**
     * Returns whether the registry accepts no more registrations.
     *
     * @return true once frozen
     */
    public synchronized boolean isFrozen() {
        return frozen;
    }

    /**
     * Lists all techniques in registration order.
     *
     * @return unmodifiable snapshot
     */
    public synchronized List<Technique> list() {
        return Collections.unmodifiableList(new ArrayList<>(techniques));
    }

    /**
     * Lists global techniques in registration order.
     *
     * @return global techniques
     */
    public List<Technique> globalTechniques() {
        return list().stream().filter(Technique::isGlobal).toList();
    }

    /**
     * Lists per-file techniques in registration order.
     *
     * @return per-file techniques
     */
    public List<Technique> perFileTechniques() {
        return list().stream().filter(t -> !t.isGlobal()).toList();
    }

    /**
     * Finds a technique by id.
     *
     * @param id technique id
     * @return the technique, if registered
     */
    public synchronized Optional<Technique> find(String id) {
        return techniques.stream().filter(t -> t.getId().equals(id)).findFirst();
    }

    /**
     * Returns the number of registered techniques.
     *
     * @return registry size
     */
    public synchronized int size() {
        return techniques.size();
    }

    /**
     * Creates a frozen registry limited to the given ids, keeping registration order.
     *
     * <p>An empty or null id list keeps every technique. Unknown ids are logged.</p>
     *
     * @param enabledIds ids to keep
     * @return new frozen registry
     */
    public TechniqueRegistry filter(Collection<String> enabledIds) {
        TechniqueRegistry filtered = new TechniqueRegistry();
        if (enabledIds == null || enabledIds.isEmpty()) {
            filtered.registerAll(list());
            return filtered.freeze();
        }

        Set<String> wanted = new LinkedHashSet<>(enabledIds);
        for (Technique technique : list()) {
            if (wanted.remove(technique.getId())) {
                filtered.register(technique);
            }
        }
        if (!wanted.isEmpty()) {
            log.warn("Unknown technique IDs in configuration: {}", wanted);
        }
        return filtered.freeze();
    }
}
