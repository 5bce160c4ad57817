package com.aegis.engine.gate;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Validators by name. Append-only: a name can be registered once and never
 * removed, so concurrent readers need no coordination.
 */
public class ValidatorRegistry {

    private final Map<String, GateValidator> validators = new ConcurrentHashMap<>();

    /**
     * @throws IllegalArgumentException if the name is blank or already taken
     */
    public ValidatorRegistry register(String name, GateValidator validator) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Validator name cannot be blank");
        }
        Objects.requireNonNull(validator, "Validator cannot be null");
        if (validators.putIfAbsent(name, validator) != null) {
            throw new IllegalArgumentException("Validator already registered: " + name);
        }
        return this;
    }

    public Optional<GateValidator> find(String name) {
        return Optional.ofNullable(name != null ? validators.get(name) : null);
    }

    /**
     * @throws UnknownValidatorException if nothing is registered under the name
     */
    public GateValidator require(String name) {
        return find(name).orElseThrow(() -> new UnknownValidatorException(name));
    }

    public boolean contains(String name) {
        return name != null && validators.containsKey(name);
    }

    public Set<String> names() {
        return new TreeSet<>(validators.keySet());
    }

    /**
     * Registry preloaded with {@link BuiltInValidators}.
     */
    public static ValidatorRegistry withBuiltIns() {
        ValidatorRegistry registry = new ValidatorRegistry();
        BuiltInValidators.registerAll(registry);
        return registry;
    }
}
