package tech.keyledger.platform.shared;

import java.util.HashMap;
import java.util.Map;

/**
 * Entity types persisted by the engine, with their 3-character ID prefixes.
 *
 * IDs are stored WITH the prefix: "{prefix}_{tsid}" (e.g., "lic_0HZXEQ5Y8JY5Z").
 *
 * <pre>
 * String id = TsidGenerator.generate(EntityType.LICENSE);  // "lic_0HZXEQ5Y8JY5Z"
 * </pre>
 */
public enum EntityType {

    LICENSE("lic"),
    ACTIVATION("act"),
    RELEASE("rel");

    private final String prefix;

    private static final Map<String, EntityType> BY_PREFIX = new HashMap<>();

    static {
        for (EntityType type : values()) {
            BY_PREFIX.put(type.prefix, type);
        }
    }

    EntityType(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    /**
     * Looks up an EntityType by its prefix.
     *
     * @return the EntityType, or null if not found
     */
    public static EntityType fromPrefix(String prefix) {
        return BY_PREFIX.get(prefix);
    }
}
