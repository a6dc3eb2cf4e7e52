package tech.keyledger.platform.shared;

import com.github.f4b6a3.tsid.TsidCreator;

import java.util.Objects;

/**
 * TSID generation for licenses, activations and releases.
 *
 * Format: "{prefix}_{tsid}" (e.g., "act_0HZXEQ5Y8JY5Z"), 17 characters in total.
 * Time-sortable, so activation rows list in creation order without a secondary index.
 */
public final class TsidGenerator {

    public static final String SEPARATOR = "_";

    public static String generate(EntityType type) {
        Objects.requireNonNull(type, "EntityType must not be null");
        return type.prefix() + SEPARATOR + TsidCreator.getTsid().toString();
    }

    /**
     * Resolve the entity type of a typed ID.
     *
     * @throws IllegalArgumentException if the ID has no known prefix
     */
    public static EntityType typeOf(String typedId) {
        if (typedId == null || typedId.isBlank()) {
            throw new IllegalArgumentException("Typed ID cannot be null or blank");
        }
        int separatorIndex = typedId.indexOf(SEPARATOR);
        if (separatorIndex == -1) {
            throw new IllegalArgumentException("Invalid typed ID format: missing separator");
        }
        EntityType type = EntityType.fromPrefix(typedId.substring(0, separatorIndex));
        if (type == null) {
            throw new IllegalArgumentException("Unknown ID prefix: " + typedId.substring(0, separatorIndex));
        }
        return type;
    }

    private TsidGenerator() {
        // Utility class
    }
}
