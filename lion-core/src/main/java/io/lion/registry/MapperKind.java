package io.lion.registry;

import io.lion.integration.EventMapper;
import io.lion.integration.FlexibleEventMapper;

/**
 * The two mapper capabilities recognized by the registry.
 */
public enum MapperKind {
    /** {@link EventMapper}: produces typed integration events. */
    TYPED(EventMapper.class),
    /** {@link FlexibleEventMapper}: produces untyped objects. */
    FLEXIBLE(FlexibleEventMapper.class);

    private final Class<?> capability;

    MapperKind(Class<?> capability) {
        this.capability = capability;
    }

    /**
     * Returns the generic interface this kind stands for.
     *
     * @return {@code EventMapper.class} or {@code FlexibleEventMapper.class}
     */
    public Class<?> capability() {
        return capability;
    }

    /**
     * Looks up the kind of a capability interface.
     *
     * @param type a raw interface type
     * @return the matching kind, or {@code null} if {@code type} is not a mapper capability
     */
    static MapperKind of(Class<?> type) {
        for (MapperKind kind : values()) {
            if (kind.capability == type) {
                return kind;
            }
        }
        return null;
    }
}
