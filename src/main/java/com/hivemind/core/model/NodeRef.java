package com.hivemind.core.model;

import java.io.Serializable;

/**
 * Weak reference to a hierarchy node. Node ids are unique within a level only,
 * so the level is part of the identity.
 *
 * @param level the node's level
 * @param id    the node's id within that level
 */
public record NodeRef(NodeLevel level, String id) implements Serializable {

    public static NodeRef of(NodeLevel level, String id) {
        return new NodeRef(level, id);
    }

    public static NodeRef task(String id) {
        return new NodeRef(NodeLevel.TASK, id);
    }

    /**
     * Parses the {@code LEVEL:id} form produced by {@link #key()}.
     */
    public static NodeRef parse(String key) {
        int sep = key.indexOf(':');
        if (sep <= 0 || sep == key.length() - 1) {
            throw new IllegalArgumentException("Node reference must look like LEVEL:id, got: " + key);
        }
        return new NodeRef(NodeLevel.parse(key.substring(0, sep)), key.substring(sep + 1));
    }

    public String key() {
        return level.name() + ":" + id;
    }

    @Override
    public String toString() {
        return key();
    }
}
