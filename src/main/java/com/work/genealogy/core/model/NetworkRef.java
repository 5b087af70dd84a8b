package com.work.genealogy.core.model;

import static com.work.genealogy.core.support.ValidationUtils.requireNonEmpty;

/**
 * 对已存储 Network 的引用（只带 id）。
 */
public final class NetworkRef {

    private final String id;

    private NetworkRef(String id) {
        this.id = requireNonEmpty(id, "id");
    }

    public static NetworkRef of(String id) {
        return new NetworkRef(id);
    }

    public String getId() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NetworkRef)) return false;
        return id.equals(((NetworkRef) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "NetworkRef{" + id + "}";
    }
}
