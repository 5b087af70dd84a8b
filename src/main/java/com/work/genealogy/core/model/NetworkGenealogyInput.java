package com.work.genealogy.core.model;

import java.util.Objects;

import static com.work.genealogy.core.support.ValidationUtils.requireNonNull;

/**
 * 一条待写入的族谱边：ancestor -> descendant。
 */
public class NetworkGenealogyInput {

    private final NetworkRef ancestor;
    private final NetworkRef descendant;

    public NetworkGenealogyInput(NetworkRef ancestor, NetworkRef descendant) {
        this.ancestor = requireNonNull(ancestor, "ancestor");
        this.descendant = requireNonNull(descendant, "descendant");
        if (ancestor.equals(descendant)) {
            throw new IllegalArgumentException("ancestor 与 descendant 不能是同一个 network: " + ancestor.getId());
        }
    }

    public NetworkRef getAncestor() {
        return ancestor;
    }

    public NetworkRef getDescendant() {
        return descendant;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NetworkGenealogyInput)) return false;
        NetworkGenealogyInput that = (NetworkGenealogyInput) o;
        return ancestor.equals(that.ancestor) && descendant.equals(that.descendant);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ancestor, descendant);
    }

    @Override
    public String toString() {
        return ancestor.getId() + " -> " + descendant.getId();
    }
}
