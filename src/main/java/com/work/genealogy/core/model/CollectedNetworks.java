package com.work.genealogy.core.model;

import java.util.Collections;
import java.util.List;

/**
 * 一批 artifact network 整理后的结果：最早/最晚的 Network 以及相邻两两之间的族谱边。
 *
 * <p>只有一个 Network 时 ancestor 与 descendant 相同，genealogies 为空。</p>
 */
public class CollectedNetworks {

    private final NetworkRef ancestor;
    private final NetworkRef descendant;
    private final List<NetworkGenealogyInput> genealogies;

    public CollectedNetworks(NetworkRef ancestor, NetworkRef descendant, List<NetworkGenealogyInput> genealogies) {
        this.ancestor = ancestor;
        this.descendant = descendant;
        this.genealogies = Collections.unmodifiableList(genealogies);
    }

    public NetworkRef getAncestor() {
        return ancestor;
    }

    public NetworkRef getDescendant() {
        return descendant;
    }

    public List<NetworkGenealogyInput> getGenealogies() {
        return genealogies;
    }
}
