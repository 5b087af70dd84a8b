package com.work.genealogy.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.work.genealogy.core.support.ValidationUtils.requireNonNull;

/**
 * possible relation 查询的一批结果：候选 Network（保持存储返回的顺序）+ 更新后的 alreadyTried。
 */
public class CandidateSearchResult {

    private final List<Network> networks;
    private final Set<String> alreadyTried;

    public CandidateSearchResult(List<Network> networks, Set<String> alreadyTried) {
        if (networks == null) {
            this.networks = Collections.emptyList();
        } else {
            List<Network> copy = new ArrayList<>(networks.size());
            for (Network network : networks) {
                copy.add(requireNonNull(network, "candidate network"));
            }
            this.networks = Collections.unmodifiableList(copy);
        }
        this.alreadyTried = alreadyTried == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(alreadyTried));
    }

    public static CandidateSearchResult exhausted(Set<String> alreadyTried) {
        return new CandidateSearchResult(Collections.emptyList(), alreadyTried);
    }

    public List<Network> getNetworks() {
        return networks;
    }

    public Set<String> getAlreadyTried() {
        return alreadyTried;
    }

    public boolean isEmpty() {
        return networks.isEmpty();
    }
}
