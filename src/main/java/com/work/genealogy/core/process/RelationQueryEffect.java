package com.work.genealogy.core.process;

import com.work.genealogy.core.model.CandidateSearchResult;
import com.work.genealogy.core.model.NetworkRef;
import com.work.genealogy.core.model.RelationDirection;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import static com.work.genealogy.core.support.ValidationUtils.requireNonNull;

/**
 * 存储查询：network 的 possibleAncestors / possibleDescendants，排除 alreadyTried。
 */
public class RelationQueryEffect implements Effect<CandidateSearchResult> {

    private final RelationDirection direction;
    private final NetworkRef network;
    private final Set<String> alreadyTried;
    private final int limit;

    public RelationQueryEffect(RelationDirection direction, NetworkRef network, Set<String> alreadyTried, int limit) {
        this.direction = requireNonNull(direction, "direction");
        this.network = requireNonNull(network, "network");
        this.alreadyTried = Collections.unmodifiableSet(new LinkedHashSet<>(requireNonNull(alreadyTried, "alreadyTried")));
        this.limit = limit;
    }

    public RelationDirection getDirection() {
        return direction;
    }

    public NetworkRef getNetwork() {
        return network;
    }

    public Set<String> getAlreadyTried() {
        return alreadyTried;
    }

    public int getLimit() {
        return limit;
    }

    @Override
    public CandidateSearchResult accept(EffectVisitor visitor) {
        return visitor.visitRelationQuery(this);
    }

    @Override
    public String describe() {
        return direction.getQueryName() + "(network=" + network.getId()
                + ", alreadyTried=" + alreadyTried.size() + ", limit=" + limit + ")";
    }
}
