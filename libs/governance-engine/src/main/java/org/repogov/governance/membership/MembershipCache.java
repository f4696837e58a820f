package org.repogov.governance.membership;

import org.repogov.governance.hierarchy.GroupNode;
import org.repogov.vcsclient.model.VcsMember;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Direct members of every group under the users subtree, captured once per session.
 * Entries are kept in walk order and never refreshed.
 */
public class MembershipCache {

    private final Map<GroupNode, List<VcsMember>> membersByGroup = new LinkedHashMap<>();
    private boolean built;

    public boolean isBuilt() {
        return built;
    }

    void put(GroupNode group, List<VcsMember> members) {
        membersByGroup.put(group, List.copyOf(members));
    }

    void markBuilt() {
        built = true;
    }

    public Map<GroupNode, List<VcsMember>> entries() {
        return Collections.unmodifiableMap(membersByGroup);
    }

    public int size() {
        return membersByGroup.size();
    }
}
