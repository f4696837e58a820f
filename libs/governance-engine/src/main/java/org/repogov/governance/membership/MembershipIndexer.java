package org.repogov.governance.membership;

import org.repogov.governance.hierarchy.GroupNode;
import org.repogov.governance.hierarchy.GroupRef;
import org.repogov.governance.hierarchy.HierarchyWalker;
import org.repogov.vcsclient.VcsClient;
import org.repogov.vcsclient.model.AccessLevel;
import org.repogov.vcsclient.model.VcsMember;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Answers "which user groups does this person belong to" from a single walk of the
 * users subtree, instead of one remote call per group and user.
 */
public class MembershipIndexer {

    private static final Logger log = LoggerFactory.getLogger(MembershipIndexer.class);

    private final HierarchyWalker walker;
    private final VcsClient client;
    private final String usersGroupPath;
    private final MembershipCache cache;

    public MembershipIndexer(HierarchyWalker walker, VcsClient client, String usersGroupPath, MembershipCache cache) {
        this.walker = walker;
        this.client = client;
        this.usersGroupPath = usersGroupPath;
        this.cache = cache;
    }

    /**
     * Groups the user is a direct member of, formatted as {@code "<group name> (<access label>)"}.
     * The first call builds the cache.
     *
     * @throws IllegalArgumentException when a membership carries an unknown access level
     */
    public Stream<String> membershipOf(String username) throws IOException {
        buildCache();
        return cache.entries().entrySet().stream()
                .flatMap(entry -> accessLevelOf(username, entry.getValue())
                        .map(level -> entry.getKey().name() + " (" + AccessLevel.fromValue(level).getLabel() + ")")
                        .stream());
    }

    private void buildCache() throws IOException {
        if (cache.isBuilt()) {
            return;
        }
        log.debug("Indexing group membership under {}", usersGroupPath);
        for (GroupNode group : walker.walkGroups(GroupRef.of(usersGroupPath))) {
            cache.put(group, client.listGroupMembers(group.id()));
        }
        cache.markBuilt();
        log.debug("Indexed {} groups", cache.size());
    }

    private static Optional<Integer> accessLevelOf(String username, List<VcsMember> members) {
        for (VcsMember member : members) {
            if (username.equals(member.username())) {
                return member.accessLevel() == 0 ? Optional.empty() : Optional.of(member.accessLevel());
            }
        }
        return Optional.empty();
    }
}
