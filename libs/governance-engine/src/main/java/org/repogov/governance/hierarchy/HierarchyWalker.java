package org.repogov.governance.hierarchy;

import org.repogov.governance.exception.GroupNotFoundException;
import org.repogov.governance.exception.InvalidPathException;
import org.repogov.governance.exception.ProjectNotFoundException;
import org.repogov.governance.path.NamespacePath;
import org.repogov.governance.path.PathResolver;
import org.repogov.governance.path.ResolvedPath;
import org.repogov.vcsclient.VcsClient;
import org.repogov.vcsclient.gitlab.GitLabException;
import org.repogov.vcsclient.model.VcsGroup;
import org.repogov.vcsclient.model.VcsProject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Resolves and walks the group/project hierarchy of the remote service.
 * <p>
 * One walker is one session: resolved groups and their child listings are cached for its
 * lifetime and never refreshed. Walks return lazy {@link Iterable}s; each call to
 * {@code iterator()} starts the walk again, and remote calls happen only as the caller
 * advances. The remote hierarchy is assumed to be acyclic; no cycle detection is done.
 * <p>
 * Transport failures raised while iterating are rethrown as {@link UncheckedIOException}.
 */
public class HierarchyWalker {

    public static final int UNBOUNDED = -1;

    private static final String GIT_SUFFIX = ".git";

    private static final Logger log = LoggerFactory.getLogger(HierarchyWalker.class);

    private final VcsClient client;
    private final PathResolver pathResolver;
    private final Map<Long, GroupNode> groupCache = new HashMap<>();

    public HierarchyWalker(VcsClient client, PathResolver pathResolver) {
        this.client = client;
        this.pathResolver = pathResolver;
    }

    public PathResolver getPathResolver() {
        return pathResolver;
    }

    /**
     * Resolve a group reference into a node.
     *
     * @throws GroupNotFoundException if the remote service reports the group as missing
     */
    public GroupNode resolveGroup(GroupRef ref) throws IOException {
        if (ref instanceof GroupRef.Resolved resolved) {
            return resolved.node();
        }
        if (ref instanceof GroupRef.ById byId) {
            GroupNode cached = groupCache.get(byId.id());
            if (cached != null) {
                return cached;
            }
            return fetchGroup(String.valueOf(byId.id()), () -> client.getGroup(byId.id()));
        }
        GroupRef.ByPath byPath = (GroupRef.ByPath) ref;
        NamespacePath rooted = pathResolver.rootedPath(byPath.path());
        return fetchGroup(rooted.toString(), () -> client.getGroup(rooted.toString()));
    }

    /**
     * Interpret a namespace string as a group, or as a group followed by one project segment.
     * A blank string names the root group. Any other string must be a well-formed path; a
     * {@code .git} suffix marks it as a project path.
     *
     * @throws InvalidPathException if the string is malformed; no remote call is made then
     * @throws ProjectNotFoundException if neither the group nor the leaf project exists
     */
    public ParsedPath parsePath(String name) throws IOException {
        if (name == null || name.isBlank()) {
            return new ParsedPath(resolveGroup(GroupRef.of(name)), null);
        }

        ResolvedPath resolved = pathResolver.resolvePath(name);
        String groupPath = resolved.groupPath() == null ? "" : resolved.groupPath();
        if (!name.endsWith(GIT_SUFFIX)) {
            try {
                return new ParsedPath(resolveGroup(GroupRef.of(name)), null);
            } catch (GroupNotFoundException e) {
                log.debug("'{}' is not a group, trying it as a project path", name);
            }
        }

        GroupNode group = resolveGroup(GroupRef.of(groupPath));
        return new ParsedPath(group, resolveProject(resolved.projectName(), group));
    }

    /**
     * Find a direct, non-shared, non-archived project of a group by path (case-insensitive).
     *
     * @throws ProjectNotFoundException if no project matches
     */
    public ProjectNode resolveProject(String name, GroupNode group) throws IOException {
        for (VcsProject candidate : projectsOf(group)) {
            if (candidate.path() != null && candidate.path().equalsIgnoreCase(name)) {
                return new ProjectNode(client.getProject(candidate.id()), group);
            }
        }
        throw new ProjectNotFoundException(name, group.fullPath());
    }

    public Iterable<GroupNode> walkGroups(GroupRef root) {
        return walkGroups(root, UNBOUNDED);
    }

    /**
     * Depth-first, pre-order walk of a group and its subgroups.
     *
     * @param root group to start from; it is yielded first
     * @param maxDepth how many levels below the root to descend; 0 yields nothing,
     *                 a negative value means unbounded
     */
    public Iterable<GroupNode> walkGroups(GroupRef root, int maxDepth) {
        return () -> new GroupIterator(root, maxDepth);
    }

    public Iterable<NamespaceNode> walkProjects(String name) {
        return walkProjects(name, false);
    }

    /**
     * Walk every project under a namespace string.
     * <p>
     * A string naming a single project yields just that project. Otherwise, for each group in
     * pre-order: the group itself when {@code includeGroups} is set, then its direct projects,
     * then its subgroups.
     */
    public Iterable<NamespaceNode> walkProjects(String name, boolean includeGroups) {
        return () -> new ProjectIterator(name, includeGroups);
    }

    List<VcsGroup> subgroupsOf(GroupNode group) throws IOException {
        if (!group.hasCachedSubgroups()) {
            group.cacheSubgroups(client.listSubgroups(group.id()));
        }
        return group.cachedSubgroups();
    }

    List<VcsProject> projectsOf(GroupNode group) throws IOException {
        if (!group.hasCachedProjects()) {
            group.cacheProjects(client.listGroupProjects(group.id()));
        }
        return group.cachedProjects();
    }

    private GroupNode nodeFor(VcsGroup group) {
        return groupCache.computeIfAbsent(group.id(), id -> new GroupNode(group));
    }

    private GroupNode fetchGroup(String description, GroupFetch fetch) throws IOException {
        try {
            return nodeFor(fetch.get());
        } catch (GitLabException e) {
            if (e.isNotFound()) {
                throw new GroupNotFoundException(description, e);
            }
            throw e;
        }
    }

    @FunctionalInterface
    private interface GroupFetch {
        VcsGroup get() throws IOException;
    }

    private record Frame(GroupRef ref, int remainingDepth) {
    }

    /**
     * Pre-order group iterator over an explicit stack. The subgroups of the node last
     * returned are listed only when the caller asks for the following element.
     */
    private final class GroupIterator implements Iterator<GroupNode> {

        private final Deque<Frame> stack = new ArrayDeque<>();
        private GroupNode pendingExpansion;
        private int pendingDepth;

        GroupIterator(GroupRef root, int maxDepth) {
            if (maxDepth != 0) {
                stack.push(new Frame(root, maxDepth));
            }
        }

        @Override
        public boolean hasNext() {
            expandPending();
            return !stack.isEmpty();
        }

        @Override
        public GroupNode next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Frame frame = stack.pop();
            GroupNode node;
            try {
                node = resolveGroup(frame.ref());
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            pendingExpansion = node;
            pendingDepth = frame.remainingDepth();
            return node;
        }

        private void expandPending() {
            if (pendingExpansion == null) {
                return;
            }
            GroupNode node = pendingExpansion;
            pendingExpansion = null;
            if (pendingDepth == 0) {
                return;
            }
            int childDepth = pendingDepth < 0 ? UNBOUNDED : pendingDepth - 1;
            List<VcsGroup> children;
            try {
                children = subgroupsOf(node);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(new Frame(GroupRef.of(nodeFor(children.get(i))), childDepth));
            }
        }
    }

    /**
     * Yields groups (optionally), then each group's projects, then descends. Projects are
     * fetched in full one at a time as the caller advances.
     */
    private final class ProjectIterator implements Iterator<NamespaceNode> {

        private final Deque<GroupNode> groups = new ArrayDeque<>();
        private final Deque<NamespaceNode> ready = new ArrayDeque<>();
        private final Deque<VcsProject> pendingProjects = new ArrayDeque<>();
        private final boolean includeGroups;
        private GroupNode current;

        ProjectIterator(String name, boolean includeGroups) {
            this.includeGroups = includeGroups;
            ParsedPath parsed;
            try {
                parsed = parsePath(name);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            if (parsed.isProject()) {
                ready.add(parsed.project());
            } else {
                groups.push(parsed.group());
            }
        }

        @Override
        public boolean hasNext() {
            try {
                advance();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            return !ready.isEmpty();
        }

        @Override
        public NamespaceNode next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return ready.poll();
        }

        private void advance() throws IOException {
            while (ready.isEmpty()) {
                if (!pendingProjects.isEmpty()) {
                    VcsProject summary = pendingProjects.poll();
                    ready.add(new ProjectNode(client.getProject(summary.id()), current));
                    return;
                }
                if (current != null) {
                    List<VcsGroup> children = subgroupsOf(current);
                    for (int i = children.size() - 1; i >= 0; i--) {
                        groups.push(nodeFor(children.get(i)));
                    }
                    current = null;
                }
                if (groups.isEmpty()) {
                    return;
                }
                current = groups.pop();
                if (includeGroups) {
                    ready.add(current);
                }
                pendingProjects.addAll(projectsOf(current));
            }
        }
    }
}
