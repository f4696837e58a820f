package org.repogov.governance.project;

import org.repogov.governance.exception.InvalidPathException;
import org.repogov.governance.hierarchy.GroupNode;
import org.repogov.governance.hierarchy.GroupRef;
import org.repogov.governance.hierarchy.HierarchyWalker;
import org.repogov.governance.hierarchy.ProjectNode;
import org.repogov.governance.path.PathResolver;
import org.repogov.governance.path.ResolvedPath;
import org.repogov.vcsclient.VcsClient;
import org.repogov.vcsclient.model.VcsProject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * Creates new projects under an existing group.
 */
public class ProjectProvisioner {

    private static final Logger log = LoggerFactory.getLogger(ProjectProvisioner.class);

    private final VcsClient client;
    private final HierarchyWalker walker;
    private final boolean dryRun;

    public ProjectProvisioner(VcsClient client, HierarchyWalker walker, boolean dryRun) {
        this.client = client;
        this.walker = walker;
        this.dryRun = dryRun;
    }

    /**
     * Create the project named by the last segment of {@code rawPath} in the group named by
     * the rest. The path and name are validated before the remote service is contacted.
     *
     * @return the new project, or empty in a dry run
     * @throws InvalidPathException if the path is malformed or the name is not lowercase and dashes
     * @throws org.repogov.governance.exception.GroupNotFoundException if the group does not exist
     */
    public Optional<ProjectNode> createProject(String rawPath) throws IOException {
        ResolvedPath resolved = walker.getPathResolver().resolvePath(rawPath);
        PathResolver.validateProjectName(resolved.projectName());

        GroupNode group = walker.resolveGroup(GroupRef.of(resolved.groupPath()));
        log.info("Creating project '{}' in {}{}", resolved.projectName(), group.fullPath(), dryRun ? " - DRY RUN" : "");
        if (dryRun) {
            return Optional.empty();
        }
        VcsProject created = client.createProject(resolved.projectName(), group.id());
        return Optional.of(new ProjectNode(created, group));
    }
}
