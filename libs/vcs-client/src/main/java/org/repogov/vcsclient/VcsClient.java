package org.repogov.vcsclient;

import org.repogov.vcsclient.model.*;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Client contract for the hosting-service resources the governance engine reads and converges.
 * <p>
 * Collections are fully materialized; pagination is handled by the implementation.
 * HTTP failures surface as {@link org.repogov.vcsclient.gitlab.GitLabException}, whose
 * {@code isNotFound()} distinguishes a missing resource from any other remote error.
 * Transport failures surface as {@link IOException}.
 */
public interface VcsClient {

    /**
     * Get a group by its full path, e.g. {@code Framestore/team-a}.
     */
    VcsGroup getGroup(String fullPath) throws IOException;

    /**
     * Get a group by its numeric ID.
     */
    VcsGroup getGroup(long groupId) throws IOException;

    /**
     * List the direct subgroups of a group.
     */
    List<VcsGroup> listSubgroups(long groupId) throws IOException;

    /**
     * List the direct projects of a group, excluding shared and archived projects.
     * Entries may be partial; use {@link #getProject(long)} for the full resource.
     */
    List<VcsProject> listGroupProjects(long groupId) throws IOException;

    /**
     * Get a project by its numeric ID.
     */
    VcsProject getProject(long projectId) throws IOException;

    /**
     * Create a project in a namespace.
     * @param name project name
     * @param namespaceId ID of the owning group
     * @return the created project
     */
    VcsProject createProject(String name, long namespaceId) throws IOException;

    /**
     * Partially update project attributes. Only the given attributes are sent.
     */
    void updateProject(long projectId, Map<String, Object> attributes) throws IOException;

    /**
     * List branch protection rules of a project.
     */
    List<VcsProtectedBranch> listProtectedBranches(long projectId) throws IOException;

    /**
     * Protect a branch with the given push and merge access levels.
     */
    void protectBranch(long projectId, String branch, AccessLevel pushAccess, AccessLevel mergeAccess) throws IOException;

    /**
     * Remove the protection rule of a branch.
     */
    void unprotectBranch(long projectId, String branch) throws IOException;

    /**
     * Get the merge request approval settings of a project.
     */
    VcsApprovalSettings getApprovalSettings(long projectId) throws IOException;

    /**
     * Partially update the merge request approval settings of a project.
     */
    void updateApprovalSettings(long projectId, Map<String, Object> attributes) throws IOException;

    /**
     * List the merge request approval rules of a project.
     */
    List<VcsApprovalRule> listApprovalRules(long projectId) throws IOException;

    /**
     * Create a regular approval rule naming eligible approvers.
     */
    VcsApprovalRule createApprovalRule(long projectId, String name, int approvalsRequired, List<Long> userIds) throws IOException;

    /**
     * Change the number of approvals an existing rule requires.
     */
    void updateApprovalRule(long projectId, long ruleId, int approvalsRequired) throws IOException;

    /**
     * Get a project integration by slug, e.g. "slack".
     * A project that never configured the integration yields a 404 {@code GitLabException}.
     */
    VcsIntegration getIntegration(long projectId, String slug) throws IOException;

    /**
     * Create or update a project integration.
     */
    void updateIntegration(long projectId, String slug, Map<String, Object> properties) throws IOException;

    /**
     * List the direct members of a group.
     */
    List<VcsMember> listGroupMembers(long groupId) throws IOException;

    /**
     * Search users by username, name or email.
     */
    List<VcsUser> searchUsers(String query) throws IOException;

    /**
     * Get a user by ID.
     */
    VcsUser getUser(long userId) throws IOException;

    /**
     * Count the branches of a project repository.
     */
    int countBranches(long projectId) throws IOException;

    /**
     * Count the commits on the default branch of a project repository.
     */
    int countCommits(long projectId) throws IOException;

    /**
     * Count the open merge requests of a project.
     */
    int countOpenMergeRequests(long projectId) throws IOException;
}
