package org.repogov.vcsclient.gitlab;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.*;
import org.repogov.vcsclient.VcsClient;
import org.repogov.vcsclient.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * VcsClient implementation for GitLab (REST API v4).
 * Authentication is expected to be configured on the supplied OkHttpClient.
 */
public class GitLabClient implements VcsClient {

    private static final Logger log = LoggerFactory.getLogger(GitLabClient.class);

    private static final String API_BASE = GitLabConfig.API_BASE;
    private static final int DEFAULT_PAGE_SIZE = GitLabConfig.DEFAULT_PAGE_SIZE;
    private static final MediaType JSON_MEDIA_TYPE = MediaType.parse("application/json");
    private static final TypeReference<Map<String, Object>> ATTRIBUTE_MAP = new TypeReference<>() {};

    private static final String ACCEPT_HEADER = "Accept";
    private static final String GITLAB_ACCEPT_HEADER = "application/json";

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public GitLabClient(OkHttpClient httpClient) {
        this(httpClient, API_BASE);
    }

    public GitLabClient(OkHttpClient httpClient, String baseUrl) {
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
        this.baseUrl = stripTrailingSlash(baseUrl != null ? baseUrl : API_BASE);
    }

    @Override
    public VcsGroup getGroup(String fullPath) throws IOException {
        return parseGroup(getJson("/groups/" + encode(fullPath), "get group"));
    }

    @Override
    public VcsGroup getGroup(long groupId) throws IOException {
        return parseGroup(getJson("/groups/" + groupId, "get group"));
    }

    @Override
    public List<VcsGroup> listSubgroups(long groupId) throws IOException {
        List<VcsGroup> groups = new ArrayList<>();
        for (JsonNode node : getAllPages("/groups/" + groupId + "/subgroups", "", "list subgroups")) {
            groups.add(parseGroup(node));
        }
        return groups;
    }

    @Override
    public List<VcsProject> listGroupProjects(long groupId) throws IOException {
        List<VcsProject> projects = new ArrayList<>();
        String query = "with_shared=false&archived=false";
        for (JsonNode node : getAllPages("/groups/" + groupId + "/projects", query, "list group projects")) {
            projects.add(parseProject(node));
        }
        return projects;
    }

    @Override
    public VcsProject getProject(long projectId) throws IOException {
        return parseProject(getJson("/projects/" + projectId, "get project"));
    }

    @Override
    public VcsProject createProject(String name, long namespaceId) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        body.put("namespace_id", namespaceId);

        log.info("createProject: name={}, namespaceId={}", name, namespaceId);
        JsonNode node = send(createPostRequest(baseUrl + "/projects", toJson(body)), "create project");
        return parseProject(node);
    }

    @Override
    public void updateProject(long projectId, Map<String, Object> attributes) throws IOException {
        send(createPutRequest(baseUrl + "/projects/" + projectId, toJson(attributes)), "update project");
    }

    @Override
    public List<VcsProtectedBranch> listProtectedBranches(long projectId) throws IOException {
        List<VcsProtectedBranch> branches = new ArrayList<>();
        for (JsonNode node : getAllPages("/projects/" + projectId + "/protected_branches", "", "list protected branches")) {
            branches.add(parseProtectedBranch(node));
        }
        return branches;
    }

    @Override
    public void protectBranch(long projectId, String branch, AccessLevel pushAccess, AccessLevel mergeAccess) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", branch);
        body.put("push_access_level", pushAccess.getValue());
        body.put("merge_access_level", mergeAccess.getValue());

        String url = baseUrl + "/projects/" + projectId + "/protected_branches";
        send(createPostRequest(url, toJson(body)), "protect branch");
    }

    @Override
    public void unprotectBranch(long projectId, String branch) throws IOException {
        String url = baseUrl + "/projects/" + projectId + "/protected_branches/" + encode(branch);
        send(createDeleteRequest(url), "unprotect branch");
    }

    @Override
    public VcsApprovalSettings getApprovalSettings(long projectId) throws IOException {
        JsonNode node = getJson("/projects/" + projectId + "/approvals", "get approval settings");
        return new VcsApprovalSettings(objectMapper.convertValue(node, ATTRIBUTE_MAP));
    }

    @Override
    public void updateApprovalSettings(long projectId, Map<String, Object> attributes) throws IOException {
        String url = baseUrl + "/projects/" + projectId + "/approvals";
        send(createPostRequest(url, toJson(attributes)), "update approval settings");
    }

    @Override
    public List<VcsApprovalRule> listApprovalRules(long projectId) throws IOException {
        List<VcsApprovalRule> rules = new ArrayList<>();
        for (JsonNode node : getAllPages("/projects/" + projectId + "/approval_rules", "", "list approval rules")) {
            rules.add(parseApprovalRule(node));
        }
        return rules;
    }

    @Override
    public VcsApprovalRule createApprovalRule(long projectId, String name, int approvalsRequired, List<Long> userIds) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        body.put("approvals_required", approvalsRequired);
        body.put("rule_type", "regular");
        body.put("user_ids", userIds);

        String url = baseUrl + "/projects/" + projectId + "/approval_rules";
        return parseApprovalRule(send(createPostRequest(url, toJson(body)), "create approval rule"));
    }

    @Override
    public void updateApprovalRule(long projectId, long ruleId, int approvalsRequired) throws IOException {
        String url = baseUrl + "/projects/" + projectId + "/approval_rules/" + ruleId;
        send(createPutRequest(url, toJson(Map.of("approvals_required", approvalsRequired))), "update approval rule");
    }

    @Override
    public VcsIntegration getIntegration(long projectId, String slug) throws IOException {
        JsonNode node = getJson("/projects/" + projectId + "/integrations/" + encode(slug), "get integration");
        return parseIntegration(node, slug);
    }

    @Override
    public void updateIntegration(long projectId, String slug, Map<String, Object> properties) throws IOException {
        String url = baseUrl + "/projects/" + projectId + "/integrations/" + encode(slug);
        send(createPutRequest(url, toJson(properties)), "update integration");
    }

    @Override
    public List<VcsMember> listGroupMembers(long groupId) throws IOException {
        List<VcsMember> members = new ArrayList<>();
        for (JsonNode node : getAllPages("/groups/" + groupId + "/members", "", "list group members")) {
            members.add(new VcsMember(
                    node.get("id").asLong(),
                    getTextOrNull(node, "username"),
                    node.path("access_level").asInt()
            ));
        }
        return members;
    }

    @Override
    public List<VcsUser> searchUsers(String query) throws IOException {
        List<VcsUser> users = new ArrayList<>();
        String search = "search=" + encode(query);
        for (JsonNode node : getAllPages("/users", search, "search users")) {
            users.add(parseUser(node));
        }
        return users;
    }

    @Override
    public VcsUser getUser(long userId) throws IOException {
        return parseUser(getJson("/users/" + userId, "get user"));
    }

    @Override
    public int countBranches(long projectId) throws IOException {
        return countAll("/projects/" + projectId + "/repository/branches", "", "count branches");
    }

    @Override
    public int countCommits(long projectId) throws IOException {
        return countAll("/projects/" + projectId + "/repository/commits", "", "count commits");
    }

    @Override
    public int countOpenMergeRequests(long projectId) throws IOException {
        return countAll("/projects/" + projectId + "/merge_requests", "state=opened", "count open merge requests");
    }

    private JsonNode getJson(String path, String operation) throws IOException {
        return send(createGetRequest(baseUrl + path), operation);
    }

    private JsonNode send(Request request, String operation) throws IOException {
        log.debug("{}: {} {}", operation, request.method(), request.url());
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw createException(operation, response);
            }
            ResponseBody body = response.body();
            String content = body != null ? body.string() : "";
            return content.isBlank() ? objectMapper.nullNode() : objectMapper.readTree(content);
        }
    }

    private List<JsonNode> getAllPages(String path, String query, String operation) throws IOException {
        List<JsonNode> items = new ArrayList<>();
        int page = 1;

        while (true) {
            String url = pageUrl(path, query, DEFAULT_PAGE_SIZE, page);
            log.debug("{}: calling URL={}", operation, url);

            Request request = createGetRequest(url);
            try (Response response = httpClient.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    throw createException(operation, response);
                }

                JsonNode root = objectMapper.readTree(response.body().string());
                if (root == null || !root.isArray() || root.isEmpty()) {
                    break;
                }

                for (JsonNode node : root) {
                    items.add(node);
                }

                String nextPage = response.header("X-Next-Page");
                if (nextPage == null || nextPage.isBlank()) {
                    break;
                }
                page++;
            }
        }

        return items;
    }

    /**
     * Count a collection using the X-Total header, falling back to walking every page
     * when GitLab omits the header (it does for large or uncounted collections).
     */
    private int countAll(String path, String query, String operation) throws IOException {
        Request request = createGetRequest(pageUrl(path, query, 1, 1));
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw createException(operation, response);
            }
            String totalHeader = response.header("X-Total");
            if (totalHeader != null && !totalHeader.isBlank()) {
                return Integer.parseInt(totalHeader.trim());
            }
        }
        return getAllPages(path, query, operation).size();
    }

    private String pageUrl(String path, String query, int perPage, int page) {
        String prefix = query == null || query.isEmpty() ? "?" : "?" + query + "&";
        return baseUrl + path + prefix + "per_page=" + perPage + "&page=" + page;
    }

    private VcsGroup parseGroup(JsonNode node) {
        long id = node.get("id").asLong();
        String path = getTextOrNull(node, "path");
        String name = getTextOrNull(node, "name");
        if (name == null) {
            name = path;
        }
        String fullPath = getTextOrNull(node, "full_path");
        Long parentId = node.hasNonNull("parent_id") ? node.get("parent_id").asLong() : null;

        return new VcsGroup(id, name, path, fullPath != null ? fullPath : path, parentId);
    }

    private VcsProject parseProject(JsonNode node) {
        return new VcsProject(
                node.get("id").asLong(),
                getTextOrNull(node, "name"),
                getTextOrNull(node, "path"),
                getTextOrNull(node, "path_with_namespace"),
                getTextOrNull(node, "description"),
                node.hasNonNull("creator_id") ? node.get("creator_id").asLong() : null,
                getTextOrNull(node, "last_activity_at"),
                getTextOrNull(node, "ssh_url_to_repo"),
                getTextOrNull(node, "web_url"),
                objectMapper.convertValue(node, ATTRIBUTE_MAP)
        );
    }

    private VcsUser parseUser(JsonNode node) {
        long id = node.get("id").asLong();
        String username = getTextOrNull(node, "username");
        String name = getTextOrNull(node, "name");
        String email = getTextOrNull(node, "email");
        String publicEmail = getTextOrNull(node, "public_email");
        String webUrl = getTextOrNull(node, "web_url");

        return new VcsUser(id, username, name != null ? name : username, email, publicEmail, webUrl);
    }

    private VcsProtectedBranch parseProtectedBranch(JsonNode node) {
        return new VcsProtectedBranch(
                getTextOrNull(node, "name"),
                parseAccessGrants(node.get("push_access_levels")),
                parseAccessGrants(node.get("merge_access_levels"))
        );
    }

    private List<VcsAccessGrant> parseAccessGrants(JsonNode levels) {
        List<VcsAccessGrant> grants = new ArrayList<>();
        if (levels != null && levels.isArray()) {
            for (JsonNode level : levels) {
                grants.add(new VcsAccessGrant(
                        level.path("access_level").asInt(),
                        getTextOrNull(level, "access_level_description")
                ));
            }
        }
        return grants;
    }

    private VcsApprovalRule parseApprovalRule(JsonNode node) {
        return new VcsApprovalRule(
                node.get("id").asLong(),
                getTextOrNull(node, "name"),
                node.path("approvals_required").asInt(),
                getTextOrNull(node, "rule_type")
        );
    }

    private VcsIntegration parseIntegration(JsonNode node, String slug) {
        String actualSlug = getTextOrNull(node, "slug");
        boolean active = node.path("active").asBoolean(false);
        Map<String, Object> properties = node.hasNonNull("properties")
                ? objectMapper.convertValue(node.get("properties"), ATTRIBUTE_MAP)
                : Map.of();
        return new VcsIntegration(actualSlug != null ? actualSlug : slug, active, properties);
    }

    private String getTextOrNull(JsonNode node, String field) {
        return node.has(field) && !node.get(field).isNull() ? node.get(field).asText() : null;
    }

    private String toJson(Object body) throws IOException {
        return objectMapper.writeValueAsString(body);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private GitLabException createException(String operation, Response response) throws IOException {
        String body = response.body() != null ? response.body().string() : "";
        return new GitLabException(operation, response.code(), body);
    }

    private Request createPostRequest(String url, String jsonBody) {
        return new Request.Builder()
                .url(url)
                .header(ACCEPT_HEADER, GITLAB_ACCEPT_HEADER)
                .post(RequestBody.create(jsonBody, JSON_MEDIA_TYPE))
                .build();
    }

    private Request createPutRequest(String url, String jsonBody) {
        return new Request.Builder()
                .url(url)
                .header(ACCEPT_HEADER, GITLAB_ACCEPT_HEADER)
                .put(RequestBody.create(jsonBody, JSON_MEDIA_TYPE))
                .build();
    }

    private Request createDeleteRequest(String url) {
        return new Request.Builder()
                .url(url)
                .header(ACCEPT_HEADER, GITLAB_ACCEPT_HEADER)
                .delete()
                .build();
    }

    private Request createGetRequest(String url) {
        return new Request.Builder()
                .url(url)
                .header(ACCEPT_HEADER, GITLAB_ACCEPT_HEADER)
                .get()
                .build();
    }
}
