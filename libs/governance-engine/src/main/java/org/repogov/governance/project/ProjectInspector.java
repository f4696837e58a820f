package org.repogov.governance.project;

import org.repogov.governance.hierarchy.ProjectNode;
import org.repogov.vcsclient.VcsClient;
import org.repogov.vcsclient.model.VcsProject;

import java.io.IOException;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

public class ProjectInspector {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private final VcsClient client;

    public ProjectInspector(VcsClient client) {
        this.client = client;
    }

    public ProjectDetails describe(ProjectNode node) throws IOException {
        VcsProject project = node.project();
        String creator = project.creatorId() != null ? client.getUser(project.creatorId()).displayName() : "";
        return new ProjectDetails(
                project.pathWithNamespace(),
                project.description() != null ? project.description() : "",
                creator != null ? creator : "",
                formatDate(project.lastActivityAt()),
                client.countBranches(project.id()),
                client.countCommits(project.id()),
                client.countOpenMergeRequests(project.id())
        );
    }

    static String formatDate(String timestamp) {
        if (timestamp == null || timestamp.isBlank()) {
            return "";
        }
        try {
            return OffsetDateTime.parse(timestamp).format(DATE);
        } catch (DateTimeParseException e) {
            // GitLab always sends an offset; fall back to the date prefix for anything else
            return timestamp.length() >= 10 ? timestamp.substring(0, 10) : timestamp;
        }
    }
}
