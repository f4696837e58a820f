package org.repogov.vcsclient.gitlab;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.repogov.vcsclient.VcsClientException;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GitLabException")
class GitLabExceptionTest {

    @Test
    @DisplayName("should format message with API error details")
    void shouldFormatMessageWithApiErrorDetails() {
        GitLabException exception = new GitLabException("get group", 404, "Not Found");

        assertThat(exception.getMessage()).isEqualTo("GitLab get group failed: 404 - Not Found");
        assertThat(exception.getStatusCode()).isEqualTo(404);
        assertThat(exception.getResponseBody()).isEqualTo("Not Found");
    }

    @Test
    @DisplayName("should only treat 404 as not found")
    void shouldDistinguishNotFound() {
        assertThat(new GitLabException("get integration", 404, "").isNotFound()).isTrue();
        assertThat(new GitLabException("get integration", 403, "").isNotFound()).isFalse();
        assertThat(new GitLabException("API error").isNotFound()).isFalse();
    }

    @Test
    @DisplayName("should keep the cause without a status code")
    void shouldKeepCause() {
        Throwable cause = new RuntimeException("Root cause");
        GitLabException exception = new GitLabException("API error", cause);

        assertThat(exception.getCause()).isEqualTo(cause);
        assertThat(exception.getStatusCode()).isEqualTo(-1);
        assertThat(exception).isInstanceOf(VcsClientException.class);
    }
}
