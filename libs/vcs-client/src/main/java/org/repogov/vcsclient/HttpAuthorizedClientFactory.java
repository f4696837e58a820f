package org.repogov.vcsclient;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.repogov.vcsclient.gitlab.GitLabConfig;

import java.util.concurrent.TimeUnit;

/**
 * Builds OkHttp clients that authenticate every request against GitLab.
 * Clients derive from a shared base client so they reuse its connection pool.
 */
public class HttpAuthorizedClientFactory {

    private final OkHttpClient baseClient;

    public HttpAuthorizedClientFactory() {
        this(new OkHttpClient());
    }

    public HttpAuthorizedClientFactory(OkHttpClient baseClient) {
        this.baseClient = baseClient;
    }

    /**
     * Create an OkHttpClient that sends a GitLab personal access token with each request.
     * 
     * @param privateToken the GitLab personal or project access token
     * @return configured OkHttpClient
     */
    public OkHttpClient createGitLabClient(String privateToken) {
        if (privateToken == null || privateToken.isBlank()) {
            throw new IllegalArgumentException("GitLab token cannot be null or empty");
        }
        
        return baseClient.newBuilder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(60, TimeUnit.SECONDS)
                .writeTimeout(60, TimeUnit.SECONDS)
                .addInterceptor(chain -> {
                    Request original = chain.request();
                    Request authorized = original.newBuilder()
                            .header(GitLabConfig.PRIVATE_TOKEN_HEADER, privateToken)
                            .header("Accept", "application/json")
                            .build();
                    return chain.proceed(authorized);
                })
                .build();
    }
}
