package com.vpnbot.api.vpn.upstream;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.vpnbot.api.vpn.exceptions.PanelAccountConflictException;
import com.vpnbot.api.vpn.exceptions.PanelAccountNotFoundException;
import com.vpnbot.api.vpn.exceptions.PanelRejectedException;
import com.vpnbot.api.vpn.exceptions.PanelUnavailableException;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * <p>
 * {@link VpnProvisioner} backed by the Marzban panel REST API. The panel's root url must be set on
 * the given {@link RestTemplate}.</p>
 *
 * <p>
 * Requests authenticate with an admin access token. The token is obtained on first use, renewed
 * before its 24 hour lifetime ends, and obtained again once if the panel rejects it earlier.</p>
 *
 * @see <a href="https://gozargah.github.io/marzban/en/docs/api">Marzban API</a>
 */
@Slf4j
public class MarzbanApi implements VpnProvisioner {

    static final String TOKEN_PATH = "/api/admin/token";
    static final String USERS_PATH = "/api/user";
    static final String USER_PATH = "/api/user/{username}";
    static final Duration TOKEN_LIFETIME = Duration.ofHours(23);

    private final RestTemplate restTemplate;
    private final String adminUsername;
    private final String adminPassword;
    private final Map<String, Object> proxies;
    private String accessToken;
    private Instant accessTokenExpiresAt;

    /**
     * @param restTemplate  a {@link RestTemplate} with the panel's root url and request timeouts.
     * @param adminUsername panel admin username.
     * @param adminPassword panel admin password.
     * @param protocols     proxy protocols enabled on new accounts, e.g. {@code vless}.
     */
    public MarzbanApi(
        @NonNull RestTemplate restTemplate,
        @NonNull String adminUsername,
        @NonNull String adminPassword,
        @NonNull List<String> protocols
    ) {
        this.restTemplate = restTemplate;
        this.adminUsername = adminUsername;
        this.adminPassword = adminPassword;
        this.proxies = new HashMap<>();
        protocols.forEach(p -> proxies.put(p, Map.of()));
    }

    @Override
    public void createAccount(@NonNull String username)
        throws PanelAccountConflictException, PanelUnavailableException, PanelRejectedException {
        val body = new HashMap<String, Object>();
        body.put("username", username);
        body.put("proxies", proxies);
        body.put("status", "active");
        body.put("data_limit", 0);
        body.put("data_limit_reset_strategy", "no_reset");
        try {
            call(HttpMethod.POST, USERS_PATH, body, PanelUser.class);
        } catch (PanelAccountNotFoundException e) {
            throw new PanelRejectedException("panel doesn't serve the user api at the configured url", e);
        }
    }

    @Override
    public void setEnabled(@NonNull String username, boolean enabled)
        throws PanelAccountNotFoundException, PanelUnavailableException, PanelRejectedException {
        try {
            call(HttpMethod.PUT, USER_PATH, Map.of("status", enabled ? "active" : "disabled"), PanelUser.class, username);
        } catch (PanelAccountConflictException e) {
            throw new PanelRejectedException("panel refused to change the account status", e);
        }
    }

    @Override
    public void deleteAccount(@NonNull String username) throws PanelUnavailableException, PanelRejectedException {
        try {
            call(HttpMethod.DELETE, USER_PATH, null, Void.class, username);
        } catch (PanelAccountNotFoundException e) {
            log.debug("panel account {} was already deleted", username);
        } catch (PanelAccountConflictException e) {
            throw new PanelRejectedException("panel refused to delete the account", e);
        }
    }

    @Override
    public boolean getStatus(@NonNull String username)
        throws PanelAccountNotFoundException, PanelUnavailableException, PanelRejectedException {
        final PanelUser user;
        try {
            user = call(HttpMethod.GET, USER_PATH, null, PanelUser.class, username);
        } catch (PanelAccountConflictException e) {
            throw new PanelRejectedException("unexpected conflict while reading an account", e);
        }

        if (user == null) {
            throw new PanelRejectedException("panel returned an empty account", null);
        }

        return "active".equalsIgnoreCase(user.getStatus());
    }

    private <T> T call(
        @NonNull HttpMethod method,
        @NonNull String path,
        Object body,
        @NonNull Class<T> responseType,
        Object... uriVariables
    ) throws PanelAccountNotFoundException, PanelAccountConflictException, PanelUnavailableException, PanelRejectedException {
        for (int attempt = 1; ; attempt++) {
            val headers = new HttpHeaders();
            headers.setBearerAuth(getAccessToken());
            headers.setContentType(MediaType.APPLICATION_JSON);
            try {
                return restTemplate.exchange(path, method, new HttpEntity<>(body, headers), responseType, uriVariables)
                    .getBody();
            } catch (HttpClientErrorException e) {
                if (e.getStatusCode() == HttpStatus.UNAUTHORIZED && attempt == 1) {
                    log.info("panel rejected the access token, signing in again");
                    invalidateAccessToken();
                    continue;
                }

                if (e.getStatusCode() == HttpStatus.NOT_FOUND) {
                    throw new PanelAccountNotFoundException(String.format("%s %s: account doesn't exist", method, path));
                }

                if (e.getStatusCode() == HttpStatus.CONFLICT) {
                    throw new PanelAccountConflictException(String.format("%s %s: account already exists", method, path));
                }

                if (e.getStatusCode() == HttpStatus.TOO_MANY_REQUESTS) {
                    throw new PanelUnavailableException(String.format("%s %s: rate limited", method, path), e);
                }

                throw new PanelRejectedException(String.format("%s %s: %s", method, path, e.getStatusCode()), e);
            } catch (HttpServerErrorException e) {
                throw new PanelUnavailableException(String.format("%s %s: %s", method, path, e.getStatusCode()), e);
            } catch (ResourceAccessException e) {
                throw new PanelUnavailableException(String.format("%s %s: panel is unreachable", method, path), e);
            } catch (RestClientException e) {
                // redirects, unknown status codes and unreadable bodies.
                throw new PanelUnavailableException(String.format("%s %s: unexpected panel response", method, path), e);
            }
        }
    }

    @NonNull
    private synchronized String getAccessToken() throws PanelUnavailableException, PanelRejectedException {
        if (accessToken != null && Instant.now().isBefore(accessTokenExpiresAt)) {
            return accessToken;
        }

        val form = new LinkedMultiValueMap<String, String>();
        form.add("grant_type", "password");
        form.add("username", adminUsername);
        form.add("password", adminPassword);

        val headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        final TokenResponse response;
        try {
            response = restTemplate.postForObject(TOKEN_PATH, new HttpEntity<>(form, headers), TokenResponse.class);
        } catch (HttpClientErrorException e) {
            throw new PanelRejectedException("panel rejected the admin credentials: " + e.getStatusCode(), e);
        } catch (HttpServerErrorException e) {
            throw new PanelUnavailableException("panel failed to issue an access token: " + e.getStatusCode(), e);
        } catch (ResourceAccessException e) {
            throw new PanelUnavailableException("panel is unreachable", e);
        } catch (RestClientException e) {
            throw new PanelUnavailableException("panel returned an unexpected token response", e);
        }

        if (response == null || response.getAccessToken() == null) {
            throw new PanelRejectedException("panel returned an empty access token", null);
        }

        accessToken = response.getAccessToken();
        accessTokenExpiresAt = Instant.now().plus(TOKEN_LIFETIME);
        return accessToken;
    }

    private synchronized void invalidateAccessToken() {
        accessToken = null;
        accessTokenExpiresAt = null;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class TokenResponse {

        @JsonProperty("access_token")
        private String accessToken;

        @JsonProperty("token_type")
        private String tokenType;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class PanelUser {

        private String username;

        private String status;
    }
}
