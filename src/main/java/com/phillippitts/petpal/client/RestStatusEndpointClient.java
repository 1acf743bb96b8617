package com.phillippitts.petpal.client;

import com.phillippitts.petpal.domain.CommandSnapshot;
import com.phillippitts.petpal.service.broadcast.NotificationCodec;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.Objects;
import java.util.Optional;

/**
 * {@link StatusEndpointClient} over {@code GET /status/{requestId}}.
 *
 * <p>Decodes with the same {@link NotificationCodec} as the push channel so both backends yield
 * identical snapshots.
 */
public final class RestStatusEndpointClient implements StatusEndpointClient {

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final NotificationCodec codec;

    public RestStatusEndpointClient(RestTemplate restTemplate, String baseUrl, NotificationCodec codec) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
        this.baseUrl = stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl"));
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    public Optional<CommandSnapshot> fetch(String requestId) {
        try {
            ResponseEntity<String> response =
                    restTemplate.getForEntity(baseUrl + "/status/{id}", String.class, requestId);
            return Optional.of(codec.decodeSnapshot(response.getBody()));
        } catch (HttpClientErrorException.NotFound e) {
            return Optional.empty();
        }
    }

    static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
