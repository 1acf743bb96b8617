package com.phillippitts.petpal.client;

import com.phillippitts.petpal.domain.CommandSnapshot;
import com.phillippitts.petpal.domain.CommandState;
import com.phillippitts.petpal.service.broadcast.NotificationCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RestStatusEndpointClientTest {

    private MockRestServiceServer server;
    private RestStatusEndpointClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new RestStatusEndpointClient(restTemplate, "http://robot.local:8080/", new NotificationCodec());
    }

    @Test
    void shouldDecodeStatusBody() {
        // Arrange
        server.expect(requestTo("http://robot.local:8080/status/req-1"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"requestId\":\"req-1\",\"kind\":\"pick up the ball\","
                        + "\"state\":\"executing\",\"phase\":\"grasp\",\"confidence\":0.91,"
                        + "\"message\":\"grasping\",\"elapsedMs\":1200,\"completedPhases\":[\"detect\",\"approach\"]}",
                        MediaType.APPLICATION_JSON));

        // Act
        Optional<CommandSnapshot> snapshot = client.fetch("req-1");

        // Assert
        server.verify();
        assertThat(snapshot).hasValueSatisfying(s -> {
            assertThat(s.state()).isEqualTo(CommandState.EXECUTING);
            assertThat(s.phase()).isEqualTo("grasp");
            assertThat(s.confidence()).isEqualTo(0.91);
            assertThat(s.completedPhases()).containsExactly("detect", "approach");
        });
    }

    @Test
    void shouldReturnEmptyForUnknownRequest() {
        server.expect(requestTo("http://robot.local:8080/status/gone")).andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThat(client.fetch("gone")).isEmpty();
    }

    @Test
    void shouldPropagateServerErrors() {
        server.expect(requestTo("http://robot.local:8080/status/req-1"))
                .andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));

        assertThatThrownBy(() -> client.fetch("req-1")).isInstanceOf(HttpServerErrorException.class);
    }
}
